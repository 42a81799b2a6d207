/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.google.interceptkit.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.InterceptorPhase;

/**
 * Parameters of {@code interceptor/invoke}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvokeInterceptorParams {

  @JsonProperty("interceptorId")
  private String interceptorId;

  /**
   * The protocol operation being intercepted, e.g. "tools/call".
   */
  @JsonProperty("event")
  private String event;

  @JsonProperty("phase")
  private InterceptorPhase phase;

  @JsonProperty("payload")
  private JsonNode payload;

  @JsonProperty("_meta")
  private RequestMeta meta;

  public InvokeInterceptorParams() {
  }

  public String getInterceptorId() {
    return interceptorId;
  }

  public void setInterceptorId(String interceptorId) {
    this.interceptorId = interceptorId;
  }

  public String getEvent() {
    return event;
  }

  public void setEvent(String event) {
    this.event = event;
  }

  public InterceptorPhase getPhase() {
    return phase;
  }

  public void setPhase(InterceptorPhase phase) {
    this.phase = phase;
  }

  public JsonNode getPayload() {
    return payload;
  }

  public void setPayload(JsonNode payload) {
    this.payload = payload;
  }

  public RequestMeta getMeta() {
    return meta;
  }

  public void setMeta(RequestMeta meta) {
    this.meta = meta;
  }
}
