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

package com.google.interceptkit.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * InvocationRequest targets a single interceptor with an event, a phase and an
 * optional payload.
 */
public final class InvocationRequest {

  private final String interceptorId;
  private final String event;
  private final InterceptorPhase phase;
  private final JsonNode payload;
  private final Object progressToken;

  private InvocationRequest(Builder builder) {
    this.interceptorId = builder.interceptorId;
    this.event = builder.event;
    this.phase = builder.phase;
    this.payload = builder.payload;
    this.progressToken = builder.progressToken;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getInterceptorId() {
    return interceptorId;
  }

  /**
   * Returns the protocol operation name, e.g. {@code tools/call}.
   *
   * @return the event name
   */
  public String getEvent() {
    return event;
  }

  public InterceptorPhase getPhase() {
    return phase;
  }

  /**
   * Returns the payload. Callers must treat it as read-only.
   *
   * @return the payload, or null if none was sent
   */
  public JsonNode getPayload() {
    return payload;
  }

  /**
   * Returns the token used to relay progress back to the caller.
   *
   * @return the progress token, or null if the caller did not ask for progress
   */
  public Object getProgressToken() {
    return progressToken;
  }

  /**
   * Returns a copy of this request aimed at another interceptor with another
   * payload.
   *
   * @param interceptorId
   *            the target interceptor id
   * @param payload
   *            the payload
   * @return a new request
   */
  public InvocationRequest retarget(String interceptorId, JsonNode payload) {
    return builder().interceptorId(interceptorId).event(event).phase(phase).payload(payload)
        .progressToken(progressToken).build();
  }

  @Override
  public String toString() {
    return "InvocationRequest{interceptorId=" + interceptorId + ", event=" + event + ", phase=" + phase + "}";
  }

  /**
   * Builder for InvocationRequest.
   */
  public static class Builder {
    private String interceptorId;
    private String event;
    private InterceptorPhase phase;
    private JsonNode payload;
    private Object progressToken;

    public Builder interceptorId(String interceptorId) {
      this.interceptorId = interceptorId;
      return this;
    }

    public Builder event(String event) {
      this.event = event;
      return this;
    }

    public Builder phase(InterceptorPhase phase) {
      this.phase = phase;
      return this;
    }

    public Builder payload(JsonNode payload) {
      this.payload = payload;
      return this;
    }

    public Builder progressToken(Object progressToken) {
      this.progressToken = progressToken;
      return this;
    }

    public InvocationRequest build() {
      if (interceptorId == null || interceptorId.isEmpty()) {
        throw new IllegalStateException("interceptorId is required");
      }
      if (event == null || event.isEmpty()) {
        throw new IllegalStateException("event is required");
      }
      if (phase == null) {
        throw new IllegalStateException("phase is required");
      }
      return new InvocationRequest(this);
    }
  }
}
