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

package com.google.interceptkit.core.chain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.InterceptorPhase;
import com.google.interceptkit.core.InvocationRequest;

/**
 * ChainRequest asks for several interceptors to run together against one
 * payload. The order of ids is advisory: the executor recomputes the order per
 * kind.
 */
public final class ChainRequest {

  private final List<String> interceptorIds;
  private final String event;
  private final InterceptorPhase phase;
  private final JsonNode payload;
  private final Object progressToken;

  private ChainRequest(Builder builder) {
    this.interceptorIds = List.copyOf(builder.interceptorIds);
    this.event = builder.event;
    this.phase = builder.phase;
    this.payload = builder.payload;
    this.progressToken = builder.progressToken;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> getInterceptorIds() {
    return interceptorIds;
  }

  public String getEvent() {
    return event;
  }

  public InterceptorPhase getPhase() {
    return phase;
  }

  public JsonNode getPayload() {
    return payload;
  }

  public Object getProgressToken() {
    return progressToken;
  }

  /**
   * Creates the single-interceptor request for one step of this chain.
   *
   * @param interceptorId
   *            the interceptor to address
   * @param stepPayload
   *            the payload for this step
   * @return the invocation request
   */
  InvocationRequest toInvocation(String interceptorId, JsonNode stepPayload) {
    return InvocationRequest.builder().interceptorId(interceptorId).event(event).phase(phase)
        .payload(stepPayload).progressToken(progressToken).build();
  }

  @Override
  public String toString() {
    return "ChainRequest{interceptorIds=" + interceptorIds + ", event='" + event + "', phase=" + phase + "}";
  }

  /**
   * Builder for ChainRequest.
   */
  public static class Builder {
    private final List<String> interceptorIds = new ArrayList<>();
    private String event;
    private InterceptorPhase phase;
    private JsonNode payload;
    private Object progressToken;

    public Builder interceptorIds(String... ids) {
      return interceptorIds(List.of(ids));
    }

    public Builder interceptorIds(Collection<String> ids) {
      this.interceptorIds.clear();
      this.interceptorIds.addAll(ids);
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

    public ChainRequest build() {
      if (event == null || event.isEmpty()) {
        throw new IllegalStateException("event is required");
      }
      if (phase == null) {
        throw new IllegalStateException("phase is required");
      }
      if (interceptorIds.contains(null)) {
        throw new IllegalStateException("interceptorIds must not contain null");
      }
      return new ChainRequest(this);
    }
  }
}
