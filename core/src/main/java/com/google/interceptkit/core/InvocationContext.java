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
import com.google.interceptkit.core.progress.ProgressEmitter;

/**
 * InvocationContext is the view of one invocation handed to context-style
 * handlers: the request, a private copy of its payload, the progress emitter
 * bound to the request's token, and the ambient {@link RequestContext}.
 */
public final class InvocationContext {

  private final InvocationRequest request;
  private final JsonNode payload;
  private final RequestContext requestContext;
  private final ProgressEmitter progress;

  public InvocationContext(InvocationRequest request, JsonNode payload, RequestContext requestContext,
      ProgressEmitter progress) {
    this.request = request;
    this.payload = payload;
    this.requestContext = requestContext;
    this.progress = progress;
  }

  public InvocationRequest getRequest() {
    return request;
  }

  public String getInterceptorId() {
    return request.getInterceptorId();
  }

  public String getEvent() {
    return request.getEvent();
  }

  public InterceptorPhase getPhase() {
    return request.getPhase();
  }

  /**
   * Returns this invocation's copy of the payload. Changing it has no effect on
   * other interceptors; mutators must return their output.
   *
   * @return the payload copy, or null if the request had no payload
   */
  public JsonNode getPayload() {
    return payload;
  }

  public RequestContext getRequestContext() {
    return requestContext;
  }

  public ProgressEmitter getProgress() {
    return progress;
  }

  public CancellationToken getCancellation() {
    return requestContext.getCancellation();
  }

  public ServiceResolver getServices() {
    return requestContext.getServices();
  }

  public ServerSession getSession() {
    return requestContext.getSession();
  }
}
