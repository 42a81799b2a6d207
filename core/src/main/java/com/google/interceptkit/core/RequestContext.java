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

import com.google.interceptkit.core.progress.ProgressSink;

/**
 * RequestContext carries the ambient, per-request state an invocation runs
 * with: the server session, the service resolver, the cancellation signal and
 * the sink progress reports are relayed to.
 */
public class RequestContext {

  private final ServerSession session;
  private final ServiceResolver services;
  private final CancellationToken cancellation;
  private final ProgressSink progressSink;

  /**
   * Creates a new RequestContext.
   *
   * @param session
   *            the server session, may be null
   * @param services
   *            the service resolver, defaults to {@link ServiceResolver#EMPTY}
   * @param cancellation
   *            the cancellation signal, defaults to {@link CancellationToken#NONE}
   * @param progressSink
   *            the progress sink, may be null
   */
  public RequestContext(ServerSession session, ServiceResolver services, CancellationToken cancellation,
      ProgressSink progressSink) {
    this.session = session;
    this.services = services != null ? services : ServiceResolver.EMPTY;
    this.cancellation = cancellation != null ? cancellation : CancellationToken.NONE;
    this.progressSink = progressSink;
  }

  /**
   * Creates a RequestContext with only a service resolver.
   *
   * @param services
   *            the service resolver
   */
  public RequestContext(ServiceResolver services) {
    this(null, services, null, null);
  }

  /**
   * Returns a context with no services, no session and no cancellation.
   *
   * @return an empty context
   */
  public static RequestContext empty() {
    return new RequestContext(null, null, null, null);
  }

  public ServerSession getSession() {
    return session;
  }

  public ServiceResolver getServices() {
    return services;
  }

  public CancellationToken getCancellation() {
    return cancellation;
  }

  public ProgressSink getProgressSink() {
    return progressSink;
  }

  public RequestContext withCancellation(CancellationToken cancellation) {
    return new RequestContext(session, services, cancellation, progressSink);
  }

  public RequestContext withServices(ServiceResolver services) {
    return new RequestContext(session, services, cancellation, progressSink);
  }

  public RequestContext withSession(ServerSession session) {
    return new RequestContext(session, services, cancellation, progressSink);
  }

  public RequestContext withProgressSink(ProgressSink progressSink) {
    return new RequestContext(session, services, cancellation, progressSink);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for RequestContext.
   */
  public static class Builder {
    private ServerSession session;
    private ServiceResolver services;
    private CancellationToken cancellation;
    private ProgressSink progressSink;

    public Builder session(ServerSession session) {
      this.session = session;
      return this;
    }

    public Builder services(ServiceResolver services) {
      this.services = services;
      return this;
    }

    public Builder cancellation(CancellationToken cancellation) {
      this.cancellation = cancellation;
      return this;
    }

    public Builder progressSink(ProgressSink progressSink) {
      this.progressSink = progressSink;
      return this;
    }

    public RequestContext build() {
      return new RequestContext(session, services, cancellation, progressSink);
    }
  }
}
