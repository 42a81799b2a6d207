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

package com.google.interceptkit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.interceptkit.core.*;
import com.google.interceptkit.core.binding.ParameterBinder;
import com.google.interceptkit.core.chain.ChainExecutor;
import com.google.interceptkit.core.chain.ChainRequest;
import com.google.interceptkit.core.chain.ChainResult;
import com.google.interceptkit.core.chain.ObservabilityTaskTracker;
import com.google.interceptkit.core.chain.ObservationStore;
import com.google.interceptkit.core.tracing.InterceptorTracer;
import com.google.interceptkit.protocol.InterceptorRequestHandler;
import com.google.interceptkit.protocol.NotificationSender;

/**
 * InterceptKit is the main entry point for serving interceptors.
 *
 * <p>
 * It owns the registry, the worker pool, the chain executor and the tracker
 * for detached observability tasks, and exposes the protocol request handler a
 * transport plugs into.
 *
 * <pre>{@code
 * InterceptKit kit = InterceptKit.builder().interceptors(new EmailInterceptors()).build();
 * ChainResult result = kit.executeChain(ChainRequest.builder()
 *     .interceptorIds("redact_emails", "validate_emails").event("tools/call")
 *     .phase(InterceptorPhase.RESPONSE).payload(payload).build());
 * kit.shutdown();
 * }</pre>
 */
public class InterceptKit implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(InterceptKit.class);

  private enum State {
    NEW, RUNNING, STOPPED
  }

  private final InterceptKitOptions options;
  private final InterceptorRegistry registry;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final ObservationStore observations;
  private final ObservabilityTaskTracker tracker;
  private final ChainExecutor chainExecutor;
  private final InterceptorRequestHandler requestHandler;
  private final ServerSession session;
  private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

  /**
   * Creates a new InterceptKit instance with default options.
   */
  public InterceptKit() {
    this(InterceptKitOptions.builder().build());
  }

  /**
   * Creates a new InterceptKit instance with the given options.
   *
   * @param options
   *            the options
   */
  public InterceptKit(InterceptKitOptions options) {
    this(options, NotificationSender.LOGGING);
  }

  /**
   * Creates a new InterceptKit instance.
   *
   * @param options
   *            the options
   * @param notifications
   *            the transport's notification channel
   */
  public InterceptKit(InterceptKitOptions options, NotificationSender notifications) {
    this.options = options;
    this.registry = new DefaultInterceptorRegistry();
    this.ownsExecutor = options.getExecutor() == null;
    this.executor = ownsExecutor
        ? Executors.newFixedThreadPool(options.getWorkerThreads(), new WorkerThreadFactory())
        : options.getExecutor();
    InterceptorTracer tracer = options.getOpenTelemetry() != null
        ? new InterceptorTracer(options.getOpenTelemetry())
        : InterceptorTracer.global();
    InvocationEngine engine = new InvocationEngine(new ParameterBinder(), tracer);
    this.observations = new ObservationStore(options.getMaxObservationFailures());
    this.tracker = new ObservabilityTaskTracker(executor, engine, observations);
    this.chainExecutor = new ChainExecutor(registry, engine, executor, tracker, tracer);
    this.session = new ServerSession(options.getServerName(), options.getServerVersion(), null);
    this.requestHandler = new InterceptorRequestHandler(registry, chainExecutor,
        notifications != null ? notifications : NotificationSender.LOGGING, session, options.getPageSize());
    registry.addListChangedListener(requestHandler::notifyListChanged);
  }

  /**
   * Creates a new InterceptKit builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the observability task tracker. Must be called before invoking
   * interceptors.
   */
  public void start() {
    if (!state.compareAndSet(State.NEW, State.RUNNING)) {
      throw new IllegalStateException("InterceptKit already started");
    }
    tracker.start();
    logger.info("InterceptKit {} {} started with {} interceptors", options.getServerName(),
        options.getServerVersion(), registry.size());
  }

  /**
   * Drains in-flight observability tasks within the grace period, cancels the
   * rest, and shuts down the internal worker pool. A caller-supplied executor
   * is left running.
   *
   * @return true if every observability task finished within the grace period
   */
  public boolean shutdown() {
    State previous = state.getAndSet(State.STOPPED);
    if (previous == State.STOPPED) {
      return true;
    }
    boolean drained = tracker.drain(options.getShutdownGracePeriod());
    if (ownsExecutor) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(options.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
    }
    logger.info("InterceptKit {} stopped", options.getServerName());
    return drained;
  }

  @Override
  public void close() {
    shutdown();
  }

  public boolean isRunning() {
    return state.get() == State.RUNNING;
  }

  /**
   * Registers an interceptor.
   *
   * @param interceptor
   *            the interceptor
   * @throws DuplicateInterceptorIdException
   *             if the id is already registered
   */
  public void register(Interceptor interceptor) {
    ensureNotStopped();
    registry.register(interceptor);
  }

  /**
   * Defines and registers an interceptor whose logic receives the invocation
   * context.
   *
   * @param desc
   *            the descriptor
   * @param handler
   *            the interceptor logic
   * @return the registered interceptor
   */
  public InterceptorDef defineInterceptor(InterceptorDesc desc, InterceptorDef.ContextHandler handler) {
    InterceptorDef interceptor = InterceptorDef.create(desc, handler);
    register(interceptor);
    return interceptor;
  }

  /**
   * Registers every {@link InterceptorMethod}-annotated method of an object.
   *
   * @param target
   *            the object
   * @return the registered interceptors
   */
  public List<Interceptor> registerMethods(Object target) {
    List<Interceptor> registered = new ArrayList<>();
    for (MethodInterceptor interceptor : MethodInterceptor.forAnnotatedMethods(target)) {
      register(interceptor);
      registered.add(interceptor);
    }
    return registered;
  }

  /**
   * Registers every {@link InterceptorMethod}-annotated method of a type, with
   * a new target created for each call.
   *
   * @param type
   *            the type
   * @param targetFactory
   *            creates the target for a call
   * @return the registered interceptors
   */
  public List<Interceptor> registerMethods(Class<?> type, Function<RequestContext, Object> targetFactory) {
    List<Interceptor> registered = new ArrayList<>();
    for (MethodInterceptor interceptor : MethodInterceptor.forAnnotatedMethods(type, targetFactory)) {
      register(interceptor);
      registered.add(interceptor);
    }
    return registered;
  }

  public boolean unregister(String id) {
    ensureNotStopped();
    return registry.unregister(id);
  }

  public InterceptorResult invoke(InvocationRequest request) {
    return invoke(request, defaultContext());
  }

  /**
   * Invokes a single interceptor.
   *
   * @param request
   *            the invocation request
   * @param context
   *            the request context
   * @return the result
   */
  public InterceptorResult invoke(InvocationRequest request, RequestContext context) {
    ensureRunning();
    return chainExecutor.invoke(request, context);
  }

  public ChainResult executeChain(ChainRequest request) {
    return executeChain(request, defaultContext());
  }

  /**
   * Executes a chain of interceptors.
   *
   * @param request
   *            the chain request
   * @param context
   *            the request context
   * @return the aggregated result
   */
  public ChainResult executeChain(ChainRequest request, RequestContext context) {
    ensureRunning();
    return chainExecutor.execute(request, context);
  }

  /**
   * Returns one page of interceptor descriptors.
   *
   * @param cursor
   *            the cursor from the previous page, or null
   * @return the page
   */
  public InterceptorPage listInterceptors(String cursor) {
    return registry.list(cursor, options.getPageSize());
  }

  /**
   * Handles one JSON-RPC request message.
   *
   * @param message
   *            the request message
   * @param context
   *            the request context, or null for the defaults
   * @return the response message
   */
  public ObjectNode handleRequest(JsonNode message, RequestContext context) {
    if (!isRunning()) {
      return notRunningResponse(message);
    }
    return requestHandler.handleRequest(message, context != null ? context : defaultContext());
  }

  private ObjectNode notRunningResponse(JsonNode message) {
    ObjectNode response = JsonUtils.getObjectMapper().createObjectNode();
    response.put("jsonrpc", "2.0");
    JsonNode id = message == null ? null : message.get("id");
    if (id == null) {
      response.putNull("id");
    } else {
      response.set("id", id);
    }
    response.set("error", InterceptorRequestHandler
        .toProtocolException(new IllegalStateException("InterceptKit is not running")).toErrorObject());
    return response;
  }

  /**
   * Returns a context carrying the configured services and this server's
   * session.
   *
   * @return a new request context
   */
  public RequestContext defaultContext() {
    return RequestContext.builder().session(session).services(options.getServices()).build();
  }

  public InterceptorRegistry getRegistry() {
    return registry;
  }

  public ObservationStore getObservations() {
    return observations;
  }

  public InterceptorRequestHandler getRequestHandler() {
    return requestHandler;
  }

  public InterceptKitOptions getOptions() {
    return options;
  }

  private void ensureRunning() {
    State current = state.get();
    if (current != State.RUNNING) {
      throw new IllegalStateException("InterceptKit is not running (state " + current + ")");
    }
  }

  private void ensureNotStopped() {
    if (state.get() == State.STOPPED) {
      throw new IllegalStateException("InterceptKit has been shut down");
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "interceptkit-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }

  /**
   * Builder for InterceptKit.
   */
  public static class Builder {
    private InterceptKitOptions options = InterceptKitOptions.builder().build();
    private NotificationSender notifications = NotificationSender.LOGGING;
    private final List<Interceptor> interceptors = new ArrayList<>();
    private final List<Object> methodTargets = new ArrayList<>();

    public Builder options(InterceptKitOptions options) {
      this.options = options;
      return this;
    }

    public Builder notificationSender(NotificationSender notifications) {
      this.notifications = notifications;
      return this;
    }

    public Builder interceptor(Interceptor interceptor) {
      this.interceptors.add(interceptor);
      return this;
    }

    /**
     * Adds every {@link InterceptorMethod}-annotated method of an object.
     *
     * @param target
     *            the object
     * @return this builder
     */
    public Builder interceptors(Object target) {
      this.methodTargets.add(target);
      return this;
    }

    /**
     * Builds and starts the InterceptKit instance.
     *
     * @return the running instance
     */
    public InterceptKit build() {
      InterceptKit kit = new InterceptKit(options, notifications);
      for (Interceptor interceptor : interceptors) {
        kit.register(interceptor);
      }
      for (Object target : methodTargets) {
        kit.registerMethods(target);
      }
      kit.start();
      return kit;
    }
  }
}
