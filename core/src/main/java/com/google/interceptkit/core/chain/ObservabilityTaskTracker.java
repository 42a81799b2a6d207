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

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.interceptkit.core.CancellationToken;
import com.google.interceptkit.core.Interceptor;
import com.google.interceptkit.core.InterceptorResult;
import com.google.interceptkit.core.InvocationEngine;
import com.google.interceptkit.core.InvocationRequest;
import com.google.interceptkit.core.RequestContext;

import io.opentelemetry.context.Context;

/**
 * ObservabilityTaskTracker owns every detached observability task.
 *
 * <p>
 * Tasks are launched without the caller waiting for them. They are detached
 * from the caller's cancellation and respond only to the tracker's shutdown
 * token. {@link #drain(Duration)} waits for in-flight tasks up to a grace
 * period and then cancels the rest, so no task outlives the tracker unnoticed.
 * Results go to the {@link ObservationStore}.
 */
public class ObservabilityTaskTracker {

  private static final Logger logger = LoggerFactory.getLogger(ObservabilityTaskTracker.class);

  /**
   * Lifecycle states of the tracker.
   */
  public enum State {
    NEW, RUNNING, DRAINING, STOPPED
  }

  private final ExecutorService executor;
  private final InvocationEngine engine;
  private final ObservationStore store;
  private final CancellationToken shutdownToken = CancellationToken.create();
  private final Set<TrackedTask> inFlight = ConcurrentHashMap.newKeySet();
  private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
  private final Object drainLock = new Object();

  public ObservabilityTaskTracker(ExecutorService executor, InvocationEngine engine, ObservationStore store) {
    this.executor = executor;
    this.engine = engine;
    this.store = store;
  }

  /**
   * Starts accepting tasks.
   *
   * @throws IllegalStateException
   *             if the tracker was already started
   */
  public void start() {
    if (!state.compareAndSet(State.NEW, State.RUNNING)) {
      throw new IllegalStateException("Observability task tracker already started (state " + state.get() + ")");
    }
    logger.debug("Observability task tracker started");
  }

  /**
   * Launches an observability interceptor without waiting for it.
   *
   * @param interceptor
   *            the observability interceptor
   * @param request
   *            the request addressed to it
   * @param context
   *            the caller's context; its cancellation is replaced by the
   *            shutdown token
   * @return true if the task was launched, false if it was rejected because
   *         the tracker is shutting down
   * @throws IllegalStateException
   *             if the tracker has not been started
   */
  public boolean launch(Interceptor interceptor, InvocationRequest request, RequestContext context) {
    String id = interceptor.getId();
    RequestContext detached = context.withCancellation(shutdownToken);
    Callable<Void> body = Context.current().wrap(() -> {
      runDetached(interceptor, request, detached);
      return null;
    });
    TrackedTask task = new TrackedTask(id, body);

    // drain() changes state under the same lock, so a task is either tracked
    // before draining starts or rejected.
    State current;
    synchronized (drainLock) {
      current = state.get();
      if (current == State.RUNNING) {
        inFlight.add(task);
      }
    }
    if (current == State.NEW) {
      throw new IllegalStateException("Observability task tracker has not been started");
    }
    if (current != State.RUNNING) {
      logger.warn("Rejected observability interceptor {}: tracker is {}", id, current);
      store.recordFailure(new ObservationFailure(id, "Rejected during shutdown", null, Instant.now()));
      return false;
    }

    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      inFlight.remove(task);
      if (!task.isCancelled()) {
        logger.warn("Executor rejected observability interceptor {}", id, e);
        store.recordFailure(id, e);
      }
      synchronized (drainLock) {
        drainLock.notifyAll();
      }
      return false;
    }
    return true;
  }

  private void runDetached(Interceptor interceptor, InvocationRequest request, RequestContext context) {
    String id = interceptor.getId();
    try {
      InterceptorResult result = engine.invoke(interceptor, request, context);
      store.recordMetadata(id, result.getMetadata());
    } catch (CancellationException e) {
      if (shutdownToken.isCancelled()) {
        logger.debug("Observability interceptor {} cancelled at shutdown", id);
      } else {
        logger.warn("Observability interceptor {} was cancelled", id);
        store.recordFailure(id, e);
      }
    } catch (RuntimeException e) {
      logger.warn("Observability interceptor {} failed: {}", id, e.getMessage(), e);
      store.recordFailure(id, e);
    } catch (Error e) {
      logger.error("Observability interceptor {} raised {}", id, e.getClass().getName(), e);
      store.recordFailure(id, e);
      if (InvocationEngine.isFatal(e)) {
        throw e;
      }
    }
  }

  /**
   * Stops accepting tasks and waits for in-flight tasks. Tasks still running
   * when the grace period ends are cancelled and recorded as failures.
   *
   * @param grace
   *            how long to wait for in-flight tasks
   * @return true if every task finished within the grace period
   */
  public boolean drain(Duration grace) {
    long deadline = System.nanoTime() + grace.toNanos();
    synchronized (drainLock) {
      State previous = state.get();
      if (previous != State.RUNNING) {
        state.compareAndSet(State.NEW, State.STOPPED);
        return inFlight.isEmpty();
      }
      state.set(State.DRAINING);
      logger.info("Draining {} in-flight observability tasks", inFlight.size());
      while (!inFlight.isEmpty()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          break;
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(drainLock, remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }

    boolean drained = inFlight.isEmpty();
    if (!drained) {
      logger.warn("{} observability tasks still running after {} ms; cancelling", inFlight.size(),
          grace.toMillis());
      shutdownToken.cancel();
      for (TrackedTask task : inFlight) {
        store.recordFailure(new ObservationFailure(task.interceptorId, "Cancelled at shutdown", null,
            Instant.now()));
        task.cancel(true);
      }
    }
    state.set(State.STOPPED);
    logger.info("Observability task tracker stopped");
    return drained;
  }

  public State getState() {
    return state.get();
  }

  public int getInFlightCount() {
    return inFlight.size();
  }

  /**
   * Returns the token detached tasks observe. It is cancelled only when a drain
   * times out.
   *
   * @return the shutdown token
   */
  public CancellationToken getShutdownToken() {
    return shutdownToken;
  }

  private final class TrackedTask extends FutureTask<Void> {
    private final String interceptorId;

    TrackedTask(String interceptorId, Callable<Void> body) {
      super(body);
      this.interceptorId = interceptorId;
    }

    @Override
    protected void done() {
      inFlight.remove(this);
      synchronized (drainLock) {
        drainLock.notifyAll();
      }
    }
  }
}
