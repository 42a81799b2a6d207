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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.binding.ParameterBinder;
import com.google.interceptkit.core.tracing.InterceptorTracer;
import com.google.interceptkit.core.tracing.SpanMetadata;

/**
 * InvocationEngine invokes exactly one interceptor: it binds the arguments,
 * creates and disposes any per-call target, runs the logic and normalizes the
 * returned value into an {@link InterceptorResult}.
 *
 * <p>
 * Return values are mapped as follows:
 * <ul>
 * <li>an {@link InterceptorResult} is taken as is</li>
 * <li>a {@link ValidationFinding}, or an array or collection of them, becomes
 * a findings result</li>
 * <li>a {@link JsonNode} becomes a modified payload</li>
 * <li>a {@link CompletionStage} is awaited and its value mapped</li>
 * <li>anything else becomes an empty result</li>
 * </ul>
 * A modified payload is only kept for {@link InterceptorKind#MUTATION}
 * interceptors.
 *
 * <p>
 * Failures are not recovered here: binding errors propagate unchanged and
 * errors raised by the logic propagate as {@link HandlerFailureException}.
 */
public class InvocationEngine {

  private static final Logger logger = LoggerFactory.getLogger(InvocationEngine.class);

  private final ParameterBinder binder;
  private final InterceptorTracer tracer;

  public InvocationEngine() {
    this(new ParameterBinder(), InterceptorTracer.noop());
  }

  public InvocationEngine(ParameterBinder binder, InterceptorTracer tracer) {
    this.binder = binder;
    this.tracer = tracer;
  }

  /**
   * Invokes an interceptor.
   *
   * @param interceptor
   *            the interceptor
   * @param request
   *            the request, addressed to this interceptor
   * @param context
   *            the ambient request context
   * @return the normalized result
   * @throws ParameterBindingException
   *             if an argument cannot be bound
   * @throws PayloadSerializationException
   *             if the payload does not match the expected shape
   * @throws HandlerFailureException
   *             if the interceptor logic fails
   * @throws CancellationException
   *             if the request was cancelled before or during the call
   */
  public InterceptorResult invoke(Interceptor interceptor, InvocationRequest request, RequestContext context) {
    InterceptorDesc desc = interceptor.getDesc();
    SpanMetadata spanMetadata = SpanMetadata.builder().name(desc.getId()).addAttribute(InterceptorTracer.ATTR_ID,
        desc.getId()).addAttribute(InterceptorTracer.ATTR_KIND, desc.getKind().getValue())
        .addAttribute(InterceptorTracer.ATTR_EVENT, request.getEvent())
        .addAttribute(InterceptorTracer.ATTR_PHASE, request.getPhase().getValue()).build();
    return tracer.inSpan(spanMetadata, () -> doInvoke(interceptor, request, context));
  }

  private InterceptorResult doInvoke(Interceptor interceptor, InvocationRequest request, RequestContext context) {
    String id = interceptor.getId();
    logger.debug("Invoking interceptor {} for {} {}", id, request.getEvent(), request.getPhase());
    context.getCancellation().throwIfCancelled();

    Object[] arguments = binder.bind(interceptor.getParameters(), request, context);

    Object target;
    try {
      target = interceptor.newTarget(context);
    } catch (RuntimeException e) {
      throw new HandlerFailureException(id, e);
    } catch (Error e) {
      throw wrapError(id, e);
    }

    Object raw;
    RuntimeException failure = null;
    try {
      raw = await(interceptor.call(target, arguments));
    } catch (InterceptorException | CancellationException e) {
      failure = e;
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancelled = new CancellationException("Interceptor '" + id + "' was interrupted");
      cancelled.initCause(e);
      failure = cancelled;
      throw cancelled;
    } catch (Exception e) {
      failure = new HandlerFailureException(id, e);
      throw failure;
    } catch (Error e) {
      failure = wrapError(id, e);
      throw failure;
    } finally {
      dispose(id, target, failure);
    }

    InterceptorResult result = normalize(interceptor.getDesc(), raw);
    logger.debug("Interceptor {} completed: {}", id, result);
    return result;
  }

  private static Object await(Object raw) throws Exception {
    if (!(raw instanceof CompletionStage)) {
      return raw;
    }
    try {
      return ((CompletionStage<?>) raw).toCompletableFuture().get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }

  /**
   * Returns true for errors the JVM cannot recover from. A stack overflow is
   * unwound by the time it reaches here, so it is treated as a handler failure.
   *
   * @param error
   *            the error
   * @return true if the error must propagate unchanged
   */
  public static boolean isFatal(Throwable error) {
    return error instanceof VirtualMachineError && !(error instanceof StackOverflowError);
  }

  private static HandlerFailureException wrapError(String id, Error error) {
    if (isFatal(error)) {
      throw error;
    }
    return new HandlerFailureException(id, error);
  }

  private static void dispose(String id, Object target, RuntimeException failure) {
    if (target == null) {
      return;
    }
    Exception disposeError = null;
    try {
      if (target instanceof AsyncDisposable) {
        ((AsyncDisposable) target).disposeAsync().toCompletableFuture().get();
      } else if (target instanceof AutoCloseable) {
        ((AutoCloseable) target).close();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      disposeError = e;
    } catch (ExecutionException e) {
      disposeError = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
    } catch (Exception e) {
      disposeError = e;
    }
    if (disposeError == null) {
      return;
    }
    if (failure != null) {
      failure.addSuppressed(disposeError);
      return;
    }
    throw new HandlerFailureException(id, disposeError);
  }

  /**
   * Maps a raw return value to a result and enforces that only mutation
   * interceptors produce a modified payload.
   *
   * @param desc
   *            the interceptor descriptor
   * @param raw
   *            the raw return value
   * @return the normalized result
   */
  static InterceptorResult normalize(InterceptorDesc desc, Object raw) {
    InterceptorResult result = toResult(raw);
    if (result.hasModifiedPayload() && desc.getKind() != InterceptorKind.MUTATION) {
      logger.warn("Interceptor {} of kind {} returned a modified payload; discarding it", desc.getId(),
          desc.getKind());
      return result.withoutPayload();
    }
    return result;
  }

  private static InterceptorResult toResult(Object raw) {
    if (raw == null) {
      return InterceptorResult.empty();
    }
    if (raw instanceof InterceptorResult) {
      return (InterceptorResult) raw;
    }
    if (raw instanceof ValidationFinding) {
      return InterceptorResult.findings(List.of((ValidationFinding) raw));
    }
    if (raw instanceof ValidationFinding[]) {
      return InterceptorResult.findings(List.of((ValidationFinding[]) raw));
    }
    if (raw instanceof Collection) {
      List<ValidationFinding> findings = new ArrayList<>();
      for (Object element : (Collection<?>) raw) {
        if (!(element instanceof ValidationFinding)) {
          return InterceptorResult.empty();
        }
        findings.add((ValidationFinding) element);
      }
      return InterceptorResult.findings(findings);
    }
    if (raw instanceof JsonNode) {
      return InterceptorResult.modifiedPayload((JsonNode) raw);
    }
    return InterceptorResult.empty();
  }
}
