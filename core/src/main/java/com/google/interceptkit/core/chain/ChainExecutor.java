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

import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.*;
import com.google.interceptkit.core.tracing.InterceptorTracer;
import com.google.interceptkit.core.tracing.SpanMetadata;

import io.opentelemetry.context.Context;

/**
 * ChainExecutor runs a set of interceptors against one payload, each kind under
 * its own concurrency contract, and aggregates the outcome.
 *
 * <p>
 * Execution proceeds as follows:
 * <ol>
 * <li>Every requested id is resolved first. An unknown id aborts the call
 * before anything runs.</li>
 * <li>Interceptors that do not apply to the requested phase are skipped.</li>
 * <li>Mutation interceptors run one after another in execution order, each
 * receiving the payload produced by the previous step. A failing step stops the
 * remaining steps.</li>
 * <li>Validation interceptors run concurrently against the original payload. A
 * failing validator contributes one synthesized error finding.</li>
 * <li>Observability interceptors are handed to the
 * {@link ObservabilityTaskTracker} and not awaited.</li>
 * </ol>
 * The groups are independent: a mutation failure is reported as a
 * {@link ChainExecutionException} only after the validation group has
 * finished.
 */
public class ChainExecutor {

  private static final Logger logger = LoggerFactory.getLogger(ChainExecutor.class);

  private static final Comparator<Interceptor> EXECUTION_ORDER = Comparator.comparing(Interceptor::getDesc,
      InterceptorDesc.EXECUTION_ORDER);

  private final InterceptorRegistry registry;
  private final InvocationEngine engine;
  private final ExecutorService executor;
  private final ObservabilityTaskTracker tracker;
  private final InterceptorTracer tracer;

  public ChainExecutor(InterceptorRegistry registry, InvocationEngine engine, ExecutorService executor,
      ObservabilityTaskTracker tracker, InterceptorTracer tracer) {
    this.registry = registry;
    this.engine = engine;
    this.executor = executor;
    this.tracker = tracker;
    this.tracer = tracer;
  }

  /**
   * Invokes a single interceptor directly, whatever its kind. Failures
   * propagate to the caller.
   *
   * @param request
   *            the invocation request
   * @param context
   *            the request context
   * @return the result, empty if the interceptor does not apply to the phase
   * @throws UnknownInterceptorIdException
   *             if the id is not registered
   */
  public InterceptorResult invoke(InvocationRequest request, RequestContext context) {
    Interceptor interceptor = registry.resolve(request.getInterceptorId());
    if (!interceptor.getDesc().appliesToPhase(request.getPhase())) {
      logger.debug("Interceptor {} does not apply to phase {}; skipping", interceptor.getId(), request.getPhase());
      return InterceptorResult.empty();
    }
    return engine.invoke(interceptor, request, context);
  }

  /**
   * Executes a chain.
   *
   * @param request
   *            the chain request
   * @param context
   *            the request context; its cancellation covers the mutation and
   *            validation groups
   * @return the aggregated result
   * @throws UnknownInterceptorIdException
   *             if any requested id is not registered
   * @throws ChainExecutionException
   *             if a mutation step failed
   * @throws CancellationException
   *             if the chain was cancelled
   */
  public ChainResult execute(ChainRequest request, RequestContext context) {
    SpanMetadata spanMetadata = SpanMetadata.builder().name("chain")
        .addAttribute(InterceptorTracer.ATTR_EVENT, request.getEvent())
        .addAttribute(InterceptorTracer.ATTR_PHASE, request.getPhase().getValue()).build();
    return tracer.inSpan(spanMetadata, () -> doExecute(request, context));
  }

  private ChainResult doExecute(ChainRequest request, RequestContext context) {
    CancellationToken cancellation = context.getCancellation();
    cancellation.throwIfCancelled();

    List<Interceptor> mutations = new ArrayList<>();
    List<Interceptor> validations = new ArrayList<>();
    List<Interceptor> observers = new ArrayList<>();
    for (Interceptor interceptor : resolveAll(request.getInterceptorIds())) {
      if (!interceptor.getDesc().appliesToPhase(request.getPhase())) {
        logger.debug("Interceptor {} does not apply to phase {}; skipping", interceptor.getId(),
            request.getPhase());
        continue;
      }
      switch (interceptor.getKind()) {
        case MUTATION :
          mutations.add(interceptor);
          break;
        case VALIDATION :
          validations.add(interceptor);
          break;
        case OBSERVABILITY :
        default :
          observers.add(interceptor);
          break;
      }
    }
    mutations.sort(EXECUTION_ORDER);
    validations.sort(EXECUTION_ORDER);
    observers.sort(EXECUTION_ORDER);
    logger.debug("Executing chain for {} {}: {} mutation, {} validation, {} observability", request.getEvent(),
        request.getPhase(), mutations.size(), validations.size(), observers.size());

    List<Future<?>> pending = new ArrayList<>();
    Future<MutationOutcome> mutationFuture = null;
    if (!mutations.isEmpty()) {
      Callable<MutationOutcome> task = () -> runMutations(mutations, request, context);
      mutationFuture = executor.submit(Context.current().wrap(task));
      pending.add(mutationFuture);
    }
    List<Future<InterceptorResult>> validationFutures = new ArrayList<>();
    for (Interceptor validator : validations) {
      InvocationRequest step = request.toInvocation(validator.getId(), request.getPayload());
      Callable<InterceptorResult> task = () -> engine.invoke(validator, step, context);
      Future<InterceptorResult> future = executor.submit(Context.current().wrap(task));
      validationFutures.add(future);
      pending.add(future);
    }
    for (Interceptor observer : observers) {
      tracker.launch(observer, request.toInvocation(observer.getId(), request.getPayload()), context);
    }

    try (CancellationToken.Registration registration = cancellation
        .onCancel(() -> pending.forEach(f -> f.cancel(true)))) {
      List<ValidationFinding> findings = new ArrayList<>();
      Map<String, Map<String, JsonNode>> validationMetadata = new LinkedHashMap<>();
      for (int i = 0; i < validations.size(); i++) {
        String id = validations.get(i).getId();
        try {
          InterceptorResult result = await(validationFutures.get(i), cancellation);
          findings.addAll(result.getFindings());
          putMetadata(validationMetadata, id, result.getMetadata());
        } catch (CancellationException e) {
          throw e;
        } catch (RuntimeException e) {
          logger.warn("Validation interceptor {} failed: {}", id, e.getMessage());
          findings.add(ValidationFinding.error(failureMessage(id, e)));
        } catch (Error e) {
          if (InvocationEngine.isFatal(e)) {
            throw e;
          }
          logger.warn("Validation interceptor {} raised {}", id, e.getClass().getName(), e);
          findings.add(ValidationFinding.error(failureMessage(id, e)));
        }
      }

      MutationOutcome mutation = mutationFuture == null
          ? MutationOutcome.completed(request.getPayload(), Collections.emptyMap())
          : await(mutationFuture, cancellation);

      Map<String, Map<String, JsonNode>> metadata = new LinkedHashMap<>(mutation.metadata);
      metadata.putAll(validationMetadata);
      ChainResult result = new ChainResult(mutation.payload, findings, metadata);
      if (mutation.failedId != null) {
        throw new ChainExecutionException(mutation.failedId, mutation.failure, result);
      }
      return result;
    } finally {
      pending.forEach(f -> f.cancel(true));
    }
  }

  private List<Interceptor> resolveAll(List<String> ids) {
    Map<String, Interceptor> resolved = new LinkedHashMap<>();
    for (String id : ids) {
      if (!resolved.containsKey(id)) {
        resolved.put(id, registry.resolve(id));
      }
    }
    return new ArrayList<>(resolved.values());
  }

  private MutationOutcome runMutations(List<Interceptor> mutations, ChainRequest request, RequestContext context) {
    JsonNode payload = request.getPayload();
    Map<String, Map<String, JsonNode>> metadata = new LinkedHashMap<>();
    for (Interceptor mutation : mutations) {
      context.getCancellation().throwIfCancelled();
      String id = mutation.getId();
      try {
        InterceptorResult result = engine.invoke(mutation, request.toInvocation(id, payload), context);
        if (result.hasModifiedPayload()) {
          payload = result.getModifiedPayload();
        }
        putMetadata(metadata, id, result.getMetadata());
      } catch (CancellationException e) {
        throw e;
      } catch (RuntimeException e) {
        logger.warn("Mutation interceptor {} failed; skipping remaining mutation steps", id, e);
        return MutationOutcome.failed(payload, metadata, id, e);
      } catch (Error e) {
        if (InvocationEngine.isFatal(e)) {
          throw e;
        }
        logger.warn("Mutation interceptor {} raised {}; skipping remaining mutation steps", id,
            e.getClass().getName(), e);
        return MutationOutcome.failed(payload, metadata, id, new HandlerFailureException(id, e));
      }
    }
    return MutationOutcome.completed(payload, metadata);
  }

  private static <T> T await(Future<T> future, CancellationToken cancellation) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancelled = new CancellationException("Chain execution was interrupted");
      cancelled.initCause(e);
      throw cancelled;
    } catch (CancellationException e) {
      throw new CancellationException("Chain execution was cancelled");
    } catch (ExecutionException e) {
      if (cancellation.isCancelled()) {
        throw new CancellationException("Chain execution was cancelled");
      }
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new InterceptorException("Unexpected chain failure", cause);
    }
  }

  private static void putMetadata(Map<String, Map<String, JsonNode>> target, String id,
      Map<String, JsonNode> values) {
    if (!values.isEmpty()) {
      target.put(id, values);
    }
  }

  static String failureMessage(String id, Throwable error) {
    if (error instanceof HandlerFailureException) {
      return error.getMessage();
    }
    return "Interceptor '" + id + "' failed: " + HandlerFailureException.describe(error);
  }

  private static final class MutationOutcome {
    final JsonNode payload;
    final Map<String, Map<String, JsonNode>> metadata;
    final String failedId;
    final RuntimeException failure;

    private MutationOutcome(JsonNode payload, Map<String, Map<String, JsonNode>> metadata, String failedId,
        RuntimeException failure) {
      this.payload = payload;
      this.metadata = metadata;
      this.failedId = failedId;
      this.failure = failure;
    }

    static MutationOutcome completed(JsonNode payload, Map<String, Map<String, JsonNode>> metadata) {
      return new MutationOutcome(payload, metadata, null, null);
    }

    static MutationOutcome failed(JsonNode payload, Map<String, Map<String, JsonNode>> metadata, String failedId,
        RuntimeException failure) {
      return new MutationOutcome(payload, metadata, failedId, failure);
    }
  }
}
