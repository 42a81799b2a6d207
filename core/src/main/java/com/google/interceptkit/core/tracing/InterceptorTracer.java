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

package com.google.interceptkit.core.tracing;

import java.util.Map;
import java.util.function.Supplier;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * InterceptorTracer wraps interceptor invocations and chain executions in
 * OpenTelemetry spans. Without an installed SDK the spans are no-ops.
 */
public final class InterceptorTracer {

  static final String INSTRUMENTATION_NAME = "interceptkit-java";

  public static final String ATTR_ID = "interceptor:id";
  public static final String ATTR_KIND = "interceptor:kind";
  public static final String ATTR_EVENT = "interceptor:event";
  public static final String ATTR_PHASE = "interceptor:phase";
  public static final String ATTR_STATE = "interceptor:state";

  private static final InterceptorTracer NOOP = new InterceptorTracer(OpenTelemetry.noop());

  private final Tracer tracer;

  /**
   * Creates a tracer backed by the given OpenTelemetry instance.
   *
   * @param openTelemetry
   *            the OpenTelemetry instance
   */
  public InterceptorTracer(OpenTelemetry openTelemetry) {
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
  }

  /**
   * Returns a tracer backed by {@link GlobalOpenTelemetry}.
   *
   * @return the tracer
   */
  public static InterceptorTracer global() {
    return new InterceptorTracer(GlobalOpenTelemetry.get());
  }

  public static InterceptorTracer noop() {
    return NOOP;
  }

  /**
   * Runs a function within a new span. The span is marked as failed when the
   * function throws, and the exception is rethrown unchanged.
   *
   * @param metadata
   *            the span metadata
   * @param fn
   *            the function to run
   * @param <T>
   *            the result type
   * @return the function result
   */
  public <T> T inSpan(SpanMetadata metadata, Supplier<T> fn) {
    String spanName = metadata.getName() != null ? metadata.getName() : "unknown";
    Span span = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL).startSpan();

    for (Map.Entry<String, Object> entry : metadata.getAttributes().entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Long || value instanceof Integer) {
        span.setAttribute(entry.getKey(), ((Number) value).longValue());
      } else if (value instanceof Boolean) {
        span.setAttribute(entry.getKey(), (Boolean) value);
      } else {
        span.setAttribute(entry.getKey(), String.valueOf(value));
      }
    }

    try (Scope scope = span.makeCurrent()) {
      T result = fn.get();
      span.setAttribute(ATTR_STATE, "success");
      span.setStatus(StatusCode.OK);
      return result;
    } catch (RuntimeException | Error e) {
      span.setAttribute(ATTR_STATE, "error");
      span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
      span.recordException(e);
      throw e;
    } finally {
      span.end();
    }
  }
}
