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

import java.util.Collections;
import java.util.List;

import com.google.interceptkit.core.binding.InterceptorParameter;

/**
 * InterceptorDef is an {@link Interceptor} defined from a descriptor and a
 * function.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * InterceptorDef redactor = InterceptorDef.builder()
 *     .desc(InterceptorDesc.builder().id("redactor").kind(InterceptorKind.MUTATION).priority(10).build())
 *     .handler(ctx -> InterceptorResult.modifiedPayload(redact(ctx.getPayload())))
 *     .build();
 * }
 * </pre>
 */
public class InterceptorDef implements Interceptor {

  /**
   * Interceptor logic that receives the whole {@link InvocationContext}.
   */
  @FunctionalInterface
  public interface ContextHandler {
    Object handle(InvocationContext context) throws Exception;
  }

  /**
   * Interceptor logic that receives arguments bound from an explicit parameter
   * list.
   */
  @FunctionalInterface
  public interface ArgumentsHandler {
    Object handle(Object[] arguments) throws Exception;
  }

  private static final List<InterceptorParameter> CONTEXT_PARAMETERS = List
      .of(InterceptorParameter.of("context", InvocationContext.class));

  private final InterceptorDesc desc;
  private final List<InterceptorParameter> parameters;
  private final ArgumentsHandler handler;

  public InterceptorDef(InterceptorDesc desc, List<InterceptorParameter> parameters, ArgumentsHandler handler) {
    if (desc == null) {
      throw new IllegalArgumentException("Interceptor descriptor is required");
    }
    if (handler == null) {
      throw new IllegalArgumentException("Interceptor handler is required: " + desc.getId());
    }
    this.desc = desc;
    this.parameters = parameters != null ? List.copyOf(parameters) : Collections.emptyList();
    this.handler = handler;
  }

  /**
   * Creates an interceptor whose logic receives the invocation context.
   *
   * @param desc
   *            the descriptor
   * @param handler
   *            the logic
   * @return the interceptor
   */
  public static InterceptorDef create(InterceptorDesc desc, ContextHandler handler) {
    if (handler == null) {
      throw new IllegalArgumentException("Interceptor handler is required: " + (desc != null ? desc.getId() : null));
    }
    return new InterceptorDef(desc, CONTEXT_PARAMETERS, args -> handler.handle((InvocationContext) args[0]));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public InterceptorDesc getDesc() {
    return desc;
  }

  @Override
  public List<InterceptorParameter> getParameters() {
    return parameters;
  }

  @Override
  public Object call(Object target, Object[] arguments) throws Exception {
    return handler.handle(arguments);
  }

  @Override
  public String toString() {
    return desc.getId();
  }

  /**
   * Builder for InterceptorDef.
   */
  public static class Builder {
    private InterceptorDesc desc;
    private List<InterceptorParameter> parameters;
    private ArgumentsHandler handler;

    public Builder desc(InterceptorDesc desc) {
      this.desc = desc;
      return this;
    }

    public Builder handler(ContextHandler handler) {
      this.parameters = CONTEXT_PARAMETERS;
      this.handler = handler != null ? args -> handler.handle((InvocationContext) args[0]) : null;
      return this;
    }

    public Builder handler(List<InterceptorParameter> parameters, ArgumentsHandler handler) {
      this.parameters = parameters;
      this.handler = handler;
      return this;
    }

    public InterceptorDef build() {
      return new InterceptorDef(desc, parameters, handler);
    }
  }
}
