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

import java.util.List;

import com.google.interceptkit.core.binding.InterceptorParameter;

/**
 * Interceptor is a registered unit of interceptor logic: a descriptor, the
 * parameters the logic expects and the logic itself.
 *
 * <p>
 * Implementations are invoked by the {@link InvocationEngine}, which binds the
 * arguments, creates and disposes any per-call target, and normalizes the
 * returned value into an {@link InterceptorResult}.
 */
public interface Interceptor {

  /**
   * Returns the descriptor of this interceptor.
   *
   * @return the descriptor
   */
  InterceptorDesc getDesc();

  /**
   * Returns the parameters this interceptor expects, in call order.
   *
   * @return the parameters
   */
  List<InterceptorParameter> getParameters();

  /**
   * Creates the object a single call runs on. The engine disposes it after the
   * call when it is {@link AutoCloseable} or {@link AsyncDisposable}.
   *
   * @param context
   *            the request context
   * @return a new target, or null when calls need no per-call target
   */
  default Object newTarget(RequestContext context) {
    return null;
  }

  /**
   * Runs the interceptor logic.
   *
   * @param target
   *            the per-call target from {@link #newTarget}, or null
   * @param arguments
   *            the bound arguments
   * @return the raw return value
   * @throws Exception
   *             if the logic fails
   */
  Object call(Object target, Object[] arguments) throws Exception;

  default String getId() {
    return getDesc().getId();
  }

  default InterceptorKind getKind() {
    return getDesc().getKind();
  }
}
