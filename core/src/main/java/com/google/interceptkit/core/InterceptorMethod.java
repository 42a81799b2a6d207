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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the descriptor of a method exposed through
 * {@link MethodInterceptor}. Finding annotated methods across an application
 * is left to the host; {@link MethodInterceptor#forAnnotatedMethods(Object)}
 * only looks at one given type.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface InterceptorMethod {

  /**
   * The interceptor id. When empty, the method name is used, converted to
   * snake_case with any {@code Async} suffix removed.
   *
   * @return the id
   */
  String id() default "";

  /**
   * The display name. When empty, the id is used.
   *
   * @return the name
   */
  String name() default "";

  String description() default "";

  InterceptorKind kind();

  /**
   * Lower numbers run first; ties are broken by id.
   *
   * @return the priority
   */
  int priority() default 0;

  /**
   * Events the interceptor applies to, e.g. {@code tools/call}. Empty means all
   * events.
   *
   * @return the events
   */
  String[] events() default {};

  /**
   * Phases the interceptor applies to. Empty means both.
   *
   * @return the phases
   */
  InterceptorPhase[] phases() default {};
}
