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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.interceptkit.core.binding.InterceptorParameter;

/**
 * MethodInterceptor exposes a Java method as an {@link Interceptor}. The
 * method's parameters are described by reflection and bound by the
 * {@link com.google.interceptkit.core.binding.ParameterBinder}.
 *
 * <p>
 * A method may run on a fixed target, or on a target created for every call by
 * a factory; factory-made targets are disposed by the engine after the call.
 */
public class MethodInterceptor implements Interceptor {

  private static final Logger logger = LoggerFactory.getLogger(MethodInterceptor.class);

  private final InterceptorDesc desc;
  private final Method method;
  private final Object target;
  private final Function<RequestContext, Object> targetFactory;
  private final List<InterceptorParameter> parameters;

  private MethodInterceptor(InterceptorDesc desc, Method method, Object target,
      Function<RequestContext, Object> targetFactory) {
    this.desc = desc;
    this.method = method;
    this.target = target;
    this.targetFactory = targetFactory;
    List<InterceptorParameter> params = new ArrayList<>();
    for (Parameter parameter : method.getParameters()) {
      params.add(InterceptorParameter.fromReflection(parameter));
    }
    this.parameters = List.copyOf(params);
    method.trySetAccessible();
  }

  /**
   * Creates an interceptor for a static method, or an instance method on a fixed
   * target.
   *
   * @param method
   *            the method
   * @param target
   *            the instance for an instance method, null for a static method
   * @param desc
   *            the descriptor, or null to derive it from
   *            {@link InterceptorMethod}
   * @return the interceptor
   */
  public static MethodInterceptor create(Method method, Object target, InterceptorDesc desc) {
    if (method == null) {
      throw new IllegalArgumentException("Method is required");
    }
    if (!Modifier.isStatic(method.getModifiers()) && target == null) {
      throw new IllegalArgumentException("Instance method " + method.getName() + " requires a target");
    }
    return new MethodInterceptor(deriveDesc(method, desc), method, target, null);
  }

  /**
   * Creates an interceptor for an instance method whose target is created for
   * every call.
   *
   * @param method
   *            the instance method
   * @param targetFactory
   *            creates the target for a call
   * @param desc
   *            the descriptor, or null to derive it from
   *            {@link InterceptorMethod}
   * @return the interceptor
   */
  public static MethodInterceptor create(Method method, Function<RequestContext, Object> targetFactory,
      InterceptorDesc desc) {
    if (method == null) {
      throw new IllegalArgumentException("Method is required");
    }
    if (targetFactory == null) {
      throw new IllegalArgumentException("Target factory is required");
    }
    return new MethodInterceptor(deriveDesc(method, desc), method, null, targetFactory);
  }

  /**
   * Creates interceptors for every method of the target's class annotated with
   * {@link InterceptorMethod}, ordered by method name.
   *
   * @param target
   *            the object whose methods are exposed
   * @return the interceptors
   */
  public static List<MethodInterceptor> forAnnotatedMethods(Object target) {
    List<MethodInterceptor> result = new ArrayList<>();
    for (Method method : annotatedMethods(target.getClass())) {
      result.add(create(method, Modifier.isStatic(method.getModifiers()) ? null : target, null));
    }
    return result;
  }

  /**
   * Creates interceptors for every method of a type annotated with
   * {@link InterceptorMethod}. Instance methods run on a target made for each
   * call.
   *
   * @param type
   *            the type declaring the methods
   * @param targetFactory
   *            creates the target for a call
   * @return the interceptors
   */
  public static List<MethodInterceptor> forAnnotatedMethods(Class<?> type,
      Function<RequestContext, Object> targetFactory) {
    List<MethodInterceptor> result = new ArrayList<>();
    for (Method method : annotatedMethods(type)) {
      if (Modifier.isStatic(method.getModifiers())) {
        result.add(create(method, (Object) null, null));
      } else {
        result.add(create(method, targetFactory, null));
      }
    }
    return result;
  }

  private static List<Method> annotatedMethods(Class<?> type) {
    List<Method> methods = new ArrayList<>();
    for (Method method : type.getDeclaredMethods()) {
      if (method.isAnnotationPresent(InterceptorMethod.class)) {
        methods.add(method);
      }
    }
    methods.sort(Comparator.comparing(Method::getName));
    return methods;
  }

  static InterceptorDesc deriveDesc(Method method, InterceptorDesc desc) {
    if (desc != null) {
      return desc;
    }
    InterceptorMethod annotation = method.getAnnotation(InterceptorMethod.class);
    if (annotation == null) {
      throw new IllegalArgumentException("Interceptor type must be specified for method " + method.getName());
    }
    String id = annotation.id().isEmpty() ? deriveId(method.getName()) : annotation.id();
    return InterceptorDesc.builder().id(id).name(annotation.name()).description(
        annotation.description().isEmpty() ? null : annotation.description()).kind(annotation.kind())
        .priority(annotation.priority()).applicableEvents(annotation.events())
        .phases(Arrays.asList(annotation.phases())).build();
  }

  /**
   * Derives an interceptor id from a method name: {@code redactEmailsAsync}
   * becomes {@code redact_emails}.
   *
   * @param methodName
   *            the method name
   * @return the id
   */
  static String deriveId(String methodName) {
    String name = methodName;
    if (name.endsWith("Async") && name.length() > "Async".length()) {
      name = name.substring(0, name.length() - "Async".length());
    }
    return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
  }

  @Override
  public InterceptorDesc getDesc() {
    return desc;
  }

  @Override
  public List<InterceptorParameter> getParameters() {
    return parameters;
  }

  public Method getMethod() {
    return method;
  }

  @Override
  public Object newTarget(RequestContext context) {
    if (targetFactory == null) {
      return null;
    }
    Object created = targetFactory.apply(context);
    if (created == null) {
      throw new IllegalStateException("Target factory returned null for interceptor " + desc.getId());
    }
    return created;
  }

  @Override
  public Object call(Object perCallTarget, Object[] arguments) throws Exception {
    Object receiver = perCallTarget != null ? perCallTarget : target;
    try {
      return method.invoke(receiver, arguments);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      logger.debug("Interceptor method {} threw {}", method.getName(), cause);
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }

  @Override
  public String toString() {
    return desc.getId() + " -> " + method.getDeclaringClass().getSimpleName() + "." + method.getName();
  }
}
