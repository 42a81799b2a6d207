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

package com.google.interceptkit.core.binding;

import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.JsonUtils;

/**
 * InterceptorParameter describes one argument an interceptor expects: its
 * name, its declared type, where its value comes from and what happens when no
 * value is found.
 */
public final class InterceptorParameter {

  private final String name;
  private final Type type;
  private final ParameterSource source;
  private final String serviceKey;
  private final boolean required;
  private final JsonNode defaultValue;

  private InterceptorParameter(Builder builder) {
    this.name = builder.name;
    this.type = builder.type;
    this.source = builder.source;
    this.serviceKey = builder.serviceKey;
    this.defaultValue = builder.defaultValue;
    this.required = builder.required && builder.defaultValue == null && rawClass(builder.type) != Optional.class;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a parameter whose value comes from the payload field of the same
   * name, or from a service if the resolver knows the type.
   *
   * @param name
   *            the parameter name
   * @param type
   *            the declared type
   * @return the parameter
   */
  public static InterceptorParameter of(String name, Type type) {
    return builder().name(name).type(type).build();
  }

  /**
   * Describes a reflected method parameter, honoring {@link FromServices},
   * {@link FromKeyedServices}, {@link PayloadProperty}, {@link Payload} and
   * {@link DefaultValue}.
   *
   * @param parameter
   *            the reflected parameter
   * @return the parameter description
   */
  public static InterceptorParameter fromReflection(Parameter parameter) {
    Builder builder = builder().name(parameter.getName()).type(parameter.getParameterizedType());

    PayloadProperty property = parameter.getAnnotation(PayloadProperty.class);
    FromKeyedServices keyed = parameter.getAnnotation(FromKeyedServices.class);
    if (parameter.isAnnotationPresent(Payload.class)) {
      builder.source(ParameterSource.WHOLE_PAYLOAD).required(false);
    } else if (parameter.isAnnotationPresent(FromServices.class)) {
      builder.source(ParameterSource.SERVICES);
    } else if (keyed != null) {
      builder.source(ParameterSource.KEYED_SERVICES).serviceKey(keyed.value());
    } else if (property != null) {
      builder.source(ParameterSource.PAYLOAD).name(property.value());
    }

    DefaultValue defaultValue = parameter.getAnnotation(DefaultValue.class);
    if (defaultValue != null) {
      builder.defaultValue(JsonUtils.parseJson(defaultValue.value()));
    }
    return builder.build();
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  /**
   * Returns the erased class of the declared type.
   *
   * @return the raw class
   */
  public Class<?> getRawType() {
    return rawClass(type);
  }

  /**
   * Returns the type of the value to bind: the element type for an
   * {@code Optional<T>} parameter, the declared type otherwise.
   *
   * @return the value type
   */
  public Type getValueType() {
    if (isOptional() && type instanceof ParameterizedType) {
      return ((ParameterizedType) type).getActualTypeArguments()[0];
    }
    return isOptional() ? Object.class : type;
  }

  public Class<?> getValueClass() {
    return rawClass(getValueType());
  }

  public boolean isOptional() {
    return getRawType() == Optional.class;
  }

  public ParameterSource getSource() {
    return source;
  }

  /**
   * Returns the key for {@link ParameterSource#KEYED_SERVICES}, falling back
   * to the parameter name.
   *
   * @return the service key
   */
  public String getServiceKey() {
    return serviceKey != null && !serviceKey.isEmpty() ? serviceKey : name;
  }

  public boolean isRequired() {
    return required;
  }

  public JsonNode getDefaultValue() {
    return defaultValue;
  }

  static Class<?> rawClass(Type type) {
    if (type instanceof Class) {
      return (Class<?>) type;
    }
    if (type instanceof ParameterizedType) {
      return (Class<?>) ((ParameterizedType) type).getRawType();
    }
    return Object.class;
  }

  @Override
  public String toString() {
    return name + ":" + type.getTypeName() + "(" + source + (required ? ", required" : "") + ")";
  }

  /**
   * Builder for InterceptorParameter.
   */
  public static class Builder {
    private String name;
    private Type type = Object.class;
    private ParameterSource source = ParameterSource.AUTO;
    private String serviceKey;
    private boolean required = true;
    private JsonNode defaultValue;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder source(ParameterSource source) {
      this.source = source;
      return this;
    }

    public Builder serviceKey(String serviceKey) {
      this.serviceKey = serviceKey;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder defaultValue(JsonNode defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public InterceptorParameter build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalStateException("name is required");
      }
      if (type == null) {
        throw new IllegalStateException("type is required");
      }
      return new InterceptorParameter(this);
    }
  }
}
