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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * MapServiceResolver is a {@link ServiceResolver} backed by fixed instances,
 * useful for small hosts and tests. Lookup by type matches the registered type
 * first and falls back to any instance assignable to the requested type.
 */
public class MapServiceResolver implements ServiceResolver {

  private final Map<Class<?>, Object> services;
  private final Map<String, Object> keyedServices;

  private MapServiceResolver(Builder builder) {
    this.services = Collections.unmodifiableMap(new LinkedHashMap<>(builder.services));
    this.keyedServices = Collections.unmodifiableMap(new LinkedHashMap<>(builder.keyedServices));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean canResolve(Class<?> type) {
    return find(type) != null;
  }

  @Override
  public Optional<Object> resolve(Class<?> type) {
    return Optional.ofNullable(find(type));
  }

  @Override
  public Optional<Object> resolveKeyed(Class<?> type, String key) {
    Object service = keyedServices.get(keyOf(type, key));
    return Optional.ofNullable(service);
  }

  private Object find(Class<?> type) {
    Object service = services.get(type);
    if (service != null) {
      return service;
    }
    for (Map.Entry<Class<?>, Object> entry : services.entrySet()) {
      if (type.isAssignableFrom(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static String keyOf(Class<?> type, String key) {
    return type.getName() + "#" + key;
  }

  /**
   * Builder for MapServiceResolver.
   */
  public static class Builder {
    private final Map<Class<?>, Object> services = new LinkedHashMap<>();
    private final Map<String, Object> keyedServices = new LinkedHashMap<>();

    public <T> Builder register(Class<T> type, T instance) {
      services.put(type, instance);
      return this;
    }

    public <T> Builder registerKeyed(Class<T> type, String key, T instance) {
      keyedServices.put(keyOf(type, key), instance);
      return this;
    }

    public MapServiceResolver build() {
      return new MapServiceResolver(this);
    }
  }
}
