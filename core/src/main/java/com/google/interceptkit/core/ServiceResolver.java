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

import java.util.Optional;

/**
 * ServiceResolver supplies interceptor arguments that come from the hosting
 * application rather than from the payload. The engine only queries it; how
 * services are constructed and scoped is up to the implementation.
 */
public interface ServiceResolver {

  /**
   * A resolver that knows no services.
   */
  ServiceResolver EMPTY = new ServiceResolver() {
    @Override
    public boolean canResolve(Class<?> type) {
      return false;
    }

    @Override
    public Optional<Object> resolve(Class<?> type) {
      return Optional.empty();
    }
  };

  /**
   * Returns true if this resolver can supply a value for the given type. The
   * binder uses this to decide whether an unannotated argument is a service or a
   * payload field.
   *
   * @param type
   *            the argument type
   * @return true if a service of that type is available
   */
  boolean canResolve(Class<?> type);

  /**
   * Resolves a service by type.
   *
   * @param type
   *            the service type
   * @return the service, or empty if none is registered
   */
  Optional<Object> resolve(Class<?> type);

  /**
   * Resolves a service registered under an explicit key.
   *
   * @param type
   *            the service type
   * @param key
   *            the service key
   * @return the service, or empty if none is registered
   */
  default Optional<Object> resolveKeyed(Class<?> type, String key) {
    return Optional.empty();
  }
}
