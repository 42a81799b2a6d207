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
import java.util.Optional;

/**
 * InterceptorRegistry holds the live set of interceptors and provides methods
 * to register, resolve, and look up interceptors.
 *
 * <p>
 * Implementations must support many concurrent readers alongside an occasional
 * writer: reads always observe a consistent snapshot and never block on a
 * registration in progress.
 */
public interface InterceptorRegistry {

  /**
   * Records the interceptor in the registry.
   *
   * @param interceptor
   *            the interceptor to register
   * @throws DuplicateInterceptorIdException
   *             if an interceptor with the same id is already registered
   */
  void register(Interceptor interceptor);

  /**
   * Removes an interceptor.
   *
   * @param id
   *            the interceptor id
   * @return true if an interceptor was removed
   */
  boolean unregister(String id);

  /**
   * Returns the interceptor with the given id.
   *
   * @param id
   *            the interceptor id
   * @return the interceptor
   * @throws UnknownInterceptorIdException
   *             if no interceptor has this id
   */
  Interceptor resolve(String id);

  /**
   * Returns the interceptor with the given id, if registered.
   *
   * @param id
   *            the interceptor id
   * @return the interceptor, or empty
   */
  Optional<Interceptor> find(String id);

  /**
   * Returns all interceptors applicable to an event and phase, in execution
   * order.
   *
   * @param event
   *            the protocol event name
   * @param phase
   *            the phase
   * @return the applicable interceptors
   */
  List<Interceptor> lookup(String event, InterceptorPhase phase);

  /**
   * Returns one page of descriptors ordered by id.
   *
   * @param cursor
   *            the cursor returned with the previous page, or null for the
   *            first page
   * @param pageSize
   *            the maximum number of descriptors to return
   * @return the page
   * @throws IllegalArgumentException
   *             if the cursor is malformed or the page size is not positive
   */
  InterceptorPage list(String cursor, int pageSize);

  /**
   * Returns all registered descriptors ordered by id.
   *
   * @return the descriptors
   */
  List<InterceptorDesc> listInterceptors();

  int size();

  void addListChangedListener(ListChangedListener listener);

  void removeListChangedListener(ListChangedListener listener);
}
