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

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DefaultInterceptorRegistry is the default implementation of the
 * InterceptorRegistry interface.
 *
 * <p>
 * Interceptors are kept in an immutable sorted snapshot that is replaced on
 * every write. Writers serialize on a lock for the duration of the copy;
 * readers dereference the current snapshot without locking.
 */
public class DefaultInterceptorRegistry implements InterceptorRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DefaultInterceptorRegistry.class);

  private final Object writeLock = new Object();
  private final List<ListChangedListener> listeners = new CopyOnWriteArrayList<>();
  private volatile NavigableMap<String, Interceptor> interceptors = Collections.emptyNavigableMap();

  @Override
  public void register(Interceptor interceptor) {
    String id = interceptor.getId();
    synchronized (writeLock) {
      if (interceptors.containsKey(id)) {
        throw new DuplicateInterceptorIdException(id);
      }
      NavigableMap<String, Interceptor> next = new TreeMap<>(interceptors);
      next.put(id, interceptor);
      interceptors = Collections.unmodifiableNavigableMap(next);
    }
    logger.debug("Registered interceptor: {} ({}, priority {})", id, interceptor.getKind(),
        interceptor.getDesc().getPriority());
    fireListChanged();
  }

  @Override
  public boolean unregister(String id) {
    synchronized (writeLock) {
      if (!interceptors.containsKey(id)) {
        return false;
      }
      NavigableMap<String, Interceptor> next = new TreeMap<>(interceptors);
      next.remove(id);
      interceptors = Collections.unmodifiableNavigableMap(next);
    }
    logger.debug("Unregistered interceptor: {}", id);
    fireListChanged();
    return true;
  }

  @Override
  public Interceptor resolve(String id) {
    Interceptor interceptor = id == null ? null : interceptors.get(id);
    if (interceptor == null) {
      throw new UnknownInterceptorIdException(id);
    }
    return interceptor;
  }

  @Override
  public Optional<Interceptor> find(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(interceptors.get(id));
  }

  @Override
  public List<Interceptor> lookup(String event, InterceptorPhase phase) {
    List<Interceptor> result = new ArrayList<>();
    for (Interceptor interceptor : interceptors.values()) {
      if (interceptor.getDesc().appliesTo(event, phase)) {
        result.add(interceptor);
      }
    }
    result.sort(Comparator.comparing(Interceptor::getDesc, InterceptorDesc.EXECUTION_ORDER));
    return result;
  }

  @Override
  public InterceptorPage list(String cursor, int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("Page size must be positive: " + pageSize);
    }
    NavigableMap<String, Interceptor> snapshot = interceptors;
    Collection<Interceptor> remaining = cursor == null || cursor.isEmpty()
        ? snapshot.values()
        : snapshot.tailMap(decodeCursor(cursor), false).values();

    List<InterceptorDesc> page = new ArrayList<>();
    Iterator<Interceptor> it = remaining.iterator();
    while (it.hasNext() && page.size() < pageSize) {
      page.add(it.next().getDesc());
    }
    String nextCursor = it.hasNext() ? encodeCursor(page.get(page.size() - 1).getId()) : null;
    return new InterceptorPage(page, nextCursor);
  }

  @Override
  public List<InterceptorDesc> listInterceptors() {
    List<InterceptorDesc> descs = new ArrayList<>();
    for (Interceptor interceptor : interceptors.values()) {
      descs.add(interceptor.getDesc());
    }
    return descs;
  }

  @Override
  public int size() {
    return interceptors.size();
  }

  @Override
  public void addListChangedListener(ListChangedListener listener) {
    listeners.add(listener);
  }

  @Override
  public void removeListChangedListener(ListChangedListener listener) {
    listeners.remove(listener);
  }

  private void fireListChanged() {
    for (ListChangedListener listener : listeners) {
      try {
        listener.onListChanged();
      } catch (RuntimeException e) {
        logger.warn("List-changed listener failed", e);
      }
    }
  }

  static String encodeCursor(String lastId) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(lastId.getBytes(StandardCharsets.UTF_8));
  }

  static String decodeCursor(String cursor) {
    try {
      return new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
    }
  }
}
