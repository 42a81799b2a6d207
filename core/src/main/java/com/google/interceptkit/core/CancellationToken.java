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
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CancellationToken carries a cancellation signal scoped to one call. Work
 * running on behalf of the call polls {@link #isCancelled()} or registers a
 * callback with {@link #onCancel(Runnable)}.
 *
 * <p>
 * A child token is cancelled together with its parent but can also be
 * cancelled on its own.
 */
public final class CancellationToken {

  private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

  /**
   * A token that is never cancelled.
   */
  public static final CancellationToken NONE = new CancellationToken(false);

  private final boolean cancellable;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * Creates a new token that can be cancelled.
   *
   * @return a new token
   */
  public static CancellationToken create() {
    return new CancellationToken(true);
  }

  /**
   * Creates a token that is cancelled whenever this token is cancelled.
   *
   * @return the child token
   */
  public CancellationToken newChild() {
    CancellationToken child = create();
    onCancel(child::cancel);
    return child;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Cancels this token and runs every registered callback exactly once.
   *
   * @throws UnsupportedOperationException
   *             if this is {@link #NONE}
   */
  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("This token cannot be cancelled");
    }
    if (cancelled.compareAndSet(false, true)) {
      for (Runnable callback : callbacks) {
        runCallback(callback);
      }
      callbacks.clear();
    }
  }

  /**
   * Registers a callback to run on cancellation. Runs it immediately if the
   * token is already cancelled.
   *
   * @param callback
   *            the callback
   * @return a registration that removes the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    if (!cancellable) {
      return () -> {
      };
    }
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      runCallback(callback);
    }
    return () -> callbacks.remove(callback);
  }

  /**
   * Throws if this token has been cancelled.
   *
   * @throws CancellationException
   *             if cancelled
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new CancellationException("Operation was cancelled");
    }
  }

  private static void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Handle returned by {@link #onCancel(Runnable)}.
   */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
