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

package com.google.interceptkit.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ProgressEmitter is handed to interceptors that want to report progress while
 * they run. Reports are forwarded to the caller when the request carried a
 * progress token and dropped otherwise.
 */
public interface ProgressEmitter {

  /**
   * An emitter that drops every report.
   */
  ProgressEmitter NOOP = (progress, total, message) -> {
  };

  /**
   * Reports progress.
   *
   * @param progress
   *            the progress so far
   * @param total
   *            the total, or null if unknown
   * @param message
   *            an optional message
   */
  void report(double progress, Double total, String message);

  default void report(double progress) {
    report(progress, null, null);
  }

  /**
   * Creates an emitter bound to a progress token.
   *
   * @param progressToken
   *            the token from the request, may be null
   * @param sink
   *            the transport sink, may be null
   * @return an emitter forwarding to the sink, or {@link #NOOP} when either
   *         argument is null
   */
  static ProgressEmitter bind(Object progressToken, ProgressSink sink) {
    if (progressToken == null || sink == null) {
      return NOOP;
    }
    return new TokenBoundEmitter(progressToken, sink);
  }

  /**
   * Forwards reports to a sink. A failing sink never fails the interceptor.
   */
  final class TokenBoundEmitter implements ProgressEmitter {

    private static final Logger logger = LoggerFactory.getLogger(TokenBoundEmitter.class);

    private final Object progressToken;
    private final ProgressSink sink;

    TokenBoundEmitter(Object progressToken, ProgressSink sink) {
      this.progressToken = progressToken;
      this.sink = sink;
    }

    @Override
    public void report(double progress, Double total, String message) {
      try {
        sink.send(new ProgressNotification(progressToken, progress, total, message));
      } catch (RuntimeException e) {
        logger.warn("Failed to relay progress for token {}: {}", progressToken, e.getMessage());
      }
    }
  }
}
