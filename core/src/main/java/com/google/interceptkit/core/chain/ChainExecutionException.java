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

package com.google.interceptkit.core.chain;

import com.google.interceptkit.core.HandlerFailureException;
import com.google.interceptkit.core.InterceptorErrorCode;
import com.google.interceptkit.core.InterceptorException;

/**
 * Thrown when a mutation step fails and the remaining mutation steps are
 * abandoned. The cause is the original error; the partial result holds the
 * last good payload and the findings of the validators, which still ran.
 */
public class ChainExecutionException extends InterceptorException {

  private final transient ChainResult partialResult;

  public ChainExecutionException(String interceptorId, Throwable cause, ChainResult partialResult) {
    super("Chain aborted by interceptor '" + interceptorId + "': " + reason(cause), cause,
        InterceptorErrorCode.CHAIN_ABORTED, interceptorId, null);
    this.partialResult = partialResult;
  }

  private static String reason(Throwable cause) {
    if (cause instanceof HandlerFailureException && cause.getCause() != null) {
      return HandlerFailureException.describe(cause.getCause());
    }
    return HandlerFailureException.describe(cause);
  }

  public ChainResult getPartialResult() {
    return partialResult;
  }
}
