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

/**
 * Error codes carried by {@link InterceptorException}.
 */
public enum InterceptorErrorCode {
  /** Registration used an id that is already registered. */
  DUPLICATE_ID,

  /** A call referenced an id that is not registered. */
  UNKNOWN_INTERCEPTOR_ID,

  /** A required argument had no value in the payload and no default. */
  MISSING_REQUIRED_PARAMETER,

  /** An argument could not be bound. */
  PARAMETER_BINDING_FAILURE,

  /** The interceptor raised an error while running. */
  HANDLER_FAILURE,

  /** The payload could not be matched to the expected shape. */
  SERIALIZATION_ERROR,

  /** A mutation step failed and the rest of the mutation group was skipped. */
  CHAIN_ABORTED;

  /**
   * Returns true if the caller can fix the error by changing its request.
   *
   * @return true for request errors
   */
  public boolean isCallerError() {
    switch (this) {
      case UNKNOWN_INTERCEPTOR_ID :
      case MISSING_REQUIRED_PARAMETER :
      case PARAMETER_BINDING_FAILURE :
      case SERIALIZATION_ERROR :
        return true;
      default :
        return false;
    }
  }
}
