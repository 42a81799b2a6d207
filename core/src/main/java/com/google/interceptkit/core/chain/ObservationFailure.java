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

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.interceptkit.core.HandlerFailureException;
import com.google.interceptkit.core.InterceptorErrorCode;
import com.google.interceptkit.core.InterceptorException;

/**
 * A failed or abandoned observability task, kept for operational visibility.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ObservationFailure {

  private final String interceptorId;
  private final String message;
  private final InterceptorErrorCode errorCode;
  private final Instant timestamp;

  @JsonCreator
  public ObservationFailure(@JsonProperty("interceptorId") String interceptorId,
      @JsonProperty("message") String message, @JsonProperty("errorCode") InterceptorErrorCode errorCode,
      @JsonProperty("timestamp") Instant timestamp) {
    this.interceptorId = interceptorId;
    this.message = message;
    this.errorCode = errorCode;
    this.timestamp = timestamp;
  }

  /**
   * Creates a failure record from an error.
   *
   * @param interceptorId
   *            the observability interceptor
   * @param error
   *            the error it raised
   * @return the failure record
   */
  public static ObservationFailure of(String interceptorId, Throwable error) {
    InterceptorErrorCode code = error instanceof InterceptorException
        ? ((InterceptorException) error).getErrorCode()
        : null;
    String message = error instanceof InterceptorException
        ? error.getMessage()
        : HandlerFailureException.describe(error);
    return new ObservationFailure(interceptorId, message, code, Instant.now());
  }

  @JsonProperty("interceptorId")
  public String getInterceptorId() {
    return interceptorId;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @JsonProperty("errorCode")
  public InterceptorErrorCode getErrorCode() {
    return errorCode;
  }

  @JsonProperty("timestamp")
  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "ObservationFailure{interceptorId='" + interceptorId + "', message='" + message + "'}";
  }
}
