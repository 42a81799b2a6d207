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
 * InterceptorException is the base exception for all interceptor errors. It
 * names the interceptor that misbehaved, when there is one, so operators can
 * tell which registration to look at.
 */
public class InterceptorException extends RuntimeException {

  private final InterceptorErrorCode errorCode;
  private final String interceptorId;
  private final Object details;

  /**
   * Creates a new InterceptorException.
   *
   * @param message
   *            the error message
   */
  public InterceptorException(String message) {
    this(message, null, null, null, null);
  }

  /**
   * Creates a new InterceptorException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public InterceptorException(String message, Throwable cause) {
    this(message, cause, null, null, null);
  }

  /**
   * Creates a new InterceptorException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param interceptorId
   *            the id of the interceptor involved, may be null
   * @param details
   *            additional error details
   */
  public InterceptorException(String message, Throwable cause, InterceptorErrorCode errorCode,
      String interceptorId, Object details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.interceptorId = interceptorId;
    this.details = details;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public InterceptorErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Returns the id of the interceptor this error is attributed to.
   *
   * @return the interceptor id, or null if not attributable
   */
  public String getInterceptorId() {
    return interceptorId;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for InterceptorException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private InterceptorErrorCode errorCode;
    private String interceptorId;
    private Object details;

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder errorCode(InterceptorErrorCode errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder interceptorId(String interceptorId) {
      this.interceptorId = interceptorId;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public InterceptorException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new InterceptorException(message, cause, errorCode, interceptorId, details);
    }
  }
}
