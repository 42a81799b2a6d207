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
 * Thrown when an interceptor argument cannot be bound.
 */
public class ParameterBindingException extends InterceptorException {

  private final String parameterName;

  public ParameterBindingException(String interceptorId, String parameterName, String message) {
    this(interceptorId, parameterName, message, null, InterceptorErrorCode.PARAMETER_BINDING_FAILURE);
  }

  protected ParameterBindingException(String interceptorId, String parameterName, String message, Throwable cause,
      InterceptorErrorCode errorCode) {
    super("Cannot bind parameter '" + parameterName + "' of interceptor '" + interceptorId + "': " + message, cause,
        errorCode, interceptorId, null);
    this.parameterName = parameterName;
  }

  public String getParameterName() {
    return parameterName;
  }
}
