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
 * Thrown when a payload, or a part of it, cannot be converted to the shape an
 * interceptor expects.
 */
public class PayloadSerializationException extends InterceptorException {

  public PayloadSerializationException(String message, Throwable cause) {
    this(message, cause, null);
  }

  public PayloadSerializationException(String message, Throwable cause, String interceptorId) {
    super(message, cause, InterceptorErrorCode.SERIALIZATION_ERROR, interceptorId, null);
  }
}
