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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * InterceptorPhase tells whether a payload belongs to an incoming request or an
 * outgoing response.
 */
public enum InterceptorPhase {
  REQUEST("Request"),

  RESPONSE("Response");

  private final String value;

  InterceptorPhase(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Creates an InterceptorPhase from its wire value, ignoring case.
   *
   * @param value
   *            the wire value
   * @return the corresponding phase
   * @throws IllegalArgumentException
   *             if the value doesn't match any phase
   */
  @JsonCreator
  public static InterceptorPhase fromValue(String value) {
    for (InterceptorPhase phase : values()) {
      if (phase.value.equalsIgnoreCase(value)) {
        return phase;
      }
    }
    throw new IllegalArgumentException("Unknown interceptor phase: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
