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
 * InterceptorKind selects the execution model an interceptor runs under when it
 * takes part in a chain.
 */
public enum InterceptorKind {
  /**
   * Runs concurrently with other validators against the original payload and
   * reports findings. Never changes the payload.
   */
  VALIDATION("Validation"),

  /**
   * Runs strictly in order; each step receives the payload produced by the
   * previous one.
   */
  MUTATION("Mutation"),

  /**
   * Launched detached from the caller. Its output is recorded out of band and
   * never becomes part of the synchronous response.
   */
  OBSERVABILITY("Observability");

  private final String value;

  InterceptorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the wire value of the kind.
   *
   * @return the wire value
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Creates an InterceptorKind from its wire value, ignoring case.
   *
   * @param value
   *            the wire value
   * @return the corresponding kind
   * @throws IllegalArgumentException
   *             if the value doesn't match any kind
   */
  @JsonCreator
  public static InterceptorKind fromValue(String value) {
    for (InterceptorKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown interceptor kind: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
