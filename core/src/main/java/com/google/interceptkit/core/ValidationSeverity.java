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
 * Severity of a single {@link ValidationFinding}.
 */
public enum ValidationSeverity {
  INFO("Info"),

  WARNING("Warning"),

  ERROR("Error");

  private final String value;

  ValidationSeverity(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ValidationSeverity fromValue(String value) {
    for (ValidationSeverity severity : values()) {
      if (severity.value.equalsIgnoreCase(value)) {
        return severity;
      }
    }
    throw new IllegalArgumentException("Unknown validation severity: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
