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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ValidationFinding is a single validation outcome: a severity, a human
 * readable message and an optional path into the payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ValidationFinding {

  private final ValidationSeverity severity;
  private final String message;
  private final String path;

  @JsonCreator
  public ValidationFinding(@JsonProperty("severity") ValidationSeverity severity,
      @JsonProperty("message") String message, @JsonProperty("path") String path) {
    if (severity == null) {
      throw new IllegalArgumentException("Finding severity is required");
    }
    if (message == null) {
      throw new IllegalArgumentException("Finding message is required");
    }
    this.severity = severity;
    this.message = message;
    this.path = path;
  }

  public static ValidationFinding info(String message) {
    return new ValidationFinding(ValidationSeverity.INFO, message, null);
  }

  public static ValidationFinding warning(String message, String path) {
    return new ValidationFinding(ValidationSeverity.WARNING, message, path);
  }

  public static ValidationFinding error(String message) {
    return new ValidationFinding(ValidationSeverity.ERROR, message, null);
  }

  public static ValidationFinding error(String message, String path) {
    return new ValidationFinding(ValidationSeverity.ERROR, message, path);
  }

  @JsonProperty("severity")
  public ValidationSeverity getSeverity() {
    return severity;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @JsonProperty("path")
  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ValidationFinding)) {
      return false;
    }
    ValidationFinding that = (ValidationFinding) o;
    return severity == that.severity && message.equals(that.message) && Objects.equals(path, that.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(severity, message, path);
  }

  @Override
  public String toString() {
    return severity + ": " + message + (path != null ? " (" + path + ")" : "");
  }
}
