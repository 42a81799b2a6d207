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

package com.google.interceptkit.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A progress update relayed to the party that invoked an interceptor,
 * correlated by the token it supplied with its request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProgressNotification {

  private final Object progressToken;
  private final double progress;
  private final Double total;
  private final String message;

  @JsonCreator
  public ProgressNotification(@JsonProperty("progressToken") Object progressToken,
      @JsonProperty("progress") double progress, @JsonProperty("total") Double total,
      @JsonProperty("message") String message) {
    this.progressToken = progressToken;
    this.progress = progress;
    this.total = total;
    this.message = message;
  }

  @JsonProperty("progressToken")
  public Object getProgressToken() {
    return progressToken;
  }

  @JsonProperty("progress")
  public double getProgress() {
    return progress;
  }

  @JsonProperty("total")
  public Double getTotal() {
    return total;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return "ProgressNotification{token=" + progressToken + ", progress=" + progress + ", total=" + total + "}";
  }
}
