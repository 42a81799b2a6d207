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

package com.google.interceptkit.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request metadata sent under {@code _meta}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestMeta {

  /**
   * Token the client uses to correlate progress notifications; a string or a
   * number.
   */
  @JsonProperty("progressToken")
  private Object progressToken;

  public RequestMeta() {
  }

  public RequestMeta(Object progressToken) {
    this.progressToken = progressToken;
  }

  public Object getProgressToken() {
    return progressToken;
  }

  public void setProgressToken(Object progressToken) {
    this.progressToken = progressToken;
  }
}
