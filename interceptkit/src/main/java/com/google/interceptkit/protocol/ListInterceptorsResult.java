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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.interceptkit.core.InterceptorDesc;
import com.google.interceptkit.core.InterceptorPage;

/**
 * Result of {@code interceptors/list}: one page of descriptors and the cursor
 * for the next page, if any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ListInterceptorsResult {

  @JsonProperty("interceptors")
  private List<InterceptorDesc> interceptors;

  @JsonProperty("nextCursor")
  private String nextCursor;

  public ListInterceptorsResult() {
  }

  public static ListInterceptorsResult from(InterceptorPage page) {
    ListInterceptorsResult wire = new ListInterceptorsResult();
    wire.interceptors = page.getInterceptors();
    wire.nextCursor = page.getNextCursor();
    return wire;
  }

  public List<InterceptorDesc> getInterceptors() {
    return interceptors;
  }

  public void setInterceptors(List<InterceptorDesc> interceptors) {
    this.interceptors = interceptors;
  }

  public String getNextCursor() {
    return nextCursor;
  }

  public void setNextCursor(String nextCursor) {
    this.nextCursor = nextCursor;
  }
}
