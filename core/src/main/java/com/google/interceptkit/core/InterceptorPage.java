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

import java.util.List;

/**
 * One page of interceptor descriptors, ordered by id.
 */
public final class InterceptorPage {

  private final List<InterceptorDesc> interceptors;
  private final String nextCursor;

  public InterceptorPage(List<InterceptorDesc> interceptors, String nextCursor) {
    this.interceptors = List.copyOf(interceptors);
    this.nextCursor = nextCursor;
  }

  public List<InterceptorDesc> getInterceptors() {
    return interceptors;
  }

  /**
   * Returns the cursor for the next page, or null if this is the last page.
   *
   * @return the next cursor
   */
  public String getNextCursor() {
    return nextCursor;
  }

  public boolean hasMore() {
    return nextCursor != null;
  }
}
