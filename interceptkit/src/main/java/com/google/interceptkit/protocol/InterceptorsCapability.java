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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The interceptor capability a server advertises during initialization.
 */
public class InterceptorsCapability {

  @JsonProperty("listChanged")
  private boolean listChanged;

  public InterceptorsCapability() {
  }

  public InterceptorsCapability(boolean listChanged) {
    this.listChanged = listChanged;
  }

  /**
   * Returns whether the server sends
   * {@link ProtocolMethods#NOTIFICATION_LIST_CHANGED}.
   *
   * @return true if list-changed notifications are sent
   */
  public boolean isListChanged() {
    return listChanged;
  }

  public void setListChanged(boolean listChanged) {
    this.listChanged = listChanged;
  }
}
