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

/**
 * Method names of the interceptor protocol.
 */
public final class ProtocolMethods {

  public static final String LIST_INTERCEPTORS = "interceptors/list";
  public static final String INVOKE_INTERCEPTOR = "interceptor/invoke";
  public static final String EXECUTE_CHAIN = "interceptor/executeChain";

  public static final String NOTIFICATION_LIST_CHANGED = "notifications/interceptors/list_changed";
  public static final String NOTIFICATION_PROGRESS = "notifications/progress";

  private ProtocolMethods() {
  }
}
