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

package com.google.interceptkit.core.binding;

/**
 * Where the value of an interceptor parameter comes from, after well-known
 * context types have been ruled out.
 */
public enum ParameterSource {
  /** A service if the resolver can supply the type, otherwise a payload field. */
  AUTO,

  /** Always the service resolver, by type. */
  SERVICES,

  /** Always the service resolver, by explicit key. */
  KEYED_SERVICES,

  /** Always a payload field. */
  PAYLOAD,

  /** The whole payload. */
  WHOLE_PAYLOAD
}
