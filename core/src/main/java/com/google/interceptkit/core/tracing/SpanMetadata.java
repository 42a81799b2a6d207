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

package com.google.interceptkit.core.tracing;

import java.util.HashMap;
import java.util.Map;

/**
 * SpanMetadata contains the name and attributes of a span started by the
 * {@link InterceptorTracer}.
 */
public class SpanMetadata {

  private final String name;
  private final Map<String, Object> attributes;

  /**
   * Creates a new SpanMetadata with the specified values.
   *
   * @param name
   *            the span name
   * @param attributes
   *            additional attributes
   */
  public SpanMetadata(String name, Map<String, Object> attributes) {
    this.name = name;
    this.attributes = attributes != null ? new HashMap<>(attributes) : new HashMap<>();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getName() {
    return name;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  /**
   * Builder for SpanMetadata.
   */
  public static class Builder {
    private String name;
    private final Map<String, Object> attributes = new HashMap<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder addAttribute(String key, Object value) {
      if (value != null) {
        this.attributes.put(key, value);
      }
      return this;
    }

    public SpanMetadata build() {
      return new SpanMetadata(name, attributes);
    }
  }
}
