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

package com.google.interceptkit.core.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.ValidationFinding;

/**
 * ChainResult is the aggregated outcome of a chain: the payload after all
 * mutation steps, the findings of every validator in execution order, and
 * metadata keyed by interceptor id.
 */
public final class ChainResult {

  private final JsonNode payload;
  private final List<ValidationFinding> findings;
  private final Map<String, Map<String, JsonNode>> metadata;

  public ChainResult(JsonNode payload, List<ValidationFinding> findings,
      Map<String, Map<String, JsonNode>> metadata) {
    this.payload = payload;
    this.findings = List.copyOf(findings);
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /**
   * Returns the final payload: the output of the last successful mutation step,
   * or the original payload when no step produced one.
   *
   * @return the payload, may be null
   */
  public JsonNode getPayload() {
    return payload;
  }

  public List<ValidationFinding> getFindings() {
    return findings;
  }

  public Map<String, Map<String, JsonNode>> getMetadata() {
    return metadata;
  }

  @Override
  public String toString() {
    return "ChainResult{findings=" + findings.size() + ", metadata=" + metadata.keySet() + "}";
  }
}
