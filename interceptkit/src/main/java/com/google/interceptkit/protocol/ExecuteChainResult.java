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
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.ValidationFinding;
import com.google.interceptkit.core.chain.ChainResult;

/**
 * Result of {@code interceptor/executeChain}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecuteChainResult {

  @JsonProperty("modifiedPayload")
  private JsonNode modifiedPayload;

  @JsonProperty("allValidationResults")
  private List<ValidationFinding> allValidationResults;

  /**
   * Metadata keyed by the id of the interceptor that produced it.
   */
  @JsonProperty("metadata")
  private Map<String, Map<String, JsonNode>> metadata;

  public ExecuteChainResult() {
  }

  public static ExecuteChainResult from(ChainResult result) {
    ExecuteChainResult wire = new ExecuteChainResult();
    wire.modifiedPayload = result.getPayload();
    wire.allValidationResults = result.getFindings().isEmpty() ? null : result.getFindings();
    wire.metadata = result.getMetadata().isEmpty() ? null : result.getMetadata();
    return wire;
  }

  public JsonNode getModifiedPayload() {
    return modifiedPayload;
  }

  public void setModifiedPayload(JsonNode modifiedPayload) {
    this.modifiedPayload = modifiedPayload;
  }

  public List<ValidationFinding> getAllValidationResults() {
    return allValidationResults;
  }

  public void setAllValidationResults(List<ValidationFinding> allValidationResults) {
    this.allValidationResults = allValidationResults;
  }

  public Map<String, Map<String, JsonNode>> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, Map<String, JsonNode>> metadata) {
    this.metadata = metadata;
  }
}
