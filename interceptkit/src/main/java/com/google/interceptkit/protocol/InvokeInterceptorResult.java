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
import com.google.interceptkit.core.InterceptorResult;
import com.google.interceptkit.core.ValidationFinding;

/**
 * Result of {@code interceptor/invoke}. Absent parts are omitted from the wire
 * form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvokeInterceptorResult {

  @JsonProperty("modifiedPayload")
  private JsonNode modifiedPayload;

  @JsonProperty("validationResults")
  private List<ValidationFinding> validationResults;

  @JsonProperty("metadata")
  private Map<String, JsonNode> metadata;

  public InvokeInterceptorResult() {
  }

  /**
   * Creates the wire result for an invocation result.
   *
   * @param result
   *            the invocation result
   * @return the wire result
   */
  public static InvokeInterceptorResult from(InterceptorResult result) {
    InvokeInterceptorResult wire = new InvokeInterceptorResult();
    wire.modifiedPayload = result.getModifiedPayload();
    wire.validationResults = result.getFindings().isEmpty() ? null : result.getFindings();
    wire.metadata = result.getMetadata().isEmpty() ? null : result.getMetadata();
    return wire;
  }

  public JsonNode getModifiedPayload() {
    return modifiedPayload;
  }

  public void setModifiedPayload(JsonNode modifiedPayload) {
    this.modifiedPayload = modifiedPayload;
  }

  public List<ValidationFinding> getValidationResults() {
    return validationResults;
  }

  public void setValidationResults(List<ValidationFinding> validationResults) {
    this.validationResults = validationResults;
  }

  public Map<String, JsonNode> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, JsonNode> metadata) {
    this.metadata = metadata;
  }
}
