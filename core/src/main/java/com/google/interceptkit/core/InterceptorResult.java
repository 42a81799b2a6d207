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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * InterceptorResult is the normalized outcome of one interceptor invocation.
 * It is a tagged value: exactly one of {@link Variant#MODIFIED_PAYLOAD},
 * {@link Variant#FINDINGS} or {@link Variant#METADATA}. Metadata may accompany
 * any variant.
 *
 * <p>
 * Handlers may return an InterceptorResult directly. The invocation engine
 * checks the variant against the interceptor's declared kind: a modified
 * payload is only honored for {@link InterceptorKind#MUTATION}.
 */
public final class InterceptorResult {

  /**
   * The variant carried by a result.
   */
  public enum Variant {
    MODIFIED_PAYLOAD, FINDINGS, METADATA
  }

  private static final InterceptorResult EMPTY = new InterceptorResult(Variant.METADATA, null,
      Collections.emptyList(), Collections.emptyMap());

  private final Variant variant;
  private final JsonNode modifiedPayload;
  private final List<ValidationFinding> findings;
  private final Map<String, JsonNode> metadata;

  private InterceptorResult(Variant variant, JsonNode modifiedPayload, List<ValidationFinding> findings,
      Map<String, JsonNode> metadata) {
    this.variant = variant;
    this.modifiedPayload = modifiedPayload;
    this.findings = findings;
    this.metadata = metadata;
  }

  /**
   * Returns a result with no payload, no findings and no metadata.
   *
   * @return the empty result
   */
  public static InterceptorResult empty() {
    return EMPTY;
  }

  public static InterceptorResult modifiedPayload(JsonNode payload) {
    return modifiedPayload(payload, null);
  }

  public static InterceptorResult modifiedPayload(JsonNode payload, Map<String, JsonNode> metadata) {
    if (payload == null) {
      throw new IllegalArgumentException("Modified payload must not be null");
    }
    return new InterceptorResult(Variant.MODIFIED_PAYLOAD, payload, Collections.emptyList(), copy(metadata));
  }

  public static InterceptorResult findings(List<ValidationFinding> findings) {
    return findings(findings, null);
  }

  public static InterceptorResult findings(List<ValidationFinding> findings, Map<String, JsonNode> metadata) {
    List<ValidationFinding> list = findings == null ? Collections.emptyList() : List.copyOf(findings);
    return new InterceptorResult(Variant.FINDINGS, null, list, copy(metadata));
  }

  public static InterceptorResult metadata(Map<String, JsonNode> metadata) {
    return new InterceptorResult(Variant.METADATA, null, Collections.emptyList(), copy(metadata));
  }

  public Variant getVariant() {
    return variant;
  }

  /**
   * Returns the modified payload.
   *
   * @return the payload, or null unless this is a
   *         {@link Variant#MODIFIED_PAYLOAD} result
   */
  public JsonNode getModifiedPayload() {
    return modifiedPayload;
  }

  public boolean hasModifiedPayload() {
    return modifiedPayload != null;
  }

  public List<ValidationFinding> getFindings() {
    return findings;
  }

  public Map<String, JsonNode> getMetadata() {
    return metadata;
  }

  /**
   * Returns a copy of this result with the payload dropped, keeping findings and
   * metadata.
   *
   * @return a result without a modified payload
   */
  public InterceptorResult withoutPayload() {
    if (variant != Variant.MODIFIED_PAYLOAD) {
      return this;
    }
    return new InterceptorResult(Variant.METADATA, null, findings, metadata);
  }

  private static Map<String, JsonNode> copy(Map<String, JsonNode> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  @Override
  public String toString() {
    return "InterceptorResult{variant=" + variant + ", findings=" + findings.size() + ", metadata="
        + metadata.keySet() + "}";
  }
}
