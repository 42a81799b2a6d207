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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.google.interceptkit.core.HandlerFailureException;
import com.google.interceptkit.core.InterceptorErrorCode;
import com.google.interceptkit.core.JsonUtils;

/**
 * Unit tests for ObservationStore.
 */
class ObservationStoreTest {

  private ObservationStore store;

  @BeforeEach
  void setUp() {
    store = new ObservationStore();
  }

  @Test
  void testMetadataMerged() {
    store.recordMetadata("o", Map.of("a", IntNode.valueOf(1), "b", IntNode.valueOf(1)));
    store.recordMetadata("o", Map.of("b", IntNode.valueOf(2)));

    Map<String, JsonNode> metadata = store.metadataFor("o");

    assertEquals(IntNode.valueOf(1), metadata.get("a"));
    assertEquals(IntNode.valueOf(2), metadata.get("b"));
  }

  @Test
  void testEmptyMetadataIgnored() {
    store.recordMetadata("o", Map.of());

    assertTrue(store.snapshot().isEmpty());
    assertTrue(store.metadataFor("o").isEmpty());
  }

  @Test
  void testFailures() {
    store.recordFailure("o", new HandlerFailureException("o", new IllegalStateException("boom")));
    store.recordFailure("p", new IllegalArgumentException("bad"));

    List<ObservationFailure> failures = store.failures();

    assertEquals(2, failures.size());
    assertEquals(InterceptorErrorCode.HANDLER_FAILURE, failures.get(0).getErrorCode());
    assertEquals("Interceptor 'o' failed: boom", failures.get(0).getMessage());
    assertNull(failures.get(1).getErrorCode());
    assertEquals("bad", failures.get(1).getMessage());
    assertNotNull(failures.get(1).getTimestamp());
  }

  @Test
  void testDrainFailures() {
    store.recordFailure("o", new IllegalStateException("boom"));

    assertEquals(1, store.drainFailures().size());
    assertTrue(store.failures().isEmpty());
  }

  @Test
  void testFailureSerializesForExport() {
    store.recordFailure("o", new HandlerFailureException("o", new IllegalStateException("boom")));

    JsonNode json = JsonUtils.toJsonNode(store.failures().get(0));

    assertEquals("o", json.get("interceptorId").asText());
    assertEquals("HANDLER_FAILURE", json.get("errorCode").asText());
    assertTrue(json.has("timestamp"));
  }

  @Test
  void testFailureBufferDropsOldest() {
    ObservationStore bounded = new ObservationStore(2);

    bounded.recordFailure("a", new IllegalStateException("1"));
    bounded.recordFailure("b", new IllegalStateException("2"));
    bounded.recordFailure("c", new IllegalStateException("3"));

    List<ObservationFailure> failures = bounded.failures();
    assertEquals(2, failures.size());
    assertEquals("b", failures.get(0).getInterceptorId());
    assertEquals("c", failures.get(1).getInterceptorId());
    assertEquals(1, bounded.getDroppedFailureCount());
  }

  @Test
  void testDefaultCapacity() {
    for (int i = 0; i < ObservationStore.DEFAULT_MAX_FAILURES + 5; i++) {
      store.recordFailure("o", new IllegalStateException("boom " + i));
    }

    assertEquals(ObservationStore.DEFAULT_MAX_FAILURES, store.failures().size());
    assertEquals(5, store.getDroppedFailureCount());
    assertEquals("boom 5", store.failures().get(0).getMessage());
  }

  @Test
  void testInvalidCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new ObservationStore(0));
  }

  @Test
  void testClear() {
    store.recordMetadata("o", Map.of("a", IntNode.valueOf(1)));
    store.recordFailure("o", new IllegalStateException("boom"));

    store.clear();

    assertTrue(store.snapshot().isEmpty());
    assertTrue(store.failures().isEmpty());
    assertEquals(0, store.getDroppedFailureCount());
  }
}
