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

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ObservationStore is the side channel for detached observability tasks. It
 * merges the metadata each task returns, keyed by interceptor id, and keeps a
 * record of the tasks that failed. Neither ever reaches the caller of a chain.
 *
 * <p>
 * Failure records are bounded; once the buffer is full the oldest record is
 * dropped for each new one.
 */
public class ObservationStore {

  private static final Logger logger = LoggerFactory.getLogger(ObservationStore.class);

  public static final int DEFAULT_MAX_FAILURES = 1000;

  private final ConcurrentMap<String, Map<String, JsonNode>> metadata = new ConcurrentHashMap<>();
  private final Deque<ObservationFailure> failures = new ArrayDeque<>();
  private final int maxFailures;
  private long droppedFailures;

  public ObservationStore() {
    this(DEFAULT_MAX_FAILURES);
  }

  /**
   * Creates a store that keeps at most {@code maxFailures} failure records.
   *
   * @param maxFailures
   *            the failure buffer capacity
   */
  public ObservationStore(int maxFailures) {
    if (maxFailures < 1) {
      throw new IllegalArgumentException("maxFailures must be positive: " + maxFailures);
    }
    this.maxFailures = maxFailures;
  }

  /**
   * Merges metadata into the entry for an interceptor. Later values replace
   * earlier values under the same key.
   *
   * @param interceptorId
   *            the interceptor id
   * @param values
   *            the metadata to merge
   */
  public void recordMetadata(String interceptorId, Map<String, JsonNode> values) {
    if (values == null || values.isEmpty()) {
      return;
    }
    metadata.merge(interceptorId, Collections.unmodifiableMap(new LinkedHashMap<>(values)), (existing, added) -> {
      Map<String, JsonNode> merged = new LinkedHashMap<>(existing);
      merged.putAll(added);
      return Collections.unmodifiableMap(merged);
    });
  }

  public void recordFailure(String interceptorId, Throwable error) {
    recordFailure(ObservationFailure.of(interceptorId, error));
  }

  /**
   * Records a failure, dropping the oldest record if the buffer is full.
   *
   * @param failure
   *            the failure
   */
  public void recordFailure(ObservationFailure failure) {
    ObservationFailure dropped = null;
    long droppedSoFar;
    synchronized (failures) {
      if (failures.size() >= maxFailures) {
        dropped = failures.pollFirst();
        droppedFailures++;
      }
      failures.addLast(failure);
      droppedSoFar = droppedFailures;
    }
    if (dropped != null) {
      if (droppedSoFar == 1) {
        logger.warn("Observation failure buffer full ({} records); dropping oldest records", maxFailures);
      } else {
        logger.debug("Dropped observation failure for {}", dropped.getInterceptorId());
      }
    }
  }

  /**
   * Returns the merged metadata recorded for an interceptor.
   *
   * @param interceptorId
   *            the interceptor id
   * @return the metadata, empty if none was recorded
   */
  public Map<String, JsonNode> metadataFor(String interceptorId) {
    return metadata.getOrDefault(interceptorId, Collections.emptyMap());
  }

  /**
   * Returns all recorded metadata, ordered by interceptor id.
   *
   * @return a snapshot of the metadata
   */
  public Map<String, Map<String, JsonNode>> snapshot() {
    return Collections.unmodifiableMap(new TreeMap<>(metadata));
  }

  public List<ObservationFailure> failures() {
    synchronized (failures) {
      return List.copyOf(failures);
    }
  }

  /**
   * Returns how many failure records were dropped because the buffer was full.
   *
   * @return the dropped count
   */
  public long getDroppedFailureCount() {
    synchronized (failures) {
      return droppedFailures;
    }
  }

  public int getMaxFailures() {
    return maxFailures;
  }

  /**
   * Removes and returns all recorded failures, for export.
   *
   * @return the failures recorded since the last drain
   */
  public List<ObservationFailure> drainFailures() {
    synchronized (failures) {
      List<ObservationFailure> drained = new ArrayList<>(failures);
      failures.clear();
      return drained;
    }
  }

  public void clear() {
    metadata.clear();
    synchronized (failures) {
      failures.clear();
      droppedFailures = 0;
    }
  }
}
