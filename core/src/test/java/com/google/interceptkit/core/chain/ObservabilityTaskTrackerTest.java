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

import static com.google.interceptkit.core.InterceptorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.TextNode;
import com.google.interceptkit.core.*;

/**
 * Unit tests for ObservabilityTaskTracker.
 */
class ObservabilityTaskTrackerTest {

  private ExecutorService executor;
  private ObservationStore store;
  private ObservabilityTaskTracker tracker;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    store = new ObservationStore();
    tracker = new ObservabilityTaskTracker(executor, new InvocationEngine(), store);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void testLaunchBeforeStartFails() {
    assertThrows(IllegalStateException.class, () -> tracker.launch(observer("o"), request("o"),
        RequestContext.empty()));
  }

  @Test
  void testStartTwiceFails() {
    tracker.start();

    assertThrows(IllegalStateException.class, () -> tracker.start());
  }

  @Test
  void testLaunchRecordsMetadata() {
    tracker.start();

    assertTrue(tracker.launch(observer("o"), request("o"), RequestContext.empty()));
    assertTrue(tracker.drain(Duration.ofSeconds(5)));

    assertEquals(TextNode.valueOf("ok"), store.metadataFor("o").get("status"));
    assertEquals(ObservabilityTaskTracker.State.STOPPED, tracker.getState());
    assertEquals(0, tracker.getInFlightCount());
  }

  @Test
  void testDrainWaitsForInFlightTasks() {
    tracker.start();
    AtomicBoolean finished = new AtomicBoolean();
    Interceptor slow = observability("slow", 0, ctx -> {
      Thread.sleep(200);
      finished.set(true);
      return null;
    });

    tracker.launch(slow, request("slow"), RequestContext.empty());

    assertTrue(tracker.drain(Duration.ofSeconds(5)));
    assertTrue(finished.get());
    assertTrue(store.failures().isEmpty());
  }

  @Test
  void testDrainCancelsStragglers() throws Exception {
    tracker.start();
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean sawShutdown = new AtomicBoolean();
    Interceptor stuck = observability("stuck", 0, ctx -> {
      ctx.getCancellation().onCancel(() -> sawShutdown.set(true));
      started.countDown();
      Thread.sleep(10_000);
      return null;
    });

    tracker.launch(stuck, request("stuck"), RequestContext.empty());
    assertTrue(started.await(5, TimeUnit.SECONDS));

    assertFalse(tracker.drain(Duration.ofMillis(100)));
    assertTrue(sawShutdown.get());
    assertTrue(tracker.getShutdownToken().isCancelled());
    assertEquals("stuck", store.failures().get(0).getInterceptorId());
  }

  @Test
  void testLaunchAfterDrainRejected() {
    tracker.start();
    tracker.drain(Duration.ZERO);

    assertFalse(tracker.launch(observer("late"), request("late"), RequestContext.empty()));
    assertEquals(1, store.failures().size());
    assertEquals("late", store.failures().get(0).getInterceptorId());
  }

  @Test
  void testDetachedFromCallerCancellation() {
    tracker.start();
    CancellationToken callerToken = CancellationToken.create();
    callerToken.cancel();

    tracker.launch(observer("o"), request("o"), RequestContext.empty().withCancellation(callerToken));

    assertTrue(tracker.drain(Duration.ofSeconds(5)));
    assertEquals(TextNode.valueOf("ok"), store.metadataFor("o").get("status"));
  }

  @Test
  void testConcurrentLaunchAndDrainLosesNothing() throws Exception {
    tracker.start();
    int launchers = 4;
    int perLauncher = 200;
    AtomicInteger accepted = new AtomicInteger();
    AtomicInteger rejected = new AtomicInteger();
    CountDownLatch go = new CountDownLatch(1);
    ExecutorService launcherPool = Executors.newFixedThreadPool(launchers);
    List<Future<?>> launches = new ArrayList<>();
    for (int t = 0; t < launchers; t++) {
      int launcher = t;
      launches.add(launcherPool.submit(() -> {
        go.await();
        for (int i = 0; i < perLauncher; i++) {
          String id = "o-" + launcher + "-" + i;
          if (tracker.launch(observer(id), request(id), RequestContext.empty())) {
            accepted.incrementAndGet();
          } else {
            rejected.incrementAndGet();
          }
        }
        return null;
      }));
    }

    go.countDown();
    Thread.sleep(5);
    boolean drained = tracker.drain(Duration.ofSeconds(10));
    for (Future<?> launch : launches) {
      launch.get(10, TimeUnit.SECONDS);
    }
    launcherPool.shutdownNow();

    assertTrue(drained);
    assertEquals(launchers * perLauncher, accepted.get() + rejected.get());
    assertEquals(accepted.get(), store.snapshot().size());
    assertEquals(rejected.get(), store.failures().size());
    assertEquals(0, tracker.getInFlightCount());
  }

  @Test
  void testDrainWithoutStart() {
    assertTrue(tracker.drain(Duration.ZERO));
    assertEquals(ObservabilityTaskTracker.State.STOPPED, tracker.getState());
  }

  private static Interceptor observer(String id) {
    return observability(id, 0, ctx -> InterceptorResult.metadata(Map.of("status", TextNode.valueOf("ok"))));
  }

  private static InvocationRequest request(String id) {
    return InterceptorFixtures.request(id, InterceptorPhase.REQUEST, TextNode.valueOf("payload"));
  }
}
