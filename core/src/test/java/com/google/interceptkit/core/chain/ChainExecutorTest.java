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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.interceptkit.core.*;
import com.google.interceptkit.core.tracing.InterceptorTracer;

/**
 * Unit tests for ChainExecutor.
 */
class ChainExecutorTest {

  private DefaultInterceptorRegistry registry;
  private ExecutorService executor;
  private ObservationStore store;
  private ObservabilityTaskTracker tracker;
  private ChainExecutor chainExecutor;

  @BeforeEach
  void setUp() {
    registry = new DefaultInterceptorRegistry();
    executor = Executors.newFixedThreadPool(4);
    store = new ObservationStore();
    InvocationEngine engine = new InvocationEngine();
    tracker = new ObservabilityTaskTracker(executor, engine, store);
    tracker.start();
    chainExecutor = new ChainExecutor(registry, engine, executor, tracker, InterceptorTracer.noop());
  }

  @AfterEach
  void tearDown() {
    tracker.drain(Duration.ofSeconds(5));
    executor.shutdownNow();
  }

  @Test
  void testMutationsRunInPriorityOrder() {
    registry.register(appending("append-a", 5, "-A"));
    registry.register(appending("append-b", 1, "-B"));

    ChainResult result = execute(TextNode.valueOf("x"), "append-a", "append-b");

    assertEquals(TextNode.valueOf("x-B-A"), result.getPayload());
    assertTrue(result.getFindings().isEmpty());
  }

  @Test
  void testMutationTiesBrokenById() {
    registry.register(appending("b", 0, "-b"));
    registry.register(appending("a", 0, "-a"));
    registry.register(appending("c", -1, "-c"));

    ChainResult result = execute(TextNode.valueOf("x"), "b", "a", "c");

    assertEquals(TextNode.valueOf("x-c-a-b"), result.getPayload());
  }

  @Test
  void testFailingValidatorOrderedBeforePassingValidator() {
    registry.register(validation("failing", 1, ctx -> {
      Thread.sleep(50);
      throw new IllegalStateException("boom");
    }));
    registry.register(validation("passing", 2, ctx -> ValidationFinding.info("looks fine")));

    ChainResult result = execute(TextNode.valueOf("x"), "passing", "failing");

    assertEquals(2, result.getFindings().size());
    ValidationFinding synthesized = result.getFindings().get(0);
    assertEquals(ValidationSeverity.ERROR, synthesized.getSeverity());
    assertEquals("Interceptor 'failing' failed: boom", synthesized.getMessage());
    assertEquals(ValidationFinding.info("looks fine"), result.getFindings().get(1));
  }

  @Test
  void testValidatorBindingFailureBecomesFinding() {
    registry.register(new InterceptorDef(desc("needs-field", InterceptorKind.VALIDATION, 0),
        List.of(com.google.interceptkit.core.binding.InterceptorParameter.of("absent", String.class)),
        args -> null));

    ChainResult result = execute(TextNode.valueOf("x"), "needs-field");

    assertEquals(1, result.getFindings().size());
    assertTrue(result.getFindings().get(0).getMessage().startsWith("Interceptor 'needs-field' failed: "));
  }

  @Test
  void testValidatorsSeeOriginalPayload() {
    registry.register(appending("m", 0, "-mutated"));
    registry.register(validation("v", 0, ctx -> ValidationFinding.info(ctx.getPayload().asText())));

    ChainResult result = execute(TextNode.valueOf("x"), "m", "v");

    assertEquals(TextNode.valueOf("x-mutated"), result.getPayload());
    assertEquals("x", result.getFindings().get(0).getMessage());
  }

  @Test
  void testUnknownIdAbortsBeforeAnythingRuns() {
    AtomicBoolean ran = new AtomicBoolean();
    registry.register(mutation("m", 0, ctx -> {
      ran.set(true);
      return null;
    }));
    registry.register(validation("v", 0, ctx -> {
      ran.set(true);
      return null;
    }));

    UnknownInterceptorIdException e = assertThrows(UnknownInterceptorIdException.class,
        () -> execute(TextNode.valueOf("x"), "m", "missing", "v"));

    assertEquals("missing", e.getInterceptorId());
    assertFalse(ran.get());
  }

  @Test
  void testEmptyChainReturnsOriginalPayload() {
    JsonNode payload = TextNode.valueOf("x");

    ChainResult result = execute(payload);

    assertSame(payload, result.getPayload());
    assertTrue(result.getFindings().isEmpty());
    assertTrue(result.getMetadata().isEmpty());
  }

  @Test
  void testInterceptorsForOtherPhaseSkipped() {
    registry.register(InterceptorDef.create(desc("response-only", InterceptorKind.MUTATION, 0,
        InterceptorPhase.RESPONSE), ctx -> TextNode.valueOf("changed")));

    ChainResult result = execute(TextNode.valueOf("x"), "response-only");

    assertEquals(TextNode.valueOf("x"), result.getPayload());
  }

  @Test
  void testEventFilterNotAppliedToExplicitIds() {
    registry.register(InterceptorDef.create(InterceptorDesc.builder().id("prompts-only")
        .kind(InterceptorKind.MUTATION).applicableEvents("prompts/get").build(), ctx -> TextNode.valueOf("y")));

    ChainResult result = execute(TextNode.valueOf("x"), "prompts-only");

    assertEquals(TextNode.valueOf("y"), result.getPayload());
  }

  @Test
  void testMutationFailureAbortsRemainingSteps() {
    AtomicBoolean lastRan = new AtomicBoolean();
    registry.register(appending("first", 1, "-1"));
    registry.register(mutation("second", 2, ctx -> {
      throw new IllegalStateException("cannot mutate");
    }));
    registry.register(mutation("third", 3, ctx -> {
      lastRan.set(true);
      return TextNode.valueOf("never");
    }));
    registry.register(validation("v", 0, ctx -> ValidationFinding.warning("checked", null)));

    ChainExecutionException e = assertThrows(ChainExecutionException.class,
        () -> execute(TextNode.valueOf("x"), "first", "second", "third", "v"));

    assertEquals("second", e.getInterceptorId());
    assertEquals(InterceptorErrorCode.CHAIN_ABORTED, e.getErrorCode());
    assertTrue(e.getCause() instanceof HandlerFailureException);
    assertTrue(e.getMessage().contains("cannot mutate"));
    assertFalse(lastRan.get());
    assertEquals(TextNode.valueOf("x-1"), e.getPartialResult().getPayload());
    assertEquals(1, e.getPartialResult().getFindings().size());
  }

  @Test
  void testFirstMutationFailureKeepsOriginalPayload() {
    registry.register(mutation("broken", 0, ctx -> {
      throw new IllegalStateException("broken");
    }));

    ChainExecutionException e = assertThrows(ChainExecutionException.class,
        () -> execute(TextNode.valueOf("x"), "broken"));

    assertEquals(TextNode.valueOf("x"), e.getPartialResult().getPayload());
  }

  @Test
  void testValidatorErrorBecomesFinding() {
    registry.register(validation("bad", 1, ctx -> {
      throw new AssertionError("assert boom");
    }));
    registry.register(validation("good", 2, ctx -> ValidationFinding.info("fine")));

    ChainResult result = execute(TextNode.valueOf("x"), "bad", "good");

    assertEquals(2, result.getFindings().size());
    assertEquals(ValidationFinding.error("Interceptor 'bad' failed: assert boom"), result.getFindings().get(0));
    assertEquals(ValidationFinding.info("fine"), result.getFindings().get(1));
  }

  @Test
  void testMutationErrorAbortsChain() {
    registry.register(appending("first", 1, "-1"));
    registry.register(mutation("deep", 2, ctx -> {
      throw new StackOverflowError();
    }));

    ChainExecutionException e = assertThrows(ChainExecutionException.class,
        () -> execute(TextNode.valueOf("x"), "first", "deep"));

    assertEquals("deep", e.getInterceptorId());
    assertTrue(e.getCause() instanceof HandlerFailureException);
    assertTrue(e.getCause().getCause() instanceof StackOverflowError);
    assertEquals(TextNode.valueOf("x-1"), e.getPartialResult().getPayload());
  }

  @Test
  void testObservabilityErrorRecorded() {
    registry.register(observability("audit", 0, ctx -> {
      throw new AssertionError("audit broke");
    }));

    ChainResult result = execute(TextNode.valueOf("x"), "audit");

    assertEquals(TextNode.valueOf("x"), result.getPayload());
    assertTrue(tracker.drain(Duration.ofSeconds(5)));
    assertEquals(1, store.failures().size());
    assertEquals("audit", store.failures().get(0).getInterceptorId());
    assertEquals("Interceptor 'audit' failed: audit broke", store.failures().get(0).getMessage());
  }

  @Test
  void testMetadataKeyedByInterceptorId() {
    registry.register(mutation("m", 0, ctx -> InterceptorResult.modifiedPayload(TextNode.valueOf("y"),
        Map.of("count", IntNode.valueOf(1)))));
    registry.register(validation("v", 0, ctx -> InterceptorResult.findings(List.of(),
        Map.of("count", IntNode.valueOf(2)))));

    ChainResult result = execute(TextNode.valueOf("x"), "m", "v");

    assertEquals(IntNode.valueOf(1), result.getMetadata().get("m").get("count"));
    assertEquals(IntNode.valueOf(2), result.getMetadata().get("v").get("count"));
  }

  @Test
  void testMutationFindingsNotAddedToChainFindings() {
    registry.register(mutation("m", 0, ctx -> ValidationFinding.error("from a mutation")));

    ChainResult result = execute(TextNode.valueOf("x"), "m");

    assertTrue(result.getFindings().isEmpty());
  }

  @Test
  void testDuplicateIdsRunOnce() {
    AtomicInteger calls = new AtomicInteger();
    registry.register(mutation("m", 0, ctx -> {
      calls.incrementAndGet();
      return null;
    }));

    execute(TextNode.valueOf("x"), "m", "m");

    assertEquals(1, calls.get());
  }

  @Test
  void testObservabilityFailureNeverSurfaces() {
    registry.register(observability("o", 0, ctx -> {
      throw new IllegalStateException("observer failed");
    }));
    registry.register(appending("m", 0, "-m"));

    ChainResult result = execute(TextNode.valueOf("x"), "o", "m");
    assertTrue(tracker.drain(Duration.ofSeconds(5)));

    assertEquals(TextNode.valueOf("x-m"), result.getPayload());
    assertTrue(result.getFindings().isEmpty());
    assertFalse(result.getMetadata().containsKey("o"));
    assertEquals(1, store.failures().size());
    assertEquals("o", store.failures().get(0).getInterceptorId());
  }

  @Test
  void testObservabilityMetadataRecordedInStore() {
    registry.register(observability("o", 0, ctx -> InterceptorResult.metadata(Map.of("seen",
        TextNode.valueOf(ctx.getPayload().asText())))));

    ChainResult result = execute(TextNode.valueOf("x"), "o");
    assertTrue(tracker.drain(Duration.ofSeconds(5)));

    assertTrue(result.getMetadata().isEmpty());
    assertEquals(TextNode.valueOf("x"), store.metadataFor("o").get("seen"));
  }

  @Test
  void testObservabilityDetachedFromCallerCancellation() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean sawCancellation = new AtomicBoolean();
    registry.register(observability("o", 0, ctx -> {
      release.await(5, TimeUnit.SECONDS);
      sawCancellation.set(ctx.getCancellation().isCancelled());
      return InterceptorResult.metadata(Map.of("done", TextNode.valueOf("yes")));
    }));
    CancellationToken token = CancellationToken.create();

    chainExecutor.execute(chainRequest(TextNode.valueOf("x"), "o"), RequestContext.empty().withCancellation(token));
    token.cancel();
    release.countDown();

    assertTrue(tracker.drain(Duration.ofSeconds(5)));
    assertFalse(sawCancellation.get());
    assertEquals(TextNode.valueOf("yes"), store.metadataFor("o").get("done"));
  }

  @Test
  void testCancelledBeforeStart() {
    AtomicBoolean ran = new AtomicBoolean();
    registry.register(mutation("m", 0, ctx -> {
      ran.set(true);
      return null;
    }));
    CancellationToken token = CancellationToken.create();
    token.cancel();

    assertThrows(CancellationException.class, () -> chainExecutor.execute(chainRequest(TextNode.valueOf("x"), "m"),
        RequestContext.empty().withCancellation(token)));
    assertFalse(ran.get());
  }

  @Test
  void testCancellationStopsRemainingMutations() {
    CancellationToken token = CancellationToken.create();
    AtomicBoolean secondRan = new AtomicBoolean();
    registry.register(mutation("first", 0, ctx -> {
      token.cancel();
      return TextNode.valueOf("y");
    }));
    registry.register(mutation("second", 1, ctx -> {
      secondRan.set(true);
      return TextNode.valueOf("z");
    }));

    assertThrows(CancellationException.class, () -> chainExecutor.execute(
        chainRequest(TextNode.valueOf("x"), "first", "second"), RequestContext.empty().withCancellation(token)));
    assertFalse(secondRan.get());
  }

  @Test
  void testCancellationInterruptsValidators() {
    CancellationToken token = CancellationToken.create();
    CountDownLatch started = new CountDownLatch(1);
    registry.register(validation("slow", 0, ctx -> {
      started.countDown();
      Thread.sleep(10_000);
      return ValidationFinding.info("finished");
    }));
    new Thread(() -> {
      try {
        if (started.await(5, TimeUnit.SECONDS)) {
          token.cancel();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }).start();

    long start = System.nanoTime();
    assertThrows(CancellationException.class, () -> chainExecutor.execute(
        chainRequest(TextNode.valueOf("x"), "slow"), RequestContext.empty().withCancellation(token)));
    assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 5);
  }

  @Test
  void testInvokeSingle() {
    registry.register(appending("m", 0, "-m"));

    InterceptorResult result = chainExecutor.invoke(request("m", InterceptorPhase.REQUEST, TextNode.valueOf("x")),
        RequestContext.empty());

    assertEquals(TextNode.valueOf("x-m"), result.getModifiedPayload());
  }

  @Test
  void testInvokeSinglePhaseMismatchIsEmpty() {
    registry.register(InterceptorDef.create(desc("r", InterceptorKind.MUTATION, 0, InterceptorPhase.RESPONSE),
        ctx -> TextNode.valueOf("changed")));

    InterceptorResult result = chainExecutor.invoke(request("r", InterceptorPhase.REQUEST, TextNode.valueOf("x")),
        RequestContext.empty());

    assertSame(InterceptorResult.empty(), result);
  }

  @Test
  void testInvokeSingleFailurePropagates() {
    registry.register(validation("v", 0, ctx -> {
      throw new IllegalStateException("boom");
    }));

    assertThrows(HandlerFailureException.class, () -> chainExecutor.invoke(
        request("v", InterceptorPhase.REQUEST, TextNode.valueOf("x")), RequestContext.empty()));
    assertThrows(UnknownInterceptorIdException.class, () -> chainExecutor.invoke(
        request("missing", InterceptorPhase.REQUEST, null), RequestContext.empty()));
  }

  private ChainResult execute(JsonNode payload, String... ids) {
    return chainExecutor.execute(chainRequest(payload, ids), RequestContext.empty());
  }

  private static ChainRequest chainRequest(JsonNode payload, String... ids) {
    return ChainRequest.builder().interceptorIds(ids).event("tools/call").phase(InterceptorPhase.REQUEST)
        .payload(payload).build();
  }
}
