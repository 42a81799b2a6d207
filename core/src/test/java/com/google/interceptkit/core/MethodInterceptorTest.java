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

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.interceptkit.core.binding.DefaultValue;
import com.google.interceptkit.core.binding.Payload;

/**
 * Unit tests for MethodInterceptor.
 */
class MethodInterceptorTest {

  @Test
  void testDeriveId() {
    assertEquals("redact_emails", MethodInterceptor.deriveId("redactEmailsAsync"));
    assertEquals("validate", MethodInterceptor.deriveId("validate"));
    assertEquals("log_request2_x", MethodInterceptor.deriveId("logRequest2X"));
    assertEquals("async", MethodInterceptor.deriveId("Async"));
  }

  @Test
  void testDescDerivedFromAnnotation() throws Exception {
    Method method = TextInterceptors.class.getDeclaredMethod("checkLengthAsync", String.class, int.class);

    InterceptorDesc desc = MethodInterceptor.deriveDesc(method, null);

    assertEquals("check_length", desc.getId());
    assertEquals("check_length", desc.getName());
    assertEquals("Rejects long text", desc.getDescription());
    assertEquals(InterceptorKind.VALIDATION, desc.getKind());
    assertEquals(2, desc.getPriority());
    assertTrue(desc.appliesTo("tools/call", InterceptorPhase.REQUEST));
    assertFalse(desc.appliesTo("tools/call", InterceptorPhase.RESPONSE));
  }

  @Test
  void testExplicitDescWins() throws Exception {
    Method method = TextInterceptors.class.getDeclaredMethod("notAnnotated");
    InterceptorDesc desc = InterceptorFixtures.desc("explicit", InterceptorKind.OBSERVABILITY, 0);

    MethodInterceptor interceptor = MethodInterceptor.create(method, new TextInterceptors(), desc);

    assertSame(desc, interceptor.getDesc());
  }

  @Test
  void testMissingAnnotationRejected() throws Exception {
    Method method = TextInterceptors.class.getDeclaredMethod("notAnnotated");

    assertThrows(IllegalArgumentException.class, () -> MethodInterceptor.create(method, new TextInterceptors(),
        null));
  }

  @Test
  void testInstanceMethodRequiresTarget() throws Exception {
    Method method = TextInterceptors.class.getDeclaredMethod("notAnnotated");
    InterceptorDesc desc = InterceptorFixtures.desc("explicit", InterceptorKind.OBSERVABILITY, 0);

    assertThrows(IllegalArgumentException.class, () -> MethodInterceptor.create(method, (Object) null, desc));
  }

  @Test
  void testForAnnotatedMethods() {
    List<MethodInterceptor> interceptors = MethodInterceptor.forAnnotatedMethods(new TextInterceptors());

    List<String> ids = new ArrayList<>();
    for (MethodInterceptor interceptor : interceptors) {
      ids.add(interceptor.getId());
    }
    assertEquals(List.of("check_length", "shout", "upper_case"), ids);
  }

  @Test
  void testInvokeBindsPayloadByParameterName() throws Exception {
    InvocationEngine engine = new InvocationEngine();
    MethodInterceptor interceptor = MethodInterceptor.create(
        TextInterceptors.class.getDeclaredMethod("checkLengthAsync", String.class, int.class),
        new TextInterceptors(), null);
    ObjectNode payload = JsonUtils.getObjectMapper().createObjectNode().put("text", "a long sentence");

    InterceptorResult result = engine.invoke(interceptor,
        InterceptorFixtures.request(interceptor.getId(), InterceptorPhase.REQUEST, payload), RequestContext.empty());

    assertEquals(1, result.getFindings().size());
    assertEquals("$.text", result.getFindings().get(0).getPath());
  }

  @Test
  void testStaticMethod() throws Exception {
    InvocationEngine engine = new InvocationEngine();
    MethodInterceptor interceptor = MethodInterceptor.create(
        TextInterceptors.class.getDeclaredMethod("upperCase", JsonNode.class), (Object) null, null);
    ObjectNode payload = JsonUtils.getObjectMapper().createObjectNode().put("text", "hi");

    InterceptorResult result = engine.invoke(interceptor,
        InterceptorFixtures.request(interceptor.getId(), InterceptorPhase.RESPONSE, payload), RequestContext.empty());

    assertEquals("HI", result.getModifiedPayload().get("text").asText());
    assertEquals("hi", payload.get("text").asText());
  }

  @Test
  void testPerCallTargetCreatedAndClosed() {
    AtomicInteger created = new AtomicInteger();
    List<ScopedInterceptors> instances = new ArrayList<>();
    List<MethodInterceptor> interceptors = MethodInterceptor.forAnnotatedMethods(ScopedInterceptors.class,
        context -> {
          created.incrementAndGet();
          ScopedInterceptors instance = new ScopedInterceptors();
          instances.add(instance);
          return instance;
        });
    InvocationEngine engine = new InvocationEngine();
    MethodInterceptor tag = interceptors.get(0);

    engine.invoke(tag, InterceptorFixtures.request(tag.getId(), InterceptorPhase.REQUEST, null),
        RequestContext.empty());
    engine.invoke(tag, InterceptorFixtures.request(tag.getId(), InterceptorPhase.REQUEST, null),
        RequestContext.empty());

    assertEquals(2, created.get());
    assertTrue(instances.get(0).closed);
    assertTrue(instances.get(1).closed);
  }

  @Test
  void testExceptionFromMethodUnwrapped() throws Exception {
    InvocationEngine engine = new InvocationEngine();
    MethodInterceptor interceptor = MethodInterceptor.create(
        TextInterceptors.class.getDeclaredMethod("shout", String.class), new TextInterceptors(), null);
    ObjectNode payload = JsonUtils.getObjectMapper().createObjectNode().put("text", "");

    HandlerFailureException e = assertThrows(HandlerFailureException.class, () -> engine.invoke(interceptor,
        InterceptorFixtures.request("shout", InterceptorPhase.REQUEST, payload), RequestContext.empty()));

    assertTrue(e.getCause() instanceof IllegalArgumentException);
    assertEquals("Interceptor 'shout' failed: text must not be empty", e.getMessage());
  }

  static class TextInterceptors {

    @InterceptorMethod(kind = InterceptorKind.VALIDATION, description = "Rejects long text", priority = 2,
        phases = InterceptorPhase.REQUEST)
    CompletionStage<List<ValidationFinding>> checkLengthAsync(String text, @DefaultValue("10") int maxLength) {
      List<ValidationFinding> findings = new ArrayList<>();
      if (text.length() > maxLength) {
        findings.add(ValidationFinding.error("Text exceeds " + maxLength + " characters", "$.text"));
      }
      return CompletableFuture.completedFuture(findings);
    }

    @InterceptorMethod(kind = InterceptorKind.MUTATION)
    static JsonNode upperCase(@Payload JsonNode payload) {
      ObjectNode copy = (ObjectNode) payload;
      copy.put("text", copy.get("text").asText().toUpperCase(java.util.Locale.ROOT));
      return copy;
    }

    @InterceptorMethod(kind = InterceptorKind.OBSERVABILITY)
    void shout(String text) {
      if (text.isEmpty()) {
        throw new IllegalArgumentException("text must not be empty");
      }
    }

    void notAnnotated() {
    }
  }

  static class ScopedInterceptors implements AutoCloseable {
    boolean closed;

    @InterceptorMethod(id = "tag", kind = InterceptorKind.OBSERVABILITY)
    void tag() {
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
