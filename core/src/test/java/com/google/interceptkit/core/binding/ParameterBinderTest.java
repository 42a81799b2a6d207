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

package com.google.interceptkit.core.binding;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.interceptkit.core.*;
import com.google.interceptkit.core.progress.ProgressEmitter;
import com.google.interceptkit.core.progress.ProgressNotification;

/**
 * Unit tests for ParameterBinder.
 */
class ParameterBinderTest {

  private ParameterBinder binder;
  private ObjectNode payload;

  @BeforeEach
  void setUp() {
    binder = new ParameterBinder();
    payload = JsonUtils.getObjectMapper().createObjectNode();
    payload.put("text", "hello");
    payload.put("count", 3);
    payload.putObject("address").put("city", "Zurich");
  }

  @Test
  void testBindsPayloadFieldsByName() {
    Object[] args = bind(List.of(InterceptorParameter.of("text", String.class),
        InterceptorParameter.of("count", int.class), InterceptorParameter.of("address", Address.class)),
        RequestContext.empty());

    assertEquals("hello", args[0]);
    assertEquals(3, args[1]);
    assertEquals("Zurich", ((Address) args[2]).city);
  }

  @Test
  void testMissingRequiredParameter() {
    MissingRequiredParameterException e = assertThrows(MissingRequiredParameterException.class,
        () -> bind(List.of(InterceptorParameter.of("absent", String.class)), RequestContext.empty()));

    assertEquals("absent", e.getParameterName());
    assertEquals("v", e.getInterceptorId());
    assertEquals(InterceptorErrorCode.MISSING_REQUIRED_PARAMETER, e.getErrorCode());
  }

  @Test
  void testDefaultValueUsedWhenAbsent() {
    InterceptorParameter limit = InterceptorParameter.builder().name("limit").type(int.class)
        .defaultValue(JsonUtils.parseJson("10")).build();

    Object[] args = bind(List.of(limit), RequestContext.empty());

    assertEquals(10, args[0]);
  }

  @Test
  void testOptionalParameter() {
    Object[] args = bind(List.of(InterceptorParameter.of("text", Optional.class),
        InterceptorParameter.builder().name("absent").type(Optional.class).build()), RequestContext.empty());

    assertEquals(Optional.of("hello"), args[0]);
    assertEquals(Optional.empty(), args[1]);
  }

  @Test
  void testConversionFailureNamesInterceptor() {
    PayloadSerializationException e = assertThrows(PayloadSerializationException.class,
        () -> bind(List.of(InterceptorParameter.of("address", int.class)), RequestContext.empty()));

    assertEquals("v", e.getInterceptorId());
    assertTrue(e.getMessage().contains("address"));
  }

  @Test
  void testJsonNodeParameterIsCopy() {
    Object[] args = bind(List.of(InterceptorParameter.of("address", JsonNode.class)), RequestContext.empty());

    ((ObjectNode) args[0]).put("city", "Geneva");

    assertEquals("Zurich", payload.get("address").get("city").asText());
  }

  @Test
  void testWellKnownValues() {
    CancellationToken token = CancellationToken.create();
    ServerSession session = new ServerSession("server", "1.0", "session-1");
    RequestContext context = RequestContext.builder().cancellation(token).session(session).build();

    Object[] args = bind(List.of(InterceptorParameter.of("token", CancellationToken.class),
        InterceptorParameter.of("session", ServerSession.class),
        InterceptorParameter.of("services", ServiceResolver.class),
        InterceptorParameter.of("progress", ProgressEmitter.class),
        InterceptorParameter.of("context", RequestContext.class)), context);

    assertSame(token, args[0]);
    assertSame(session, args[1]);
    assertSame(ServiceResolver.EMPTY, args[2]);
    assertSame(ProgressEmitter.NOOP, args[3]);
    assertSame(context, args[4]);
  }

  @Test
  void testInvocationContextHoldsPayloadCopy() {
    Object[] args = bind(List.of(InterceptorParameter.of("ctx", InvocationContext.class)), RequestContext.empty());

    InvocationContext ctx = (InvocationContext) args[0];
    ((ObjectNode) ctx.getPayload()).put("text", "changed");

    assertEquals("v", ctx.getInterceptorId());
    assertEquals("hello", payload.get("text").asText());
  }

  @Test
  void testInvocationRequestHoldsPayloadCopy() {
    Object[] args = bind(List.of(InterceptorParameter.of("request", InvocationRequest.class),
        InterceptorParameter.of("ctx", InvocationContext.class)), RequestContext.empty());

    InvocationRequest bound = (InvocationRequest) args[0];
    ((ObjectNode) bound.getPayload()).put("text", "changed");

    assertEquals("v", bound.getInterceptorId());
    assertEquals("hello", payload.get("text").asText());
    assertSame(bound, ((InvocationContext) args[1]).getRequest());
  }

  @Test
  void testInvocationContextRequestDoesNotExposeOriginal() {
    Object[] args = bind(List.of(InterceptorParameter.of("ctx", InvocationContext.class)), RequestContext.empty());

    ((ObjectNode) ((InvocationContext) args[0]).getRequest().getPayload()).put("text", "changed");

    assertEquals("hello", payload.get("text").asText());
  }

  @Test
  void testProgressEmitterBoundToToken() {
    List<ProgressNotification> sent = new ArrayList<>();
    RequestContext context = RequestContext.builder().progressSink(sent::add).build();
    InvocationRequest request = InvocationRequest.builder().interceptorId("v").event("tools/call")
        .phase(InterceptorPhase.REQUEST).payload(payload).progressToken("tok-1").build();

    Object[] args = binder.bind(List.of(InterceptorParameter.of("progress", ProgressEmitter.class)), request,
        context);
    ((ProgressEmitter) args[0]).report(1, 2.0, "halfway");

    assertEquals(1, sent.size());
    assertEquals("tok-1", sent.get(0).getProgressToken());
    assertEquals(2.0, sent.get(0).getTotal().doubleValue());
    assertEquals("halfway", sent.get(0).getMessage());
  }

  @Test
  void testServiceResolvedWhenResolverKnowsType() {
    Greeter greeter = new Greeter();
    RequestContext context = new RequestContext(MapServiceResolver.builder().register(Greeter.class, greeter).build());

    Object[] args = bind(List.of(InterceptorParameter.of("greeter", Greeter.class)), context);

    assertSame(greeter, args[0]);
  }

  @Test
  void testExplicitServiceMissing() {
    InterceptorParameter param = InterceptorParameter.builder().name("text").type(Greeter.class)
        .source(ParameterSource.SERVICES).build();

    ParameterBindingException e = assertThrows(ParameterBindingException.class,
        () -> bind(List.of(param), RequestContext.empty()));

    assertEquals("text", e.getParameterName());
    assertEquals(InterceptorErrorCode.PARAMETER_BINDING_FAILURE, e.getErrorCode());
  }

  @Test
  void testKeyedService() {
    Greeter formal = new Greeter();
    RequestContext context = new RequestContext(
        MapServiceResolver.builder().registerKeyed(Greeter.class, "formal", formal).build());
    InterceptorParameter keyed = InterceptorParameter.builder().name("greeter").type(Greeter.class)
        .source(ParameterSource.KEYED_SERVICES).serviceKey("formal").build();
    InterceptorParameter byName = InterceptorParameter.builder().name("formal").type(Greeter.class)
        .source(ParameterSource.KEYED_SERVICES).build();

    Object[] args = bind(List.of(keyed, byName), context);

    assertSame(formal, args[0]);
    assertSame(formal, args[1]);
  }

  @Test
  void testAnnotatedMethodParameters() throws Exception {
    Method method = Annotated.class.getDeclaredMethod("handle", String.class, Optional.class, Greeter.class,
        JsonNode.class, int.class);
    List<InterceptorParameter> params = new ArrayList<>();
    for (java.lang.reflect.Parameter parameter : method.getParameters()) {
      params.add(InterceptorParameter.fromReflection(parameter));
    }
    Greeter greeter = new Greeter();
    RequestContext context = new RequestContext(MapServiceResolver.builder().register(Greeter.class, greeter).build());

    Object[] args = bind(params, context);

    assertEquals("hello", args[0]);
    assertEquals(Optional.empty(), args[1]);
    assertSame(greeter, args[2]);
    assertEquals(payload, args[3]);
    assertEquals(25, args[4]);
  }

  @Test
  void testPayloadIsNotModified() {
    JsonNode before = payload.deepCopy();

    bind(List.of(InterceptorParameter.of("address", Address.class), InterceptorParameter.of("ctx",
        InvocationContext.class)), RequestContext.empty());

    assertEquals(before, payload);
  }

  @Test
  void testIsWellKnown() {
    assertTrue(ParameterBinder.isWellKnown(CancellationToken.class));
    assertTrue(ParameterBinder.isWellKnown(InvocationContext.class));
    assertFalse(ParameterBinder.isWellKnown(String.class));
  }

  private Object[] bind(List<InterceptorParameter> parameters, RequestContext context) {
    InvocationRequest request = InvocationRequest.builder().interceptorId("v").event("tools/call")
        .phase(InterceptorPhase.REQUEST).payload(payload).build();
    return binder.bind(parameters, request, context);
  }

  static class Address {
    public String city;
  }

  static class Greeter {
  }

  static class Annotated {
    @SuppressWarnings("unused")
    Object handle(@PayloadProperty("text") String message, Optional<String> note, @FromServices Greeter greeter,
        @Payload JsonNode whole, @DefaultValue("25") int limit) {
      return null;
    }
  }
}
