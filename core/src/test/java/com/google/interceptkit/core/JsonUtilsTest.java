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

import java.lang.reflect.Type;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Unit tests for JsonUtils.
 */
class JsonUtilsTest {

  public static class Message {
    public String text;
    public int count;
  }

  @Test
  void testParseAndConvert() {
    JsonNode node = JsonUtils.parseJson("{\"text\":\"hi\",\"count\":2,\"extra\":true}");

    Message message = JsonUtils.fromJsonNode(node, Message.class);

    assertEquals("hi", message.text);
    assertEquals(2, message.count);
  }

  @Test
  void testConvertGenericType() {
    Type type = new TypeReference<List<Map<String, Integer>>>() {
    }.getType();

    Object value = JsonUtils.fromJsonNode(JsonUtils.parseJson("[{\"a\":1}]"), type);

    assertEquals(List.of(Map.of("a", 1)), value);
  }

  @Test
  void testInvalidJsonRejected() {
    PayloadSerializationException e = assertThrows(PayloadSerializationException.class,
        () -> JsonUtils.parseJson("{not json"));

    assertEquals(InterceptorErrorCode.SERIALIZATION_ERROR, e.getErrorCode());
  }

  @Test
  void testConversionFailureRejected() {
    assertThrows(PayloadSerializationException.class,
        () -> JsonUtils.fromJsonNode(JsonUtils.parseJson("{\"count\":\"many\"}"), Message.class));
  }

  @Test
  void testInstantWrittenAsText() {
    String json = JsonUtils.toJson(Map.of("at", Instant.parse("2024-01-02T03:04:05Z")));

    assertEquals("{\"at\":\"2024-01-02T03:04:05Z\"}", json);
  }

  @Test
  void testCopyIsIndependent() {
    ObjectNode original = (ObjectNode) JsonUtils.parseJson("{\"a\":{\"b\":1}}");

    JsonNode copy = JsonUtils.copy(original);
    ((ObjectNode) original.get("a")).put("b", 2);

    assertEquals(1, copy.get("a").get("b").asInt());
    assertNull(JsonUtils.copy(null));
  }
}
