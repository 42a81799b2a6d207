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

import java.lang.reflect.Type;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides the shared JSON mapper and conversion helpers used for
 * payloads and protocol messages.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws PayloadSerializationException
   *             if serialization fails
   */
  public static String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new PayloadSerializationException("Failed to serialize to JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Converts an object to a JsonNode.
   *
   * @param value
   *            the object to convert
   * @return the JsonNode
   * @throws PayloadSerializationException
   *             if conversion fails
   */
  public static JsonNode toJsonNode(Object value) {
    try {
      return objectMapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new PayloadSerializationException("Failed to convert to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws PayloadSerializationException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new PayloadSerializationException("Failed to parse JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Converts a JsonNode to the specified class.
   *
   * @param node
   *            the JsonNode
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the converted object
   * @throws PayloadSerializationException
   *             if conversion fails
   */
  public static <T> T fromJsonNode(JsonNode node, Class<T> clazz) {
    try {
      return objectMapper.treeToValue(node, clazz);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new PayloadSerializationException("Failed to convert JSON to " + clazz.getName() + ": " + e.getMessage(),
          e);
    }
  }

  /**
   * Converts a JsonNode to an arbitrary, possibly generic, Java type.
   *
   * @param node
   *            the JsonNode
   * @param type
   *            the target type
   * @return the converted object
   * @throws PayloadSerializationException
   *             if conversion fails
   */
  public static Object fromJsonNode(JsonNode node, Type type) {
    JavaType javaType = objectMapper.getTypeFactory().constructType(type);
    try {
      return objectMapper.convertValue(node, javaType);
    } catch (IllegalArgumentException e) {
      throw new PayloadSerializationException(
          "Failed to convert JSON to " + javaType.toCanonical() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns a deep copy of a node so the original is never changed by the
   * holder of the copy.
   *
   * @param node
   *            the node, may be null
   * @return the copy, or null
   */
  public static JsonNode copy(JsonNode node) {
    return node != null ? node.deepCopy() : null;
  }
}
