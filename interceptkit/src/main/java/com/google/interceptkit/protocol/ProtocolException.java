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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * ProtocolException is an error returned to the client as a JSON-RPC error
 * object.
 */
public class ProtocolException extends RuntimeException {

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;
  public static final int REQUEST_CANCELLED = -32800;

  private final int code;
  private final JsonNode data;

  public ProtocolException(int code, String message) {
    this(code, message, null, null);
  }

  public ProtocolException(int code, String message, JsonNode data, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.data = data;
  }

  public int getCode() {
    return code;
  }

  /**
   * Returns the structured error data.
   *
   * @return the data, or null
   */
  public JsonNode getData() {
    return data;
  }

  /**
   * Returns the JSON-RPC error object: {@code {code, message, data?}}.
   *
   * @return the error object
   */
  public ObjectNode toErrorObject() {
    ObjectNode error = JsonNodeFactory.instance.objectNode();
    error.put("code", code);
    error.put("message", getMessage());
    if (data != null) {
      error.set("data", data);
    }
    return error;
  }
}
