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

import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.interceptkit.core.*;
import com.google.interceptkit.core.chain.ChainExecutionException;
import com.google.interceptkit.core.chain.ChainExecutor;
import com.google.interceptkit.core.chain.ChainRequest;
import com.google.interceptkit.core.chain.ChainResult;

/**
 * InterceptorRequestHandler serves the interceptor protocol methods on top of
 * a registry and a chain executor. The transport decodes JSON-RPC messages and
 * hands them to {@link #handleRequest(JsonNode, RequestContext)}, or calls
 * {@link #handle(String, JsonNode, RequestContext)} directly.
 *
 * <p>
 * Errors are mapped to JSON-RPC error objects. Errors the caller can fix
 * (unknown interceptor, unbindable parameters, malformed payloads or params)
 * map to {@link ProtocolException#INVALID_PARAMS}; everything else maps to
 * {@link ProtocolException#INTERNAL_ERROR}. The error data names the error
 * code and the interceptor involved.
 */
public class InterceptorRequestHandler {

  private static final Logger logger = LoggerFactory.getLogger(InterceptorRequestHandler.class);

  private final InterceptorRegistry registry;
  private final ChainExecutor chainExecutor;
  private final NotificationSender notifications;
  private final ServerSession session;
  private final int pageSize;

  public InterceptorRequestHandler(InterceptorRegistry registry, ChainExecutor chainExecutor,
      NotificationSender notifications, ServerSession session, int pageSize) {
    this.registry = registry;
    this.chainExecutor = chainExecutor;
    this.notifications = notifications;
    this.session = session;
    this.pageSize = pageSize;
  }

  /**
   * Returns the capabilities to advertise: {@code {"interceptors":
   * {"listChanged": true}}}.
   *
   * @return the capabilities object
   */
  public ObjectNode getCapabilities() {
    ObjectNode capabilities = JsonNodeFactory.instance.objectNode();
    capabilities.set("interceptors", JsonUtils.toJsonNode(new InterceptorsCapability(true)));
    return capabilities;
  }

  /**
   * Sends {@link ProtocolMethods#NOTIFICATION_LIST_CHANGED}. Registered as a
   * registry listener.
   */
  public void notifyListChanged() {
    notifications.send(ProtocolMethods.NOTIFICATION_LIST_CHANGED, JsonNodeFactory.instance.objectNode());
  }

  /**
   * Handles one JSON-RPC request message and returns the response message.
   *
   * @param message
   *            the request: {@code {jsonrpc, id, method, params}}
   * @param context
   *            the request context
   * @return the response: {@code {jsonrpc, id, result}} or
   *         {@code {jsonrpc, id, error}}
   */
  public ObjectNode handleRequest(JsonNode message, RequestContext context) {
    ObjectNode response = JsonNodeFactory.instance.objectNode();
    response.put("jsonrpc", "2.0");
    JsonNode id = message == null ? null : message.get("id");
    response.set("id", id == null ? JsonNodeFactory.instance.nullNode() : id);

    try {
      if (message == null || !message.hasNonNull("method") || !message.get("method").isTextual()) {
        throw new ProtocolException(ProtocolException.INVALID_REQUEST, "Invalid request: missing method");
      }
      JsonNode result = handle(message.get("method").asText(), message.get("params"), context);
      response.set("result", result);
    } catch (RuntimeException e) {
      ProtocolException error = toProtocolException(e);
      if (error.getCode() == ProtocolException.INTERNAL_ERROR) {
        logger.error("Error handling request {}", id, e);
      } else {
        logger.debug("Request {} rejected: {}", id, error.getMessage());
      }
      response.set("error", error.toErrorObject());
    }
    return response;
  }

  /**
   * Handles one protocol method.
   *
   * @param method
   *            the method name
   * @param params
   *            the method parameters, may be null
   * @param context
   *            the request context
   * @return the method result
   * @throws ProtocolException
   *             if the method is unknown or the params are malformed
   */
  public JsonNode handle(String method, JsonNode params, RequestContext context) {
    RequestContext effective = withDefaults(context);
    switch (method) {
      case ProtocolMethods.LIST_INTERCEPTORS :
        return JsonUtils.toJsonNode(listInterceptors(parse(params, ListInterceptorsParams.class)));
      case ProtocolMethods.INVOKE_INTERCEPTOR :
        return JsonUtils.toJsonNode(invoke(parse(params, InvokeInterceptorParams.class), effective));
      case ProtocolMethods.EXECUTE_CHAIN :
        return JsonUtils.toJsonNode(executeChain(parse(params, ExecuteChainParams.class), effective));
      default :
        throw new ProtocolException(ProtocolException.METHOD_NOT_FOUND, "Method not found: " + method);
    }
  }

  public ListInterceptorsResult listInterceptors(ListInterceptorsParams params) {
    String cursor = params == null ? null : params.getCursor();
    return ListInterceptorsResult.from(registry.list(cursor, pageSize));
  }

  public InvokeInterceptorResult invoke(InvokeInterceptorParams params, RequestContext context) {
    if (params == null) {
      throw invalidParams("Missing params");
    }
    requireParam(params.getInterceptorId(), "interceptorId");
    requireParam(params.getEvent(), "event");
    requireParam(params.getPhase(), "phase");

    InvocationRequest request = InvocationRequest.builder().interceptorId(params.getInterceptorId())
        .event(params.getEvent()).phase(params.getPhase()).payload(params.getPayload())
        .progressToken(progressToken(params.getMeta())).build();
    InterceptorResult result = chainExecutor.invoke(request, context);
    return InvokeInterceptorResult.from(result);
  }

  public ExecuteChainResult executeChain(ExecuteChainParams params, RequestContext context) {
    if (params == null) {
      throw invalidParams("Missing params");
    }
    requireParam(params.getInterceptorIds(), "interceptorIds");
    if (params.getInterceptorIds().contains(null)) {
      throw invalidParams("interceptorIds must not contain null");
    }
    requireParam(params.getEvent(), "event");
    requireParam(params.getPhase(), "phase");

    ChainRequest request = ChainRequest.builder().interceptorIds(params.getInterceptorIds())
        .event(params.getEvent()).phase(params.getPhase()).payload(params.getPayload())
        .progressToken(progressToken(params.getMeta())).build();
    ChainResult result = chainExecutor.execute(request, context);
    return ExecuteChainResult.from(result);
  }

  private RequestContext withDefaults(RequestContext context) {
    RequestContext effective = context == null ? RequestContext.empty() : context;
    if (effective.getSession() == null) {
      effective = effective.withSession(session);
    }
    if (effective.getProgressSink() == null) {
      effective = effective.withProgressSink(notification -> notifications
          .send(ProtocolMethods.NOTIFICATION_PROGRESS, JsonUtils.toJsonNode(notification)));
    }
    return effective;
  }

  private static <T> T parse(JsonNode params, Class<T> type) {
    if (params == null || params.isNull()) {
      return null;
    }
    if (!params.isObject()) {
      throw invalidParams("Params must be an object");
    }
    return JsonUtils.fromJsonNode(params, type);
  }

  private static Object progressToken(RequestMeta meta) {
    return meta == null ? null : meta.getProgressToken();
  }

  private static void requireParam(Object value, String name) {
    if (value == null || (value instanceof String && ((String) value).isEmpty())) {
      throw invalidParams("Missing required parameter: " + name);
    }
  }

  private static ProtocolException invalidParams(String message) {
    return new ProtocolException(ProtocolException.INVALID_PARAMS, message);
  }

  /**
   * Maps an exception raised while handling a request to a protocol error.
   *
   * @param e
   *            the exception
   * @return the protocol error
   */
  public static ProtocolException toProtocolException(Throwable e) {
    if (e instanceof ProtocolException) {
      return (ProtocolException) e;
    }
    if (e instanceof InterceptorException) {
      InterceptorException ie = (InterceptorException) e;
      ObjectNode data = JsonNodeFactory.instance.objectNode();
      if (ie.getErrorCode() != null) {
        data.put("errorCode", ie.getErrorCode().name());
      }
      if (ie.getInterceptorId() != null) {
        data.put("interceptorId", ie.getInterceptorId());
      }
      if (ie instanceof ChainExecutionException) {
        ChainResult partial = ((ChainExecutionException) ie).getPartialResult();
        if (partial != null) {
          data.set("partialResult", JsonUtils.toJsonNode(ExecuteChainResult.from(partial)));
        }
      }
      int code = ie.getErrorCode() != null && ie.getErrorCode().isCallerError()
          ? ProtocolException.INVALID_PARAMS
          : ProtocolException.INTERNAL_ERROR;
      return new ProtocolException(code, ie.getMessage(), data, ie);
    }
    if (e instanceof IllegalArgumentException) {
      return new ProtocolException(ProtocolException.INVALID_PARAMS, e.getMessage(), null, e);
    }
    if (e instanceof CancellationException) {
      return new ProtocolException(ProtocolException.REQUEST_CANCELLED, "Request cancelled", null, e);
    }
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return new ProtocolException(ProtocolException.INTERNAL_ERROR, "Internal error: " + message, null, e);
  }
}
