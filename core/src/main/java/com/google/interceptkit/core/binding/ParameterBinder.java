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

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.interceptkit.core.CancellationToken;
import com.google.interceptkit.core.InvocationContext;
import com.google.interceptkit.core.InvocationRequest;
import com.google.interceptkit.core.JsonUtils;
import com.google.interceptkit.core.MissingRequiredParameterException;
import com.google.interceptkit.core.ParameterBindingException;
import com.google.interceptkit.core.PayloadSerializationException;
import com.google.interceptkit.core.RequestContext;
import com.google.interceptkit.core.ServerSession;
import com.google.interceptkit.core.ServiceResolver;
import com.google.interceptkit.core.progress.ProgressEmitter;

/**
 * ParameterBinder produces the argument array for one interceptor invocation.
 *
 * <p>
 * Each parameter is resolved from the first source that applies:
 * <ol>
 * <li>well-known context values: {@link CancellationToken},
 * {@link ServiceResolver}, {@link ServerSession}, {@link ProgressEmitter},
 * {@link RequestContext}, {@link InvocationRequest} and
 * {@link InvocationContext}</li>
 * <li>the service resolver, for parameters marked as services or whose type the
 * resolver reports it can satisfy</li>
 * <li>the payload field with the parameter's name</li>
 * </ol>
 *
 * <p>
 * The request payload is never modified; payload-bound values are converted
 * copies.
 */
public class ParameterBinder {

  private static final Logger logger = LoggerFactory.getLogger(ParameterBinder.class);

  private static final Set<Class<?>> WELL_KNOWN_TYPES = Set.of(CancellationToken.class, ServiceResolver.class,
      ServerSession.class, ProgressEmitter.class, RequestContext.class, InvocationRequest.class,
      InvocationContext.class);

  /**
   * Returns true if values of this type are supplied by the invocation itself.
   *
   * @param type
   *            the parameter type
   * @return true for well-known context types
   */
  public static boolean isWellKnown(Class<?> type) {
    return WELL_KNOWN_TYPES.contains(type);
  }

  /**
   * Binds all parameters for one invocation.
   *
   * @param parameters
   *            the parameters the interceptor expects, in call order
   * @param request
   *            the invocation request
   * @param context
   *            the ambient request context
   * @return the bound arguments, in call order
   * @throws ParameterBindingException
   *             if a parameter cannot be satisfied
   * @throws PayloadSerializationException
   *             if a payload value cannot be converted to the parameter type
   */
  public Object[] bind(List<InterceptorParameter> parameters, InvocationRequest request, RequestContext context) {
    Bindings bindings = new Bindings(request, context);
    Object[] arguments = new Object[parameters.size()];
    for (int i = 0; i < parameters.size(); i++) {
      arguments[i] = bindOne(parameters.get(i), bindings);
    }
    return arguments;
  }

  private Object bindOne(InterceptorParameter parameter, Bindings bindings) {
    Class<?> type = parameter.getRawType();
    if (isWellKnown(type)) {
      return bindings.wellKnown(type);
    }

    switch (parameter.getSource()) {
      case SERVICES :
        return bindService(parameter, bindings);
      case KEYED_SERVICES :
        return bindKeyedService(parameter, bindings);
      case WHOLE_PAYLOAD :
        return bindWholePayload(parameter, bindings);
      case PAYLOAD :
        return bindPayloadField(parameter, bindings);
      case AUTO :
      default :
        if (bindings.context.getServices().canResolve(parameter.getValueClass())) {
          return bindService(parameter, bindings);
        }
        return bindPayloadField(parameter, bindings);
    }
  }

  private Object bindService(InterceptorParameter parameter, Bindings bindings) {
    Optional<Object> service = bindings.context.getServices().resolve(parameter.getValueClass());
    return serviceOrFail(parameter, bindings, service, "No service of the requested type was found: "
        + parameter.getValueClass().getName());
  }

  private Object bindKeyedService(InterceptorParameter parameter, Bindings bindings) {
    String key = parameter.getServiceKey();
    Optional<Object> service = bindings.context.getServices().resolveKeyed(parameter.getValueClass(), key);
    return serviceOrFail(parameter, bindings, service, "No service of type " + parameter.getValueClass().getName()
        + " was found for key '" + key + "'");
  }

  private Object serviceOrFail(InterceptorParameter parameter, Bindings bindings, Optional<Object> service,
      String message) {
    if (parameter.isOptional()) {
      return service;
    }
    if (service.isPresent()) {
      return service.get();
    }
    if (!parameter.isRequired()) {
      return null;
    }
    throw new ParameterBindingException(bindings.interceptorId(), parameter.getName(), message);
  }

  private Object bindWholePayload(InterceptorParameter parameter, Bindings bindings) {
    JsonNode payload = bindings.request.getPayload();
    if (payload == null || payload.isMissingNode()) {
      return absent(parameter, bindings);
    }
    return convert(parameter, bindings, payload);
  }

  private Object bindPayloadField(InterceptorParameter parameter, Bindings bindings) {
    JsonNode payload = bindings.request.getPayload();
    JsonNode value = payload != null && payload.isObject() ? payload.get(parameter.getName()) : null;
    if (value == null) {
      if (parameter.getDefaultValue() != null) {
        logger.debug("Using default value for parameter {} of {}", parameter.getName(), bindings.interceptorId());
        return convert(parameter, bindings, parameter.getDefaultValue());
      }
      if (parameter.isRequired()) {
        throw new MissingRequiredParameterException(bindings.interceptorId(), parameter.getName());
      }
      return absent(parameter, bindings);
    }
    return convert(parameter, bindings, value);
  }

  private Object absent(InterceptorParameter parameter, Bindings bindings) {
    if (parameter.isOptional()) {
      return Optional.empty();
    }
    if (parameter.getRawType().isPrimitive()) {
      throw new ParameterBindingException(bindings.interceptorId(), parameter.getName(),
          "no value available for primitive type " + parameter.getRawType().getName());
    }
    return null;
  }

  private Object convert(InterceptorParameter parameter, Bindings bindings, JsonNode value) {
    if (value.isNull()) {
      return absent(parameter, bindings);
    }
    Object converted;
    if (parameter.getValueClass() == JsonNode.class) {
      converted = value.deepCopy();
    } else {
      try {
        converted = JsonUtils.fromJsonNode(value, parameter.getValueType());
      } catch (PayloadSerializationException e) {
        throw new PayloadSerializationException("Cannot convert payload value for parameter '"
            + parameter.getName() + "' of interceptor '" + bindings.interceptorId() + "' to "
            + parameter.getValueType().getTypeName(), e.getCause(), bindings.interceptorId());
      }
    }
    return parameter.isOptional() ? Optional.ofNullable(converted) : converted;
  }

  /**
   * Per-invocation state shared by all parameters of one call.
   */
  private static final class Bindings {
    private final InvocationRequest request;
    private final RequestContext context;
    private ProgressEmitter progress;
    private InvocationRequest isolatedRequest;
    private InvocationContext invocationContext;

    Bindings(InvocationRequest request, RequestContext context) {
      this.request = request;
      this.context = context;
    }

    String interceptorId() {
      return request.getInterceptorId();
    }

    Object wellKnown(Class<?> type) {
      if (type == CancellationToken.class) {
        return context.getCancellation();
      }
      if (type == ServiceResolver.class) {
        return context.getServices();
      }
      if (type == ServerSession.class) {
        return context.getSession();
      }
      if (type == ProgressEmitter.class) {
        return progress();
      }
      if (type == RequestContext.class) {
        return context;
      }
      if (type == InvocationRequest.class) {
        return isolatedRequest();
      }
      return invocationContext();
    }

    ProgressEmitter progress() {
      if (progress == null) {
        progress = ProgressEmitter.bind(request.getProgressToken(), context.getProgressSink());
      }
      return progress;
    }

    /**
     * Returns the request with its own copy of the payload. Validators share the
     * original payload node, so no bound value may expose it.
     */
    InvocationRequest isolatedRequest() {
      if (isolatedRequest == null) {
        isolatedRequest = request.retarget(request.getInterceptorId(), JsonUtils.copy(request.getPayload()));
      }
      return isolatedRequest;
    }

    InvocationContext invocationContext() {
      if (invocationContext == null) {
        InvocationRequest isolated = isolatedRequest();
        invocationContext = new InvocationContext(isolated, isolated.getPayload(), context, progress());
      }
      return invocationContext;
    }
  }
}
