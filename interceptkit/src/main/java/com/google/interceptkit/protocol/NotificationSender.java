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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * NotificationSender pushes server-initiated notifications to connected
 * clients. It is implemented by the transport hosting the handler.
 */
@FunctionalInterface
public interface NotificationSender {

  /**
   * A sender that only logs notifications.
   */
  NotificationSender LOGGING = new NotificationSender() {
    private final Logger logger = LoggerFactory.getLogger(NotificationSender.class);

    @Override
    public void send(String method, JsonNode params) {
      logger.debug("No transport attached; dropping notification {}", method);
    }
  };

  /**
   * Sends a notification.
   *
   * @param method
   *            the notification method, e.g.
   *            {@link ProtocolMethods#NOTIFICATION_LIST_CHANGED}
   * @param params
   *            the notification parameters, may be null
   */
  void send(String method, JsonNode params);
}
