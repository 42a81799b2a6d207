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

/**
 * ServerSession identifies the server and the client session a request is
 * being served for. Interceptors may declare a parameter of this type to learn
 * who they are running for.
 */
public final class ServerSession {

  private final String serverName;
  private final String serverVersion;
  private final String sessionId;

  public ServerSession(String serverName, String serverVersion, String sessionId) {
    this.serverName = serverName;
    this.serverVersion = serverVersion;
    this.sessionId = sessionId;
  }

  public String getServerName() {
    return serverName;
  }

  public String getServerVersion() {
    return serverVersion;
  }

  /**
   * Returns the client session id.
   *
   * @return the session id, or null for sessionless transports
   */
  public String getSessionId() {
    return sessionId;
  }

  public ServerSession withSessionId(String sessionId) {
    return new ServerSession(serverName, serverVersion, sessionId);
  }

  @Override
  public String toString() {
    return serverName + "/" + serverVersion + (sessionId != null ? "#" + sessionId : "");
  }
}
