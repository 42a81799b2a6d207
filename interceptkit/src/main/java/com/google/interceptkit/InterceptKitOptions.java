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

package com.google.interceptkit;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

import com.google.interceptkit.core.ServiceResolver;
import com.google.interceptkit.core.chain.ObservationStore;

import io.opentelemetry.api.OpenTelemetry;

/**
 * InterceptKitOptions contains configuration options for InterceptKit.
 */
public class InterceptKitOptions {

  static final String ENV_WORKER_THREADS = "INTERCEPTKIT_WORKER_THREADS";
  static final String ENV_SHUTDOWN_GRACE_MS = "INTERCEPTKIT_SHUTDOWN_GRACE_MS";
  static final String ENV_PAGE_SIZE = "INTERCEPTKIT_PAGE_SIZE";
  static final String ENV_MAX_OBSERVATION_FAILURES = "INTERCEPTKIT_MAX_OBSERVATION_FAILURES";

  static final int MIN_WORKER_THREADS = 2;
  static final long DEFAULT_SHUTDOWN_GRACE_MS = 5000;
  static final int DEFAULT_PAGE_SIZE = 50;

  private final String serverName;
  private final String serverVersion;
  private final int workerThreads;
  private final Duration shutdownGracePeriod;
  private final int pageSize;
  private final int maxObservationFailures;
  private final ExecutorService executor;
  private final ServiceResolver services;
  private final OpenTelemetry openTelemetry;

  private InterceptKitOptions(Builder builder) {
    this.serverName = builder.serverName;
    this.serverVersion = builder.serverVersion;
    this.workerThreads = builder.workerThreads;
    this.shutdownGracePeriod = builder.shutdownGracePeriod;
    this.pageSize = builder.pageSize;
    this.maxObservationFailures = builder.maxObservationFailures;
    this.executor = builder.executor;
    this.services = builder.services;
    this.openTelemetry = builder.openTelemetry;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public String getServerName() {
    return serverName;
  }

  public String getServerVersion() {
    return serverVersion;
  }

  /**
   * Returns the size of the worker pool created when no executor is supplied.
   *
   * @return the number of worker threads
   */
  public int getWorkerThreads() {
    return workerThreads;
  }

  /**
   * Returns how long shutdown waits for in-flight observability tasks.
   *
   * @return the grace period
   */
  public Duration getShutdownGracePeriod() {
    return shutdownGracePeriod;
  }

  /**
   * Returns the number of descriptors per page when listing interceptors.
   *
   * @return the page size
   */
  public int getPageSize() {
    return pageSize;
  }

  /**
   * Returns the caller-supplied executor. A caller-supplied executor is not
   * shut down by InterceptKit.
   *
   * @return the executor, or null to use an internal pool
   */
  public int getMaxObservationFailures() {
    return maxObservationFailures;
  }

  public ExecutorService getExecutor() {
    return executor;
  }

  public ServiceResolver getServices() {
    return services;
  }

  /**
   * Returns the OpenTelemetry instance used for spans.
   *
   * @return the OpenTelemetry instance, or null to use the global one
   */
  public OpenTelemetry getOpenTelemetry() {
    return openTelemetry;
  }

  static int parseSetting(String value, int defaultValue, int min) {
    if (value != null) {
      try {
        return Math.max(min, Integer.parseInt(value.trim()));
      } catch (NumberFormatException e) {
        // fall through to default
      }
    }
    return Math.max(min, defaultValue);
  }

  /**
   * Builder for InterceptKitOptions.
   */
  public static class Builder {
    private String serverName = "interceptkit";
    private String serverVersion = "1.0.0";
    private int workerThreads = parseSetting(System.getenv(ENV_WORKER_THREADS),
        Runtime.getRuntime().availableProcessors(), MIN_WORKER_THREADS);
    private Duration shutdownGracePeriod = Duration.ofMillis(
        parseSetting(System.getenv(ENV_SHUTDOWN_GRACE_MS), (int) DEFAULT_SHUTDOWN_GRACE_MS, 0));
    private int pageSize = parseSetting(System.getenv(ENV_PAGE_SIZE), DEFAULT_PAGE_SIZE, 1);
    private int maxObservationFailures = parseSetting(System.getenv(ENV_MAX_OBSERVATION_FAILURES),
        ObservationStore.DEFAULT_MAX_FAILURES, 1);
    private ExecutorService executor;
    private ServiceResolver services = ServiceResolver.EMPTY;
    private OpenTelemetry openTelemetry;

    public Builder serverName(String serverName) {
      this.serverName = serverName;
      return this;
    }

    public Builder serverVersion(String serverVersion) {
      this.serverVersion = serverVersion;
      return this;
    }

    public Builder workerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
      this.shutdownGracePeriod = shutdownGracePeriod;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /**
     * Sets how many observability failure records are kept before the oldest
     * are dropped.
     *
     * @param maxObservationFailures
     *            the capacity
     * @return this builder
     */
    public Builder maxObservationFailures(int maxObservationFailures) {
      this.maxObservationFailures = maxObservationFailures;
      return this;
    }

    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public Builder services(ServiceResolver services) {
      this.services = services;
      return this;
    }

    public Builder openTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = openTelemetry;
      return this;
    }

    public InterceptKitOptions build() {
      if (workerThreads < 1) {
        throw new IllegalStateException("workerThreads must be positive");
      }
      if (pageSize < 1) {
        throw new IllegalStateException("pageSize must be positive");
      }
      if (maxObservationFailures < 1) {
        throw new IllegalStateException("maxObservationFailures must be positive");
      }
      if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
        throw new IllegalStateException("shutdownGracePeriod must not be negative");
      }
      if (services == null) {
        services = ServiceResolver.EMPTY;
      }
      return new InterceptKitOptions(this);
    }
  }
}
