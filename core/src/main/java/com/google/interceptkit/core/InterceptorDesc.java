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

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * InterceptorDesc describes the identity and execution metadata of a single
 * interceptor. Instances are immutable; this is also the shape returned when
 * interceptors are listed for discovery.
 *
 * <p>
 * An empty event set matches every event and an empty phase set matches both
 * phases.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class InterceptorDesc {

  /**
   * Execution order within a kind: priority ascending, then id ascending.
   */
  public static final Comparator<InterceptorDesc> EXECUTION_ORDER = Comparator
      .comparingInt(InterceptorDesc::getPriority).thenComparing(InterceptorDesc::getId);

  private final String id;
  private final String name;
  private final String description;
  private final InterceptorKind kind;
  private final int priority;
  private final Set<String> applicableEvents;
  private final Set<InterceptorPhase> phases;

  /**
   * Creates a new InterceptorDesc.
   *
   * @param id
   *            the unique interceptor id
   * @param name
   *            the display name, defaults to the id when null
   * @param description
   *            optional description
   * @param kind
   *            the interceptor kind
   * @param priority
   *            the priority, lower runs earlier
   * @param applicableEvents
   *            events this interceptor applies to, null or empty for all
   * @param phases
   *            phases this interceptor applies to, null or empty for both
   */
  @JsonCreator
  public InterceptorDesc(@JsonProperty("id") String id, @JsonProperty("name") String name,
      @JsonProperty("description") String description, @JsonProperty("type") InterceptorKind kind,
      @JsonProperty("priority") int priority, @JsonProperty("applicableEvents") Collection<String> applicableEvents,
      @JsonProperty("phases") @JsonAlias("applicablePhases") Collection<InterceptorPhase> phases) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("Interceptor id is required");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Interceptor type must be specified: " + id);
    }
    this.id = id;
    this.name = name != null && !name.isEmpty() ? name : id;
    this.description = description;
    this.kind = kind;
    this.priority = priority;
    this.applicableEvents = applicableEvents == null || applicableEvents.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(new LinkedHashSet<>(applicableEvents));
    this.phases = phases == null || phases.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(phases));
  }

  public static Builder builder() {
    return new Builder();
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("description")
  public String getDescription() {
    return description;
  }

  @JsonProperty("type")
  public InterceptorKind getKind() {
    return kind;
  }

  @JsonProperty("priority")
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public int getPriority() {
    return priority;
  }

  @JsonProperty("applicableEvents")
  public Set<String> getApplicableEvents() {
    return applicableEvents;
  }

  @JsonProperty("phases")
  public Set<InterceptorPhase> getPhases() {
    return phases;
  }

  /**
   * Returns true if this interceptor runs in the given phase.
   *
   * @param phase
   *            the phase
   * @return true if the phase set is empty or contains the phase
   */
  public boolean appliesToPhase(InterceptorPhase phase) {
    return phases.isEmpty() || phases.contains(phase);
  }

  /**
   * Returns true if this interceptor handles the given event.
   *
   * @param event
   *            the protocol event name, e.g. {@code tools/call}
   * @return true if the event set is empty or contains the event
   */
  public boolean appliesToEvent(String event) {
    return applicableEvents.isEmpty() || applicableEvents.contains(event);
  }

  @JsonIgnore
  public boolean appliesTo(String event, InterceptorPhase phase) {
    return appliesToEvent(event) && appliesToPhase(phase);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof InterceptorDesc)) {
      return false;
    }
    InterceptorDesc that = (InterceptorDesc) o;
    return priority == that.priority && id.equals(that.id) && name.equals(that.name)
        && Objects.equals(description, that.description) && kind == that.kind
        && applicableEvents.equals(that.applicableEvents) && phases.equals(that.phases);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, description, kind, priority, applicableEvents, phases);
  }

  @Override
  public String toString() {
    return "InterceptorDesc{id=" + id + ", kind=" + kind + ", priority=" + priority + "}";
  }

  /**
   * Builder for InterceptorDesc.
   */
  public static class Builder {
    private String id;
    private String name;
    private String description;
    private InterceptorKind kind;
    private int priority;
    private final Set<String> applicableEvents = new LinkedHashSet<>();
    private final Set<InterceptorPhase> phases = EnumSet.noneOf(InterceptorPhase.class);

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder kind(InterceptorKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder applicableEvents(String... events) {
      Collections.addAll(this.applicableEvents, events);
      return this;
    }

    public Builder applicableEvents(Collection<String> events) {
      if (events != null) {
        this.applicableEvents.addAll(events);
      }
      return this;
    }

    public Builder phases(InterceptorPhase... phases) {
      Collections.addAll(this.phases, phases);
      return this;
    }

    public Builder phases(Collection<InterceptorPhase> phases) {
      if (phases != null) {
        this.phases.addAll(phases);
      }
      return this;
    }

    public InterceptorDesc build() {
      return new InterceptorDesc(id, name, description, kind, priority, applicableEvents, phases);
    }
  }
}
