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

package com.google.promptbridge.ai.telemetry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import com.google.promptbridge.ai.InvocationDescriptor;
import com.google.promptbridge.core.telemetry.EventKind;

/**
 * TelemetryConfig controls which telemetry events a call publishes.
 *
 * <p>
 * Recognised options:
 * <ul>
 * <li>{@code enabled} - master switch, default true</li>
 * <li>{@code sampleRate} - fraction of calls that publish events, 0.0 to 1.0,
 * default 1.0</li>
 * <li>{@code events} - which of start, stop and exception are published,
 * default all</li>
 * <li>{@code prefix} - event name prefix, default {@code [promptbridge]}</li>
 * <li>{@code metadata} - opt-in metadata fields ({@code llm_client},
 * {@code stream})</li>
 * <li>{@code collectorName} - fixed collector name, or a function of the
 * descriptor</li>
 * </ul>
 *
 * <p>
 * A usage collector is created for every call whatever these settings say;
 * they only govern event publication.
 */
public final class TelemetryConfig {

  public static final List<String> DEFAULT_PREFIX = List.of("promptbridge");

  public static final String METADATA_LLM_CLIENT = "llm_client";
  public static final String METADATA_STREAM = "stream";

  private static final Set<String> KNOWN_METADATA = Set.of(METADATA_LLM_CLIENT, METADATA_STREAM);

  private static final TelemetryConfig DEFAULTS = builder().build();

  private final boolean enabled;
  private final double sampleRate;
  private final Set<EventKind> events;
  private final List<String> prefix;
  private final Set<String> metadata;
  private final Function<InvocationDescriptor, String> collectorName;

  private TelemetryConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.sampleRate = builder.sampleRate;
    this.events = Collections.unmodifiableSet(EnumSet.copyOf(builder.events));
    this.prefix = List.copyOf(builder.prefix);
    this.metadata = Collections.unmodifiableSet(new LinkedHashSet<>(builder.metadata));
    this.collectorName = builder.collectorName;
  }

  /**
   * Returns the default configuration: enabled, always sampled, every event
   * kind, default prefix.
   *
   * @return the defaults
   */
  public static TelemetryConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Returns a configuration that publishes nothing.
   *
   * @return the disabled configuration
   */
  public static TelemetryConfig disabled() {
    return builder().enabled(false).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder seeded with this configuration's values.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder().enabled(enabled).sampleRate(sampleRate).events(events).prefix(prefix)
        .metadata(metadata);
    builder.collectorName = collectorName;
    return builder;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public double getSampleRate() {
    return sampleRate;
  }

  public Set<EventKind> getEvents() {
    return events;
  }

  /**
   * Returns whether events of the given kind are published.
   *
   * @param kind
   *            the event kind
   * @return true if the kind is enabled
   */
  public boolean emits(EventKind kind) {
    return events.contains(kind);
  }

  public List<String> getPrefix() {
    return prefix;
  }

  public Set<String> getMetadata() {
    return metadata;
  }

  /**
   * Returns whether an opt-in metadata field is included in events.
   *
   * @param field
   *            the field name
   * @return true if requested
   */
  public boolean includesMetadata(String field) {
    return metadata.contains(field);
  }

  /**
   * Returns the collector naming function.
   *
   * @return the function, or null when the default name is used
   */
  public Function<InvocationDescriptor, String> getCollectorName() {
    return collectorName;
  }

  @Override
  public String toString() {
    return "TelemetryConfig{enabled=" + enabled + ", sampleRate=" + sampleRate + ", events=" + events
        + ", prefix=" + prefix + "}";
  }

  /**
   * Builder for TelemetryConfig.
   */
  public static class Builder {
    private boolean enabled = true;
    private double sampleRate = 1.0;
    private Set<EventKind> events = EnumSet.allOf(EventKind.class);
    private List<String> prefix = DEFAULT_PREFIX;
    private Set<String> metadata = new LinkedHashSet<>();
    private Function<InvocationDescriptor, String> collectorName;

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder sampleRate(double sampleRate) {
      if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
        throw new IllegalArgumentException("Sample rate must be between 0.0 and 1.0, got " + sampleRate);
      }
      this.sampleRate = sampleRate;
      return this;
    }

    public Builder events(Set<EventKind> events) {
      this.events = events == null || events.isEmpty() ? EnumSet.noneOf(EventKind.class) : EnumSet.copyOf(events);
      return this;
    }

    public Builder events(EventKind... events) {
      EnumSet<EventKind> set = EnumSet.noneOf(EventKind.class);
      Collections.addAll(set, events);
      this.events = set;
      return this;
    }

    public Builder prefix(List<String> prefix) {
      if (prefix == null || prefix.isEmpty()) {
        throw new IllegalArgumentException("Event prefix must not be empty");
      }
      this.prefix = List.copyOf(prefix);
      return this;
    }

    public Builder prefix(String... prefix) {
      return prefix(List.of(prefix));
    }

    public Builder metadata(Set<String> fields) {
      this.metadata = new LinkedHashSet<>();
      if (fields != null) {
        for (String field : fields) {
          addMetadata(field);
        }
      }
      return this;
    }

    public Builder metadata(String... fields) {
      this.metadata = new LinkedHashSet<>();
      for (String field : fields) {
        addMetadata(field);
      }
      return this;
    }

    private void addMetadata(String field) {
      if (!KNOWN_METADATA.contains(field)) {
        throw new IllegalArgumentException("Unknown telemetry metadata field: " + field);
      }
      this.metadata.add(field);
    }

    /**
     * Uses a fixed collector name for every call.
     *
     * @param name
     *            the name
     * @return this builder
     */
    public Builder collectorName(String name) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Collector name must not be empty");
      }
      this.collectorName = descriptor -> name;
      return this;
    }

    /**
     * Derives the collector name from the call being made.
     *
     * @param nameFn
     *            the naming function
     * @return this builder
     */
    public Builder collectorName(Function<InvocationDescriptor, String> nameFn) {
      this.collectorName = nameFn;
      return this;
    }

    public TelemetryConfig build() {
      return new TelemetryConfig(this);
    }
  }
}
