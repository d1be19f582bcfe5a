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

package com.google.promptbridge.core.telemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TelemetryEvent is an immutable record published to an {@link EventBus}.
 *
 * <p>
 * The event name is the configured prefix followed by {@code call} and the
 * event kind, e.g. {@code [promptbridge, call, stop]}. Measurements carry
 * numeric values (timestamps, durations in nanoseconds, token counts) and
 * metadata carries identity and diagnostic fields.
 */
public final class TelemetryEvent {

  private final List<String> name;
  private final EventKind kind;
  private final Map<String, Object> measurements;
  private final Map<String, Object> metadata;

  /**
   * Creates a new TelemetryEvent.
   *
   * @param name
   *            the full event name
   * @param kind
   *            the event kind
   * @param measurements
   *            the measurements, copied
   * @param metadata
   *            the metadata, copied
   */
  public TelemetryEvent(List<String> name, EventKind kind, Map<String, Object> measurements,
      Map<String, Object> metadata) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Event name is required");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Event kind is required");
    }
    this.name = List.copyOf(name);
    this.kind = kind;
    this.measurements = Collections
        .unmodifiableMap(new LinkedHashMap<>(measurements != null ? measurements : Map.of()));
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata != null ? metadata : Map.of()));
  }

  /**
   * Builds the event name for the given prefix and kind.
   *
   * @param prefix
   *            the event name prefix
   * @param kind
   *            the event kind
   * @return the event name
   */
  public static List<String> eventName(List<String> prefix, EventKind kind) {
    List<String> name = new ArrayList<>(prefix);
    name.add("call");
    name.add(kind.getValue());
    return List.copyOf(name);
  }

  public List<String> getName() {
    return name;
  }

  public EventKind getKind() {
    return kind;
  }

  public Map<String, Object> getMeasurements() {
    return measurements;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /**
   * Returns the event name joined with dots, e.g. {@code promptbridge.call.stop}.
   *
   * @return the dotted event name
   */
  public String getDottedName() {
    return String.join(".", name);
  }

  @Override
  public String toString() {
    return "TelemetryEvent{" + getDottedName() + ", measurements=" + measurements + ", metadata=" + metadata + "}";
  }
}
