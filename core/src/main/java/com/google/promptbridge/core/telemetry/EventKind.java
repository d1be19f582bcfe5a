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

/**
 * EventKind identifies the point in a call's lifecycle at which a telemetry
 * event is published.
 */
public enum EventKind {
  /**
   * Published before the engine is invoked.
   */
  START("start"),

  /**
   * Published after the engine returned, carrying duration and usage.
   */
  STOP("stop"),

  /**
   * Published when the engine call raised.
   */
  EXCEPTION("exception");

  private final String value;

  EventKind(String value) {
    this.value = value;
  }

  /**
   * Returns the string value used as the last segment of event names.
   *
   * @return the event kind string value
   */
  public String getValue() {
    return value;
  }

  /**
   * Creates an EventKind from a string value.
   *
   * @param value
   *            the string value
   * @return the corresponding EventKind
   * @throws IllegalArgumentException
   *             if the value doesn't match any EventKind
   */
  public static EventKind fromValue(String value) {
    for (EventKind kind : values()) {
      if (kind.value.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown event kind: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
