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
 * EventBus publishes telemetry events to zero or more subscribers. Publication
 * is fire-and-forget: it never changes the outcome of the call being observed.
 */
public interface EventBus {

  /**
   * Publishes an event. Publishing with no subscribers is a no-op.
   *
   * @param event
   *            the event
   */
  void publish(TelemetryEvent event);

  /**
   * Returns an event bus that discards every event.
   *
   * @return the no-op bus
   */
  static EventBus noop() {
    return NoopEventBus.INSTANCE;
  }

  /**
   * Event bus that discards every event.
   */
  final class NoopEventBus implements EventBus {
    private static final NoopEventBus INSTANCE = new NoopEventBus();

    private NoopEventBus() {
    }

    @Override
    public void publish(TelemetryEvent event) {
      // no subscribers
    }
  }
}
