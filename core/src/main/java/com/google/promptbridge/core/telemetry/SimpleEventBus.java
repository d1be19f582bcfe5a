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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SimpleEventBus is an in-process {@link EventBus} that dispatches events
 * synchronously to attached subscribers.
 *
 * <p>
 * Subscribers are attached under a unique handler id, optionally filtered by
 * event name. A subscriber that throws is detached and the failure is logged;
 * the publisher never sees the exception.
 */
public class SimpleEventBus implements EventBus {

  private static final Logger logger = LoggerFactory.getLogger(SimpleEventBus.class);

  private final Map<String, Handler> handlers = new ConcurrentHashMap<>();

  /**
   * Attaches a subscriber that receives every event.
   *
   * @param handlerId
   *            the unique handler id
   * @param subscriber
   *            the subscriber
   * @throws IllegalStateException
   *             if a handler with the same id is already attached
   */
  public void attach(String handlerId, EventSubscriber subscriber) {
    attach(handlerId, null, subscriber);
  }

  /**
   * Attaches a subscriber for a single event name.
   *
   * @param handlerId
   *            the unique handler id
   * @param eventName
   *            the event name to receive, or null for all events
   * @param subscriber
   *            the subscriber
   * @throws IllegalStateException
   *             if a handler with the same id is already attached
   */
  public void attach(String handlerId, List<String> eventName, EventSubscriber subscriber) {
    if (handlerId == null || handlerId.isEmpty()) {
      throw new IllegalArgumentException("Handler id is required");
    }
    if (subscriber == null) {
      throw new IllegalArgumentException("Subscriber is required");
    }
    Handler handler = new Handler(eventName != null ? List.copyOf(eventName) : null, subscriber);
    if (handlers.putIfAbsent(handlerId, handler) != null) {
      throw new IllegalStateException("Handler already attached: " + handlerId);
    }
    logger.debug("Attached telemetry handler: {}", handlerId);
  }

  /**
   * Detaches a subscriber.
   *
   * @param handlerId
   *            the handler id
   * @return true if a handler was detached
   */
  public boolean detach(String handlerId) {
    boolean removed = handlers.remove(handlerId) != null;
    if (removed) {
      logger.debug("Detached telemetry handler: {}", handlerId);
    }
    return removed;
  }

  /**
   * Returns the ids of the attached handlers.
   *
   * @return the handler ids
   */
  public List<String> listHandlers() {
    return new ArrayList<>(handlers.keySet());
  }

  @Override
  public void publish(TelemetryEvent event) {
    for (Map.Entry<String, Handler> entry : handlers.entrySet()) {
      Handler handler = entry.getValue();
      if (handler.eventName != null && !handler.eventName.equals(event.getName())) {
        continue;
      }
      try {
        handler.subscriber.onEvent(event);
      } catch (RuntimeException e) {
        handlers.remove(entry.getKey(), handler);
        logger.warn("Telemetry handler {} failed on {} and was detached: {}", entry.getKey(),
            event.getDottedName(), e.getMessage(), e);
      }
    }
  }

  private static final class Handler {
    private final List<String> eventName;
    private final EventSubscriber subscriber;

    private Handler(List<String> eventName, EventSubscriber subscriber) {
      this.eventName = eventName;
      this.subscriber = subscriber;
    }
  }
}
