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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.ai.CallDiagnostics;
import com.google.promptbridge.ai.CallOptions;
import com.google.promptbridge.ai.InvocationDescriptor;
import com.google.promptbridge.ai.Usage;
import com.google.promptbridge.ai.UsageCollector;
import com.google.promptbridge.ai.UsageExtractor;
import com.google.promptbridge.core.telemetry.EventBus;
import com.google.promptbridge.core.telemetry.EventKind;
import com.google.promptbridge.core.telemetry.TelemetryEvent;

/**
 * CallTelemetry instruments single-shot engine calls.
 *
 * <p>
 * Every call gets a usage collector, created through the engine's factory
 * unless the caller supplies one. When telemetry is enabled and the call is
 * sampled, a start event precedes the call and a stop event follows it; a call
 * that throws publishes an exception event instead of the stop event and the
 * exception is rethrown as is. Event publication never changes the outcome of
 * the call.
 *
 * <p>
 * Event metadata carries {@code resource}, {@code action},
 * {@code function_name} and {@code collector_name}, plus the opt-in fields
 * requested by {@link TelemetryConfig#getMetadata()}. The stop event adds the
 * diagnostics the engine left on the collector.
 */
public class CallTelemetry {

  private static final Logger logger = LoggerFactory.getLogger(CallTelemetry.class);

  private static final AtomicLong COLLECTOR_SEQUENCE = new AtomicLong();

  private final EventBus eventBus;
  private final DoubleSupplier random;

  /**
   * Creates a CallTelemetry publishing to the given bus.
   *
   * @param eventBus
   *            the event bus, null for no-op
   */
  public CallTelemetry(EventBus eventBus) {
    this(eventBus, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a CallTelemetry with an explicit random source for sampling.
   *
   * @param eventBus
   *            the event bus, null for no-op
   * @param random
   *            uniform draws in [0, 1)
   */
  public CallTelemetry(EventBus eventBus, DoubleSupplier random) {
    this.eventBus = eventBus != null ? eventBus : EventBus.noop();
    this.random = random;
  }

  public EventBus getEventBus() {
    return eventBus;
  }

  /**
   * Runs a call with telemetry.
   *
   * @param descriptor
   *            the call being made
   * @param existingCollector
   *            a collector to reuse, or null to create one
   * @param collectorFactory
   *            creates a collector from its name
   * @param callFn
   *            performs the engine call
   * @param <T>
   *            the result type
   * @return the call function's result and the collector it used
   */
  public <T> InstrumentedCall<T> execute(InvocationDescriptor descriptor, UsageCollector existingCollector,
      Function<String, UsageCollector> collectorFactory, CallFunction<T> callFn) {
    TelemetryConfig config = descriptor.getTelemetry();
    UsageCollector collector = existingCollector != null
        ? existingCollector
        : collectorFactory.apply(collectorName(descriptor));
    CallOptions options = CallOptions.withCollector(collector);

    if (!isEnabled(config) || !isSampled(config)) {
      logger.debug("Telemetry skipped for {}", descriptor);
      return new InstrumentedCall<>(callFn.call(options), collector, false);
    }

    Map<String, Object> metadata = baseMetadata(descriptor, collector);
    long start = System.nanoTime();

    if (config.emits(EventKind.START)) {
      Map<String, Object> measurements = new LinkedHashMap<>();
      measurements.put("monotonic_time", start);
      measurements.put("system_time", System.currentTimeMillis());
      publish(config.getPrefix(), EventKind.START, measurements, metadata);
    }

    T result;
    try {
      result = callFn.call(options);
    } catch (RuntimeException | Error e) {
      if (config.emits(EventKind.EXCEPTION)) {
        long now = System.nanoTime();
        Map<String, Object> measurements = new LinkedHashMap<>();
        measurements.put("duration", now - start);
        measurements.put("monotonic_time", now);
        Map<String, Object> exceptionMetadata = new LinkedHashMap<>(metadata);
        exceptionMetadata.put("kind", e instanceof Error ? "exit" : "error");
        exceptionMetadata.put("reason", e.getMessage());
        exceptionMetadata.put("error_type", e.getClass().getName());
        exceptionMetadata.put("stacktrace", e.getStackTrace());
        publish(config.getPrefix(), EventKind.EXCEPTION, measurements, exceptionMetadata);
      }
      throw e;
    }

    if (config.emits(EventKind.STOP)) {
      long now = System.nanoTime();
      Usage usage = UsageExtractor.extractUsage(collector);
      CallDiagnostics diagnostics = UsageExtractor.extractDiagnostics(collector);
      Map<String, Object> measurements = new LinkedHashMap<>();
      measurements.put("duration", now - start);
      measurements.put("input_tokens", usage.getInputTokens());
      measurements.put("output_tokens", usage.getOutputTokens());
      measurements.put("total_tokens", usage.getTotalTokens());
      measurements.put("monotonic_time", now);
      Map<String, Object> stopMetadata = new LinkedHashMap<>(metadata);
      stopMetadata.putAll(diagnostics.toMetadata());
      publish(config.getPrefix(), EventKind.STOP, measurements, stopMetadata);
    }
    return new InstrumentedCall<>(result, collector, true);
  }

  /**
   * Returns whether telemetry is enabled for a configuration.
   *
   * @param config
   *            the configuration
   * @return true if enabled
   */
  public boolean isEnabled(TelemetryConfig config) {
    return config != null && config.isEnabled();
  }

  /**
   * Draws the sampling decision for one call.
   *
   * @param config
   *            the configuration
   * @return true if the call should publish events
   */
  public boolean isSampled(TelemetryConfig config) {
    double rate = config.getSampleRate();
    if (rate >= 1.0) {
      return true;
    }
    if (rate <= 0.0) {
      return false;
    }
    return random.getAsDouble() < rate;
  }

  /**
   * Resolves the collector name for a call.
   *
   * @param descriptor
   *            the call
   * @return the configured name, or {@code <resource>-<function>-<n>}
   */
  public String collectorName(InvocationDescriptor descriptor) {
    Function<InvocationDescriptor, String> nameFn = descriptor.getTelemetry().getCollectorName();
    if (nameFn != null) {
      String name = nameFn.apply(descriptor);
      if (name != null && !name.isEmpty()) {
        return name;
      }
      logger.debug("Collector name function returned no name for {}, using default", descriptor);
    }
    return descriptor.getResource() + "-" + descriptor.getFunctionName() + "-"
        + COLLECTOR_SEQUENCE.incrementAndGet();
  }

  private Map<String, Object> baseMetadata(InvocationDescriptor descriptor, UsageCollector collector) {
    TelemetryConfig config = descriptor.getTelemetry();
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("resource", descriptor.getResource());
    metadata.put("action", descriptor.getAction());
    metadata.put("function_name", descriptor.getFunctionName());
    metadata.put("collector_name", collector.getName());
    if (config.includesMetadata(TelemetryConfig.METADATA_LLM_CLIENT)) {
      metadata.put(TelemetryConfig.METADATA_LLM_CLIENT,
          descriptor.getContext().get(TelemetryConfig.METADATA_LLM_CLIENT));
    }
    if (config.includesMetadata(TelemetryConfig.METADATA_STREAM)) {
      metadata.put(TelemetryConfig.METADATA_STREAM,
          Boolean.TRUE.equals(descriptor.getContext().get(TelemetryConfig.METADATA_STREAM)));
    }
    return metadata;
  }

  private void publish(List<String> prefix, EventKind kind, Map<String, Object> measurements,
      Map<String, Object> metadata) {
    try {
      eventBus.publish(new TelemetryEvent(TelemetryEvent.eventName(prefix, kind), kind, measurements, metadata));
    } catch (RuntimeException e) {
      logger.warn("Failed to publish {} telemetry event: {}", kind, e.getMessage());
    }
  }

  /**
   * Performs the engine call with the collector-carrying options.
   *
   * @param <T>
   *            the result type
   */
  @FunctionalInterface
  public interface CallFunction<T> {
    /**
     * Runs the call.
     *
     * @param options
     *            options carrying the collector
     * @return the call result
     */
    T call(CallOptions options);
  }
}
