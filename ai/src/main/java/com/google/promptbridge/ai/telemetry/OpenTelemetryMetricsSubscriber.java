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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.core.telemetry.EventKind;
import com.google.promptbridge.core.telemetry.EventSubscriber;
import com.google.promptbridge.core.telemetry.TelemetryEvent;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetryMetricsSubscriber turns call telemetry events into
 * OpenTelemetry metrics.
 *
 * <p>
 * This subscriber tracks:
 * <ul>
 * <li>Request counts per function, split by status</li>
 * <li>Latency histograms</li>
 * <li>Input/output token counts</li>
 * </ul>
 *
 * <p>
 * Start events carry nothing to record and are ignored.
 */
public class OpenTelemetryMetricsSubscriber implements EventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryMetricsSubscriber.class);
  private static final String METER_NAME = "promptbridge";
  private static final String SOURCE = "java";

  static final String METRIC_REQUESTS = "promptbridge/call/requests";
  static final String METRIC_LATENCY = "promptbridge/call/latency";
  static final String METRIC_INPUT_TOKENS = "promptbridge/call/input/tokens";
  static final String METRIC_OUTPUT_TOKENS = "promptbridge/call/output/tokens";

  private final LongCounter requestCounter;
  private final LongHistogram latencyHistogram;
  private final LongCounter inputTokensCounter;
  private final LongCounter outputTokensCounter;

  /**
   * Creates a subscriber recording to the global OpenTelemetry meter.
   */
  public OpenTelemetryMetricsSubscriber() {
    this(GlobalOpenTelemetry.getMeter(METER_NAME));
  }

  /**
   * Creates a subscriber recording to the given meter.
   *
   * @param meter
   *            the meter
   */
  public OpenTelemetryMetricsSubscriber(Meter meter) {
    requestCounter = meter.counterBuilder(METRIC_REQUESTS).setDescription("Counts calls to prompt functions.")
        .setUnit("1").build();

    latencyHistogram = meter.histogramBuilder(METRIC_LATENCY)
        .setDescription("Latencies of prompt function calls.").setUnit("ms").ofLongs().build();

    inputTokensCounter = meter.counterBuilder(METRIC_INPUT_TOKENS)
        .setDescription("Counts input tokens sent to prompt functions.").setUnit("1").build();

    outputTokensCounter = meter.counterBuilder(METRIC_OUTPUT_TOKENS)
        .setDescription("Counts output tokens returned by prompt functions.").setUnit("1").build();

    logger.debug("OpenTelemetryMetricsSubscriber initialized");
  }

  @Override
  public void onEvent(TelemetryEvent event) {
    if (event.getKind() == EventKind.START) {
      return;
    }
    Map<String, Object> metadata = event.getMetadata();
    Map<String, Object> measurements = event.getMeasurements();
    String error = event.getKind() == EventKind.EXCEPTION ? asString(metadata.get("error_type")) : null;
    String status = error != null ? "failure" : "success";

    Attributes baseAttrs = Attributes.builder()
        .put("functionName", truncate(asString(metadata.get("function_name")), 256))
        .put("resource", truncate(asString(metadata.get("resource")), 256))
        .put("action", truncate(asString(metadata.get("action")), 256))
        .put("modelName", truncate(asString(metadata.get("model_name")), 1024)).put("status", status)
        .put("source", SOURCE).build();

    Attributes requestAttrs = error != null
        ? baseAttrs.toBuilder().put("error", truncate(error, 256)).build()
        : baseAttrs;
    requestCounter.add(1, requestAttrs);

    long durationNanos = asLong(measurements.get("duration"));
    latencyHistogram.record(durationNanos / 1_000_000L, baseAttrs);

    long inputTokens = asLong(measurements.get("input_tokens"));
    if (inputTokens > 0) {
      inputTokensCounter.add(inputTokens, baseAttrs);
    }
    long outputTokens = asLong(measurements.get("output_tokens"));
    if (outputTokens > 0) {
      outputTokensCounter.add(outputTokens, baseAttrs);
    }
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }

  private static long asLong(Object value) {
    return value instanceof Number ? ((Number) value).longValue() : 0L;
  }

  private static String truncate(String value, int maxLength) {
    if (value == null) {
      return "";
    }
    if (value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
