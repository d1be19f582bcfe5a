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

package com.google.promptbridge;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.ai.stream.StreamingBridge;
import com.google.promptbridge.ai.telemetry.TelemetryConfig;
import com.google.promptbridge.core.telemetry.EventBus;

/**
 * PromptBridgeOptions contains configuration options for PromptBridge.
 *
 * <p>
 * Defaults are read from the environment:
 * <ul>
 * <li>{@code PROMPTBRIDGE_STREAM_READ_TIMEOUT_MS} - stream read timeout,
 * default 100</li>
 * <li>{@code PROMPTBRIDGE_STREAM_MAX_DRAIN} - cleanup drain bound, default
 * 1000</li>
 * <li>{@code PROMPTBRIDGE_TELEMETRY_ENABLED} - default true</li>
 * <li>{@code PROMPTBRIDGE_TELEMETRY_SAMPLE_RATE} - default 1.0</li>
 * </ul>
 */
public class PromptBridgeOptions {

  private static final Logger logger = LoggerFactory.getLogger(PromptBridgeOptions.class);

  static final String ENV_STREAM_READ_TIMEOUT_MS = "PROMPTBRIDGE_STREAM_READ_TIMEOUT_MS";
  static final String ENV_STREAM_MAX_DRAIN = "PROMPTBRIDGE_STREAM_MAX_DRAIN";
  static final String ENV_TELEMETRY_ENABLED = "PROMPTBRIDGE_TELEMETRY_ENABLED";
  static final String ENV_TELEMETRY_SAMPLE_RATE = "PROMPTBRIDGE_TELEMETRY_SAMPLE_RATE";

  private final Duration streamReadTimeout;
  private final int streamMaxDrain;
  private final boolean telemetryEnabled;
  private final double telemetrySampleRate;
  private final EventBus eventBus;
  private final ExecutorService streamExecutor;
  private final boolean cancelStreamsOnAbandon;

  private PromptBridgeOptions(Builder builder) {
    this.streamReadTimeout = builder.streamReadTimeout;
    this.streamMaxDrain = builder.streamMaxDrain;
    this.telemetryEnabled = builder.telemetryEnabled;
    this.telemetrySampleRate = builder.telemetrySampleRate;
    this.eventBus = builder.eventBus != null ? builder.eventBus : EventBus.noop();
    this.streamExecutor = builder.streamExecutor;
    this.cancelStreamsOnAbandon = builder.cancelStreamsOnAbandon;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns how long each stream pull waits for the next message.
   *
   * @return the read timeout
   */
  public Duration getStreamReadTimeout() {
    return streamReadTimeout;
  }

  /**
   * Returns how many stale messages cleanup drains at most per stream.
   *
   * @return the drain bound
   */
  public int getStreamMaxDrain() {
    return streamMaxDrain;
  }

  public boolean isTelemetryEnabled() {
    return telemetryEnabled;
  }

  public double getTelemetrySampleRate() {
    return telemetrySampleRate;
  }

  public EventBus getEventBus() {
    return eventBus;
  }

  /**
   * Returns the executor that runs stream workers.
   *
   * @return the executor, or null for the default daemon pool
   */
  public ExecutorService getStreamExecutor() {
    return streamExecutor;
  }

  public boolean isCancelStreamsOnAbandon() {
    return cancelStreamsOnAbandon;
  }

  /**
   * Returns the telemetry configuration used by resources that do not define
   * their own.
   *
   * @return the default telemetry configuration
   */
  public TelemetryConfig defaultTelemetry() {
    return TelemetryConfig.builder().enabled(telemetryEnabled).sampleRate(telemetrySampleRate).build();
  }

  /**
   * Builder for PromptBridgeOptions.
   */
  public static class Builder {
    private Duration streamReadTimeout = Duration.ofMillis(
        longFromEnv(ENV_STREAM_READ_TIMEOUT_MS, StreamingBridge.DEFAULT_READ_TIMEOUT.toMillis()));
    private int streamMaxDrain = (int) longFromEnv(ENV_STREAM_MAX_DRAIN, StreamingBridge.DEFAULT_MAX_DRAIN);
    private boolean telemetryEnabled = booleanFromEnv(ENV_TELEMETRY_ENABLED, true);
    private double telemetrySampleRate = sampleRateFromEnv();
    private EventBus eventBus;
    private ExecutorService streamExecutor;
    private boolean cancelStreamsOnAbandon;

    private static long longFromEnv(String name, long defaultValue) {
      String value = System.getenv(name);
      if (value != null) {
        try {
          long parsed = Long.parseLong(value.trim());
          if (parsed > 0) {
            return parsed;
          }
          logger.warn("Ignoring non-positive {}={}, using {}", name, value, defaultValue);
        } catch (NumberFormatException e) {
          logger.warn("Ignoring invalid {}={}, using {}", name, value, defaultValue);
        }
      }
      return defaultValue;
    }

    private static boolean booleanFromEnv(String name, boolean defaultValue) {
      String value = System.getenv(name);
      if (value == null || value.isBlank()) {
        return defaultValue;
      }
      return !"false".equalsIgnoreCase(value.trim()) && !"0".equals(value.trim());
    }

    private static double sampleRateFromEnv() {
      String value = System.getenv(ENV_TELEMETRY_SAMPLE_RATE);
      if (value != null) {
        try {
          double rate = Double.parseDouble(value.trim());
          if (rate >= 0.0 && rate <= 1.0) {
            return rate;
          }
          logger.warn("Ignoring out of range {}={}, using 1.0", ENV_TELEMETRY_SAMPLE_RATE, value);
        } catch (NumberFormatException e) {
          logger.warn("Ignoring invalid {}={}, using 1.0", ENV_TELEMETRY_SAMPLE_RATE, value);
        }
      }
      return 1.0;
    }

    public Builder streamReadTimeout(Duration streamReadTimeout) {
      this.streamReadTimeout = streamReadTimeout;
      return this;
    }

    public Builder streamMaxDrain(int streamMaxDrain) {
      this.streamMaxDrain = streamMaxDrain;
      return this;
    }

    public Builder telemetryEnabled(boolean telemetryEnabled) {
      this.telemetryEnabled = telemetryEnabled;
      return this;
    }

    public Builder telemetrySampleRate(double telemetrySampleRate) {
      this.telemetrySampleRate = telemetrySampleRate;
      return this;
    }

    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    public Builder streamExecutor(ExecutorService streamExecutor) {
      this.streamExecutor = streamExecutor;
      return this;
    }

    public Builder cancelStreamsOnAbandon(boolean cancelStreamsOnAbandon) {
      this.cancelStreamsOnAbandon = cancelStreamsOnAbandon;
      return this;
    }

    public PromptBridgeOptions build() {
      if (streamReadTimeout == null || streamReadTimeout.isNegative()) {
        throw new IllegalArgumentException("Stream read timeout must be zero or positive");
      }
      if (streamMaxDrain < 1) {
        throw new IllegalArgumentException("Stream drain bound must be positive, got " + streamMaxDrain);
      }
      if (Double.isNaN(telemetrySampleRate) || telemetrySampleRate < 0.0 || telemetrySampleRate > 1.0) {
        throw new IllegalArgumentException("Sample rate must be between 0.0 and 1.0, got " + telemetrySampleRate);
      }
      return new PromptBridgeOptions(this);
    }
  }
}
