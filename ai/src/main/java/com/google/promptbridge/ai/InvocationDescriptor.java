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

package com.google.promptbridge.ai;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.promptbridge.ai.telemetry.TelemetryConfig;

/**
 * InvocationDescriptor identifies one call: the engine function to run, its
 * arguments, the resource and action it was invoked through, and the telemetry
 * configuration that applies.
 *
 * <p>
 * Descriptors are immutable and built fresh for every call.
 */
public final class InvocationDescriptor {

  private final String functionName;
  private final Map<String, Object> arguments;
  private final String resource;
  private final String action;
  private final TelemetryConfig telemetry;
  private final Map<String, Object> context;
  private final Map<String, Class<?>> returnVariants;

  private InvocationDescriptor(Builder builder) {
    this.functionName = builder.functionName;
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
    this.resource = builder.resource;
    this.action = builder.action;
    this.telemetry = builder.telemetry != null ? builder.telemetry : TelemetryConfig.defaults();
    this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
    this.returnVariants = Collections.unmodifiableMap(new LinkedHashMap<>(builder.returnVariants));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getFunctionName() {
    return functionName;
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public String getResource() {
    return resource;
  }

  public String getAction() {
    return action;
  }

  public TelemetryConfig getTelemetry() {
    return telemetry;
  }

  /**
   * Returns the invocation context, such as the {@code llm_client} override or
   * the {@code stream} flag.
   *
   * @return the context map, never null
   */
  public Map<String, Object> getContext() {
    return context;
  }

  /**
   * Returns the declared return variants of a multi-shape function, in
   * declaration order.
   *
   * @return variant names mapped to classes, empty for single-shape functions
   */
  public Map<String, Class<?>> getReturnVariants() {
    return returnVariants;
  }

  @Override
  public String toString() {
    return "InvocationDescriptor{" + resource + "." + action + " -> " + functionName + "}";
  }

  /**
   * Builder for InvocationDescriptor.
   */
  public static class Builder {
    private String functionName;
    private Map<String, Object> arguments = new LinkedHashMap<>();
    private String resource;
    private String action;
    private TelemetryConfig telemetry;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final Map<String, Class<?>> returnVariants = new LinkedHashMap<>();

    public Builder functionName(String functionName) {
      this.functionName = functionName;
      return this;
    }

    public Builder arguments(Map<String, Object> arguments) {
      this.arguments = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
      return this;
    }

    public Builder resource(String resource) {
      this.resource = resource;
      return this;
    }

    public Builder action(String action) {
      this.action = action;
      return this;
    }

    public Builder telemetry(TelemetryConfig telemetry) {
      this.telemetry = telemetry;
      return this;
    }

    public Builder context(String key, Object value) {
      this.context.put(key, value);
      return this;
    }

    public Builder context(Map<String, Object> context) {
      if (context != null) {
        this.context.putAll(context);
      }
      return this;
    }

    public Builder returnVariant(String name, Class<?> type) {
      this.returnVariants.put(name, type);
      return this;
    }

    public Builder returnVariants(Map<String, Class<?>> variants) {
      if (variants != null) {
        this.returnVariants.putAll(variants);
      }
      return this;
    }

    public InvocationDescriptor build() {
      if (functionName == null || functionName.isEmpty()) {
        throw new IllegalStateException("functionName is required");
      }
      return new InvocationDescriptor(this);
    }
  }
}
