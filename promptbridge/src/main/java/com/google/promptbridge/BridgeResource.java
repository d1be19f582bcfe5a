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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.promptbridge.ai.telemetry.TelemetryConfig;

/**
 * BridgeResource groups actions that call functions of one client.
 *
 * <pre>{@code
 * BridgeResource tasks = BridgeResource.builder().name("Tasks").client("todo")
 *     .telemetry(TelemetryConfig.builder().sampleRate(0.5).build()).importFunctions("ExtractTasks")
 *     .action(ActionDefinition.call("summarize", "SummarizeTasks")).build();
 * }</pre>
 *
 * Imported functions are expanded into actions when the resource is defined on
 * a {@link PromptBridge}.
 */
public class BridgeResource {

  private final String name;
  private final String client;
  private final TelemetryConfig telemetry;
  private final Map<String, ActionDefinition> actions;
  private final List<String> importedFunctions;

  private BridgeResource(String name, String client, TelemetryConfig telemetry,
      Map<String, ActionDefinition> actions, List<String> importedFunctions) {
    this.name = name;
    this.client = client;
    this.telemetry = telemetry;
    this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    this.importedFunctions = List.copyOf(importedFunctions);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getName() {
    return name;
  }

  public String getClient() {
    return client;
  }

  /**
   * Returns the resource's telemetry configuration.
   *
   * @return the configuration, or null to use the bridge default
   */
  public TelemetryConfig getTelemetry() {
    return telemetry;
  }

  public Map<String, ActionDefinition> getActions() {
    return actions;
  }

  public ActionDefinition getAction(String actionName) {
    return actions.get(actionName);
  }

  public List<String> getImportedFunctions() {
    return importedFunctions;
  }

  /**
   * Returns a copy of this resource with imported functions expanded into
   * actions.
   *
   * @param promptClient
   *            the resource's client
   * @return the resolved resource
   */
  BridgeResource resolve(PromptClient promptClient) {
    Map<String, ActionDefinition> resolved = FunctionImporter.importFunctions(promptClient, importedFunctions,
        actions);
    return new BridgeResource(name, client, telemetry, resolved, importedFunctions);
  }

  @Override
  public String toString() {
    return "BridgeResource{" + name + ", client=" + client + ", actions=" + actions.keySet() + "}";
  }

  /**
   * Builder for BridgeResource.
   */
  public static class Builder {
    private String name;
    private String client;
    private TelemetryConfig telemetry;
    private final Map<String, ActionDefinition> actions = new LinkedHashMap<>();
    private final List<String> importedFunctions = new ArrayList<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder client(String client) {
      this.client = client;
      return this;
    }

    public Builder telemetry(TelemetryConfig telemetry) {
      this.telemetry = telemetry;
      return this;
    }

    public Builder action(ActionDefinition action) {
      if (actions.putIfAbsent(action.getName(), action) != null) {
        throw new IllegalStateException("Action already defined: " + action.getName());
      }
      return this;
    }

    public Builder importFunctions(String... functionNames) {
      Collections.addAll(importedFunctions, functionNames);
      return this;
    }

    public BridgeResource build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalStateException("name is required");
      }
      if (client == null || client.isEmpty()) {
        throw new IllegalStateException("client is required");
      }
      return new BridgeResource(name, client, telemetry, actions, importedFunctions);
    }
  }
}
