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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ActionDefinition binds a named resource action to an engine function.
 */
public class ActionDefinition {

  /**
   * The call shape of an action.
   */
  public enum Kind {
    CALL("call"),
    STREAM("stream");

    private final String value;

    Kind(String value) {
      this.value = value;
    }

    public String getValue() {
      return value;
    }
  }

  private final String name;
  private final String functionName;
  private final Kind kind;
  private final Map<String, Class<?>> returnVariants;
  private final String description;

  private ActionDefinition(Builder builder) {
    this.name = builder.name;
    this.functionName = builder.functionName;
    this.kind = builder.kind;
    this.returnVariants = Collections.unmodifiableMap(new LinkedHashMap<>(builder.returnVariants));
    this.description = builder.description;
  }

  /**
   * Creates a single-shot action.
   *
   * @param name
   *            the action name
   * @param functionName
   *            the engine function
   * @return the action
   */
  public static ActionDefinition call(String name, String functionName) {
    return builder().name(name).functionName(functionName).kind(Kind.CALL).build();
  }

  /**
   * Creates a streaming action.
   *
   * @param name
   *            the action name
   * @param functionName
   *            the engine function
   * @return the action
   */
  public static ActionDefinition stream(String name, String functionName) {
    return builder().name(name).functionName(functionName).kind(Kind.STREAM).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getName() {
    return name;
  }

  public String getFunctionName() {
    return functionName;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isStream() {
    return kind == Kind.STREAM;
  }

  public Map<String, Class<?>> getReturnVariants() {
    return returnVariants;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return "ActionDefinition{" + name + " -> " + functionName + " (" + kind.getValue() + ")}";
  }

  /**
   * Builder for ActionDefinition.
   */
  public static class Builder {
    private String name;
    private String functionName;
    private Kind kind = Kind.CALL;
    private Map<String, Class<?>> returnVariants = new LinkedHashMap<>();
    private String description;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder functionName(String functionName) {
      this.functionName = functionName;
      return this;
    }

    public Builder kind(Kind kind) {
      this.kind = kind;
      return this;
    }

    public Builder returnVariants(Map<String, Class<?>> returnVariants) {
      this.returnVariants = returnVariants != null ? new LinkedHashMap<>(returnVariants) : new LinkedHashMap<>();
      return this;
    }

    public Builder returnVariant(String variant, Class<?> type) {
      this.returnVariants.put(variant, type);
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public ActionDefinition build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalStateException("name is required");
      }
      if (functionName == null || functionName.isEmpty()) {
        throw new IllegalStateException("functionName is required");
      }
      if (kind == null) {
        throw new IllegalStateException("kind is required");
      }
      return new ActionDefinition(this);
    }
  }
}
