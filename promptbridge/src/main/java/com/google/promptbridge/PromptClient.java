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
import java.util.Set;

import com.google.promptbridge.ai.PromptEngine;

/**
 * PromptClient associates an identifier with an engine and the functions that
 * engine exposes.
 *
 * <p>
 * Functions returning one of several shapes declare their variants, which are
 * used to tag results of actions imported from the function.
 */
public class PromptClient {

  private final String identifier;
  private final PromptEngine engine;
  private final Map<String, Map<String, Class<?>>> functions;

  private PromptClient(Builder builder) {
    this.identifier = builder.identifier;
    this.engine = builder.engine;
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.functions));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getIdentifier() {
    return identifier;
  }

  public PromptEngine getEngine() {
    return engine;
  }

  /**
   * Returns the names of the functions this client exposes, in declaration
   * order.
   *
   * @return the function names
   */
  public Set<String> getFunctionNames() {
    return functions.keySet();
  }

  /**
   * Returns whether the client exposes a function.
   *
   * @param functionName
   *            the function name
   * @return true if exposed
   */
  public boolean exposes(String functionName) {
    return functions.containsKey(functionName);
  }

  /**
   * Returns the declared return variants of a function.
   *
   * @param functionName
   *            the function name
   * @return the variants, empty for single-shape or unknown functions
   */
  public Map<String, Class<?>> getReturnVariants(String functionName) {
    Map<String, Class<?>> variants = functions.get(functionName);
    return variants != null ? variants : Map.of();
  }

  @Override
  public String toString() {
    return "PromptClient{" + identifier + ", functions=" + functions.keySet() + "}";
  }

  /**
   * Builder for PromptClient.
   */
  public static class Builder {
    private String identifier;
    private PromptEngine engine;
    private final Map<String, Map<String, Class<?>>> functions = new LinkedHashMap<>();

    public Builder identifier(String identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder engine(PromptEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder function(String name) {
      return function(name, Map.of());
    }

    /**
     * Declares a function returning one of several shapes.
     *
     * @param name
     *            the function name
     * @param variants
     *            variant names mapped to the class each produces, in order
     * @return this builder
     */
    public Builder function(String name, Map<String, Class<?>> variants) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Function name is required");
      }
      this.functions.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(variants)));
      return this;
    }

    public Builder functions(String... names) {
      for (String name : names) {
        function(name);
      }
      return this;
    }

    public PromptClient build() {
      if (identifier == null || identifier.isEmpty()) {
        throw new IllegalStateException("identifier is required");
      }
      if (engine == null) {
        throw new IllegalStateException("engine is required");
      }
      return new PromptClient(this);
    }
  }
}
