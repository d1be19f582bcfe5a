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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * InMemoryUsageCollector is a {@link UsageCollector} that engines populate
 * directly. Token counts accumulate across recorded executions.
 */
public class InMemoryUsageCollector implements UsageCollector {

  private final String name;
  private int inputTokens;
  private int outputTokens;
  private boolean reported;
  private FunctionLog lastFunctionLog;

  /**
   * Creates a new collector.
   *
   * @param name
   *            the collector name
   */
  public InMemoryUsageCollector(String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Collector name is required");
    }
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  /**
   * Adds token counts reported by the engine.
   *
   * @param input
   *            input tokens
   * @param output
   *            output tokens
   */
  public synchronized void recordUsage(int input, int output) {
    this.inputTokens = Math.addExact(inputTokens, input);
    this.outputTokens = Math.addExact(outputTokens, output);
    this.reported = true;
  }

  /**
   * Records a function execution log and its token counts.
   *
   * @param log
   *            the function log
   */
  public synchronized void record(FunctionLog log) {
    this.lastFunctionLog = log;
    if (log != null && log.getUsage() != null) {
      recordUsage(log.getUsage().getInputTokens(), log.getUsage().getOutputTokens());
    }
  }

  @Override
  public synchronized Map<String, Object> usage() {
    Map<String, Object> usage = new LinkedHashMap<>();
    if (reported) {
      usage.put("input_tokens", inputTokens);
      usage.put("output_tokens", outputTokens);
    }
    return usage;
  }

  @Override
  public synchronized FunctionLog lastFunctionLog() {
    return lastFunctionLog;
  }

  @Override
  public String toString() {
    return "InMemoryUsageCollector{" + name + "}";
  }
}
