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
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Usage represents token usage statistics of one engine call. The total is
 * always the sum of input and output tokens.
 */
public final class Usage {

  private static final Usage ZERO = new Usage(0, 0);

  @JsonProperty("input_tokens")
  private final int inputTokens;

  @JsonProperty("output_tokens")
  private final int outputTokens;

  @JsonProperty(value = "total_tokens", access = JsonProperty.Access.READ_ONLY)
  private final int totalTokens;

  /**
   * Creates a Usage with token counts.
   *
   * @param inputTokens
   *            number of input tokens
   * @param outputTokens
   *            number of output tokens
   * @throws ArithmeticException
   *             if the total does not fit in an int
   */
  @JsonCreator
  public Usage(@JsonProperty("input_tokens") int inputTokens, @JsonProperty("output_tokens") int outputTokens) {
    if (inputTokens < 0 || outputTokens < 0) {
      throw new IllegalArgumentException("Token counts must not be negative");
    }
    this.inputTokens = inputTokens;
    this.outputTokens = outputTokens;
    this.totalTokens = Math.addExact(inputTokens, outputTokens);
  }

  /**
   * Returns the zero usage.
   *
   * @return usage with all counts at zero
   */
  public static Usage zero() {
    return ZERO;
  }

  public int getInputTokens() {
    return inputTokens;
  }

  public int getOutputTokens() {
    return outputTokens;
  }

  public int getTotalTokens() {
    return totalTokens;
  }

  /**
   * Returns the usage as a map keyed {@code input_tokens},
   * {@code output_tokens} and {@code total_tokens}.
   *
   * @return the usage map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("input_tokens", inputTokens);
    map.put("output_tokens", outputTokens);
    map.put("total_tokens", totalTokens);
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Usage)) {
      return false;
    }
    Usage other = (Usage) o;
    return inputTokens == other.inputTokens && outputTokens == other.outputTokens;
  }

  @Override
  public int hashCode() {
    return Objects.hash(inputTokens, outputTokens);
  }

  @Override
  public String toString() {
    return "Usage{input=" + inputTokens + ", output=" + outputTokens + ", total=" + totalTokens + "}";
  }
}
