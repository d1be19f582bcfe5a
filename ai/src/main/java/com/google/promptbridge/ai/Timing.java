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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Timing records when an engine call started and how long it took.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Timing {

  @JsonProperty("start_time_utc_ms")
  private Long startTimeUtcMs;

  @JsonProperty("duration_ms")
  private Long durationMs;

  /**
   * Default constructor.
   */
  public Timing() {
  }

  /**
   * Creates a Timing.
   *
   * @param startTimeUtcMs
   *            wall-clock start in epoch milliseconds
   * @param durationMs
   *            duration in milliseconds
   */
  public Timing(Long startTimeUtcMs, Long durationMs) {
    this.startTimeUtcMs = startTimeUtcMs;
    this.durationMs = durationMs;
  }

  // Getters and setters

  public Long getStartTimeUtcMs() {
    return startTimeUtcMs;
  }

  public void setStartTimeUtcMs(Long startTimeUtcMs) {
    this.startTimeUtcMs = startTimeUtcMs;
  }

  public Long getDurationMs() {
    return durationMs;
  }

  public void setDurationMs(Long durationMs) {
    this.durationMs = durationMs;
  }
}
