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

package com.google.promptbridge.ai.stream;

/**
 * StreamPhase is the lifecycle phase of a stream session.
 */
public enum StreamPhase {
  STREAMING("streaming"),
  COMPLETED("completed"),
  FAILED("failed"),
  ABANDONED("abandoned"),
  TIMED_OUT("timed_out");

  private final String value;

  StreamPhase(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Returns whether the phase is terminal.
   *
   * @return true for every phase but STREAMING
   */
  public boolean isTerminal() {
    return this != STREAMING;
  }

  /**
   * Returns whether the consumer should treat the phase as an error. Timeouts
   * are reported the same way as engine failures.
   *
   * @return true for FAILED and TIMED_OUT
   */
  public boolean isError() {
    return this == FAILED || this == TIMED_OUT;
  }

  @Override
  public String toString() {
    return value;
  }
}
