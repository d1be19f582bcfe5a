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

import java.util.Map;

/**
 * UsageCollector is the per-call accumulator the engine fills with token
 * counts and diagnostic data while it executes a function.
 *
 * <p>
 * A collector belongs to exactly one call. It is written by the engine during
 * the call and read by the bridge after the call returned, so no locking is
 * needed between the two. Both query methods may throw; callers go through
 * {@link UsageExtractor}, which never does.
 */
public interface UsageCollector {

  /**
   * Returns the collector name.
   *
   * @return the name
   */
  String getName();

  /**
   * Returns the raw usage reported by the engine, keyed
   * {@code input_tokens} and {@code output_tokens}.
   *
   * @return the raw usage map, may be empty
   */
  Map<String, Object> usage();

  /**
   * Returns the log of the most recent function execution recorded by this
   * collector.
   *
   * @return the function log, or null if none was recorded
   */
  FunctionLog lastFunctionLog();
}
