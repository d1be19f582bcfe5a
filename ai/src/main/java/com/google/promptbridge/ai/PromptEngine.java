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
import java.util.function.Consumer;

import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.PromptBridgeException;

/**
 * PromptEngine is the interface to an external prompt-execution engine that
 * evaluates typed, LLM-backed functions.
 *
 * <p>
 * Implementations populate the {@link UsageCollector} found in the
 * {@link CallOptions} before returning. Engine faults are thrown; functional
 * failures reported by the engine come back as {@link CallResult#error}.
 */
public interface PromptEngine {

  /**
   * Invokes a function and returns its single structured result.
   *
   * @param functionName
   *            the engine-side function name
   * @param arguments
   *            the named arguments
   * @param options
   *            the call options carrying the collector
   * @return the outcome of the call
   * @throws PromptBridgeException
   *             if the engine itself fails
   */
  CallResult<Object> invoke(String functionName, Map<String, Object> arguments, CallOptions options)
      throws PromptBridgeException;

  /**
   * Invokes a function in streaming mode. Each partial result is passed to
   * {@code onChunk} in the order the engine produces it; the final value is
   * returned.
   *
   * @param functionName
   *            the engine-side function name
   * @param arguments
   *            the named arguments
   * @param options
   *            the call options carrying the collector
   * @param onChunk
   *            receives partial results
   * @return the outcome of the call, holding the final value on success
   * @throws PromptBridgeException
   *             if the engine itself fails
   */
  CallResult<Object> invokeStream(String functionName, Map<String, Object> arguments, CallOptions options,
      Consumer<Object> onChunk) throws PromptBridgeException;

  /**
   * Creates a fresh usage collector.
   *
   * @param name
   *            the collector name
   * @return the collector
   */
  default UsageCollector newCollector(String name) {
    return new InMemoryUsageCollector(name);
  }
}
