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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.ai.telemetry.CallTelemetry;
import com.google.promptbridge.ai.telemetry.InstrumentedCall;
import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.PromptBridgeException;

/**
 * FunctionCaller runs single-shot calls: telemetry around the engine call,
 * variant tagging of the result, then wrapping in a {@link Response}.
 *
 * <p>
 * Error outcomes are returned as the engine reported them, without an
 * envelope. Engine faults propagate unchanged.
 */
public class FunctionCaller {

  private static final Logger logger = LoggerFactory.getLogger(FunctionCaller.class);

  private final CallTelemetry telemetry;

  /**
   * Creates a FunctionCaller.
   *
   * @param telemetry
   *            the call telemetry
   */
  public FunctionCaller(CallTelemetry telemetry) {
    if (telemetry == null) {
      throw new IllegalArgumentException("Call telemetry is required");
    }
    this.telemetry = telemetry;
  }

  /**
   * Calls a function with a fresh collector.
   *
   * @param engine
   *            the engine
   * @param descriptor
   *            the call
   * @return the wrapped result, or the engine's error
   * @throws PromptBridgeException
   *             if the engine fails
   */
  public CallResult<Response<Object>> call(PromptEngine engine, InvocationDescriptor descriptor)
      throws PromptBridgeException {
    return call(engine, descriptor, null);
  }

  /**
   * Calls a function, reusing the supplied collector when there is one.
   *
   * @param engine
   *            the engine
   * @param descriptor
   *            the call
   * @param collector
   *            a collector to reuse, or null
   * @return the wrapped result, or the engine's error
   * @throws PromptBridgeException
   *             if the engine fails
   */
  public CallResult<Response<Object>> call(PromptEngine engine, InvocationDescriptor descriptor,
      UsageCollector collector) throws PromptBridgeException {
    InstrumentedCall<CallResult<Object>> instrumented = telemetry.execute(descriptor, collector,
        engine::newCollector,
        options -> engine.invoke(descriptor.getFunctionName(), descriptor.getArguments(), options));

    CallResult<Object> outcome = instrumented.getResult();
    if (outcome == null) {
      throw PromptBridgeException.builder().message("Engine returned no result for " + descriptor.getFunctionName())
          .errorCode(PromptBridgeException.ENGINE_FAILURE).build();
    }
    if (outcome.isError()) {
      logger.debug("Call {} returned an error: {}", descriptor, outcome.getErrorMessage());
      return CallResult.error(outcome.getError());
    }
    UsageCollector used = instrumented.getCollector();
    return outcome.map(data -> Response.wrap(VariantResolver.tag(data, descriptor.getReturnVariants()), used));
  }
}
