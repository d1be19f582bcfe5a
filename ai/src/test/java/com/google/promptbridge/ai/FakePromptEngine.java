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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.google.promptbridge.core.CallResult;

/**
 * Scriptable engine for tests.
 */
public class FakePromptEngine implements PromptEngine {

  public CallResult<Object> result = CallResult.ok("result");
  public RuntimeException failure;
  public int inputTokens = -1;
  public int outputTokens = -1;
  public FunctionLog functionLog;

  public final List<Object> chunks = new ArrayList<>();
  public CallResult<Object> streamResult = CallResult.ok("final");
  public long chunkDelayMillis;
  public CountDownLatch releaseStream;

  public final List<CallOptions> seenOptions = new ArrayList<>();
  public final List<String> createdCollectors = new ArrayList<>();
  public volatile boolean streamFinished;

  @Override
  public CallResult<Object> invoke(String functionName, Map<String, Object> arguments, CallOptions options) {
    seenOptions.add(options);
    if (failure != null) {
      throw failure;
    }
    populate(options);
    return result;
  }

  @Override
  public CallResult<Object> invokeStream(String functionName, Map<String, Object> arguments, CallOptions options,
      Consumer<Object> onChunk) {
    try {
      if (releaseStream != null) {
        releaseStream.await(10, TimeUnit.SECONDS);
      }
      if (failure != null) {
        throw failure;
      }
      for (Object chunk : chunks) {
        if (chunkDelayMillis > 0) {
          Thread.sleep(chunkDelayMillis);
        }
        onChunk.accept(chunk);
      }
      return streamResult;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CallResult.error(e);
    } finally {
      streamFinished = true;
    }
  }

  @Override
  public UsageCollector newCollector(String name) {
    createdCollectors.add(name);
    return new InMemoryUsageCollector(name);
  }

  private void populate(CallOptions options) {
    UsageCollector collector = options.getCollector();
    if (!(collector instanceof InMemoryUsageCollector)) {
      return;
    }
    InMemoryUsageCollector memory = (InMemoryUsageCollector) collector;
    if (functionLog != null) {
      memory.record(functionLog);
    }
    if (inputTokens >= 0 && outputTokens >= 0) {
      memory.recordUsage(inputTokens, outputTokens);
    }
  }
}
