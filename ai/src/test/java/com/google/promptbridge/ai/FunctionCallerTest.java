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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.promptbridge.ai.telemetry.CallTelemetry;
import com.google.promptbridge.ai.telemetry.TelemetryConfig;
import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.PromptBridgeException;
import com.google.promptbridge.core.telemetry.EventKind;
import com.google.promptbridge.core.telemetry.SimpleEventBus;
import com.google.promptbridge.core.telemetry.TelemetryEvent;

/**
 * Unit tests for FunctionCaller.
 */
class FunctionCallerTest {

  static class Reply {
  }

  static class Clarification {
  }

  private SimpleEventBus bus;
  private List<TelemetryEvent> events;
  private FakePromptEngine engine;
  private FunctionCaller caller;

  @BeforeEach
  void setUp() {
    bus = new SimpleEventBus();
    events = new ArrayList<>();
    bus.attach("test", events::add);
    engine = new FakePromptEngine();
    caller = new FunctionCaller(new CallTelemetry(bus));
  }

  private static InvocationDescriptor.Builder descriptor() {
    return InvocationDescriptor.builder().functionName("ExtractTasks").resource("Tasks").action("extract_tasks")
        .arguments(Map.of("input", "buy milk"));
  }

  @Test
  void testSuccessIsWrapped() {
    engine.result = CallResult.ok(Map.of("tasks", List.of("buy milk")));
    engine.inputTokens = 30;
    engine.outputTokens = 8;

    CallResult<Response<Object>> result = caller.call(engine, descriptor().build());

    assertTrue(result.isOk());
    Response<Object> response = result.getData();
    assertEquals(Map.of("tasks", List.of("buy milk")), Response.unwrap(response));
    assertEquals(new Usage(30, 8), response.getUsage());
    assertEquals(38, Response.usage(response).getTotalTokens());
    assertEquals(List.of(EventKind.START, EventKind.STOP),
        List.of(events.get(0).getKind(), events.get(1).getKind()));
  }

  @Test
  void testErrorIsNotWrapped() {
    engine.result = CallResult.error("validation failed");

    CallResult<Response<Object>> result = caller.call(engine, descriptor().build());

    assertTrue(result.isError());
    assertEquals("validation failed", result.getError());
    assertNull(result.getData());
  }

  @Test
  void testUsageMatchesCollectorAfterCall() {
    engine.inputTokens = 5;
    engine.outputTokens = 2;
    InMemoryUsageCollector collector = new InMemoryUsageCollector("shared");

    Response<Object> response = caller.call(engine, descriptor().build(), collector).getData();

    assertEquals(new Usage(5, 2), response.getUsage());
    assertSame(collector, response.getCollector());
    assertSame(collector, engine.seenOptions.get(0).getCollector());
    assertTrue(engine.createdCollectors.isEmpty());
  }

  @Test
  void testReusedCollectorAccumulates() {
    engine.inputTokens = 10;
    engine.outputTokens = 4;
    InMemoryUsageCollector collector = new InMemoryUsageCollector("session");

    caller.call(engine, descriptor().build(), collector);
    Response<Object> second = caller.call(engine, descriptor().build(), collector).getData();

    assertEquals(new Usage(20, 8), second.getUsage());
  }

  @Test
  void testUsageAvailableWithoutTelemetry() {
    engine.inputTokens = 3;
    engine.outputTokens = 1;
    TelemetryConfig disabled = TelemetryConfig.disabled();
    TelemetryConfig unsampled = TelemetryConfig.builder().sampleRate(0.0).build();

    Response<Object> first = caller.call(engine, descriptor().telemetry(disabled).build()).getData();
    Response<Object> second = caller.call(engine, descriptor().telemetry(unsampled).build()).getData();

    assertEquals(new Usage(3, 1), first.getUsage());
    assertEquals(new Usage(3, 1), second.getUsage());
    assertTrue(events.isEmpty());
    assertEquals(2, engine.createdCollectors.size());
  }

  @Test
  void testMissingUsageIsZero() {
    Response<Object> response = caller.call(engine, descriptor().build()).getData();

    assertEquals(Usage.zero(), response.getUsage());
    assertEquals("result", response.getData());
  }

  @Test
  void testVariantTaggedBeforeWrapping() {
    Clarification clarification = new Clarification();
    engine.result = CallResult.ok(clarification);
    InvocationDescriptor tagged = descriptor().returnVariant("reply", Reply.class)
        .returnVariant("clarification", Clarification.class).build();

    Response<Object> response = caller.call(engine, tagged).getData();

    assertEquals(new TaggedValue("clarification", clarification), response.getData());
  }

  @Test
  void testEngineFaultPropagates() {
    PromptBridgeException failure = new PromptBridgeException("engine crashed");
    engine.failure = failure;

    PromptBridgeException thrown = assertThrows(PromptBridgeException.class,
        () -> caller.call(engine, descriptor().build()));

    assertSame(failure, thrown);
    assertEquals(EventKind.EXCEPTION, events.get(events.size() - 1).getKind());
  }

  @Test
  void testNullOutcomeIsEngineFailure() {
    engine.result = null;

    PromptBridgeException thrown = assertThrows(PromptBridgeException.class,
        () -> caller.call(engine, descriptor().build()));

    assertEquals(PromptBridgeException.ENGINE_FAILURE, thrown.getErrorCode());
  }

  @Test
  void testTelemetryRequired() {
    assertThrows(IllegalArgumentException.class, () -> new FunctionCaller(null));
  }
}
