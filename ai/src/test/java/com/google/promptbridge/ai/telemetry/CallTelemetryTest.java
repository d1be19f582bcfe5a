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

package com.google.promptbridge.ai.telemetry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.promptbridge.ai.CallOptions;
import com.google.promptbridge.ai.FakePromptEngine;
import com.google.promptbridge.ai.FunctionLog;
import com.google.promptbridge.ai.HttpRequestLog;
import com.google.promptbridge.ai.InMemoryUsageCollector;
import com.google.promptbridge.ai.InvocationDescriptor;
import com.google.promptbridge.ai.LlmCall;
import com.google.promptbridge.ai.UsageCollector;
import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.PromptBridgeException;
import com.google.promptbridge.core.telemetry.EventBus;
import com.google.promptbridge.core.telemetry.EventKind;
import com.google.promptbridge.core.telemetry.SimpleEventBus;
import com.google.promptbridge.core.telemetry.TelemetryEvent;

/**
 * Unit tests for CallTelemetry.
 */
class CallTelemetryTest {

  private SimpleEventBus bus;
  private List<TelemetryEvent> events;
  private FakePromptEngine engine;

  @BeforeEach
  void setUp() {
    bus = new SimpleEventBus();
    events = new ArrayList<>();
    bus.attach("test", events::add);
    engine = new FakePromptEngine();
    engine.inputTokens = 40;
    engine.outputTokens = 12;
  }

  private static InvocationDescriptor descriptor(TelemetryConfig config) {
    return InvocationDescriptor.builder().functionName("ExtractTasks").resource("Tasks").action("extract_tasks")
        .arguments(Map.of("input", "buy milk")).telemetry(config).build();
  }

  private InstrumentedCall<CallResult<Object>> run(CallTelemetry telemetry, InvocationDescriptor descriptor,
      UsageCollector existing) {
    return telemetry.execute(descriptor, existing, engine::newCollector,
        options -> engine.invoke(descriptor.getFunctionName(), descriptor.getArguments(), options));
  }

  @Test
  void testStartAndStopEvents() {
    CallTelemetry telemetry = new CallTelemetry(bus);

    InstrumentedCall<CallResult<Object>> call = run(telemetry, descriptor(TelemetryConfig.defaults()), null);

    assertEquals(CallResult.ok("result"), call.getResult());
    assertTrue(call.isPublished());
    assertEquals(2, events.size());

    TelemetryEvent start = events.get(0);
    assertEquals(List.of("promptbridge", "call", "start"), start.getName());
    assertTrue(start.getMeasurements().containsKey("monotonic_time"));
    assertTrue(start.getMeasurements().containsKey("system_time"));

    TelemetryEvent stop = events.get(1);
    assertEquals(List.of("promptbridge", "call", "stop"), stop.getName());
    assertEquals(40, stop.getMeasurements().get("input_tokens"));
    assertEquals(12, stop.getMeasurements().get("output_tokens"));
    assertEquals(52, stop.getMeasurements().get("total_tokens"));
    assertTrue((Long) stop.getMeasurements().get("duration") >= 0);
  }

  @Test
  void testStartMetadataMatchesStopBaseMetadata() {
    run(new CallTelemetry(bus), descriptor(TelemetryConfig.defaults()), null);

    Map<String, Object> start = events.get(0).getMetadata();
    Map<String, Object> stop = events.get(1).getMetadata();

    assertEquals("Tasks", start.get("resource"));
    assertEquals("extract_tasks", start.get("action"));
    assertEquals("ExtractTasks", start.get("function_name"));
    for (Map.Entry<String, Object> entry : start.entrySet()) {
      assertEquals(entry.getValue(), stop.get(entry.getKey()), entry.getKey());
    }
    assertTrue(stop.containsKey("model_name"));
    assertTrue(stop.containsKey("num_attempts"));
  }

  @Test
  void testStopCarriesDiagnostics() {
    HttpRequestLog request = new HttpRequestLog();
    request.setBody("{\"model\":\"claude-sonnet\"}");
    LlmCall llmCall = new LlmCall();
    llmCall.setProvider("anthropic");
    llmCall.setRequest(request);
    FunctionLog log = new FunctionLog();
    log.setId("req-1");
    log.setCalls(List.of(llmCall));
    engine.functionLog = log;

    run(new CallTelemetry(bus), descriptor(TelemetryConfig.defaults()), null);

    Map<String, Object> stop = events.get(1).getMetadata();
    assertEquals("claude-sonnet", stop.get("model_name"));
    assertEquals("anthropic", stop.get("provider"));
    assertEquals(1, stop.get("num_attempts"));
    assertEquals("req-1", stop.get("request_id"));
  }

  @Test
  void testDisabledStillCreatesCollector() {
    CallTelemetry telemetry = new CallTelemetry(bus);

    InstrumentedCall<CallResult<Object>> call = run(telemetry, descriptor(TelemetryConfig.disabled()), null);

    assertTrue(events.isEmpty());
    assertFalse(call.isPublished());
    assertNotNull(call.getCollector());
    assertEquals(1, engine.createdCollectors.size());
    assertSame(call.getCollector(), engine.seenOptions.get(0).getCollector());
  }

  @Test
  void testZeroSampleRatePublishesNothing() {
    CallTelemetry telemetry = new CallTelemetry(bus, () -> 0.0);

    InstrumentedCall<CallResult<Object>> call = run(telemetry,
        descriptor(TelemetryConfig.builder().sampleRate(0.0).build()), null);

    assertTrue(events.isEmpty());
    assertNotNull(call.getCollector());
  }

  @Test
  void testSamplingUsesRandomDraw() {
    TelemetryConfig half = TelemetryConfig.builder().sampleRate(0.5).build();

    run(new CallTelemetry(bus, () -> 0.7), descriptor(half), null);
    assertTrue(events.isEmpty());

    run(new CallTelemetry(bus, () -> 0.2), descriptor(half), null);
    assertEquals(2, events.size());
  }

  @Test
  void testFullSampleRateNeverDraws() {
    CallTelemetry telemetry = new CallTelemetry(bus, () -> {
      throw new AssertionError("no draw expected");
    });

    assertTrue(telemetry.isSampled(TelemetryConfig.defaults()));
  }

  @Test
  void testReusesSuppliedCollector() {
    InMemoryUsageCollector existing = new InMemoryUsageCollector("caller-owned");

    InstrumentedCall<CallResult<Object>> call = run(new CallTelemetry(bus),
        descriptor(TelemetryConfig.defaults()), existing);

    assertSame(existing, call.getCollector());
    assertTrue(engine.createdCollectors.isEmpty());
    assertEquals("caller-owned", events.get(0).getMetadata().get("collector_name"));
  }

  @Test
  void testExceptionEventAndRethrow() {
    PromptBridgeException failure = new PromptBridgeException("provider unavailable");
    engine.failure = failure;

    PromptBridgeException thrown = assertThrows(PromptBridgeException.class,
        () -> run(new CallTelemetry(bus), descriptor(TelemetryConfig.defaults()), null));

    assertSame(failure, thrown);
    assertEquals(2, events.size());
    TelemetryEvent exception = events.get(1);
    assertEquals(EventKind.EXCEPTION, exception.getKind());
    assertEquals("provider unavailable", exception.getMetadata().get("reason"));
    assertEquals("error", exception.getMetadata().get("kind"));
    assertEquals(PromptBridgeException.class.getName(), exception.getMetadata().get("error_type"));
    assertTrue(exception.getMeasurements().containsKey("duration"));
  }

  @Test
  void testExceptionEventCanBeDisabled() {
    engine.failure = new IllegalStateException("boom");
    TelemetryConfig config = TelemetryConfig.builder().events(EventKind.START, EventKind.STOP).build();

    assertThrows(IllegalStateException.class, () -> run(new CallTelemetry(bus), descriptor(config), null));

    assertEquals(1, events.size());
    assertEquals(EventKind.START, events.get(0).getKind());
  }

  @Test
  void testPublishFailureDoesNotMaskResult() {
    EventBus failing = mock(EventBus.class);
    doThrow(new IllegalStateException("bus down")).when(failing).publish(any());

    InstrumentedCall<CallResult<Object>> call = run(new CallTelemetry(failing),
        descriptor(TelemetryConfig.defaults()), null);

    assertEquals(CallResult.ok("result"), call.getResult());
    verify(failing, times(2)).publish(any());
  }

  @Test
  void testCustomPrefix() {
    run(new CallTelemetry(bus), descriptor(TelemetryConfig.builder().prefix("my_app", "llm").build()), null);

    assertEquals(List.of("my_app", "llm", "call", "start"), events.get(0).getName());
  }

  @Test
  void testOptInMetadata() {
    TelemetryConfig config = TelemetryConfig.builder().metadata("llm_client", "stream").build();
    InvocationDescriptor descriptor = InvocationDescriptor.builder().functionName("ExtractTasks")
        .resource("Tasks").action("extract_tasks").telemetry(config).context("llm_client", "GPT4Mini").build();

    run(new CallTelemetry(bus), descriptor, null);

    Map<String, Object> metadata = events.get(0).getMetadata();
    assertEquals("GPT4Mini", metadata.get("llm_client"));
    assertEquals(false, metadata.get("stream"));
  }

  @Test
  void testOptInMetadataAbsentByDefault() {
    run(new CallTelemetry(bus), descriptor(TelemetryConfig.defaults()), null);

    assertFalse(events.get(0).getMetadata().containsKey("llm_client"));
    assertFalse(events.get(0).getMetadata().containsKey("stream"));
  }

  @Test
  void testCollectorNaming() {
    CallTelemetry telemetry = new CallTelemetry(bus);

    String generated = telemetry.collectorName(descriptor(TelemetryConfig.defaults()));
    assertTrue(generated.startsWith("Tasks-ExtractTasks-"), generated);
    assertNotEquals(generated, telemetry.collectorName(descriptor(TelemetryConfig.defaults())));

    TelemetryConfig named = TelemetryConfig.builder().collectorName(d -> d.getAction() + "-usage").build();
    run(telemetry, descriptor(named), null);
    assertEquals(List.of("extract_tasks-usage"), engine.createdCollectors);
  }

  @Test
  void testEmptyNameFunctionFallsBackToDefault() {
    CallTelemetry telemetry = new CallTelemetry(bus);
    TelemetryConfig config = TelemetryConfig.builder().collectorName(d -> "").build();

    assertTrue(telemetry.collectorName(descriptor(config)).startsWith("Tasks-ExtractTasks-"));
  }

  @Test
  void testNullBusIsNoop() {
    CallTelemetry telemetry = new CallTelemetry(null);

    assertSame(EventBus.noop(), telemetry.getEventBus());
    assertNotNull(telemetry.execute(descriptor(TelemetryConfig.defaults()), null, engine::newCollector,
        CallOptions::getCollector).getResult());
  }
}
