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
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for UsageExtractor and InMemoryUsageCollector.
 */
@ExtendWith(MockitoExtension.class)
class UsageExtractorTest {

  @Mock
  private UsageCollector brokenCollector;

  static FunctionLog sampleLog() {
    HttpRequestLog request = new HttpRequestLog();
    request.setUrl("https://api.example.com/v1/chat");
    request.setMethod("POST");
    request.setBody("{\"model\":\"gpt-4o-mini\",\"messages\":[]}");

    HttpResponseLog response = new HttpResponseLog();
    response.setStatusCode(200);

    LlmCall failed = new LlmCall();
    failed.setClientName("Primary");
    failed.setProvider("anthropic");
    failed.setSelected(false);

    LlmCall selected = new LlmCall();
    selected.setClientName("Fallback");
    selected.setProvider("openai");
    selected.setSelected(true);
    selected.setRequest(request);
    selected.setResponse(response);

    FunctionLog log = new FunctionLog();
    log.setId("req-42");
    log.setFunctionName("ExtractTasks");
    log.setLogType("call");
    log.setRawLlmResponse("{\"tasks\":[]}");
    log.setTags(Map.of());
    log.setCalls(List.of(failed, selected));
    log.setUsage(new Usage(100, 20));
    log.setTiming(new Timing(1700000000000L, 850L));
    return log;
  }

  @Test
  void testExtractUsage() {
    InMemoryUsageCollector collector = new InMemoryUsageCollector("c");
    collector.recordUsage(10, 5);
    collector.recordUsage(1, 2);

    Usage usage = UsageExtractor.extractUsage(collector);

    assertEquals(new Usage(11, 7), usage);
    assertEquals(usage.getInputTokens() + usage.getOutputTokens(), usage.getTotalTokens());
  }

  @Test
  void testExtractUsageFromEmptyCollector() {
    assertEquals(Usage.zero(), UsageExtractor.extractUsage(new InMemoryUsageCollector("empty")));
    assertEquals(Usage.zero(), UsageExtractor.extractUsage(null));
  }

  @Test
  void testExtractUsageDegradesWhenCollectorThrows() {
    when(brokenCollector.usage()).thenThrow(new IllegalStateException("native handle released"));

    assertEquals(Usage.zero(), UsageExtractor.extractUsage(brokenCollector));
  }

  @Test
  void testExtractUsageAcceptsStringCounts() {
    when(brokenCollector.usage()).thenReturn(Map.of("input_tokens", "7", "output_tokens", 3L));

    assertEquals(new Usage(7, 3), UsageExtractor.extractUsage(brokenCollector));
  }

  @Test
  void testExtractUsageRejectsCountsBeyondIntRange() {
    when(brokenCollector.usage())
        .thenReturn(Map.of("input_tokens", Integer.MAX_VALUE + 1L, "output_tokens", 3L));

    assertEquals(Usage.zero(), UsageExtractor.extractUsage(brokenCollector));
  }

  @Test
  void testExtractUsageRejectsFractionalCounts() {
    when(brokenCollector.usage()).thenReturn(Map.of("input_tokens", 12.5, "output_tokens", 3));

    assertEquals(Usage.zero(), UsageExtractor.extractUsage(brokenCollector));
  }

  @Test
  void testExtractUsageAcceptsWholeDecimalCounts() {
    when(brokenCollector.usage()).thenReturn(Map.of("input_tokens", 12.0, "output_tokens", "4"));

    assertEquals(new Usage(12, 4), UsageExtractor.extractUsage(brokenCollector));
  }

  @Test
  void testExtractUsageRejectsOverflowingTotal() {
    when(brokenCollector.usage())
        .thenReturn(Map.of("input_tokens", Integer.MAX_VALUE, "output_tokens", 1));

    assertEquals(Usage.zero(), UsageExtractor.extractUsage(brokenCollector));
  }

  @Test
  void testRecordFunctionLogAddsUsage() {
    InMemoryUsageCollector collector = new InMemoryUsageCollector("c");

    collector.record(sampleLog());

    assertEquals(Map.of("input_tokens", 100, "output_tokens", 20), collector.usage());
    assertEquals("req-42", collector.lastFunctionLog().getId());
  }

  @Test
  void testExtractDiagnosticsUsesSelectedCall() {
    InMemoryUsageCollector collector = new InMemoryUsageCollector("c");
    collector.record(sampleLog());

    CallDiagnostics diagnostics = UsageExtractor.extractDiagnostics(collector);

    assertEquals("gpt-4o-mini", diagnostics.getModelName());
    assertEquals("openai", diagnostics.getProvider());
    assertEquals("Fallback", diagnostics.getClientName());
    assertEquals(2, diagnostics.getNumAttempts());
    assertEquals("req-42", diagnostics.getRequestId());
    assertEquals("call", diagnostics.getLogType());
    assertNull(diagnostics.getTags());
    assertEquals(850L, diagnostics.getTiming().getDurationMs());
    assertEquals(Map.of("url", "https://api.example.com/v1/chat", "method", "POST", "body",
        "{\"model\":\"gpt-4o-mini\",\"messages\":[]}"), diagnostics.getHttpRequest());
    assertEquals(Map.of("status_code", 200), diagnostics.getHttpResponse());
  }

  @Test
  void testExtractDiagnosticsFallsBackToFirstCall() {
    FunctionLog log = sampleLog();
    log.getCalls().forEach(call -> call.setSelected(null));
    InMemoryUsageCollector collector = new InMemoryUsageCollector("c");
    collector.record(log);

    CallDiagnostics diagnostics = UsageExtractor.extractDiagnostics(collector);

    assertEquals("anthropic", diagnostics.getProvider());
    assertNull(diagnostics.getModelName());
    assertNull(diagnostics.getHttpRequest());
  }

  @Test
  void testExtractDiagnosticsWithoutLog() {
    assertSame(CallDiagnostics.empty(), UsageExtractor.extractDiagnostics(new InMemoryUsageCollector("c")));
  }

  @Test
  void testExtractDiagnosticsDegradesWhenCollectorThrows() {
    when(brokenCollector.lastFunctionLog()).thenThrow(new IllegalStateException("gone"));

    assertSame(CallDiagnostics.empty(), UsageExtractor.extractDiagnostics(brokenCollector));
  }

  @Test
  void testDiagnosticsMetadataKeys() {
    Map<String, Object> metadata = CallDiagnostics.empty().toMetadata();

    assertEquals(List.of("model_name", "provider", "client_name", "num_attempts", "request_id", "raw_response",
        "tags", "log_type", "http_request", "http_response"), List.copyOf(metadata.keySet()));
  }

  @Test
  void testCollectorRequiresName() {
    assertThrows(IllegalArgumentException.class, () -> new InMemoryUsageCollector(""));
  }
}
