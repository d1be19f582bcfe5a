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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.promptbridge.ai.CallOptions;
import com.google.promptbridge.ai.FakePromptEngine;
import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.PromptBridgeException;
import com.google.promptbridge.core.stream.Mailbox;
import com.google.promptbridge.core.stream.ResourceStream;

/**
 * Unit tests for StreamingBridge.
 */
class StreamingBridgeTest {

  private ExecutorService executor;
  private FakePromptEngine engine;
  private StreamingBridge bridge;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    engine = new FakePromptEngine();
    bridge = StreamingBridge.builder().executor(executor).readTimeout(Duration.ofSeconds(2)).build();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  private static Map<String, Object> content(String value) {
    Map<String, Object> chunk = new HashMap<>();
    chunk.put("content", value);
    return chunk;
  }

  private StreamingBridge.StreamHandle open() {
    return bridge.open(engine, "ExtractTasks", Map.of("input", "plan the week"), CallOptions.none());
  }

  @Test
  void testDefaults() {
    StreamingBridge defaults = StreamingBridge.builder().build();

    assertEquals(Duration.ofMillis(100), defaults.getReadTimeout());
    assertEquals(1000, defaults.getMaxDrain());
    assertFalse(defaults.isCancelOnAbandon());
  }

  @Test
  void testChunksThenFinalInOrder() {
    engine.chunks.addAll(List.of("c1", "c2", "c3"));
    engine.streamResult = CallResult.ok("final");
    StreamingBridge.StreamHandle handle = open();

    assertEquals(List.of("c1", "c2", "c3", "final"), handle.toList());
    assertEquals(StreamPhase.COMPLETED, handle.getPhase());
    assertNull(handle.getFailure());
  }

  @Test
  void testNilContentChunkDropped() {
    engine.chunks.addAll(List.of(content("a"), content(null), content("b")));
    engine.streamResult = CallResult.ok(content("c"));

    List<Object> elements = open().toList();

    assertEquals(List.of(content("a"), content("b"), content("c")), elements);
  }

  @Test
  void testNothingRunsBeforeIteration() throws InterruptedException {
    StreamingBridge.StreamHandle handle = open();
    Thread.sleep(50);

    assertNull(handle.getPhase());
    assertFalse(engine.streamFinished);
  }

  @Test
  void testEngineErrorFailsStream() {
    engine.chunks.add("partial");
    engine.streamResult = CallResult.error("schema mismatch");
    StreamingBridge.StreamHandle handle = open();

    assertEquals(List.of("partial"), handle.toList());
    assertEquals(StreamPhase.FAILED, handle.getPhase());
    assertEquals("schema mismatch", handle.getFailure());
    assertTrue(handle.getPhase().isError());
  }

  @Test
  void testEngineExceptionFailsStream() {
    PromptBridgeException failure = new PromptBridgeException("connection reset");
    engine.failure = failure;
    StreamingBridge.StreamHandle handle = open();

    assertTrue(handle.toList().isEmpty());
    assertEquals(StreamPhase.FAILED, handle.getPhase());
    assertSame(failure, handle.getFailure());
  }

  @Test
  void testSilentWorkerTimesOut() {
    engine.releaseStream = new CountDownLatch(1);
    StreamingBridge fast = StreamingBridge.builder().executor(executor).readTimeout(Duration.ofMillis(50))
        .build();
    StreamingBridge.StreamHandle handle = fast.open(engine, "ExtractTasks", Map.of(), CallOptions.none());

    long start = System.nanoTime();
    List<Object> elements = handle.toList();
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    engine.releaseStream.countDown();

    assertTrue(elements.isEmpty());
    assertEquals(StreamPhase.TIMED_OUT, handle.getPhase());
    assertTrue(handle.getPhase().isError());
    assertTrue(elapsedMillis < 2000, "took " + elapsedMillis + " ms");
  }

  @Test
  void testAbandonmentLeavesNoMessages() throws InterruptedException {
    for (int i = 0; i < 50; i++) {
      engine.chunks.add("chunk-" + i);
    }
    engine.chunkDelayMillis = 1;
    StreamingBridge.StreamHandle handle = open();

    Iterator<Object> iterator = handle.iterator();
    assertEquals("chunk-0", iterator.next());
    assertEquals("chunk-1", iterator.next());
    ((ResourceStream.Cursor<?, ?>) iterator).close();
    String token = handle.getToken();

    assertEquals(StreamPhase.ABANDONED, handle.getPhase());
    long deadline = System.currentTimeMillis() + 5000;
    while (!engine.streamFinished && System.currentTimeMillis() < deadline) {
      Thread.sleep(5);
    }
    Thread.sleep(20);
    assertTrue(engine.streamFinished);
    assertFalse(Mailbox.current().receive(token, Duration.ZERO).isPresent());
    assertEquals(0, Mailbox.current().pending(token));
  }

  private void awaitWorker() throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (!engine.streamFinished && System.currentTimeMillis() < deadline) {
      Thread.sleep(5);
    }
    Thread.sleep(20);
    assertTrue(engine.streamFinished);
  }

  @Test
  void testBreakThenCloseHandleLeavesNoMessages() throws InterruptedException {
    for (int i = 0; i < 20; i++) {
      engine.chunks.add("chunk-" + i);
    }
    engine.chunkDelayMillis = 1;
    String token;

    try (StreamingBridge.StreamHandle handle = open()) {
      for (Object chunk : handle) {
        assertEquals("chunk-0", chunk);
        break;
      }
      token = handle.getToken();
      assertEquals(StreamPhase.STREAMING, handle.getPhase());
    }

    awaitWorker();
    assertEquals(0, Mailbox.current().pending(token));
  }

  @Test
  void testCloseHandleAbandonsSession() throws InterruptedException {
    engine.chunks.addAll(List.of("a", "b", "c"));
    StreamingBridge.StreamHandle handle = open();
    for (Object chunk : handle) {
      break;
    }

    handle.close();

    assertEquals(StreamPhase.ABANDONED, handle.getPhase());
    assertFalse(handle.getSession().getChannel().isOpen());
    awaitWorker();
    assertEquals(0, Mailbox.current().pending(handle.getToken()));
  }

  @Test
  void testNewIterationClosesPreviousSession() throws InterruptedException {
    for (int i = 0; i < 20; i++) {
      engine.chunks.add("chunk-" + i);
    }
    StreamingBridge.StreamHandle handle = open();
    Iterator<Object> first = handle.iterator();
    assertEquals("chunk-0", first.next());
    String firstToken = handle.getToken();
    Mailbox.Channel firstChannel = handle.getSession().getChannel();

    Iterator<Object> second = handle.iterator();

    assertFalse(firstChannel.isOpen());
    assertFalse(first.hasNext());
    assertEquals("chunk-0", second.next());
    handle.close();
    awaitWorker();
    assertEquals(0, Mailbox.current().pending(firstToken));
  }

  @Test
  void testCloseAfterCompletionKeepsPhase() {
    StreamingBridge.StreamHandle handle = open();
    assertEquals(List.of("final"), handle.toList());

    handle.close();

    assertEquals(StreamPhase.COMPLETED, handle.getPhase());
  }

  @Test
  void testJavaStreamCloseAbandons() {
    engine.chunks.addAll(List.of("a", "b", "c", "d"));
    StreamingBridge.StreamHandle handle = open();

    List<Object> first;
    try (Stream<Object> stream = handle.stream()) {
      first = stream.limit(1).collect(Collectors.toList());
    }

    assertEquals(List.of("a"), first);
    assertEquals(StreamPhase.ABANDONED, handle.getPhase());
  }

  @Test
  void testEachIterationIsNewSession() {
    engine.chunks.add("only");
    StreamingBridge.StreamHandle handle = open();

    assertEquals(List.of("only", "final"), handle.toList());
    String firstToken = handle.getToken();
    assertEquals(List.of("only", "final"), handle.toList());

    assertNotEquals(firstToken, handle.getToken());
  }

  @Test
  void testCancelOnAbandonInterruptsWorker() throws InterruptedException {
    engine.releaseStream = new CountDownLatch(1);
    StreamingBridge cancelling = StreamingBridge.builder().executor(executor).readTimeout(Duration.ofMillis(20))
        .cancelOnAbandon(true).build();
    StreamingBridge.StreamHandle handle = cancelling.open(engine, "ExtractTasks", Map.of(), CallOptions.none());

    handle.toList();

    assertEquals(StreamPhase.TIMED_OUT, handle.getPhase());
    assertTrue(handle.getSession().getWorker().isCancelled());
    long deadline = System.currentTimeMillis() + 5000;
    while (!engine.streamFinished && System.currentTimeMillis() < deadline) {
      Thread.sleep(5);
    }
    assertTrue(engine.streamFinished);
  }

  @Test
  void testBuilderValidation() {
    assertThrows(IllegalArgumentException.class, () -> StreamingBridge.builder().maxDrain(0));
    assertThrows(IllegalArgumentException.class,
        () -> StreamingBridge.builder().readTimeout(Duration.ofMillis(-1)));
  }
}
