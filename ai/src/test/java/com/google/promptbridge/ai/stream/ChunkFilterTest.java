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

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.promptbridge.core.JsonUtils;

/**
 * Unit tests for ChunkFilter.
 */
class ChunkFilterTest {

  static class Partial {
    public String content;
    public Integer progress;

    Partial(String content) {
      this.content = content;
    }
  }

  @Test
  void testNullPayloadDropped() {
    assertFalse(ChunkFilter.hasContent(null));
  }

  @Test
  void testMapWithNullContentDropped() {
    Map<String, Object> chunk = new HashMap<>();
    chunk.put("content", null);

    assertFalse(ChunkFilter.hasContent(chunk));
    assertTrue(ChunkFilter.hasContent(Map.of("content", "a")));
    assertTrue(ChunkFilter.hasContent(Map.of("content", "")));
    assertTrue(ChunkFilter.hasContent(Map.of("tasks", 3)));
  }

  @Test
  void testObjectWithNullContentDropped() {
    assertFalse(ChunkFilter.hasContent(new Partial(null)));
    assertTrue(ChunkFilter.hasContent(new Partial("draft")));
  }

  @Test
  void testJsonNodeChunk() {
    assertFalse(ChunkFilter.hasContent(JsonUtils.parseJson("{\"content\":null}")));
    assertTrue(ChunkFilter.hasContent(JsonUtils.parseJson("{\"content\":\"x\"}")));
  }

  @Test
  void testScalarsKept() {
    assertTrue(ChunkFilter.hasContent("partial text"));
    assertTrue(ChunkFilter.hasContent(42));
  }
}
