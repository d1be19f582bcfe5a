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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.promptbridge.core.JsonUtils;

/**
 * ChunkFilter decides which streamed chunks are passed to the consumer.
 *
 * <p>
 * Engines may emit structurally valid chunks before any content has been
 * generated. A chunk is dropped when it is null or when its {@code content}
 * field is present and null. An empty string is content.
 */
public final class ChunkFilter {

  private static final Logger logger = LoggerFactory.getLogger(ChunkFilter.class);

  static final String CONTENT_FIELD = "content";

  private ChunkFilter() {
    // Utility class
  }

  /**
   * Returns whether a chunk should be yielded.
   *
   * @param payload
   *            the chunk payload
   * @return false for content-less chunks
   */
  public static boolean hasContent(Object payload) {
    if (payload == null) {
      return false;
    }
    if (payload instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) payload;
      return !(map.containsKey(CONTENT_FIELD) && map.get(CONTENT_FIELD) == null);
    }
    if (payload instanceof CharSequence || payload instanceof Number || payload instanceof Boolean) {
      return true;
    }
    try {
      JsonNode node = payload instanceof JsonNode ? (JsonNode) payload : JsonUtils.toJsonNode(payload);
      if (node == null || node.isNull() || node.isMissingNode()) {
        return false;
      }
      return !(node.isObject() && node.has(CONTENT_FIELD) && node.get(CONTENT_FIELD).isNull());
    } catch (IllegalArgumentException e) {
      logger.debug("Cannot inspect chunk of type {}, passing it through: {}", payload.getClass().getName(),
          e.getMessage());
      return true;
    }
  }
}
