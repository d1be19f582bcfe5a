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

package com.google.promptbridge.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides the shared Jackson mapper used to inspect engine payloads
 * such as recorded HTTP request bodies and streamed chunks.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to a JsonNode.
   *
   * @param value
   *            the object to convert
   * @return the JsonNode
   */
  public static JsonNode toJsonNode(Object value) {
    return objectMapper.valueToTree(value);
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws PromptBridgeException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws PromptBridgeException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new PromptBridgeException("Failed to parse JSON: " + e.getMessage(), e,
          PromptBridgeException.SERIALIZATION_ERROR, null);
    }
  }
}
