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

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.promptbridge.core.JsonUtils;

/**
 * UsageExtractor reads usage and diagnostics out of a {@link UsageCollector}.
 *
 * <p>
 * Neither method throws. A collector that fails or reports nothing usable
 * yields {@link Usage#zero()} and {@link CallDiagnostics#empty()}
 * respectively, and the failure is logged at debug level.
 */
public final class UsageExtractor {

  private static final Logger logger = LoggerFactory.getLogger(UsageExtractor.class);

  private static final BigDecimal MAX_COUNT = BigDecimal.valueOf(Integer.MAX_VALUE);

  private UsageExtractor() {
    // Utility class
  }

  /**
   * Extracts the usage snapshot from a collector.
   *
   * @param collector
   *            the collector, may be null
   * @return the usage, zero when unavailable
   */
  public static Usage extractUsage(UsageCollector collector) {
    if (collector == null) {
      return Usage.zero();
    }
    Map<String, Object> raw;
    try {
      raw = collector.usage();
    } catch (RuntimeException e) {
      logger.debug("Failed to extract token usage from collector: {}", e.toString());
      return Usage.zero();
    }
    if (raw == null || !raw.containsKey("input_tokens") || !raw.containsKey("output_tokens")) {
      return Usage.zero();
    }
    try {
      return new Usage(toCount(raw.get("input_tokens")), toCount(raw.get("output_tokens")));
    } catch (IllegalArgumentException | ArithmeticException e) {
      logger.warn("Collector {} reported invalid token counts, using zero usage: {}", collector.getName(),
          e.getMessage());
      return Usage.zero();
    }
  }

  /**
   * Extracts observability data from the collector's last function log.
   *
   * @param collector
   *            the collector, may be null
   * @return the diagnostics, empty when unavailable
   */
  public static CallDiagnostics extractDiagnostics(UsageCollector collector) {
    if (collector == null) {
      return CallDiagnostics.empty();
    }
    try {
      FunctionLog log = collector.lastFunctionLog();
      if (log == null) {
        return CallDiagnostics.empty();
      }
      LlmCall call = selectedOrFirstCall(log);
      return CallDiagnostics.builder().modelName(extractModelName(call))
          .provider(call != null ? call.getProvider() : null)
          .clientName(call != null ? call.getClientName() : null)
          .numAttempts(log.getCalls() != null ? log.getCalls().size() : null).requestId(log.getId())
          .rawResponse(log.getRawLlmResponse())
          .tags(log.getTags() != null && !log.getTags().isEmpty() ? log.getTags() : null)
          .logType(log.getLogType()).httpRequest(summarizeRequest(call)).httpResponse(summarizeResponse(call))
          .timing(log.getTiming()).build();
    } catch (RuntimeException e) {
      logger.debug("Failed to extract observability data from collector: {}", e.toString());
      return CallDiagnostics.empty();
    }
  }

  /**
   * Converts a reported token count. Counts must be whole, non-negative and
   * fit in an int; anything else is rejected rather than narrowed.
   */
  private static int toCount(Object value) {
    if (value == null) {
      return 0;
    }
    BigDecimal count;
    try {
      count = new BigDecimal(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Token count is not a number: " + value);
    }
    if (count.signum() < 0) {
      throw new IllegalArgumentException("Token count is negative: " + value);
    }
    if (count.stripTrailingZeros().scale() > 0) {
      throw new IllegalArgumentException("Token count is not a whole number: " + value);
    }
    if (count.compareTo(MAX_COUNT) > 0) {
      throw new IllegalArgumentException("Token count out of range: " + value);
    }
    return count.intValueExact();
  }

  private static LlmCall selectedOrFirstCall(FunctionLog log) {
    List<LlmCall> calls = log.getCalls();
    if (calls == null || calls.isEmpty()) {
      return null;
    }
    for (LlmCall call : calls) {
      if (Boolean.TRUE.equals(call.getSelected())) {
        return call;
      }
    }
    return calls.get(0);
  }

  /**
   * Reads the {@code model} field of the request body JSON.
   */
  private static String extractModelName(LlmCall call) {
    if (call == null || call.getRequest() == null || call.getRequest().getBody() == null) {
      return null;
    }
    try {
      JsonNode body = JsonUtils.parseJson(call.getRequest().getBody());
      JsonNode model = body.get("model");
      return model != null && model.isTextual() ? model.asText() : null;
    } catch (RuntimeException e) {
      logger.debug("Request body is not JSON, no model name: {}", e.getMessage());
      return null;
    }
  }

  private static Map<String, Object> summarizeRequest(LlmCall call) {
    if (call == null || call.getRequest() == null) {
      return null;
    }
    HttpRequestLog request = call.getRequest();
    Map<String, Object> summary = new LinkedHashMap<>();
    putIfPresent(summary, "url", request.getUrl());
    putIfPresent(summary, "method", request.getMethod());
    putIfPresent(summary, "headers", request.getHeaders());
    putIfPresent(summary, "body", request.getBody());
    return summary.isEmpty() ? null : summary;
  }

  private static Map<String, Object> summarizeResponse(LlmCall call) {
    if (call == null || call.getResponse() == null) {
      return null;
    }
    HttpResponseLog response = call.getResponse();
    Map<String, Object> summary = new LinkedHashMap<>();
    putIfPresent(summary, "status_code", response.getStatusCode());
    putIfPresent(summary, "headers", response.getHeaders());
    putIfPresent(summary, "body", response.getBody());
    return summary.isEmpty() ? null : summary;
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
