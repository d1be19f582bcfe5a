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

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FunctionLog is the engine's record of one function execution, as held by a
 * {@link UsageCollector}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FunctionLog {

  @JsonProperty("id")
  private String id;

  @JsonProperty("function_name")
  private String functionName;

  @JsonProperty("log_type")
  private String logType;

  @JsonProperty("raw_llm_response")
  private String rawLlmResponse;

  @JsonProperty("tags")
  private Map<String, String> tags;

  @JsonProperty("calls")
  private List<LlmCall> calls;

  @JsonProperty("usage")
  private Usage usage;

  @JsonProperty("timing")
  private Timing timing;

  /**
   * Default constructor.
   */
  public FunctionLog() {
  }

  // Getters and setters

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getFunctionName() {
    return functionName;
  }

  public void setFunctionName(String functionName) {
    this.functionName = functionName;
  }

  public String getLogType() {
    return logType;
  }

  public void setLogType(String logType) {
    this.logType = logType;
  }

  public String getRawLlmResponse() {
    return rawLlmResponse;
  }

  public void setRawLlmResponse(String rawLlmResponse) {
    this.rawLlmResponse = rawLlmResponse;
  }

  public Map<String, String> getTags() {
    return tags;
  }

  public void setTags(Map<String, String> tags) {
    this.tags = tags;
  }

  public List<LlmCall> getCalls() {
    return calls;
  }

  public void setCalls(List<LlmCall> calls) {
    this.calls = calls;
  }

  public Usage getUsage() {
    return usage;
  }

  public void setUsage(Usage usage) {
    this.usage = usage;
  }

  public Timing getTiming() {
    return timing;
  }

  public void setTiming(Timing timing) {
    this.timing = timing;
  }
}
