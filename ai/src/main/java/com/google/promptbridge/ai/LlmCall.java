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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * LlmCall is one attempt the engine made against an LLM client while executing
 * a function. Retries and fallbacks produce several calls; the one whose
 * response was used is marked selected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LlmCall {

  @JsonProperty("client_name")
  private String clientName;

  @JsonProperty("provider")
  private String provider;

  @JsonProperty("selected")
  private Boolean selected;

  @JsonProperty("request")
  private HttpRequestLog request;

  @JsonProperty("response")
  private HttpResponseLog response;

  @JsonProperty("usage")
  private Usage usage;

  @JsonProperty("timing")
  private Timing timing;

  /**
   * Default constructor.
   */
  public LlmCall() {
  }

  // Getters and setters

  public String getClientName() {
    return clientName;
  }

  public void setClientName(String clientName) {
    this.clientName = clientName;
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }

  public Boolean getSelected() {
    return selected;
  }

  public void setSelected(Boolean selected) {
    this.selected = selected;
  }

  public HttpRequestLog getRequest() {
    return request;
  }

  public void setRequest(HttpRequestLog request) {
    this.request = request;
  }

  public HttpResponseLog getResponse() {
    return response;
  }

  public void setResponse(HttpResponseLog response) {
    this.response = response;
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
