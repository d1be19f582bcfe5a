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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CallDiagnostics holds the observability fields the engine attached to a
 * collector: which model and provider served the call, how many attempts it
 * took, and summaries of the HTTP exchange. Every field is optional.
 */
public final class CallDiagnostics {

  private static final CallDiagnostics EMPTY = builder().build();

  private final String modelName;
  private final String provider;
  private final String clientName;
  private final Integer numAttempts;
  private final String requestId;
  private final String rawResponse;
  private final Map<String, String> tags;
  private final String logType;
  private final Map<String, Object> httpRequest;
  private final Map<String, Object> httpResponse;
  private final Timing timing;

  private CallDiagnostics(Builder builder) {
    this.modelName = builder.modelName;
    this.provider = builder.provider;
    this.clientName = builder.clientName;
    this.numAttempts = builder.numAttempts;
    this.requestId = builder.requestId;
    this.rawResponse = builder.rawResponse;
    this.tags = builder.tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags)) : null;
    this.logType = builder.logType;
    this.httpRequest = builder.httpRequest != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.httpRequest))
        : null;
    this.httpResponse = builder.httpResponse != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.httpResponse))
        : null;
    this.timing = builder.timing;
  }

  /**
   * Returns diagnostics with no fields set.
   *
   * @return the empty diagnostics
   */
  public static CallDiagnostics empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getModelName() {
    return modelName;
  }

  public String getProvider() {
    return provider;
  }

  public String getClientName() {
    return clientName;
  }

  public Integer getNumAttempts() {
    return numAttempts;
  }

  public String getRequestId() {
    return requestId;
  }

  public String getRawResponse() {
    return rawResponse;
  }

  public Map<String, String> getTags() {
    return tags;
  }

  public String getLogType() {
    return logType;
  }

  public Map<String, Object> getHttpRequest() {
    return httpRequest;
  }

  public Map<String, Object> getHttpResponse() {
    return httpResponse;
  }

  public Timing getTiming() {
    return timing;
  }

  /**
   * Returns the diagnostics as event metadata. Every key is present; absent
   * values map to null.
   *
   * @return the metadata map
   */
  public Map<String, Object> toMetadata() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("model_name", modelName);
    map.put("provider", provider);
    map.put("client_name", clientName);
    map.put("num_attempts", numAttempts);
    map.put("request_id", requestId);
    map.put("raw_response", rawResponse);
    map.put("tags", tags);
    map.put("log_type", logType);
    map.put("http_request", httpRequest);
    map.put("http_response", httpResponse);
    return map;
  }

  @Override
  public String toString() {
    return "CallDiagnostics{model=" + modelName + ", provider=" + provider + ", client=" + clientName
        + ", attempts=" + numAttempts + ", requestId=" + requestId + "}";
  }

  /**
   * Builder for CallDiagnostics.
   */
  public static class Builder {
    private String modelName;
    private String provider;
    private String clientName;
    private Integer numAttempts;
    private String requestId;
    private String rawResponse;
    private Map<String, String> tags;
    private String logType;
    private Map<String, Object> httpRequest;
    private Map<String, Object> httpResponse;
    private Timing timing;

    public Builder modelName(String modelName) {
      this.modelName = modelName;
      return this;
    }

    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder clientName(String clientName) {
      this.clientName = clientName;
      return this;
    }

    public Builder numAttempts(Integer numAttempts) {
      this.numAttempts = numAttempts;
      return this;
    }

    public Builder requestId(String requestId) {
      this.requestId = requestId;
      return this;
    }

    public Builder rawResponse(String rawResponse) {
      this.rawResponse = rawResponse;
      return this;
    }

    public Builder tags(Map<String, String> tags) {
      this.tags = tags;
      return this;
    }

    public Builder logType(String logType) {
      this.logType = logType;
      return this;
    }

    public Builder httpRequest(Map<String, Object> httpRequest) {
      this.httpRequest = httpRequest;
      return this;
    }

    public Builder httpResponse(Map<String, Object> httpResponse) {
      this.httpResponse = httpResponse;
      return this;
    }

    public Builder timing(Timing timing) {
      this.timing = timing;
      return this;
    }

    public CallDiagnostics build() {
      return new CallDiagnostics(this);
    }
  }
}
