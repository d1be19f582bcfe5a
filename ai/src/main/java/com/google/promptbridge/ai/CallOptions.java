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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CallOptions carries per-invocation engine options, chiefly the usage
 * collectors the engine should populate.
 */
public class CallOptions {

  private final List<UsageCollector> collectors;

  private CallOptions(Builder builder) {
    this.collectors = Collections.unmodifiableList(new ArrayList<>(builder.collectors));
  }

  /**
   * Returns options with no collector attached.
   *
   * @return empty options
   */
  public static CallOptions none() {
    return builder().build();
  }

  /**
   * Returns options carrying a single collector.
   *
   * @param collector
   *            the collector
   * @return the options
   */
  public static CallOptions withCollector(UsageCollector collector) {
    return builder().collector(collector).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<UsageCollector> getCollectors() {
    return collectors;
  }

  /**
   * Returns the first attached collector.
   *
   * @return the collector, or null if none is attached
   */
  public UsageCollector getCollector() {
    return collectors.isEmpty() ? null : collectors.get(0);
  }

  @Override
  public String toString() {
    return "CallOptions{collectors=" + collectors.size() + "}";
  }

  /**
   * Builder for CallOptions.
   */
  public static class Builder {
    private final List<UsageCollector> collectors = new ArrayList<>();

    public Builder collector(UsageCollector collector) {
      if (collector != null) {
        this.collectors.add(collector);
      }
      return this;
    }

    public CallOptions build() {
      return new CallOptions(this);
    }
  }
}
