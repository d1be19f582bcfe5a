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

package com.google.promptbridge.ai.telemetry;

import com.google.promptbridge.ai.UsageCollector;

/**
 * InstrumentedCall holds the outcome of a call run through
 * {@link CallTelemetry}: the call function's own result and the collector the
 * engine populated.
 *
 * @param <T>
 *            the result type
 */
public final class InstrumentedCall<T> {

  private final T result;
  private final UsageCollector collector;
  private final boolean published;

  InstrumentedCall(T result, UsageCollector collector, boolean published) {
    this.result = result;
    this.collector = collector;
    this.published = published;
  }

  public T getResult() {
    return result;
  }

  public UsageCollector getCollector() {
    return collector;
  }

  /**
   * Returns whether the call was sampled and published telemetry events.
   *
   * @return true if events were published
   */
  public boolean isPublished() {
    return published;
  }
}
