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

/**
 * Call telemetry for PromptBridge.
 *
 * <p>
 * {@link com.google.promptbridge.ai.telemetry.CallTelemetry} wraps single-shot
 * calls with sampled start, stop and exception events published to an
 * {@link com.google.promptbridge.core.telemetry.EventBus}.
 * {@link com.google.promptbridge.ai.telemetry.OpenTelemetryMetricsSubscriber}
 * can be attached to the bus to export those events as OpenTelemetry metrics.
 *
 * @see <a href="https://opentelemetry.io/">OpenTelemetry</a>
 */
package com.google.promptbridge.ai.telemetry;
