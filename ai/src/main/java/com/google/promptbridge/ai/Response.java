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

/**
 * Response wraps the result of a successful single-shot call together with
 * the usage recorded by its collector.
 *
 * <p>
 * A Response exists only for successful calls; error outcomes are returned
 * unwrapped. {@link #unwrap(Object)} accepts both wrapped and raw values, so
 * call sites that only want the data need not care which they hold.
 *
 * <pre>{@code
 * Response<Reply> response = Response.wrap(reply, collector);
 * Reply data = Response.unwrap(response);
 * Usage usage = Response.usage(response);
 * }</pre>
 *
 * @param <T>
 *            the data type
 */
public final class Response<T> {

  private final T data;
  private final Usage usage;
  private final UsageCollector collector;
  private final CallDiagnostics diagnostics;

  private Response(T data, Usage usage, UsageCollector collector, CallDiagnostics diagnostics) {
    this.data = data;
    this.usage = usage;
    this.collector = collector;
    this.diagnostics = diagnostics;
  }

  /**
   * Wraps a successful result. Usage and diagnostics are read from the
   * collector once, here; extraction failures degrade to zero usage and empty
   * diagnostics.
   *
   * @param data
   *            the call result, stored untouched
   * @param collector
   *            the collector used for the call, may be null
   * @param <T>
   *            the data type
   * @return the envelope
   */
  public static <T> Response<T> wrap(T data, UsageCollector collector) {
    if (collector == null) {
      return new Response<>(data, null, null, CallDiagnostics.empty());
    }
    return new Response<>(data, UsageExtractor.extractUsage(collector), collector,
        UsageExtractor.extractDiagnostics(collector));
  }

  /**
   * Returns the data of an envelope, or the value itself when it is not an
   * envelope. Unwrapping twice yields the same value as unwrapping once.
   *
   * @param value
   *            an envelope or a raw value
   * @param <T>
   *            the expected data type
   * @return the data
   */
  @SuppressWarnings("unchecked")
  public static <T> T unwrap(Object value) {
    if (value instanceof Response) {
      return (T) ((Response<?>) value).getData();
    }
    return (T) value;
  }

  /**
   * Returns the usage of an envelope.
   *
   * @param value
   *            an envelope or a raw value
   * @return the usage, or null when the value is not an envelope or carries no
   *         usage
   */
  public static Usage usage(Object value) {
    if (value instanceof Response) {
      return ((Response<?>) value).getUsage();
    }
    return null;
  }

  /**
   * Returns whether a value is an envelope.
   *
   * @param value
   *            the value
   * @return true if the value is a Response
   */
  public static boolean isResponse(Object value) {
    return value instanceof Response;
  }

  public T getData() {
    return data;
  }

  /**
   * Returns the usage snapshot.
   *
   * @return the usage, or null if the call had no collector
   */
  public Usage getUsage() {
    return usage;
  }

  /**
   * Returns the collector used for the call, for diagnostic access.
   *
   * @return the collector, may be null
   */
  public UsageCollector getCollector() {
    return collector;
  }

  public CallDiagnostics getDiagnostics() {
    return diagnostics;
  }

  @Override
  public String toString() {
    return "Response{data=" + data + ", usage=" + usage + "}";
  }
}
