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

import java.util.Objects;
import java.util.function.Function;

/**
 * CallResult is the outcome of one engine call: either a successful value or
 * an error reason. Engines report recoverable failures through
 * {@link #error(Object)} and raise exceptions for faults.
 *
 * @param <T>
 *            the success value type
 */
public final class CallResult<T> {

  private final boolean ok;
  private final T data;
  private final Object error;

  private CallResult(boolean ok, T data, Object error) {
    this.ok = ok;
    this.data = data;
    this.error = error;
  }

  /**
   * Creates a successful result.
   *
   * @param data
   *            the result value, may be null
   * @param <T>
   *            the value type
   * @return a successful result
   */
  public static <T> CallResult<T> ok(T data) {
    return new CallResult<>(true, data, null);
  }

  /**
   * Creates an error result.
   *
   * @param reason
   *            the error reason, typically a message or an exception
   * @param <T>
   *            the value type
   * @return an error result
   */
  public static <T> CallResult<T> error(Object reason) {
    if (reason == null) {
      throw new IllegalArgumentException("error reason is required");
    }
    return new CallResult<>(false, null, reason);
  }

  public boolean isOk() {
    return ok;
  }

  public boolean isError() {
    return !ok;
  }

  /**
   * Returns the success value.
   *
   * @return the value
   * @throws IllegalStateException
   *             if this is an error result
   */
  public T getData() {
    if (!ok) {
      throw new IllegalStateException("Cannot read data of an error result: " + error);
    }
    return data;
  }

  /**
   * Returns the error reason.
   *
   * @return the reason, or null for a successful result
   */
  public Object getError() {
    return error;
  }

  /**
   * Returns the error reason rendered as a message.
   *
   * @return the message, or null for a successful result
   */
  public String getErrorMessage() {
    if (error == null) {
      return null;
    }
    if (error instanceof Throwable) {
      return ((Throwable) error).getMessage();
    }
    return error.toString();
  }

  /**
   * Transforms the success value, leaving an error result untouched.
   *
   * @param fn
   *            the mapping function
   * @param <R>
   *            the new value type
   * @return the mapped result
   */
  @SuppressWarnings("unchecked")
  public <R> CallResult<R> map(Function<? super T, ? extends R> fn) {
    if (!ok) {
      return (CallResult<R>) this;
    }
    return ok(fn.apply(data));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CallResult)) {
      return false;
    }
    CallResult<?> other = (CallResult<?>) o;
    return ok == other.ok && Objects.equals(data, other.data) && Objects.equals(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ok, data, error);
  }

  @Override
  public String toString() {
    return ok ? "CallResult.ok(" + data + ")" : "CallResult.error(" + error + ")";
  }
}
