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

/**
 * PromptBridgeException is the base exception for all bridge errors. Engine
 * faults raised while executing a prompt function surface as this type (or as
 * whatever runtime exception the engine threw) and are never wrapped in a
 * response envelope.
 */
public class PromptBridgeException extends RuntimeException {

  /** The engine reported a fault while executing a function. */
  public static final String ENGINE_FAILURE = "ENGINE_FAILURE";

  /** The client does not expose the requested function. */
  public static final String FUNCTION_NOT_FOUND = "FUNCTION_NOT_FOUND";

  /** No client is registered under the requested identifier. */
  public static final String CLIENT_NOT_CONFIGURED = "CLIENT_NOT_CONFIGURED";

  /** The resource has no action with the requested name. */
  public static final String ACTION_NOT_FOUND = "ACTION_NOT_FOUND";

  /** A value could not be converted to or from JSON. */
  public static final String SERIALIZATION_ERROR = "SERIALIZATION_ERROR";

  private final String errorCode;
  private final Object details;

  /**
   * Creates a new PromptBridgeException.
   *
   * @param message
   *            the error message
   */
  public PromptBridgeException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new PromptBridgeException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public PromptBridgeException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new PromptBridgeException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public PromptBridgeException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Creates a builder for PromptBridgeException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for PromptBridgeException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private String errorCode;
    private Object details;

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder errorCode(String errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public PromptBridgeException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new PromptBridgeException(message, cause, errorCode, details);
    }
  }
}
