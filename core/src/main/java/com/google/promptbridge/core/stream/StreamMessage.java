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

package com.google.promptbridge.core.stream;

import com.google.promptbridge.core.CallResult;

/**
 * StreamMessage is one message delivered to a {@link Mailbox}, tagged with the
 * correlation token of the stream session it belongs to.
 */
public final class StreamMessage {

  /**
   * The kind of a stream message.
   */
  public enum Type {
    /** A partial result. */
    CHUNK,
    /** The final message of a session, carrying the call outcome. */
    DONE
  }

  private final String token;
  private final Type type;
  private final Object payload;
  private final CallResult<?> result;

  private StreamMessage(String token, Type type, Object payload, CallResult<?> result) {
    if (token == null) {
      throw new IllegalArgumentException("Correlation token is required");
    }
    this.token = token;
    this.type = type;
    this.payload = payload;
    this.result = result;
  }

  /**
   * Creates a chunk message.
   *
   * @param token
   *            the correlation token
   * @param payload
   *            the chunk payload, may be null
   * @return the message
   */
  public static StreamMessage chunk(String token, Object payload) {
    return new StreamMessage(token, Type.CHUNK, payload, null);
  }

  /**
   * Creates a completion message.
   *
   * @param token
   *            the correlation token
   * @param result
   *            the outcome of the streaming call
   * @return the message
   */
  public static StreamMessage done(String token, CallResult<?> result) {
    if (result == null) {
      throw new IllegalArgumentException("Completion result is required");
    }
    return new StreamMessage(token, Type.DONE, null, result);
  }

  public String getToken() {
    return token;
  }

  public Type getType() {
    return type;
  }

  public boolean isChunk() {
    return type == Type.CHUNK;
  }

  public boolean isDone() {
    return type == Type.DONE;
  }

  /**
   * Returns the chunk payload.
   *
   * @return the payload, or null for completion messages
   */
  public Object getPayload() {
    return payload;
  }

  /**
   * Returns the completion outcome.
   *
   * @return the outcome, or null for chunk messages
   */
  public CallResult<?> getResult() {
    return result;
  }

  @Override
  public String toString() {
    return "StreamMessage{" + token + ", " + type + ", " + (type == Type.CHUNK ? payload : result) + "}";
  }
}
