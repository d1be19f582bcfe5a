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

package com.google.promptbridge.ai.stream;

import java.util.concurrent.Future;

import com.google.promptbridge.core.stream.Mailbox;

/**
 * StreamSession is the state of one streaming call, threaded through each pull
 * step. Sessions are immutable; every transition returns a new session.
 */
public final class StreamSession {

  private final String token;
  private final Mailbox.Channel channel;
  private final Future<?> worker;
  private final StreamPhase phase;
  private final Object failure;

  private StreamSession(String token, Mailbox.Channel channel, Future<?> worker, StreamPhase phase,
      Object failure) {
    this.token = token;
    this.channel = channel;
    this.worker = worker;
    this.phase = phase;
    this.failure = failure;
  }

  /**
   * Creates a session in the STREAMING phase.
   *
   * @param channel
   *            the mailbox channel the worker sends to
   * @param worker
   *            the background worker
   * @return the session
   */
  public static StreamSession start(Mailbox.Channel channel, Future<?> worker) {
    return new StreamSession(channel.getToken(), channel, worker, StreamPhase.STREAMING, null);
  }

  /**
   * Returns a copy of this session in another phase.
   *
   * @param next
   *            the new phase
   * @return the new session
   */
  public StreamSession withPhase(StreamPhase next) {
    return new StreamSession(token, channel, worker, next, failure);
  }

  /**
   * Returns a copy of this session in a terminal error phase.
   *
   * @param next
   *            FAILED or TIMED_OUT
   * @param reason
   *            the failure reason
   * @return the new session
   */
  public StreamSession withFailure(StreamPhase next, Object reason) {
    return new StreamSession(token, channel, worker, next, reason);
  }

  public String getToken() {
    return token;
  }

  public Mailbox.Channel getChannel() {
    return channel;
  }

  public Future<?> getWorker() {
    return worker;
  }

  public StreamPhase getPhase() {
    return phase;
  }

  /**
   * Returns the failure reason.
   *
   * @return the reason reported by the engine, a description of the timeout, or
   *         null
   */
  public Object getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return "StreamSession{" + token + ", " + phase + (failure != null ? ", failure=" + failure : "") + "}";
  }
}
