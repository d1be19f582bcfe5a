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

import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.core.CallResult;

/**
 * Mailbox is the inbox of a consuming thread. Background workers deliver
 * {@link StreamMessage}s into it and the owner receives them selectively by
 * correlation token, so several stream sessions can share one mailbox without
 * seeing each other's messages.
 *
 * <p>
 * Workers send through a {@link Channel}. Once the owner closes a channel,
 * further sends on it are discarded, which is how late output of an abandoned
 * worker is kept out of the mailbox.
 */
public class Mailbox {

  private static final Logger logger = LoggerFactory.getLogger(Mailbox.class);

  private static final ThreadLocal<Mailbox> CURRENT = ThreadLocal.withInitial(Mailbox::new);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition arrived = lock.newCondition();
  private final LinkedList<StreamMessage> messages = new LinkedList<>();
  // Tokens of closed channels that still had messages queued past the drain bound.
  private final Set<String> closedTokens = new HashSet<>();

  /**
   * Returns the mailbox owned by the calling thread.
   *
   * @return the current thread's mailbox
   */
  public static Mailbox current() {
    return CURRENT.get();
  }

  /**
   * Opens a channel that delivers messages tagged with the given token. Any
   * messages still queued for previously closed channels are discarded first.
   *
   * @param token
   *            the correlation token
   * @return the channel
   */
  public Channel open(String token) {
    if (token == null || token.isEmpty()) {
      throw new IllegalArgumentException("Correlation token is required");
    }
    lock.lock();
    try {
      purgeClosedLocked();
    } finally {
      lock.unlock();
    }
    return new Channel(token);
  }

  /**
   * Delivers a message unconditionally.
   *
   * @param message
   *            the message
   */
  public void send(StreamMessage message) {
    lock.lock();
    try {
      messages.add(message);
      arrived.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the oldest message tagged with the token, waiting up to
   * the timeout for one to arrive. Messages with other tokens are left in place.
   *
   * @param token
   *            the correlation token
   * @param timeout
   *            the maximum time to wait
   * @return the message, or empty if none arrived in time
   * @throws InterruptedException
   *             if the waiting thread is interrupted
   */
  public Optional<StreamMessage> receive(String token, Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (true) {
        StreamMessage message = removeFirst(token);
        if (message != null) {
          return Optional.of(message);
        }
        if (remaining <= 0) {
          return Optional.empty();
        }
        remaining = arrived.awaitNanos(remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the oldest message tagged with the token without
   * waiting.
   *
   * @param token
   *            the correlation token
   * @return the message, or empty if none is queued
   */
  public Optional<StreamMessage> poll(String token) {
    lock.lock();
    try {
      return Optional.ofNullable(removeFirst(token));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards queued messages tagged with the token.
   *
   * @param token
   *            the correlation token
   * @param maxMessages
   *            the maximum number of messages to discard
   * @return the number of messages discarded
   */
  public int drain(String token, int maxMessages) {
    lock.lock();
    try {
      return drainLocked(token, maxMessages);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of queued messages tagged with the token.
   *
   * @param token
   *            the correlation token
   * @return the pending count
   */
  public int pending(String token) {
    lock.lock();
    try {
      return countLocked(token);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of queued messages across all tokens.
   *
   * @return the queue size
   */
  public int size() {
    lock.lock();
    try {
      return messages.size();
    } finally {
      lock.unlock();
    }
  }

  private void purgeClosedLocked() {
    if (closedTokens.isEmpty()) {
      return;
    }
    int purged = 0;
    Iterator<StreamMessage> it = messages.iterator();
    while (it.hasNext()) {
      if (closedTokens.contains(it.next().getToken())) {
        it.remove();
        purged++;
      }
    }
    logger.debug("Purged {} stale messages of {} closed channels", purged, closedTokens.size());
    closedTokens.clear();
  }

  private StreamMessage removeFirst(String token) {
    Iterator<StreamMessage> it = messages.iterator();
    while (it.hasNext()) {
      StreamMessage message = it.next();
      if (message.getToken().equals(token)) {
        it.remove();
        return message;
      }
    }
    return null;
  }

  private int countLocked(String token) {
    int count = 0;
    for (StreamMessage message : messages) {
      if (message.getToken().equals(token)) {
        count++;
      }
    }
    return count;
  }

  private int drainLocked(String token, int maxMessages) {
    int drained = 0;
    Iterator<StreamMessage> it = messages.iterator();
    while (it.hasNext() && drained < maxMessages) {
      if (it.next().getToken().equals(token)) {
        it.remove();
        drained++;
      }
    }
    return drained;
  }

  /**
   * Channel is the sending side of one stream session.
   */
  public final class Channel {
    private final String token;
    private boolean open = true;

    private Channel(String token) {
      this.token = token;
    }

    public String getToken() {
      return token;
    }

    /**
     * Returns the mailbox this channel delivers to.
     *
     * @return the mailbox
     */
    public Mailbox getMailbox() {
      return Mailbox.this;
    }

    /**
     * Delivers a chunk message if the channel is still open.
     *
     * @param payload
     *            the chunk payload
     * @return true if the message was delivered
     */
    public boolean sendChunk(Object payload) {
      return send(StreamMessage.chunk(token, payload));
    }

    /**
     * Delivers the completion message if the channel is still open.
     *
     * @param result
     *            the call outcome
     * @return true if the message was delivered
     */
    public boolean sendDone(CallResult<?> result) {
      return send(StreamMessage.done(token, result));
    }

    private boolean send(StreamMessage message) {
      lock.lock();
      try {
        if (!open) {
          logger.trace("Discarding message for closed channel {}", token);
          return false;
        }
        messages.add(message);
        arrived.signalAll();
        return true;
      } finally {
        lock.unlock();
      }
    }

    /**
     * Returns whether the channel still accepts messages.
     *
     * @return true if open
     */
    public boolean isOpen() {
      lock.lock();
      try {
        return open;
      } finally {
        lock.unlock();
      }
    }

    /**
     * Closes the channel and discards up to {@code maxDrain} queued messages
     * tagged with its token. Messages sent after this call are discarded.
     *
     * @param maxDrain
     *            the maximum number of queued messages to discard
     * @return the number of messages discarded
     */
    public int close(int maxDrain) {
      lock.lock();
      try {
        open = false;
        int drained = drainLocked(token, maxDrain);
        if (drained >= maxDrain && countLocked(token) > 0) {
          logger.warn("Drain bound {} reached for stream {}; stale messages remain queued until the next open",
              maxDrain, token);
          closedTokens.add(token);
        }
        return drained;
      } finally {
        lock.unlock();
      }
    }
  }
}
