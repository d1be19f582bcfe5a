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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.promptbridge.ai.CallOptions;
import com.google.promptbridge.ai.PromptEngine;
import com.google.promptbridge.core.CallResult;
import com.google.promptbridge.core.stream.Mailbox;
import com.google.promptbridge.core.stream.ResourceStream;
import com.google.promptbridge.core.stream.ResourceStream.Step;
import com.google.promptbridge.core.stream.StreamMessage;

/**
 * StreamingBridge turns the engine's push-style stream into a lazy, pull-based
 * sequence.
 *
 * <p>
 * Each time the returned sequence is iterated a new session starts: a
 * correlation token is generated, a channel is opened on the consuming
 * thread's {@link Mailbox}, and a worker invokes the engine's streaming entry
 * point, forwarding every chunk and then one completion message. Each pull
 * waits up to the read timeout for the next message of its session.
 *
 * <p>
 * When the sequence ends, is closed early or times out, the channel is closed
 * so that late worker output is discarded, and queued messages of the session
 * are drained up to the drain bound. The worker is left to finish on its own
 * unless cancellation on abandonment is enabled.
 *
 * <pre>{@code
 * StreamingBridge bridge = StreamingBridge.builder().readTimeout(Duration.ofMillis(250)).build();
 * StreamingBridge.StreamHandle handle = bridge.open(engine, "ExtractTasks", args, CallOptions.none());
 * try (Stream<Object> chunks = handle.stream()) {
 *   chunks.forEach(System.out::println);
 * }
 * }</pre>
 */
public class StreamingBridge {

  private static final Logger logger = LoggerFactory.getLogger(StreamingBridge.class);

  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMillis(100);
  public static final int DEFAULT_MAX_DRAIN = 1000;

  private final ExecutorService executor;
  private final Duration readTimeout;
  private final int maxDrain;
  private final boolean cancelOnAbandon;

  private StreamingBridge(Builder builder) {
    this.executor = builder.executor != null ? builder.executor : defaultExecutor();
    this.readTimeout = builder.readTimeout;
    this.maxDrain = builder.maxDrain;
    this.cancelOnAbandon = builder.cancelOnAbandon;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public int getMaxDrain() {
    return maxDrain;
  }

  public boolean isCancelOnAbandon() {
    return cancelOnAbandon;
  }

  /**
   * Prepares a streaming call. Nothing runs until the handle is iterated.
   *
   * @param engine
   *            the engine
   * @param functionName
   *            the engine-side function name
   * @param arguments
   *            the named arguments
   * @param options
   *            the call options
   * @return the stream handle
   */
  public StreamHandle open(PromptEngine engine, String functionName, Map<String, Object> arguments,
      CallOptions options) {
    CallOptions callOptions = options != null ? options : CallOptions.none();
    ResourceStream<StreamSession, Object> source = ResourceStream.of(
        () -> startSession(engine, functionName, arguments, callOptions), this::step, this::cleanup);
    return new StreamHandle(source);
  }

  private StreamSession startSession(PromptEngine engine, String functionName, Map<String, Object> arguments,
      CallOptions options) {
    String token = UUID.randomUUID().toString();
    Mailbox.Channel channel = Mailbox.current().open(token);
    Future<?> worker = executor
        .submit(() -> runWorker(engine, functionName, arguments, options, channel));
    logger.debug("Started stream {} for function {}", token, functionName);
    return StreamSession.start(channel, worker);
  }

  private void runWorker(PromptEngine engine, String functionName, Map<String, Object> arguments,
      CallOptions options, Mailbox.Channel channel) {
    CallResult<Object> result;
    try {
      result = engine.invokeStream(functionName, arguments, options, channel::sendChunk);
      if (result == null) {
        result = CallResult.error("Engine returned no result for " + functionName);
      }
    } catch (RuntimeException e) {
      logger.warn("Streaming call to {} failed: {}", functionName, e.getMessage());
      result = CallResult.error(e);
    }
    if (!channel.sendDone(result)) {
      logger.debug("Stream {} was closed before {} completed", channel.getToken(), functionName);
    }
  }

  private Step<StreamSession, Object> step(StreamSession session) {
    if (session.getPhase().isTerminal()) {
      return Step.halt(session);
    }
    Optional<StreamMessage> received;
    try {
      received = session.getChannel().getMailbox().receive(session.getToken(), readTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Step.halt(session.withPhase(StreamPhase.ABANDONED));
    }
    if (received.isEmpty()) {
      logger.debug("Stream {} timed out after {} ms", session.getToken(), readTimeout.toMillis());
      return Step.halt(session.withFailure(StreamPhase.TIMED_OUT,
          "No stream message within " + readTimeout.toMillis() + " ms"));
    }
    StreamMessage message = received.get();
    if (message.isChunk()) {
      if (!ChunkFilter.hasContent(message.getPayload())) {
        return Step.skip(session);
      }
      return Step.emit(message.getPayload(), session);
    }
    CallResult<?> result = message.getResult();
    if (result.isOk()) {
      return Step.emit(result.getData(), session.withPhase(StreamPhase.COMPLETED));
    }
    logger.debug("Stream {} failed: {}", session.getToken(), result.getErrorMessage());
    return Step.halt(session.withFailure(StreamPhase.FAILED, result.getError()));
  }

  private StreamSession cleanup(StreamSession session) {
    int drained = session.getChannel().close(maxDrain);
    StreamSession closed = session.getPhase() == StreamPhase.STREAMING
        ? session.withPhase(StreamPhase.ABANDONED)
        : session;
    if (cancelOnAbandon && closed.getPhase() != StreamPhase.COMPLETED && !closed.getWorker().isDone()) {
      closed.getWorker().cancel(true);
    }
    logger.debug("Stream {} closed in phase {}, drained {} messages", session.getToken(), closed.getPhase(),
        drained);
    return closed;
  }

  private static ExecutorService defaultExecutor() {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, "promptbridge-stream-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newCachedThreadPool(factory);
  }

  /**
   * StreamHandle is the caller's view of a streaming call. Iterating it starts
   * a new session; the phase and failure of the most recent session are
   * available once iteration begins.
   *
   * <p>
   * Starting a new iteration closes the previous session, and closing the
   * handle closes the current one. Callers that may stop early, for example by
   * breaking out of a for-each loop, should close the handle:
   *
   * <pre>{@code
   * try (StreamingBridge.StreamHandle handle = bridge.open(engine, "ExtractTasks", args, options)) {
   *   for (Object chunk : handle) {
   *     if (done(chunk)) {
   *       break;
   *     }
   *   }
   * }
   * }</pre>
   */
  public static final class StreamHandle implements Iterable<Object>, AutoCloseable {
    private final ResourceStream<StreamSession, Object> source;
    private volatile ResourceStream.Cursor<StreamSession, Object> current;

    private StreamHandle(ResourceStream<StreamSession, Object> source) {
      this.source = source;
    }

    @Override
    public Iterator<Object> iterator() {
      return nextCursor();
    }

    /**
     * Returns the sequence as a Java stream. Closing the stream abandons the
     * session.
     *
     * @return the stream
     */
    public Stream<Object> stream() {
      ResourceStream.Cursor<StreamSession, Object> cursor = nextCursor();
      return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false)
          .onClose(cursor::close);
    }

    /**
     * Consumes a whole session.
     *
     * @return every yielded element in order
     */
    public List<Object> toList() {
      List<Object> result = new ArrayList<>();
      ResourceStream.Cursor<StreamSession, Object> cursor = nextCursor();
      try (cursor) {
        while (cursor.hasNext()) {
          result.add(cursor.next());
        }
      }
      return result;
    }

    /**
     * Closes the current session. A session that has not finished is
     * abandoned; a finished one is left as it is.
     */
    @Override
    public synchronized void close() {
      ResourceStream.Cursor<StreamSession, Object> cursor = current;
      if (cursor != null) {
        cursor.close();
      }
    }

    private synchronized ResourceStream.Cursor<StreamSession, Object> nextCursor() {
      close();
      ResourceStream.Cursor<StreamSession, Object> cursor = source.iterator();
      current = cursor;
      return cursor;
    }

    /**
     * Returns the most recent session.
     *
     * @return the session, or null before iteration starts
     */
    public StreamSession getSession() {
      ResourceStream.Cursor<StreamSession, Object> cursor = current;
      return cursor != null ? cursor.getState() : null;
    }

    /**
     * Returns the phase of the most recent session.
     *
     * @return the phase, or null before iteration starts
     */
    public StreamPhase getPhase() {
      StreamSession session = getSession();
      return session != null ? session.getPhase() : null;
    }

    /**
     * Returns the failure reason of the most recent session.
     *
     * @return the reason, or null
     */
    public Object getFailure() {
      StreamSession session = getSession();
      return session != null ? session.getFailure() : null;
    }

    /**
     * Returns the correlation token of the most recent session.
     *
     * @return the token, or null before iteration starts
     */
    public String getToken() {
      StreamSession session = getSession();
      return session != null ? session.getToken() : null;
    }
  }

  /**
   * Builder for StreamingBridge.
   */
  public static class Builder {
    private ExecutorService executor;
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;
    private int maxDrain = DEFAULT_MAX_DRAIN;
    private boolean cancelOnAbandon;

    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public Builder readTimeout(Duration readTimeout) {
      if (readTimeout == null || readTimeout.isNegative()) {
        throw new IllegalArgumentException("Read timeout must be zero or positive");
      }
      this.readTimeout = readTimeout;
      return this;
    }

    public Builder maxDrain(int maxDrain) {
      if (maxDrain < 1) {
        throw new IllegalArgumentException("Drain bound must be positive, got " + maxDrain);
      }
      this.maxDrain = maxDrain;
      return this;
    }

    public Builder cancelOnAbandon(boolean cancelOnAbandon) {
      this.cancelOnAbandon = cancelOnAbandon;
      return this;
    }

    public StreamingBridge build() {
      return new StreamingBridge(this);
    }
  }
}
