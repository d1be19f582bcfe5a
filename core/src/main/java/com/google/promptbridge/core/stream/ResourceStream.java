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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * ResourceStream turns a stateful producer into a lazy, pull-based sequence
 * through three functions:
 * <ul>
 * <li><b>init</b> creates the session state on the first pull</li>
 * <li><b>step</b> maps the current state to zero or more elements and the next
 * state, or halts</li>
 * <li><b>cleanup</b> runs exactly once, when the sequence halts or its cursor
 * is closed, and returns the terminal state</li>
 * </ul>
 *
 * <p>
 * Every call to {@link #iterator()} or {@link #stream()} starts a new session;
 * a single cursor is single-pass. Consumers that may stop early must close the
 * cursor (or the {@link Stream}) so cleanup runs.
 *
 * @param <S>
 *            the session state type
 * @param <T>
 *            the element type
 */
public final class ResourceStream<S, T> implements Iterable<T> {

  private final Supplier<S> init;
  private final Function<S, Step<S, T>> step;
  private final Function<S, S> cleanup;

  private ResourceStream(Supplier<S> init, Function<S, Step<S, T>> step, Function<S, S> cleanup) {
    if (init == null || step == null || cleanup == null) {
      throw new IllegalArgumentException("init, step and cleanup are required");
    }
    this.init = init;
    this.step = step;
    this.cleanup = cleanup;
  }

  /**
   * Creates a ResourceStream.
   *
   * @param init
   *            creates the session state
   * @param step
   *            advances the session state
   * @param cleanup
   *            releases the session and returns its terminal state
   * @param <S>
   *            the session state type
   * @param <T>
   *            the element type
   * @return the stream
   */
  public static <S, T> ResourceStream<S, T> of(Supplier<S> init, Function<S, Step<S, T>> step,
      Function<S, S> cleanup) {
    return new ResourceStream<>(init, step, cleanup);
  }

  /**
   * Starts a new session and returns its cursor. The session is initialized
   * lazily on the first pull.
   *
   * @return a new cursor
   */
  @Override
  public Cursor<S, T> iterator() {
    return new Cursor<>(this);
  }

  /**
   * Starts a new session and exposes it as a sequential {@link Stream}. Closing
   * the stream runs cleanup if the session has not halted.
   *
   * @return a new stream
   */
  public Stream<T> stream() {
    Cursor<S, T> cursor = iterator();
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false)
        .onClose(cursor::close);
  }

  /**
   * Starts a new session, consumes it fully and returns the elements.
   *
   * @return the elements in production order
   */
  public List<T> toList() {
    List<T> result = new ArrayList<>();
    try (Cursor<S, T> cursor = iterator()) {
      while (cursor.hasNext()) {
        result.add(cursor.next());
      }
    }
    return result;
  }

  /**
   * Step is the result of one step call.
   *
   * @param <S>
   *            the session state type
   * @param <T>
   *            the element type
   */
  public static final class Step<S, T> {
    private final List<T> elements;
    private final S state;
    private final boolean halt;

    private Step(List<T> elements, S state, boolean halt) {
      this.elements = elements;
      this.state = state;
      this.halt = halt;
    }

    /**
     * Emits elements (possibly none) and continues with the given state.
     *
     * @param elements
     *            the elements to emit
     * @param next
     *            the next state
     * @param <S>
     *            the session state type
     * @param <T>
     *            the element type
     * @return the step
     */
    public static <S, T> Step<S, T> emitAll(List<T> elements, S next) {
      return new Step<>(elements != null ? elements : List.of(), next, false);
    }

    /**
     * Emits a single element and continues with the given state.
     *
     * @param element
     *            the element to emit
     * @param next
     *            the next state
     * @param <S>
     *            the session state type
     * @param <T>
     *            the element type
     * @return the step
     */
    public static <S, T> Step<S, T> emit(T element, S next) {
      List<T> elements = new ArrayList<>(1);
      elements.add(element);
      return new Step<>(elements, next, false);
    }

    /**
     * Emits nothing and continues with the given state.
     *
     * @param next
     *            the next state
     * @param <S>
     *            the session state type
     * @param <T>
     *            the element type
     * @return the step
     */
    public static <S, T> Step<S, T> skip(S next) {
      return new Step<>(List.of(), next, false);
    }

    /**
     * Ends the sequence with the given state.
     *
     * @param state
     *            the final state passed to cleanup
     * @param <S>
     *            the session state type
     * @param <T>
     *            the element type
     * @return the step
     */
    public static <S, T> Step<S, T> halt(S state) {
      return new Step<>(List.of(), state, true);
    }

    public List<T> getElements() {
      return elements;
    }

    public S getState() {
      return state;
    }

    public boolean isHalt() {
      return halt;
    }
  }

  /**
   * Cursor is the single-pass iterator over one session.
   *
   * @param <S>
   *            the session state type
   * @param <T>
   *            the element type
   */
  public static final class Cursor<S, T> implements Iterator<T>, AutoCloseable {
    private final ResourceStream<S, T> source;
    private final LinkedList<T> buffer = new LinkedList<>();
    private S state;
    private boolean initialized;
    private boolean halted;
    private boolean cleanedUp;

    private Cursor(ResourceStream<S, T> source) {
      this.source = source;
    }

    @Override
    public boolean hasNext() {
      if (!buffer.isEmpty()) {
        return true;
      }
      if (halted) {
        return false;
      }
      if (!initialized) {
        state = source.init.get();
        initialized = true;
      }
      while (buffer.isEmpty() && !halted) {
        Step<S, T> next;
        try {
          next = source.step.apply(state);
        } catch (RuntimeException e) {
          halted = true;
          runCleanup();
          throw e;
        }
        state = next.getState();
        if (next.isHalt()) {
          halted = true;
          runCleanup();
        } else {
          buffer.addAll(next.getElements());
        }
      }
      return !buffer.isEmpty();
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffer.removeFirst();
    }

    /**
     * Returns the current session state: the latest step state while the
     * sequence runs, and the terminal state once cleanup ran.
     *
     * @return the state, or null before the first pull
     */
    public S getState() {
      return state;
    }

    /**
     * Returns whether cleanup has run.
     *
     * @return true once the session is released
     */
    public boolean isClosed() {
      return cleanedUp;
    }

    /**
     * Stops the sequence. Runs cleanup if the session was initialized and not
     * yet released; a cursor that was never pulled has nothing to release.
     */
    @Override
    public void close() {
      halted = true;
      buffer.clear();
      if (initialized) {
        runCleanup();
      }
    }

    private void runCleanup() {
      if (!cleanedUp) {
        cleanedUp = true;
        state = source.cleanup.apply(state);
      }
    }
  }
}
