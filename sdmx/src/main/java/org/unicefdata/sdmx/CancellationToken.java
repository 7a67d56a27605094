/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.unicefdata.sdmx;

import com.google.common.base.Ticker;
import com.google.common.math.LongMath;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed down the fetch pipeline.
 *
 * <p>A token is cancelled explicitly through {@link #cancel()} or implicitly
 * once its deadline passes. A token derived with {@link #withTimeout} is
 * cancelled whenever its parent is, and its deadline is never later than
 * the parent's.
 *
 * <p>Callers check the token between blocking steps; an in-flight request
 * is abandoned when the token is observed as cancelled.
 */
public final class CancellationToken {
  private static final long NO_DEADLINE = Long.MAX_VALUE;

  private final @Nullable CancellationToken parent;
  private final Ticker ticker;
  private final long deadlineNanos;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private CancellationToken(@Nullable CancellationToken parent, Ticker ticker,
      long deadlineNanos) {
    this.parent = parent;
    this.ticker = ticker;
    this.deadlineNanos = deadlineNanos;
  }

  /** A token that is never cancelled by a deadline. */
  public static CancellationToken create() {
    return new CancellationToken(null, Ticker.systemTicker(), NO_DEADLINE);
  }

  /** A token with its own clock; used to drive deadlines deterministically. */
  public static CancellationToken create(Ticker ticker) {
    return new CancellationToken(null, ticker, NO_DEADLINE);
  }

  /**
   * Derives a child token whose deadline is {@code timeout} from now, or
   * the parent's deadline if that comes first.
   */
  public CancellationToken withTimeout(@Nullable Duration timeout) {
    if (timeout == null) {
      return new CancellationToken(this, ticker, deadlineNanos);
    }
    long now = ticker.read();
    long candidate = LongMath.saturatedAdd(now, timeout.toNanos());
    return new CancellationToken(this, ticker, Math.min(deadlineNanos, candidate));
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get()
        || (parent != null && parent.isCancelled())
        || isDeadlineExceeded();
  }

  private boolean isDeadlineExceeded() {
    return deadlineNanos != NO_DEADLINE && ticker.read() >= deadlineNanos;
  }

  public boolean hasDeadline() {
    return deadlineNanos != NO_DEADLINE;
  }

  /** Time left before the deadline, or null if the token has none. */
  public @Nullable Duration remaining() {
    if (deadlineNanos == NO_DEADLINE) {
      return null;
    }
    long left = deadlineNanos - ticker.read();
    return Duration.ofNanos(Math.max(0L, left));
  }

  /**
   * Shortens a per-attempt timeout so that it never outlives the deadline.
   */
  public Duration cap(Duration timeout) {
    Duration left = remaining();
    if (left == null || left.compareTo(timeout) >= 0) {
      return timeout;
    }
    return left;
  }

  /**
   * Throws if the token is cancelled.
   *
   * @param what description of the step about to run, used in the message
   * @throws FetchCancelledException if cancelled or past the deadline
   */
  public void throwIfCancelled(String what) {
    if (!isCancelled()) {
      return;
    }
    boolean deadline = !cancelled.get() && !isParentCancelledExplicitly();
    throw new FetchCancelledException(
        (deadline ? "Deadline exceeded before " : "Cancelled before ") + what, deadline);
  }

  private boolean isParentCancelledExplicitly() {
    CancellationToken p = parent;
    while (p != null) {
      if (p.cancelled.get()) {
        return true;
      }
      p = p.parent;
    }
    return false;
  }
}
