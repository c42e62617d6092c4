/*
 * Copyright 2026 The RetryKit Authors
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
 */

package io.retrykit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.math.LongMath;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Doubles the wait before every retry, starting at an initial interval and capped at a maximum.
 * The n-th retry waits {@code initial * 2^(n-1)}; once that would exceed the maximum, every
 * later retry waits exactly the maximum.
 */
@ThreadSafe
public final class ExponentialBackoffRetryStrategy implements RetryStrategy {
  private final long initialIntervalNanos;
  private final long maxIntervalNanos;
  private final int maxRetries;
  private final AtomicLong attempts = new AtomicLong();
  // Only ever goes from false to true.
  private volatile boolean maxIntervalReached;

  /**
   * Creates a strategy.
   *
   * @param initialInterval wait before the first retry, must be positive
   * @param maxInterval ceiling for the wait, must not be less than {@code initialInterval}
   * @param unit unit of both intervals
   * @param maxRetries number of retries allowed; zero or negative means unbounded
   */
  public ExponentialBackoffRetryStrategy(
      long initialInterval, long maxInterval, TimeUnit unit, int maxRetries) {
    checkNotNull(unit, "unit");
    checkArgument(initialInterval > 0, "initialInterval must be positive: %s", initialInterval);
    checkArgument(initialInterval <= maxInterval,
        "initialInterval (%s) must not be greater than maxInterval (%s)",
        initialInterval, maxInterval);
    this.initialIntervalNanos = unit.toNanos(initialInterval);
    this.maxIntervalNanos = unit.toNanos(maxInterval);
    this.maxRetries = maxRetries;
  }

  @Override
  public RetryDecision advance() {
    long attempt = attempts.incrementAndGet();
    if (maxRetries > 0 && attempt > maxRetries) {
      return RetryDecision.stop();
    }
    if (maxIntervalReached) {
      return RetryDecision.retryAfter(maxIntervalNanos, TimeUnit.NANOSECONDS);
    }
    long intervalNanos = backoffNanos(attempt);
    if (intervalNanos > maxIntervalNanos) {
      maxIntervalReached = true;
      return RetryDecision.retryAfter(maxIntervalNanos, TimeUnit.NANOSECONDS);
    }
    return RetryDecision.retryAfter(intervalNanos, TimeUnit.NANOSECONDS);
  }

  /** Saturates at {@link Long#MAX_VALUE} instead of overflowing. */
  private long backoffNanos(long attempt) {
    long doublings = attempt - 1;
    if (doublings >= Long.SIZE - 1) {
      return Long.MAX_VALUE;
    }
    return LongMath.saturatedMultiply(initialIntervalNanos, 1L << doublings);
  }

  @Override
  public RetryStrategy report(@Nullable Throwable failure) {
    return this;
  }

  @VisibleForTesting
  boolean isMaxIntervalReached() {
    return maxIntervalReached;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("initialIntervalNanos", initialIntervalNanos)
        .add("maxIntervalNanos", maxIntervalNanos)
        .add("maxRetries", maxRetries)
        .add("attempts", attempts.get())
        .toString();
  }
}
