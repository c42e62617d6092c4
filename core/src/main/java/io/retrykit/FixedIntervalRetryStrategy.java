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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Waits the same interval before every retry, for a bounded or unbounded number of retries.
 */
@ThreadSafe
public final class FixedIntervalRetryStrategy implements RetryStrategy {
  private final long intervalNanos;
  private final int maxRetries;
  private final AtomicLong attempts = new AtomicLong();

  /**
   * Creates a strategy.
   *
   * @param interval wait before each retry, must be positive
   * @param unit unit of {@code interval}
   * @param maxRetries number of retries allowed; zero or negative means unbounded
   */
  public FixedIntervalRetryStrategy(long interval, TimeUnit unit, int maxRetries) {
    checkNotNull(unit, "unit");
    checkArgument(interval > 0, "interval must be positive: %s", interval);
    this.intervalNanos = unit.toNanos(interval);
    this.maxRetries = maxRetries;
  }

  @Override
  public RetryDecision advance() {
    long attempt = attempts.incrementAndGet();
    if (maxRetries <= 0 || attempt <= maxRetries) {
      return RetryDecision.retryAfter(intervalNanos, TimeUnit.NANOSECONDS);
    }
    return RetryDecision.stop();
  }

  @Override
  public RetryStrategy report(@Nullable Throwable failure) {
    return this;
  }

  @VisibleForTesting
  long attempts() {
    return attempts.get();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("intervalNanos", intervalNanos)
        .add("maxRetries", maxRetries)
        .add("attempts", attempts.get())
        .toString();
  }
}
