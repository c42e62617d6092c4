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

import com.google.common.base.MoreObjects;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.Immutable;

/**
 * The outcome of {@link RetryStrategy#advance}: either wait for a delay and try again, or stop.
 */
@Immutable
public final class RetryDecision {
  private static final RetryDecision STOP = new RetryDecision(false, 0);

  /**
   * Retry after waiting for {@code delay}.
   *
   * @param delay a non-negative delay
   */
  public static RetryDecision retryAfter(long delay, TimeUnit unit) {
    checkNotNull(unit, "unit");
    checkArgument(delay >= 0, "delay must not be negative: %s", delay);
    return new RetryDecision(true, unit.toNanos(delay));
  }

  /**
   * Do not retry any more.
   */
  public static RetryDecision stop() {
    return STOP;
  }

  private final boolean shouldRetry;
  private final long delayNanos;

  private RetryDecision(boolean shouldRetry, long delayNanos) {
    this.shouldRetry = shouldRetry;
    this.delayNanos = delayNanos;
  }

  /**
   * Returns {@code false} if the caller must stop retrying.
   */
  public boolean shouldRetry() {
    return shouldRetry;
  }

  /**
   * Returns the wait before the next attempt. Meaningless, and zero, when {@link #shouldRetry}
   * is {@code false}.
   */
  public long delayNanos() {
    return delayNanos;
  }

  public long delay(TimeUnit unit) {
    return unit.convert(delayNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RetryDecision)) {
      return false;
    }
    RetryDecision that = (RetryDecision) o;
    return shouldRetry == that.shouldRetry && delayNanos == that.delayNanos;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(delayNanos) * 31 + (shouldRetry ? 1 : 0);
  }

  @Override
  public String toString() {
    if (!shouldRetry) {
      return "RetryDecision{stop}";
    }
    return MoreObjects.toStringHelper(this).add("delayNanos", delayNanos).toString();
  }
}
