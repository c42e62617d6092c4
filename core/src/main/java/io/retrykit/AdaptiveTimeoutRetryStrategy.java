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
import io.retrykit.internal.FailureWindow;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Gates another strategy on the recent failure rate. Outcomes passed to {@link #report} are kept
 * in a sliding window of the last {@code windowWordCount * 64} requests; while that window holds
 * {@code failureThreshold} or more failures, {@link #advance} refuses to retry without asking the
 * base strategy. As failures age out of the window the gate reopens on its own.
 *
 * <p>The gate only works if outcomes are reported, either by the caller or by a
 * {@link RetryExecutor} built with {@link RetryExecutor.Builder#setReportOutcomes}.
 *
 * <p>The check in {@code advance} and the updates in {@code report} are individually atomic but
 * not transactional, so under concurrent use the gate is best-effort. The base strategy must be
 * safe for the concurrency it will see.
 */
@ThreadSafe
public final class AdaptiveTimeoutRetryStrategy implements RetryStrategy {
  private final RetryStrategy base;
  private final FailureWindow window;
  private final int failureThreshold;

  /**
   * Creates a strategy.
   *
   * @param base the strategy consulted while the gate is open
   * @param windowWordCount size of the window in 64-slot words, must be positive
   * @param failureThreshold failures within the window that close the gate, must be positive
   */
  public AdaptiveTimeoutRetryStrategy(
      RetryStrategy base, int windowWordCount, int failureThreshold) {
    this.base = checkNotNull(base, "base");
    checkArgument(failureThreshold > 0, "failureThreshold must be positive: %s",
        failureThreshold);
    this.window = new FailureWindow(windowWordCount);
    this.failureThreshold = failureThreshold;
  }

  @Override
  public RetryDecision advance() {
    if (window.failureCount() >= failureThreshold) {
      return RetryDecision.stop();
    }
    return base.advance();
  }

  @Override
  public RetryStrategy report(@Nullable Throwable failure) {
    if (failure == null) {
      window.recordSuccess();
    } else {
      window.recordFailure();
    }
    return this;
  }

  @VisibleForTesting
  int recentFailures() {
    return window.failureCount();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("base", base)
        .add("window", window)
        .add("failureThreshold", failureThreshold)
        .toString();
  }
}
