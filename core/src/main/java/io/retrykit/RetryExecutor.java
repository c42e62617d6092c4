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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.retrykit.internal.RetryTimer;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs an operation until it succeeds, its {@link RetryStrategy} gives up, or a
 * {@link CancellationSignal} is cancelled.
 *
 * <p>Each invocation runs on the calling thread and makes its attempts strictly one after
 * another: invoke the operation; on failure ask the strategy for a delay; wait for that delay on a
 * single reusable timer; repeat. Cancellation is only noticed while waiting, so an attempt that
 * is already running always runs to completion.
 *
 * <p>By default outcomes are not reported to the strategy; see
 * {@link Builder#setReportOutcomes}.
 */
@ThreadSafe
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns a shared executor using the default timer scheduler that does not report outcomes.
   */
  public static RetryExecutor getDefault() {
    return DefaultHolder.INSTANCE;
  }

  private final ScheduledExecutorService scheduler;
  private final boolean reportOutcomes;

  private RetryExecutor(Builder builder) {
    this.scheduler =
        builder.scheduler != null ? builder.scheduler : TimerSchedulerHolder.SCHEDULER;
    this.reportOutcomes = builder.reportOutcomes;
  }

  /**
   * Runs {@code operation} until it completes normally.
   *
   * @throws AttemptsExhaustedException if {@code strategy} refused another retry
   * @throws RetryCancelledException if {@code signal} was cancelled while waiting to retry
   * @throws InterruptedException if the calling thread was interrupted while waiting, or the
   *     operation itself threw it
   */
  public void execute(
      CancellationSignal signal, RetryStrategy strategy, final Operation operation)
      throws RetryException, InterruptedException {
    checkNotNull(operation, "operation");
    call(signal, strategy, new Callable<Void>() {
      @Override
      public Void call() throws Exception {
        operation.run();
        return null;
      }
    });
  }

  /**
   * Like {@link #execute}, but returns the value of the first successful call.
   */
  @CanIgnoreReturnValue
  public <T> T call(CancellationSignal signal, RetryStrategy strategy, Callable<T> callable)
      throws RetryException, InterruptedException {
    checkNotNull(signal, "signal");
    checkNotNull(strategy, "strategy");
    checkNotNull(callable, "callable");

    final RetryTimer timer = new RetryTimer(scheduler);
    CancellationSignal.Listener wakeUp = new CancellationSignal.Listener() {
      @Override
      public void cancelled(CancellationSignal cancelled) {
        timer.abort();
      }
    };
    signal.addListener(wakeUp, MoreExecutors.directExecutor());
    try {
      int attempts = 0;
      while (true) {
        attempts++;
        Exception failure;
        try {
          T result = callable.call();
          if (reportOutcomes) {
            report(strategy, null);
          }
          return result;
        } catch (InterruptedException e) {
          throw e;
        } catch (Exception e) {
          failure = e;
        }
        if (reportOutcomes) {
          strategy = report(strategy, failure);
        }

        RetryDecision decision = strategy.advance();
        if (!decision.shouldRetry()) {
          logger.log(Level.FINE, "Giving up after {0} attempt(s)", attempts);
          throw new AttemptsExhaustedException(attempts, failure);
        }
        if (logger.isLoggable(Level.FINE)) {
          logger.log(Level.FINE, "Attempt {0} failed, retrying in {1}ns",
              new Object[] {attempts, decision.delayNanos()});
        }
        timer.arm(decision.delayNanos());
        if (!timer.await()) {
          throw new RetryCancelledException(attempts, signal.cancellationCause());
        }
      }
    } finally {
      signal.removeListener(wakeUp);
      timer.stop();
    }
  }

  private static RetryStrategy report(RetryStrategy strategy, @Nullable Throwable failure) {
    return checkNotNull(strategy.report(failure), "%s.report() returned null", strategy);
  }

  /** Builder for {@link RetryExecutor}. */
  public static final class Builder {
    @Nullable
    private ScheduledExecutorService scheduler;
    private boolean reportOutcomes;

    private Builder() {}

    /**
     * Sets the scheduler that drives the wait between attempts. It is not shut down by the
     * executor. If not set, a shared daemon scheduler is used.
     */
    @CanIgnoreReturnValue
    public Builder setScheduledExecutorService(ScheduledExecutorService scheduler) {
      this.scheduler = checkNotNull(scheduler, "scheduler");
      return this;
    }

    /**
     * Sets whether {@link RetryStrategy#report} is called after every attempt, with {@code null}
     * on success and the operation's error on failure. Needed for strategies that adapt to
     * outcomes, such as {@link AdaptiveTimeoutRetryStrategy}. Defaults to {@code false}.
     *
     * <p>When enabled, the strategy returned by {@code report} is the one asked for the next
     * delay.
     */
    @CanIgnoreReturnValue
    public Builder setReportOutcomes(boolean reportOutcomes) {
      this.reportOutcomes = reportOutcomes;
      return this;
    }

    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }

  private static final class TimerSchedulerHolder {
    static final ScheduledExecutorService SCHEDULER = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("retrykit-timer-%d")
            .build());
  }

  private static final class DefaultHolder {
    static final RetryExecutor INSTANCE = newBuilder().build();
  }
}
