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

package io.retrykit.internal;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A single timer that one thread waits on between retry attempts, and that other threads can
 * abort.
 *
 * <p>{@link #arm} (re)starts the timer; the thread then blocks in {@link #await} until the timer
 * fires or {@link #abort} is called. Rearming discards the earlier schedule, so a stale expiration
 * can never wake a later wait. Once aborted the timer stays aborted: every following
 * {@code await} returns {@code false} immediately.
 */
@ThreadSafe
public final class RetryTimer {
  private final ScheduledExecutorService scheduler;
  private final Object lock = new Object();

  @GuardedBy("lock")
  @Nullable
  private ScheduledFuture<?> pending;
  // Incremented on every arm; an expiration only counts if it belongs to the latest arm.
  @GuardedBy("lock")
  private long generation;
  @GuardedBy("lock")
  private boolean fired;
  @GuardedBy("lock")
  private boolean aborted;

  public RetryTimer(ScheduledExecutorService scheduler) {
    this.scheduler = checkNotNull(scheduler, "scheduler");
  }

  /**
   * Starts the timer so that it fires after {@code delayNanos}, replacing any earlier schedule.
   * Does nothing once the timer is aborted.
   */
  public void arm(long delayNanos) {
    checkArgument(delayNanos >= 0, "delayNanos must not be negative: %s", delayNanos);
    synchronized (lock) {
      if (aborted) {
        return;
      }
      cancelPending();
      fired = false;
      pending = scheduler.schedule(
          new Expiration(++generation), delayNanos, TimeUnit.NANOSECONDS);
    }
  }

  /**
   * Blocks until the timer fires or is aborted.
   *
   * @return {@code true} if the timer fired, {@code false} if it was aborted. Abort wins if both
   *     happened.
   * @throws InterruptedException if the calling thread is interrupted, even when the timer has
   *     already fired
   */
  public boolean await() throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException();
    }
    synchronized (lock) {
      while (!fired && !aborted) {
        lock.wait();
      }
      return !aborted;
    }
  }

  /**
   * Wakes up any waiter and keeps the timer from firing again.
   */
  public void abort() {
    synchronized (lock) {
      aborted = true;
      cancelPending();
      lock.notifyAll();
    }
  }

  /**
   * Cancels the pending schedule, if any, without aborting.
   */
  public void stop() {
    synchronized (lock) {
      generation++;
      cancelPending();
    }
  }

  @VisibleForTesting
  boolean hasFired() {
    synchronized (lock) {
      return fired;
    }
  }

  @GuardedBy("lock")
  private void cancelPending() {
    if (pending != null) {
      pending.cancel(false);
      pending = null;
    }
  }

  private final class Expiration implements Runnable {
    private final long armedGeneration;

    Expiration(long armedGeneration) {
      this.armedGeneration = armedGeneration;
    }

    @Override
    public void run() {
      synchronized (lock) {
        if (armedGeneration != generation || aborted) {
          return;
        }
        fired = true;
        pending = null;
        lock.notifyAll();
      }
    }
  }
}
