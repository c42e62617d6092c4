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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A one-shot signal that tells long running work, such as a retry loop, to give up. A signal
 * starts out active and can be cancelled exactly once, either explicitly through {@link #cancel}
 * or because its deadline elapsed. Once cancelled it stays cancelled and remembers the cause.
 *
 * <p>Cancellation is cooperative. Holders of the signal poll {@link #isCancelled} or register a
 * {@link Listener}; nothing is interrupted on their behalf.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationSignal {
  private static final Logger log = Logger.getLogger(CancellationSignal.class.getName());

  /**
   * Creates a signal that is only cancelled by calling {@link #cancel}.
   */
  public static CancellationSignal create() {
    return new CancellationSignal();
  }

  /**
   * Creates a signal that is cancelled with a {@link TimeoutException} once {@code duration} has
   * elapsed, unless it was cancelled before that.
   *
   * @param duration a non-negative duration; zero or negative values cancel immediately
   * @param unit the unit of {@code duration}
   * @param scheduler used to run the expiration; it is not shut down by the signal
   */
  public static CancellationSignal withDeadlineAfter(
      long duration, TimeUnit unit, ScheduledExecutorService scheduler) {
    checkNotNull(unit, "unit");
    checkNotNull(scheduler, "scheduler");
    final CancellationSignal signal = new CancellationSignal();
    final long timeoutNanos = unit.toNanos(duration);
    if (timeoutNanos <= 0) {
      signal.cancel(new TimeoutException("deadline already exceeded"));
      return signal;
    }
    ScheduledFuture<?> expiration = scheduler.schedule(new Runnable() {
      @Override
      public void run() {
        signal.cancel(new TimeoutException("deadline exceeded after " + timeoutNanos + "ns"));
      }
    }, timeoutNanos, TimeUnit.NANOSECONDS);
    synchronized (signal.lock) {
      if (signal.cancelled) {
        expiration.cancel(false);
      } else {
        signal.pendingDeadline = expiration;
      }
    }
    return signal;
  }

  private final Object lock = new Object();
  // @GuardedBy("lock")
  private List<ExecutableListener> listeners = new ArrayList<>();
  // @GuardedBy("lock")
  private ScheduledFuture<?> pendingDeadline;
  private volatile boolean cancelled;
  private volatile Throwable cancellationCause;

  private CancellationSignal() {}

  /**
   * Returns a new signal that is cancelled, with the same cause, as soon as this one is. The child
   * may also be cancelled on its own without affecting this signal.
   *
   * <p>This signal keeps a reference to the child until one of the two is cancelled. A child that
   * is no longer needed should be cancelled so that a long-lived parent does not retain it.
   */
  public CancellationSignal newChild() {
    final CancellationSignal child = new CancellationSignal();
    final Listener propagator = new Listener() {
      @Override
      public void cancelled(CancellationSignal parent) {
        child.cancel(parent.cancellationCause());
      }
    };
    addListener(propagator, DirectExecutor.INSTANCE);
    // Stop holding on to the child once it is done.
    child.addListener(new Listener() {
      @Override
      public void cancelled(CancellationSignal signal) {
        removeListener(propagator);
      }
    }, DirectExecutor.INSTANCE);
    return child;
  }

  /**
   * Cancels this signal and notifies its listeners. Only the first call has any effect.
   *
   * @param cause why the signal was cancelled; {@code null} is replaced with a
   *     {@link CancellationException}
   * @return {@code true} if this call cancelled the signal, {@code false} if it was already
   *     cancelled
   */
  public boolean cancel(Throwable cause) {
    List<ExecutableListener> toNotify;
    ScheduledFuture<?> deadline;
    synchronized (lock) {
      if (cancelled) {
        return false;
      }
      cancellationCause = cause != null ? cause : new CancellationException("signal cancelled");
      cancelled = true;
      toNotify = listeners;
      listeners = null;
      deadline = pendingDeadline;
      pendingDeadline = null;
    }
    if (deadline != null) {
      deadline.cancel(false);
    }
    for (ExecutableListener listener : toNotify) {
      listener.deliver();
    }
    return true;
  }

  /**
   * Returns {@code true} once this signal has been cancelled.
   */
  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Returns the cause this signal was cancelled with, or {@code null} if it is still active.
   */
  public Throwable cancellationCause() {
    if (!cancelled) {
      return null;
    }
    return cancellationCause;
  }

  /**
   * Registers a listener to be run on {@code executor} when this signal is cancelled. If the
   * signal is already cancelled the listener is scheduled right away.
   */
  public void addListener(Listener listener, Executor executor) {
    checkNotNull(listener, "listener");
    checkNotNull(executor, "executor");
    ExecutableListener executable = new ExecutableListener(listener, executor);
    synchronized (lock) {
      if (!cancelled) {
        listeners.add(executable);
        return;
      }
    }
    executable.deliver();
  }

  /**
   * Removes every registration of {@code listener}. Has no effect once the signal is cancelled.
   */
  public void removeListener(Listener listener) {
    synchronized (lock) {
      if (listeners == null) {
        return;
      }
      for (int i = listeners.size() - 1; i >= 0; i--) {
        if (listeners.get(i).listener == listener) {
          listeners.remove(i);
        }
      }
    }
  }

  // Used in tests.
  int listenerCount() {
    synchronized (lock) {
      return listeners == null ? 0 : listeners.size();
    }
  }

  @Override
  public String toString() {
    Throwable cause = cancellationCause();
    return "CancellationSignal{cancelled=" + (cause != null)
        + (cause != null ? ", cause=" + cause : "") + "}";
  }

  /**
   * Notified when a {@link CancellationSignal} is cancelled.
   */
  public interface Listener {
    void cancelled(CancellationSignal signal);
  }

  private final class ExecutableListener implements Runnable {
    private final Listener listener;
    private final Executor executor;

    ExecutableListener(Listener listener, Executor executor) {
      this.listener = listener;
      this.executor = executor;
    }

    void deliver() {
      try {
        executor.execute(this);
      } catch (Throwable t) {
        log.log(Level.INFO, "Exception notifying cancellation listener", t);
      }
    }

    @Override
    public void run() {
      listener.cancelled(CancellationSignal.this);
    }
  }

  private enum DirectExecutor implements Executor {
    INSTANCE;

    @Override
    public void execute(Runnable command) {
      command.run();
    }
  }

  private static <T> T checkNotNull(T reference, Object errorMessage) {
    if (reference == null) {
      throw new NullPointerException(String.valueOf(errorMessage));
    }
    return reference;
  }
}
