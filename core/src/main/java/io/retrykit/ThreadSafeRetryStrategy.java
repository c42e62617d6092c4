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

import com.google.common.base.MoreObjects;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Serializes all calls into a strategy that is not safe for concurrent use. {@link #advance} and
 * {@link #report} hold the same lock for the duration of the delegated call; the delegate's
 * behavior is otherwise unchanged.
 *
 * <p>If the delegate's {@code report} hands back a different strategy, this wrapper starts
 * guarding that one and still returns itself, so callers never see the unguarded instance.
 */
@ThreadSafe
public final class ThreadSafeRetryStrategy implements RetryStrategy {
  private final Object lock = new Object();
  @GuardedBy("lock")
  private RetryStrategy delegate;

  public ThreadSafeRetryStrategy(RetryStrategy delegate) {
    this.delegate = checkNotNull(delegate, "delegate");
  }

  @Override
  public RetryDecision advance() {
    synchronized (lock) {
      return delegate.advance();
    }
  }

  @Override
  public RetryStrategy report(@Nullable Throwable failure) {
    synchronized (lock) {
      delegate = checkNotNull(delegate.report(failure), "report() returned null");
    }
    return this;
  }

  @Override
  public String toString() {
    synchronized (lock) {
      return MoreObjects.toStringHelper(this).add("delegate", delegate).toString();
    }
  }
}
