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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;

/**
 * Decides how long to wait before the next attempt of a failed operation, and when to give up.
 *
 * <p>One instance is normally shared by every attempt of a logical operation, and may be shared
 * further (across a connection pool, say) if the caller chooses. Implementations that are not
 * safe for concurrent use can be wrapped in a {@link ThreadSafeRetryStrategy}.
 */
public interface RetryStrategy {

  /**
   * Called once per failed attempt. Returns how long to wait before the next attempt, or
   * {@link RetryDecision#stop()} if the caller must stop retrying.
   */
  RetryDecision advance();

  /**
   * Tells the strategy how an attempt went, so that it can adapt.
   *
   * @param failure the error the attempt failed with, or {@code null} if it succeeded
   * @return the strategy to consult from now on; usually {@code this}
   */
  @CanIgnoreReturnValue
  RetryStrategy report(@Nullable Throwable failure);
}
