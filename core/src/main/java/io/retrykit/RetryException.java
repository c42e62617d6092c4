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

import javax.annotation.Nullable;

/**
 * Thrown by {@link RetryExecutor} when it gives up on an operation without the operation having
 * succeeded.
 */
public abstract class RetryException extends Exception {
  private static final long serialVersionUID = 4216395473828143051L;

  private final int attempts;

  protected RetryException(String message, @Nullable Throwable cause, int attempts) {
    super(message, cause);
    this.attempts = attempts;
  }

  /**
   * Returns how many times the operation was invoked before giving up.
   */
  public final int getAttempts() {
    return attempts;
  }
}
