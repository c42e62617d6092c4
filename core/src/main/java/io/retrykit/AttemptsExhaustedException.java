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
 * The {@link RetryStrategy} refused further retries. The cause, if any, is the error the last
 * attempt failed with.
 */
public final class AttemptsExhaustedException extends RetryException {
  private static final long serialVersionUID = -3117264960512781925L;

  public AttemptsExhaustedException(int attempts, @Nullable Throwable lastFailure) {
    super("retry attempts exhausted after " + attempts + " attempt(s)", lastFailure, attempts);
  }
}
