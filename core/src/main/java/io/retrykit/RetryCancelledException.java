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

/**
 * The {@link CancellationSignal} was cancelled while waiting for the next attempt. The cause is
 * exactly {@link CancellationSignal#cancellationCause()}.
 */
public final class RetryCancelledException extends RetryException {
  private static final long serialVersionUID = 8350462212731596147L;

  public RetryCancelledException(int attempts, Throwable cancellationCause) {
    super("retry cancelled after " + attempts + " attempt(s)", cancellationCause, attempts);
  }
}
