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

import com.google.common.base.MoreObjects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A fixed-size ring of outcome bits remembering which of the most recent requests failed.
 *
 * <p>The ring is packed into 64-bit words. Each recorded outcome takes the next slot in ring
 * order, overwriting the outcome recorded {@link #capacity()} requests earlier. A set bit is a
 * failure, a clear bit a success, so a fresh window counts as all successes.
 *
 * <p>Every word update is an atomic read-modify-write, so concurrent writers to the same word
 * never lose each other's bits. {@link #failureCount} is not a snapshot: it may observe some
 * concurrent updates and miss others.
 */
@ThreadSafe
public final class FailureWindow {
  private static final int BITS_PER_WORD_SHIFT = 6;
  private static final long BIT_INDEX_MASK = Long.SIZE - 1;

  private final AtomicLongArray words;
  private final AtomicLong requests = new AtomicLong();
  private final long capacity;

  /**
   * Creates a window of {@code wordCount * 64} slots.
   */
  public FailureWindow(int wordCount) {
    checkArgument(wordCount > 0, "wordCount must be positive: %s", wordCount);
    this.words = new AtomicLongArray(wordCount);
    this.capacity = (long) wordCount * Long.SIZE;
  }

  public void recordFailure() {
    long slot = nextSlot();
    final long mask = 1L << (slot & BIT_INDEX_MASK);
    words.getAndAccumulate(wordIndex(slot), mask, (word, bit) -> word | bit);
  }

  public void recordSuccess() {
    long slot = nextSlot();
    final long mask = 1L << (slot & BIT_INDEX_MASK);
    words.getAndAccumulate(wordIndex(slot), mask, (word, bit) -> word & ~bit);
  }

  /**
   * Returns the number of failures among the last {@link #capacity()} recorded outcomes.
   */
  public int failureCount() {
    int failures = 0;
    for (int i = 0; i < words.length(); i++) {
      failures += Long.bitCount(words.get(i));
    }
    return failures;
  }

  public long capacity() {
    return capacity;
  }

  private long nextSlot() {
    return Math.floorMod(requests.getAndIncrement(), capacity);
  }

  private static int wordIndex(long slot) {
    return (int) (slot >>> BITS_PER_WORD_SHIFT);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("capacity", capacity)
        .add("failures", failureCount())
        .toString();
  }
}
