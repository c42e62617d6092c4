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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Unit tests for {@link FailureWindow}.
 */
@RunWith(JUnit4.class)
public class FailureWindowTest {

  @Test
  public void capacityIsSixtyFourSlotsPerWord() {
    assertThat(new FailureWindow(1).capacity()).isEqualTo(64);
    assertThat(new FailureWindow(3).capacity()).isEqualTo(192);
  }

  @Test
  public void freshWindowHasNoFailures() {
    assertThat(new FailureWindow(2).failureCount()).isEqualTo(0);
  }

  @Test
  public void countsFailuresAcrossWords() {
    FailureWindow window = new FailureWindow(2);

    for (int i = 0; i < 100; i++) {
      if (i % 4 == 0) {
        window.recordSuccess();
      } else {
        window.recordFailure();
      }
    }

    assertThat(window.failureCount()).isEqualTo(75);
  }

  @Test
  public void oldestOutcomesAreOverwritten() {
    FailureWindow window = new FailureWindow(1);
    for (int i = 0; i < 64; i++) {
      window.recordFailure();
    }
    assertThat(window.failureCount()).isEqualTo(64);

    for (int i = 0; i < 10; i++) {
      window.recordSuccess();
    }

    assertThat(window.failureCount()).isEqualTo(54);
  }

  @Test
  public void onlyTheLastCapacityOutcomesCount() {
    FailureWindow window = new FailureWindow(1);
    for (int i = 0; i < 1000; i++) {
      window.recordFailure();
    }
    for (int i = 0; i < 64; i++) {
      window.recordSuccess();
    }

    assertThat(window.failureCount()).isEqualTo(0);
  }

  @Test
  public void concurrentWritersToOneWordLoseNothing() throws Exception {
    final FailureWindow window = new FailureWindow(1);
    int threads = 8;
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < 8; i++) {
            window.recordFailure();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(window.failureCount()).isEqualTo(64);
  }

  @Test
  public void rejectsNonPositiveWordCount() {
    assertThrows(IllegalArgumentException.class, () -> new FailureWindow(0));
    assertThrows(IllegalArgumentException.class, () -> new FailureWindow(-2));
  }
}
