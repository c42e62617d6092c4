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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link RetryTimer}.
 */
@RunWith(JUnit4.class)
public class RetryTimerTest {
  private final ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
  private final ScheduledFuture<?> future = mock(ScheduledFuture.class);
  private final ArgumentCaptor<Runnable> expirations = ArgumentCaptor.forClass(Runnable.class);

  private RetryTimer timer;

  @Before
  public void setUp() {
    doReturn(future).when(scheduler)
        .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    timer = new RetryTimer(scheduler);
  }

  @Test
  public void firesAfterArmedDelay() throws Exception {
    timer.arm(100);

    verify(scheduler).schedule(expirations.capture(), eq(100L), eq(TimeUnit.NANOSECONDS));
    assertThat(timer.hasFired()).isFalse();

    expirations.getValue().run();

    assertThat(timer.hasFired()).isTrue();
    assertThat(timer.await()).isTrue();
  }

  @Test
  public void rearmDiscardsEarlierSchedule() {
    timer.arm(100);
    timer.arm(200);

    verify(future).cancel(false);
    verify(scheduler, times(2))
        .schedule(expirations.capture(), anyLong(), eq(TimeUnit.NANOSECONDS));
    List<Runnable> scheduled = expirations.getAllValues();

    scheduled.get(0).run();
    assertThat(timer.hasFired()).isFalse();

    scheduled.get(1).run();
    assertThat(timer.hasFired()).isTrue();
  }

  @Test
  public void rearmClearsPreviousFiring() {
    timer.arm(100);
    verify(scheduler).schedule(expirations.capture(), anyLong(), any(TimeUnit.class));
    expirations.getValue().run();
    assertThat(timer.hasFired()).isTrue();

    timer.arm(100);

    assertThat(timer.hasFired()).isFalse();
  }

  @Test
  public void abortWakesWaiter() throws Exception {
    timer.arm(TimeUnit.HOURS.toNanos(1));
    final AtomicBoolean result = new AtomicBoolean(true);
    Thread waiter = new Thread(() -> {
      try {
        result.set(timer.await());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    waiter.start();

    timer.abort();
    waiter.join(TimeUnit.SECONDS.toMillis(10));

    assertThat(waiter.isAlive()).isFalse();
    assertThat(result.get()).isFalse();
    verify(future).cancel(false);
  }

  @Test
  public void abortWinsOverFiring() throws Exception {
    timer.arm(100);
    verify(scheduler).schedule(expirations.capture(), anyLong(), any(TimeUnit.class));
    expirations.getValue().run();

    timer.abort();

    assertThat(timer.await()).isFalse();
  }

  @Test
  public void armAfterAbortDoesNothing() throws Exception {
    timer.abort();

    timer.arm(100);

    verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    assertThat(timer.await()).isFalse();
  }

  @Test
  public void stopIgnoresLateExpiration() {
    timer.arm(100);
    verify(scheduler).schedule(expirations.capture(), anyLong(), any(TimeUnit.class));

    timer.stop();
    expirations.getValue().run();

    verify(future).cancel(false);
    assertThat(timer.hasFired()).isFalse();
  }

  @Test
  public void awaitThrowsWhenInterruptedAfterFiring() {
    timer.arm(100);
    verify(scheduler).schedule(expirations.capture(), anyLong(), any(TimeUnit.class));
    expirations.getValue().run();

    Thread.currentThread().interrupt();
    try {
      assertThrows(InterruptedException.class, () -> timer.await());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  public void rejectsNegativeDelay() {
    assertThrows(IllegalArgumentException.class, () -> timer.arm(-1));
  }
}
