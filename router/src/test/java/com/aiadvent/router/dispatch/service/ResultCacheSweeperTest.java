package com.aiadvent.router.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.router.dispatch.cache.ResultCache;
import com.aiadvent.router.dispatch.provider.CompletionResponse;
import com.aiadvent.router.dispatch.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class ResultCacheSweeperTest {

  @Test
  void sweepRemovesExpiredEntriesAndRecordsMetric() {
    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    ResultCache cache = new ResultCache(Duration.ofMinutes(10), 0.95, 100, clock);
    cache.put("fp-1", "text", CompletionResponse.of("answer", "p", "m"), new float[] {1f, 0f});
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    ResultCacheSweeper sweeper =
        new ResultCacheSweeper(cache, null, Duration.ofMinutes(1), new DispatchMetrics(registry));

    clock.advance(Duration.ofMinutes(11));

    assertThat(sweeper.sweep()).isEqualTo(2);
    assertThat(registry.get("router.cache.sweep.removed").summary().totalAmount()).isEqualTo(2.0);
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void startSchedulesOnceAndStopCancels() {
    TaskScheduler scheduler = mock(TaskScheduler.class);
    ScheduledFuture future = mock(ScheduledFuture.class);
    when(scheduler.scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(5))))
        .thenReturn(future);
    ResultCacheSweeper sweeper =
        new ResultCacheSweeper(
            mock(ResultCache.class), scheduler, Duration.ofMinutes(5), null);

    sweeper.start();
    sweeper.start();

    assertThat(sweeper.isRunning()).isTrue();
    verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(5)));

    sweeper.stop();

    assertThat(sweeper.isRunning()).isFalse();
    verify(future).cancel(false);
  }

  @Test
  void nonPositiveIntervalDisablesBackgroundSweep() {
    TaskScheduler scheduler = mock(TaskScheduler.class);
    ResultCacheSweeper sweeper =
        new ResultCacheSweeper(mock(ResultCache.class), scheduler, Duration.ZERO, null);

    sweeper.start();

    assertThat(sweeper.isRunning()).isFalse();
    verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
  }
}
