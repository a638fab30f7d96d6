package com.aiadvent.router.dispatch.service;

import com.aiadvent.router.dispatch.cache.ResultCache;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/** Periodic expiry sweep of a {@link ResultCache}, started and stopped by its owner. */
@Slf4j
public class ResultCacheSweeper {

  private final ResultCache resultCache;
  private final TaskScheduler taskScheduler;
  private final Duration interval;
  private final DispatchMetrics metrics;
  private ScheduledFuture<?> scheduledSweep;

  public ResultCacheSweeper(
      ResultCache resultCache,
      TaskScheduler taskScheduler,
      Duration interval,
      DispatchMetrics metrics) {
    this.resultCache = resultCache;
    this.taskScheduler = taskScheduler;
    this.interval = interval;
    this.metrics = metrics;
  }

  public synchronized void start() {
    if (scheduledSweep != null) {
      return;
    }
    if (taskScheduler == null || interval == null || interval.isZero() || interval.isNegative()) {
      log.info("Result cache sweep disabled (interval={})", interval);
      return;
    }
    scheduledSweep = taskScheduler.scheduleWithFixedDelay(this::safeSweep, interval);
    log.info("Result cache sweep started with interval {}", interval);
  }

  public synchronized void stop() {
    if (scheduledSweep == null) {
      return;
    }
    scheduledSweep.cancel(false);
    scheduledSweep = null;
    log.info("Result cache sweep stopped");
  }

  public synchronized boolean isRunning() {
    return scheduledSweep != null;
  }

  public int sweep() {
    int removed = resultCache.sweepExpired();
    if (metrics != null) {
      metrics.recordSweep(removed);
    }
    return removed;
  }

  private void safeSweep() {
    try {
      sweep();
    } catch (RuntimeException exception) {
      log.warn("Result cache sweep failed", exception);
    }
  }
}
