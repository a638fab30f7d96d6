package com.aiadvent.router.dispatch.execution;

import com.aiadvent.router.dispatch.exception.RateLimitedException;
import java.time.Duration;
import java.util.Optional;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Exponential backoff that yields to a server-suggested delay when the failed attempt carried an
 * explicit rate-limit signal.
 */
class RateLimitAwareBackOffPolicy implements BackOffPolicy {

  private final long initialIntervalMs;
  private final double multiplier;
  private final long maxIntervalMs;
  private final Sleeper sleeper;

  RateLimitAwareBackOffPolicy(
      Duration initialInterval, double multiplier, Duration maxInterval, Sleeper sleeper) {
    this.initialIntervalMs = initialInterval.toMillis();
    this.multiplier = multiplier;
    this.maxIntervalMs = Math.max(initialIntervalMs, maxInterval.toMillis());
    this.sleeper = sleeper;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new AttemptBackOffContext(context);
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    AttemptBackOffContext context = (AttemptBackOffContext) backOffContext;
    long delay = nextDelay(context.retryContext.getLastThrowable(), context.backOffs++);
    if (delay <= 0) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted during retry backoff", exception);
    }
  }

  long nextDelay(Throwable lastFailure, int completedBackOffs) {
    if (lastFailure instanceof RateLimitedException rateLimited) {
      Optional<Duration> suggested = rateLimited.retryAfter();
      if (suggested.isPresent()) {
        return Math.max(0L, suggested.get().toMillis());
      }
    }
    double delay = initialIntervalMs * Math.pow(multiplier, completedBackOffs);
    return (long) Math.min(delay, maxIntervalMs);
  }

  private static final class AttemptBackOffContext implements BackOffContext {

    private final RetryContext retryContext;
    private int backOffs;

    private AttemptBackOffContext(RetryContext retryContext) {
      this.retryContext = retryContext;
    }
  }
}
