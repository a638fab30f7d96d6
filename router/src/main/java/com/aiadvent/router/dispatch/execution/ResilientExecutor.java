package com.aiadvent.router.dispatch.execution;

import com.aiadvent.router.dispatch.exception.AttemptTimeoutException;
import com.aiadvent.router.dispatch.exception.ProviderException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.Assert;

/**
 * Runs single outbound calls against one backend with minimum-interval pacing, a hard per-attempt
 * timeout and bounded exponential-backoff retry. Timeouts are terminal and never retried.
 *
 * <p>The only state kept between calls is the start time of the previous paced attempt; callers
 * sharing an instance are serialized around it. {@link #executeOnce} bypasses both pacing and retry
 * and leaves that state untouched.
 */
public class ResilientExecutor {

  private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

  private final String name;
  private final ExecutionSettings settings;
  private final ExecutorService attemptExecutor;
  private final LongSupplier nanoClock;
  private final Sleeper sleeper;
  private final RetryTemplate retryTemplate;

  private final Object pacingLock = new Object();
  private long lastAttemptStartedAt;
  private boolean attemptStarted;

  public ResilientExecutor(String name, ExecutionSettings settings, ExecutorService attemptExecutor) {
    this(name, settings, attemptExecutor, System::nanoTime, new ThreadWaitSleeper());
  }

  public ResilientExecutor(
      String name,
      ExecutionSettings settings,
      ExecutorService attemptExecutor,
      LongSupplier nanoClock,
      Sleeper sleeper) {
    Assert.hasText(name, "name must not be blank");
    Assert.notNull(settings, "settings must not be null");
    Assert.notNull(attemptExecutor, "attemptExecutor must not be null");
    this.name = name;
    this.settings = settings;
    this.attemptExecutor = attemptExecutor;
    this.nanoClock = nanoClock;
    this.sleeper = sleeper;
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(settings.maxAttempts())
            .notRetryOn(AttemptTimeoutException.class)
            .customBackoff(
                new RateLimitAwareBackOffPolicy(
                    settings.initialBackoff(),
                    settings.backoffMultiplier(),
                    settings.maxBackoff(),
                    sleeper))
            .withListener(new AttemptLoggingListener(name))
            .build();
  }

  public String name() {
    return name;
  }

  public ExecutionSettings settings() {
    return settings;
  }

  public <T> T execute(Supplier<T> attempt) {
    return execute(attempt, null);
  }

  /**
   * @param timeout per-attempt deadline, {@code null} for the configured default
   * @throws AttemptTimeoutException when an attempt exceeds its deadline
   * @throws RuntimeException the last failure once the retry budget is spent
   */
  public <T> T execute(Supplier<T> attempt, Duration timeout) {
    Assert.notNull(attempt, "attempt must not be null");
    Duration effectiveTimeout =
        timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : settings.timeout();
    return retryTemplate.execute(
        context -> {
          awaitPacingSlot();
          return runAttempt(attempt, effectiveTimeout);
        });
  }

  /**
   * Runs one unpaced attempt bounded by the configured timeout. Failures propagate as they are,
   * without retry.
   */
  public <T> T executeOnce(Supplier<T> attempt) {
    Assert.notNull(attempt, "attempt must not be null");
    return runAttempt(attempt, settings.timeout());
  }

  private <T> T runAttempt(Supplier<T> attempt, Duration timeout) {
    Future<T> future = attemptExecutor.submit(attempt::get);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException exception) {
      future.cancel(true);
      throw new AttemptTimeoutException(name, timeout);
    } catch (ExecutionException exception) {
      Throwable cause = exception.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new ProviderException(name, "Attempt against '" + name + "' failed", cause);
    } catch (InterruptedException exception) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ProviderException(name, "Interrupted while waiting for '" + name + "'", exception);
    }
  }

  private void awaitPacingSlot() {
    long minIntervalNanos = settings.minInterval().toNanos();
    synchronized (pacingLock) {
      if (attemptStarted && minIntervalNanos > 0) {
        long remainingNanos = lastAttemptStartedAt + minIntervalNanos - nanoClock.getAsLong();
        if (remainingNanos > 0) {
          long waitMillis = TimeUnit.NANOSECONDS.toMillis(remainingNanos + 999_999L);
          try {
            sleeper.sleep(waitMillis);
          } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new ProviderException(
                name, "Interrupted while pacing attempts for '" + name + "'", exception);
          }
        }
      }
      lastAttemptStartedAt = nanoClock.getAsLong();
      attemptStarted = true;
    }
  }

  private static final class AttemptLoggingListener implements RetryListener {

    private final String name;

    private AttemptLoggingListener(String name) {
      this.name = name;
    }

    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      int attempt = context.getRetryCount();
      if (log.isDebugEnabled()) {
        log.debug("Attempt {} against {} failed: {}", attempt, name, throwable.getMessage(), throwable);
      } else {
        log.info("Attempt {} against {} failed: {}", attempt, name, throwable.getMessage());
      }
    }
  }
}
