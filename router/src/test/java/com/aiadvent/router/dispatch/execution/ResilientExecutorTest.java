package com.aiadvent.router.dispatch.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.router.dispatch.exception.AttemptTimeoutException;
import com.aiadvent.router.dispatch.exception.ProviderException;
import com.aiadvent.router.dispatch.exception.RateLimitedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ResilientExecutorTest {

  private final ExecutorService attemptExecutor = Executors.newCachedThreadPool();
  private final RecordingSleeper sleeper = new RecordingSleeper();

  @AfterEach
  void tearDown() {
    attemptExecutor.shutdownNow();
  }

  @Test
  void returnsResultOfSuccessfulAttempt() {
    ResilientExecutor executor =
        new ResilientExecutor("openai:gpt-4o", settings(Duration.ZERO, 3), attemptExecutor);

    assertThat(executor.execute(() -> "answer")).isEqualTo("answer");
  }

  @Test
  void consecutiveAttemptsRespectMinimumInterval() {
    Duration minInterval = Duration.ofMillis(150);
    ResilientExecutor executor =
        new ResilientExecutor("openai:gpt-4o", settings(minInterval, 0), attemptExecutor);
    List<Long> startedAt = new CopyOnWriteArrayList<>();

    executor.execute(() -> startedAt.add(System.nanoTime()));
    executor.execute(() -> startedAt.add(System.nanoTime()));

    long gapMillis = TimeUnit.NANOSECONDS.toMillis(startedAt.get(1) - startedAt.get(0));
    assertThat(gapMillis).isGreaterThanOrEqualTo(minInterval.toMillis());
  }

  @Test
  void concurrentCallersSharingAnExecutorAreStillSpacedApart() throws Exception {
    Duration minInterval = Duration.ofMillis(100);
    ResilientExecutor executor =
        new ResilientExecutor("openai:gpt-4o", settings(minInterval, 0), attemptExecutor);
    List<Long> startedAt = new CopyOnWriteArrayList<>();
    int callers = 5;
    ExecutorService callerPool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<String>> calls = new ArrayList<>();
    try {
      for (int i = 0; i < callers; i++) {
        calls.add(
            callerPool.submit(
                () -> {
                  start.await();
                  return executor.execute(
                      () -> {
                        startedAt.add(System.nanoTime());
                        return "ok";
                      });
                }));
      }
      start.countDown();
      for (Future<String> call : calls) {
        assertThat(call.get(30, TimeUnit.SECONDS)).isEqualTo("ok");
      }
    } finally {
      callerPool.shutdownNow();
    }

    List<Long> sorted = startedAt.stream().sorted().toList();
    assertThat(sorted).hasSize(callers);
    // small allowance for the hand-off from the pacing thread to the attempt pool
    long toleranceMillis = 10;
    for (int i = 1; i < sorted.size(); i++) {
      long gapMillis = TimeUnit.NANOSECONDS.toMillis(sorted.get(i) - sorted.get(i - 1));
      assertThat(gapMillis).isGreaterThanOrEqualTo(minInterval.toMillis() - toleranceMillis);
    }
    long spanMillis = TimeUnit.NANOSECONDS.toMillis(sorted.get(callers - 1) - sorted.get(0));
    assertThat(spanMillis)
        .isGreaterThanOrEqualTo((callers - 1) * minInterval.toMillis() - toleranceMillis);
  }

  @Test
  void singleAttemptSkipsPacingAndRetry() {
    long[] now = {0L};
    ResilientExecutor executor =
        new ResilientExecutor(
            "openai:gpt-4o",
            settings(Duration.ofSeconds(1), 3),
            attemptExecutor,
            () -> now[0],
            sleeper);
    AtomicInteger attempts = new AtomicInteger();

    executor.execute(() -> "paced");
    assertThatThrownBy(
            () ->
                executor.executeOnce(
                    () -> {
                      attempts.incrementAndGet();
                      throw new ProviderException("openai:gpt-4o", "no embedding model");
                    }))
        .isInstanceOf(ProviderException.class);
    now[0] += TimeUnit.MILLISECONDS.toNanos(400);
    executor.execute(() -> "paced again");

    assertThat(attempts).hasValue(1);
    assertThat(sleeper.sleeps()).containsExactly(600L);
  }

  @Test
  void singleAttemptIsBoundedByConfiguredTimeout() {
    ResilientExecutor executor =
        new ResilientExecutor(
            "openai:gpt-4o",
            new ExecutionSettings(
                Duration.ZERO,
                Duration.ofMillis(50),
                3,
                Duration.ofSeconds(2),
                2.0,
                Duration.ofSeconds(60)),
            attemptExecutor,
            () -> 0L,
            sleeper);

    assertThatThrownBy(
            () ->
                executor.executeOnce(
                    () -> {
                      sleepQuietly(2_000);
                      return "late";
                    }))
        .isInstanceOf(AttemptTimeoutException.class);
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void pacingWaitsOnlyForTheRemainderOfTheInterval() {
    long[] now = {0L};
    ResilientExecutor executor =
        new ResilientExecutor(
            "openai:gpt-4o",
            settings(Duration.ofSeconds(1), 0),
            attemptExecutor,
            () -> now[0],
            sleeper);

    executor.execute(() -> "first");
    now[0] += TimeUnit.MILLISECONDS.toNanos(400);
    executor.execute(() -> "second");

    assertThat(sleeper.sleeps()).containsExactly(600L);
  }

  @Test
  void retriesFailedAttemptsUntilSuccess() {
    ResilientExecutor executor = fakeTimeExecutor(settings(Duration.ZERO, 3));
    AtomicInteger attempts = new AtomicInteger();

    String result =
        executor.execute(
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new ProviderException("openai:gpt-4o", "boom");
              }
              return "recovered";
            });

    assertThat(result).isEqualTo("recovered");
    assertThat(attempts).hasValue(3);
  }

  @Test
  void rethrowsLastFailureOnceRetriesAreSpent() {
    ResilientExecutor executor = fakeTimeExecutor(settings(Duration.ZERO, 2));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new ProviderException(
                          "openai:gpt-4o", "failure " + attempts.incrementAndGet());
                    }))
        .isInstanceOf(ProviderException.class)
        .hasMessage("failure 3");
    assertThat(attempts).hasValue(3);
  }

  @Test
  void backoffGrowsExponentially() {
    ResilientExecutor executor = fakeTimeExecutor(settings(Duration.ZERO, 3));

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new ProviderException("openai:gpt-4o", "boom");
                    }))
        .isInstanceOf(ProviderException.class);
    assertThat(sleeper.sleeps()).containsExactly(2_000L, 4_000L, 8_000L);
  }

  @Test
  void honoursServerSuggestedRetryDelay() {
    ResilientExecutor executor = fakeTimeExecutor(settings(Duration.ZERO, 3));
    AtomicInteger attempts = new AtomicInteger();

    String result =
        executor.execute(
            () -> {
              if (attempts.incrementAndGet() == 1) {
                throw new RateLimitedException(
                    "openai:gpt-4o", "slow down", Duration.ofSeconds(7));
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(sleeper.sleeps()).containsExactly(7_000L);
  }

  @Test
  void timedOutAttemptIsNotRetried() {
    ResilientExecutor executor = fakeTimeExecutor(settings(Duration.ZERO, 3));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      attempts.incrementAndGet();
                      sleepQuietly(2_000);
                      return "late";
                    },
                    Duration.ofMillis(50)))
        .isInstanceOf(AttemptTimeoutException.class);
    assertThat(attempts).hasValue(1);
    assertThat(sleeper.sleeps()).isEmpty();
  }

  private ResilientExecutor fakeTimeExecutor(ExecutionSettings settings) {
    return new ResilientExecutor("openai:gpt-4o", settings, attemptExecutor, () -> 0L, sleeper);
  }

  private static ExecutionSettings settings(Duration minInterval, int maxRetries) {
    return new ExecutionSettings(
        minInterval,
        Duration.ofSeconds(5),
        maxRetries,
        Duration.ofSeconds(2),
        2.0,
        Duration.ofSeconds(60));
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
