package com.aiadvent.router.dispatch.execution;

import java.time.Duration;
import org.springframework.util.Assert;

public record ExecutionSettings(
    Duration minInterval,
    Duration timeout,
    int maxRetries,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff) {

  public ExecutionSettings {
    minInterval = minInterval != null ? minInterval : Duration.ZERO;
    timeout = timeout != null ? timeout : Duration.ofSeconds(30);
    initialBackoff = initialBackoff != null ? initialBackoff : Duration.ZERO;
    maxBackoff = maxBackoff != null ? maxBackoff : Duration.ofSeconds(60);
    Assert.isTrue(!minInterval.isNegative(), "minInterval must not be negative");
    Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
    Assert.isTrue(maxRetries >= 0, "maxRetries must not be negative");
    Assert.isTrue(!initialBackoff.isNegative(), "initialBackoff must not be negative");
    Assert.isTrue(backoffMultiplier >= 1.0, "backoffMultiplier must be at least 1.0");
  }

  public static ExecutionSettings defaults() {
    return new ExecutionSettings(
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        3,
        Duration.ofSeconds(2),
        2.0,
        Duration.ofSeconds(60));
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }
}
