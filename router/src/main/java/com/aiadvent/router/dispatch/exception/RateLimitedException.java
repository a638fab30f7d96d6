package com.aiadvent.router.dispatch.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Explicit rate-limit signal from a backend. When the backend suggested a delay it takes precedence
 * over the computed backoff of the next retry.
 */
public class RateLimitedException extends ProviderException {

  private final Duration retryAfter;

  public RateLimitedException(String candidateKey, String message, Duration retryAfter) {
    super(candidateKey, message);
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
