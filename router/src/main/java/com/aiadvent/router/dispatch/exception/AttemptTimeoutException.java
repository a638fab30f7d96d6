package com.aiadvent.router.dispatch.exception;

import java.time.Duration;

/** A single attempt exceeded its deadline. Never retried. */
public class AttemptTimeoutException extends DispatchException {

  private final String candidateKey;
  private final Duration timeout;

  public AttemptTimeoutException(String candidateKey, Duration timeout) {
    super("Attempt against '" + candidateKey + "' timed out after " + timeout.toMillis() + " ms");
    this.candidateKey = candidateKey;
    this.timeout = timeout;
  }

  public String candidateKey() {
    return candidateKey;
  }

  public Duration timeout() {
    return timeout;
  }
}
