package com.aiadvent.router.dispatch.exception;

/** A backend call failed. Always attributed to the candidate identified by {@link #candidateKey()}. */
public class ProviderException extends DispatchException {

  private final String candidateKey;

  public ProviderException(String candidateKey, String message) {
    super(message);
    this.candidateKey = candidateKey;
  }

  public ProviderException(String candidateKey, String message, Throwable cause) {
    super(message, cause);
    this.candidateKey = candidateKey;
  }

  public String candidateKey() {
    return candidateKey;
  }
}
