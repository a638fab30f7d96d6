package com.aiadvent.router.dispatch.exception;

public class AllCandidatesFailedException extends DispatchException {

  private final String fingerprint;
  private final int attemptedCandidates;

  public AllCandidatesFailedException(String fingerprint, int attemptedCandidates) {
    super(
        "All candidates failed for request "
            + fingerprint
            + " ("
            + attemptedCandidates
            + " attempted)");
    this.fingerprint = fingerprint;
    this.attemptedCandidates = attemptedCandidates;
  }

  public String fingerprint() {
    return fingerprint;
  }

  public int attemptedCandidates() {
    return attemptedCandidates;
  }
}
