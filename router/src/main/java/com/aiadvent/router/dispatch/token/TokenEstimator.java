package com.aiadvent.router.dispatch.token;

public interface TokenEstimator {

  /**
   * @param tokenizer jtokkit model or encoding name, {@code null} for the configured default
   */
  int estimate(String tokenizer, String text);
}
