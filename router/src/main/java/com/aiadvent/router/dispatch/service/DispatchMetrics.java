package com.aiadvent.router.dispatch.service;

import io.micrometer.core.instrument.MeterRegistry;

public class DispatchMetrics {

  private final MeterRegistry meterRegistry;

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCacheLookup(String result) {
    meterRegistry.counter("router.cache.lookups", "result", result).increment();
  }

  public void recordCacheWrite(boolean semantic) {
    meterRegistry.counter("router.cache.writes", "semantic", Boolean.toString(semantic)).increment();
  }

  public void recordAttempt(String providerId, String modelId, String outcome) {
    meterRegistry
        .counter(
            "router.candidate.attempts", "provider", providerId, "model", modelId, "outcome", outcome)
        .increment();
  }

  public void recordRequestFailure() {
    meterRegistry.counter("router.requests.failed").increment();
  }

  public void recordSweep(int removed) {
    meterRegistry.summary("router.cache.sweep.removed").record(removed);
  }
}
