package com.aiadvent.router.dispatch.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

/** Candidate ordering policy. An absent strategy means the complexity-adaptive default. */
public enum FallbackStrategy {
  COST_ASCENDING("cost-ascending"),
  CAPABILITY_DESCENDING("capability-descending"),
  SPECIFIC_MODELS("specific-models");

  private final String value;

  FallbackStrategy(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static FallbackStrategy from(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return Arrays.stream(values())
        .filter(strategy -> strategy.value.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown fallback strategy: " + raw));
  }
}
