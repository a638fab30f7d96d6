package com.aiadvent.router.dispatch.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.Assert;

/**
 * Static description of one registered backend model: its capability ratings (0..10, higher is
 * better, for {@code speed} higher means faster) and its per-unit prices.
 */
public record CapabilityProfile(
    String providerName,
    String modelName,
    Map<String, Double> capabilities,
    double costPerInputUnit,
    double costPerOutputUnit) {

  public static final String SPEED = "speed";
  public static final String KNOWLEDGE = "knowledge";
  public static final String REASONING = "reasoning";
  public static final String CREATIVITY = "creativity";

  /** Unit volume used when comparing a profile against a request's cost bound. */
  public static final int REFERENCE_UNITS = 1_000;

  public CapabilityProfile {
    Assert.hasText(providerName, "providerName must not be blank");
    Assert.hasText(modelName, "modelName must not be blank");
    Assert.isTrue(costPerInputUnit >= 0, "costPerInputUnit must not be negative");
    Assert.isTrue(costPerOutputUnit >= 0, "costPerOutputUnit must not be negative");
    capabilities =
        capabilities == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
  }

  public static String key(String providerName, String modelName) {
    return providerName + ":" + modelName;
  }

  public String key() {
    return key(providerName, modelName);
  }

  /** Rating for the capability, {@code 0} when the profile does not declare it. */
  public double capability(String name) {
    Double value = capabilities.get(name);
    return value != null ? value : 0.0;
  }

  public double unitCostSum() {
    return costPerInputUnit + costPerOutputUnit;
  }

  public double referenceCost() {
    return costPerInputUnit * REFERENCE_UNITS + costPerOutputUnit * REFERENCE_UNITS;
  }

  public double estimateCost(long inputUnits, long outputUnits) {
    return costPerInputUnit * inputUnits + costPerOutputUnit * outputUnits;
  }
}
