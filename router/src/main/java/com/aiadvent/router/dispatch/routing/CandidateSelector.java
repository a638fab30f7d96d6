package com.aiadvent.router.dispatch.routing;

import com.aiadvent.router.dispatch.classifier.ComplexityTier;
import com.aiadvent.router.dispatch.exception.RoutingConfigurationException;
import com.aiadvent.router.dispatch.provider.CapabilityProfile;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Builds the ordered list of candidates to try for one request: filters by the request's
 * constraints, then orders per its fallback strategy. Orderings are stable, so candidates that
 * compare equal keep registration order.
 */
public class CandidateSelector {

  public List<RegisteredCandidate> select(
      List<RegisteredCandidate> registered, RequestOptions options, ComplexityTier tier) {
    RequestOptions effective = options != null ? options : RequestOptions.defaults();
    validate(effective);
    List<RegisteredCandidate> eligible = filterEligible(registered, effective);
    return order(eligible, effective, tier);
  }

  /** Fails fast on option combinations that can never be routed. */
  public void validate(RequestOptions options) {
    if (options.fallbackStrategy() == FallbackStrategy.SPECIFIC_MODELS
        && options.fallbackModels().isEmpty()) {
      throw new RoutingConfigurationException(
          "Fallback models must be specified when using specific-models strategy");
    }
  }

  public boolean requiresTier(RequestOptions options) {
    FallbackStrategy strategy = options != null ? options.fallbackStrategy() : null;
    return strategy == null || strategy == FallbackStrategy.CAPABILITY_DESCENDING;
  }

  List<RegisteredCandidate> filterEligible(
      List<RegisteredCandidate> registered, RequestOptions options) {
    List<RegisteredCandidate> eligible = new ArrayList<>();
    for (RegisteredCandidate candidate : registered) {
      CapabilityProfile profile = candidate.profile();
      if (options.preferredProvider() != null
          && !options.preferredProvider().equals(profile.providerName())) {
        continue;
      }
      if (options.preferredModel() != null
          && !options.preferredModel().equals(profile.modelName())) {
        continue;
      }
      if (!meetsMinimums(profile, options.minCapability())) {
        continue;
      }
      if (options.maxCost() != null && profile.referenceCost() > options.maxCost()) {
        continue;
      }
      eligible.add(candidate);
    }
    return eligible;
  }

  List<RegisteredCandidate> order(
      List<RegisteredCandidate> eligible, RequestOptions options, ComplexityTier tier) {
    FallbackStrategy strategy = options.fallbackStrategy();
    if (strategy == null) {
      return sortedDescending(eligible, profile -> adaptiveScore(profile, tier));
    }
    switch (strategy) {
      case COST_ASCENDING:
        List<RegisteredCandidate> byCost = new ArrayList<>(eligible);
        byCost.sort(Comparator.comparingDouble(candidate -> candidate.profile().unitCostSum()));
        return byCost;
      case CAPABILITY_DESCENDING:
        String capability = focusCapability(tier);
        return sortedDescending(eligible, profile -> profile.capability(capability));
      case SPECIFIC_MODELS:
        return inRequestedOrder(eligible, options.fallbackModels());
      default:
        throw new IllegalStateException("Unsupported fallback strategy: " + strategy);
    }
  }

  static String focusCapability(ComplexityTier tier) {
    if (tier == null) {
      return CapabilityProfile.KNOWLEDGE;
    }
    switch (tier) {
      case SIMPLE:
        return CapabilityProfile.SPEED;
      case COMPLEX:
        return CapabilityProfile.REASONING;
      case MODERATE:
      default:
        return CapabilityProfile.KNOWLEDGE;
    }
  }

  /**
   * SIMPLE rewards speed discounted by the cost of the reference volume, MODERATE averages
   * knowledge and reasoning, COMPLEX uses reasoning alone.
   */
  static double adaptiveScore(CapabilityProfile profile, ComplexityTier tier) {
    ComplexityTier effectiveTier = tier != null ? tier : ComplexityTier.MODERATE;
    switch (effectiveTier) {
      case SIMPLE:
        return profile.capability(CapabilityProfile.SPEED) / (1.0 + profile.referenceCost());
      case COMPLEX:
        return profile.capability(CapabilityProfile.REASONING);
      case MODERATE:
      default:
        return (profile.capability(CapabilityProfile.KNOWLEDGE)
                + profile.capability(CapabilityProfile.REASONING))
            / 2.0;
    }
  }

  private List<RegisteredCandidate> sortedDescending(
      List<RegisteredCandidate> eligible, ToDoubleFunction<CapabilityProfile> score) {
    List<RegisteredCandidate> sorted = new ArrayList<>(eligible);
    sorted.sort(
        Comparator.comparingDouble(
                (RegisteredCandidate candidate) -> score.applyAsDouble(candidate.profile()))
            .reversed());
    return sorted;
  }

  private List<RegisteredCandidate> inRequestedOrder(
      List<RegisteredCandidate> eligible, List<String> requestedKeys) {
    Set<String> seen = new LinkedHashSet<>();
    List<RegisteredCandidate> ordered = new ArrayList<>();
    for (String key : requestedKeys) {
      if (!seen.add(key)) {
        continue;
      }
      eligible.stream()
          .filter(candidate -> candidate.key().equals(key))
          .findFirst()
          .ifPresent(ordered::add);
    }
    return ordered;
  }

  private boolean meetsMinimums(CapabilityProfile profile, Map<String, Double> minimums) {
    for (Map.Entry<String, Double> minimum : minimums.entrySet()) {
      if (minimum.getValue() != null && profile.capability(minimum.getKey()) < minimum.getValue()) {
        return false;
      }
    }
    return true;
  }
}
