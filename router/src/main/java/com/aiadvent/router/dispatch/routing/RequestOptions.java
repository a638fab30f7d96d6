package com.aiadvent.router.dispatch.routing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Per-call dispatch configuration. Every field is optional; {@code temperature}, {@code topP} and
 * {@code maxTokens} are passed through to the backend untouched.
 */
public record RequestOptions(
    String preferredProvider,
    String preferredModel,
    Map<String, Double> minCapability,
    Double maxCost,
    FallbackStrategy fallbackStrategy,
    List<String> fallbackModels,
    Boolean cacheResults,
    Long timeoutMs,
    Double temperature,
    Double topP,
    Integer maxTokens) {

  private static final RequestOptions DEFAULTS = builder().build();

  public RequestOptions {
    preferredProvider = StringUtils.hasText(preferredProvider) ? preferredProvider.trim() : null;
    preferredModel = StringUtils.hasText(preferredModel) ? preferredModel.trim() : null;
    minCapability =
        minCapability == null || minCapability.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(minCapability));
    fallbackModels =
        fallbackModels == null
            ? List.of()
            : fallbackModels.stream().filter(StringUtils::hasText).map(String::trim).toList();
  }

  public static RequestOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean cachingEnabled() {
    return !Boolean.FALSE.equals(cacheResults);
  }

  public Optional<Duration> timeout() {
    return timeoutMs != null && timeoutMs > 0
        ? Optional.of(Duration.ofMillis(timeoutMs))
        : Optional.empty();
  }

  public boolean hasPreference() {
    return preferredProvider != null || preferredModel != null;
  }

  public static final class Builder {

    private String preferredProvider;
    private String preferredModel;
    private final Map<String, Double> minCapability = new LinkedHashMap<>();
    private Double maxCost;
    private FallbackStrategy fallbackStrategy;
    private final List<String> fallbackModels = new ArrayList<>();
    private Boolean cacheResults;
    private Long timeoutMs;
    private Double temperature;
    private Double topP;
    private Integer maxTokens;

    private Builder() {}

    public Builder preferredProvider(String preferredProvider) {
      this.preferredProvider = preferredProvider;
      return this;
    }

    public Builder preferredModel(String preferredModel) {
      this.preferredModel = preferredModel;
      return this;
    }

    public Builder minCapability(String capability, double minimum) {
      this.minCapability.put(Objects.requireNonNull(capability, "capability"), minimum);
      return this;
    }

    public Builder maxCost(Double maxCost) {
      this.maxCost = maxCost;
      return this;
    }

    public Builder fallbackStrategy(FallbackStrategy fallbackStrategy) {
      this.fallbackStrategy = fallbackStrategy;
      return this;
    }

    public Builder fallbackModels(List<String> fallbackModels) {
      this.fallbackModels.clear();
      if (fallbackModels != null) {
        this.fallbackModels.addAll(fallbackModels);
      }
      return this;
    }

    public Builder cacheResults(Boolean cacheResults) {
      this.cacheResults = cacheResults;
      return this;
    }

    public Builder timeoutMs(Long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    public Builder temperature(Double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder topP(Double topP) {
      this.topP = topP;
      return this;
    }

    public Builder maxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
      return this;
    }

    public RequestOptions build() {
      return new RequestOptions(
          preferredProvider,
          preferredModel,
          minCapability,
          maxCost,
          fallbackStrategy,
          fallbackModels,
          cacheResults,
          timeoutMs,
          temperature,
          topP,
          maxTokens);
    }
  }
}
