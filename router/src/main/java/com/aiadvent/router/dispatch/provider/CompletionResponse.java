package com.aiadvent.router.dispatch.provider;

import com.aiadvent.router.dispatch.provider.model.CompletionUsage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CompletionResponse(
    String text,
    String provider,
    String model,
    CompletionUsage usage,
    Double estimatedCost,
    Map<String, Object> metadata) {

  public CompletionResponse {
    usage = usage != null ? usage : CompletionUsage.empty();
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static CompletionResponse of(String text, String provider, String model) {
    return new CompletionResponse(text, provider, model, CompletionUsage.empty(), null, Map.of());
  }

  public CompletionResponse withEstimatedCost(Double cost) {
    return new CompletionResponse(text, provider, model, usage, cost, metadata);
  }
}
