package com.aiadvent.router.dispatch.cache;

import com.aiadvent.router.dispatch.provider.CompletionResponse;
import java.time.Instant;

/** Immutable cached result. {@code embedding} is {@code null} when none could be obtained. */
public record CacheEntry(
    String fingerprint,
    String text,
    float[] embedding,
    CompletionResponse response,
    Instant createdAt,
    Instant expiresAt) {

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }
}
