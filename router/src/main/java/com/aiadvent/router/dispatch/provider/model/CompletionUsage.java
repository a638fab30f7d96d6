package com.aiadvent.router.dispatch.provider.model;

public record CompletionUsage(
    int promptTokens, int completionTokens, int totalTokens, UsageSource source) {

  public CompletionUsage {
    totalTokens = Math.max(totalTokens, promptTokens + completionTokens);
    source = source != null ? source : UsageSource.UNKNOWN;
  }

  public static CompletionUsage empty() {
    return new CompletionUsage(0, 0, 0, UsageSource.UNKNOWN);
  }

  public boolean hasUsage() {
    return totalTokens > 0;
  }
}
