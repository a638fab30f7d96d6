package com.aiadvent.router.dispatch.health;

import com.aiadvent.router.dispatch.cache.ResultCache;
import com.aiadvent.router.dispatch.routing.CandidateRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reported as the {@code dispatch} health component. */
@Component("dispatch")
public class DispatchHealthIndicator implements HealthIndicator {

  private final CandidateRegistry registry;
  private final ResultCache resultCache;

  public DispatchHealthIndicator(CandidateRegistry registry, ResultCache resultCache) {
    this.registry = registry;
    this.resultCache = resultCache;
  }

  @Override
  public Health health() {
    int candidateCount = registry.size();
    Health.Builder builder =
        candidateCount > 0
            ? Health.up()
            : Health.outOfService().withDetail("status", "no-candidates");
    return builder
        .withDetail("candidateCount", candidateCount)
        .withDetail("exactCacheEntries", resultCache.exactSize())
        .withDetail("semanticCacheEntries", resultCache.semanticSize())
        .build();
  }
}
