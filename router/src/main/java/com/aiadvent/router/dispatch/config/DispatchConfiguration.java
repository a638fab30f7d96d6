package com.aiadvent.router.dispatch.config;

import com.aiadvent.router.dispatch.cache.ResultCache;
import com.aiadvent.router.dispatch.classifier.ComplexityClassifier;
import com.aiadvent.router.dispatch.routing.CandidateRegistry;
import com.aiadvent.router.dispatch.routing.CandidateSelector;
import com.aiadvent.router.dispatch.service.DispatchMetrics;
import com.aiadvent.router.dispatch.service.DispatchService;
import com.aiadvent.router.dispatch.service.ResultCacheSweeper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(RouterProperties.class)
public class DispatchConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ComplexityClassifier complexityClassifier() {
    return new ComplexityClassifier();
  }

  @Bean
  public CandidateSelector candidateSelector() {
    return new CandidateSelector();
  }

  @Bean
  public DispatchMetrics dispatchMetrics(MeterRegistry meterRegistry) {
    return new DispatchMetrics(meterRegistry);
  }

  @Bean
  public ResultCache resultCache(RouterProperties properties, Clock clock) {
    RouterProperties.Cache cache = properties.getCache();
    return new ResultCache(
        cache.getTtl(), cache.getSimilarityThreshold(), cache.getMaximumSize(), clock);
  }

  @Bean
  public ResultCacheSweeper resultCacheSweeper(
      ResultCache resultCache,
      ObjectProvider<TaskScheduler> taskScheduler,
      RouterProperties properties,
      DispatchMetrics metrics) {
    return new ResultCacheSweeper(
        resultCache,
        taskScheduler.getIfAvailable(),
        properties.getCache().getSweepInterval(),
        metrics);
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  public DispatchService dispatchService(
      CandidateRegistry candidateRegistry,
      CandidateSelector candidateSelector,
      ComplexityClassifier complexityClassifier,
      ResultCache resultCache,
      ResultCacheSweeper resultCacheSweeper,
      DispatchMetrics dispatchMetrics,
      RouterProperties properties) {
    RouterProperties.Cache cache = properties.getCache();
    return new DispatchService(
        candidateRegistry,
        candidateSelector,
        complexityClassifier,
        resultCache,
        resultCacheSweeper,
        dispatchMetrics,
        cache.isEnabled(),
        cache.isSemanticEnabled(),
        cache.getEmbeddingCandidate());
  }
}
