package com.aiadvent.router.dispatch.config;

import com.aiadvent.router.dispatch.execution.ExecutionSettings;
import com.aiadvent.router.dispatch.execution.ResilientExecutor;
import com.aiadvent.router.dispatch.logging.LoggingChatModel;
import com.aiadvent.router.dispatch.provider.CapabilityProfile;
import com.aiadvent.router.dispatch.provider.OpenAiCapabilityProvider;
import com.aiadvent.router.dispatch.provider.RateLimitResponseErrorHandler;
import com.aiadvent.router.dispatch.routing.CandidateRegistry;
import com.aiadvent.router.dispatch.routing.RegisteredCandidate;
import com.aiadvent.router.dispatch.token.TokenEstimator;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;

/**
 * Builds one candidate per configured (provider, model) pair. Spring AI clients are created with a
 * single-attempt retry template and a rate-limit aware error handler so that pacing, retry and
 * timeouts are owned by each candidate's {@link ResilientExecutor}.
 */
@Slf4j
@Configuration
public class CandidateConfiguration {

  static final String ATTEMPT_EXECUTOR = "routerAttemptExecutor";

  @Bean(name = ATTEMPT_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService routerAttemptExecutor() {
    return Executors.newCachedThreadPool(new CustomizableThreadFactory("router-attempt-"));
  }

  @Bean
  public CandidateRegistry candidateRegistry(
      RouterProperties properties,
      @Qualifier(ATTEMPT_EXECUTOR) ExecutorService attemptExecutor,
      TokenEstimator tokenEstimator) {
    ExecutionSettings settings = properties.getExecution().toSettings();
    CandidateRegistry registry =
        new CandidateRegistry(key -> new ResilientExecutor(key, settings, attemptExecutor));

    properties
        .getProviders()
        .forEach(
            (providerId, providerConfig) ->
                registerProvider(registry, providerId, providerConfig, properties, tokenEstimator));

    if (registry.isEmpty()) {
      log.warn("No routing candidates registered; every request will fail until one is configured");
    } else {
      log.info(
          "Registered {} routing candidates: {}",
          registry.size(),
          registry.candidates().stream().map(RegisteredCandidate::key).toList());
    }
    return registry;
  }

  private void registerProvider(
      CandidateRegistry registry,
      String providerId,
      RouterProperties.Provider providerConfig,
      RouterProperties properties,
      TokenEstimator tokenEstimator) {
    if (providerConfig.getType() != ProviderType.OPENAI) {
      throw new IllegalStateException(
          "Unsupported provider type for '" + providerId + "': " + providerConfig.getType());
    }
    if (!StringUtils.hasText(providerConfig.getApiKey())) {
      log.warn("Provider '{}' has no API key configured, skipping its models", providerId);
      return;
    }
    if (providerConfig.getModels().isEmpty()) {
      log.warn("Provider '{}' declares no models", providerId);
      return;
    }

    RetryTemplate singleAttempt = RetryTemplate.builder().maxAttempts(1).build();
    RouterProperties.ModelLogging modelLogging = properties.getLogging().getModel();

    for (Map.Entry<String, RouterProperties.Model> entry : providerConfig.getModels().entrySet()) {
      String modelId = entry.getKey();
      RouterProperties.Model modelConfig = entry.getValue();
      String key = CapabilityProfile.key(providerId, modelId);

      OpenAiApi openAiApi = buildApi(providerConfig, key);
      ChatModel chatModel =
          OpenAiChatModel.builder()
              .openAiApi(openAiApi)
              .defaultOptions(OpenAiChatOptions.builder().model(modelId).build())
              .retryTemplate(singleAttempt)
              .build();
      if (modelLogging.isEnabled()) {
        chatModel = new LoggingChatModel(key, chatModel, modelLogging.isLogCompletion());
      }
      EmbeddingModel embeddingModel = null;
      if (StringUtils.hasText(providerConfig.getEmbeddingModel())) {
        embeddingModel =
            new OpenAiEmbeddingModel(
                openAiApi,
                MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(providerConfig.getEmbeddingModel()).build(),
                singleAttempt);
      }

      try {
        registry.register(
            toProfile(providerId, modelId, modelConfig),
            new OpenAiCapabilityProvider(
                providerId, modelId, providerConfig, chatModel, embeddingModel, tokenEstimator));
      } catch (IllegalArgumentException ex) {
        throw new IllegalStateException(
            "Invalid configuration for candidate '" + key + "': " + ex.getMessage(), ex);
      }
    }
  }

  private OpenAiApi buildApi(RouterProperties.Provider providerConfig, String candidateKey) {
    OpenAiApi.Builder builder =
        OpenAiApi.builder()
            .apiKey(providerConfig.getApiKey())
            .responseErrorHandler(new RateLimitResponseErrorHandler(candidateKey));
    if (StringUtils.hasText(providerConfig.getBaseUrl())) {
      builder.baseUrl(providerConfig.getBaseUrl());
    }
    if (StringUtils.hasText(providerConfig.getCompletionsPath())) {
      builder.completionsPath(providerConfig.getCompletionsPath());
    }
    if (StringUtils.hasText(providerConfig.getEmbeddingsPath())) {
      builder.embeddingsPath(providerConfig.getEmbeddingsPath());
    }
    return builder.build();
  }

  static CapabilityProfile toProfile(
      String providerId, String modelId, RouterProperties.Model modelConfig) {
    RouterProperties.Model model = modelConfig != null ? modelConfig : new RouterProperties.Model();
    RouterProperties.Pricing pricing =
        model.getPricing() != null ? model.getPricing() : new RouterProperties.Pricing();
    return new CapabilityProfile(
        providerId,
        modelId,
        model.getCapabilities(),
        pricing.getInputPerToken(),
        pricing.getOutputPerToken());
  }
}
