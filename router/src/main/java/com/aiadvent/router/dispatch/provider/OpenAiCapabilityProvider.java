package com.aiadvent.router.dispatch.provider;

import com.aiadvent.router.dispatch.config.RouterProperties;
import com.aiadvent.router.dispatch.exception.ProviderException;
import com.aiadvent.router.dispatch.provider.model.CompletionUsage;
import com.aiadvent.router.dispatch.provider.model.UsageSource;
import com.aiadvent.router.dispatch.routing.RequestOptions;
import com.aiadvent.router.dispatch.token.TokenEstimator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Capability provider for one model served over an OpenAI-compatible API through Spring AI. The
 * chat and embedding models must not retry on their own; retry belongs to the executor wrapping
 * every call.
 */
public class OpenAiCapabilityProvider implements CapabilityProvider {

  private final String providerId;
  private final String modelId;
  private final RouterProperties.Provider providerConfig;
  private final ChatModel chatModel;
  private final EmbeddingModel embeddingModel;
  private final TokenEstimator tokenEstimator;

  public OpenAiCapabilityProvider(
      String providerId,
      String modelId,
      RouterProperties.Provider providerConfig,
      ChatModel chatModel,
      EmbeddingModel embeddingModel,
      TokenEstimator tokenEstimator) {
    Assert.hasText(providerId, "providerId must not be blank");
    Assert.hasText(modelId, "modelId must not be blank");
    Assert.notNull(chatModel, "chatModel must not be null");
    this.providerId = providerId;
    this.modelId = modelId;
    this.providerConfig = providerConfig != null ? providerConfig : new RouterProperties.Provider();
    this.chatModel = chatModel;
    this.embeddingModel = embeddingModel;
    this.tokenEstimator = tokenEstimator;
  }

  @Override
  public CompletionResponse generateCompletion(String text, RequestOptions options) {
    if (!StringUtils.hasText(text)) {
      throw new ProviderException(key(), "Prompt must be a non-empty string");
    }
    ChatResponse response;
    try {
      response = chatModel.call(new Prompt(text, buildOptions(options)));
    } catch (ProviderException exception) {
      throw exception;
    } catch (RuntimeException exception) {
      throw new ProviderException(
          key(), "Completion via '" + key() + "' failed: " + exception.getMessage(), exception);
    }

    Generation generation = response != null ? response.getResult() : null;
    String content =
        generation != null && generation.getOutput() != null ? generation.getOutput().getText() : null;
    if (!StringUtils.hasText(content)) {
      throw new ProviderException(key(), "Backend '" + key() + "' returned an empty completion");
    }

    ChatResponseMetadata metadata = response.getMetadata();
    String respondingModel =
        metadata != null && StringUtils.hasText(metadata.getModel()) ? metadata.getModel() : modelId;
    return new CompletionResponse(
        content,
        providerId,
        respondingModel,
        resolveUsage(metadata != null ? metadata.getUsage() : null, text, content),
        null,
        describe(metadata, generation));
  }

  @Override
  public float[] generateEmbedding(String text) {
    if (embeddingModel == null) {
      throw new ProviderException(key(), "Embeddings are not configured for '" + key() + "'");
    }
    try {
      float[] embedding = embeddingModel.embed(text);
      if (embedding == null || embedding.length == 0) {
        throw new ProviderException(key(), "Backend '" + key() + "' returned an empty embedding");
      }
      return embedding;
    } catch (ProviderException exception) {
      throw exception;
    } catch (RuntimeException exception) {
      throw new ProviderException(
          key(), "Embedding via '" + key() + "' failed: " + exception.getMessage(), exception);
    }
  }

  @Override
  public boolean supportsEmbeddings() {
    return embeddingModel != null;
  }

  @Override
  public int estimateUnits(String text) {
    if (tokenEstimator == null) {
      return text != null ? (text.length() + 3) / 4 : 0;
    }
    return tokenEstimator.estimate(providerConfig.getTokenizer(), text);
  }

  public ChatModel chatModel() {
    return chatModel;
  }

  private String key() {
    return CapabilityProfile.key(providerId, modelId);
  }

  private OpenAiChatOptions buildOptions(RequestOptions options) {
    RequestOptions effective = options != null ? options : RequestOptions.defaults();
    OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder().model(modelId);

    Double temperature =
        effective.temperature() != null ? effective.temperature() : providerConfig.getTemperature();
    if (temperature != null) {
      builder.temperature(temperature);
    }
    Double topP = effective.topP() != null ? effective.topP() : providerConfig.getTopP();
    if (topP != null) {
      builder.topP(topP);
    }
    Integer maxTokens =
        effective.maxTokens() != null ? effective.maxTokens() : providerConfig.getMaxTokens();
    if (maxTokens != null) {
      builder.maxTokens(maxTokens);
    }
    return builder.build();
  }

  private CompletionUsage resolveUsage(Usage usage, String prompt, String completion) {
    Integer promptTokens = usage != null ? toInteger(usage.getPromptTokens()) : null;
    Integer completionTokens = usage != null ? toInteger(usage.getCompletionTokens()) : null;
    Integer totalTokens = usage != null ? toInteger(usage.getTotalTokens()) : null;
    boolean nativeAvailable =
        (promptTokens != null && promptTokens > 0)
            || (completionTokens != null && completionTokens > 0);
    if (nativeAvailable) {
      return new CompletionUsage(
          promptTokens != null ? promptTokens : 0,
          completionTokens != null ? completionTokens : 0,
          totalTokens != null ? totalTokens : 0,
          UsageSource.NATIVE);
    }
    int estimatedPrompt = estimateUnits(prompt);
    int estimatedCompletion = estimateUnits(completion);
    return new CompletionUsage(
        estimatedPrompt,
        estimatedCompletion,
        estimatedPrompt + estimatedCompletion,
        UsageSource.FALLBACK);
  }

  private Map<String, Object> describe(ChatResponseMetadata metadata, Generation generation) {
    Map<String, Object> details = new LinkedHashMap<>();
    if (metadata != null && StringUtils.hasText(metadata.getId())) {
      details.put("id", metadata.getId());
    }
    if (generation != null
        && generation.getMetadata() != null
        && StringUtils.hasText(generation.getMetadata().getFinishReason())) {
      details.put("finishReason", generation.getMetadata().getFinishReason());
    }
    return details;
  }

  private Integer toInteger(Number value) {
    if (value == null) {
      return null;
    }
    return Math.toIntExact(value.longValue());
  }
}
