package com.aiadvent.router.dispatch.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.router.dispatch.config.RouterProperties;
import com.aiadvent.router.dispatch.exception.ProviderException;
import com.aiadvent.router.dispatch.exception.RateLimitedException;
import com.aiadvent.router.dispatch.provider.model.UsageSource;
import com.aiadvent.router.dispatch.routing.RequestOptions;
import com.aiadvent.router.dispatch.token.TokenEstimator;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatOptions;

class OpenAiCapabilityProviderTest {

  private ChatModel chatModel;
  private EmbeddingModel embeddingModel;
  private TokenEstimator tokenEstimator;
  private RouterProperties.Provider providerConfig;
  private OpenAiCapabilityProvider provider;

  @BeforeEach
  void setUp() {
    chatModel = mock(ChatModel.class);
    embeddingModel = mock(EmbeddingModel.class);
    tokenEstimator = mock(TokenEstimator.class);
    providerConfig = new RouterProperties.Provider();
    providerConfig.setTemperature(0.7);
    providerConfig.setMaxTokens(512);
    providerConfig.setTokenizer("cl100k_base");
    provider =
        new OpenAiCapabilityProvider(
            "openai", "gpt-4o-mini", providerConfig, chatModel, embeddingModel, tokenEstimator);
  }

  @Test
  void usesReportedUsageWhenAvailable() {
    when(chatModel.call(any(Prompt.class)))
        .thenReturn(
            response(
                "Paris",
                ChatResponseMetadata.builder()
                    .id("chatcmpl-1")
                    .model("gpt-4o-mini-2024-07-18")
                    .usage(new DefaultUsage(12, 3))
                    .build()));

    CompletionResponse response = provider.generateCompletion("Capital of France?", null);

    assertThat(response.text()).isEqualTo("Paris");
    assertThat(response.provider()).isEqualTo("openai");
    assertThat(response.model()).isEqualTo("gpt-4o-mini-2024-07-18");
    assertThat(response.usage().promptTokens()).isEqualTo(12);
    assertThat(response.usage().completionTokens()).isEqualTo(3);
    assertThat(response.usage().totalTokens()).isEqualTo(15);
    assertThat(response.usage().source()).isEqualTo(UsageSource.NATIVE);
    assertThat(response.metadata()).containsEntry("id", "chatcmpl-1").containsEntry("finishReason", "STOP");
  }

  @Test
  void estimatesUsageWhenBackendReportsNone() {
    when(chatModel.call(any(Prompt.class)))
        .thenReturn(response("Paris", ChatResponseMetadata.builder().build()));
    when(tokenEstimator.estimate("cl100k_base", "Capital of France?")).thenReturn(5);
    when(tokenEstimator.estimate("cl100k_base", "Paris")).thenReturn(1);

    CompletionResponse response = provider.generateCompletion("Capital of France?", null);

    assertThat(response.model()).isEqualTo("gpt-4o-mini");
    assertThat(response.usage().promptTokens()).isEqualTo(5);
    assertThat(response.usage().completionTokens()).isEqualTo(1);
    assertThat(response.usage().source()).isEqualTo(UsageSource.FALLBACK);
  }

  @Test
  void requestOptionsOverrideProviderDefaults() {
    when(chatModel.call(any(Prompt.class)))
        .thenReturn(response("ok", ChatResponseMetadata.builder().build()));

    provider.generateCompletion(
        "Say ok", RequestOptions.builder().temperature(0.1).topP(0.9).build());

    ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
    verify(chatModel).call(captor.capture());
    OpenAiChatOptions options = (OpenAiChatOptions) captor.getValue().getOptions();
    assertThat(options.getModel()).isEqualTo("gpt-4o-mini");
    assertThat(options.getTemperature()).isEqualTo(0.1);
    assertThat(options.getTopP()).isEqualTo(0.9);
    assertThat(options.getMaxTokens()).isEqualTo(512);
  }

  @Test
  void backendFailuresAreAttributedToTheCandidate() {
    when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> provider.generateCompletion("hi", null))
        .isInstanceOfSatisfying(
            ProviderException.class,
            ex -> assertThat(ex.candidateKey()).isEqualTo("openai:gpt-4o-mini"))
        .hasMessageContaining("connection reset");
  }

  @Test
  void rateLimitSignalPassesThroughUnchanged() {
    RateLimitedException rateLimited =
        new RateLimitedException("openai:gpt-4o-mini", "slow down", Duration.ofSeconds(3));
    when(chatModel.call(any(Prompt.class))).thenThrow(rateLimited);

    assertThatThrownBy(() -> provider.generateCompletion("hi", null)).isSameAs(rateLimited);
  }

  @Test
  void emptyCompletionIsAFailure() {
    when(chatModel.call(any(Prompt.class)))
        .thenReturn(response("", ChatResponseMetadata.builder().build()));

    assertThatThrownBy(() -> provider.generateCompletion("hi", null))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("empty completion");
  }

  @Test
  void embeddingsComeFromTheEmbeddingModel() {
    when(embeddingModel.embed(eq("hello"))).thenReturn(new float[] {0.1f, 0.2f});

    assertThat(provider.generateEmbedding("hello")).containsExactly(0.1f, 0.2f);
  }

  @Test
  void embeddingsFailWithoutEmbeddingModel() {
    OpenAiCapabilityProvider withoutEmbeddings =
        new OpenAiCapabilityProvider(
            "openai", "gpt-4o-mini", providerConfig, chatModel, null, tokenEstimator);

    assertThatThrownBy(() -> withoutEmbeddings.generateEmbedding("hello"))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("not configured");
  }

  @Test
  void unitEstimatesUseConfiguredTokenizer() {
    when(tokenEstimator.estimate("cl100k_base", "some text")).thenReturn(2);

    assertThat(provider.estimateUnits("some text")).isEqualTo(2);
  }

  private static ChatResponse response(String text, ChatResponseMetadata metadata) {
    Generation generation =
        new Generation(
            new AssistantMessage(text), ChatGenerationMetadata.builder().finishReason("STOP").build());
    return new ChatResponse(List.of(generation), metadata);
  }
}
