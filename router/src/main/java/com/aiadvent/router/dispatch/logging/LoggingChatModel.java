package com.aiadvent.router.dispatch.logging;

import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * Wraps the chat model of one routing candidate and logs, at debug level, the prompt text it
 * receives, how long the backend took and the reported token usage. Completions are logged only
 * when {@code logCompletion} is set.
 */
public class LoggingChatModel implements ChatModel {

  private static final Logger log = LoggerFactory.getLogger(LoggingChatModel.class);

  private final String candidateKey;
  private final ChatModel delegate;
  private final boolean logCompletion;

  public LoggingChatModel(String candidateKey, ChatModel delegate, boolean logCompletion) {
    this.candidateKey = candidateKey;
    this.delegate = delegate;
    this.logCompletion = logCompletion;
  }

  public String candidateKey() {
    return candidateKey;
  }

  public ChatModel delegate() {
    return delegate;
  }

  @Override
  public ChatResponse call(Prompt prompt) {
    if (!log.isDebugEnabled()) {
      return delegate.call(prompt);
    }
    log.debug("[{}] prompt ({} chars):\n{}", candidateKey, length(prompt), contents(prompt));
    long startedAt = System.nanoTime();
    ChatResponse response;
    try {
      response = delegate.call(prompt);
    } catch (RuntimeException ex) {
      log.debug(
          "[{}] call failed after {} ms: {}",
          candidateKey,
          elapsedMillis(startedAt),
          ex.getMessage());
      throw ex;
    }
    Usage usage =
        response != null && response.getMetadata() != null ? response.getMetadata().getUsage() : null;
    log.debug(
        "[{}] answered in {} ms, tokens prompt={} completion={}",
        candidateKey,
        elapsedMillis(startedAt),
        usage != null ? usage.getPromptTokens() : null,
        usage != null ? usage.getCompletionTokens() : null);
    if (logCompletion) {
      Generation generation = response != null ? response.getResult() : null;
      if (generation != null && generation.getOutput() != null) {
        log.debug("[{}] completion:\n{}", candidateKey, generation.getOutput().getText());
      }
    }
    return response;
  }

  @Override
  public Flux<ChatResponse> stream(Prompt prompt) {
    return delegate.stream(prompt);
  }

  @Override
  public ChatOptions getDefaultOptions() {
    return delegate.getDefaultOptions();
  }

  private static String contents(Prompt prompt) {
    return prompt != null ? prompt.getContents() : "";
  }

  private static int length(Prompt prompt) {
    return contents(prompt).length();
  }

  private static long elapsedMillis(long startedAt) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
  }
}
