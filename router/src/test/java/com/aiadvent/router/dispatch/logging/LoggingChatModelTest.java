package com.aiadvent.router.dispatch.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

class LoggingChatModelTest {

  private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingChatModel.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private Level previousLevel;
  private ChatModel delegate;

  @BeforeEach
  void setUp() {
    delegate = mock(ChatModel.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
  }

  @Test
  void logsPromptUsageAndCompletionForCandidate() {
    ChatResponse reply =
        new ChatResponse(
            List.of(new Generation(new AssistantMessage("Paris"))),
            ChatResponseMetadata.builder().usage(new DefaultUsage(12, 3)).build());
    when(delegate.call(any(Prompt.class))).thenReturn(reply);
    LoggingChatModel model = new LoggingChatModel("openai:gpt-4o", delegate, true);

    ChatResponse response = model.call(new Prompt("Capital of France?"));

    assertThat(response).isSameAs(reply);
    assertThat(appender.list)
        .extracting(ILoggingEvent::getFormattedMessage)
        .anySatisfy(
            message ->
                assertThat(message).contains("[openai:gpt-4o]").contains("Capital of France?"))
        .anySatisfy(message -> assertThat(message).contains("prompt=12").contains("completion=3"))
        .anySatisfy(message -> assertThat(message).contains("completion:").contains("Paris"));
  }

  @Test
  void completionIsNotLoggedUnlessRequested() {
    when(delegate.call(any(Prompt.class)))
        .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("secret")))));
    LoggingChatModel model = new LoggingChatModel("openai:gpt-4o", delegate, false);

    model.call(new Prompt("Tell me"));

    assertThat(appender.list)
        .extracting(ILoggingEvent::getFormattedMessage)
        .noneSatisfy(message -> assertThat(message).contains("secret"));
  }

  @Test
  void backendFailurePropagatesUnchanged() {
    IllegalStateException failure = new IllegalStateException("connection reset");
    when(delegate.call(any(Prompt.class))).thenThrow(failure);
    LoggingChatModel model = new LoggingChatModel("deepseek:deepseek-chat", delegate, false);

    assertThatThrownBy(() -> model.call(new Prompt("Hello"))).isSameAs(failure);
    assertThat(appender.list)
        .extracting(ILoggingEvent::getFormattedMessage)
        .anySatisfy(
            message -> assertThat(message).contains("call failed").contains("connection reset"));
  }
}
