package com.aiadvent.router.dispatch.token;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.ModelType;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * jtokkit-backed estimator. Falls back to strict counting when ordinary counting fails and to a
 * characters/4 approximation when no encoding can count the text.
 */
public class DefaultTokenEstimator implements TokenEstimator {

  private static final Logger log = LoggerFactory.getLogger(DefaultTokenEstimator.class);
  private static final int CHARS_PER_TOKEN = 4;

  private final EncodingRegistry encodingRegistry;
  private final String defaultTokenizer;
  private final Map<String, Optional<Encoding>> encodings = new ConcurrentHashMap<>();

  public DefaultTokenEstimator(EncodingRegistry encodingRegistry, String defaultTokenizer) {
    this.encodingRegistry = encodingRegistry;
    this.defaultTokenizer = StringUtils.hasText(defaultTokenizer) ? defaultTokenizer : "cl100k_base";
  }

  @Override
  public int estimate(String tokenizer, String text) {
    if (!StringUtils.hasText(text)) {
      return 0;
    }
    String tokenizerName = StringUtils.hasText(tokenizer) ? tokenizer.trim() : defaultTokenizer;
    Optional<Encoding> encoding = encodings.computeIfAbsent(tokenizerName, this::resolveEncoding);
    if (encoding.isEmpty()) {
      return approximate(text);
    }
    try {
      return encoding.get().countTokensOrdinary(text);
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to strict token counting due to {}", ordinaryFailure.getMessage());
      try {
        return encoding.get().countTokens(text);
      } catch (RuntimeException strictFailure) {
        log.warn("Failed to count tokens via tokenizer {}, approximating", tokenizerName, strictFailure);
        return approximate(text);
      }
    }
  }

  static int approximate(String text) {
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  private Optional<Encoding> resolveEncoding(String tokenizerName) {
    Optional<Encoding> byModelName = encodingRegistry.getEncodingForModel(tokenizerName);
    if (byModelName.isPresent()) {
      return byModelName;
    }
    Optional<Encoding> byModelType =
        ModelType.fromName(tokenizerName).map(encodingRegistry::getEncodingForModel);
    if (byModelType.isPresent()) {
      return byModelType;
    }
    Optional<Encoding> byEncodingType =
        EncodingType.fromName(tokenizerName).map(encodingRegistry::getEncoding);
    if (byEncodingType.isPresent()) {
      return byEncodingType;
    }
    Optional<Encoding> byName = encodingRegistry.getEncoding(tokenizerName);
    if (byName.isEmpty()) {
      log.warn("Unknown tokenizer '{}', token counts will be approximated", tokenizerName);
    }
    return byName;
  }
}
