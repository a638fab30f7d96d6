package com.aiadvent.router.dispatch.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Assigns a {@link ComplexityTier} to request text. Pattern rules are evaluated in declaration
 * order and the first matching rule wins; texts matching no rule are classified by word count.
 */
public class ComplexityClassifier {

  static final int SIMPLE_MAX_WORDS = 50;
  static final int MODERATE_MAX_WORDS = 150;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final List<Rule> RULES =
      List.of(
          new Rule(
              ComplexityTier.SIMPLE,
              patterns(
                  "what is|who is|when|where|can you|could you",
                  "hello|hi there|good morning|help me",
                  "simple|basic|quick|short")),
          new Rule(
              ComplexityTier.MODERATE,
              patterns(
                  "explain|describe|compare|contrast|summarize",
                  "how to|how do I|steps to|process of",
                  "analyze the|provide feedback|what are the implications")),
          new Rule(
              ComplexityTier.COMPLEX,
              patterns(
                  "design a|create a comprehensive|develop a strategy",
                  "ethical implications|philosophical|theoretical|conceptual",
                  "critique|evaluate the merits|assess the validity",
                  "research|investigate|deep dive",
                  "complex|complicated|advanced|sophisticated")));

  public ComplexityTier classify(String text) {
    String value = text != null ? text : "";
    for (Rule rule : RULES) {
      if (rule.matches(value)) {
        return rule.tier();
      }
    }
    int words = countWords(value);
    if (words <= SIMPLE_MAX_WORDS) {
      return ComplexityTier.SIMPLE;
    }
    if (words <= MODERATE_MAX_WORDS) {
      return ComplexityTier.MODERATE;
    }
    return ComplexityTier.COMPLEX;
  }

  static int countWords(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return 0;
    }
    return WHITESPACE.split(trimmed).length;
  }

  private static List<Pattern> patterns(String... expressions) {
    return Arrays.stream(expressions)
        .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE))
        .toList();
  }

  private record Rule(ComplexityTier tier, List<Pattern> patterns) {

    boolean matches(String text) {
      for (Pattern pattern : patterns) {
        if (pattern.matcher(text).find()) {
          return true;
        }
      }
      return false;
    }
  }
}
