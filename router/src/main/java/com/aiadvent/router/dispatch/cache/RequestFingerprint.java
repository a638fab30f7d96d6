package com.aiadvent.router.dispatch.cache;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.util.DigestUtils;

/** Exact-cache key: digest of the request text after whitespace and case normalization. */
public final class RequestFingerprint {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private RequestFingerprint() {}

  public static String of(String text) {
    return DigestUtils.md5DigestAsHex(normalize(text).getBytes(StandardCharsets.UTF_8));
  }

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }
}
