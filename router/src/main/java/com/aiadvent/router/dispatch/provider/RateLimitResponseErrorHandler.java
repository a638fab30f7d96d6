package com.aiadvent.router.dispatch.provider;

import com.aiadvent.router.dispatch.exception.ProviderException;
import com.aiadvent.router.dispatch.exception.RateLimitedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResponseErrorHandler;

/**
 * Translates non-2xx backend responses into dispatch exceptions. HTTP 429 becomes a
 * {@link RateLimitedException} carrying the {@code Retry-After} delay when one was sent.
 */
public class RateLimitResponseErrorHandler implements ResponseErrorHandler {

  private static final int MAX_BODY_LENGTH = 512;

  private final String candidateKey;

  public RateLimitResponseErrorHandler(String candidateKey) {
    this.candidateKey = candidateKey;
  }

  @Override
  public boolean hasError(ClientHttpResponse response) throws IOException {
    return response.getStatusCode().isError();
  }

  @Override
  public void handleError(ClientHttpResponse response) throws IOException {
    HttpStatusCode status = response.getStatusCode();
    String body = readBody(response);
    if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
      Duration retryAfter = parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
      throw new RateLimitedException(
          candidateKey, "Rate limited by backend '" + candidateKey + "': " + body, retryAfter);
    }
    throw new ProviderException(
        candidateKey,
        "Backend '" + candidateKey + "' responded with " + status.value() + ": " + body);
  }

  static Duration parseRetryAfter(String header) {
    if (!StringUtils.hasText(header)) {
      return null;
    }
    try {
      long seconds = Long.parseLong(header.trim());
      return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException ex) {
      // HTTP-date form is not honoured; the computed backoff applies instead
      return null;
    }
  }

  private String readBody(ClientHttpResponse response) {
    try {
      String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
      if (!StringUtils.hasText(body)) {
        return "<empty body>";
      }
      return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) + "..." : body;
    } catch (IOException ex) {
      return "<unreadable body>";
    }
  }
}
