package com.aiadvent.router.dispatch.service;

import com.aiadvent.router.dispatch.cache.RequestFingerprint;
import com.aiadvent.router.dispatch.cache.ResultCache;
import com.aiadvent.router.dispatch.classifier.ComplexityClassifier;
import com.aiadvent.router.dispatch.classifier.ComplexityTier;
import com.aiadvent.router.dispatch.exception.AllCandidatesFailedException;
import com.aiadvent.router.dispatch.exception.AttemptTimeoutException;
import com.aiadvent.router.dispatch.exception.RequestValidationException;
import com.aiadvent.router.dispatch.provider.CapabilityProfile;
import com.aiadvent.router.dispatch.provider.CompletionResponse;
import com.aiadvent.router.dispatch.provider.model.CompletionUsage;
import com.aiadvent.router.dispatch.routing.CandidateRegistry;
import com.aiadvent.router.dispatch.routing.CandidateSelector;
import com.aiadvent.router.dispatch.routing.RegisteredCandidate;
import com.aiadvent.router.dispatch.routing.RequestOptions;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Dispatches one request end to end: exact then semantic cache lookup, complexity classification,
 * candidate ordering and a strictly sequential attempt loop that stops at the first success.
 * Per-candidate failures are logged and absorbed; the caller only sees validation and
 * configuration errors or a single {@link AllCandidatesFailedException}.
 */
@Slf4j
public class DispatchService {

  private final CandidateRegistry registry;
  private final CandidateSelector selector;
  private final ComplexityClassifier classifier;
  private final ResultCache resultCache;
  private final ResultCacheSweeper sweeper;
  private final DispatchMetrics metrics;
  private final boolean cacheEnabled;
  private final boolean semanticCacheEnabled;
  private final String embeddingCandidateKey;

  public DispatchService(
      CandidateRegistry registry,
      CandidateSelector selector,
      ComplexityClassifier classifier,
      ResultCache resultCache,
      ResultCacheSweeper sweeper,
      DispatchMetrics metrics,
      boolean cacheEnabled,
      boolean semanticCacheEnabled,
      String embeddingCandidateKey) {
    this.registry = registry;
    this.selector = selector;
    this.classifier = classifier;
    this.resultCache = resultCache;
    this.sweeper = sweeper;
    this.metrics = metrics;
    this.cacheEnabled = cacheEnabled;
    this.semanticCacheEnabled = semanticCacheEnabled;
    this.embeddingCandidateKey =
        StringUtils.hasText(embeddingCandidateKey) ? embeddingCandidateKey.trim() : null;
  }

  public void start() {
    if (sweeper != null) {
      sweeper.start();
    }
  }

  public void stop() {
    if (sweeper != null) {
      sweeper.stop();
    }
  }

  public CompletionResponse processRequest(String text, RequestOptions options) {
    if (!StringUtils.hasText(text)) {
      throw new RequestValidationException("Prompt must be a non-empty string");
    }
    RequestOptions effective = options != null ? options : RequestOptions.defaults();
    selector.validate(effective);

    String fingerprint = RequestFingerprint.of(text);
    boolean caching = cacheEnabled && effective.cachingEnabled();
    LookupEmbedding lookupEmbedding = null;

    if (caching) {
      Optional<CompletionResponse> exact = lookupExact(fingerprint);
      if (exact.isPresent()) {
        return exact.get();
      }
      if (semanticCacheEnabled) {
        lookupEmbedding = embedForLookup(text, effective);
        Optional<CompletionResponse> similar = lookupSimilar(fingerprint, lookupEmbedding);
        if (similar.isPresent()) {
          return similar.get();
        }
      }
      metrics.recordCacheLookup("miss");
    }

    ComplexityTier tier = selector.requiresTier(effective) ? classifier.classify(text) : null;
    List<RegisteredCandidate> ordered = selector.select(registry.candidates(), effective, tier);
    if (log.isDebugEnabled()) {
      log.debug(
          "Request {} classified as {}, candidates {}",
          fingerprint,
          tier,
          ordered.stream().map(RegisteredCandidate::key).toList());
    }

    int attempted = 0;
    for (RegisteredCandidate candidate : ordered) {
      attempted++;
      Optional<CompletionResponse> response = attempt(candidate, text, effective, fingerprint);
      if (response.isPresent()) {
        CompletionResponse priced = withEstimatedCost(response.get(), candidate, text);
        if (caching) {
          store(fingerprint, text, priced, candidate, lookupEmbedding);
        }
        return priced;
      }
    }

    metrics.recordRequestFailure();
    log.warn(
        "All candidates failed for request {} ({} of {} registered attempted)",
        fingerprint,
        attempted,
        registry.size());
    throw new AllCandidatesFailedException(fingerprint, attempted);
  }

  public CandidateRegistry registry() {
    return registry;
  }

  public ResultCache resultCache() {
    return resultCache;
  }

  private Optional<CompletionResponse> attempt(
      RegisteredCandidate candidate, String text, RequestOptions options, String fingerprint) {
    CapabilityProfile profile = candidate.profile();
    try {
      CompletionResponse response =
          candidate
              .executor()
              .execute(
                  () -> candidate.provider().generateCompletion(text, options),
                  options.timeout().orElse(null));
      if (response == null) {
        log.warn("Candidate {} returned no response for request {}", candidate.key(), fingerprint);
        metrics.recordAttempt(profile.providerName(), profile.modelName(), "failure");
        return Optional.empty();
      }
      metrics.recordAttempt(profile.providerName(), profile.modelName(), "success");
      return Optional.of(response);
    } catch (AttemptTimeoutException exception) {
      metrics.recordAttempt(profile.providerName(), profile.modelName(), "timeout");
      log.warn("Candidate {} timed out for request {}", candidate.key(), fingerprint);
    } catch (RuntimeException exception) {
      metrics.recordAttempt(profile.providerName(), profile.modelName(), "failure");
      log.warn(
          "Candidate {} failed for request {}: {}",
          candidate.key(),
          fingerprint,
          exception.getMessage());
      log.debug("Candidate {} failure detail", candidate.key(), exception);
    }
    return Optional.empty();
  }

  private Optional<CompletionResponse> lookupExact(String fingerprint) {
    try {
      Optional<CompletionResponse> cached = resultCache.get(fingerprint);
      if (cached.isPresent()) {
        metrics.recordCacheLookup("exact_hit");
        log.debug("Exact cache hit for request {}", fingerprint);
      }
      return cached;
    } catch (RuntimeException exception) {
      log.warn("Exact cache lookup failed for request {}", fingerprint, exception);
      return Optional.empty();
    }
  }

  private Optional<CompletionResponse> lookupSimilar(
      String fingerprint, LookupEmbedding lookupEmbedding) {
    if (lookupEmbedding == null || lookupEmbedding.vector() == null) {
      return Optional.empty();
    }
    try {
      Optional<CompletionResponse> cached = resultCache.findSimilar(lookupEmbedding.vector());
      if (cached.isPresent()) {
        metrics.recordCacheLookup("semantic_hit");
        log.debug("Semantic cache hit for request {}", fingerprint);
      }
      return cached;
    } catch (RuntimeException exception) {
      log.warn("Semantic cache lookup failed for request {}", fingerprint, exception);
      return Optional.empty();
    }
  }

  private LookupEmbedding embedForLookup(String text, RequestOptions options) {
    Optional<RegisteredCandidate> embedder = resolveEmbeddingCandidate(options);
    if (embedder.isEmpty() || !embedder.get().provider().supportsEmbeddings()) {
      return null;
    }
    RegisteredCandidate candidate = embedder.get();
    return new LookupEmbedding(candidate.key(), embed(candidate, text));
  }

  private Optional<RegisteredCandidate> resolveEmbeddingCandidate(RequestOptions options) {
    if (options.hasPreference()) {
      return registry.find(options.preferredProvider(), options.preferredModel());
    }
    if (embeddingCandidateKey != null) {
      return registry.find(embeddingCandidateKey);
    }
    return registry.candidates().stream().findFirst();
  }

  // single unpaced attempt; null when the backend cannot embed right now
  private float[] embed(RegisteredCandidate candidate, String text) {
    try {
      float[] vector =
          candidate.executor().executeOnce(() -> candidate.provider().generateEmbedding(text));
      return vector != null && vector.length > 0 ? vector : null;
    } catch (RuntimeException exception) {
      log.debug("Embedding via {} unavailable: {}", candidate.key(), exception.getMessage());
      return null;
    }
  }

  private void store(
      String fingerprint,
      String text,
      CompletionResponse response,
      RegisteredCandidate candidate,
      LookupEmbedding lookupEmbedding) {
    float[] embedding = null;
    if (semanticCacheEnabled) {
      if (lookupEmbedding != null && lookupEmbedding.candidateKey().equals(candidate.key())) {
        embedding = lookupEmbedding.vector();
      } else if (candidate.provider().supportsEmbeddings()) {
        embedding = embed(candidate, text);
      }
    }
    try {
      resultCache.put(fingerprint, text, response, embedding);
      metrics.recordCacheWrite(embedding != null);
    } catch (RuntimeException exception) {
      log.warn("Failed to cache response for request {}", fingerprint, exception);
    }
  }

  private CompletionResponse withEstimatedCost(
      CompletionResponse response, RegisteredCandidate candidate, String text) {
    if (response.estimatedCost() != null) {
      return response;
    }
    CompletionUsage usage = response.usage();
    long inputUnits;
    long outputUnits;
    if (usage.hasUsage()) {
      inputUnits = usage.promptTokens();
      outputUnits = usage.completionTokens();
    } else {
      try {
        inputUnits = candidate.provider().estimateUnits(text);
        outputUnits =
            response.text() != null ? candidate.provider().estimateUnits(response.text()) : 0;
      } catch (RuntimeException exception) {
        log.debug("Unit estimation failed for {}", candidate.key(), exception);
        return response;
      }
    }
    return response.withEstimatedCost(candidate.profile().estimateCost(inputUnits, outputUnits));
  }

  /** Outcome of the lookup embedding; {@code vector} is null when the attempt failed. */
  private record LookupEmbedding(String candidateKey, float[] vector) {}
}
