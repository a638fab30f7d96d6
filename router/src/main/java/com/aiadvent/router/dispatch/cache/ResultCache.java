package com.aiadvent.router.dispatch.cache;

import com.aiadvent.router.dispatch.provider.CompletionResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Two-tier response cache. The exact index maps a request fingerprint to its latest entry; the
 * semantic index is an insertion-ordered list of the entries that were written with an embedding.
 * Entries are never mutated and leave the indices on lookup (exact) or on sweep (both).
 */
public class ResultCache {

  private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

  private final Cache<String, CacheEntry> exactIndex;

  /** Exact entries Caffeine expired on its own since the last sweep. */
  private final AtomicInteger expiredEvictions = new AtomicInteger();

  private final List<CacheEntry> semanticIndex = new ArrayList<>();
  private final ReadWriteLock semanticLock = new ReentrantReadWriteLock();
  private final Duration defaultTtl;
  private final double defaultThreshold;
  private final long maximumSize;
  private final Clock clock;

  public ResultCache(Duration defaultTtl, double defaultThreshold, long maximumSize, Clock clock) {
    Assert.isTrue(
        defaultTtl != null && !defaultTtl.isNegative() && !defaultTtl.isZero(),
        "defaultTtl must be positive");
    Assert.isTrue(maximumSize > 0, "maximumSize must be positive");
    Assert.notNull(clock, "clock must not be null");
    this.defaultTtl = defaultTtl;
    this.defaultThreshold = defaultThreshold;
    this.maximumSize = maximumSize;
    this.clock = clock;
    this.exactIndex =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry(clock))
            .evictionListener(
                (String fingerprint, CacheEntry entry, RemovalCause cause) -> {
                  if (cause == RemovalCause.EXPIRED) {
                    expiredEvictions.incrementAndGet();
                  }
                })
            .ticker(clockTicker(clock))
            .executor(Runnable::run)
            .build();
  }

  public Optional<CompletionResponse> get(String fingerprint) {
    if (!StringUtils.hasText(fingerprint)) {
      return Optional.empty();
    }
    CacheEntry entry = exactIndex.getIfPresent(fingerprint);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      exactIndex.invalidate(fingerprint);
      return Optional.empty();
    }
    return Optional.of(entry.response());
  }

  public void put(String fingerprint, String text, CompletionResponse response, float[] embedding) {
    put(fingerprint, text, response, embedding, null);
  }

  public void put(
      String fingerprint, String text, CompletionResponse response, float[] embedding, Duration ttl) {
    Assert.hasText(fingerprint, "fingerprint must not be blank");
    Assert.notNull(response, "response must not be null");
    Duration effectiveTtl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : defaultTtl;
    Instant now = clock.instant();
    float[] storedEmbedding = embedding != null && embedding.length > 0 ? embedding.clone() : null;
    CacheEntry entry =
        new CacheEntry(fingerprint, text, storedEmbedding, response, now, now.plus(effectiveTtl));

    exactIndex.put(fingerprint, entry);
    if (entry.hasEmbedding()) {
      semanticLock.writeLock().lock();
      try {
        semanticIndex.add(entry);
        if (semanticIndex.size() > maximumSize) {
          semanticIndex.remove(0);
        }
      } finally {
        semanticLock.writeLock().unlock();
      }
    }
  }

  public Optional<CompletionResponse> findSimilar(float[] embedding) {
    return findSimilar(embedding, defaultThreshold);
  }

  /**
   * Response of the retained entry most similar to {@code embedding}, provided its similarity is
   * strictly above {@code threshold}. Equal scores keep the earliest inserted entry.
   */
  public Optional<CompletionResponse> findSimilar(float[] embedding, double threshold) {
    if (embedding == null || embedding.length == 0) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    sweepSemanticIndex(now);

    CacheEntry bestMatch = null;
    double highestSimilarity = Double.NEGATIVE_INFINITY;
    semanticLock.readLock().lock();
    try {
      for (CacheEntry entry : semanticIndex) {
        if (!entry.hasEmbedding() || entry.isExpired(now)) {
          continue;
        }
        double similarity;
        try {
          similarity = VectorSimilarity.cosine(embedding, entry.embedding());
        } catch (VectorDimensionMismatchException ex) {
          log.warn(
              "Skipping semantic cache entry {} with inconsistent embedding: {}",
              entry.fingerprint(),
              ex.getMessage());
          continue;
        }
        if (similarity > threshold && similarity > highestSimilarity) {
          highestSimilarity = similarity;
          bestMatch = entry;
        }
      }
    } finally {
      semanticLock.readLock().unlock();
    }

    if (bestMatch == null) {
      return Optional.empty();
    }
    log.debug(
        "Semantic cache match {} with similarity {}", bestMatch.fingerprint(), highestSimilarity);
    return Optional.of(bestMatch.response());
  }

  /** Removes every expired entry from both indices and returns how many were dropped. */
  public int sweepExpired() {
    Instant now = clock.instant();
    AtomicInteger exactRemoved = new AtomicInteger();
    ConcurrentMap<String, CacheEntry> entries = exactIndex.asMap();
    entries.forEach(
        (fingerprint, entry) -> {
          if (entry.isExpired(now) && entries.remove(fingerprint, entry)) {
            exactRemoved.incrementAndGet();
          }
        });
    exactIndex.cleanUp();
    exactRemoved.addAndGet(expiredEvictions.getAndSet(0));
    int semanticRemoved = sweepSemanticIndex(now);
    if (exactRemoved.get() > 0 || semanticRemoved > 0) {
      log.debug(
          "Result cache sweep removed {} exact and {} semantic entries",
          exactRemoved,
          semanticRemoved);
    }
    return exactRemoved.get() + semanticRemoved;
  }

  public long exactSize() {
    exactIndex.cleanUp();
    return exactIndex.estimatedSize();
  }

  public int semanticSize() {
    semanticLock.readLock().lock();
    try {
      return semanticIndex.size();
    } finally {
      semanticLock.readLock().unlock();
    }
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  public double defaultThreshold() {
    return defaultThreshold;
  }

  private int sweepSemanticIndex(Instant now) {
    semanticLock.writeLock().lock();
    try {
      int before = semanticIndex.size();
      semanticIndex.removeIf(entry -> entry.isExpired(now));
      return before - semanticIndex.size();
    } finally {
      semanticLock.writeLock().unlock();
    }
  }

  private static Ticker clockTicker(Clock clock) {
    return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }

  private static final class EntryExpiry implements Expiry<String, CacheEntry> {

    private final Clock clock;

    private EntryExpiry(Clock clock) {
      this.clock = clock;
    }

    @Override
    public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
      return remaining(value);
    }

    @Override
    public long expireAfterUpdate(
        String key, CacheEntry value, long currentTime, long currentDuration) {
      return remaining(value);
    }

    @Override
    public long expireAfterRead(
        String key, CacheEntry value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    // one extra millisecond so Caffeine keeps the entry until the clock has passed expiresAt
    private long remaining(CacheEntry value) {
      long millis = value.expiresAt().toEpochMilli() - clock.millis() + 1;
      return TimeUnit.MILLISECONDS.toNanos(Math.max(0L, millis));
    }
  }
}
