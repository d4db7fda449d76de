package com.scholary.inference.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of ResponseCache.
 *
 * <p>Entries are kept in creation order. When the cache is full the single oldest-created entry is
 * evicted (not the least recently used one). Expired entries are purged before every insertion.
 *
 * <p>Eviction is global across keys, so all operations share one monitor. None of them does I/O.
 */
@Component
public class InMemoryResponseCache implements ResponseCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryResponseCache.class);

  // insertion order == creation order: overwrites are removed and re-appended
  private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
  private final int maxSize;
  private final int defaultTtlSeconds;
  private final Clock clock;

  private long hits;
  private long misses;
  private long evictions;

  public InMemoryResponseCache(
      @Value("${inference.cache.maxSize:1000}") int maxSize,
      @Value("${inference.cache.defaultTtlSeconds:300}") int defaultTtlSeconds,
      Clock clock) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    this.defaultTtlSeconds = defaultTtlSeconds;
    this.clock = clock;

    LOGGER.info(
        "Initialized response cache: maxSize={}, defaultTtlSeconds={}", maxSize, defaultTtlSeconds);
  }

  @Override
  public synchronized Optional<CacheEntry> get(String key) {
    CacheEntry entry = entries.get(key);
    if (entry == null) {
      misses++;
      LOGGER.debug("Cache miss: key={}", key);
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key);
      misses++;
      LOGGER.debug("Cache entry expired: key={}", key);
      return Optional.empty();
    }
    hits++;
    LOGGER.debug("Cache hit: key={}", key);
    return Optional.of(entry);
  }

  @Override
  public synchronized void put(
      String key, byte[] payload, Map<String, String> headers, int statusCode, Integer ttlSeconds) {
    Instant now = clock.instant();
    purgeExpired(now);

    boolean overwrite = entries.remove(key) != null;
    if (!overwrite && entries.size() >= maxSize) {
      evictOldest();
    }

    long ttl = ttlSeconds != null ? ttlSeconds : defaultTtlSeconds;
    entries.put(key, new CacheEntry(payload, headers, statusCode, now, ttl));
    LOGGER.debug("Cached response: key={}, status={}, ttl={}s", key, statusCode, ttl);
  }

  @Override
  public synchronized int invalidate(String keyPrefix) {
    int removed = 0;
    Iterator<String> keys = entries.keySet().iterator();
    while (keys.hasNext()) {
      if (keys.next().startsWith(keyPrefix)) {
        keys.remove();
        removed++;
      }
    }
    LOGGER.info("Invalidated {} cache entries with prefix '{}'", removed, keyPrefix);
    return removed;
  }

  @Override
  public synchronized CacheStats stats() {
    return new CacheStats(entries.size(), maxSize, hits, misses, evictions);
  }

  private void purgeExpired(Instant now) {
    int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    int purged = before - entries.size();
    if (purged > 0) {
      LOGGER.debug("Purged {} expired cache entries", purged);
    }
  }

  private void evictOldest() {
    Iterator<Map.Entry<String, CacheEntry>> oldest = entries.entrySet().iterator();
    if (oldest.hasNext()) {
      String key = oldest.next().getKey();
      oldest.remove();
      evictions++;
      LOGGER.debug("Evicted oldest cache entry: key={}", key);
    }
  }
}
