package com.scholary.inference.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache of prior responses to idempotent requests, keyed by request fingerprint.
 *
 * <p>Implementations never throw for expected conditions: a missing or expired key is simply
 * absent.
 */
public interface ResponseCache {

  /**
   * Look up a cached response.
   *
   * @param key the request fingerprint
   * @return the entry, or empty if absent or expired (an expired entry is removed)
   */
  Optional<CacheEntry> get(String key);

  /**
   * Store a response.
   *
   * @param key the request fingerprint
   * @param payload the response body
   * @param headers the response headers to replay
   * @param statusCode the response status
   * @param ttlSeconds time to live, or null for the configured default
   */
  void put(
      String key, byte[] payload, Map<String, String> headers, int statusCode, Integer ttlSeconds);

  /**
   * Remove every entry whose key starts with the given prefix.
   *
   * @return the number of entries removed
   */
  int invalidate(String keyPrefix);

  /** Snapshot of cache counters for diagnostics. */
  CacheStats stats();

  /**
   * Generate a request fingerprint.
   *
   * @param method the HTTP method
   * @param path the request path
   * @param query the raw query string, or null to leave it out of the key
   * @param identity the caller identity (API key), or null to share entries between callers
   * @return hex MD5 digest of the colon-joined parts
   */
  static String generateKey(String method, String path, String query, String identity) {
    List<String> parts = new ArrayList<>(List.of(method, path));
    if (query != null && !query.isEmpty()) {
      parts.add(query);
    }
    if (identity != null) {
      parts.add(identity);
    }
    try {
      MessageDigest md5 = MessageDigest.getInstance("MD5");
      byte[] digest = md5.digest(String.join(":", parts).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      // MD5 is mandatory on every Java platform
      throw new IllegalStateException("MD5 not available", e);
    }
  }

  /** Cache counters. */
  record CacheStats(int size, int maxSize, long hits, long misses, long evictions) {

    public double hitRate() {
      long lookups = hits + misses;
      return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
  }
}
