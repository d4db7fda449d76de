package com.scholary.inference.cache;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A cached HTTP response.
 *
 * <p>The entry is logically absent once {@code now} is after {@link #expiresAt()}.
 */
public record CacheEntry(
    byte[] payload,
    Map<String, String> headers,
    int statusCode,
    Instant createdAt,
    long ttlSeconds) {

  public CacheEntry {
    payload = payload == null ? new byte[0] : payload.clone();
    headers =
        headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public Instant expiresAt() {
    return createdAt.plusSeconds(ttlSeconds);
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt());
  }

  /** Age in whole seconds, as reported in the {@code Age} header. */
  public long ageSeconds(Instant now) {
    return Math.max(0, now.getEpochSecond() - createdAt.getEpochSecond());
  }
}
