package com.scholary.inference.cache;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/** Reads the caching directives of a response's {@code Cache-Control} and {@code Expires}. */
public final class CacheDirectives {

  private CacheDirectives() {}

  /** True unless the response forbids caching with {@code no-cache} or {@code no-store}. */
  public static boolean isStorable(String cacheControl) {
    if (cacheControl == null) {
      return true;
    }
    String lower = cacheControl.toLowerCase(Locale.ROOT);
    return !lower.contains("no-cache") && !lower.contains("no-store");
  }

  /**
   * Resolve the time to live of a response.
   *
   * @param cacheControl the Cache-Control header, may be null
   * @param expires the Expires header (RFC 1123 date), may be null
   * @param now the current time
   * @return {@code max-age} if present and valid, else seconds until {@code Expires} (never
   *     negative), else null to use the cache default
   */
  public static Integer resolveTtlSeconds(String cacheControl, String expires, Instant now) {
    if (cacheControl != null) {
      for (String directive : cacheControl.split(",")) {
        String trimmed = directive.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("max-age=")) {
          try {
            return Integer.parseInt(trimmed.substring("max-age=".length()).trim());
          } catch (NumberFormatException e) {
            // malformed max-age: fall through to Expires
            break;
          }
        }
      }
    }

    if (expires != null && !expires.isBlank()) {
      try {
        Instant expiresAt =
            ZonedDateTime.parse(expires, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        return (int) Math.max(0, Duration.between(now, expiresAt).getSeconds());
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    return null;
  }
}
