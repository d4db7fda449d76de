package com.scholary.inference.web;

import com.scholary.inference.cache.CacheDirectives;
import com.scholary.inference.cache.CacheEntry;
import com.scholary.inference.cache.ResponseCache;
import com.scholary.inference.config.InferenceProperties.CacheProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Serves eligible GET requests from the response cache and stores successful responses.
 *
 * <p>The cache is an optimisation only: any failure to read from or write to it is logged and the
 * request is served as if the cache did not exist.
 */
public class ResponseCacheFilter extends OncePerRequestFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseCacheFilter.class);

  static final String CACHE_HEADER = "X-Cache";

  /** Per-request headers that must not be replayed from a cached entry. */
  private static final Set<String> SKIPPED_HEADERS =
      Set.of(
          "x-cache",
          "age",
          "date",
          "content-length",
          "transfer-encoding",
          "set-cookie",
          "x-ratelimit-limit",
          "x-ratelimit-remaining",
          "x-ratelimit-reset");

  private final ResponseCache cache;
  private final CacheProperties properties;
  private final Clock clock;

  public ResponseCacheFilter(ResponseCache cache, CacheProperties properties, Clock clock) {
    this.cache = cache;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !"GET".equals(request.getMethod()) || !properties.isCacheable(request.getRequestURI());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String key =
        ResponseCache.generateKey(
            request.getMethod(),
            request.getRequestURI(),
            properties.keyByQuery() ? request.getQueryString() : null,
            properties.keyByApiKey() ? request.getHeader(RateLimitFilter.API_KEY_HEADER) : null);

    Optional<CacheEntry> cached = lookup(key);
    if (cached.isPresent()) {
      replay(cached.get(), response);
      return;
    }

    ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
    wrapper.setHeader(CACHE_HEADER, "MISS");
    try {
      chain.doFilter(request, wrapper);
      store(key, wrapper);
    } finally {
      wrapper.copyBodyToResponse();
    }
  }

  private Optional<CacheEntry> lookup(String key) {
    try {
      return cache.get(key);
    } catch (RuntimeException e) {
      LOGGER.warn("Response cache lookup failed, bypassing cache: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private void replay(CacheEntry entry, HttpServletResponse response) throws IOException {
    response.setStatus(entry.statusCode());
    entry
        .headers()
        .forEach(
            (name, value) -> {
              if (HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name)) {
                response.setContentType(value);
              } else {
                response.setHeader(name, value);
              }
            });
    response.setHeader(CACHE_HEADER, "HIT");
    response.setHeader(HttpHeaders.AGE, String.valueOf(entry.ageSeconds(clock.instant())));
    byte[] payload = entry.payload();
    response.setContentLength(payload.length);
    response.getOutputStream().write(payload);
  }

  private void store(String key, ContentCachingResponseWrapper response) {
    int status = response.getStatus();
    if (status < 200 || status >= 300) {
      return;
    }
    String cacheControl = response.getHeader(HttpHeaders.CACHE_CONTROL);
    if (!CacheDirectives.isStorable(cacheControl)) {
      return;
    }
    Integer ttl =
        CacheDirectives.resolveTtlSeconds(
            cacheControl, response.getHeader(HttpHeaders.EXPIRES), clock.instant());
    if (ttl != null && ttl <= 0) {
      return;
    }

    try {
      cache.put(key, response.getContentAsByteArray(), replayableHeaders(response), status, ttl);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to store response in cache: {}", e.getMessage());
    }
  }

  private static Map<String, String> replayableHeaders(HttpServletResponse response) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (String name : response.getHeaderNames()) {
      if (!SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
        headers.put(name, response.getHeader(name));
      }
    }
    if (response.getContentType() != null) {
      headers.put(HttpHeaders.CONTENT_TYPE, response.getContentType());
    }
    return headers;
  }
}
