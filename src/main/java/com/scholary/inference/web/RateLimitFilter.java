package com.scholary.inference.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.inference.config.InferenceProperties.RateLimitProperties;
import com.scholary.inference.ratelimit.AdmissionDecision;
import com.scholary.inference.ratelimit.RateLimitPolicy;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects requests over any rate-limit bucket with 429 before they reach a controller.
 *
 * <p>Admitted requests carry the reported bucket's budget in {@code X-RateLimit-*} headers.
 */
public class RateLimitFilter extends OncePerRequestFilter {

  static final String API_KEY_HEADER = "X-API-Key";

  private final RateLimitPolicy policy;
  private final RateLimitProperties properties;
  private final ObjectMapper objectMapper;

  public RateLimitFilter(
      RateLimitPolicy policy, RateLimitProperties properties, ObjectMapper objectMapper) {
    this.policy = policy;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return properties.isExcluded(request.getRequestURI());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    AdmissionDecision decision =
        policy.admit(request.getRemoteAddr(), request.getHeader(API_KEY_HEADER));

    response.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
    response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
    response.setHeader("X-RateLimit-Reset", String.valueOf(decision.resetEpochSeconds()));

    if (decision.admitted()) {
      chain.doFilter(request, response);
      return;
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put(
        "detail",
        String.format(
            "Rate limit exceeded. Try again in %d seconds.", decision.retryAfterSeconds()));
    body.put("type", "rate_limit_exceeded");
    body.put("limiter", decision.limiter());

    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
