package com.scholary.inference.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.inference.cache.ResponseCache;
import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.ratelimit.RateLimitPolicy;
import java.time.Clock;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Registers the HTTP filters. Rate limiting runs first, so rejected requests never touch the
 * cache.
 */
@Configuration
public class WebFilterConfig {

  @Bean
  public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(
      RateLimitPolicy policy, InferenceProperties properties, ObjectMapper objectMapper) {
    FilterRegistrationBean<RateLimitFilter> registration =
        new FilterRegistrationBean<>(
            new RateLimitFilter(policy, properties.rateLimit(), objectMapper));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }

  @Bean
  public FilterRegistrationBean<ResponseCacheFilter> responseCacheFilter(
      ResponseCache cache, InferenceProperties properties, Clock clock) {
    FilterRegistrationBean<ResponseCacheFilter> registration =
        new FilterRegistrationBean<>(new ResponseCacheFilter(cache, properties.cache(), clock));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);
    return registration;
  }
}
