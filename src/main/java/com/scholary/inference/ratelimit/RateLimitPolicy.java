package com.scholary.inference.ratelimit;

import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.config.InferenceProperties.RateLimitProperties;
import com.scholary.inference.logging.StructuredLogger;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Admission control over three independent buckets, checked in order: a global bucket, the
 * caller's IP, and (when present) the caller's API key. A request is admitted only if no bucket
 * rejects it.
 */
@Component
public class RateLimitPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitPolicy.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String GLOBAL_IDENTIFIER = "global";

  private final SlidingWindowRateLimiter globalLimiter;
  private final SlidingWindowRateLimiter ipLimiter;
  private final SlidingWindowRateLimiter apiKeyLimiter;
  private final Clock clock;

  public RateLimitPolicy(InferenceProperties properties, Clock clock) {
    RateLimitProperties limits = properties.rateLimit();
    this.clock = clock;
    this.globalLimiter =
        new SlidingWindowRateLimiter("global", limits.globalLimit(), limits.windowSeconds(), clock);
    this.ipLimiter =
        new SlidingWindowRateLimiter("ip", limits.ipLimit(), limits.windowSeconds(), clock);
    this.apiKeyLimiter =
        new SlidingWindowRateLimiter(
            "api_key", limits.apiKeyLimit(), limits.windowSeconds(), clock);

    LOGGER.info(
        "Initialized rate limits: global={}, ip={}, apiKey={} per {}s",
        limits.globalLimit(),
        limits.ipLimit(),
        limits.apiKeyLimit(),
        limits.windowSeconds());
  }

  /**
   * Evaluate a request.
   *
   * @param clientIp the caller's address
   * @param apiKey the caller's API key, or null
   */
  public AdmissionDecision admit(String clientIp, String apiKey) {
    RateLimitResult global = globalLimiter.isLimited(GLOBAL_IDENTIFIER);
    if (global.limited()) {
      return reject(globalLimiter, GLOBAL_IDENTIFIER, global);
    }

    RateLimitResult ip = ipLimiter.isLimited(clientIp);
    if (ip.limited()) {
      return reject(ipLimiter, clientIp, ip);
    }

    if (apiKey != null && !apiKey.isBlank()) {
      RateLimitResult key = apiKeyLimiter.isLimited(apiKey);
      if (key.limited()) {
        // never log the key itself
        return reject(apiKeyLimiter, "<api-key>", key);
      }
      return admit(apiKeyLimiter, key);
    }
    return admit(ipLimiter, ip);
  }

  /** Periodically forget identifiers that have been idle for a full window. */
  @Scheduled(fixedDelayString = "${inference.rateLimit.purgeIntervalMs:60000}")
  public void purgeIdleWindows() {
    int purged = globalLimiter.purgeIdle() + ipLimiter.purgeIdle() + apiKeyLimiter.purgeIdle();
    if (purged > 0) {
      LOGGER.debug("Purged {} idle rate-limit windows", purged);
    }
  }

  private AdmissionDecision admit(SlidingWindowRateLimiter limiter, RateLimitResult result) {
    return new AdmissionDecision(
        true,
        limiter.getName(),
        limiter.getMaxRequests(),
        result.remaining(),
        clock.instant().getEpochSecond() + limiter.getWindowSeconds(),
        0);
  }

  private AdmissionDecision reject(
      SlidingWindowRateLimiter limiter, String identifier, RateLimitResult result) {
    structuredLogger.logRateLimited(limiter.getName(), identifier, result.waitSeconds());
    return new AdmissionDecision(
        false,
        limiter.getName(),
        limiter.getMaxRequests(),
        0,
        clock.instant().getEpochSecond() + result.waitSeconds(),
        result.waitSeconds());
  }
}
