package com.scholary.inference.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the inference gateway core.
 *
 * <p>Controls task retention, response caching, rate limits, model failover and the background
 * job executor.
 */
@ConfigurationProperties(prefix = "inference")
@Validated
public record InferenceProperties(
    @Valid @NotNull TaskProperties tasks,
    @Valid @NotNull CacheProperties cache,
    @Valid @NotNull RateLimitProperties rateLimit,
    @Valid @NotNull FailoverProperties failover,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record TaskProperties(@Positive int retentionMinutes) {}

  /**
   * Response cache settings. A path is cacheable if it matches an include rule and no exclude
   * rule.
   */
  public record CacheProperties(
      @Positive int maxSize,
      @Positive int defaultTtlSeconds,
      List<String> includePaths,
      List<String> includePrefixes,
      List<String> excludePaths,
      List<String> excludePrefixes,
      boolean keyByQuery,
      boolean keyByApiKey) {

    public CacheProperties {
      includePaths = includePaths == null ? List.of() : List.copyOf(includePaths);
      includePrefixes = includePrefixes == null ? List.of() : List.copyOf(includePrefixes);
      excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
      excludePrefixes = excludePrefixes == null ? List.of() : List.copyOf(excludePrefixes);
    }

    public boolean isCacheable(String path) {
      if (excludePaths.contains(path) || excludePrefixes.stream().anyMatch(path::startsWith)) {
        return false;
      }
      return includePaths.contains(path) || includePrefixes.stream().anyMatch(path::startsWith);
    }
  }

  public record RateLimitProperties(
      @Positive int windowSeconds,
      @Positive int globalLimit,
      @Positive int ipLimit,
      @Positive int apiKeyLimit,
      List<String> excludePaths,
      List<String> excludePrefixes) {

    public RateLimitProperties {
      excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
      excludePrefixes = excludePrefixes == null ? List.of() : List.copyOf(excludePrefixes);
    }

    public boolean isExcluded(String path) {
      return excludePaths.contains(path) || excludePrefixes.stream().anyMatch(path::startsWith);
    }
  }

  /**
   * Model failover settings.
   *
   * @param alternatives per model family, the alternates of each primary model
   * @param defaultModels per model family, the model used when a request names none
   */
  public record FailoverProperties(
      @Positive int cooldownSeconds,
      @Positive int historySize,
      @Positive int unavailableRetryAfterSeconds,
      @Positive int exhaustedRetryAfterSeconds,
      Map<String, Map<String, List<String>>> alternatives,
      Map<String, String> defaultModels) {

    public FailoverProperties {
      alternatives = alternatives == null ? Map.of() : Map.copyOf(alternatives);
      defaultModels = defaultModels == null ? Map.of() : Map.copyOf(defaultModels);
    }
  }
}
