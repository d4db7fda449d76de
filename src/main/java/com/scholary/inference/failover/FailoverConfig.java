package com.scholary.inference.failover;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Failover settings for one model family.
 *
 * @param modelType the family ("text", "transcription", "video", ...)
 * @param alternatives for each primary model id, the ids that may replace it
 * @param cooldownBase base wait before a failed model may be retried
 */
public record FailoverConfig(
    String modelType, Map<String, List<String>> alternatives, Duration cooldownBase) {

  public FailoverConfig {
    if (cooldownBase == null || cooldownBase.isNegative()) {
      throw new IllegalArgumentException("cooldownBase must not be negative");
    }
    alternatives = copy(alternatives);
  }

  FailoverConfig withAlternatives(String primary, List<String> alternates, Duration cooldown) {
    Map<String, List<String>> updated = new LinkedHashMap<>(alternatives);
    updated.put(primary, alternates);
    return new FailoverConfig(modelType, updated, cooldown);
  }

  private static Map<String, List<String>> copy(Map<String, List<String>> alternatives) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (alternatives != null) {
      alternatives.forEach((primary, alts) -> copy.put(primary, List.copyOf(alts)));
    }
    return Collections.unmodifiableMap(copy);
  }
}
