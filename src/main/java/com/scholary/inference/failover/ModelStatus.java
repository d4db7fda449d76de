package com.scholary.inference.failover;

import java.time.Duration;
import java.time.Instant;

/**
 * Health record of one model id.
 *
 * <p>A model becomes unavailable on any failure and available again only on an explicit success.
 * Independently of that flag, an unavailable model may be retried once its cooldown has elapsed;
 * the cooldown grows with consecutive failures, capped at five times the base.
 *
 * <p>Each instance is its own monitor.
 */
public class ModelStatus {

  static final int MAX_COOLDOWN_MULTIPLIER = 5;

  private final String modelId;
  private boolean available = true;
  private int failureCount;
  private Instant lastFailureAt;
  private int recoveryCount;
  private long cumulativeErrors;

  ModelStatus(String modelId) {
    this.modelId = modelId;
  }

  public String getModelId() {
    return modelId;
  }

  /**
   * @return the consecutive failure count after this failure
   */
  synchronized int markFailure(Instant now) {
    available = false;
    failureCount++;
    cumulativeErrors++;
    lastFailureAt = now;
    return failureCount;
  }

  /**
   * @return true if the model was unavailable and has now recovered
   */
  synchronized boolean markSuccess() {
    boolean recovered = !available;
    if (recovered) {
      recoveryCount++;
    }
    available = true;
    failureCount = 0;
    return recovered;
  }

  synchronized boolean shouldRetry(Duration cooldownBase, Instant now) {
    if (available) {
      return true;
    }
    Duration cooldown = cooldownBase.multipliedBy(Math.min(MAX_COOLDOWN_MULTIPLIER, failureCount));
    return Duration.between(lastFailureAt, now).compareTo(cooldown) > 0;
  }

  synchronized Snapshot snapshot() {
    return new Snapshot(
        modelId, available, failureCount, lastFailureAt, recoveryCount, cumulativeErrors);
  }

  /** Point-in-time copy for reporting. */
  public record Snapshot(
      String modelId,
      boolean available,
      int failureCount,
      Instant lastFailureAt,
      int recoveryCount,
      long cumulativeErrors) {}
}
