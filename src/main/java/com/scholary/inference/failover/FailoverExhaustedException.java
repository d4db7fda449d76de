package com.scholary.inference.failover;

/** Thrown when both a model and the alternate tried in its place failed. */
public class FailoverExhaustedException extends RuntimeException {

  private final String originalModel;
  private final String alternativeModel;
  private final int retryAfterSeconds;

  public FailoverExhaustedException(
      String originalModel, String alternativeModel, int retryAfterSeconds, Throwable cause) {
    super(
        String.format(
            "Both primary model %s and alternative %s failed", originalModel, alternativeModel),
        cause);
    this.originalModel = originalModel;
    this.alternativeModel = alternativeModel;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public String getOriginalModel() {
    return originalModel;
  }

  public String getAlternativeModel() {
    return alternativeModel;
  }

  public int getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
