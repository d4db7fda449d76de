package com.scholary.inference.failover;

/** Thrown when a model failed and no alternate is currently eligible. */
public class ModelUnavailableException extends RuntimeException {

  private final String modelId;
  private final String modelType;
  private final int retryAfterSeconds;

  public ModelUnavailableException(
      String modelId, String modelType, int retryAfterSeconds, Throwable cause) {
    super(
        String.format(
            "Model %s is currently unavailable and no alternatives are available", modelId),
        cause);
    this.modelId = modelId;
    this.modelType = modelType;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public String getModelId() {
    return modelId;
  }

  public String getModelType() {
    return modelType;
  }

  public int getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
