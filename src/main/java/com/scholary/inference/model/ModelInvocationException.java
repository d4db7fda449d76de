package com.scholary.inference.model;

/**
 * Exception thrown when a model backend call fails.
 *
 * <p>This could be due to network issues, backend unavailability, or a rejected request. Only the
 * first two are faults of the model; a 4xx response means the request itself was wrong.
 */
public class ModelInvocationException extends RuntimeException {

  /** Status code used when no HTTP response was received. */
  public static final int NO_RESPONSE = -1;

  private final String modelId;
  private final int statusCode;

  public ModelInvocationException(String modelId, int statusCode, String message) {
    super(message);
    this.modelId = modelId;
    this.statusCode = statusCode;
  }

  public ModelInvocationException(String modelId, String message, Throwable cause) {
    super(message, cause);
    this.modelId = modelId;
    this.statusCode = NO_RESPONSE;
  }

  public String getModelId() {
    return modelId;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** True for transport errors and 5xx responses; these trigger failover. */
  public boolean isModelFault() {
    return statusCode == NO_RESPONSE || statusCode >= 500;
  }
}
