package com.scholary.inference.failover;

/**
 * Outcome of a failover-guarded call.
 *
 * @param value the call's result
 * @param modelUsed the model that produced it
 * @param originalModel the model that was asked for
 */
public record FailoverResult<T>(T value, String modelUsed, String originalModel) {

  public boolean failedOver() {
    return !modelUsed.equals(originalModel);
  }
}
