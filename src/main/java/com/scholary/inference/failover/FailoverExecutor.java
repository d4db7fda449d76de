package com.scholary.inference.failover;

import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.model.ModelInvocationException;
import com.scholary.inference.task.CancellationToken;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs model calls with a single failover attempt.
 *
 * <p>The primary model is called first. If it fails with a model fault, it is marked failed and
 * one eligible alternate is tried. Client errors (4xx from the backend) and any other exception
 * propagate unchanged and do not affect model health.
 */
@Component
public class FailoverExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FailoverExecutor.class);

  private final FailoverManager failoverManager;
  private final int unavailableRetryAfterSeconds;
  private final int exhaustedRetryAfterSeconds;

  @Autowired
  public FailoverExecutor(FailoverManager failoverManager, InferenceProperties properties) {
    this(
        failoverManager,
        properties.failover().unavailableRetryAfterSeconds(),
        properties.failover().exhaustedRetryAfterSeconds());
  }

  FailoverExecutor(
      FailoverManager failoverManager,
      int unavailableRetryAfterSeconds,
      int exhaustedRetryAfterSeconds) {
    this.failoverManager = failoverManager;
    this.unavailableRetryAfterSeconds = unavailableRetryAfterSeconds;
    this.exhaustedRetryAfterSeconds = exhaustedRetryAfterSeconds;
  }

  public <T> FailoverResult<T> execute(String modelType, String modelId, ModelCall<T> call) {
    return execute(modelType, modelId, CancellationToken.NONE, call);
  }

  /**
   * Call {@code modelId}, falling back to one alternate of its family on a model fault.
   *
   * @param cancellation polled before each attempt
   * @throws ModelUnavailableException if the primary failed and no alternate is eligible
   * @throws FailoverExhaustedException if the primary and the alternate both failed
   * @throws ModelInvocationException for client errors, which are not retried
   * @throws com.scholary.inference.task.TaskCancelledException if cancellation was requested
   */
  public <T> FailoverResult<T> execute(
      String modelType, String modelId, CancellationToken cancellation, ModelCall<T> call) {
    cancellation.throwIfCancellationRequested();

    T value;
    try {
      value = call.call(modelId);
    } catch (ModelInvocationException e) {
      if (!e.isModelFault()) {
        throw e;
      }
      return failover(modelType, modelId, cancellation, call, e);
    }
    failoverManager.markSuccess(modelId);
    return new FailoverResult<>(value, modelId, modelId);
  }

  private <T> FailoverResult<T> failover(
      String modelType,
      String modelId,
      CancellationToken cancellation,
      ModelCall<T> call,
      ModelInvocationException primaryFailure) {
    LOGGER.warn("Model {} failed: {}", modelId, primaryFailure.getMessage());
    failoverManager.markFailure(modelId, primaryFailure.getMessage());

    Optional<String> alternative = failoverManager.getAlternative(modelType, modelId);
    if (alternative.isEmpty()) {
      throw new ModelUnavailableException(
          modelId, modelType, unavailableRetryAfterSeconds, primaryFailure);
    }

    String alternate = alternative.get();
    LOGGER.info("Failing over from {} to {}", modelId, alternate);
    cancellation.throwIfCancellationRequested();

    T value;
    try {
      value = call.call(alternate);
    } catch (ModelInvocationException e) {
      if (e.isModelFault()) {
        failoverManager.markFailure(alternate, e.getMessage());
      }
      failoverManager.recordFailoverEvent(modelId, alternate, false, e.getMessage());
      throw new FailoverExhaustedException(modelId, alternate, exhaustedRetryAfterSeconds, e);
    }

    failoverManager.markSuccess(alternate);
    failoverManager.recordFailoverEvent(modelId, alternate, true, null);
    return new FailoverResult<>(value, alternate, modelId);
  }
}
