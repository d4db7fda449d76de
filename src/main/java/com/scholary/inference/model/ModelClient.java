package com.scholary.inference.model;

import com.scholary.inference.task.ProgressTracker;

/**
 * Interface for model backends.
 *
 * <p>This abstraction allows us to swap model-serving providers without changing the job and
 * failover logic.
 */
public interface ModelClient {

  /**
   * Invoke a model.
   *
   * @param request the model id, task type and parameters
   * @param progress tracker to report intermediate progress to, or null for synchronous calls
   * @return the model output
   * @throws ModelInvocationException if the call fails
   */
  ModelResponse invoke(ModelRequest request, ProgressTracker progress);
}
