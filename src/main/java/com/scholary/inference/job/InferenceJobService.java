package com.scholary.inference.job;

import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.failover.FailoverExecutor;
import com.scholary.inference.failover.FailoverResult;
import com.scholary.inference.logging.StructuredLogger;
import com.scholary.inference.model.ModelClient;
import com.scholary.inference.model.ModelRequest;
import com.scholary.inference.model.ModelResponse;
import com.scholary.inference.task.CancellationToken;
import com.scholary.inference.task.ProgressTracker;
import com.scholary.inference.task.TaskCancelledException;
import com.scholary.inference.task.TaskParams;
import com.scholary.inference.task.TaskRegistry;
import com.scholary.inference.task.TaskStatus;
import com.scholary.inference.task.TaskType;
import com.scholary.inference.task.TaskUpdate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Starts inference jobs and runs them in the background.
 *
 * <p>A job registers a task, returns its id immediately, and then on the job executor:
 *
 * <ol>
 *   <li>marks the task running (unless it was cancelled while queued)
 *   <li>resolves the model from the request or the family default
 *   <li>calls the model through the failover executor, reporting progress as it goes
 *   <li>records the results or the error
 * </ol>
 *
 * <p>Cancellation is cooperative: the job checks the task's cancellation token before each model
 * attempt, and the registry ignores any late write to a cancelled task.
 */
@Service
public class InferenceJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(InferenceJobService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TaskRegistry registry;
  private final FailoverExecutor failoverExecutor;
  private final ModelClient modelClient;
  private final Map<String, String> defaultModels;
  private final Executor executor;

  public InferenceJobService(
      TaskRegistry registry,
      FailoverExecutor failoverExecutor,
      ModelClient modelClient,
      InferenceProperties properties,
      @Qualifier("taskExecutor") Executor executor) {
    this.registry = registry;
    this.failoverExecutor = failoverExecutor;
    this.modelClient = modelClient;
    this.defaultModels = properties.failover().defaultModels();
    this.executor = executor;
  }

  /**
   * Register a task and start its job.
   *
   * @return the task id, usable for polling right away
   */
  public String submit(TaskType type, String owner, TaskParams params) {
    String taskId = registry.create(type, owner, params);
    try {
      executor.execute(() -> runJob(taskId, type, owner, params));
    } catch (RejectedExecutionException e) {
      LOGGER.error("Job executor rejected task {}", taskId, e);
      registry.update(taskId, TaskUpdate.failed("Job queue is full, try again later"));
    }
    return taskId;
  }

  /**
   * Run a model call on the caller's thread, with failover.
   *
   * @throws IllegalArgumentException if no model is requested and the family has no default
   */
  public FailoverResult<ModelResponse> invokeNow(TaskType type, TaskParams params) {
    String modelId = resolveModel(type, params);
    return failoverExecutor.execute(
        type.modelFamily(),
        modelId,
        model -> modelClient.invoke(new ModelRequest(model, type, params), null));
  }

  /** Model used for a request: the one it names, else the default of its family. */
  public String resolveModel(TaskType type, TaskParams params) {
    if (params != null) {
      Optional<String> requested = params.requestedModel();
      if (requested.isPresent()) {
        return requested.get();
      }
    }
    String model = defaultModels.get(type.modelFamily());
    if (model == null) {
      throw new IllegalArgumentException(
          "No model requested and no default model configured for family " + type.modelFamily());
    }
    return model;
  }

  void runJob(String taskId, TaskType type, String owner, TaskParams params) {
    StructuredLogger.setTaskContext(taskId, type.wireName(), owner);
    CancellationToken cancellation = registry.cancellationToken(taskId);
    try {
      if (cancellation.isCancellationRequested()) {
        LOGGER.info("Skipping job for cancelled task: {}", taskId);
        return;
      }
      registry.update(taskId, TaskUpdate.status(TaskStatus.RUNNING).withMessage("running"));

      String modelId = resolveModel(type, params);
      ProgressTracker progress = new ProgressTracker(taskId, registry);
      progress.report(0.0, "invoking " + modelId);

      FailoverResult<ModelResponse> result =
          failoverExecutor.execute(
              type.modelFamily(),
              modelId,
              cancellation,
              model -> modelClient.invoke(new ModelRequest(model, type, params), progress));

      registry.update(taskId, TaskUpdate.completed(results(result)));
      structuredLogger.logJobProgress(taskId, 100, "completed");

    } catch (TaskCancelledException e) {
      LOGGER.info("Job stopped after cancellation: {}", taskId);
    } catch (RuntimeException e) {
      LOGGER.error("Job failed for task: {}", taskId, e);
      registry.update(taskId, TaskUpdate.failed(e.getMessage()));
    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  private static Map<String, Object> results(FailoverResult<ModelResponse> result) {
    Map<String, Object> results = new LinkedHashMap<>();
    results.put("output", result.value().output());
    results.put("model", result.modelUsed());
    results.put("latency_ms", result.value().latencyMs());
    if (result.failedOver()) {
      results.put("failover_from", result.originalModel());
    }
    return results;
  }
}
