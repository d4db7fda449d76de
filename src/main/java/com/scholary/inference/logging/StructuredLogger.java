package com.scholary.inference.logging;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so a JSON log
 * appender can index them. Job threads additionally carry a task context.
 */
public class StructuredLogger {

  private static final List<String> TASK_CONTEXT_KEYS = List.of("taskId", "taskType", "owner");

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log task created event. */
  public void logTaskCreated(String taskId, String type, String owner) {
    Map<String, String> previousContext = saveTaskContext();
    try {
      MDC.put("event_type", "task_created");
      MDC.put("taskId", taskId);
      MDC.put("taskType", type);
      MDC.put("owner", owner);

      logger.info("Task created: id={}, type={}, owner={}", taskId, type, owner);
    } finally {
      clearEventFields();
      restoreTaskContext(previousContext);
    }
  }

  /** Log task status transition event. */
  public void logTaskTransition(String taskId, String from, String to) {
    Map<String, String> previousContext = saveTaskContext();
    try {
      MDC.put("event_type", "task_transition");
      MDC.put("taskId", taskId);
      MDC.put("fromStatus", from);
      MDC.put("toStatus", to);

      logger.info("Task transition: id={}, {} -> {}", taskId, from, to);
    } finally {
      clearEventFields();
      restoreTaskContext(previousContext);
    }
  }

  /** Log rate limit rejection event. */
  public void logRateLimited(String limiter, String identifier, int waitSeconds) {
    try {
      MDC.put("event_type", "rate_limited");
      MDC.put("limiter", limiter);
      MDC.put("waitSeconds", String.valueOf(waitSeconds));

      logger.warn(
          "Rate limit exceeded: limiter={}, identifier={}, retryAfter={}s",
          limiter,
          identifier,
          waitSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log model failure event. */
  public void logModelFailure(String modelId, int failureCount, String message) {
    try {
      MDC.put("event_type", "model_failure");
      MDC.put("modelId", modelId);
      MDC.put("failureCount", String.valueOf(failureCount));

      logger.warn(
          "Model marked as failed: model={}, failures={}, error={}",
          modelId,
          failureCount,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log failover attempt outcome. */
  public void logFailover(String originalModel, String alternativeModel, boolean success) {
    try {
      MDC.put("event_type", "model_failover");
      MDC.put("originalModel", originalModel);
      MDC.put("alternativeModel", alternativeModel);
      MDC.put("success", String.valueOf(success));

      if (success) {
        logger.info("Failover succeeded: {} -> {}", originalModel, alternativeModel);
      } else {
        logger.warn("Failover failed: {} -> {}", originalModel, alternativeModel);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String taskId, int percentComplete, String phase) {
    Map<String, String> previousContext = saveTaskContext();
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("taskId", taskId);
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: taskId={}, phase={}, progress={}%", taskId, phase, percentComplete);
    } finally {
      clearEventFields();
      restoreTaskContext(previousContext);
    }
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskId, String taskType, String owner) {
    MDC.put("taskId", taskId);
    MDC.put("taskType", taskType);
    MDC.put("owner", owner);
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    TASK_CONTEXT_KEYS.forEach(MDC::remove);
  }

  private static Map<String, String> saveTaskContext() {
    Map<String, String> saved = new HashMap<>();
    for (String key : TASK_CONTEXT_KEYS) {
      saved.put(key, MDC.get(key));
    }
    return saved;
  }

  /** Put back the task context a job thread had before an event for another task was logged. */
  private static void restoreTaskContext(Map<String, String> saved) {
    saved.forEach(
        (key, value) -> {
          if (value == null) {
            MDC.remove(key);
          } else {
            MDC.put(key, value);
          }
        });
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("limiter");
    MDC.remove("waitSeconds");
    MDC.remove("modelId");
    MDC.remove("failureCount");
    MDC.remove("originalModel");
    MDC.remove("alternativeModel");
    MDC.remove("success");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
