package com.scholary.inference.task;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partial update of a task. Null components are left unchanged.
 *
 * <p>Identity fields (id, owner, creation time) are deliberately absent: they cannot be changed.
 */
public record TaskUpdate(
    TaskStatus status,
    Integer progress,
    String message,
    Map<String, Object> results,
    String error) {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskUpdate.class);

  /** Keys of the boundary form that are dropped without complaint. */
  static final Set<String> IMMUTABLE_FIELDS =
      Set.of("id", "task_id", "owner", "user_id", "created_at", "createdAt");

  public static TaskUpdate empty() {
    return new TaskUpdate(null, null, null, null, null);
  }

  public static TaskUpdate status(TaskStatus status) {
    return empty().withStatus(status);
  }

  public static TaskUpdate progress(int progress, String message) {
    return new TaskUpdate(null, progress, message, null, null);
  }

  public static TaskUpdate completed(Map<String, Object> results) {
    return new TaskUpdate(TaskStatus.COMPLETED, null, "completed", results, null);
  }

  public static TaskUpdate failed(String error) {
    return new TaskUpdate(TaskStatus.FAILED, null, "failed", null, error);
  }

  public TaskUpdate withStatus(TaskStatus status) {
    return new TaskUpdate(status, progress, message, results, error);
  }

  public TaskUpdate withMessage(String message) {
    return new TaskUpdate(status, progress, message, results, error);
  }

  /**
   * Build an update from the loosely typed field map used at the boundary.
   *
   * <p>Identity fields are silently dropped. Unknown keys are ignored.
   *
   * @throws IllegalArgumentException if {@code status} or {@code progress} has an invalid value
   */
  public static TaskUpdate fromFields(Map<String, ?> fields) {
    TaskStatus status = null;
    Integer progress = null;
    String message = null;
    Map<String, Object> results = null;
    String error = null;

    for (Map.Entry<String, ?> field : fields.entrySet()) {
      String key = field.getKey();
      Object value = field.getValue();
      if (IMMUTABLE_FIELDS.contains(key)) {
        LOGGER.debug("Dropping immutable task field from update: {}", key);
        continue;
      }
      switch (key) {
        case "status" -> status = value == null ? null : TaskStatus.fromWire(value.toString());
        case "progress" -> progress = toProgress(value);
        case "message" -> message = value == null ? null : value.toString();
        case "results" -> results = toResults(value);
        case "error" -> error = value == null ? null : value.toString();
        default -> LOGGER.debug("Ignoring unknown task field in update: {}", key);
      }
    }
    return new TaskUpdate(status, progress, message, results, error);
  }

  private static Map<String, Object> toResults(Object value) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("results must be an object");
    }
    Map<String, Object> results = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      results.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return results;
  }

  private static Integer toProgress(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return (int) Math.round(number.doubleValue());
    }
    try {
      return (int) Math.round(Double.parseDouble(value.toString()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("progress must be numeric: " + value, e);
    }
  }
}
