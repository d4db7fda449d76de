package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.inference.task.Task;
import com.scholary.inference.task.TaskStatus;
import com.scholary.inference.task.TaskType;
import java.time.Instant;
import java.util.Map;

/**
 * Response for task status query.
 *
 * <p>Shows the current state of a task; {@code results} only once completed, {@code error} only
 * once failed.
 */
public record TaskStatusResponse(
    @JsonProperty("task_id") String taskId,
    TaskType type,
    TaskStatus status,
    int progress,
    String message,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> results,
    @JsonInclude(JsonInclude.Include.NON_NULL) String error) {

  public static TaskStatusResponse from(Task task) {
    return new TaskStatusResponse(
        task.id(),
        task.type(),
        task.status(),
        task.progress(),
        task.message(),
        task.createdAt(),
        task.startedAt(),
        task.completedAt(),
        task.results(),
        task.error());
  }
}
