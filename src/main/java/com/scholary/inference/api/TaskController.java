package com.scholary.inference.api;

import com.scholary.inference.task.TaskPage;
import com.scholary.inference.task.TaskRegistry;
import com.scholary.inference.task.TaskStatus;
import com.scholary.inference.task.TaskType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST API for polling and managing tasks. */
@RestController
@Tag(name = "Tasks", description = "Task status polling and management")
public class TaskController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskController.class);

  private final TaskRegistry taskRegistry;

  public TaskController(TaskRegistry taskRegistry) {
    this.taskRegistry = taskRegistry;
  }

  @GetMapping("/api/tasks/{id}")
  @Operation(summary = "Get task status", description = "Check the status of a task")
  public ResponseEntity<TaskStatusResponse> getTask(@PathVariable String id) {
    return taskRegistry
        .get(id)
        .map(task -> ResponseEntity.ok(TaskStatusResponse.from(task)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/api/tasks")
  @Operation(summary = "List tasks", description = "List tasks newest first, with optional filters")
  public ResponseEntity<?> listTasks(
      @RequestParam(required = false) String owner,
      @RequestParam(required = false) String type,
      @RequestParam(required = false) String status,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    try {
      TaskPage page =
          taskRegistry.list(
              owner,
              type == null ? null : TaskType.fromWire(type),
              status == null ? null : TaskStatus.fromWire(status),
              limit,
              offset);
      return ResponseEntity.ok(TaskListResponse.from(page));
    } catch (IllegalArgumentException e) {
      LOGGER.debug("Rejected task listing: {}", e.getMessage());
      return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage(), "invalid_request"));
    }
  }

  /**
   * Cancel a pending or running task.
   *
   * <p>Cancelling a finished task is not an error: the response reports {@code success: false}.
   */
  @PostMapping("/api/tasks/{id}/cancel")
  @Operation(summary = "Cancel task", description = "Request cancellation of a running task")
  public ResponseEntity<SuccessResponse> cancelTask(@PathVariable String id) {
    return taskRegistry
        .get(id)
        .map(
            task -> {
              if (taskRegistry.cancel(id)) {
                LOGGER.info("Task cancelled: {}", id);
                return ResponseEntity.ok(new SuccessResponse(true, "Task cancelled"));
              }
              String current = taskRegistry.get(id).map(t -> t.status().wireName()).orElse("gone");
              return ResponseEntity.ok(
                  new SuccessResponse(false, "Task cannot be cancelled in status " + current));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/api/tasks/{id}")
  @Operation(summary = "Delete task", description = "Remove a task from the registry")
  public ResponseEntity<SuccessResponse> deleteTask(@PathVariable String id) {
    if (!taskRegistry.delete(id)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(new SuccessResponse(true, "Task deleted"));
  }
}
