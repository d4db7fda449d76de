package com.scholary.inference.api;

import com.scholary.inference.task.TaskPage;
import java.util.List;
import java.util.stream.Collectors;

/** One page of tasks, newest first. {@code total} counts all matches, not just this page. */
public record TaskListResponse(int total, int limit, int offset, List<TaskStatusResponse> tasks) {

  public static TaskListResponse from(TaskPage page) {
    return new TaskListResponse(
        page.total(),
        page.limit(),
        page.offset(),
        page.tasks().stream().map(TaskStatusResponse::from).collect(Collectors.toList()));
  }
}
