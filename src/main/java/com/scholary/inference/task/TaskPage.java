package com.scholary.inference.task;

import java.util.List;

/** One page of a filtered task listing; {@code total} counts all matches, not just this page. */
public record TaskPage(int total, int limit, int offset, List<Task> tasks) {

  public TaskPage {
    tasks = List.copyOf(tasks);
  }
}
