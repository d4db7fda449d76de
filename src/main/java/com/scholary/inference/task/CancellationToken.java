package com.scholary.inference.task;

/**
 * Cooperative cancellation handle for a background job.
 *
 * <p>Cancelling a task only flips its recorded status; the job has to poll this token between
 * steps to actually stop.
 */
@FunctionalInterface
public interface CancellationToken {

  CancellationToken NONE = () -> false;

  boolean isCancellationRequested();

  /**
   * @throws TaskCancelledException if cancellation was requested
   */
  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new TaskCancelledException("Task was cancelled");
    }
  }
}
