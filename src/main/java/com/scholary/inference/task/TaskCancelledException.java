package com.scholary.inference.task;

/** Thrown inside a background job when it observes that its task was cancelled. */
public class TaskCancelledException extends RuntimeException {

  public TaskCancelledException(String message) {
    super(message);
  }
}
