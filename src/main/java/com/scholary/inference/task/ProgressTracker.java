package com.scholary.inference.task;

/**
 * Narrow progress callback handed to long-running jobs.
 *
 * <p>Jobs report a fraction in [0, 1]; the tracker rescales it to a percentage and forwards it to
 * the registry, so a job never needs the registry's full API.
 */
public class ProgressTracker {

  private final String taskId;
  private final TaskRegistry registry;

  public ProgressTracker(String taskId, TaskRegistry registry) {
    this.taskId = taskId;
    this.registry = registry;
  }

  public String getTaskId() {
    return taskId;
  }

  /**
   * Report progress.
   *
   * @param fraction completed share of the work, 0.0 to 1.0; values outside are clamped
   * @param description optional human-readable step description, may be null
   */
  public void report(double fraction, String description) {
    double bounded = Math.max(0.0, Math.min(1.0, fraction));
    registry.reportProgress(taskId, (int) Math.round(bounded * 100), description);
  }

  public void report(double fraction) {
    report(fraction, null);
  }
}
