package com.scholary.inference.task;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of one unit of asynchronous work.
 *
 * <p>The registry replaces the stored snapshot on every mutation, so a {@code Task} handed to a
 * caller never changes underneath it.
 *
 * @param startedAt set once, on the pending to running transition; null before that
 * @param completedAt set once, on entry into a terminal state; null before that
 * @param results present only when completed
 * @param error present only when failed
 */
public record Task(
    String id,
    TaskType type,
    TaskStatus status,
    String owner,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    int progress,
    String message,
    TaskParams params,
    Map<String, Object> results,
    String error) {

  public static final String QUEUED_MESSAGE = "queued";
  public static final String CANCELLED_MESSAGE = "cancelled by user";

  public Task {
    results = results == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(results));
  }

  static Task pending(
      String id, TaskType type, String owner, TaskParams params, Instant createdAt) {
    return new Task(
        id,
        type,
        TaskStatus.PENDING,
        owner,
        createdAt,
        null,
        null,
        0,
        QUEUED_MESSAGE,
        params,
        null,
        null);
  }

  /**
   * Apply an update, keeping identity fields and enforcing the lifecycle timestamps.
   *
   * @param update the fields to merge
   * @param now the time of the update
   * @return the new snapshot
   */
  Task apply(TaskUpdate update, Instant now) {
    TaskStatus newStatus = update.status() != null ? update.status() : status;
    Instant newStartedAt = startedAt;
    Instant newCompletedAt = completedAt;

    int newProgress = progress;
    if (update.progress() != null) {
      // progress never moves backwards
      newProgress = Math.max(progress, clampProgress(update.progress()));
    }

    if (newStatus == TaskStatus.RUNNING && newStartedAt == null) {
      newStartedAt = now;
    }
    if (newStatus.isTerminal()) {
      if (newCompletedAt == null) {
        newCompletedAt = now;
      }
      newProgress = 100;
    }

    return new Task(
        id,
        type,
        newStatus,
        owner,
        createdAt,
        newStartedAt,
        newCompletedAt,
        newProgress,
        update.message() != null ? update.message() : message,
        params,
        update.results() != null ? update.results() : results,
        update.error() != null ? update.error() : error);
  }

  Task cancel(Instant now) {
    return new Task(
        id,
        type,
        TaskStatus.CANCELLED,
        owner,
        createdAt,
        startedAt,
        completedAt != null ? completedAt : now,
        100,
        CANCELLED_MESSAGE,
        params,
        results,
        error);
  }

  static int clampProgress(int progress) {
    return Math.max(0, Math.min(100, progress));
  }
}
