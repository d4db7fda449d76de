package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of a task. Completed, failed and cancelled are terminal. */
public enum TaskStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean isActive() {
    return this == PENDING || this == RUNNING;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a status from its wire form, case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no status
   */
  @JsonCreator
  public static TaskStatus fromWire(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Task status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown task status: " + value, e);
    }
  }
}
