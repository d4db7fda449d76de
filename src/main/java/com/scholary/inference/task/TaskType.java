package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of asynchronous work the gateway tracks.
 *
 * <p>Each type belongs to a model family ("text", "transcription", "video", ...) which selects the
 * failover configuration and the default model used when a request does not name one.
 */
public enum TaskType {
  TEXT_INFERENCE("text-inference", "text"),
  IMAGE_GENERATION("image-generation", "image"),
  EMBEDDING("embedding", "embedding"),
  TRANSCRIPTION_MONOLOGUE("transcription-monologue", "transcription"),
  TRANSCRIPTION_MULTISPEAKER("transcription-multispeaker", "transcription"),
  VIDEO_MANIPULATION("video-manipulation", "video"),
  VIDEO_NONVERBAL("video-nonverbal", "video"),
  BATCH("batch", "text"),
  CHAINED("chained", "text"),
  SYSTEM_FINAL("system-final", "text");

  private final String wireName;
  private final String modelFamily;

  TaskType(String wireName, String modelFamily) {
    this.wireName = wireName;
    this.modelFamily = modelFamily;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public String modelFamily() {
    return modelFamily;
  }

  /**
   * Parse the wire name ("text-inference") or the enum constant name ("TEXT_INFERENCE").
   *
   * @throws IllegalArgumentException if the value names no task type
   */
  @JsonCreator
  public static TaskType fromWire(String value) {
    for (TaskType type : values()) {
      if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown task type: " + value);
  }
}
