package com.scholary.inference.api;

import com.scholary.inference.task.TaskParams;
import com.scholary.inference.task.TaskType;
import jakarta.validation.constraints.NotNull;

/**
 * Request to start a background inference job.
 *
 * <p>{@code params} carries a {@code kind} discriminator: "text", "transcription", "video" or
 * "generic".
 */
public record InferenceJobRequest(@NotNull TaskType type, @NotNull TaskParams params) {}
