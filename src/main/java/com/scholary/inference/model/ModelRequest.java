package com.scholary.inference.model;

import com.scholary.inference.task.TaskParams;
import com.scholary.inference.task.TaskType;

/** One call to a model: which model, what kind of work, and its parameters. */
public record ModelRequest(String modelId, TaskType taskType, TaskParams params) {}
