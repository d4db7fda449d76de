package com.scholary.inference.api;

/** Outcome of a task or model management action. */
public record SuccessResponse(boolean success, String message) {}
