package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for a job submission.
 *
 * <p>Returns the task id and the URL to poll for its status.
 */
public record AsyncJobResponse(
    @JsonProperty("task_id") String taskId, @JsonProperty("status_url") String statusUrl) {}
