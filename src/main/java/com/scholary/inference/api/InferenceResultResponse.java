package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.inference.failover.FailoverResult;
import com.scholary.inference.model.ModelResponse;
import java.util.Map;

/** Result of a synchronous inference call. */
public record InferenceResultResponse(
    String model,
    Map<String, Object> output,
    @JsonProperty("latency_ms") long latencyMs,
    @JsonProperty("failover_from") @JsonInclude(JsonInclude.Include.NON_NULL)
        String failoverFrom) {

  public static InferenceResultResponse from(FailoverResult<ModelResponse> result) {
    return new InferenceResultResponse(
        result.modelUsed(),
        result.value().output(),
        result.value().latencyMs(),
        result.failedOver() ? result.originalModel() : null);
  }
}
