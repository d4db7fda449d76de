package com.scholary.inference.model;

import java.util.Map;

/**
 * Output of a model call.
 *
 * @param modelId the model that produced the output
 * @param output the backend's result document, opaque to the gateway
 * @param latencyMs wall time of the call
 */
public record ModelResponse(String modelId, Map<String, Object> output, long latencyMs) {

  public ModelResponse {
    output = output == null ? Map.of() : output;
  }
}
