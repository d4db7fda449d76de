package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Error body for failed requests.
 *
 * @param type machine-readable error kind, e.g. "model_unavailable"
 * @param retryAfter seconds the client should wait, mirrored in the Retry-After header
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String detail,
    String type,
    String model,
    List<String> models,
    @JsonProperty("retry_after") Integer retryAfter) {

  public static ErrorResponse of(String detail, String type) {
    return new ErrorResponse(detail, type, null, null, null);
  }
}
