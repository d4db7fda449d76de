package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Orchestrator probe result. {@code reason} is only set when the probe fails. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeResponse(String status, String reason) {

  public static ProbeResponse of(String status) {
    return new ProbeResponse(status, null);
  }
}
