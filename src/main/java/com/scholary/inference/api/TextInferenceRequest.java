package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.inference.task.TextInferenceParams;
import jakarta.validation.constraints.NotBlank;

/** Request for a synchronous text inference call. */
public record TextInferenceRequest(
    String model,
    @NotBlank String prompt,
    @JsonProperty("prompt_name") String promptName,
    @JsonProperty("max_tokens") Integer maxTokens,
    Double temperature) {

  public TextInferenceParams toParams() {
    return new TextInferenceParams(model, prompt, promptName, maxTokens, temperature);
  }
}
