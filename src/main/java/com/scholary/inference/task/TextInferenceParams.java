package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Inputs of a text inference job. {@code promptName} selects a server-side prompt template. */
public record TextInferenceParams(
    String model,
    String prompt,
    @JsonProperty("prompt_name") String promptName,
    @JsonProperty("max_tokens") Integer maxTokens,
    Double temperature)
    implements TaskParams {

  public TextInferenceParams {
    if (prompt == null || prompt.isBlank()) {
      throw new IllegalArgumentException("prompt must not be blank");
    }
    if (maxTokens != null && maxTokens <= 0) {
      throw new IllegalArgumentException("max_tokens must be positive");
    }
  }

  @Override
  public Optional<String> requestedModel() {
    return Optional.ofNullable(model).filter(m -> !m.isBlank());
  }

  @Override
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("prompt", prompt);
    if (promptName != null) {
      map.put("prompt_name", promptName);
    }
    if (maxTokens != null) {
      map.put("max_tokens", maxTokens);
    }
    if (temperature != null) {
      map.put("temperature", temperature);
    }
    return map;
  }
}
