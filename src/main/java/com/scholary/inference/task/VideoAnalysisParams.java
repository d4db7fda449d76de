package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Inputs of a video analysis job (manipulation detection or non-verbal analysis). */
public record VideoAnalysisParams(
    String model,
    @JsonProperty("media_uri") String mediaUri,
    @JsonProperty("sample_frames") Integer sampleFrames,
    @JsonProperty("include_transcript") boolean includeTranscript)
    implements TaskParams {

  public VideoAnalysisParams {
    if (mediaUri == null || mediaUri.isBlank()) {
      throw new IllegalArgumentException("media_uri must not be blank");
    }
    if (sampleFrames != null && sampleFrames <= 0) {
      throw new IllegalArgumentException("sample_frames must be positive");
    }
  }

  @Override
  public Optional<String> requestedModel() {
    return Optional.ofNullable(model).filter(m -> !m.isBlank());
  }

  @Override
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("media_uri", mediaUri);
    if (sampleFrames != null) {
      map.put("sample_frames", sampleFrames);
    }
    map.put("include_transcript", includeTranscript);
    return map;
  }
}
