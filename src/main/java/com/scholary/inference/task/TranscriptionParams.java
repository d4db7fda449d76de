package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inputs of a transcription job.
 *
 * <p>The speaker bounds only matter for multi-speaker transcription (diarization).
 */
public record TranscriptionParams(
    String model,
    @JsonProperty("media_uri") String mediaUri,
    String language,
    @JsonProperty("min_speakers") Integer minSpeakers,
    @JsonProperty("max_speakers") Integer maxSpeakers)
    implements TaskParams {

  public TranscriptionParams {
    if (mediaUri == null || mediaUri.isBlank()) {
      throw new IllegalArgumentException("media_uri must not be blank");
    }
    if (minSpeakers != null && maxSpeakers != null && minSpeakers > maxSpeakers) {
      throw new IllegalArgumentException("min_speakers must be <= max_speakers");
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
    if (language != null) {
      map.put("language", language);
    }
    if (minSpeakers != null) {
      map.put("min_speakers", minSpeakers);
    }
    if (maxSpeakers != null) {
      map.put("max_speakers", maxSpeakers);
    }
    return map;
  }
}
