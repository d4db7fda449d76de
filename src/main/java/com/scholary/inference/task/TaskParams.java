package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Map;
import java.util.Optional;

/**
 * Job-specific inputs of a task.
 *
 * <p>One variant per task family. At the HTTP edge the variant is selected by the {@code kind}
 * property, so clients still send a plain JSON object.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TextInferenceParams.class, name = "text"),
  @JsonSubTypes.Type(value = TranscriptionParams.class, name = "transcription"),
  @JsonSubTypes.Type(value = VideoAnalysisParams.class, name = "video"),
  @JsonSubTypes.Type(value = GenericParams.class, name = "generic")
})
public interface TaskParams {

  /** Model requested by the caller, if any. */
  Optional<String> requestedModel();

  /** Flat view used for logging and for passing parameters to the model backend. */
  Map<String, Object> asMap();
}
