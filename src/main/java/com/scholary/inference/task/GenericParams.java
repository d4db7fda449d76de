package com.scholary.inference.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Free-form inputs for task types without a dedicated shape (batch, chained, embedding, image
 * generation). A {@code model} entry, if present, is honoured as the requested model.
 *
 * <p>In JSON the entries sit directly next to the {@code kind} discriminator.
 */
public record GenericParams(Map<String, Object> values) implements TaskParams {

  public GenericParams {
    values =
        values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static GenericParams of(Map<String, Object> values) {
    return new GenericParams(values);
  }

  @Override
  public Optional<String> requestedModel() {
    Object model = values.get("model");
    return model instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
  }

  @Override
  public Map<String, Object> asMap() {
    return values;
  }
}
