package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/** Alternates for one primary model; {@code cooldownSeconds} defaults to the configured base. */
public record FailoverConfigRequest(
    @NotEmpty List<String> alternatives,
    @JsonProperty("cooldown_seconds") @PositiveOrZero Integer cooldownSeconds) {}
