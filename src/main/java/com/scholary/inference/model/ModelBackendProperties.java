package com.scholary.inference.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the model-serving backend.
 *
 * <p>Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "model-backend")
@Validated
public record ModelBackendProperties(
    @NotBlank String baseUrl, @Positive int connectTimeout, @Positive int readTimeout) {}
