package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Models known to the gateway.
 *
 * @param defaults per family, the model used when a request names none
 * @param alternatives per family, each primary model with its failover alternates
 */
public record ModelCatalogResponse(
    @JsonProperty("default_models") Map<String, String> defaults,
    Map<String, Map<String, List<String>>> alternatives) {}
