package com.scholary.inference.api;

import com.scholary.inference.cache.ResponseCache;
import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.failover.FailoverManager;
import com.scholary.inference.failover.ModelHealthReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Diagnostics and manual controls for model failover and the response cache. */
@RestController
@Tag(name = "Health", description = "Model health, failover configuration and cache statistics")
public class ModelHealthController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelHealthController.class);

  private final FailoverManager failoverManager;
  private final ResponseCache responseCache;
  private final InferenceProperties properties;

  public ModelHealthController(
      FailoverManager failoverManager,
      ResponseCache responseCache,
      InferenceProperties properties) {
    this.failoverManager = failoverManager;
    this.responseCache = responseCache;
    this.properties = properties;
  }

  @GetMapping("/api/health/models")
  @Operation(summary = "Model health", description = "Failover metrics and per-model status")
  public ModelHealthReport modelHealth() {
    return failoverManager.healthReport();
  }

  @PostMapping("/api/health/models/{modelId}/reset")
  @Operation(summary = "Reset model", description = "Mark a failed model as available again")
  public ResponseEntity<SuccessResponse> resetModel(@PathVariable String modelId) {
    if (!failoverManager.resetModel(modelId)) {
      return ResponseEntity.notFound().build();
    }
    dropCachedResponses();
    return ResponseEntity.ok(new SuccessResponse(true, "Model " + modelId + " reset"));
  }

  @PutMapping("/api/failover/{modelType}/{modelId}")
  @Operation(summary = "Configure failover", description = "Set the alternates of a model")
  public SuccessResponse configureFailover(
      @PathVariable String modelType,
      @PathVariable String modelId,
      @Valid @RequestBody FailoverConfigRequest request) {
    int cooldown =
        request.cooldownSeconds() == null
            ? properties.failover().cooldownSeconds()
            : request.cooldownSeconds();
    failoverManager.configureAlternatives(
        modelType, modelId, request.alternatives(), Duration.ofSeconds(cooldown));
    LOGGER.info("Failover updated via API: type={}, model={}", modelType, modelId);
    dropCachedResponses();
    return new SuccessResponse(true, "Failover configured for " + modelId);
  }

  @GetMapping("/api/health/cache")
  @Operation(summary = "Cache statistics", description = "Response cache counters")
  public CacheStatsResponse cacheStats() {
    return CacheStatsResponse.from(responseCache.stats());
  }

  // Keys are digests, so no prefix selects the catalog alone.
  private void dropCachedResponses() {
    responseCache.invalidate("");
  }
}
