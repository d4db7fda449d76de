package com.scholary.inference.api;

import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.failover.FailoverExhaustedException;
import com.scholary.inference.failover.FailoverManager;
import com.scholary.inference.failover.FailoverResult;
import com.scholary.inference.failover.ModelUnavailableException;
import com.scholary.inference.job.InferenceJobService;
import com.scholary.inference.model.ModelInvocationException;
import com.scholary.inference.model.ModelResponse;
import com.scholary.inference.task.TaskType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for model inference.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a background job (returns the task id immediately)
 *   <li>Synchronous text inference with model failover
 *   <li>Listing the configured models
 * </ul>
 */
@RestController
@Tag(name = "Inference", description = "Model inference jobs and calls")
public class InferenceController {

  private static final Logger LOGGER = LoggerFactory.getLogger(InferenceController.class);

  static final String FAILOVER_HEADER = "X-Model-Failover";
  static final String DEFAULT_OWNER = "anonymous";

  private final InferenceJobService jobService;
  private final FailoverManager failoverManager;
  private final InferenceProperties properties;

  public InferenceController(
      InferenceJobService jobService,
      FailoverManager failoverManager,
      InferenceProperties properties) {
    this.jobService = jobService;
    this.failoverManager = failoverManager;
    this.properties = properties;
  }

  @PostMapping("/api/inference/jobs")
  @Operation(
      summary = "Start inference job",
      description = "Start an asynchronous inference job and return the task id for polling")
  public ResponseEntity<?> submitJob(
      @RequestHeader(value = "X-User-Id", defaultValue = DEFAULT_OWNER) String owner,
      @Valid @RequestBody InferenceJobRequest request) {
    try {
      jobService.resolveModel(request.type(), request.params());
      String taskId = jobService.submit(request.type(), owner, request.params());
      LOGGER.info("Submitted {} job: taskId={}", request.type().wireName(), taskId);
      return ResponseEntity.accepted()
          .body(new AsyncJobResponse(taskId, "/api/tasks/" + taskId));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage(), "invalid_request"));
    }
  }

  @PostMapping("/api/inference/text")
  @Operation(
      summary = "Text inference",
      description = "Run a text model synchronously, failing over to an alternate if it is down")
  public ResponseEntity<?> inferText(@Valid @RequestBody TextInferenceRequest request) {
    try {
      FailoverResult<ModelResponse> result =
          jobService.invokeNow(TaskType.TEXT_INFERENCE, request.toParams());

      ResponseEntity.BodyBuilder response = ResponseEntity.ok();
      if (result.failedOver()) {
        response.header(
            FAILOVER_HEADER,
            String.format(
                "Original: %s, Alternative: %s", result.originalModel(), result.modelUsed()));
      }
      return response.body(InferenceResultResponse.from(result));

    } catch (ModelUnavailableException e) {
      LOGGER.warn("Model unavailable: {}", e.getModelId());
      return serviceUnavailable(
          new ErrorResponse(
              e.getMessage(),
              "model_unavailable",
              e.getModelId(),
              null,
              e.getRetryAfterSeconds()));
    } catch (FailoverExhaustedException e) {
      LOGGER.error(
          "Failover exhausted: original={}, alternative={}",
          e.getOriginalModel(),
          e.getAlternativeModel());
      return serviceUnavailable(
          new ErrorResponse(
              e.getMessage(),
              "failover_failed",
              null,
              List.of(e.getOriginalModel(), e.getAlternativeModel()),
              e.getRetryAfterSeconds()));
    } catch (ModelInvocationException e) {
      LOGGER.warn("Model rejected request: status={}", e.getStatusCode());
      HttpStatus status = HttpStatus.resolve(e.getStatusCode());
      return ResponseEntity.status(status == null ? HttpStatus.BAD_GATEWAY : status)
          .body(ErrorResponse.of(e.getMessage(), "model_request_rejected"));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage(), "invalid_request"));
    }
  }

  @GetMapping("/api/inference/models")
  @Operation(summary = "List models", description = "Configured models per family")
  public ModelCatalogResponse listModels() {
    return new ModelCatalogResponse(
        properties.failover().defaultModels(), failoverManager.configuredModels());
  }

  private static ResponseEntity<ErrorResponse> serviceUnavailable(ErrorResponse body) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(body.retryAfter()))
        .body(body);
  }
}
