package com.scholary.inference.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.inference.task.ProgressTracker;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the model-serving backend.
 *
 * <p>Posts {@code {model, task_type, params}} as JSON to {@code {baseUrl}/v1/models/{model}:invoke}
 * and parses the JSON object that comes back. There is no retry here; a failed call is handed to
 * the failover layer, which decides whether another model should be tried.
 */
@Component
public class HttpModelClient implements ModelClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpModelClient.class);
  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  private final HttpClient httpClient;
  private final ModelBackendProperties properties;
  private final ObjectMapper objectMapper;

  public HttpModelClient(ModelBackendProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized model backend client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public ModelResponse invoke(ModelRequest request, ProgressTracker progress) {
    String modelId = request.modelId();
    LOGGER.info("Invoking model: model={}, taskType={}", modelId, request.taskType().wireName());

    long start = System.nanoTime();
    try {
      if (progress != null) {
        progress.report(0.1, "sending request to " + modelId);
      }

      HttpRequest httpRequest =
          HttpRequest.newBuilder()
              .uri(invokeUri(modelId))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .header("Accept", "application/json")
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body(request))))
              .build();

      LOGGER.debug("Sending model request to {}", httpRequest.uri());
      HttpResponse<String> response =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new ModelInvocationException(
            modelId,
            response.statusCode(),
            String.format(
                "Model %s returned status %d: %s",
                modelId, response.statusCode(), response.body()));
      }

      Map<String, Object> output =
          response.body() == null || response.body().isBlank()
              ? Map.of()
              : objectMapper.readValue(response.body(), JSON_OBJECT);
      long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

      if (progress != null) {
        progress.report(0.9, modelId + " responded");
      }
      LOGGER.info("Model call successful: model={}, latency={}ms", modelId, latencyMs);
      return new ModelResponse(modelId, output, latencyMs);

    } catch (IOException e) {
      throw new ModelInvocationException(
          modelId, "Model " + modelId + " call failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModelInvocationException(modelId, "Model " + modelId + " call interrupted", e);
    }
  }

  private URI invokeUri(String modelId) {
    String base = properties.baseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String encoded = URLEncoder.encode(modelId, StandardCharsets.UTF_8);
    return URI.create(base + "/v1/models/" + encoded + ":invoke");
  }

  private Map<String, Object> body(ModelRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", request.modelId());
    body.put("task_type", request.taskType().wireName());
    body.put("params", request.params() == null ? Map.of() : request.params().asMap());
    return body;
  }
}
