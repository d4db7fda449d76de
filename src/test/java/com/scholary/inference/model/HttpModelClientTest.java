package com.scholary.inference.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.inference.task.ProgressTracker;
import com.scholary.inference.task.TaskType;
import com.scholary.inference.task.TextInferenceParams;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests HttpModelClient against an in-process HTTP server. */
class HttpModelClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AtomicReference<String> requestPath = new AtomicReference<>();
  private final AtomicReference<String> requestBody = new AtomicReference<>();

  private HttpServer server;
  private volatile int responseStatus = 200;
  private volatile String responseBody = "{}";

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/v1/models/",
        exchange -> {
          requestPath.set(exchange.getRequestURI().getPath());
          requestBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().set("Content-Type", "application/json");
          exchange.sendResponseHeaders(responseStatus, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void invoke_shouldPostRequestAndParseOutput() throws IOException {
    responseBody = "{\"text\":\"hello\",\"tokens\":3}";
    ProgressTracker progress = mock(ProgressTracker.class);

    ModelResponse response = client().invoke(request("llama-3-8b-instruct"), progress);

    assertThat(response.modelId()).isEqualTo("llama-3-8b-instruct");
    assertThat(response.output()).containsEntry("text", "hello").containsEntry("tokens", 3);
    assertThat(requestPath.get()).isEqualTo("/v1/models/llama-3-8b-instruct:invoke");

    JsonNode sent = objectMapper.readTree(requestBody.get());
    assertThat(sent.get("model").asText()).isEqualTo("llama-3-8b-instruct");
    assertThat(sent.get("task_type").asText()).isEqualTo("text-inference");
    assertThat(sent.get("params").get("prompt").asText()).isEqualTo("Say hi");
    assertThat(sent.get("params").get("max_tokens").asInt()).isEqualTo(16);

    verify(progress).report(eq(0.1), anyString());
    verify(progress).report(eq(0.9), anyString());
  }

  @Test
  void invoke_shouldTreatServerErrorAsModelFault() {
    responseStatus = 503;
    responseBody = "{\"error\":\"overloaded\"}";

    assertThatThrownBy(() -> client().invoke(request("m1"), null))
        .isInstanceOf(ModelInvocationException.class)
        .satisfies(
            e -> {
              ModelInvocationException failure = (ModelInvocationException) e;
              assertThat(failure.getStatusCode()).isEqualTo(503);
              assertThat(failure.getModelId()).isEqualTo("m1");
              assertThat(failure.isModelFault()).isTrue();
            });
  }

  @Test
  void invoke_shouldNotTreatClientErrorAsModelFault() {
    responseStatus = 422;
    responseBody = "{\"error\":\"bad prompt\"}";

    assertThatThrownBy(() -> client().invoke(request("m1"), null))
        .isInstanceOf(ModelInvocationException.class)
        .satisfies(e -> assertThat(((ModelInvocationException) e).isModelFault()).isFalse());
  }

  @Test
  void invoke_shouldTreatConnectionFailureAsModelFault() {
    int port = server.getAddress().getPort();
    server.stop(0);
    HttpModelClient client =
        new HttpModelClient(
            new ModelBackendProperties("http://127.0.0.1:" + port, 2, 2), objectMapper);

    assertThatThrownBy(() -> client.invoke(request("m1"), null))
        .isInstanceOf(ModelInvocationException.class)
        .satisfies(
            e -> {
              ModelInvocationException failure = (ModelInvocationException) e;
              assertThat(failure.getStatusCode()).isEqualTo(ModelInvocationException.NO_RESPONSE);
              assertThat(failure.isModelFault()).isTrue();
            });
  }

  private HttpModelClient client() {
    String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    return new HttpModelClient(new ModelBackendProperties(baseUrl, 5, 5), objectMapper);
  }

  private static ModelRequest request(String modelId) {
    return new ModelRequest(
        modelId,
        TaskType.TEXT_INFERENCE,
        new TextInferenceParams(modelId, "Say hi", null, 16, null));
  }
}
