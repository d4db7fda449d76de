package com.scholary.inference.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.inference.config.InferenceProperties;
import com.scholary.inference.failover.FailoverExecutor;
import com.scholary.inference.failover.FailoverManager;
import com.scholary.inference.failover.FailoverResult;
import com.scholary.inference.model.ModelClient;
import com.scholary.inference.model.ModelInvocationException;
import com.scholary.inference.model.ModelRequest;
import com.scholary.inference.model.ModelResponse;
import com.scholary.inference.support.MutableClock;
import com.scholary.inference.support.TestProperties;
import com.scholary.inference.task.GenericParams;
import com.scholary.inference.task.ProgressTracker;
import com.scholary.inference.task.Task;
import com.scholary.inference.task.TaskRegistry;
import com.scholary.inference.task.TaskStatus;
import com.scholary.inference.task.TaskType;
import com.scholary.inference.task.TextInferenceParams;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for InferenceJobService, running jobs inline on the calling thread. */
@ExtendWith(MockitoExtension.class)
class InferenceJobServiceTest {

  @Mock private ModelClient modelClient;

  private MutableClock clock;
  private TaskRegistry registry;
  private InferenceProperties properties;
  private FailoverExecutor failoverExecutor;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpochSeconds(1_700_000_000L);
    registry = new TaskRegistry(60, clock);
    properties =
        TestProperties.withFailover(Map.of("text", Map.of("model-a", List.of("model-b"))));
    failoverExecutor = new FailoverExecutor(new FailoverManager(properties, clock), properties);
  }

  @Test
  void submit_shouldReportProgressAndComplete() {
    InferenceJobService service = service(Runnable::run);
    List<Integer> observed = new ArrayList<>();
    List<TaskStatus> statuses = new ArrayList<>();

    when(modelClient.invoke(any(), any()))
        .thenAnswer(
            invocation -> {
              ProgressTracker progress = invocation.getArgument(1);
              for (double fraction : new double[] {0.25, 0.5, 0.75}) {
                progress.report(fraction, "step");
                Task current = registry.get(progress.getTaskId()).orElseThrow();
                observed.add(current.progress());
                statuses.add(current.status());
              }
              return new ModelResponse("model-a", Map.of("text", "hi"), 12);
            });

    String taskId = service.submit(TaskType.TEXT_INFERENCE, "u1", textParams(null));

    Task task = registry.get(taskId).orElseThrow();
    assertThat(observed).containsExactly(25, 50, 75);
    assertThat(statuses).containsOnly(TaskStatus.RUNNING);
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.progress()).isEqualTo(100);
    assertThat(task.startedAt()).isNotNull();
    assertThat(task.completedAt()).isNotNull();
    assertThat(task.results())
        .containsEntry("model", "model-a")
        .containsEntry("output", Map.of("text", "hi"))
        .doesNotContainKey("failover_from");
  }

  @Test
  void submit_shouldRecordFailoverInResults() {
    InferenceJobService service = service(Runnable::run);
    when(modelClient.invoke(any(), any()))
        .thenAnswer(
            invocation -> {
              ModelRequest request = invocation.getArgument(0);
              if (request.modelId().equals("model-a")) {
                throw new ModelInvocationException("model-a", 503, "overloaded");
              }
              return new ModelResponse(request.modelId(), Map.of("text", "from b"), 3);
            });

    String taskId = service.submit(TaskType.TEXT_INFERENCE, "u1", textParams(null));

    Task task = registry.get(taskId).orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.results())
        .containsEntry("model", "model-b")
        .containsEntry("failover_from", "model-a");
  }

  @Test
  void submit_shouldFailTaskWhenNoModelCanServe() {
    InferenceJobService service = service(Runnable::run);
    when(modelClient.invoke(any(), any()))
        .thenThrow(new ModelInvocationException("model-x", 500, "down"));

    String taskId = service.submit(TaskType.TEXT_INFERENCE, "u1", textParams("model-x"));

    Task task = registry.get(taskId).orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(task.error()).contains("model-x").contains("unavailable");
    assertThat(task.results()).isNull();
  }

  @Test
  void submit_shouldLeaveTaskCancelledWhenCancelledMidFlight() {
    InferenceJobService service = service(Runnable::run);
    when(modelClient.invoke(any(), any()))
        .thenAnswer(
            invocation -> {
              ProgressTracker progress = invocation.getArgument(1);
              registry.cancel(progress.getTaskId());
              return new ModelResponse("model-a", Map.of(), 1);
            });

    String taskId = service.submit(TaskType.TEXT_INFERENCE, "u1", textParams(null));

    Task task = registry.get(taskId).orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.CANCELLED);
    assertThat(task.message()).isEqualTo(Task.CANCELLED_MESSAGE);
    assertThat(task.results()).isNull();
  }

  @Test
  void submit_shouldSkipJobCancelledWhileQueued() {
    List<Runnable> queue = new ArrayList<>();
    InferenceJobService service = service(queue::add);

    String taskId = service.submit(TaskType.TEXT_INFERENCE, "u1", textParams(null));
    registry.cancel(taskId);
    queue.forEach(Runnable::run);

    assertThat(registry.get(taskId).orElseThrow().status()).isEqualTo(TaskStatus.CANCELLED);
    assertThat(registry.get(taskId).orElseThrow().startedAt()).isNull();
    verify(modelClient, never()).invoke(any(), any());
  }

  @Test
  void submit_shouldFailTaskWhenExecutorRejects() {
    InferenceJobService service =
        service(
            runnable -> {
              throw new RejectedExecutionException("full");
            });

    String taskId = service.submit(TaskType.TEXT_INFERENCE, "u1", textParams(null));

    Task task = registry.get(taskId).orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(task.error()).contains("queue is full");
  }

  @Test
  void submit_shouldUseFamilyDefaultModel() {
    InferenceJobService service = service(Runnable::run);
    when(modelClient.invoke(any(), any())).thenReturn(new ModelResponse("video-a", Map.of(), 1));

    service.submit(
        TaskType.VIDEO_NONVERBAL, "u1", new GenericParams(Map.of("media_uri", "s3://clip.mp4")));

    verify(modelClient)
        .invoke(
            argThat(
                request ->
                    request.modelId().equals("video-a")
                        && request.taskType() == TaskType.VIDEO_NONVERBAL),
            any());
  }

  @Test
  void resolveModel_shouldPreferRequestedModel() {
    InferenceJobService service = service(Runnable::run);

    assertThat(service.resolveModel(TaskType.CHAINED, textParams("custom"))).isEqualTo("custom");
    assertThat(service.resolveModel(TaskType.CHAINED, textParams(" "))).isEqualTo("model-a");
    assertThatThrownBy(() -> service.resolveModel(TaskType.IMAGE_GENERATION, textParams(null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("image");
  }

  @Test
  void invokeNow_shouldCallModelWithoutProgressTracker() {
    InferenceJobService service = service(Runnable::run);
    when(modelClient.invoke(any(), any()))
        .thenReturn(new ModelResponse("model-a", Map.of("text", "sync"), 2));

    FailoverResult<ModelResponse> result =
        service.invokeNow(TaskType.TEXT_INFERENCE, textParams(null));

    assertThat(result.modelUsed()).isEqualTo("model-a");
    assertThat(result.value().output()).containsEntry("text", "sync");
    verify(modelClient).invoke(any(), isNull());
    assertThat(registry.size()).isZero();
  }

  private InferenceJobService service(Executor executor) {
    return new InferenceJobService(registry, failoverExecutor, modelClient, properties, executor);
  }

  private static TextInferenceParams textParams(String model) {
    return new TextInferenceParams(model, "Summarise this", null, 128, 0.2);
  }
}
