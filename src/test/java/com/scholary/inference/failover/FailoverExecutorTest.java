package com.scholary.inference.failover;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.inference.model.ModelInvocationException;
import com.scholary.inference.task.TaskCancelledException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FailoverExecutorTest {

  @Mock private FailoverManager failoverManager;

  private FailoverExecutor executor;
  private final List<String> calledModels = new ArrayList<>();

  @BeforeEach
  void setUp() {
    executor = new FailoverExecutor(failoverManager, 300, 600);
  }

  @Test
  void execute_shouldReturnPrimaryResultWhenHealthy() {
    FailoverResult<String> result = executor.execute("text", "A", model -> "ok from " + model);

    assertThat(result.value()).isEqualTo("ok from A");
    assertThat(result.failedOver()).isFalse();
    verify(failoverManager).markSuccess("A");
    verify(failoverManager, never()).getAlternative(anyString(), anyString());
  }

  @Test
  void execute_shouldFailOverToAlternate() {
    when(failoverManager.getAlternative("text", "A")).thenReturn(Optional.of("B"));

    FailoverResult<String> result =
        executor.execute("text", "A", model -> call(model, "A", 503));

    assertThat(result.value()).isEqualTo("ok from B");
    assertThat(result.modelUsed()).isEqualTo("B");
    assertThat(result.originalModel()).isEqualTo("A");
    assertThat(result.failedOver()).isTrue();
    assertThat(calledModels).containsExactly("A", "B");
    verify(failoverManager).markFailure(eq("A"), anyString());
    verify(failoverManager).markSuccess("B");
    verify(failoverManager).recordFailoverEvent("A", "B", true, null);
  }

  @Test
  void execute_shouldRaiseUnavailableWithoutAlternate() {
    when(failoverManager.getAlternative("text", "A")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> executor.execute("text", "A", model -> call(model, "A", 500)))
        .isInstanceOf(ModelUnavailableException.class)
        .satisfies(
            e -> {
              ModelUnavailableException unavailable = (ModelUnavailableException) e;
              assertThat(unavailable.getModelId()).isEqualTo("A");
              assertThat(unavailable.getModelType()).isEqualTo("text");
              assertThat(unavailable.getRetryAfterSeconds()).isEqualTo(300);
            });
    verify(failoverManager).markFailure(eq("A"), anyString());
  }

  @Test
  void execute_shouldRaiseExhaustedWhenAlternateAlsoFails() {
    when(failoverManager.getAlternative("text", "A")).thenReturn(Optional.of("B"));

    assertThatThrownBy(
            () ->
                executor.execute(
                    "text",
                    "A",
                    model -> {
                      calledModels.add(model);
                      throw new ModelInvocationException(model, "connection refused", null);
                    }))
        .isInstanceOf(FailoverExhaustedException.class)
        .satisfies(
            e -> {
              FailoverExhaustedException exhausted = (FailoverExhaustedException) e;
              assertThat(exhausted.getOriginalModel()).isEqualTo("A");
              assertThat(exhausted.getAlternativeModel()).isEqualTo("B");
              assertThat(exhausted.getRetryAfterSeconds()).isEqualTo(600);
              assertThat(exhausted.getMessage()).contains("A").contains("B");
            });
    assertThat(calledModels).containsExactly("A", "B");
    verify(failoverManager).markFailure(eq("B"), anyString());
    verify(failoverManager).recordFailoverEvent(eq("A"), eq("B"), eq(false), anyString());
  }

  @Test
  void execute_shouldNotFailOverOnClientError() {
    assertThatThrownBy(() -> executor.execute("text", "A", model -> call(model, "A", 400)))
        .isInstanceOf(ModelInvocationException.class);

    verify(failoverManager, never()).markFailure(anyString(), any());
    verify(failoverManager, never()).getAlternative(anyString(), anyString());
  }

  @Test
  void execute_shouldStopBeforeCallingWhenCancelled() {
    assertThatThrownBy(() -> executor.execute("text", "A", () -> true, model -> call(model, "", 0)))
        .isInstanceOf(TaskCancelledException.class);

    assertThat(calledModels).isEmpty();
  }

  /** Fails with {@code status} when called with {@code failing}, succeeds otherwise. */
  private String call(String model, String failing, int status) {
    calledModels.add(model);
    if (model.equals(failing)) {
      throw new ModelInvocationException(model, status, "status " + status);
    }
    return "ok from " + model;
  }
}
