package com.scholary.inference.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.inference.support.MutableClock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class HealthControllerTest {

  private MutableClock clock;
  private ThreadPoolTaskExecutor executor;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpochSeconds(1_000);
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.initialize();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new HealthController(executor, clock, "2.3.0")).build();
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void health_shouldReportVersionAndUptime() throws Exception {
    clock.advanceSeconds(90);

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.version").value("2.3.0"))
        .andExpect(jsonPath("$.timestamp").value(1090.0))
        .andExpect(jsonPath("$.uptime").value(90.0));
  }

  @Test
  void ping_shouldAnswerPong() throws Exception {
    mockMvc
        .perform(get("/api/health/ping"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ping").value("pong"));
  }

  @Test
  void live_shouldReportAlive() throws Exception {
    mockMvc
        .perform(get("/api/health/live"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("alive"));
  }

  @Test
  void ready_shouldReportReadyWhileQueueHasRoom() throws Exception {
    mockMvc
        .perform(get("/api/health/ready"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ready"))
        .andExpect(jsonPath("$.reason").doesNotExist());
  }

  @Test
  void ready_shouldReturn503WhenJobQueueIsFull() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    executor.execute(
        () -> {
          started.countDown();
          awaitQuietly(release);
        });
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    executor.execute(() -> awaitQuietly(release));

    try {
      mockMvc
          .perform(get("/api/health/ready"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.status").value("not_ready"))
          .andExpect(jsonPath("$.reason").value("Job queue is full"));
    } finally {
      release.countDown();
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
