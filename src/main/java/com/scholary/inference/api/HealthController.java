package com.scholary.inference.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health and probe endpoints for load balancers and orchestrators.
 *
 * <p>The gateway is ready while the background job pool can still accept work.
 */
@RestController
@Tag(name = "Health", description = "Gateway health and orchestrator probes")
public class HealthController {

  private static final Logger LOGGER = LoggerFactory.getLogger(HealthController.class);

  private final Executor taskExecutor;
  private final Clock clock;
  private final String version;
  private final Instant startedAt;

  public HealthController(
      @Qualifier("taskExecutor") Executor taskExecutor,
      Clock clock,
      @Value("${inference.version:1.0.0}") String version) {
    this.taskExecutor = taskExecutor;
    this.clock = clock;
    this.version = version;
    this.startedAt = clock.instant();
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health check", description = "Status, version and uptime of the gateway")
  public HealthResponse health() {
    Instant now = clock.instant();
    double uptime = Duration.between(startedAt, now).toMillis() / 1000.0;
    return new HealthResponse("ok", version, now.toEpochMilli() / 1000.0, uptime);
  }

  @GetMapping("/api/health/ping")
  @Operation(summary = "Ping", description = "Check that the gateway responds")
  public PingResponse ping() {
    return new PingResponse("pong");
  }

  @GetMapping("/api/health/ready")
  @Operation(summary = "Readiness probe", description = "503 while the job queue is full")
  public ResponseEntity<ProbeResponse> ready() {
    if (jobQueueFull()) {
      LOGGER.warn("Readiness probe failed: job queue is full");
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(new ProbeResponse("not_ready", "Job queue is full"));
    }
    return ResponseEntity.ok(ProbeResponse.of("ready"));
  }

  @GetMapping("/api/health/live")
  @Operation(summary = "Liveness probe", description = "Check that the gateway process is alive")
  public ProbeResponse live() {
    return ProbeResponse.of("alive");
  }

  private boolean jobQueueFull() {
    if (!(taskExecutor instanceof ThreadPoolTaskExecutor poolExecutor)) {
      return false;
    }
    ThreadPoolExecutor pool = poolExecutor.getThreadPoolExecutor();
    return pool.getActiveCount() >= pool.getMaximumPoolSize()
        && pool.getQueue().remainingCapacity() == 0;
  }
}
