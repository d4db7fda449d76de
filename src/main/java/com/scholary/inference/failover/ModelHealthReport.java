package com.scholary.inference.failover;

import java.util.List;
import java.util.Map;

/** Diagnostic snapshot of the failover tables. */
public record ModelHealthReport(
    Metrics metrics,
    Map<String, ModelStatus.Snapshot> models,
    List<FailoverEvent> recentFailovers) {

  /** Aggregate failover counters since process start. */
  public record Metrics(
      long totalFailovers, long successfulFailovers, long failedFailovers, long modelsRecovered) {}
}
