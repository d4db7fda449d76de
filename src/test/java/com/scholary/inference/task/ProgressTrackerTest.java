package com.scholary.inference.task;

import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProgressTrackerTest {

  @Mock private TaskRegistry registry;

  @Test
  void report_shouldRescaleFractionToPercent() {
    ProgressTracker tracker = new ProgressTracker("t1", registry);

    tracker.report(0.25, "quarter");

    verify(registry).reportProgress("t1", 25, "quarter");
  }

  @Test
  void report_shouldClampOutOfRangeFractions() {
    ProgressTracker tracker = new ProgressTracker("t1", registry);

    tracker.report(1.7);
    tracker.report(-0.2, "negative");

    verify(registry).reportProgress("t1", 100, null);
    verify(registry).reportProgress("t1", 0, "negative");
  }
}
