package com.gentoro.onepivot.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PerformanceTrackerTest {

  @Test
  void phasesAndMetrics() {
    PerformanceTracker tracker = new PerformanceTracker();
    tracker.start(PerformanceTracker.PHASE_FILTER);
    tracker.endCurrent(Map.<String, Object>of("records", 4));
    tracker.start(PerformanceTracker.PHASE_HIERARCHY);
    tracker.endCurrent();

    PerformanceTracker.Phase filter = tracker.phases().get(PerformanceTracker.PHASE_FILTER);
    assertTrue(filter.isFinished());
    assertEquals(4, filter.getAttributes().get("records"));
    assertEquals(Duration.ZERO, tracker.elapsed(PerformanceTracker.PHASE_AGGREGATION));

    PerformanceMetrics metrics = tracker.toMetrics(10, 4, 7, false);
    assertEquals(10, metrics.sourceCount());
    assertEquals(4, metrics.filteredCount());
    assertEquals(7, metrics.processedCells());
    assertEquals(metrics.hierarchyTime(), metrics.pivotTime());
    assertFalse(metrics.totalTime().isNegative());
    assertTrue(metrics.memoryUsedBytes() > 0);
    assertNotNull(metrics.measuredAt());
  }

  @Test
  void endWithoutOpenPhaseIsIgnored() {
    PerformanceTracker tracker = new PerformanceTracker();
    assertDoesNotThrow(() -> tracker.endCurrent());
    assertTrue(tracker.phases().isEmpty());
  }
}
