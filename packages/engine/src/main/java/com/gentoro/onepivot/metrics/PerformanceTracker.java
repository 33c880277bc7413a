package com.gentoro.onepivot.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Phase timer for a single pivot computation. One tracker is created per call and never shared,
 * so concurrent computations cannot overwrite each other's numbers.
 */
public class PerformanceTracker {
  public static final String PHASE_FILTER = "filter";
  public static final String PHASE_HIERARCHY = "hierarchy";
  public static final String PHASE_AGGREGATION = "aggregation";

  public static final class Phase {
    private final String name;
    private final long startNanos;
    private long durationNanos = -1;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    Phase(String name) {
      this.name = name;
      this.startNanos = System.nanoTime();
    }

    public String getName() {
      return name;
    }

    public boolean isFinished() {
      return durationNanos >= 0;
    }

    public Duration getDuration() {
      return Duration.ofNanos(Math.max(0, durationNanos));
    }

    public Map<String, Object> getAttributes() {
      return Collections.unmodifiableMap(attributes);
    }
  }

  private final long startNanos = System.nanoTime();
  private final Map<String, Phase> phases = new LinkedHashMap<>();
  private final Deque<Phase> open = new ArrayDeque<>();

  public Phase start(String name) {
    Phase phase = new Phase(name);
    phases.put(name, phase);
    open.push(phase);
    return phase;
  }

  /** Ends the most recently started phase that is still open; no-op when none is. */
  public void endCurrent(Map<String, Object> attributes) {
    Phase phase = open.poll();
    if (phase == null) {
      return;
    }
    phase.durationNanos = System.nanoTime() - phase.startNanos;
    if (attributes != null && !attributes.isEmpty()) {
      phase.attributes.putAll(attributes);
    }
  }

  public void endCurrent() {
    endCurrent(null);
  }

  /** Duration of a finished phase, zero when the phase never ran. */
  public Duration elapsed(String phaseName) {
    Phase phase = phases.get(phaseName);
    return phase == null ? Duration.ZERO : phase.getDuration();
  }

  public Duration totalElapsed() {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  public Map<String, Phase> phases() {
    return Collections.unmodifiableMap(phases);
  }

  public PerformanceMetrics toMetrics(
      int sourceCount, int filteredCount, int processedCells, boolean cacheHit) {
    Duration hierarchy = elapsed(PHASE_HIERARCHY);
    Duration aggregation = elapsed(PHASE_AGGREGATION);
    Runtime runtime = Runtime.getRuntime();
    return new PerformanceMetrics(
        sourceCount,
        filteredCount,
        elapsed(PHASE_FILTER),
        hierarchy,
        aggregation,
        hierarchy.plus(aggregation),
        totalElapsed(),
        processedCells,
        runtime.totalMemory() - runtime.freeMemory(),
        cacheHit,
        Instant.now());
  }
}
