package com.gentoro.onepivot.metrics;

import java.time.Duration;
import java.time.Instant;

/**
 * Timings and sizes of one {@code process} call. Every result carries its own instance.
 *
 * @param sourceCount records handed to the engine
 * @param filteredCount records left after the filter stage
 * @param filterTime time spent filtering
 * @param hierarchyTime time spent building both header axes
 * @param aggregationTime time spent computing cells
 * @param pivotTime hierarchy plus aggregation
 * @param totalTime wall time of the whole call, cache lookup included
 * @param processedCells cells materialized in the result
 * @param memoryUsedBytes heap in use when the call finished
 * @param cacheHit whether the result was served from the cache
 * @param measuredAt when the call finished
 */
public record PerformanceMetrics(
    int sourceCount,
    int filteredCount,
    Duration filterTime,
    Duration hierarchyTime,
    Duration aggregationTime,
    Duration pivotTime,
    Duration totalTime,
    int processedCells,
    long memoryUsedBytes,
    boolean cacheHit,
    Instant measuredAt) {}
