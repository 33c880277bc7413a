package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.exception.ErrorDetails;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.metrics.PerformanceMetrics;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of one pivot computation. Read-only: renderers and exporters consume it but never
 * change headers or cells.
 *
 * <p>Cells are kept in computation order (row headers, then column headers, then measures), which
 * is also the order exporters write them in.
 */
public final class PivotResult<T> {
  private final PivotConfiguration<T> configuration;
  private final PivotAxis<T> rowAxis;
  private final PivotAxis<T> columnAxis;
  private final Map<String, PivotCell<T>> cells;
  private final int sourceRecordCount;
  private final int filteredRecordCount;
  private final List<String> warnings;
  private final List<ErrorDetails> errors;
  private final Instant generatedAt;
  private final PerformanceMetrics metrics;

  PivotResult(
      PivotConfiguration<T> configuration,
      PivotAxis<T> rowAxis,
      PivotAxis<T> columnAxis,
      Map<String, PivotCell<T>> cells,
      int sourceRecordCount,
      int filteredRecordCount,
      List<String> warnings,
      List<ErrorDetails> errors,
      Instant generatedAt,
      PerformanceMetrics metrics) {
    this.configuration = configuration;
    this.rowAxis = rowAxis;
    this.columnAxis = columnAxis;
    this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    this.sourceRecordCount = sourceRecordCount;
    this.filteredRecordCount = filteredRecordCount;
    this.warnings = List.copyOf(warnings);
    this.errors = List.copyOf(errors);
    this.generatedAt = generatedAt;
    this.metrics = metrics;
  }

  /** Same result with other metrics; used when a cached result is served again. */
  PivotResult<T> withMetrics(PerformanceMetrics metrics) {
    return new PivotResult<>(
        configuration,
        rowAxis,
        columnAxis,
        cells,
        sourceRecordCount,
        filteredRecordCount,
        warnings,
        errors,
        generatedAt,
        metrics);
  }

  /** Snapshot of the configuration the result was computed from. */
  public PivotConfiguration<T> getConfiguration() {
    return configuration;
  }

  public PivotAxis<T> getRowAxis() {
    return rowAxis;
  }

  public PivotAxis<T> getColumnAxis() {
    return columnAxis;
  }

  public List<PivotHeader<T>> getRowHeaders() {
    return rowAxis.headers();
  }

  public List<PivotHeader<T>> getColumnHeaders() {
    return columnAxis.headers();
  }

  public Map<String, PivotCell<T>> getCells() {
    return cells;
  }

  public Collection<PivotCell<T>> cells() {
    return cells.values();
  }

  public Optional<PivotCell<T>> getCell(String key) {
    return Optional.ofNullable(cells.get(key));
  }

  public Optional<PivotCell<T>> getCell(
      PivotHeader<T> row, PivotHeader<T> column, PivotField<T> measure) {
    return getCell(PivotCell.key(row, column, measure));
  }

  /** Cells of the measure with {@code measure}'s key, in computation order. */
  public List<PivotCell<T>> cellsFor(PivotField<T> measure) {
    List<PivotCell<T>> out = new ArrayList<>();
    for (PivotCell<T> cell : cells.values()) {
      if (cell.measure().getKey().equals(measure.getKey())) {
        out.add(cell);
      }
    }
    return out;
  }

  public int getSourceRecordCount() {
    return sourceRecordCount;
  }

  public int getFilteredRecordCount() {
    return filteredRecordCount;
  }

  public Duration getElapsed() {
    return metrics == null ? Duration.ZERO : metrics.totalTime();
  }

  public List<String> getWarnings() {
    return warnings;
  }

  /** Messages of the recovered cell failures, in first-seen order. */
  public List<String> getErrors() {
    return errors.stream().map(ErrorDetails::message).collect(Collectors.toList());
  }

  public List<ErrorDetails> getErrorDetails() {
    return errors;
  }

  public Instant getGeneratedAt() {
    return generatedAt;
  }

  public PerformanceMetrics getMetrics() {
    return metrics;
  }

  @Override
  public String toString() {
    return "PivotResult{"
        + "pivotId="
        + configuration.getPivotId()
        + ", rows="
        + rowAxis.size()
        + ", columns="
        + columnAxis.size()
        + ", cells="
        + cells.size()
        + ", warnings="
        + warnings.size()
        + "}";
  }
}
