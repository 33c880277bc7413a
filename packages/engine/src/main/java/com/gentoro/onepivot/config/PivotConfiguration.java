package com.gentoro.onepivot.config;

import com.gentoro.onepivot.field.PivotField;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Declarative description of one pivot: which fields go on rows, columns, data (measures) and
 * filters, plus the totals and resource flags.
 *
 * <p>{@code maxCells} and {@code sizeGuard} are optional; when unset the engine-wide {@link
 * EngineSettings} apply.
 *
 * @param <T> record type
 */
public class PivotConfiguration<T> {
  private String pivotId = UUID.randomUUID().toString();
  private String title = "";

  private List<PivotField<T>> rowFields = new ArrayList<>();
  private List<PivotField<T>> columnFields = new ArrayList<>();
  private List<PivotField<T>> dataFields = new ArrayList<>();
  private List<PivotField<T>> filterFields = new ArrayList<>();

  private boolean enableSubtotals = true;
  private boolean enableGrandTotals = true;
  private boolean enableCaching = true;
  private Integer maxCells;
  private SizeGuardPolicy sizeGuard;

  /** Row, column, data and filter fields, in that order. */
  public List<PivotField<T>> allFields() {
    return Stream.of(rowFields, columnFields, dataFields, filterFields)
        .flatMap(List::stream)
        .collect(Collectors.toList());
  }

  /**
   * Shallow snapshot: new lists holding the same field instances. Results keep a snapshot so a
   * later edit of the live configuration's field lists does not change what a result describes.
   */
  public PivotConfiguration<T> snapshot() {
    PivotConfiguration<T> s = new PivotConfiguration<>();
    s.pivotId = pivotId;
    s.title = title;
    s.rowFields = List.copyOf(rowFields);
    s.columnFields = List.copyOf(columnFields);
    s.dataFields = List.copyOf(dataFields);
    s.filterFields = List.copyOf(filterFields);
    s.enableSubtotals = enableSubtotals;
    s.enableGrandTotals = enableGrandTotals;
    s.enableCaching = enableCaching;
    s.maxCells = maxCells;
    s.sizeGuard = sizeGuard;
    return s;
  }

  public String getPivotId() {
    return pivotId;
  }

  public PivotConfiguration<T> setPivotId(String pivotId) {
    this.pivotId = pivotId;
    return this;
  }

  public String getTitle() {
    return title;
  }

  public PivotConfiguration<T> setTitle(String title) {
    this.title = title;
    return this;
  }

  public List<PivotField<T>> getRowFields() {
    return rowFields;
  }

  public PivotConfiguration<T> setRowFields(List<PivotField<T>> rowFields) {
    this.rowFields = rowFields == null ? new ArrayList<>() : new ArrayList<>(rowFields);
    return this;
  }

  public List<PivotField<T>> getColumnFields() {
    return columnFields;
  }

  public PivotConfiguration<T> setColumnFields(List<PivotField<T>> columnFields) {
    this.columnFields = columnFields == null ? new ArrayList<>() : new ArrayList<>(columnFields);
    return this;
  }

  public List<PivotField<T>> getDataFields() {
    return dataFields;
  }

  public PivotConfiguration<T> setDataFields(List<PivotField<T>> dataFields) {
    this.dataFields = dataFields == null ? new ArrayList<>() : new ArrayList<>(dataFields);
    return this;
  }

  public List<PivotField<T>> getFilterFields() {
    return filterFields;
  }

  public PivotConfiguration<T> setFilterFields(List<PivotField<T>> filterFields) {
    this.filterFields = filterFields == null ? new ArrayList<>() : new ArrayList<>(filterFields);
    return this;
  }

  public PivotConfiguration<T> addRowField(PivotField<T> field) {
    rowFields.add(field);
    return this;
  }

  public PivotConfiguration<T> addColumnField(PivotField<T> field) {
    columnFields.add(field);
    return this;
  }

  public PivotConfiguration<T> addDataField(PivotField<T> field) {
    dataFields.add(field);
    return this;
  }

  public PivotConfiguration<T> addFilterField(PivotField<T> field) {
    filterFields.add(field);
    return this;
  }

  public boolean isEnableSubtotals() {
    return enableSubtotals;
  }

  public PivotConfiguration<T> setEnableSubtotals(boolean enableSubtotals) {
    this.enableSubtotals = enableSubtotals;
    return this;
  }

  public boolean isEnableGrandTotals() {
    return enableGrandTotals;
  }

  public PivotConfiguration<T> setEnableGrandTotals(boolean enableGrandTotals) {
    this.enableGrandTotals = enableGrandTotals;
    return this;
  }

  public boolean isEnableCaching() {
    return enableCaching;
  }

  public PivotConfiguration<T> setEnableCaching(boolean enableCaching) {
    this.enableCaching = enableCaching;
    return this;
  }

  public Integer getMaxCells() {
    return maxCells;
  }

  public PivotConfiguration<T> setMaxCells(Integer maxCells) {
    this.maxCells = maxCells;
    return this;
  }

  public SizeGuardPolicy getSizeGuard() {
    return sizeGuard;
  }

  public PivotConfiguration<T> setSizeGuard(SizeGuardPolicy sizeGuard) {
    this.sizeGuard = sizeGuard;
    return this;
  }

  /** Effective cell budget: this configuration's own, else the engine default. */
  public int effectiveMaxCells(EngineSettings settings) {
    return maxCells != null ? maxCells : settings.defaultMaxCells();
  }

  public SizeGuardPolicy effectiveSizeGuard(EngineSettings settings) {
    return sizeGuard != null ? sizeGuard : settings.sizeGuard();
  }
}
