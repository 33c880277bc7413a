package com.gentoro.onepivot.field;

/** Role of a field in a pivot. */
public enum FieldKind {
  /** Partitions records into header groups. */
  DIMENSION,
  /** Numeric field aggregated into cell values. */
  MEASURE,
  /** Value computed per record from other fields. */
  CALCULATED,
  /** Used only to filter records. */
  FILTER
}
