package com.gentoro.onepivot.field;

/** Aggregations a measure field can be summarized with. */
public enum AggregationKind {
  COUNT,
  SUM,
  AVERAGE,
  MIN,
  MAX,
  CUSTOM
}
