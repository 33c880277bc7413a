package com.gentoro.onepivot.exception;

/** Stable error categories reported by the pivot engine. */
public enum OnePivotErrorCode {
  CONFIGURATION_ERROR,
  SIZE_LIMIT_EXCEEDED,
  CANCELLED,
  AGGREGATION_ERROR,
  EXPORT_ERROR,
  UNKNOWN
}
