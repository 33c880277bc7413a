package com.gentoro.onepivot.field;

/** Order of header groups produced from a dimension field. */
public enum SortDirection {
  ASCENDING,
  DESCENDING,
  /** Keep groups in order of first appearance in the filtered records. */
  NONE
}
