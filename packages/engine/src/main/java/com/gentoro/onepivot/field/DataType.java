package com.gentoro.onepivot.field;

/** Data type tag of a field; drives default formatting only. */
public enum DataType {
  TEXT,
  NUMBER,
  CURRENCY,
  PERCENTAGE,
  DATE,
  DATE_TIME,
  BOOLEAN,
  CUSTOM
}
