package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;

/**
 * Aggregated value at the intersection of a row header, a column header and a measure.
 *
 * @param key {@code rowPath|columnPath|measureKey}, unique within one result
 * @param value aggregated value, {@link Value#NULL} when nothing could be aggregated
 * @param formattedValue value rendered through the measure's formatting
 * @param matchedCount records matching both headers
 */
public record PivotCell<T>(
    String key,
    Value value,
    String formattedValue,
    PivotField<T> measure,
    PivotHeader<T> rowHeader,
    PivotHeader<T> columnHeader,
    int matchedCount) {

  static final String KEY_SEPARATOR = "|";

  static <T> String key(PivotHeader<T> row, PivotHeader<T> column, PivotField<T> measure) {
    return row.getPath() + KEY_SEPARATOR + column.getPath() + KEY_SEPARATOR + measure.getKey();
  }

  public boolean isEmpty() {
    return matchedCount == 0 || value.isNull();
  }

  /** Row header is a subtotal or a total. */
  public boolean isRowTotal() {
    return rowHeader.isSubtotal() || rowHeader.isTotal();
  }

  /** Column header is a subtotal or a total. */
  public boolean isColumnTotal() {
    return columnHeader.isSubtotal() || columnHeader.isTotal();
  }

  /** Both headers cover every filtered record. */
  public boolean isGrandTotal() {
    return rowHeader.isTotal() && columnHeader.isTotal();
  }
}
