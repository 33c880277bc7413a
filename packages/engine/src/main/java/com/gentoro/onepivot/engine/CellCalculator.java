package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills the sparse cell map: for each row header, then each column header, then each measure,
 * aggregates the records covered by both headers.
 *
 * <p>A pair whose record subset is empty is skipped unless one of the two headers is a subtotal
 * or a total, so total rows and columns are always materialized.
 */
final class CellCalculator {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(CellCalculator.class);

  private final AggregationEngine aggregationEngine;

  CellCalculator(AggregationEngine aggregationEngine) {
    this.aggregationEngine = aggregationEngine;
  }

  <T> Map<String, PivotCell<T>> calculate(
      List<T> records,
      PivotAxis<T> rows,
      PivotAxis<T> columns,
      List<PivotField<T>> measures,
      CancellationToken token,
      Diagnostics diagnostics) {
    BitSet[] rowMatches = HeaderMatcher.matchAll(records, rows);
    BitSet[] columnMatches = HeaderMatcher.matchAll(records, columns);

    Map<String, PivotCell<T>> cells = new LinkedHashMap<>();
    for (PivotHeader<T> row : rows.headers()) {
      for (PivotHeader<T> column : columns.headers()) {
        BitSet both = (BitSet) rowMatches[row.getIndex()].clone();
        both.and(columnMatches[column.getIndex()]);
        if (both.isEmpty() && !summarizes(row) && !summarizes(column)) {
          continue;
        }
        List<T> subset = select(records, both);
        for (PivotField<T> measure : measures) {
          token.throwIfCancellationRequested("cell computation");
          Value value =
              aggregationEngine.aggregate(
                  subset, measure, measure.getDefaultAggregation(), diagnostics);
          String key = PivotCell.key(row, column, measure);
          PivotCell<T> previous =
              cells.put(
                  key,
                  new PivotCell<>(
                      key,
                      value,
                      measure.format(value),
                      measure,
                      row,
                      column,
                      subset.size()));
          if (previous != null) {
            diagnostics.warning("Cell key " + key + " is not unique; an earlier cell was replaced");
          }
        }
      }
    }
    log.debug(
        "Computed {} cells for {} row and {} column headers",
        cells.size(),
        rows.size(),
        columns.size());
    return cells;
  }

  private static boolean summarizes(PivotHeader<?> header) {
    return header.isSubtotal() || header.isTotal();
  }

  private static <T> List<T> select(List<T> records, BitSet positions) {
    List<T> subset = new ArrayList<>(positions.cardinality());
    for (int i = positions.nextSetBit(0); i >= 0; i = positions.nextSetBit(i + 1)) {
      subset.add(records.get(i));
    }
    return subset;
  }
}
