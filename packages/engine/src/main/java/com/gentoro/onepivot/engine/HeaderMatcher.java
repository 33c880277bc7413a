package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.value.Value;
import java.util.BitSet;
import java.util.List;

/**
 * Decides which records a header covers.
 *
 * <p>A group header covers a record when every field-owning header on its ancestor chain, itself
 * included, matches the record's value for that field: by {@link Value} equality, falling back to
 * text equality, while an empty-sentinel group matches null and blank values. A subtotal covers
 * exactly what the group it closes covers; grand-total and axis-total headers cover everything.
 */
final class HeaderMatcher {
  private HeaderMatcher() {}

  static <T> boolean matches(T record, PivotHeader<T> header, PivotAxis<T> axis) {
    if (header.isTotal()) {
      return true;
    }
    PivotHeader<T> current = header.isSubtotal() ? axis.parentOf(header).orElse(null) : header;
    while (current != null) {
      if (current.getField() != null && !matchesGroup(record, current)) {
        return false;
      }
      current = axis.parentOf(current).orElse(null);
    }
    return true;
  }

  /** Compares only this header's own group value, ignoring its ancestors. */
  static <T> boolean matchesGroup(T record, PivotHeader<T> header) {
    Value v = header.getField().valueOf(record);
    if (header.isEmptyGroup()) {
      return v.isBlank();
    }
    if (v.isBlank()) {
      return false;
    }
    return v.equals(header.getValue()) || v.asText().equals(header.getValue().asText());
  }

  /**
   * Record positions covered by every header of the axis, indexed by arena index. Headers are
   * visited in display order, where a parent always precedes its children, so each group only
   * tests the records its parent already covers.
   */
  static <T> BitSet[] matchAll(List<T> records, PivotAxis<T> axis) {
    BitSet all = new BitSet(records.size());
    all.set(0, records.size());
    BitSet[] matches = new BitSet[axis.size()];
    for (PivotHeader<T> header : axis.headers()) {
      if (header.isTotal()) {
        matches[header.getIndex()] = all;
      } else if (header.isSubtotal()) {
        matches[header.getIndex()] = matches[header.getParentIndex()];
      } else {
        BitSet candidates = header.isRoot() ? all : matches[header.getParentIndex()];
        BitSet covered = new BitSet(records.size());
        for (int i = candidates.nextSetBit(0); i >= 0; i = candidates.nextSetBit(i + 1)) {
          if (matchesGroup(records.get(i), header)) {
            covered.set(i);
          }
        }
        matches[header.getIndex()] = covered;
      }
    }
    return matches;
  }
}
