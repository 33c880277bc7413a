package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.field.SortDirection;
import com.gentoro.onepivot.value.Value;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the header tree of one axis by grouping records level by level.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>An axis without fields gets a single {@code Total} header covering every record.
 *   <li>Otherwise records are grouped by the value of the field at each level. Null and blank
 *       values share one group keyed by the empty sentinel. Values with the same text (a number
 *       {@code 1} and the text {@code "1"}) share a group whose key is the first value seen, the
 *       same equivalence {@link HeaderMatcher} applies. Groups are ordered by key according to
 *       the field's {@link SortDirection}, so the result is deterministic for identical input.
 *   <li>Bottom-up, every group that has children, is above the deepest level and whose field
 *       shows subtotals receives a subtotal header as its last child.
 *   <li>When any axis field shows a grand total, a {@code Grand Total} root is appended.
 *   <li>The tree is flattened pre-order.
 * </ol>
 */
final class HierarchyBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(HierarchyBuilder.class);

  static final String AXIS_TOTAL_LABEL = "Total";
  static final String GRAND_TOTAL_LABEL = "Grand Total";
  static final String SUBTOTAL_SUFFIX = " Total";

  private static final Comparator<Group<?>> ASCENDING =
      Comparator.<Group<?>, Value>comparing(g -> g.key().value())
          .thenComparing(g -> g.key().empty());

  private final String emptyText;

  HierarchyBuilder(String emptyText) {
    this.emptyText = emptyText;
  }

  /** Distinct group identity: the sentinel group never merges with a real value equal to it. */
  private record GroupKey(Value value, boolean empty) {}

  /** Records of one group; {@code key} holds the representative value. */
  private record Group<T>(GroupKey key, List<T> records) {}

  <T> PivotAxis<T> build(
      List<T> records,
      List<PivotField<T>> fields,
      boolean rowAxis,
      boolean subtotalsEnabled,
      boolean grandTotalsEnabled,
      CancellationToken token) {
    PivotAxis<T> axis = new PivotAxis<>(rowAxis, fields);
    if (fields.isEmpty()) {
      axis.addNode(
          null,
          Value.text(AXIS_TOTAL_LABEL),
          AXIS_TOTAL_LABEL,
          null,
          0,
          PivotHeader.HeaderKind.AXIS_TOTAL,
          false,
          records.size());
      axis.seal();
      return axis;
    }

    buildLevel(axis, records, fields, 0, null, token);

    if (subtotalsEnabled) {
      for (PivotHeader<T> root : axis.roots()) {
        addSubtotals(axis, root, fields.size());
      }
    }

    if (grandTotalsEnabled && fields.stream().anyMatch(PivotField::isShowGrandTotal)) {
      axis.addNode(
          null,
          Value.text(GRAND_TOTAL_LABEL),
          GRAND_TOTAL_LABEL,
          null,
          0,
          PivotHeader.HeaderKind.GRAND_TOTAL,
          false,
          records.size());
    }

    axis.seal();
    log.debug(
        "Built {} axis with {} headers from {} records",
        rowAxis ? "row" : "column",
        axis.size(),
        records.size());
    return axis;
  }

  private <T> void buildLevel(
      PivotAxis<T> axis,
      List<T> records,
      List<PivotField<T>> fields,
      int level,
      PivotHeader<T> parent,
      CancellationToken token) {
    token.throwIfCancellationRequested("hierarchy level " + level);
    if (records.isEmpty()) {
      return;
    }
    PivotField<T> field = fields.get(level);

    // keyed by text so values the matcher treats as equal never split into two headers
    Group<T> empty = null;
    Map<String, Group<T>> groups = new LinkedHashMap<>();
    List<Group<T>> ordered = new ArrayList<>();
    for (T record : records) {
      Value v = field.valueOf(record);
      Group<T> group;
      if (v.isBlank()) {
        if (empty == null) {
          empty = new Group<>(new GroupKey(Value.text(emptyText), true), new ArrayList<>());
          ordered.add(empty);
        }
        group = empty;
      } else {
        group = groups.get(v.asText());
        if (group == null) {
          group = new Group<>(new GroupKey(v, false), new ArrayList<>());
          groups.put(v.asText(), group);
          ordered.add(group);
        }
      }
      group.records().add(record);
    }

    switch (field.getSortDirection()) {
      case ASCENDING -> ordered.sort(ASCENDING);
      case DESCENDING -> ordered.sort(ASCENDING.reversed());
      case NONE -> {
        // first-appearance order
      }
    }

    for (Group<T> group : ordered) {
      GroupKey key = group.key();
      String formatted = key.empty() ? field.format(Value.NULL) : field.format(key.value());
      PivotHeader<T> header =
          axis.addNode(
              parent,
              key.value(),
              formatted,
              field,
              level,
              PivotHeader.HeaderKind.GROUP,
              key.empty(),
              group.records().size());
      if (level < fields.size() - 1) {
        buildLevel(axis, group.records(), fields, level + 1, header, token);
      }
    }
  }

  private <T> void addSubtotals(PivotAxis<T> axis, PivotHeader<T> header, int fieldCount) {
    // children captured before this header's own subtotal is appended
    for (PivotHeader<T> child : axis.childrenOf(header)) {
      addSubtotals(axis, child, fieldCount);
    }
    if (header.hasChildren()
        && header.getLevel() < fieldCount - 1
        && header.getField() != null
        && header.getField().isShowSubtotals()) {
      axis.addNode(
          header,
          Value.text(header.getValue().asText() + SUBTOTAL_SUFFIX),
          header.getFormattedValue() + SUBTOTAL_SUFFIX,
          header.getField(),
          header.getLevel() + 1,
          PivotHeader.HeaderKind.SUBTOTAL,
          false,
          header.getMatchedCount());
    }
  }
}
