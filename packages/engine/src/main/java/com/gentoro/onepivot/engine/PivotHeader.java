package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row or column header of a pivot.
 *
 * <p>Headers live in the node arena of their {@link PivotAxis}; the parent and children are held
 * as arena indices, never as object references, so a header tree has no ownership cycles. Use
 * {@link PivotAxis#parentOf(PivotHeader)} and {@link PivotAxis#childrenOf(PivotHeader)} to
 * navigate.
 *
 * <p>Kinds of header:
 *
 * <ul>
 *   <li>group header: one distinct value of {@link #getField()} at {@link #getLevel()}
 *   <li>subtotal ({@link #isSubtotal()}): last child of a group, summarizing that group
 *   <li>grand total ({@link #isGrandTotal()}): last root, covering every filtered record
 *   <li>axis total ({@link #isAxisTotal()}): the single header of an axis without fields
 * </ul>
 */
public final class PivotHeader<T> {
  public static final int NO_PARENT = -1;

  private final int index;
  private final int parentIndex;
  private final Value value;
  private final String formattedValue;
  private final PivotField<T> field;
  private final int level;
  private final boolean subtotal;
  private final boolean grandTotal;
  private final boolean axisTotal;
  private final boolean emptyGroup;
  private final boolean rowAxis;
  private final int matchedCount;
  private final String path;
  private final List<Integer> children = new ArrayList<>();

  PivotHeader(
      int index,
      int parentIndex,
      Value value,
      String formattedValue,
      PivotField<T> field,
      int level,
      HeaderKind kind,
      boolean emptyGroup,
      boolean rowAxis,
      int matchedCount,
      String path) {
    this.index = index;
    this.parentIndex = parentIndex;
    this.value = value;
    this.formattedValue = formattedValue;
    this.field = field;
    this.level = level;
    this.subtotal = kind == HeaderKind.SUBTOTAL;
    this.grandTotal = kind == HeaderKind.GRAND_TOTAL;
    this.axisTotal = kind == HeaderKind.AXIS_TOTAL;
    this.emptyGroup = emptyGroup;
    this.rowAxis = rowAxis;
    this.matchedCount = matchedCount;
    this.path = path;
  }

  enum HeaderKind {
    GROUP,
    SUBTOTAL,
    GRAND_TOTAL,
    AXIS_TOTAL
  }

  void addChild(int childIndex) {
    children.add(childIndex);
  }

  public int getIndex() {
    return index;
  }

  /** Arena index of the parent, or {@link #NO_PARENT} for root headers. */
  public int getParentIndex() {
    return parentIndex;
  }

  public boolean isRoot() {
    return parentIndex == NO_PARENT;
  }

  public Value getValue() {
    return value;
  }

  public String getFormattedValue() {
    return formattedValue;
  }

  /** Owning field; {@code null} for grand-total and axis-total headers. */
  public PivotField<T> getField() {
    return field;
  }

  public int getLevel() {
    return level;
  }

  public boolean isSubtotal() {
    return subtotal;
  }

  public boolean isGrandTotal() {
    return grandTotal;
  }

  public boolean isAxisTotal() {
    return axisTotal;
  }

  /** Grand total or axis total: matches every record. */
  public boolean isTotal() {
    return grandTotal || axisTotal;
  }

  /** True for the group collecting null and blank values under the empty sentinel. */
  public boolean isEmptyGroup() {
    return emptyGroup;
  }

  public boolean isRowAxis() {
    return rowAxis;
  }

  public int getMatchedCount() {
    return matchedCount;
  }

  /** Values from the root down to this header joined with {@code /}, unique within the axis. */
  public String getPath() {
    return path;
  }

  public List<Integer> getChildIndices() {
    return Collections.unmodifiableList(children);
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  @Override
  public String toString() {
    return "PivotHeader{" + path + ", level=" + level + ", count=" + matchedCount + "}";
  }
}
