package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Row or column axis of a pivot: the arena of every header node plus their pre-order flattening.
 *
 * <p>The flattened list is what renderers and the cell calculator iterate; parents always precede
 * their children in it, subtotals close their group and the grand total comes last.
 */
public final class PivotAxis<T> {
  static final String PATH_SEPARATOR = "/";

  private final boolean rowAxis;
  private final List<PivotField<T>> fields;
  private final List<PivotHeader<T>> nodes = new ArrayList<>();
  private final List<Integer> roots = new ArrayList<>();
  private List<PivotHeader<T>> flattened = List.of();

  PivotAxis(boolean rowAxis, List<PivotField<T>> fields) {
    this.rowAxis = rowAxis;
    this.fields = List.copyOf(fields);
  }

  PivotHeader<T> addNode(
      PivotHeader<T> parent,
      Value value,
      String formattedValue,
      PivotField<T> field,
      int level,
      PivotHeader.HeaderKind kind,
      boolean emptyGroup,
      int matchedCount) {
    int index = nodes.size();
    int parentIndex = parent == null ? PivotHeader.NO_PARENT : parent.getIndex();
    String segment = value.asText();
    String path = parent == null ? segment : parent.getPath() + PATH_SEPARATOR + segment;
    PivotHeader<T> header =
        new PivotHeader<>(
            index,
            parentIndex,
            value,
            formattedValue,
            field,
            level,
            kind,
            emptyGroup,
            rowAxis,
            matchedCount,
            path);
    nodes.add(header);
    if (parent == null) {
      roots.add(index);
    } else {
      parent.addChild(index);
    }
    return header;
  }

  /** Pre-order depth-first flattening; call once the tree is complete. */
  void seal() {
    List<PivotHeader<T>> out = new ArrayList<>(nodes.size());
    for (int root : roots) {
      flatten(nodes.get(root), out);
    }
    this.flattened = Collections.unmodifiableList(out);
  }

  private void flatten(PivotHeader<T> header, List<PivotHeader<T>> out) {
    out.add(header);
    for (int child : header.getChildIndices()) {
      flatten(nodes.get(child), out);
    }
  }

  public boolean isRowAxis() {
    return rowAxis;
  }

  /** Fields that built this axis, outermost first. */
  public List<PivotField<T>> getFields() {
    return fields;
  }

  /** Headers in display order. */
  public List<PivotHeader<T>> headers() {
    return flattened;
  }

  public int size() {
    return flattened.size();
  }

  public PivotHeader<T> node(int index) {
    return nodes.get(index);
  }

  public List<PivotHeader<T>> roots() {
    List<PivotHeader<T>> out = new ArrayList<>(roots.size());
    for (int root : roots) {
      out.add(nodes.get(root));
    }
    return out;
  }

  public Optional<PivotHeader<T>> parentOf(PivotHeader<T> header) {
    return header.isRoot()
        ? Optional.empty()
        : Optional.of(nodes.get(header.getParentIndex()));
  }

  public List<PivotHeader<T>> childrenOf(PivotHeader<T> header) {
    List<PivotHeader<T>> out = new ArrayList<>(header.getChildIndices().size());
    for (int child : header.getChildIndices()) {
      out.add(nodes.get(child));
    }
    return out;
  }

  public Optional<PivotHeader<T>> grandTotal() {
    for (int root : roots) {
      if (nodes.get(root).isTotal()) {
        return Optional.of(nodes.get(root));
      }
    }
    return Optional.empty();
  }

  /** Header with the given path, if any. */
  public Optional<PivotHeader<T>> find(String path) {
    for (PivotHeader<T> header : nodes) {
      if (header.getPath().equals(path)) {
        return Optional.of(header);
      }
    }
    return Optional.empty();
  }
}
