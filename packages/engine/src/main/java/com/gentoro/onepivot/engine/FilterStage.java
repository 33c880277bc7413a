package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.apache.commons.lang3.StringUtils;

/**
 * Reduces source records with the include, exclude and search filters set on the configuration's
 * fields.
 *
 * <p>Filter fields are applied first, then row and column fields (a dimension can carry its own
 * value filter). Measures are never used as filters, and fields with filtering disabled are
 * skipped. Within a field the three filters compose as AND, and so do fields.
 */
public final class FilterStage {
  private FilterStage() {}

  /** Fields whose filter state participates, in application order. */
  public static <T> List<PivotField<T>> filterCapableFields(PivotConfiguration<T> configuration) {
    Set<PivotField<T>> fields = new LinkedHashSet<>();
    fields.addAll(configuration.getFilterFields());
    fields.addAll(configuration.getRowFields());
    fields.addAll(configuration.getColumnFields());
    fields.removeIf(f -> f == null || !f.isAllowFiltering());
    return new ArrayList<>(fields);
  }

  /** Returns a new list; {@code source} is never modified. */
  public static <T> List<T> apply(List<T> source, List<PivotField<T>> fields) {
    Predicate<T> keep = record -> true;
    for (PivotField<T> field : fields) {
      if (field.hasFilter()) {
        keep = keep.and(predicateFor(field));
      }
    }
    List<T> filtered = new ArrayList<>(source.size());
    for (T record : source) {
      if (keep.test(record)) {
        filtered.add(record);
      }
    }
    return filtered;
  }

  static <T> Predicate<T> predicateFor(PivotField<T> field) {
    Predicate<T> predicate = record -> true;
    if (!field.getIncludeValues().isEmpty()) {
      Set<Value> included = toValues(field.getIncludeValues());
      predicate = predicate.and(record -> included.contains(field.valueOf(record)));
    }
    if (!field.getExcludeValues().isEmpty()) {
      Set<Value> excluded = toValues(field.getExcludeValues());
      predicate = predicate.and(record -> !excluded.contains(field.valueOf(record)));
    }
    String search = field.getSearchFilter();
    if (search != null && !search.isEmpty()) {
      predicate =
          predicate.and(
              record -> StringUtils.containsIgnoreCase(field.valueOf(record).asText(), search));
    }
    return predicate;
  }

  private static Set<Value> toValues(List<Object> raw) {
    Set<Value> values = new LinkedHashSet<>();
    for (Object o : raw) {
      values.add(Value.of(o));
    }
    return values;
  }
}
