package com.gentoro.onepivot.field;

import com.gentoro.onepivot.value.Value;
import java.util.Map;

/**
 * Input handed to a calculated field's computation: the record being evaluated and the values of
 * the fields it declared as dependencies.
 */
public final class CalculationContext<T> {
  private final T record;
  private final Map<String, PivotField<T>> dependencies;

  CalculationContext(T record, Map<String, PivotField<T>> dependencies) {
    this.record = record;
    this.dependencies = dependencies;
  }

  public T record() {
    return record;
  }

  /** Value of a declared dependency for the current record; {@link Value#NULL} if undeclared. */
  public Value value(String fieldKey) {
    PivotField<T> field = dependencies.get(fieldKey);
    return field == null ? Value.NULL : field.valueOf(record);
  }

  /** Numeric value of a dependency, or {@code 0} when it is absent or not numeric. */
  public double number(String fieldKey) {
    return value(fieldKey).toNumber().orElse(0d);
  }
}
