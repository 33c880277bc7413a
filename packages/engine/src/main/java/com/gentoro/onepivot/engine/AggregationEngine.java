package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.exception.ExceptionUtil;
import com.gentoro.onepivot.exception.OnePivotErrorCode;
import com.gentoro.onepivot.exception.OnePivotException;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Summarizes a record subset for one measure field.
 *
 * <ul>
 *   <li>{@code COUNT}: size of the subset
 *   <li>{@code SUM}: sum of the numeric-coerced values; null values are skipped, values that do
 *       not convert count as 0 and raise a warning
 *   <li>{@code AVERAGE}: {@code SUM / COUNT}, 0 for an empty subset
 *   <li>{@code MIN} / {@code MAX}: extremum of the values that convert, null when none does
 *   <li>{@code CUSTOM}: the field's own function over the raw records; a failure yields null and
 *       is reported, never propagated
 * </ul>
 *
 * <p>Numeric coercion follows {@link Value#toNumber()}.
 */
public final class AggregationEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(AggregationEngine.class);

  public <T> Value aggregate(List<T> records, PivotField<T> field, AggregationKind kind) {
    return aggregate(records, field, kind, new Diagnostics());
  }

  <T> Value aggregate(
      List<T> records, PivotField<T> field, AggregationKind kind, Diagnostics diagnostics) {
    AggregationKind effective = kind == null ? AggregationKind.SUM : kind;
    if (!field.supports(effective)) {
      log.debug(
          "Aggregation {} is not declared as supported by field {}; computing it anyway",
          effective,
          field.getKey());
    }
    switch (effective) {
      case COUNT:
        return Value.number(records.size());
      case SUM:
        return Value.number(sum(records, field, diagnostics));
      case AVERAGE:
        return records.isEmpty()
            ? Value.number(0)
            : Value.number(sum(records, field, diagnostics) / records.size());
      case MIN:
        return extremum(records, field, diagnostics, true);
      case MAX:
        return extremum(records, field, diagnostics, false);
      case CUSTOM:
        return custom(records, field, diagnostics);
      default:
        throw new IllegalStateException("Unhandled aggregation " + effective);
    }
  }

  private <T> double sum(List<T> records, PivotField<T> field, Diagnostics diagnostics) {
    double total = 0d;
    for (T record : records) {
      Value v = field.valueOf(record);
      if (v.isNull()) {
        continue;
      }
      OptionalDouble n = v.toNumber();
      if (n.isPresent()) {
        total += n.getAsDouble();
      } else {
        reportNonNumeric(field, v, diagnostics, "treated as 0");
      }
    }
    return total;
  }

  private <T> Value extremum(
      List<T> records, PivotField<T> field, Diagnostics diagnostics, boolean min) {
    boolean found = false;
    double best = 0d;
    for (T record : records) {
      Value v = field.valueOf(record);
      if (v.isNull()) {
        continue;
      }
      OptionalDouble n = v.toNumber();
      if (n.isEmpty()) {
        reportNonNumeric(field, v, diagnostics, "ignored");
        continue;
      }
      double d = n.getAsDouble();
      if (!found || (min ? d < best : d > best)) {
        best = d;
        found = true;
      }
    }
    return found ? Value.number(best) : Value.NULL;
  }

  private <T> Value custom(List<T> records, PivotField<T> field, Diagnostics diagnostics) {
    if (field.getCustomAggregation() == null) {
      diagnostics.warning(
          "Field '" + field.getKey() + "' has no custom aggregation function; cell left empty");
      return Value.NULL;
    }
    try {
      return Value.of(field.getCustomAggregation().apply(Collections.unmodifiableList(records)));
    } catch (RuntimeException e) {
      log.warn(
          "Custom aggregation for field {} failed: {}",
          field.getKey(),
          ExceptionUtil.formatCompactStackTrace(e));
      diagnostics.warning(
          "Custom aggregation for field '" + field.getKey() + "' failed; cell left empty");
      OnePivotException failure =
          new OnePivotException(
                  OnePivotErrorCode.AGGREGATION_ERROR,
                  "Custom aggregation for field '"
                      + field.getKey()
                      + "': "
                      + ExceptionUtil.describe(e),
                  e)
              .withContext("field", field.getKey());
      diagnostics.error(ExceptionUtil.toErrorDetails(failure));
      return Value.NULL;
    }
  }

  private static <T> void reportNonNumeric(
      PivotField<T> field, Value value, Diagnostics diagnostics, String outcome) {
    String message =
        "Field '" + field.getKey() + "': value '" + value.asText() + "' is not numeric, " + outcome;
    if (diagnostics.warning(message)) {
      log.warn(message);
    }
  }
}
