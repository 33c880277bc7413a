package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.config.EngineSettings;
import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.PivotField;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks of a {@link PivotConfiguration} run before any record is touched.
 *
 * <p>Validation never throws: problems are collected into a {@link ValidationResult}. Errors make
 * the configuration unusable ({@link PivotEngine#process} refuses it); warnings are advisory and
 * are copied onto the computed result.
 *
 * <p>Errors:
 *
 * <ul>
 *   <li>missing configuration, or no measure (data) field
 *   <li>a field without a key, or a key used more than once across the four field lists
 *   <li>a non-calculated field without a value extractor
 *   <li>a calculated field without a computation function, or one whose dependencies lead back to
 *       itself
 * </ul>
 *
 * <p>Warnings: the estimated cell count {@code max(1, rows*10) * max(1, columns*10) * measures}
 * exceeds the cell budget, and measure aggregation settings that cannot work as declared.
 */
public final class PivotValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(PivotValidator.class);

  static final int ESTIMATED_GROUPS_PER_FIELD = 10;

  private PivotValidator() {}

  public static <T> ValidationResult validate(
      PivotConfiguration<T> configuration, EngineSettings settings) {
    ValidationResult result = new ValidationResult();
    if (configuration == null) {
      result.addError("Configuration cannot be null");
      return result;
    }
    try {
      if (configuration.getDataFields().isEmpty()) {
        result.addError("At least one measure (data) field must be specified");
      }

      List<PivotField<T>> allFields = configuration.allFields();
      if (allFields.stream().anyMatch(f -> f == null)) {
        result.addError("Field definitions must not be null");
      }
      List<PivotField<T>> fields =
          allFields.stream().filter(f -> f != null).collect(Collectors.toList());

      validateKeys(fields, result);
      for (PivotField<T> field : fields) {
        validateField(field, result);
      }
      for (PivotField<T> measure : configuration.getDataFields()) {
        if (measure != null) {
          validateMeasure(measure, result);
        }
      }

      long estimatedCells = estimateCellCount(configuration);
      int maxCells = configuration.effectiveMaxCells(settings);
      if (estimatedCells > maxCells) {
        result.addWarning(
            String.format(
                Locale.ROOT,
                "Estimated cell count (%,d) exceeds maximum (%,d)", estimatedCells, maxCells));
      }
    } catch (RuntimeException e) {
      log.error("Error validating pivot configuration {}", configuration.getPivotId(), e);
      result.addError("Validation error: " + e.getMessage());
    }
    return result;
  }

  /**
   * Rough size estimate assuming ten groups per axis field. It ignores the data, so it is only
   * used for the advisory warning; the hard budget check runs on the built axes.
   */
  public static long estimateCellCount(PivotConfiguration<?> configuration) {
    long rows = Math.max(1, configuration.getRowFields().size() * ESTIMATED_GROUPS_PER_FIELD);
    long columns = Math.max(1, configuration.getColumnFields().size() * ESTIMATED_GROUPS_PER_FIELD);
    long measures = Math.max(1, configuration.getDataFields().size());
    return rows * columns * measures;
  }

  private static <T> void validateKeys(List<PivotField<T>> fields, ValidationResult result) {
    boolean missingKey = false;
    Map<String, Integer> occurrences = new LinkedHashMap<>();
    for (PivotField<T> field : fields) {
      String key = field.getKey();
      if (key == null || key.isEmpty()) {
        missingKey = true;
        continue;
      }
      occurrences.merge(key, 1, Integer::sum);
    }
    if (missingKey) {
      result.addError("All fields must have a key");
    }
    List<String> duplicates =
        occurrences.entrySet().stream()
            .filter(e -> e.getValue() > 1)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    if (!duplicates.isEmpty()) {
      result.addError("Duplicate field keys found: " + String.join(", ", duplicates));
    }
  }

  private static <T> void validateField(PivotField<T> field, ValidationResult result) {
    if (field.isCalculated()) {
      if (field.getCalculation() == null) {
        result.addError("Calculated field " + field.getKey() + " must have a computation function");
      }
      if (dependsOnItself(field)) {
        result.addError("Calculated field " + field.getKey() + " has a circular dependency");
      }
    } else if (field.getExtractor() == null) {
      result.addError(
          "Field " + field.getKey() + " must have a value extractor or be marked as calculated");
    }
  }

  private static <T> void validateMeasure(PivotField<T> measure, ValidationResult result) {
    AggregationKind aggregation = measure.getDefaultAggregation();
    if (aggregation == null) {
      result.addWarning(
          "Measure field " + measure.getKey() + " has no default aggregation; SUM will be used");
      return;
    }
    if (aggregation == AggregationKind.CUSTOM && measure.getCustomAggregation() == null) {
      result.addWarning(
          "Measure field "
              + measure.getKey()
              + " uses CUSTOM aggregation but defines no custom aggregation function");
    }
    if (!measure.supports(aggregation)) {
      result.addWarning(
          "Measure field "
              + measure.getKey()
              + " defaults to "
              + aggregation
              + ", which is not among its supported aggregations");
    }
  }

  private static <T> boolean dependsOnItself(PivotField<T> field) {
    Set<PivotField<T>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<PivotField<T>> pending = new ArrayDeque<>(field.getDependencies());
    while (!pending.isEmpty()) {
      PivotField<T> next = pending.pop();
      if (next == field) {
        return true;
      }
      if (seen.add(next)) {
        pending.addAll(next.getDependencies());
      }
    }
    return false;
  }
}
