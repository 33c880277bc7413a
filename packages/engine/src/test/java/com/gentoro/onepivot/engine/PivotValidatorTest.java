package com.gentoro.onepivot.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onepivot.Sale;
import com.gentoro.onepivot.config.EngineSettings;
import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.FieldKind;
import com.gentoro.onepivot.field.PivotField;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PivotValidatorTest {

  private final EngineSettings settings = EngineSettings.defaults();

  @Test
  @DisplayName("a well-formed configuration is valid")
  void valid() {
    PivotConfiguration<Sale> cfg =
        new PivotConfiguration<Sale>()
            .addRowField(Sale.regionField())
            .addDataField(Sale.amountField());
    ValidationResult result = PivotValidator.validate(cfg, settings);
    assertTrue(result.isValid(), result.toString());
    assertTrue(result.getWarnings().isEmpty());
  }

  @Test
  @DisplayName("null configuration")
  void nullConfiguration() {
    ValidationResult result = PivotValidator.validate(null, settings);
    assertFalse(result.isValid());
    assertEquals(List.of("Configuration cannot be null"), result.getErrors());
  }

  @Test
  @DisplayName("zero measure fields is an error naming the measure requirement")
  void missingMeasure() {
    PivotConfiguration<Sale> cfg = new PivotConfiguration<Sale>().addRowField(Sale.regionField());
    ValidationResult result = PivotValidator.validate(cfg, settings);
    assertFalse(result.isValid());
    assertTrue(result.getErrors().stream().anyMatch(e -> e.contains("measure")));
  }

  @Test
  @DisplayName("a key shared by a row and a filter field is a duplicate-key error")
  void duplicateKeys() {
    PivotConfiguration<Sale> cfg =
        new PivotConfiguration<Sale>()
            .addRowField(Sale.regionField())
            .addFilterField(Sale.regionField())
            .addDataField(Sale.amountField());
    ValidationResult result = PivotValidator.validate(cfg, settings);
    assertFalse(result.isValid());
    assertEquals(List.of("Duplicate field keys found: Region"), result.getErrors());
  }

  @Test
  @DisplayName("missing key, extractor and computation function")
  void fieldErrors() {
    PivotField<Sale> noKey = new PivotField<>("", Sale::region);
    PivotField<Sale> noExtractor = PivotField.<Sale>builder("Country").build();
    PivotField<Sale> noCalculation =
        PivotField.<Sale>builder("Margin").build().setKind(FieldKind.CALCULATED);
    PivotConfiguration<Sale> cfg =
        new PivotConfiguration<Sale>()
            .addRowField(noKey)
            .addColumnField(noExtractor)
            .addFilterField(noCalculation)
            .addDataField(Sale.amountField());
    List<String> errors = PivotValidator.validate(cfg, settings).getErrors();
    assertTrue(errors.contains("All fields must have a key"), errors.toString());
    assertTrue(
        errors.contains("Field Country must have a value extractor or be marked as calculated"));
    assertTrue(errors.contains("Calculated field Margin must have a computation function"));
  }

  @Test
  @DisplayName("calculated fields must not depend on themselves")
  void circularDependency() {
    PivotField<Sale> a = PivotField.<Sale>builder("A").calculated(ctx -> 1).build();
    PivotField<Sale> b =
        PivotField.<Sale>builder("B").calculated(ctx -> ctx.number("A"), a).build();
    a.setCalculation(ctx -> ctx.number("B"), List.of(b));
    PivotConfiguration<Sale> cfg = new PivotConfiguration<Sale>().addRowField(a).addDataField(b);
    List<String> errors = PivotValidator.validate(cfg, settings).getErrors();
    assertTrue(errors.contains("Calculated field A has a circular dependency"), errors.toString());
    assertTrue(errors.contains("Calculated field B has a circular dependency"));
  }

  @Test
  @DisplayName("an estimate above the budget is only a warning")
  void estimateWarning() {
    PivotConfiguration<Sale> cfg =
        new PivotConfiguration<Sale>()
            .addRowField(Sale.regionField())
            .addRowField(Sale.countryField())
            .addColumnField(Sale.productField())
            .addDataField(Sale.amountField())
            .setMaxCells(150);
    assertEquals(200, PivotValidator.estimateCellCount(cfg));
    ValidationResult result = PivotValidator.validate(cfg, settings);
    assertTrue(result.isValid());
    assertEquals(List.of("Estimated cell count (200) exceeds maximum (150)"), result.getWarnings());
  }

  @Test
  @DisplayName("measure aggregation settings that cannot work are warned about")
  void measureWarnings() {
    PivotField<Sale> custom =
        PivotField.<Sale>builder("Custom")
            .extractor(Sale::amount)
            .asMeasure(AggregationKind.CUSTOM)
            .build();
    PivotField<Sale> restricted =
        PivotField.<Sale>builder("Restricted")
            .extractor(Sale::amount)
            .asMeasure(AggregationKind.MAX)
            .aggregations(AggregationKind.SUM)
            .build();
    PivotConfiguration<Sale> cfg =
        new PivotConfiguration<Sale>().addDataField(custom).addDataField(restricted);
    ValidationResult result = PivotValidator.validate(cfg, settings);
    assertTrue(result.isValid());
    assertEquals(2, result.getWarnings().size(), result.getWarnings().toString());
  }
}
