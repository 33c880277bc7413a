package com.gentoro.onepivot.export;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onepivot.Sale;
import com.gentoro.onepivot.config.EngineSettings;
import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.engine.PivotEngine;
import com.gentoro.onepivot.engine.PivotResult;
import com.gentoro.onepivot.exception.PivotExportException;
import com.gentoro.onepivot.exception.UnsupportedExportFormatException;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExportServiceTest {

  private PivotEngine engine;
  private final ExportService exportService = ExportService.withDefaults();

  @BeforeEach
  void setUp() {
    engine = new PivotEngine(EngineSettings.defaults());
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  private PivotResult<Sale> regionResult() {
    List<Sale> sales = List.of(Sale.of("East", 10), Sale.of("East", 20), Sale.of("West", 5));
    return engine.process(
        sales,
        new PivotConfiguration<Sale>()
            .addRowField(Sale.regionField())
            .addDataField(Sale.amountField()));
  }

  private String text(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("CSV: header line, then one line per cell in row-major order")
  void csv() {
    String csv =
        text(exportService.export(regionResult(), ExportConfiguration.of(ExportFormat.CSV)));
    assertEquals("Row,Column,Value\nEast,Total,30\nWest,Total,5\nGrand Total,Total,35\n", csv);
  }

  @Test
  @DisplayName("CSV options: no header line, no grand totals")
  void csvOptions() {
    ExportConfiguration cfg =
        ExportConfiguration.of(ExportFormat.CSV)
            .setIncludeHeaders(false)
            .setIncludeGrandTotals(false);
    assertEquals("East,Total,30\nWest,Total,5\n", text(exportService.export(regionResult(), cfg)));
  }

  @Test
  @DisplayName("nested labels carry their ancestors; subtotals name their own group")
  void nestedLabels() {
    PivotResult<Sale> result =
        engine.process(
            Sale.sample(),
            new PivotConfiguration<Sale>()
                .addRowField(Sale.regionField())
                .addRowField(Sale.productField())
                .addDataField(Sale.amountField()));
    String csv = text(exportService.export(result, ExportConfiguration.of(ExportFormat.CSV)));
    assertEquals(
        "Row,Column,Value\n"
            + "East,Total,35\n"
            + "East / Rice,Total,20\n"
            + "East / Tea,Total,15\n"
            + "East Total,Total,35\n"
            + "West,Total,50\n"
            + "West / Tea,Total,2\n"
            + "West / Wine,Total,48\n"
            + "West Total,Total,50\n"
            + "Grand Total,Total,85\n",
        csv);
  }

  @Test
  @DisplayName("subtotal cells can be left out")
  void withoutSubtotals() {
    PivotResult<Sale> result =
        engine.process(
            Sale.sample(),
            new PivotConfiguration<Sale>()
                .addRowField(Sale.regionField())
                .addRowField(Sale.countryField())
                .addDataField(Sale.amountField()));
    String csv =
        text(
            exportService.export(
                result, ExportConfiguration.of(ExportFormat.CSV).setIncludeSubtotals(false)));
    assertFalse(csv.contains("East Total"), csv);
    assertTrue(csv.contains("Grand Total,Total,85"), csv);
  }

  @Test
  @DisplayName("TSV uses tabs and labels columns per measure when there are several")
  void tsvWithTwoMeasures() {
    PivotField<Sale> count =
        PivotField.<Sale>builder("Count")
            .displayName("Orders")
            .extractor(Sale::amount)
            .asMeasure(AggregationKind.COUNT)
            .build();
    PivotResult<Sale> result =
        engine.process(
            List.of(Sale.of("East", 10)),
            new PivotConfiguration<Sale>()
                .addRowField(Sale.regionField())
                .addDataField(Sale.amountField())
                .addDataField(count)
                .setEnableGrandTotals(false));
    String tsv = text(exportService.export(result, ExportConfiguration.of(ExportFormat.TSV)));
    assertEquals("Row\tColumn\tValue\nEast\tTotal - Amount\t10\nEast\tTotal - Orders\t1\n", tsv);
  }

  @Test
  @DisplayName("JSON carries headers, cells, metrics and diagnostics")
  void json() throws Exception {
    PivotResult<Sale> result = regionResult();
    JsonNode root =
        JacksonUtility.getJsonMapper()
            .readTree(exportService.export(result, ExportConfiguration.of(ExportFormat.JSON)));
    assertEquals(result.getConfiguration().getPivotId(), root.get("pivotId").asText());
    assertEquals(3, root.get("rowHeaders").size());
    assertEquals("East", root.get("rowHeaders").get(0).get("path").asText());
    assertTrue(root.get("rowHeaders").get(2).get("grandTotal").asBoolean());
    assertEquals(1, root.get("columnHeaders").size());
    assertEquals(3, root.get("cells").size());
    assertEquals(35d, root.get("cells").get(2).get("value").asDouble());
    assertEquals("Amount", root.get("configuration").get("dataFields").get(0).get("key").asText());
    assertTrue(root.has("metrics"));
    assertTrue(root.get("warnings").isArray());
  }

  @Test
  @DisplayName("formats without an exporter fail the same way")
  void unsupportedFormats() {
    PivotResult<Sale> result = regionResult();
    for (ExportFormat format :
        List.of(ExportFormat.EXCEL, ExportFormat.PDF, ExportFormat.XML, ExportFormat.HTML)) {
      UnsupportedExportFormatException ex =
          assertThrows(
              UnsupportedExportFormatException.class,
              () -> exportService.export(result, ExportConfiguration.of(format)));
      assertTrue(ex.getMessage().contains(format.name()));
    }
    assertFalse(exportService.isSupported(ExportFormat.EXCEL));
    assertTrue(exportService.isSupported(ExportFormat.JSON));
  }

  @Test
  @DisplayName("exporter failures are wrapped in PivotExportException")
  void exporterFailure() {
    PivotExporter failing = mock(PivotExporter.class);
    when(failing.format()).thenReturn(ExportFormat.XML);
    when(failing.export(any(), any())).thenThrow(new IllegalStateException("disk full"));
    ExportService service = new ExportService().register(failing);

    PivotExportException ex =
        assertThrows(
            PivotExportException.class,
            () -> service.export(regionResult(), ExportConfiguration.of(ExportFormat.XML)));
    assertTrue(ex.getMessage().contains("disk full"));
  }

  @Test
  void fileName() {
    assertEquals(
        "PivotTable_Export.csv", ExportConfiguration.of(ExportFormat.CSV).fullFileName());
    assertEquals(
        "sales.json",
        ExportConfiguration.of(ExportFormat.JSON).setFileName("sales").fullFileName());
  }
}
