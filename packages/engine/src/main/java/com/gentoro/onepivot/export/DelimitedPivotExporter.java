package com.gentoro.onepivot.export;

import com.gentoro.onepivot.engine.PivotAxis;
import com.gentoro.onepivot.engine.PivotCell;
import com.gentoro.onepivot.engine.PivotHeader;
import com.gentoro.onepivot.engine.PivotResult;
import com.gentoro.onepivot.exception.PivotExportException;
import com.gentoro.onepivot.field.PivotField;
import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * One line per cell: row label, column label, formatted value. Lines follow the row headers, then
 * the column headers, then the measures, all in display order.
 *
 * <p>A label is the formatted header chain from the outermost level down, joined with {@code " /
 * "} ({@code 2024 / Q1}). A subtotal already names the group it closes, so its chain skips that
 * group ({@code 2024 / Q1 Total}). With more than one measure the column label is suffixed with
 * the measure's display name.
 *
 * <p>Fields are quoted only when they contain the separator, a quote or a line break.
 */
public class DelimitedPivotExporter implements PivotExporter {
  static final String[] HEADER_LINE = {"Row", "Column", "Value"};
  static final String MEASURE_LABEL_SEPARATOR = " - ";
  static final String LEVEL_SEPARATOR = " / ";

  private final ExportFormat format;
  private final char separator;

  public DelimitedPivotExporter(ExportFormat format, char separator) {
    this.format = format;
    this.separator = separator;
  }

  public static DelimitedPivotExporter csv() {
    return new DelimitedPivotExporter(ExportFormat.CSV, CSVWriter.DEFAULT_SEPARATOR);
  }

  public static DelimitedPivotExporter tsv() {
    return new DelimitedPivotExporter(ExportFormat.TSV, '\t');
  }

  @Override
  public ExportFormat format() {
    return format;
  }

  @Override
  public <T> byte[] export(PivotResult<T> result, ExportConfiguration configuration) {
    List<PivotField<T>> measures = result.getConfiguration().getDataFields();
    boolean labelMeasures = measures.size() > 1;
    try (StringWriter out = new StringWriter();
        CSVWriter writer =
            new CSVWriter(
                out,
                separator,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {
      if (configuration.isIncludeHeaders()) {
        writer.writeNext(HEADER_LINE, false);
      }
      for (PivotHeader<T> row : result.getRowHeaders()) {
        String rowLabel = label(result.getRowAxis(), row);
        for (PivotHeader<T> column : result.getColumnHeaders()) {
          String baseColumnLabel = label(result.getColumnAxis(), column);
          for (PivotField<T> measure : measures) {
            Optional<PivotCell<T>> cell = result.getCell(row, column, measure);
            if (cell.isEmpty() || !configuration.includes(cell.get())) {
              continue;
            }
            String columnLabel =
                labelMeasures
                    ? baseColumnLabel + MEASURE_LABEL_SEPARATOR + measure.getDisplayName()
                    : baseColumnLabel;
            writer.writeNext(
                new String[] {rowLabel, columnLabel, cell.get().formattedValue()}, false);
          }
        }
      }
      writer.flush();
      return out.toString().getBytes(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PivotExportException("Failed to write " + format + " export", e);
    }
  }

  static <T> String label(PivotAxis<T> axis, PivotHeader<T> header) {
    Deque<String> parts = new ArrayDeque<>();
    parts.push(header.getFormattedValue());
    Optional<PivotHeader<T>> ancestor = axis.parentOf(header);
    if (header.isSubtotal()) {
      ancestor = ancestor.flatMap(axis::parentOf);
    }
    while (ancestor.isPresent()) {
      parts.push(ancestor.get().getFormattedValue());
      ancestor = axis.parentOf(ancestor.get());
    }
    return String.join(LEVEL_SEPARATOR, parts);
  }
}
