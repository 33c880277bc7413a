package com.gentoro.onepivot.export;

import com.gentoro.onepivot.engine.PivotCell;
import com.gentoro.onepivot.engine.PivotHeader;

/**
 * Options of one export call.
 *
 * <p>{@code includeHeaders} controls the header line of delimited formats. {@code
 * includeSubtotals} and {@code includeGrandTotals} drop cells (and, in JSON, headers) belonging
 * to subtotal or grand-total headers. The single header of an axis without fields is not a grand
 * total and is always kept.
 */
public class ExportConfiguration {
  public static final String DEFAULT_FILE_NAME = "PivotTable_Export";

  private String fileName = DEFAULT_FILE_NAME;
  private ExportFormat format = ExportFormat.CSV;
  private boolean includeHeaders = true;
  private boolean includeSubtotals = true;
  private boolean includeGrandTotals = true;

  public static ExportConfiguration of(ExportFormat format) {
    return new ExportConfiguration().setFormat(format);
  }

  public boolean includes(PivotHeader<?> header) {
    if (header.isSubtotal() && !includeSubtotals) {
      return false;
    }
    return !header.isGrandTotal() || includeGrandTotals;
  }

  public boolean includes(PivotCell<?> cell) {
    return includes(cell.rowHeader()) && includes(cell.columnHeader());
  }

  /** File name with the format's extension. */
  public String fullFileName() {
    return fileName + "." + format.getFileExtension();
  }

  public String getFileName() {
    return fileName;
  }

  public ExportConfiguration setFileName(String fileName) {
    this.fileName = fileName;
    return this;
  }

  public ExportFormat getFormat() {
    return format;
  }

  public ExportConfiguration setFormat(ExportFormat format) {
    this.format = format;
    return this;
  }

  public boolean isIncludeHeaders() {
    return includeHeaders;
  }

  public ExportConfiguration setIncludeHeaders(boolean includeHeaders) {
    this.includeHeaders = includeHeaders;
    return this;
  }

  public boolean isIncludeSubtotals() {
    return includeSubtotals;
  }

  public ExportConfiguration setIncludeSubtotals(boolean includeSubtotals) {
    this.includeSubtotals = includeSubtotals;
    return this;
  }

  public boolean isIncludeGrandTotals() {
    return includeGrandTotals;
  }

  public ExportConfiguration setIncludeGrandTotals(boolean includeGrandTotals) {
    this.includeGrandTotals = includeGrandTotals;
    return this;
  }
}
