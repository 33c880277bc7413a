package com.gentoro.onepivot.export;

import com.gentoro.onepivot.engine.PivotResult;
import com.gentoro.onepivot.exception.ExceptionUtil;
import com.gentoro.onepivot.exception.PivotExportException;
import com.gentoro.onepivot.exception.UnsupportedExportFormatException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry of exporters keyed by format.
 *
 * <p>Every format without a registered exporter fails the same way, with {@link
 * UnsupportedExportFormatException}; no format silently falls back to another.
 */
public class ExportService {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(ExportService.class);

  private final Map<ExportFormat, PivotExporter> exporters = new EnumMap<>(ExportFormat.class);

  /** Registry with the CSV, TSV and JSON exporters. */
  public static ExportService withDefaults() {
    return new ExportService()
        .register(DelimitedPivotExporter.csv())
        .register(DelimitedPivotExporter.tsv())
        .register(new JsonPivotExporter());
  }

  /** Registers or replaces the exporter for its format. */
  public ExportService register(PivotExporter exporter) {
    exporters.put(exporter.format(), exporter);
    return this;
  }

  public boolean isSupported(ExportFormat format) {
    return exporters.containsKey(format);
  }

  public Set<ExportFormat> supportedFormats() {
    return Collections.unmodifiableSet(exporters.keySet());
  }

  public <T> byte[] export(PivotResult<T> result, ExportConfiguration configuration) {
    if (result == null) {
      throw new PivotExportException("Nothing to export: result is null");
    }
    ExportConfiguration cfg = configuration == null ? new ExportConfiguration() : configuration;
    ExportFormat format = cfg.getFormat();
    PivotExporter exporter = format == null ? null : exporters.get(format);
    if (exporter == null) {
      throw new UnsupportedExportFormatException(String.valueOf(format));
    }
    try {
      byte[] bytes = exporter.export(result, cfg);
      log.debug(
          "Exported pivot {} as {} ({} bytes)",
          result.getConfiguration().getPivotId(),
          format,
          bytes.length);
      return bytes;
    } catch (PivotExportException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error(
          "Export of pivot {} as {} failed", result.getConfiguration().getPivotId(), format, e);
      throw new PivotExportException(
          "Export as " + format + " failed: " + ExceptionUtil.describe(e), e);
    }
  }
}
