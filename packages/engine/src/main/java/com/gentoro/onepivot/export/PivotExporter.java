package com.gentoro.onepivot.export;

import com.gentoro.onepivot.engine.PivotResult;

/** Serializes a {@link PivotResult} into one {@link ExportFormat}. */
public interface PivotExporter {

  ExportFormat format();

  /**
   * @throws com.gentoro.onepivot.exception.PivotExportException when serialization fails
   */
  <T> byte[] export(PivotResult<T> result, ExportConfiguration configuration);
}
