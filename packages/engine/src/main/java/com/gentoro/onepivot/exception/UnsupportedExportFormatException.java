package com.gentoro.onepivot.exception;

/** Raised for every export format that has no registered exporter. */
public class UnsupportedExportFormatException extends PivotExportException {
  public UnsupportedExportFormatException(String format) {
    super("Export format " + format + " is not supported");
    withContext("format", format);
  }
}
