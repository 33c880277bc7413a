package com.gentoro.onepivot.exception;

/** Errors while serializing a pivot result. */
public class PivotExportException extends OnePivotException {
  public PivotExportException(String message) {
    super(OnePivotErrorCode.EXPORT_ERROR, message);
  }

  public PivotExportException(String message, Throwable cause) {
    super(OnePivotErrorCode.EXPORT_ERROR, message, cause);
  }
}
