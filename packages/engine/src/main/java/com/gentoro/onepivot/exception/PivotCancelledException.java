package com.gentoro.onepivot.exception;

/** Raised when a caller cancels a computation through its cancellation token. */
public class PivotCancelledException extends OnePivotException {
  public PivotCancelledException(String message) {
    super(OnePivotErrorCode.CANCELLED, message);
  }
}
