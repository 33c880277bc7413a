package com.gentoro.onepivot.exception;

/** Raised when the cross-tab would materialize more cells than the configured budget. */
public class PivotSizeLimitException extends OnePivotException {
  public PivotSizeLimitException(long cellUpperBound, int maxCells) {
    super(
        OnePivotErrorCode.SIZE_LIMIT_EXCEEDED,
        "Pivot would produce up to "
            + cellUpperBound
            + " cells, which exceeds the configured maximum of "
            + maxCells);
    withContext("cellUpperBound", cellUpperBound);
    withContext("maxCells", maxCells);
  }
}
