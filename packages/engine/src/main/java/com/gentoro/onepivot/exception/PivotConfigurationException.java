package com.gentoro.onepivot.exception;

import java.util.List;

/** Raised when a pivot configuration fails validation; nothing has been computed yet. */
public class PivotConfigurationException extends OnePivotException {
  private final List<String> errors;

  public PivotConfigurationException(List<String> errors) {
    super(
        OnePivotErrorCode.CONFIGURATION_ERROR,
        "Invalid pivot configuration: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
    withContext("errors", this.errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
