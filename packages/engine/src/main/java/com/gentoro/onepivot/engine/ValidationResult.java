package com.gentoro.onepivot.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outcome of validating a pivot configuration. Warnings never make a configuration invalid. */
public final class ValidationResult {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  void addError(String error) {
    errors.add(error);
  }

  void addWarning(String warning) {
    warnings.add(warning);
  }

  @Override
  public String toString() {
    return "ValidationResult{valid=" + isValid() + ", errors=" + errors + ", warnings=" + warnings
        + "}";
  }
}
