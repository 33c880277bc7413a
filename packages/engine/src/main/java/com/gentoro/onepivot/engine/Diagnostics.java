package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.exception.ErrorDetails;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the recoverable problems of one computation. Duplicate messages are kept once, in
 * first-seen order, so a bad value repeated over thousands of cells yields a single warning.
 */
final class Diagnostics {
  private final Set<String> warnings = new LinkedHashSet<>();
  private final Map<String, ErrorDetails> errors = new LinkedHashMap<>();

  /** Returns true the first time a message is recorded. */
  boolean warning(String message) {
    return warnings.add(message);
  }

  void error(ErrorDetails details) {
    errors.putIfAbsent(details.message(), details);
  }

  List<String> warnings() {
    return new ArrayList<>(warnings);
  }

  List<ErrorDetails> errorDetails() {
    return new ArrayList<>(errors.values());
  }
}
