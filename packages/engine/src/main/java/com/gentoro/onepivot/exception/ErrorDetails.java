package com.gentoro.onepivot.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured description of a failure, as stored on pivot results and serialized by exporters.
 *
 * @param type simple class name of the failure
 * @param message failure message, never null
 * @param code error category
 * @param context values explaining the failure; empty when there are none
 * @param timestamp when the failure was recorded
 */
public record ErrorDetails(
    String type,
    String message,
    OnePivotErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {

  public ErrorDetails {
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }
}
