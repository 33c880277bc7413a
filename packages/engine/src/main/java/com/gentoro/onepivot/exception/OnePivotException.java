package com.gentoro.onepivot.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the pivot engine.
 *
 * <p>Every failure raised by the engine carries an {@link OnePivotErrorCode} so callers can react
 * to the category without parsing messages, plus an optional context map with the values that
 * explain the failure (field keys, limits, formats).
 */
public class OnePivotException extends RuntimeException {
  private final OnePivotErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public OnePivotException(OnePivotErrorCode code, String message) {
    super(message);
    this.code = code == null ? OnePivotErrorCode.UNKNOWN : code;
  }

  public OnePivotException(OnePivotErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? OnePivotErrorCode.UNKNOWN : code;
  }

  public OnePivotErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public OnePivotException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
