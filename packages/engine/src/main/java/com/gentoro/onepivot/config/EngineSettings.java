package com.gentoro.onepivot.config;

import com.gentoro.onepivot.exception.OnePivotErrorCode;
import com.gentoro.onepivot.exception.OnePivotException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed, immutable view of the engine-wide settings.
 *
 * <p>Per-pivot options (field lists, totals, the configuration's own cell budget) live on {@link
 * PivotConfiguration}; the values here are process-wide defaults and resource limits.
 */
public record EngineSettings(
    boolean cacheEnabled,
    long cacheMaximumSize,
    Duration cacheExpireAfterWrite,
    int defaultMaxCells,
    SizeGuardPolicy sizeGuard,
    String emptyText) {

  public static final int DEFAULT_MAX_CELLS = 100_000;
  public static final String DEFAULT_EMPTY_TEXT = "(Empty)";

  public EngineSettings {
    if (cacheMaximumSize < 0) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR, "engine.cache.maximum-size must be >= 0");
    }
    if (defaultMaxCells <= 0) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR, "engine.max-cells must be > 0");
    }
    cacheExpireAfterWrite =
        cacheExpireAfterWrite == null ? Duration.ofMinutes(10) : cacheExpireAfterWrite;
    sizeGuard = sizeGuard == null ? SizeGuardPolicy.FAIL : sizeGuard;
    emptyText = emptyText == null ? DEFAULT_EMPTY_TEXT : emptyText;
  }

  public static EngineSettings defaults() {
    return new EngineSettings(
        true,
        256,
        Duration.ofMinutes(10),
        DEFAULT_MAX_CELLS,
        SizeGuardPolicy.FAIL,
        DEFAULT_EMPTY_TEXT);
  }

  /** Read settings from the {@code engine.*} keys, falling back to {@link #defaults()}. */
  public static EngineSettings fromConfiguration(Configuration configuration) {
    EngineSettings d = defaults();
    if (configuration == null) {
      return d;
    }
    return new EngineSettings(
        configuration.getBoolean("engine.cache.enabled", d.cacheEnabled()),
        configuration.getLong("engine.cache.maximum-size", d.cacheMaximumSize()),
        parseDuration(
            configuration.getString("engine.cache.expire-after-write", null),
            d.cacheExpireAfterWrite()),
        configuration.getInt("engine.max-cells", d.defaultMaxCells()),
        parsePolicy(configuration.getString("engine.size-guard", null), d.sizeGuard()),
        configuration.getString("engine.empty-text", d.emptyText()));
  }

  private static Duration parseDuration(String raw, Duration fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Duration.parse(raw.trim());
    } catch (DateTimeParseException e) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR,
          "engine.cache.expire-after-write must be an ISO-8601 duration, got '" + raw + "'",
          e);
    }
  }

  private static SizeGuardPolicy parsePolicy(String raw, SizeGuardPolicy fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return SizeGuardPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR,
          "engine.size-guard must be one of FAIL, WARN; got '" + raw + "'",
          e);
    }
  }
}
