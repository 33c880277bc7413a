package com.gentoro.onepivot.cache;

import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.value.Value;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Content-addressed cache keys: a SHA-256 hex digest over the configuration fingerprint and the
 * values every axis and measure field takes on the filtered records.
 *
 * <p>Functions (extractors, calculations, custom aggregations, formatters) cannot be compared by
 * content, so they enter the fingerprint by identity. Two configurations built with different
 * lambda instances therefore never share an entry.
 *
 * <p>Only the values of axis and measure fields enter the key. A custom aggregation receives the
 * raw records and may read anything on them, so configurations with a custom measure are not
 * cacheable (see {@link #isCacheable(PivotConfiguration)}).
 */
public final class CacheKeyFactory {
  private static final char UNIT = '\u001f';
  private static final char RECORD = '\u001e';

  private CacheKeyFactory() {}

  /** False when a measure aggregates with a custom function over the raw records. */
  public static boolean isCacheable(PivotConfiguration<?> configuration) {
    for (PivotField<?> measure : configuration.getDataFields()) {
      if (measure.getDefaultAggregation() == AggregationKind.CUSTOM) {
        return false;
      }
    }
    return true;
  }

  public static <T> String keyFor(
      PivotConfiguration<T> configuration, List<T> filteredRecords, String emptyText) {
    MessageDigest md = newDigest();
    StringBuilder sb = new StringBuilder(256);
    sb.append(configuration.getPivotId())
        .append(UNIT)
        .append(configuration.isEnableSubtotals())
        .append(UNIT)
        .append(configuration.isEnableGrandTotals())
        .append(UNIT)
        .append(configuration.getMaxCells())
        .append(UNIT)
        .append(configuration.getSizeGuard())
        .append(UNIT)
        .append(emptyText)
        .append(RECORD);
    appendFields(sb, "rows", configuration.getRowFields());
    appendFields(sb, "columns", configuration.getColumnFields());
    appendFields(sb, "data", configuration.getDataFields());
    appendFields(sb, "filters", configuration.getFilterFields());
    update(md, sb);

    List<PivotField<T>> projected = projectedFields(configuration);
    sb.append(filteredRecords.size()).append(RECORD);
    for (T record : filteredRecords) {
      for (PivotField<T> field : projected) {
        Value v = field.valueOf(record);
        sb.append(v.rank()).append(':').append(v.asText()).append(UNIT);
      }
      sb.append(RECORD);
      if (sb.length() > 8192) {
        update(md, sb);
      }
    }
    update(md, sb);
    return toHex(md.digest());
  }

  private static <T> List<PivotField<T>> projectedFields(PivotConfiguration<T> configuration) {
    Set<PivotField<T>> fields = new LinkedHashSet<>();
    fields.addAll(configuration.getRowFields());
    fields.addAll(configuration.getColumnFields());
    fields.addAll(configuration.getDataFields());
    return new ArrayList<>(fields);
  }

  private static <T> void appendFields(StringBuilder sb, String area, List<PivotField<T>> fields) {
    sb.append(area).append('[');
    for (PivotField<T> f : fields) {
      sb.append(f.getKey())
          .append(UNIT)
          .append(f.getKind())
          .append(UNIT)
          .append(f.getDataType())
          .append(UNIT)
          .append(f.getDefaultAggregation())
          .append(UNIT)
          .append(f.getSupportedAggregations())
          .append(UNIT)
          .append(f.getFormat())
          .append(UNIT)
          .append(f.getNullDisplayText())
          .append(UNIT)
          .append(f.getSortDirection())
          .append(UNIT)
          .append(f.isAllowFiltering())
          .append(UNIT)
          .append(f.getIncludeValues())
          .append(UNIT)
          .append(f.getExcludeValues())
          .append(UNIT)
          .append(f.getSearchFilter())
          .append(UNIT)
          .append(f.isShowSubtotals())
          .append(UNIT)
          .append(f.isShowGrandTotal())
          .append(UNIT)
          .append(System.identityHashCode(f.getExtractor()))
          .append(UNIT)
          .append(System.identityHashCode(f.getCalculation()))
          .append(UNIT)
          .append(System.identityHashCode(f.getCustomAggregation()))
          .append(UNIT)
          .append(System.identityHashCode(f.getFormatter()))
          .append(RECORD);
    }
    sb.append(']');
  }

  private static void update(MessageDigest md, StringBuilder sb) {
    md.update(sb.toString().getBytes(StandardCharsets.UTF_8));
    sb.setLength(0);
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static String toHex(byte[] digest) {
    StringBuilder sb = new StringBuilder(digest.length * 2);
    for (byte b : digest) sb.append(String.format("%02x", b));
    return sb.toString();
  }
}
