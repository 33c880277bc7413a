package com.gentoro.onepivot.value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.OptionalDouble;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Tagged scalar flowing through the pivot pipeline: record values, group keys and aggregated
 * cell values are all {@code Value}s.
 *
 * <p>Conversion from arbitrary Java objects happens once, in {@link #of(Object)}; everything
 * downstream works on the five variants below. Two rules are total and documented here:
 *
 * <ul>
 *   <li><b>Numeric coercion</b> ({@link #toNumber()}): numbers convert as-is, booleans to 1/0,
 *       text when it parses as a number (decimal, exponent or hex notation), dates and null never.
 *   <li><b>Ordering</b> ({@link #compareTo(Value)}): first by variant rank {@code NULL < BOOL <
 *       NUMBER < DATE < TEXT}, then by the natural order of the variant. Text compares by UTF-16
 *       code unit, so group ordering does not depend on the JVM locale.
 * </ul>
 */
public sealed interface Value extends Comparable<Value>
    permits Value.NullValue,
        Value.BoolValue,
        Value.NumberValue,
        Value.DateValue,
        Value.TextValue {

  Value NULL = new NullValue();

  /** Variant rank used by {@link #compareTo(Value)}. */
  int rank();

  /** Plain text rendering; {@code ""} for null. */
  String asText();

  /** Unwrapped Java object: {@code Double}, {@code String}, {@code Boolean}, {@code
   * LocalDateTime} or {@code null}. */
  Object raw();

  OptionalDouble toNumber();

  default boolean isNull() {
    return this instanceof NullValue;
  }

  /** True for null and for whitespace-only text, the values grouped under the empty sentinel. */
  default boolean isBlank() {
    return isNull() || (this instanceof TextValue t && t.value().isBlank());
  }

  @Override
  default int compareTo(Value other) {
    int byRank = Integer.compare(rank(), other.rank());
    if (byRank != 0) {
      return byRank;
    }
    if (this instanceof BoolValue a && other instanceof BoolValue b) {
      return Boolean.compare(a.value(), b.value());
    }
    if (this instanceof NumberValue a && other instanceof NumberValue b) {
      return Double.compare(a.value(), b.value());
    }
    if (this instanceof DateValue a && other instanceof DateValue b) {
      return a.value().compareTo(b.value());
    }
    if (this instanceof TextValue a && other instanceof TextValue b) {
      return a.value().compareTo(b.value());
    }
    return 0;
  }

  static Value number(double value) {
    return new NumberValue(value);
  }

  static Value text(String value) {
    return value == null ? NULL : new TextValue(value);
  }

  static Value bool(boolean value) {
    return new BoolValue(value);
  }

  static Value date(LocalDateTime value) {
    return value == null ? NULL : new DateValue(value);
  }

  /** Convert any extracted Java object into its tagged form. */
  static Value of(Object raw) {
    if (raw == null) {
      return NULL;
    }
    if (raw instanceof Value v) {
      return v;
    }
    if (raw instanceof Number n) {
      return new NumberValue(n.doubleValue());
    }
    if (raw instanceof Boolean b) {
      return new BoolValue(b);
    }
    if (raw instanceof CharSequence || raw instanceof Character) {
      return new TextValue(raw.toString());
    }
    if (raw instanceof LocalDateTime dt) {
      return new DateValue(dt);
    }
    if (raw instanceof LocalDate d) {
      return new DateValue(d.atStartOfDay());
    }
    if (raw instanceof Instant i) {
      return new DateValue(LocalDateTime.ofInstant(i, ZoneOffset.UTC));
    }
    if (raw instanceof OffsetDateTime odt) {
      return new DateValue(LocalDateTime.ofInstant(odt.toInstant(), ZoneOffset.UTC));
    }
    if (raw instanceof ZonedDateTime zdt) {
      return new DateValue(LocalDateTime.ofInstant(zdt.toInstant(), ZoneOffset.UTC));
    }
    if (raw instanceof Date d) {
      return new DateValue(LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC));
    }
    if (raw instanceof Enum<?> e) {
      return new TextValue(e.name());
    }
    return new TextValue(raw.toString());
  }

  /** Absence of a value. */
  record NullValue() implements Value {
    @Override
    public int rank() {
      return 0;
    }

    @Override
    public String asText() {
      return "";
    }

    @Override
    public Object raw() {
      return null;
    }

    @Override
    public OptionalDouble toNumber() {
      return OptionalDouble.empty();
    }
  }

  record BoolValue(boolean value) implements Value {
    @Override
    public int rank() {
      return 1;
    }

    @Override
    public String asText() {
      return Boolean.toString(value);
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public OptionalDouble toNumber() {
      return OptionalDouble.of(value ? 1d : 0d);
    }
  }

  record NumberValue(double value) implements Value {
    public NumberValue {
      // collapse -0.0 so equal sums land in the same group
      if (value == 0d) {
        value = 0d;
      }
    }

    @Override
    public int rank() {
      return 2;
    }

    @Override
    public String asText() {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return Double.toString(value);
      }
      return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public OptionalDouble toNumber() {
      return OptionalDouble.of(value);
    }
  }

  record DateValue(LocalDateTime value) implements Value {
    @Override
    public int rank() {
      return 3;
    }

    @Override
    public String asText() {
      if (value.toLocalTime().equals(LocalTime.MIDNIGHT)) {
        return value.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
      }
      return value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public OptionalDouble toNumber() {
      return OptionalDouble.empty();
    }
  }

  record TextValue(String value) implements Value {
    @Override
    public int rank() {
      return 4;
    }

    @Override
    public String asText() {
      return value;
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public OptionalDouble toNumber() {
      String trimmed = value.trim();
      if (!NumberUtils.isCreatable(trimmed)) {
        return OptionalDouble.empty();
      }
      try {
        return OptionalDouble.of(NumberUtils.createNumber(trimmed).doubleValue());
      } catch (NumberFormatException e) {
        return OptionalDouble.empty();
      }
    }
  }
}
