package com.gentoro.onepivot.field;

import com.gentoro.onepivot.exception.OnePivotErrorCode;
import com.gentoro.onepivot.exception.OnePivotException;
import com.gentoro.onepivot.value.Value;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * One dimension, measure, calculated or filter field of a pivot.
 *
 * <p>A field knows how to pull its value out of a record ({@link #valueOf(Object)}), how to
 * render a value ({@link #format(Value)}), how it is aggregated when used as a measure, and
 * carries the filter state the user picked for it. Filter state and flags are mutable so a UI can
 * edit them between computations; use {@link #copy()} to place the same field in another area
 * with independent state.
 *
 * <p>Non-calculated fields need an extractor; calculated fields need a computation over a {@link
 * CalculationContext}. Both rules are checked by the pivot validator, not here.
 *
 * @param <T> record type
 */
public class PivotField<T> {
  public static final String DEFAULT_NULL_DISPLAY_TEXT = "(Empty)";

  private String key;
  private String displayName;
  private String description = "";
  private FieldKind kind = FieldKind.DIMENSION;
  private DataType dataType = DataType.TEXT;

  private Function<T, Object> extractor;
  private Function<CalculationContext<T>, Object> calculation;
  private final Map<String, PivotField<T>> dependencies = new LinkedHashMap<>();

  private AggregationKind defaultAggregation = AggregationKind.SUM;
  private Set<AggregationKind> supportedAggregations = EnumSet.noneOf(AggregationKind.class);
  private Function<List<T>, Object> customAggregation;

  private String format = "";
  private String nullDisplayText = DEFAULT_NULL_DISPLAY_TEXT;
  private Function<Object, String> formatter;

  private SortDirection sortDirection = SortDirection.ASCENDING;

  private boolean allowFiltering = true;
  private List<Object> includeValues = new ArrayList<>();
  private List<Object> excludeValues = new ArrayList<>();
  private String searchFilter = "";

  private boolean showSubtotals = true;
  private boolean showGrandTotal = true;

  private volatile Function<T, Value> accessor;

  public PivotField() {}

  public PivotField(String key, Function<T, Object> extractor) {
    this.key = key;
    this.displayName = key;
    this.extractor = extractor;
  }

  public static <T> Builder<T> builder(String key) {
    return new Builder<>(key);
  }

  /**
   * Value of this field for the given record. The accessor combining extraction (or calculation)
   * with conversion to {@link Value} is resolved on first use and reused afterwards.
   */
  public Value valueOf(T record) {
    if (record == null) {
      return Value.NULL;
    }
    Function<T, Value> a = accessor;
    if (a == null) {
      a = resolveAccessor();
      accessor = a;
    }
    return a.apply(record);
  }

  private Function<T, Value> resolveAccessor() {
    if (isCalculated()) {
      if (calculation == null) {
        throw new OnePivotException(
            OnePivotErrorCode.CONFIGURATION_ERROR,
            "Calculated field " + key + " has no computation function");
      }
      Function<CalculationContext<T>, Object> fn = calculation;
      Map<String, PivotField<T>> deps = Collections.unmodifiableMap(dependencies);
      return record -> Value.of(fn.apply(new CalculationContext<>(record, deps)));
    }
    if (extractor == null) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR, "Field " + key + " has no value extractor");
    }
    Function<T, Object> fn = extractor;
    return record -> Value.of(fn.apply(record));
  }

  /**
   * Render a value for display. A custom formatter wins; otherwise a non-empty {@link
   * #getFormat() format} is applied as a {@link DecimalFormat} pattern to numbers or a {@link
   * DateTimeFormatter} pattern to dates; otherwise the value's plain text. Null renders as {@link
   * #getNullDisplayText()}.
   */
  public String format(Value value) {
    if (value == null || value.isNull()) {
      return nullDisplayText;
    }
    if (formatter != null) {
      return formatter.apply(value.raw());
    }
    if (format != null && !format.isEmpty()) {
      if (value instanceof Value.NumberValue n) {
        return new DecimalFormat(format, DecimalFormatSymbols.getInstance(Locale.ROOT))
            .format(n.value());
      }
      if (value instanceof Value.DateValue d) {
        return d.value().format(DateTimeFormatter.ofPattern(format, Locale.ROOT));
      }
    }
    return value.asText();
  }

  /** True when the aggregation is explicitly supported, or no restriction was declared. */
  public boolean supports(AggregationKind aggregation) {
    return supportedAggregations.isEmpty() || supportedAggregations.contains(aggregation);
  }

  public boolean isCalculated() {
    return kind == FieldKind.CALCULATED;
  }

  public boolean hasFilter() {
    return !includeValues.isEmpty()
        || !excludeValues.isEmpty()
        || (searchFilter != null && !searchFilter.isEmpty());
  }

  /** Independent copy: same extraction and formatting, separate filter lists. */
  public PivotField<T> copy() {
    PivotField<T> c = new PivotField<>();
    c.key = key;
    c.displayName = displayName;
    c.description = description;
    c.kind = kind;
    c.dataType = dataType;
    c.extractor = extractor;
    c.calculation = calculation;
    c.dependencies.putAll(dependencies);
    c.defaultAggregation = defaultAggregation;
    c.supportedAggregations =
        supportedAggregations.isEmpty()
            ? EnumSet.noneOf(AggregationKind.class)
            : EnumSet.copyOf(supportedAggregations);
    c.customAggregation = customAggregation;
    c.format = format;
    c.nullDisplayText = nullDisplayText;
    c.formatter = formatter;
    c.sortDirection = sortDirection;
    c.allowFiltering = allowFiltering;
    c.includeValues = new ArrayList<>(includeValues);
    c.excludeValues = new ArrayList<>(excludeValues);
    c.searchFilter = searchFilter;
    c.showSubtotals = showSubtotals;
    c.showGrandTotal = showGrandTotal;
    return c;
  }

  public String getKey() {
    return key;
  }

  public PivotField<T> setKey(String key) {
    this.key = key;
    return this;
  }

  public String getDisplayName() {
    return displayName;
  }

  public PivotField<T> setDisplayName(String displayName) {
    this.displayName = displayName;
    return this;
  }

  public String getDescription() {
    return description;
  }

  public PivotField<T> setDescription(String description) {
    this.description = description;
    return this;
  }

  public FieldKind getKind() {
    return kind;
  }

  public PivotField<T> setKind(FieldKind kind) {
    this.kind = kind;
    this.accessor = null;
    return this;
  }

  public DataType getDataType() {
    return dataType;
  }

  public PivotField<T> setDataType(DataType dataType) {
    this.dataType = dataType;
    return this;
  }

  public Function<T, Object> getExtractor() {
    return extractor;
  }

  public PivotField<T> setExtractor(Function<T, Object> extractor) {
    this.extractor = extractor;
    this.accessor = null;
    return this;
  }

  public Function<CalculationContext<T>, Object> getCalculation() {
    return calculation;
  }

  public PivotField<T> setCalculation(
      Function<CalculationContext<T>, Object> calculation, List<PivotField<T>> dependsOn) {
    this.calculation = calculation;
    this.dependencies.clear();
    if (dependsOn != null) {
      for (PivotField<T> dep : dependsOn) {
        this.dependencies.put(dep.getKey(), dep);
      }
    }
    this.accessor = null;
    return this;
  }

  /** Fields a calculated field reads, in declaration order. */
  public List<PivotField<T>> getDependencies() {
    return List.copyOf(dependencies.values());
  }

  /** Keys of the fields a calculated field reads, in declaration order. */
  public List<String> getDependentFieldKeys() {
    return List.copyOf(dependencies.keySet());
  }

  public AggregationKind getDefaultAggregation() {
    return defaultAggregation;
  }

  public PivotField<T> setDefaultAggregation(AggregationKind defaultAggregation) {
    this.defaultAggregation = defaultAggregation;
    return this;
  }

  public Set<AggregationKind> getSupportedAggregations() {
    return Collections.unmodifiableSet(supportedAggregations);
  }

  public PivotField<T> setSupportedAggregations(Set<AggregationKind> supportedAggregations) {
    this.supportedAggregations =
        supportedAggregations == null || supportedAggregations.isEmpty()
            ? EnumSet.noneOf(AggregationKind.class)
            : EnumSet.copyOf(supportedAggregations);
    return this;
  }

  public Function<List<T>, Object> getCustomAggregation() {
    return customAggregation;
  }

  public PivotField<T> setCustomAggregation(Function<List<T>, Object> customAggregation) {
    this.customAggregation = customAggregation;
    return this;
  }

  public String getFormat() {
    return format;
  }

  public PivotField<T> setFormat(String format) {
    this.format = format;
    return this;
  }

  public String getNullDisplayText() {
    return nullDisplayText;
  }

  public PivotField<T> setNullDisplayText(String nullDisplayText) {
    this.nullDisplayText = nullDisplayText;
    return this;
  }

  public Function<Object, String> getFormatter() {
    return formatter;
  }

  public PivotField<T> setFormatter(Function<Object, String> formatter) {
    this.formatter = formatter;
    return this;
  }

  public SortDirection getSortDirection() {
    return sortDirection;
  }

  public PivotField<T> setSortDirection(SortDirection sortDirection) {
    this.sortDirection = sortDirection == null ? SortDirection.ASCENDING : sortDirection;
    return this;
  }

  public boolean isAllowFiltering() {
    return allowFiltering;
  }

  public PivotField<T> setAllowFiltering(boolean allowFiltering) {
    this.allowFiltering = allowFiltering;
    return this;
  }

  public List<Object> getIncludeValues() {
    return includeValues;
  }

  public PivotField<T> setIncludeValues(List<?> includeValues) {
    this.includeValues = includeValues == null ? new ArrayList<>() : new ArrayList<>(includeValues);
    return this;
  }

  public List<Object> getExcludeValues() {
    return excludeValues;
  }

  public PivotField<T> setExcludeValues(List<?> excludeValues) {
    this.excludeValues = excludeValues == null ? new ArrayList<>() : new ArrayList<>(excludeValues);
    return this;
  }

  public String getSearchFilter() {
    return searchFilter;
  }

  public PivotField<T> setSearchFilter(String searchFilter) {
    this.searchFilter = searchFilter == null ? "" : searchFilter;
    return this;
  }

  public boolean isShowSubtotals() {
    return showSubtotals;
  }

  public PivotField<T> setShowSubtotals(boolean showSubtotals) {
    this.showSubtotals = showSubtotals;
    return this;
  }

  public boolean isShowGrandTotal() {
    return showGrandTotal;
  }

  public PivotField<T> setShowGrandTotal(boolean showGrandTotal) {
    this.showGrandTotal = showGrandTotal;
    return this;
  }

  @Override
  public String toString() {
    return "PivotField{" + key + ", " + kind + "}";
  }

  /** Fluent builder; the display name defaults to the key. */
  public static final class Builder<T> {
    private final PivotField<T> field = new PivotField<>();

    private Builder(String key) {
      field.key = key;
    }

    public Builder<T> displayName(String displayName) {
      field.displayName = displayName;
      return this;
    }

    public Builder<T> description(String description) {
      field.description = description;
      return this;
    }

    public Builder<T> extractor(Function<T, Object> extractor) {
      field.extractor = extractor;
      return this;
    }

    @SafeVarargs
    public final Builder<T> calculated(
        Function<CalculationContext<T>, Object> calculation, PivotField<T>... dependsOn) {
      field.kind = FieldKind.CALCULATED;
      field.setCalculation(calculation, List.of(dependsOn));
      return this;
    }

    public Builder<T> asMeasure(AggregationKind defaultAggregation) {
      field.kind = FieldKind.MEASURE;
      field.dataType = field.dataType == DataType.TEXT ? DataType.NUMBER : field.dataType;
      field.defaultAggregation = defaultAggregation;
      return this;
    }

    public Builder<T> asMeasure() {
      return asMeasure(AggregationKind.SUM);
    }

    public Builder<T> asDimension() {
      field.kind = FieldKind.DIMENSION;
      return this;
    }

    public Builder<T> asFilter() {
      field.kind = FieldKind.FILTER;
      return this;
    }

    public Builder<T> dataType(DataType dataType) {
      field.dataType = dataType;
      return this;
    }

    public Builder<T> aggregations(AggregationKind... aggregations) {
      field.setSupportedAggregations(
          aggregations.length == 0 ? null : EnumSet.copyOf(List.of(aggregations)));
      return this;
    }

    public Builder<T> customAggregation(Function<List<T>, Object> customAggregation) {
      field.customAggregation = customAggregation;
      return this;
    }

    public Builder<T> format(String format) {
      field.format = format;
      return this;
    }

    public Builder<T> formatter(Function<Object, String> formatter) {
      field.formatter = formatter;
      return this;
    }

    public Builder<T> nullDisplayText(String nullDisplayText) {
      field.nullDisplayText = nullDisplayText;
      return this;
    }

    public Builder<T> sort(SortDirection direction) {
      field.setSortDirection(direction);
      return this;
    }

    public Builder<T> include(Object... values) {
      field.setIncludeValues(Arrays.asList(values));
      return this;
    }

    public Builder<T> exclude(Object... values) {
      field.setExcludeValues(Arrays.asList(values));
      return this;
    }

    public Builder<T> search(String searchFilter) {
      field.setSearchFilter(searchFilter);
      return this;
    }

    public Builder<T> disableFiltering() {
      field.allowFiltering = false;
      return this;
    }

    public Builder<T> disableSubtotals() {
      field.showSubtotals = false;
      return this;
    }

    public Builder<T> disableGrandTotal() {
      field.showGrandTotal = false;
      return this;
    }

    public PivotField<T> build() {
      if (field.displayName == null || field.displayName.isEmpty()) {
        field.displayName = field.key;
      }
      return field;
    }
  }
}
