package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.cache.CacheKeyFactory;
import com.gentoro.onepivot.cache.PivotResultCache;
import com.gentoro.onepivot.config.EngineConfigurationProvider;
import com.gentoro.onepivot.config.EngineSettings;
import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.config.SizeGuardPolicy;
import com.gentoro.onepivot.exception.ExceptionUtil;
import com.gentoro.onepivot.exception.OnePivotErrorCode;
import com.gentoro.onepivot.exception.OnePivotException;
import com.gentoro.onepivot.exception.PivotCancelledException;
import com.gentoro.onepivot.exception.PivotConfigurationException;
import com.gentoro.onepivot.exception.PivotSizeLimitException;
import com.gentoro.onepivot.export.ExportConfiguration;
import com.gentoro.onepivot.export.ExportService;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.logging.LoggingService;
import com.gentoro.onepivot.metrics.PerformanceTracker;
import com.gentoro.onepivot.value.Value;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Entry point of the pivot engine.
 *
 * <p>{@link #process} runs the pipeline: validation, filtering, cache lookup, row and column
 * hierarchies, cell budget check, cell aggregation and, on success, cache store. Configuration
 * problems abort before any record is read; data problems inside single cells are recovered and
 * reported as result warnings.
 *
 * <p>One engine serves any number of record types and concurrent callers. Each call owns its own
 * performance tracker, so metrics always travel with the result they describe.
 */
public class PivotEngine implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(PivotEngine.class);

  private final EngineSettings settings;
  private final HierarchyBuilder hierarchyBuilder;
  private final AggregationEngine aggregationEngine = new AggregationEngine();
  private final CellCalculator cellCalculator = new CellCalculator(aggregationEngine);
  private final PivotResultCache<PivotResult<?>> cache;
  private final ExportService exportService;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  /** Engine configured from the classpath {@code onepivot.yaml}. */
  public PivotEngine() {
    this(new EngineConfigurationProvider());
  }

  public PivotEngine(EngineConfigurationProvider configurationProvider) {
    this(applyLogging(configurationProvider).settings());
  }

  public PivotEngine(EngineSettings settings) {
    this(settings, ExportService.withDefaults(), null);
  }

  /**
   * @param executor runs {@link #processAsync}; when {@code null} the engine creates its own pool
   *     and shuts it down on {@link #close()}
   */
  public PivotEngine(
      EngineSettings settings, ExportService exportService, ExecutorService executor) {
    this.settings = settings == null ? EngineSettings.defaults() : settings;
    this.hierarchyBuilder = new HierarchyBuilder(this.settings.emptyText());
    this.cache = new PivotResultCache<>(this.settings);
    this.exportService = exportService == null ? ExportService.withDefaults() : exportService;
    this.ownsExecutor = executor == null;
    this.executor = executor == null ? newWorkerPool() : executor;
  }

  private static EngineConfigurationProvider applyLogging(EngineConfigurationProvider provider) {
    LoggingService.applyConfiguration(provider.configuration());
    return provider;
  }

  private static ExecutorService newWorkerPool() {
    AtomicInteger counter = new AtomicInteger();
    int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    return Executors.newFixedThreadPool(
        threads,
        r -> {
          Thread t = new Thread(r, "onepivot-worker-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  public EngineSettings getSettings() {
    return settings;
  }

  public ValidationResult validate(PivotConfiguration<?> configuration) {
    return PivotValidator.validate(configuration, settings);
  }

  public <T> PivotResult<T> process(Collection<T> records, PivotConfiguration<T> configuration) {
    return process(records, configuration, CancellationToken.none());
  }

  /**
   * Compute the pivot of {@code records}.
   *
   * @throws PivotConfigurationException when validation reports errors
   * @throws PivotSizeLimitException when the pivot exceeds its cell budget under {@link
   *     SizeGuardPolicy#FAIL}
   * @throws PivotCancelledException when {@code token} is cancelled before completion
   */
  public <T> PivotResult<T> process(
      Collection<T> records, PivotConfiguration<T> configuration, CancellationToken token) {
    CancellationToken ct = token == null ? CancellationToken.none() : token;
    ValidationResult validation = validate(configuration);
    if (!validation.isValid()) {
      log.error("Invalid pivot configuration: {}", validation.getErrors());
      throw new PivotConfigurationException(validation.getErrors());
    }
    validation.getWarnings().forEach(w -> log.warn("Pivot {}: {}", configuration.getPivotId(), w));

    PivotConfiguration<T> cfg = configuration.snapshot();
    List<T> source = records == null ? List.of() : new ArrayList<>(records);
    PerformanceTracker tracker = new PerformanceTracker();
    log.debug("Processing pivot {} over {} records", cfg.getPivotId(), source.size());

    try {
      ct.throwIfCancellationRequested("filtering");
      tracker.start(PerformanceTracker.PHASE_FILTER);
      List<T> filtered = FilterStage.apply(source, FilterStage.filterCapableFields(cfg));
      tracker.endCurrent(Map.<String, Object>of("records", filtered.size()));

      boolean useCache = settings.cacheEnabled() && cfg.isEnableCaching();
      if (useCache && !CacheKeyFactory.isCacheable(cfg)) {
        log.debug("Pivot {} has a custom measure; result cache bypassed", cfg.getPivotId());
        useCache = false;
      }
      String cacheKey = null;
      if (useCache) {
        cacheKey = CacheKeyFactory.keyFor(cfg, filtered, settings.emptyText());
        Optional<PivotResult<?>> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
          @SuppressWarnings("unchecked")
          PivotResult<T> hit = (PivotResult<T>) cached.get();
          log.debug("Cache hit for pivot {}", cfg.getPivotId());
          return hit.withMetrics(
              tracker.toMetrics(source.size(), filtered.size(), hit.getCells().size(), true));
        }
        log.debug("Cache miss for pivot {}", cfg.getPivotId());
      }

      Diagnostics diagnostics = new Diagnostics();
      validation.getWarnings().forEach(diagnostics::warning);

      tracker.start(PerformanceTracker.PHASE_HIERARCHY);
      PivotAxis<T> rows =
          hierarchyBuilder.build(
              filtered,
              cfg.getRowFields(),
              true,
              cfg.isEnableSubtotals(),
              cfg.isEnableGrandTotals(),
              ct);
      PivotAxis<T> columns =
          hierarchyBuilder.build(
              filtered,
              cfg.getColumnFields(),
              false,
              cfg.isEnableSubtotals(),
              cfg.isEnableGrandTotals(),
              ct);
      tracker.endCurrent(
          Map.<String, Object>of("rowHeaders", rows.size(), "columnHeaders", columns.size()));

      enforceCellBudget(cfg, rows, columns, diagnostics);

      tracker.start(PerformanceTracker.PHASE_AGGREGATION);
      Map<String, PivotCell<T>> cells =
          cellCalculator.calculate(filtered, rows, columns, cfg.getDataFields(), ct, diagnostics);
      tracker.endCurrent(Map.<String, Object>of("cells", cells.size()));

      PivotResult<T> result =
          new PivotResult<>(
              cfg,
              rows,
              columns,
              cells,
              source.size(),
              filtered.size(),
              diagnostics.warnings(),
              diagnostics.errorDetails(),
              Instant.now(),
              tracker.toMetrics(source.size(), filtered.size(), cells.size(), false));
      if (useCache) {
        cache.put(cacheKey, result);
      }
      log.info(
          "Pivot {} computed: {} row headers, {} column headers, {} cells in {} ms",
          cfg.getPivotId(),
          rows.size(),
          columns.size(),
          cells.size(),
          result.getElapsed().toMillis());
      return result;
    } catch (PivotCancelledException e) {
      log.info("Pivot {}: {}", cfg.getPivotId(), e.getMessage());
      throw e;
    } catch (OnePivotException e) {
      log.error("Pivot {} failed: {}", cfg.getPivotId(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.error("Pivot {} failed", cfg.getPivotId(), e);
      throw new OnePivotException(
              OnePivotErrorCode.UNKNOWN,
              "Pivot computation failed: " + ExceptionUtil.describe(e),
              e)
          .withContext("pivotId", cfg.getPivotId());
    }
  }

  public <T> CompletableFuture<PivotResult<T>> processAsync(
      Collection<T> records, PivotConfiguration<T> configuration, CancellationToken token) {
    return CompletableFuture.supplyAsync(() -> process(records, configuration, token), executor);
  }

  private <T> void enforceCellBudget(
      PivotConfiguration<T> cfg, PivotAxis<T> rows, PivotAxis<T> columns, Diagnostics diagnostics) {
    long bound = (long) rows.size() * columns.size() * cfg.getDataFields().size();
    int maxCells = cfg.effectiveMaxCells(settings);
    if (bound <= maxCells) {
      return;
    }
    if (cfg.effectiveSizeGuard(settings) == SizeGuardPolicy.FAIL) {
      throw new PivotSizeLimitException(bound, maxCells);
    }
    String message =
        String.format(
            Locale.ROOT,
            "Pivot may produce up to %,d cells, above the maximum of %,d",
            bound,
            maxCells);
    log.warn("Pivot {}: {}", cfg.getPivotId(), message);
    diagnostics.warning(message);
  }

  /** Distinct non-null values of {@code field} over {@code records}, in ascending order. */
  public <T> List<Value> distinctValues(Collection<T> records, PivotField<T> field) {
    if (records == null || field == null) {
      return List.of();
    }
    return records.stream()
        .map(field::valueOf)
        .filter(v -> !v.isNull())
        .distinct()
        .sorted()
        .collect(Collectors.toList());
  }

  /** Aggregate one measure over arbitrary records, outside any pivot. */
  public <T> Value aggregate(Collection<T> records, PivotField<T> field, AggregationKind kind) {
    List<T> subset = records == null ? List.of() : new ArrayList<>(records);
    return aggregationEngine.aggregate(subset, field, kind);
  }

  /**
   * Source records behind one cell: {@code records} filtered with the result's configuration and
   * matched against both headers.
   */
  public <T> List<T> drillThrough(
      Collection<T> records,
      PivotResult<T> result,
      PivotHeader<T> rowHeader,
      PivotHeader<T> columnHeader) {
    if (records == null) {
      return List.of();
    }
    List<T> filtered =
        FilterStage.apply(
            new ArrayList<>(records), FilterStage.filterCapableFields(result.getConfiguration()));
    List<T> matched = new ArrayList<>();
    for (T record : filtered) {
      if (HeaderMatcher.matches(record, rowHeader, result.getRowAxis())
          && HeaderMatcher.matches(record, columnHeader, result.getColumnAxis())) {
        matched.add(record);
      }
    }
    return matched;
  }

  /** Serialize a result; unsupported formats raise {@code UnsupportedExportFormatException}. */
  public <T> byte[] export(PivotResult<T> result, ExportConfiguration configuration) {
    return exportService.export(result, configuration);
  }

  public ExportService getExportService() {
    return exportService;
  }

  public void clearCache() {
    cache.clear();
    log.debug("Pivot result cache cleared");
  }

  public long cacheSize() {
    return cache.size();
  }

  @Override
  public void close() {
    if (ownsExecutor) {
      executor.shutdownNow();
    }
  }
}
