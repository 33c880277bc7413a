package com.gentoro.onepivot.cache;

import com.gentoro.onepivot.config.EngineSettings;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.util.Optional;

/**
 * Bounded, thread-safe store of computed results keyed by {@link CacheKeyFactory} digests.
 *
 * <p>Entries are evicted by size (least recently used first) and after the configured time to
 * live, or all at once through {@link #clear()}.
 *
 * @param <V> cached value type
 */
public class PivotResultCache<V> {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(PivotResultCache.class);

  private final Cache<String, V> cache;

  public PivotResultCache(EngineSettings settings) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(settings.cacheMaximumSize())
            .expireAfterWrite(settings.cacheExpireAfterWrite())
            .recordStats()
            .build();
    log.debug(
        "Result cache initialized (maximumSize={}, expireAfterWrite={})",
        settings.cacheMaximumSize(),
        settings.cacheExpireAfterWrite());
  }

  public Optional<V> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  public void put(String key, V value) {
    cache.put(key, value);
  }

  public void clear() {
    cache.invalidateAll();
    cache.cleanUp();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public CacheStats stats() {
    return cache.stats();
  }
}
