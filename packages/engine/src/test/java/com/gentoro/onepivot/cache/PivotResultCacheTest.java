package com.gentoro.onepivot.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onepivot.config.EngineSettings;
import com.gentoro.onepivot.config.SizeGuardPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PivotResultCacheTest {

  @Test
  void putGetClear() {
    PivotResultCache<String> cache = new PivotResultCache<>(EngineSettings.defaults());
    assertTrue(cache.get("k").isEmpty());
    cache.put("k", "v");
    assertEquals("v", cache.get("k").orElseThrow());
    assertEquals(1, cache.size());
    assertEquals(1, cache.stats().hitCount());
    assertEquals(1, cache.stats().missCount());
    cache.clear();
    assertEquals(0, cache.size());
  }

  @Test
  void boundedBySize() {
    EngineSettings settings =
        new EngineSettings(true, 2, Duration.ofMinutes(1), 1000, SizeGuardPolicy.FAIL, "(Empty)");
    PivotResultCache<Integer> cache = new PivotResultCache<>(settings);
    for (int i = 0; i < 50; i++) {
      cache.put("k" + i, i);
    }
    assertTrue(cache.size() <= 2, "size=" + cache.size());
  }
}
