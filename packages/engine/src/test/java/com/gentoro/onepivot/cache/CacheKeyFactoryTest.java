package com.gentoro.onepivot.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onepivot.Sale;
import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.field.AggregationKind;
import com.gentoro.onepivot.field.PivotField;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CacheKeyFactoryTest {

  private final PivotField<Sale> region = Sale.regionField();
  private final PivotField<Sale> amount = Sale.amountField();
  private final PivotConfiguration<Sale> cfg =
      new PivotConfiguration<Sale>().setPivotId("p1").addRowField(region).addDataField(amount);

  @Test
  @DisplayName("keys are stable SHA-256 hex digests")
  void stable() {
    String first = CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)");
    String second = CacheKeyFactory.keyFor(cfg, new ArrayList<>(Sale.sample()), "(Empty)");
    assertEquals(first, second);
    assertEquals(64, first.length());
    assertTrue(first.matches("[0-9a-f]+"));
  }

  @Test
  @DisplayName("record content, not just record count, changes the key")
  void contentSensitive() {
    String a = CacheKeyFactory.keyFor(cfg, List.of(Sale.of("East", 1)), "(Empty)");
    String b = CacheKeyFactory.keyFor(cfg, List.of(Sale.of("East", 2)), "(Empty)");
    assertNotEquals(a, b);
  }

  @Test
  @DisplayName("configuration changes the key")
  void configurationSensitive() {
    String before = CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)");
    amount.setDefaultAggregation(AggregationKind.MAX);
    assertNotEquals(before, CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)"));

    String withTotals = CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)");
    cfg.setEnableGrandTotals(false);
    assertNotEquals(withTotals, CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)"));

    String byId = CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)");
    cfg.setPivotId("p2");
    assertNotEquals(byId, CacheKeyFactory.keyFor(cfg, Sale.sample(), "(Empty)"));
  }

  @Test
  @DisplayName("custom measures make a configuration uncacheable")
  void customMeasuresNotCacheable() {
    assertTrue(CacheKeyFactory.isCacheable(cfg));
    cfg.addDataField(
        Sale.amountField(AggregationKind.CUSTOM).setCustomAggregation(records -> records.size()));
    assertFalse(CacheKeyFactory.isCacheable(cfg));
  }
}
