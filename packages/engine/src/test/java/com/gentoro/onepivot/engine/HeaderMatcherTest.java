package com.gentoro.onepivot.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onepivot.Sale;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HeaderMatcherTest {

  private final HierarchyBuilder builder = new HierarchyBuilder("(Empty)");

  private PivotAxis<Sale> axis(List<Sale> sales) {
    return builder.build(
        sales,
        List.of(Sale.regionField(), Sale.countryField(), Sale.productField()),
        true,
        true,
        true,
        CancellationToken.none());
  }

  @Test
  @DisplayName("a group header checks its whole ancestor chain")
  void ancestorChain() {
    PivotAxis<Sale> axis = axis(Sale.sample());
    PivotHeader<Sale> eastChinaTea = axis.find("East/China/Tea").orElseThrow();
    assertTrue(HeaderMatcher.matches(Sale.of("East", "China", "Tea", 1), eastChinaTea, axis));
    assertFalse(HeaderMatcher.matches(Sale.of("West", "China", "Tea", 1), eastChinaTea, axis));
    assertFalse(HeaderMatcher.matches(Sale.of("East", "Japan", "Tea", 1), eastChinaTea, axis));
  }

  @Test
  @DisplayName("a subtotal matches what its group matches, at any depth")
  void subtotals() {
    PivotAxis<Sale> axis = axis(Sale.sample());
    PivotHeader<Sale> chinaTotal = axis.find("East/China/China Total").orElseThrow();
    PivotHeader<Sale> eastTotal = axis.find("East/East Total").orElseThrow();
    Sale rice = Sale.of("East", "China", "Rice", 1);
    Sale japan = Sale.of("East", "Japan", "Tea", 1);
    assertTrue(HeaderMatcher.matches(rice, chinaTotal, axis));
    assertFalse(HeaderMatcher.matches(japan, chinaTotal, axis));
    assertTrue(HeaderMatcher.matches(japan, eastTotal, axis));
    assertFalse(HeaderMatcher.matches(Sale.of("West", "Spain", "Wine", 1), eastTotal, axis));
  }

  @Test
  @DisplayName("the empty group matches null and blank values only")
  void emptyGroup() {
    List<Sale> sales = Arrays.asList(Sale.of(null, 1), Sale.of("East", 2));
    PivotAxis<Sale> axis =
        builder.build(
            sales, List.of(Sale.regionField()), true, true, true, CancellationToken.none());
    PivotHeader<Sale> empty = axis.find("(Empty)").orElseThrow();
    assertTrue(HeaderMatcher.matches(Sale.of(" ", 1), empty, axis));
    assertFalse(HeaderMatcher.matches(Sale.of("East", 1), empty, axis));
    assertFalse(HeaderMatcher.matches(Sale.of(null, 1), axis.find("East").orElseThrow(), axis));
  }

  @Test
  @DisplayName("bulk matching agrees with per-record matching and header counts")
  void matchAllAgrees() {
    List<Sale> sales = Sale.sample();
    PivotAxis<Sale> axis = axis(sales);
    BitSet[] matches = HeaderMatcher.matchAll(sales, axis);
    for (PivotHeader<Sale> header : axis.headers()) {
      BitSet bits = matches[header.getIndex()];
      assertEquals(header.getMatchedCount(), bits.cardinality(), header.toString());
      for (int i = 0; i < sales.size(); i++) {
        assertEquals(
            HeaderMatcher.matches(sales.get(i), header, axis), bits.get(i), header.toString());
      }
    }
  }
}
