package com.gentoro.onepivot.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onepivot.Sale;
import com.gentoro.onepivot.exception.PivotCancelledException;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.field.SortDirection;
import com.gentoro.onepivot.value.Value;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HierarchyBuilderTest {

  private final HierarchyBuilder builder = new HierarchyBuilder("(Empty)");

  private static List<String> paths(PivotAxis<?> axis) {
    return axis.headers().stream().map(PivotHeader::getPath).collect(Collectors.toList());
  }

  @Test
  @DisplayName("axis without fields has a single Total header")
  void emptyAxis() {
    PivotAxis<Sale> axis =
        builder.build(Sale.sample(), List.of(), false, true, true, CancellationToken.none());
    assertEquals(1, axis.size());
    PivotHeader<Sale> total = axis.headers().get(0);
    assertTrue(total.isAxisTotal());
    assertTrue(total.isTotal());
    assertFalse(total.isGrandTotal());
    assertEquals("Total", total.getFormattedValue());
    assertEquals(6, total.getMatchedCount());
    assertNull(total.getField());
  }

  @Test
  @DisplayName("two levels: groups sorted, subtotals closing groups, grand total last")
  void twoLevels() {
    PivotAxis<Sale> axis =
        builder.build(
            Sale.sample(),
            List.of(Sale.regionField(), Sale.countryField()),
            true,
            true,
            true,
            CancellationToken.none());

    assertEquals(
        List.of(
            "East",
            "East/China",
            "East/Japan",
            "East/East Total",
            "West",
            "West/France",
            "West/Spain",
            "West/West Total",
            "Grand Total"),
        paths(axis));

    PivotHeader<Sale> eastTotal = axis.find("East/East Total").orElseThrow();
    assertTrue(eastTotal.isSubtotal());
    assertEquals(1, eastTotal.getLevel());
    assertEquals(3, eastTotal.getMatchedCount());
    assertEquals("Region", eastTotal.getField().getKey());
    assertEquals(axis.find("East").orElseThrow(), axis.parentOf(eastTotal).orElseThrow());

    PivotHeader<Sale> grand = axis.grandTotal().orElseThrow();
    assertTrue(grand.isGrandTotal());
    assertEquals(6, grand.getMatchedCount());
    assertTrue(axis.headers().stream().allMatch(PivotHeader::isRowAxis));
  }

  @Test
  @DisplayName("parents always precede their children in the flattened list")
  void preOrder() {
    PivotAxis<Sale> axis =
        builder.build(
            Sale.sample(),
            List.of(Sale.regionField(), Sale.countryField(), Sale.productField()),
            true,
            true,
            true,
            CancellationToken.none());
    List<PivotHeader<Sale>> headers = axis.headers();
    for (int i = 0; i < headers.size(); i++) {
      PivotHeader<Sale> h = headers.get(i);
      if (!h.isRoot()) {
        assertTrue(headers.indexOf(axis.node(h.getParentIndex())) < i, h.toString());
      }
    }
    assertEquals(1, axis.roots().stream().filter(PivotHeader::isGrandTotal).count());
  }

  @Test
  @DisplayName("three levels: every intermediate group gets a subtotal, leaves never do")
  void threeLevels() {
    PivotAxis<Sale> axis =
        builder.build(
            Sale.sample(),
            List.of(Sale.regionField(), Sale.countryField(), Sale.productField()),
            true,
            true,
            false,
            CancellationToken.none());
    assertEquals(
        List.of(
            "East",
            "East/China",
            "East/China/Rice",
            "East/China/Tea",
            "East/China/China Total",
            "East/Japan",
            "East/Japan/Tea",
            "East/Japan/Japan Total",
            "East/East Total",
            "West",
            "West/France",
            "West/France/Tea",
            "West/France/Wine",
            "West/France/France Total",
            "West/Spain",
            "West/Spain/Wine",
            "West/Spain/Spain Total",
            "West/West Total"),
        paths(axis));
    assertTrue(axis.grandTotal().isEmpty());
  }

  @Test
  @DisplayName("subtotals follow both the global and the per-field switch")
  void subtotalSwitches() {
    PivotField<Sale> region =
        PivotField.<Sale>builder("Region").extractor(Sale::region).disableSubtotals().build();
    PivotAxis<Sale> perField =
        builder.build(
            Sale.sample(),
            List.of(region, Sale.countryField()),
            true,
            true,
            true,
            CancellationToken.none());
    assertTrue(perField.headers().stream().noneMatch(PivotHeader::isSubtotal));

    PivotAxis<Sale> global =
        builder.build(
            Sale.sample(),
            List.of(Sale.regionField(), Sale.countryField()),
            true,
            false,
            true,
            CancellationToken.none());
    assertTrue(global.headers().stream().noneMatch(PivotHeader::isSubtotal));
  }

  @Test
  @DisplayName("grand total needs the global switch and at least one field asking for it")
  void grandTotalSwitches() {
    PivotField<Sale> region =
        PivotField.<Sale>builder("Region").extractor(Sale::region).disableGrandTotal().build();
    assertTrue(
        builder
            .build(Sale.sample(), List.of(region), true, true, true, CancellationToken.none())
            .grandTotal()
            .isEmpty());
    assertTrue(
        builder
            .build(
                Sale.sample(),
                List.of(Sale.regionField()),
                true,
                true,
                false,
                CancellationToken.none())
            .grandTotal()
            .isEmpty());
  }

  @Test
  @DisplayName("null and blank values share the (Empty) group")
  void emptyGroup() {
    List<Sale> sales = Arrays.asList(Sale.of(null, 1), Sale.of(" ", 2), Sale.of("East", 3));
    PivotAxis<Sale> axis =
        builder.build(
            sales, List.of(Sale.regionField()), true, true, false, CancellationToken.none());
    assertEquals(2, axis.size());
    // "(" sorts before letters
    PivotHeader<Sale> empty = axis.headers().get(0);
    assertTrue(empty.isEmptyGroup());
    assertEquals(Value.text("(Empty)"), empty.getValue());
    assertEquals("(Empty)", empty.getFormattedValue());
    assertEquals(2, empty.getMatchedCount());
  }

  @Test
  @DisplayName("sort direction: descending and first appearance")
  void sortDirections() {
    PivotField<Sale> descending =
        PivotField.<Sale>builder("Country")
            .extractor(Sale::country)
            .sort(SortDirection.DESCENDING)
            .build();
    assertEquals(
        List.of("Spain", "Japan", "France", "China"),
        paths(
            builder.build(
                Sale.sample(), List.of(descending), true, true, false, CancellationToken.none())));

    PivotField<Sale> unsorted =
        PivotField.<Sale>builder("Product")
            .extractor(Sale::product)
            .sort(SortDirection.NONE)
            .build();
    assertEquals(
        List.of("Tea", "Rice", "Wine"),
        paths(
            builder.build(
                Sale.sample(), List.of(unsorted), true, true, false, CancellationToken.none())));
  }

  @Test
  @DisplayName("numeric groups sort numerically, not as text")
  void numericOrdering() {
    PivotField<Sale> amount = PivotField.<Sale>builder("Amount").extractor(Sale::amount).build();
    assertEquals(
        List.of("2", "5", "8", "10", "20", "40"),
        paths(
            builder.build(
                Sale.sample(), List.of(amount), true, true, false, CancellationToken.none())));
  }

  @Test
  @DisplayName("values with the same text form one group, keyed by the first value seen")
  void textEquivalentValuesMerge() {
    PivotField<Sale> code =
        PivotField.<Sale>builder("Code")
            .extractor(s -> "East".equals(s.region()) ? (Object) 1 : "1")
            .build();
    List<Sale> sales = List.of(Sale.of("East", 10), Sale.of("West", 5), Sale.of("East", 1));
    PivotAxis<Sale> axis =
        builder.build(sales, List.of(code), true, true, false, CancellationToken.none());

    assertEquals(List.of("1"), paths(axis));
    PivotHeader<Sale> group = axis.headers().get(0);
    assertEquals(Value.number(1), group.getValue());
    assertEquals(3, group.getMatchedCount());
    assertEquals(3, HeaderMatcher.matchAll(sales, axis)[group.getIndex()].cardinality());
  }

  @Test
  @DisplayName("a cancelled token stops the build")
  void cancellation() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    assertThrows(
        PivotCancelledException.class,
        () -> builder.build(Sale.sample(), List.of(Sale.regionField()), true, true, true, token));
  }
}
