package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.error.BadRequestException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

final class OrderedListDiffTest {

  private record Col(String name, String type) {}

  private static List<String> compare(Col c, Col d) {
    List<String> out = new ArrayList<>();
    if (!Objects.equals(c.type(), d.type())) out.add("modify " + d.name() + " " + d.type());
    return out;
  }

  @Test
  void reportsModificationsAndAppends() {
    OrderedListDiff.Result<Col> r = OrderedListDiff.diff(
        List.of(new Col("A", "INT"), new Col("B", "TEXT")),
        List.of(new Col("A", "INT"), new Col("B", "VARCHAR(10)"), new Col("C", "DATE")),
        Col::name, OrderedListDiffTest::compare, "column");
    assertEquals(1, r.modifications().size());
    assertEquals(1, r.modifications().get(0).position());
    assertEquals(List.of("modify B VARCHAR(10)"), r.modifications().get(0).clauses());
    assertEquals(List.of(new Col("C", "DATE")), r.appended());
  }

  @Test
  void identicalListsProduceNothing() {
    List<Col> cols = List.of(new Col("A", "INT"));
    assertTrue(OrderedListDiff.diff(cols, cols, Col::name, OrderedListDiffTest::compare, "column").isEmpty());
  }

  @Test
  void removalIsRejected() {
    BadRequestException e = assertThrows(BadRequestException.class, () -> OrderedListDiff.diff(
        List.of(new Col("A", "INT"), new Col("B", "INT")), List.of(new Col("A", "INT")),
        Col::name, OrderedListDiffTest::compare, "column"));
    assertTrue(e.getMessage().contains("B"));
  }

  @Test
  void renameAtPositionIsRejected() {
    assertThrows(BadRequestException.class, () -> OrderedListDiff.diff(
        List.of(new Col("A", "INT")), List.of(new Col("Z", "INT")),
        Col::name, OrderedListDiffTest::compare, "column"));
  }
}
