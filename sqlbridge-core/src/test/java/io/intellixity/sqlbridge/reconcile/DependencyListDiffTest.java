package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.sql.Identifiers;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DependencyListDiffTest {

  private static String key(String name) {
    return Identifiers.normalize(Identifiers.unquote(Identifiers.lastPart(name)));
  }

  @Test
  void onlyNewPredecessorsAreAdded() {
    DependencyListDiff.Result r = DependencyListDiff.diff(
        List.of("DB.SCH.T1", "DB.SCH.T2"), List.of("t2", "t3"), DependencyListDiffTest::key);
    assertEquals(List.of("DB.SCH.T1"), r.removed());
    assertEquals(List.of("t3"), r.added());
  }

  @Test
  void emptyDesiredRemovesAll() {
    DependencyListDiff.Result r = DependencyListDiff.diff(List.of("A", "B"), List.of(), DependencyListDiffTest::key);
    assertEquals(List.of("A", "B"), r.removed());
    assertTrue(r.added().isEmpty());
    assertTrue(DependencyListDiff.diff(null, null, DependencyListDiffTest::key).isEmpty());
  }
}
