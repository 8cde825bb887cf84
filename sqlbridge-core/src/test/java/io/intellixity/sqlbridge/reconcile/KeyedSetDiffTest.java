package io.intellixity.sqlbridge.reconcile;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class KeyedSetDiffTest {

  private record Key(String name, List<String> columns) {}

  private static KeyedSetDiff.Result<Key> diff(List<Key> current, List<Key> desired) {
    return KeyedSetDiff.diff(current, desired, Key::columns, Key::name,
        n -> n == null || n.startsWith("SYS_CONSTRAINT_"));
  }

  @Test
  void unnamedDesiredOverSystemNameIsNoChange() {
    assertTrue(diff(List.of(new Key("SYS_CONSTRAINT_1", List.of("A"))), List.of(new Key(null, List.of("A")))).isEmpty());
  }

  @Test
  void unnamedDesiredOverUserNameIsDropAndAdd() {
    KeyedSetDiff.Result<Key> r = diff(List.of(new Key("PK_A", List.of("A"))), List.of(new Key(null, List.of("A"))));
    assertEquals(List.of(new Key("PK_A", List.of("A"))), r.dropped());
    assertEquals(List.of(new Key(null, List.of("A"))), r.added());
  }

  @Test
  void differentNameIsRename() {
    KeyedSetDiff.Result<Key> r = diff(List.of(new Key("U1", List.of("A", "B"))), List.of(new Key("U2", List.of("A", "B"))));
    assertEquals(1, r.renamed().size());
    assertEquals("U1", r.renamed().get(0).from());
    assertEquals("U2", r.renamed().get(0).to());
    assertTrue(r.dropped().isEmpty());
  }

  @Test
  void missingKeysAreDroppedAndNewKeysAdded() {
    KeyedSetDiff.Result<Key> r = diff(List.of(new Key("U1", List.of("A"))), List.of(new Key("U2", List.of("B"))));
    assertEquals(List.of(new Key("U1", List.of("A"))), r.dropped());
    assertEquals(List.of(new Key("U2", List.of("B"))), r.added());
    assertTrue(r.renamed().isEmpty());
  }
}
