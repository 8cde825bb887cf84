package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.error.BadRequestException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PropertyDiffTest {

  private static final PropertyTable TABLE = PropertyTable.builder()
      .required("name")
      .optional("warehouse_size", "auto_suspend", "comment")
      .immutable("instance_family")
      .readOnly("owner")
      .unsettable("auto_suspend", "comment")
      .quoted("comment")
      .caseInsensitive("warehouse_size")
      .special("name")
      .build();

  private static Map<String, Object> map(Object... kv) {
    Map<String, Object> m = new HashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  private static DiffOutcome find(List<DiffOutcome> out, String key) {
    return out.stream().filter(o -> o.property().equals(key)).findFirst().orElseThrow();
  }

  @Test
  void comparedSkipsSpecialProperties() {
    assertEquals(List.of("warehouse_size", "auto_suspend", "comment", "instance_family", "owner"), TABLE.compared());
  }

  @Test
  void equalValuesAreUnchanged() {
    List<DiffOutcome> out = PropertyDiff.diff(TABLE,
        map("warehouse_size", "small", "auto_suspend", 60, "comment", "c"),
        map("warehouse_size", "SMALL", "auto_suspend", "60", "comment", "c"));
    assertTrue(out.stream().allMatch(o -> o.is(DiffOutcome.Kind.UNCHANGED)));
  }

  @Test
  void changedValueIsSet() {
    List<DiffOutcome> out = PropertyDiff.diff(TABLE, map("auto_suspend", 120), map("auto_suspend", 60));
    DiffOutcome o = find(out, "auto_suspend");
    assertEquals(DiffOutcome.Kind.TO_SET, o.kind());
    assertEquals(120, o.desired());
  }

  @Test
  void absentUnsettableIsUnset() {
    Map<String, Object> desired = map("comment", null);
    List<DiffOutcome> out = PropertyDiff.diff(TABLE, desired, map("comment", "old", "warehouse_size", "SMALL"));
    assertEquals(DiffOutcome.Kind.TO_UNSET, find(out, "comment").kind());
    // warehouse_size is not unsettable
    assertEquals(DiffOutcome.Kind.UNCHANGED, find(out, "warehouse_size").kind());
  }

  @Test
  void immutableAndReadOnlyChangesAreViolations() {
    List<DiffOutcome> out = PropertyDiff.diff(TABLE,
        map("instance_family", "CPU_X64_S", "owner", "PUBLIC"),
        map("instance_family", "CPU_X64_XS", "owner", "SYSADMIN"));
    assertEquals(2, PropertyDiff.only(out, DiffOutcome.Kind.IMMUTABLE_VIOLATION).size());
    BadRequestException e = assertThrows(BadRequestException.class, () -> PropertyDiff.rejectViolations(out, "compute pool"));
    assertTrue(e.getMessage().startsWith("`instance_family` of a compute pool can't be changed"));
  }

  @Test
  void absentImmutableIsNotAViolation() {
    List<DiffOutcome> out = PropertyDiff.diff(TABLE, map(), map("instance_family", "CPU_X64_XS"));
    assertTrue(PropertyDiff.only(out, DiffOutcome.Kind.IMMUTABLE_VIOLATION).isEmpty());
  }

  @Test
  void requiredPropertiesAreChecked() {
    BadRequestException e = assertThrows(BadRequestException.class, () -> TABLE.requirePresent(map("comment", "x")));
    assertEquals("Required property name is missing", e.getMessage());
  }

  @Test
  void renderQuotesOnlyQuotedProperties() {
    assertEquals("'a b'", TABLE.render("comment", "a b"));
    assertEquals("60", TABLE.render("auto_suspend", 60));
  }
}
