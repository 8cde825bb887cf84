package io.intellixity.sqlbridge.reconcile;

import java.util.Objects;

/** Verdict of the generic diff for one declared property. */
public record DiffOutcome(String property, Kind kind, Object desired, Object current) {
  public enum Kind { UNCHANGED, TO_SET, TO_UNSET, IMMUTABLE_VIOLATION }

  public DiffOutcome {
    Objects.requireNonNull(property, "property");
    Objects.requireNonNull(kind, "kind");
  }

  public static DiffOutcome unchanged(String property) {
    return new DiffOutcome(property, Kind.UNCHANGED, null, null);
  }

  public static DiffOutcome toSet(String property, Object desired, Object current) {
    return new DiffOutcome(property, Kind.TO_SET, desired, current);
  }

  public static DiffOutcome toUnset(String property, Object current) {
    return new DiffOutcome(property, Kind.TO_UNSET, null, current);
  }

  public static DiffOutcome immutableViolation(String property, Object desired, Object current) {
    return new DiffOutcome(property, Kind.IMMUTABLE_VIOLATION, desired, current);
  }

  public boolean is(Kind k) { return kind == k; }
}
