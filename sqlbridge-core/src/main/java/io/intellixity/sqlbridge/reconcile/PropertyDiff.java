package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.error.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Scalar current-vs-desired comparison driven by a {@link PropertyTable}. */
public final class PropertyDiff {
  private PropertyDiff() {}

  /**
   * One outcome per compared property.\n
   * An explicit null in {@code desired} counts as absent.
   */
  public static List<DiffOutcome> diff(PropertyTable table, Map<String, Object> desired, Map<String, Object> current) {
    List<DiffOutcome> out = new ArrayList<>();
    for (String key : table.compared()) {
      Object d = desired.get(key);
      Object c = current.get(key);
      if (table.isImmutable(key)) {
        if (d != null && !table.equivalent(key, d, c)) out.add(DiffOutcome.immutableViolation(key, d, c));
        else out.add(DiffOutcome.unchanged(key));
        continue;
      }
      if (d == null) {
        if (c != null && table.isUnsettable(key)) out.add(DiffOutcome.toUnset(key, c));
        else out.add(DiffOutcome.unchanged(key));
        continue;
      }
      if (table.equivalent(key, d, c)) out.add(DiffOutcome.unchanged(key));
      else out.add(DiffOutcome.toSet(key, d, c));
    }
    return out;
  }

  /** Throws on the first immutable violation; nothing has been executed at this point. */
  public static void rejectViolations(List<DiffOutcome> outcomes, String resourceKind) {
    for (DiffOutcome o : outcomes) {
      if (o.is(DiffOutcome.Kind.IMMUTABLE_VIOLATION)) {
        throw new BadRequestException("`" + o.property() + "` of a " + resourceKind
            + " can't be changed. Trying to change from " + o.current() + " to " + o.desired());
      }
    }
  }

  public static List<DiffOutcome> only(List<DiffOutcome> outcomes, DiffOutcome.Kind kind) {
    List<DiffOutcome> out = new ArrayList<>();
    for (DiffOutcome o : outcomes) if (o.is(kind)) out.add(o);
    return out;
  }
}
