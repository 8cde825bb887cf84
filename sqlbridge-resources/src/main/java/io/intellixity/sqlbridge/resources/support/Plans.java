package io.intellixity.sqlbridge.resources.support;

import io.intellixity.sqlbridge.reconcile.DiffOutcome;
import io.intellixity.sqlbridge.reconcile.PropertyDiff;
import io.intellixity.sqlbridge.reconcile.PropertyTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** SET / UNSET fragments from generic diff outcomes. */
public final class Plans {
  private Plans() {}

  /** {@code KEY = value} per TO_SET outcome, rendered through the table's quoting rules. */
  public static List<String> assignments(PropertyTable table, List<DiffOutcome> outcomes) {
    List<String> out = new ArrayList<>();
    for (DiffOutcome o : PropertyDiff.only(outcomes, DiffOutcome.Kind.TO_SET)) {
      out.add(o.property().toUpperCase(Locale.ROOT) + " = " + table.render(o.property(), o.desired()));
    }
    return out;
  }

  public static List<String> unsets(List<DiffOutcome> outcomes) {
    List<String> out = new ArrayList<>();
    for (DiffOutcome o : PropertyDiff.only(outcomes, DiffOutcome.Kind.TO_UNSET)) out.add(o.property());
    return out;
  }
}
