package io.intellixity.sqlbridge.reconcile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Ordered statements that move a resource from its current state to the desired one.\n
 *
 * Regardless of the order the builder is fed, statements come out as UNSET, then SET,
 * then structural changes (columns, keys, predecessors, ...).
 */
public final class ReconciliationPlan {
  private final List<String> statements;

  private ReconciliationPlan(List<String> statements) {
    this.statements = List.copyOf(statements);
  }

  public static ReconciliationPlan empty() { return new ReconciliationPlan(List.of()); }

  public static Builder builder() { return new Builder(); }

  public List<String> statements() { return statements; }

  public boolean isEmpty() { return statements.isEmpty(); }

  public int size() { return statements.size(); }

  @Override
  public String toString() { return "ReconciliationPlan" + statements; }

  public static final class Builder {
    private final List<String> unsets = new ArrayList<>();
    private final List<String> sets = new ArrayList<>();
    private final List<String> structural = new ArrayList<>();

    private Builder() {}

    /** {@code <alterPrefix> UNSET k1<sep>k2}; nothing when {@code keys} is empty. */
    public Builder unset(String alterPrefix, Collection<String> keys, String separator) {
      if (keys.isEmpty()) return this;
      List<String> upper = new ArrayList<>(keys.size());
      for (String k : keys) upper.add(k.toUpperCase(Locale.ROOT));
      unsets.add(alterPrefix + " UNSET " + String.join(separator, upper));
      return this;
    }

    /** {@code <alterPrefix> SET a1<sep>a2}; nothing when {@code assignments} is empty. */
    public Builder set(String alterPrefix, Collection<String> assignments, String separator) {
      if (assignments.isEmpty()) return this;
      sets.add(alterPrefix + " SET " + String.join(separator, assignments));
      return this;
    }

    public Builder unsetStatement(String sql) { unsets.add(sql); return this; }

    public Builder setStatement(String sql) { sets.add(sql); return this; }

    public Builder statement(String sql) { structural.add(sql); return this; }

    public Builder statements(Collection<String> sql) { structural.addAll(sql); return this; }

    public ReconciliationPlan build() {
      List<String> all = new ArrayList<>(unsets.size() + sets.size() + structural.size());
      all.addAll(unsets);
      all.addAll(sets);
      all.addAll(structural);
      return new ReconciliationPlan(all);
    }
  }
}
