package io.intellixity.sqlbridge.reconcile;

import java.util.*;
import java.util.function.Function;

/** Set difference over dependency names (task predecessors), compared by a normalized key. */
public final class DependencyListDiff {
  private DependencyListDiff() {}

  public record Result(List<String> removed, List<String> added) {
    public boolean isEmpty() { return removed.isEmpty() && added.isEmpty(); }
  }

  public static Result diff(List<String> current, List<String> desired, Function<String, String> key) {
    List<String> cur = current == null ? List.of() : current;
    List<String> des = desired == null ? List.of() : desired;
    Set<String> curKeys = new HashSet<>();
    for (String c : cur) curKeys.add(key.apply(c));
    Set<String> desKeys = new HashSet<>();
    for (String d : des) desKeys.add(key.apply(d));

    List<String> removed = new ArrayList<>();
    for (String c : cur) if (!desKeys.contains(key.apply(c))) removed.add(c);
    List<String> added = new ArrayList<>();
    for (String d : des) if (!curKeys.contains(key.apply(d))) added.add(d);
    return new Result(List.copyOf(removed), List.copyOf(added));
  }
}
