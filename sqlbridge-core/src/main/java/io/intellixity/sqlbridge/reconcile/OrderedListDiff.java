package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.error.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Position-wise diff of an ordered list (table columns).\n
 *
 * Elements are matched by position. Renaming, reordering or removing an element is rejected;
 * desired elements beyond the current length are reported as appended.
 */
public final class OrderedListDiff {
  private OrderedListDiff() {}

  public record Modification<E>(int position, E current, E desired, List<String> clauses) {}

  public record Result<E>(List<Modification<E>> modifications, List<E> appended) {
    public boolean isEmpty() { return modifications.isEmpty() && appended.isEmpty(); }
  }

  /**
   * @param identity normalized element name
   * @param compare  clauses needed to turn the current element into the desired one (may throw)
   * @param label    element noun used in error messages
   */
  public static <E> Result<E> diff(List<E> current, List<E> desired, Function<E, String> identity,
                                   BiFunction<E, E, List<String>> compare, String label) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(desired, "desired");
    if (current.size() > desired.size()) {
      List<String> removed = new ArrayList<>();
      for (E e : current.subList(desired.size(), current.size())) removed.add(identity.apply(e));
      throw new BadRequestException("Can't remove a " + label + " for create_or_update. These "
          + label + "s are removed " + String.join(",", removed) + ".");
    }
    List<Modification<E>> mods = new ArrayList<>();
    for (int i = 0; i < current.size(); i++) {
      E c = current.get(i);
      E d = desired.get(i);
      String cn = identity.apply(c);
      String dn = identity.apply(d);
      if (!Objects.equals(cn, dn)) {
        throw new BadRequestException("Can't remove or reorder a " + label + " for create_or_update. "
            + cn + " at position " + i + " is replaced by " + dn + ".");
      }
      List<String> clauses = compare.apply(c, d);
      if (clauses != null && !clauses.isEmpty()) mods.add(new Modification<>(i, c, d, List.copyOf(clauses)));
    }
    List<E> appended = new ArrayList<>(desired.subList(current.size(), desired.size()));
    return new Result<>(List.copyOf(mods), appended);
  }
}
