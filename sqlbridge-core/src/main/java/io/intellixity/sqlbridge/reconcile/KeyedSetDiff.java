package io.intellixity.sqlbridge.reconcile;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Diff of a set whose elements are identified by a key (constraints keyed by their column tuple).\n
 *
 * For a key present on both sides:\n
 * - desired name absent and current name system-generated: no change\n
 * - desired name absent and current name user-chosen: drop then add\n
 * - names equal: no change\n
 * - names differ: rename\n
 */
public final class KeyedSetDiff {
  private KeyedSetDiff() {}

  public record Rename<E>(E current, E desired, String from, String to) {}

  public record Result<E>(List<E> dropped, List<Rename<E>> renamed, List<E> added) {
    public boolean isEmpty() { return dropped.isEmpty() && renamed.isEmpty() && added.isEmpty(); }
  }

  /**
   * @param key          element key; compared with {@code equals}
   * @param name         normalized element name, or null when unnamed
   * @param systemNamed  whether a current name was generated by the backend
   */
  public static <E, K> Result<E> diff(Collection<E> current, Collection<E> desired, Function<E, K> key,
                                      Function<E, String> name, Predicate<String> systemNamed) {
    Map<K, E> cur = new LinkedHashMap<>();
    for (E e : current) cur.put(key.apply(e), e);
    Map<K, E> des = new LinkedHashMap<>();
    for (E e : desired) des.put(key.apply(e), e);

    List<E> dropped = new ArrayList<>();
    List<Rename<E>> renamed = new ArrayList<>();
    List<E> added = new ArrayList<>();

    for (var e : cur.entrySet()) {
      if (!des.containsKey(e.getKey())) dropped.add(e.getValue());
    }
    for (var e : des.entrySet()) {
      E d = e.getValue();
      E c = cur.get(e.getKey());
      if (c == null) {
        added.add(d);
        continue;
      }
      String dn = name.apply(d);
      String cn = name.apply(c);
      if (dn == null) {
        if (!systemNamed.test(cn)) {
          dropped.add(c);
          added.add(d);
        }
      } else if (!dn.equals(cn)) {
        renamed.add(new Rename<>(c, d, cn, dn));
      }
    }
    return new Result<>(List.copyOf(dropped), List.copyOf(renamed), List.copyOf(added));
  }
}
