package io.intellixity.sqlbridge.reconcile;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loose equality between a desired (JSON-typed) value and a current (backend-reported) value.\n
 *
 * Numbers compare by magnitude, numeric text compares against numbers, "true"/"false" text
 * compares against booleans. Maps and lists compare element-wise.
 */
public final class Values {
  private Values() {}

  public static boolean equivalent(Object desired, Object current) {
    return equivalent(desired, current, false);
  }

  public static boolean equivalent(Object desired, Object current, boolean ignoreCase) {
    if (desired == null || current == null) return desired == current;
    if (desired instanceof Map<?, ?> dm && current instanceof Map<?, ?> cm) {
      if (dm.size() != cm.size()) return false;
      for (var e : dm.entrySet()) {
        if (!cm.containsKey(e.getKey())) return false;
        if (!equivalent(e.getValue(), cm.get(e.getKey()), ignoreCase)) return false;
      }
      return true;
    }
    if (desired instanceof List<?> dl && current instanceof List<?> cl) {
      if (dl.size() != cl.size()) return false;
      Iterator<?> a = dl.iterator();
      Iterator<?> b = cl.iterator();
      while (a.hasNext()) {
        if (!equivalent(a.next(), b.next(), ignoreCase)) return false;
      }
      return true;
    }
    BigDecimal dn = asNumber(desired);
    BigDecimal cn = asNumber(current);
    if (dn != null && cn != null) return dn.compareTo(cn) == 0;
    if (desired instanceof Boolean || current instanceof Boolean) {
      return String.valueOf(desired).equalsIgnoreCase(String.valueOf(current));
    }
    if (desired instanceof String ds && current instanceof String cs) {
      return ignoreCase ? ds.equalsIgnoreCase(cs) : ds.equals(cs);
    }
    return Objects.equals(desired, current);
  }

  private static BigDecimal asNumber(Object v) {
    if (v instanceof BigDecimal bd) return bd;
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return BigDecimal.valueOf(((Number) v).longValue());
    }
    if (v instanceof Number n) return BigDecimal.valueOf(n.doubleValue());
    if (v instanceof String s) {
      String t = s.trim();
      if (t.isEmpty()) return null;
      char c = t.charAt(0);
      if (!(Character.isDigit(c) || c == '-' || c == '+' || c == '.')) return null;
      try {
        return new BigDecimal(t);
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
