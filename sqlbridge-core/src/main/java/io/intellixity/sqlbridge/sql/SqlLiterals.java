package io.intellixity.sqlbridge.sql;

/** Value rendering for generated statements. */
public final class SqlLiterals {
  private SqlLiterals() {}

  /**
   * Single-quotes strings (an existing surrounding pair is stripped first, inner quotes are doubled).
   * Null renders as an empty string; other values render unquoted.
   */
  public static String singleQuote(Object value) {
    if (value == null) return "";
    if (!(value instanceof String s)) return render(value);
    if (!s.isEmpty() && s.charAt(0) == '\'' && s.charAt(s.length() - 1) == '\'') {
      s = s.length() == 1 ? "" : s.substring(1, s.length() - 1);
    }
    return "'" + s.replace("'", "''") + "'";
  }

  /** Unquoted rendering: booleans lower-case, numbers without grouping, strings verbatim. */
  public static String render(Object value) {
    if (value == null) return "null";
    if (value instanceof Boolean b) return b ? "true" : "false";
    if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
      return String.valueOf(d.longValue());
    }
    if (value instanceof java.math.BigDecimal bd) return bd.toPlainString();
    return String.valueOf(value);
  }

  /** Pattern literal for LIKE / STARTS WITH clauses. */
  public static String pattern(String raw) {
    return "'" + (raw == null ? "" : raw.replace("'", "''")) + "'";
  }
}
