package io.intellixity.sqlbridge.sql;

import java.util.Locale;
import java.util.Set;

/** Collapses equivalent column types onto one spelling so that diffs only see real changes. */
public final class DataTypes {
  private static final Set<String> INTEGERS = Set.of("INT", "INTEGER", "BIGINT", "SMALLINT", "TINYINT", "BYTEINT", "NUMBER");
  private static final Set<String> FLOATS = Set.of("DOUBLE", "DOUBLEPRECISION", "REAL");
  private static final Set<String> STRINGS = Set.of("STRING", "TEXT", "VARCHAR");
  private static final Set<String> CHARS = Set.of("CHAR", "CHARACTER");

  private DataTypes() {}

  public static String normalize(String datatype) {
    if (datatype == null) return null;
    String t = datatype.toUpperCase(Locale.ROOT).replace(" ", "");
    if (INTEGERS.contains(t)) return "NUMBER(38,0)";
    if (FLOATS.contains(t)) return "FLOAT";
    if (STRINGS.contains(t)) return "VARCHAR(16777216)";
    if (CHARS.contains(t)) return "VARCHAR(1)";
    if (t.equals("VARBINARY")) return "BINARY";
    return t.replace("DECIMAL", "NUMBER")
        .replace("NUMERIC", "NUMBER")
        .replace("STRING", "VARCHAR")
        .replace("TEXT", "VARCHAR");
  }

  public static boolean equivalent(String a, String b) {
    String na = normalize(a);
    String nb = normalize(b);
    return na == null ? nb == null : na.equals(nb);
  }
}
