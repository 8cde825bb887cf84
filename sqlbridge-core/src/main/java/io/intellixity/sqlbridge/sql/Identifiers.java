package io.intellixity.sqlbridge.sql;

import io.intellixity.sqlbridge.error.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier case-folding and quoting.\n
 *
 * normalize(normalize(x)) == normalize(x) for every accepted x.
 */
public final class Identifiers {
  private static final Pattern ALREADY_QUOTED = Pattern.compile("^(\".+\")$");
  private static final Pattern UNQUOTED_CASE_INSENSITIVE = Pattern.compile("^([_A-Za-z]+[_A-Za-z0-9$]*)$");
  private static final Pattern STORED_UPPER = Pattern.compile("^([_A-Z]+[_A-Z0-9$]*)$");

  private Identifiers() {}

  /**
   * Quoted names pass through (inner quotes must already be doubled), simple names are upper-cased,
   * anything else is wrapped in double quotes with inner quotes doubled.
   */
  public static String normalize(String name) {
    Objects.requireNonNull(name, "name");
    if (ALREADY_QUOTED.matcher(name).matches()) return validateQuoted(name);
    if (UNQUOTED_CASE_INSENSITIVE.matcher(name).matches()) return escapeQuotes(name.toUpperCase(Locale.ROOT));
    return '"' + escapeQuotes(name) + '"';
  }

  /** Name exactly as stored (SHOW output): plain upper-case names stay bare, everything else is quoted. */
  public static String fromStored(String stored) {
    Objects.requireNonNull(stored, "stored");
    return STORED_UPPER.matcher(stored).matches() ? stored : doubleQuote(stored);
  }

  /** Strips one pair of surrounding double quotes, if present. */
  public static String unquote(String name) {
    if (name != null && name.length() > 1 && name.charAt(0) == '"' && name.charAt(name.length() - 1) == '"') {
      return name.substring(1, name.length() - 1);
    }
    return name;
  }

  public static String doubleQuote(String name) {
    if (name == null || name.isEmpty()) return name;
    return '"' + escapeQuotes(name) + '"';
  }

  public static boolean sameName(String a, String b) {
    if (a == null || b == null) return a == b;
    return normalize(a).equals(normalize(b));
  }

  /** Dot-joins already-normalized parts. */
  public static String qualify(String... parts) {
    return String.join(".", parts);
  }

  /** Last part of a dotted name, honoring quoted parts ("A"."B.C" yields "B.C" quoted). */
  public static String lastPart(String dotted) {
    boolean inQuotes = false;
    int start = 0;
    for (int i = 0; i < dotted.length(); i++) {
      char c = dotted.charAt(i);
      if (c == '"') inQuotes = !inQuotes;
      else if (c == '.' && !inQuotes) start = i + 1;
    }
    return dotted.substring(start);
  }

  /** Splits a dotted name into its parts, honoring quoted parts. */
  public static List<String> parts(String dotted) {
    List<String> out = new ArrayList<>();
    boolean inQuotes = false;
    int start = 0;
    for (int i = 0; i < dotted.length(); i++) {
      char c = dotted.charAt(i);
      if (c == '"') inQuotes = !inQuotes;
      else if (c == '.' && !inQuotes) {
        out.add(dotted.substring(start, i));
        start = i + 1;
      }
    }
    out.add(dotted.substring(start));
    return out;
  }

  private static String validateQuoted(String name) {
    String inner = name.substring(1, name.length() - 1).replace("\"\"", "");
    if (inner.indexOf('"') >= 0) {
      throw new BadRequestException("Invalid Identifier " + name
          + ". The inside double quotes need to be escaped when the name itself is double quoted.");
    }
    return name;
  }

  private static String escapeQuotes(String s) {
    return s.replace("\"", "\"\"");
  }
}
