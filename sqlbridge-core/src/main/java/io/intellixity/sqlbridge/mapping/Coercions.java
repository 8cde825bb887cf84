package io.intellixity.sqlbridge.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlbridge.sql.Identifiers;

import java.util.*;

/** Conversions from the string-typed values SHOW / DESCRIBE return into typed values. */
public final class Coercions {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

  private Coercions() {}

  /** "Y"/"N" flags (case-insensitive). Null stays null. */
  public static Boolean yesNo(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    return "Y".equalsIgnoreCase(String.valueOf(raw).trim());
  }

  /** "true"/"false" text. Null stays null. */
  public static Boolean trueFalse(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    return "true".equalsIgnoreCase(String.valueOf(raw).trim());
  }

  /** "ON"/"OFF" switches. */
  public static Boolean onOff(Object raw) {
    if (raw instanceof Boolean b) return b;
    return raw != null && "ON".equalsIgnoreCase(String.valueOf(raw).trim());
  }

  public static Integer toInteger(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Integer i) return i;
    if (raw instanceof Number n) return n.intValue();
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return null;
    try {
      return Integer.valueOf(s);
    } catch (NumberFormatException e) {
      return (int) Double.parseDouble(s);
    }
  }

  public static Long toLong(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Number n) return n.longValue();
    String s = String.valueOf(raw).trim();
    return s.isEmpty() ? null : Long.valueOf(s);
  }

  /** Whole numbers collapse to Long, everything else stays Double. */
  public static Number toNumber(Object raw) {
    if (raw == null) return null;
    double d = raw instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(raw).trim());
    if (d == Math.rint(d) && !Double.isInfinite(d)) return (long) d;
    return d;
  }

  public static Object emptyToNull(Object raw) {
    if (raw instanceof String s && s.isEmpty()) return null;
    return raw;
  }

  public static Map<String, Object> parseJsonObject(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Map<?, ?> m) {
      @SuppressWarnings("unchecked")
      Map<String, Object> mm = (Map<String, Object>) m;
      return mm;
    }
    String s = String.valueOf(raw);
    if (s.isBlank()) return null;
    try {
      return JSON.readValue(s, MAP);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Not a JSON object: " + s, e);
    }
  }

  public static String toJson(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON serializable: " + value.getClass().getName(), e);
    }
  }

  /**
   * Bracketed, comma-delimited text such as {@code ["DB"."SCH"."T1",\n "T2"]}.\n
   * Each element is trimmed of newlines and blanks, escaped quotes are restored and one pair of
   * surrounding double quotes is dropped.
   */
  public static List<String> delimitedList(Object raw) {
    if (raw == null) return new ArrayList<>();
    if (raw instanceof List<?> l) {
      List<String> out = new ArrayList<>();
      for (Object o : l) out.add(String.valueOf(o));
      return out;
    }
    String s = String.valueOf(raw).trim();
    while (s.startsWith("[")) s = s.substring(1);
    while (s.endsWith("]")) s = s.substring(0, s.length() - 1);
    List<String> out = new ArrayList<>();
    if (s.isBlank()) return out;
    for (String part : s.split(",")) {
      String p = part.replace("\n", "").replace("\\\"", "\"").trim();
      if (p.isEmpty()) continue;
      out.add(Identifiers.unquote(p));
    }
    return out;
  }

  /** Copy of {@code row} with lower-cased keys. */
  public static Map<String, Object> lowerKeys(Map<String, Object> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : row.entrySet()) out.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
    return out;
  }

  /**
   * Typed value of a SHOW PARAMETERS row, driven by its "type" column.\n
   * NUMBER yields an integer, NUMBER(p,s) a double, BOOLEAN true/false/null, STRING with "" as null.
   */
  public static Object parameterValue(String type, Object value) {
    if (type == null) throw new IllegalArgumentException("Parameter type is required");
    String v = value == null ? null : String.valueOf(value);
    boolean blank = v == null || v.isEmpty();
    if (type.equals("NUMBER")) return blank ? null : toLong(v);
    if (type.startsWith("NUMBER")) return blank ? null : Double.valueOf(v);
    if (type.equals("BOOLEAN")) return blank ? null : Boolean.valueOf("true".equals(v));
    if (type.equals("STRING")) return blank ? null : v;
    throw new IllegalArgumentException("Parameter type " + type + " isn't processed.");
  }
}
