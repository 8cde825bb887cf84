package io.intellixity.sqlbridge.resources.support;

import io.intellixity.sqlbridge.mapping.Coercions;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Folds SHOW PARAMETERS rows (key, value, level, type) into a resource row. */
public final class ParameterRows {
  private ParameterRows() {}

  /** Typed value when set at {@code level}, null when inherited. */
  public static void mergeTyped(Map<String, Object> into, List<Map<String, Object>> params, String level) {
    for (Map<String, Object> p : params) {
      String key = String.valueOf(p.get("key")).toLowerCase(Locale.ROOT);
      Object value = level.equals(p.get("level"))
          ? Coercions.parameterValue(String.valueOf(p.get("type")), p.get("value"))
          : null;
      into.put(key, value);
    }
  }

  /** Raw values for the named keys only, whatever level they were set at. */
  public static void mergeRaw(Map<String, Object> into, List<Map<String, Object>> params, List<String> keys) {
    for (Map<String, Object> p : params) {
      String key = String.valueOf(p.get("key")).toLowerCase(Locale.ROOT);
      if (keys.contains(key)) into.put(key, p.get("value"));
    }
  }
}
