package io.intellixity.sqlbridge.resources.task;

import io.intellixity.sqlbridge.mapping.Coercions;
import io.intellixity.sqlbridge.sql.Identifiers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** SHOW TASKS / DESC TASK row normalization. */
final class TaskRows {
  private TaskRows() {}

  static Map<String, Object> normalize(Map<String, Object> raw) {
    Map<String, Object> t = new LinkedHashMap<>();
    for (var e : raw.entrySet()) {
      Object v = e.getValue();
      if ("true".equals(v)) v = Boolean.TRUE;
      else if ("false".equals(v)) v = Boolean.FALSE;
      else if ("[]".equals(v)) v = new ArrayList<>();
      else if ("null".equals(v)) v = null;
      t.put(e.getKey(), v);
    }
    if (t.get("name") != null) t.put("name", Identifiers.normalize(String.valueOf(t.get("name"))));
    if (t.containsKey("schedule")) t.put("schedule", TaskSchedule.parse(Coercions.emptyToNull(t.get("schedule"))));
    Map<String, Object> config = Coercions.parseJsonObject(t.get("config"));
    t.put("config", config == null ? new LinkedHashMap<>() : config);
    t.put("predecessors", Coercions.delimitedList(t.get("predecessors")));
    for (String k : new String[] {"comment", "condition", "warehouse", "error_integration"}) {
      if (t.containsKey(k)) t.put(k, Coercions.emptyToNull(t.get(k)));
    }
    return t;
  }

  /** Typed SHOW PARAMETERS value; unknown types pass through as text. */
  static Object parameterValue(String type, Object value) {
    if (value == null) return null;
    String v = String.valueOf(value);
    String t = type == null ? "" : type.toUpperCase(Locale.ROOT);
    if (t.equals("BOOLEAN")) return Boolean.valueOf("true".equalsIgnoreCase(v));
    if (t.startsWith("NUMBER")) return v.isEmpty() ? null : Coercions.toNumber(v);
    return v;
  }
}
