package io.intellixity.sqlbridge.exec;

import java.util.*;

public final class StatementResults {
  public static final String STATUS = "status";
  public static final String DESCRIPTION = "description";
  public static final String SUCCESSFUL = "successful";

  private StatementResults() {}

  public static Map<String, Object> success() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(DESCRIPTION, SUCCESSFUL);
    return out;
  }

  public static boolean isSuccess(Map<String, Object> row) {
    return row != null && row.size() == 1 && SUCCESSFUL.equals(row.get(DESCRIPTION));
  }

  /**
   * A single one-column "status" row collapses to the acknowledgment row, no rows to an empty list,
   * anything else passes through (projected when {@code desiredProperties} is non-empty).
   */
  public static List<Map<String, Object>> shape(List<Map<String, Object>> rows, List<String> desiredProperties) {
    if (rows == null || rows.isEmpty()) return new ArrayList<>();
    if (rows.size() == 1 && rows.get(0).size() == 1 && rows.get(0).containsKey(STATUS)) {
      List<Map<String, Object>> ack = new ArrayList<>();
      ack.add(success());
      return ack;
    }
    return project(rows, desiredProperties);
  }

  public static List<Map<String, Object>> project(List<Map<String, Object>> rows, List<String> desiredProperties) {
    if (desiredProperties == null || desiredProperties.isEmpty()) return rows;
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      Map<String, Object> p = new LinkedHashMap<>();
      for (String k : desiredProperties) p.put(k, r.get(k));
      out.add(p);
    }
    return out;
  }
}
