package io.intellixity.sqlbridge.resource;

import java.util.List;
import java.util.Map;

/**
 * What a translator returns: the statements it issued (in order) and the response payload,
 * either a single object or a list of objects.
 */
public record HandlerResult(List<String> statements, Object result) {
  public HandlerResult {
    statements = statements == null ? List.of() : List.copyOf(statements);
  }

  public static HandlerResult of(List<String> statements, Object result) {
    return new HandlerResult(statements, result);
  }

  public static HandlerResult single(String sql, Map<String, Object> row) {
    return new HandlerResult(List.of(sql), row);
  }

  public static HandlerResult list(String sql, List<Map<String, Object>> rows) {
    return new HandlerResult(List.of(sql), rows);
  }

  /** Last issued statement or null. */
  public String lastStatement() {
    return statements.isEmpty() ? null : statements.get(statements.size() - 1);
  }
}
