package io.intellixity.sqlbridge.exec;

import io.intellixity.sqlbridge.error.InternalServerErrorException;

import java.util.List;
import java.util.Map;

/**
 * Runs backend statements and returns shaped rows (see {@link StatementResults#shape}).\n
 *
 * Backend failures surface as {@link io.intellixity.sqlbridge.error.RestException} subclasses,
 * classified once at this boundary.
 */
public interface StatementExecutor {
  List<Map<String, Object>> execute(String sql);

  /** One shaped result list per statement of a ';'-separated script. */
  List<List<Map<String, Object>>> executeMany(String sql);

  /** Rows projected onto {@code desiredProperties}; missing keys become null. */
  default List<Map<String, Object>> execute(String sql, List<String> desiredProperties) {
    return StatementResults.project(execute(sql), desiredProperties);
  }

  /** First shaped row; DDL yields the canonical acknowledgment row. */
  default Map<String, Object> executeOne(String sql) {
    List<Map<String, Object>> rows = execute(sql);
    if (rows.isEmpty()) throw new InternalServerErrorException("Statement returned no rows: " + sql);
    return rows.get(0);
  }
}
