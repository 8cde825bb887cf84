package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.exec.StatementResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;

/**
 * {@link StatementExecutor} over a {@link DataSource}.\n
 *
 * Every call borrows one connection and returns it before completing. Statements that produce
 * no result set answer with a single "status" row, which shaping turns into the acknowledgment.
 */
public final class JdbcStatementExecutor implements StatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);
  static final String STATUS_TEXT = "Statement executed successfully.";

  private final JdbcHandle handle;
  private final DataSource ds;
  private final JdbcErrorMapper errors;

  public JdbcStatementExecutor(JdbcHandle handle, JdbcErrorMapper errors) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.ds = handle.client();
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  public JdbcStatementExecutor(JdbcHandle handle) {
    this(handle, new JdbcErrorMapper());
  }

  @Override
  public List<Map<String, Object>> execute(String sql) {
    Objects.requireNonNull(sql, "sql");
    try (Connection c = ds.getConnection()) {
      return StatementResults.shape(run(c, "EXECUTE", sql), null);
    } catch (SQLException e) {
      throw errors.map(e, sql);
    }
  }

  @Override
  public List<List<Map<String, Object>>> executeMany(String sql) {
    Objects.requireNonNull(sql, "sql");
    List<List<Map<String, Object>>> out = new ArrayList<>();
    String current = sql;
    try (Connection c = ds.getConnection()) {
      for (String stmt : SqlScripts.split(sql)) {
        current = stmt;
        out.add(StatementResults.shape(run(c, "EXECUTE_MANY", stmt), null));
      }
      return out;
    } catch (SQLException e) {
      throw errors.map(e, current);
    }
  }

  private List<Map<String, Object>> run(Connection c, String op, String sql) throws SQLException {
    long start = System.nanoTime();
    debugSql(op, sql);
    try (Statement st = c.createStatement()) {
      List<Map<String, Object>> rows;
      if (st.execute(sql)) {
        try (ResultSet rs = st.getResultSet()) {
          rows = new JdbcRowAdapter(rs).readAll();
        }
      } else {
        rows = new ArrayList<>();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put(StatementResults.STATUS, STATUS_TEXT);
        rows.add(status);
      }
      debugDone(op, rows.size(), System.nanoTime() - start);
      return rows;
    }
  }

  private void debugSql(String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlbridge.jdbc op={} handleId={} database={} sql={}",
        op, handle.id(), handle.defaultDatabase() == null ? "null" : handle.defaultDatabase(), sql);
  }

  private void debugDone(String op, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlbridge.jdbc_done op={} durationMs={} rows={}", op, durationNanos / 1_000_000.0, rows);
  }
}
