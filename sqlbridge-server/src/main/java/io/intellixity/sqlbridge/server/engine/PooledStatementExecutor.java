package io.intellixity.sqlbridge.server.engine;

import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.jdbc.JdbcErrorMapper;
import io.intellixity.sqlbridge.jdbc.JdbcHandle;
import io.intellixity.sqlbridge.jdbc.JdbcStatementExecutor;
import io.intellixity.sqlbridge.jdbc.PooledDataSources;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs statements on the default pool, which is only built by the first statement.
 */
public final class PooledStatementExecutor implements StatementExecutor {
  private final PooledDataSources pools;
  private final JdbcErrorMapper errors = new JdbcErrorMapper();

  public PooledStatementExecutor(PooledDataSources pools) {
    this.pools = Objects.requireNonNull(pools, "pools");
  }

  @Override
  public List<Map<String, Object>> execute(String sql) {
    return jdbc().execute(sql);
  }

  @Override
  public List<List<Map<String, Object>>> executeMany(String sql) {
    return jdbc().executeMany(sql);
  }

  private JdbcStatementExecutor jdbc() {
    JdbcHandle handle = new JdbcHandle("jdbc:" + PooledDataSources.DEFAULT_KEY, pools.get(), null);
    return new JdbcStatementExecutor(handle, errors);
  }
}
