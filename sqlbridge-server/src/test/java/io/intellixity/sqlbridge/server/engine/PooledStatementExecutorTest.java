package io.intellixity.sqlbridge.server.engine;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.sqlbridge.error.RestException;
import io.intellixity.sqlbridge.jdbc.PooledDataSources;
import io.intellixity.sqlbridge.jdbc.auth.SessionRenewingExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PooledStatementExecutorTest {
  private final PooledDataSources pools = new PooledDataSources(key -> {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl("jdbc:h2:mem:server_" + key + ";DB_CLOSE_DELAY=-1");
    hc.setMaximumPoolSize(2);
    return hc;
  });

  @AfterEach
  void close() {
    pools.close();
  }

  @Test
  void poolIsBuiltByTheFirstStatement() {
    PooledStatementExecutor exec = new PooledStatementExecutor(pools);
    assertFalse(pools.isCreated(PooledDataSources.DEFAULT_KEY));

    List<Map<String, Object>> rows = exec.execute("SELECT 1 AS ONE");
    assertTrue(pools.isCreated(PooledDataSources.DEFAULT_KEY));
    assertEquals(1, ((Number) rows.get(0).get("one")).intValue());
  }

  @Test
  void backendErrorsAreMapped() {
    PooledStatementExecutor exec = new PooledStatementExecutor(pools);
    RestException e = assertThrows(RestException.class, () -> exec.execute("SELECT * FROM NO_SUCH_TABLE"));
    assertTrue(e.getMessage().contains("NO_SUCH_TABLE"), e::getMessage);
  }

  @Test
  void renewerEvictsAndKeepsServing() {
    PoolEvictingRenewer renewer = new PoolEvictingRenewer(pools, () -> "t0k");
    SessionRenewingExecutor exec = new SessionRenewingExecutor(new PooledStatementExecutor(pools), renewer);
    exec.execute("SELECT 1");

    renewer.renew();
    assertEquals(1, exec.executeMany("SELECT 1; SELECT 2").get(1).size());
    assertEquals("Snowflake Token=\"t0k\"", renewer.authorizationHeader());
  }
}
