package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.exec.ExecutionHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC-family execution handle (resolved by application code). */
public final class JdbcHandle implements ExecutionHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String defaultDatabase;

  public JdbcHandle(String id, DataSource client, String defaultDatabase) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.defaultDatabase = (defaultDatabase == null || defaultDatabase.isBlank()) ? null : defaultDatabase;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String defaultDatabase() { return defaultDatabase; }
}
