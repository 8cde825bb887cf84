package io.intellixity.sqlbridge.exec;

/**
 * Resolved runtime binding to a backend.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource\n
 */
public interface ExecutionHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an executor. */
  TClient client();

  /** Default database the session resolves unqualified names against, or null. */
  String defaultDatabase();
}
