package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.ErrorDetails;
import io.intellixity.sqlbridge.exec.StatementResults;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcStatementExecutorTest {
  private JdbcStatementExecutor exec;

  @BeforeEach
  void setUp() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    exec = new JdbcStatementExecutor(new JdbcHandle("h2", ds, "TEST"));
  }

  @Test
  void ddlCollapsesToAcknowledgment() {
    List<Map<String, Object>> rows = exec.execute("CREATE TABLE T1 (ID INT PRIMARY KEY, NAME VARCHAR(20))");
    assertEquals(1, rows.size());
    assertTrue(StatementResults.isSuccess(rows.get(0)));
  }

  @Test
  void queriesReturnLowerCasedRows() {
    exec.execute("CREATE TABLE T1 (ID INT PRIMARY KEY, NAME VARCHAR(20))");
    exec.execute("INSERT INTO T1 VALUES (1, 'a'), (2, 'b')");
    List<Map<String, Object>> rows = exec.execute("SELECT ID, NAME FROM T1 ORDER BY ID");
    assertEquals(2, rows.size());
    assertEquals("a", rows.get(0).get("name"));
    assertEquals(2, ((Number) rows.get(1).get("id")).intValue());
  }

  @Test
  void emptyResultIsEmptyList() {
    exec.execute("CREATE TABLE T1 (ID INT)");
    assertTrue(exec.execute("SELECT * FROM T1").isEmpty());
  }

  @Test
  void projectionKeepsRequestedKeysOnly() {
    Map<String, Object> row = exec.execute("SELECT 1 AS ONE, 2 AS TWO", List.of("two", "three")).get(0);
    assertEquals(List.of("two", "three"), List.copyOf(row.keySet()));
    assertNull(row.get("three"));
  }

  @Test
  void timestampsBecomeLocalDateTime() {
    Object ts = exec.executeOne("SELECT TIMESTAMP '2024-01-02 03:04:05' AS TS").get("ts");
    assertEquals(LocalDateTime.of(2024, 1, 2, 3, 4, 5), ts);
  }

  @Test
  void scriptYieldsOneResultPerStatement() {
    List<List<Map<String, Object>>> out = exec.executeMany(
        "CREATE TABLE T2 (V VARCHAR(10)); INSERT INTO T2 VALUES ('x;y'); SELECT V FROM T2");
    assertEquals(3, out.size());
    assertTrue(StatementResults.isSuccess(out.get(0).get(0)));
    assertEquals("x;y", out.get(2).get(0).get("v"));
  }

  @Test
  void backendErrorsAreMappedWithDiagnostics() {
    BadRequestException e = assertThrows(BadRequestException.class, () -> exec.execute("SELECT * FROM MISSING_TABLE"));
    assertEquals("SELECT * FROM MISSING_TABLE", e.detail(ErrorDetails.QUERY));
    assertNotNull(e.detail(ErrorDetails.SQLSTATE));
    assertNotNull(ErrorDetails.errno(e));
  }
}
