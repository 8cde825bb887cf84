package io.intellixity.sqlbridge.resources.schema;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.resource.HandlerResult;
import io.intellixity.sqlbridge.resources.RecordingExecutor;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.sqlbridge.resources.RecordingExecutor.row;
import static io.intellixity.sqlbridge.resources.Requests.*;
import static org.junit.jupiter.api.Assertions.*;

final class SchemaTranslatorTest {

  private static HandlerResult run(NormalizedRequest r, RecordingExecutor exec) {
    return new SchemaTranslator(r, exec).execute();
  }

  @Test
  void listIsScopedToTheDatabase() {
    RecordingExecutor exec = new RecordingExecutor()
        .answer("SHOW SCHEMAS ", List.of(row("name", "PUBLIC", "database_name", "DB1", "is_default", "Y",
            "is_current", "N", "comment", "", "retention_time", "1")))
        .answer("SHOW PARAMETERS IN SCHEMA DB1.PUBLIC", List.of(
            row("key", "PIPE_EXECUTION_PAUSED", "value", "false", "level", "", "type", "BOOLEAN")));

    HandlerResult r = run(get("/api/v2/databases/db1/schemas", Map.of("like", "P%", "history", "true")), exec);

    assertEquals(List.of("SHOW SCHEMAS HISTORY LIKE 'P%' IN DATABASE DB1 ", "SHOW PARAMETERS IN SCHEMA DB1.PUBLIC"),
        r.statements());
    @SuppressWarnings("unchecked")
    Map<String, Object> pub = ((List<Map<String, Object>>) r.result()).get(0);
    assertEquals(Boolean.TRUE, pub.get("is_default"));
    assertEquals(Boolean.FALSE, pub.get("pipe_execution_paused"));
    assertEquals(1, pub.get("data_retention_time_in_days"));
  }

  @Test
  void createWithManagedAccess() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "sch1");
    body.put("comment", "c");
    body.put("user_task_managed_initial_warehouse_size", "XSMALL");
    HandlerResult r = run(post("/api/v2/databases/DB1/schemas",
        Map.of("with_managed_access", "true", "createMode", "ifNotExists"), body), new RecordingExecutor());
    assertEquals("CREATE SCHEMA IF NOT EXISTS DB1.SCH1 WITH MANAGED ACCESS "
        + "USER_TASK_MANAGED_INITIAL_WAREHOUSE_SIZE = 'XSMALL' COMMENT = 'c' ", r.lastStatement());
  }

  @Test
  void nullCommentIsLeftOut() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "sch1");
    body.put("comment", null);
    assertEquals("CREATE SCHEMA DB1.SCH1 ",
        run(post("/api/v2/databases/DB1/schemas", body), new RecordingExecutor()).lastStatement());
  }

  @Test
  void quotedNamesSurviveReconcile() {
    RecordingExecutor exec = new RecordingExecutor()
        .answer("SHOW SCHEMAS LIKE 'my schema' IN DATABASE DB1",
            row("name", "my schema", "database_name", "DB1", "comment", "", "owner", "R"))
        .answer("SHOW PARAMETERS IN SCHEMA DB1.\"my schema\"", List.of(
            row("key", "DATA_RETENTION_TIME_IN_DAYS", "value", "5", "level", "SCHEMA", "type", "NUMBER")));

    HandlerResult r = run(put("/api/v2/databases/DB1/schemas/%22my%20schema%22",
        Map.of("name", "\"my schema\"", "data_retention_time_in_days", 7)), exec);

    assertEquals(List.of("ALTER SCHEMA DB1.\"my schema\" SET DATA_RETENTION_TIME_IN_DAYS = 7"), r.statements());
  }

  @Test
  void databaseNameCannotChange() {
    RecordingExecutor exec = new RecordingExecutor()
        .answer("SHOW SCHEMAS LIKE 'S1' IN DATABASE DB1", row("name", "S1", "database_name", "DB1"));
    assertThrows(BadRequestException.class,
        () -> run(put("/api/v2/databases/DB1/schemas/S1", Map.of("name", "S1", "database_name", "DB2")), exec));
    assertEquals(2, exec.executed().size());
  }

  @Test
  void cloneUndropAndDrop() {
    assertEquals("CREATE SCHEMA DB1.S2 CLONE DB1.S1 AT (TIMESTAMP => '2024-01-01') ",
        run(post("/api/v2/databases/DB1/schemas/S1:clone", Map.of("name", "S2", "point_of_time",
            Map.of("reference", "at", "point_of_time_type", "timestamp", "timestamp", "'2024-01-01'"))),
            new RecordingExecutor()).lastStatement());
    assertEquals("UNDROP SCHEMA DB1.S1",
        run(post("/api/v2/databases/DB1/schemas/S1:undrop", null), new RecordingExecutor()).lastStatement());
    assertEquals("DROP SCHEMA DB1.S1",
        run(delete("/api/v2/databases/DB1/schemas/S1", Map.of()), new RecordingExecutor()).lastStatement());
  }
}
