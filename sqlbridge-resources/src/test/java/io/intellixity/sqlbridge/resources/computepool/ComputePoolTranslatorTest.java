package io.intellixity.sqlbridge.resources.computepool;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.NotFoundException;
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

final class ComputePoolTranslatorTest {
  private static final String POOLS = "/api/v2/compute-pools";

  private static HandlerResult run(NormalizedRequest r, RecordingExecutor exec) {
    return new ComputePoolTranslator(r, exec).execute();
  }

  private static Map<String, Object> p1Body() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "p1");
    body.put("min_nodes", 1);
    body.put("max_nodes", 2);
    body.put("instance_family", "cpu_x64_xs");
    body.put("auto_resume", true);
    body.put("auto_suspend_secs", 3600);
    return body;
  }

  private static RecordingExecutor existingP1() {
    return new RecordingExecutor()
        .answer("DESC COMPUTE POOL P1", row("name", "P1", "state", "IDLE", "min_nodes", "1", "max_nodes", "2",
            "instance_family", "CPU_X64_XS", "auto_resume", "true", "auto_suspend_secs", "3600", "comment", "",
            "num_services", "0"));
  }

  @Test
  void createRendersClausesInOrder() {
    Map<String, Object> body = p1Body();
    body.put("comment", "pool");
    HandlerResult r = run(post(POOLS, body), new RecordingExecutor());
    assertEquals(List.of("CREATE COMPUTE POOL P1 MIN_NODES = 1 MAX_NODES = 2 INSTANCE_FAMILY = 'cpu_x64_xs' "
        + "AUTO_RESUME = true AUTO_SUSPEND_SECS = 3600 COMMENT = 'pool' "), r.statements());
  }

  @Test
  void nullCommentIsLeftOut() {
    Map<String, Object> body = p1Body();
    body.put("comment", null);
    HandlerResult r = run(post(POOLS, body), new RecordingExecutor());
    assertEquals(List.of("CREATE COMPUTE POOL P1 MIN_NODES = 1 MAX_NODES = 2 INSTANCE_FAMILY = 'cpu_x64_xs' "
        + "AUTO_RESUME = true AUTO_SUSPEND_SECS = 3600 "), r.statements());
  }

  @Test
  void createIfNotExists() {
    HandlerResult r = run(post(POOLS, Map.of("ifNotExists", "true"), Map.of("name", "P1", "min_nodes", 1,
        "max_nodes", 1, "instance_family", "X")), new RecordingExecutor());
    assertEquals(List.of("CREATE COMPUTE POOL IF NOT EXISTS P1 MIN_NODES = 1 MAX_NODES = 1 INSTANCE_FAMILY = 'X' "),
        r.statements());
  }

  @Test
  void orReplaceIsRejected() {
    RecordingExecutor exec = new RecordingExecutor();
    assertThrows(BadRequestException.class, () -> run(post(POOLS, Map.of("createMode", "orReplace"), p1Body()), exec));
    assertTrue(exec.executed().isEmpty());
  }

  @Test
  void missingRequiredPropertyIsRejected() {
    Map<String, Object> body = p1Body();
    body.remove("max_nodes");
    assertThrows(BadRequestException.class, () -> run(post(POOLS, body), new RecordingExecutor()));
  }

  @Test
  void identicalPutExecutesNothing() {
    RecordingExecutor exec = existingP1();
    HandlerResult r = run(put(POOLS + "/P1", p1Body()), exec);
    assertTrue(r.statements().isEmpty());
    assertEquals(List.of("DESC COMPUTE POOL P1"), exec.executed());
  }

  @Test
  void putSetsChangedProperties() {
    Map<String, Object> body = p1Body();
    body.put("max_nodes", 3);
    body.put("comment", "c");
    HandlerResult r = run(put(POOLS, body), existingP1());
    assertEquals(List.of("ALTER COMPUTE POOL P1 SET MAX_NODES = 3 COMMENT = 'c'"), r.statements());
  }

  @Test
  void putUnsetsOmittedProperties() {
    RecordingExecutor exec = new RecordingExecutor()
        .answer("DESC COMPUTE POOL P1", row("name", "P1", "min_nodes", "1", "max_nodes", "2",
            "instance_family", "CPU_X64_XS", "auto_resume", "true", "auto_suspend_secs", "600", "comment", "old"));
    Map<String, Object> body = p1Body();
    body.remove("auto_suspend_secs");
    HandlerResult r = run(put(POOLS + "/P1", body), exec);
    assertEquals(List.of("ALTER COMPUTE POOL P1 UNSET AUTO_SUSPEND_SECS, COMMENT"), r.statements());
  }

  @Test
  void instanceFamilyIsImmutable() {
    Map<String, Object> body = p1Body();
    body.put("instance_family", "GPU_NV_S");
    RecordingExecutor exec = existingP1();
    assertThrows(BadRequestException.class, () -> run(put(POOLS + "/P1", body), exec));
    assertEquals(List.of("DESC COMPUTE POOL P1"), exec.executed());
  }

  @Test
  void putOnMissingPoolCreatesIt() {
    HandlerResult r = run(put(POOLS + "/P1", p1Body()), new RecordingExecutor());
    assertEquals(List.of("CREATE COMPUTE POOL P1 MIN_NODES = 1 MAX_NODES = 2 INSTANCE_FAMILY = 'cpu_x64_xs' "
        + "AUTO_RESUME = true AUTO_SUSPEND_SECS = 3600 "), r.statements());
  }

  @SuppressWarnings("unchecked")
  @Test
  void fetchNormalizesTypes() {
    HandlerResult r = run(get(POOLS + "/P1"), existingP1());
    Map<String, Object> pool = (Map<String, Object>) r.result();
    assertEquals(1, pool.get("min_nodes"));
    assertEquals(0, pool.get("num_services"));
    assertEquals(Boolean.TRUE, pool.get("auto_resume"));
    assertNull(pool.get("comment"));
  }

  @Test
  void fetchMissingPool() {
    NotFoundException e = assertThrows(NotFoundException.class, () -> run(get(POOLS + "/P9"), new RecordingExecutor()));
    assertEquals("Compute pool P9 does not exist.", e.getMessage());
  }

  @Test
  void listWithPaging() {
    HandlerResult r = run(get(POOLS, Map.of("like", "P%", "showLimit", "10", "fromName", "P1")), new RecordingExecutor());
    assertEquals(List.of("SHOW COMPUTE POOLS LIKE 'P%' LIMIT 10 FROM 'P1'"), r.statements());
  }

  @Test
  void actionsAndDrop() {
    RecordingExecutor exec = new RecordingExecutor();
    run(post(POOLS + "/P1:resume", null), exec);
    assertEquals("ALTER COMPUTE POOL P1 RESUME", exec.last());
    run(post(POOLS + "/P1:stopallservices", null), exec);
    assertEquals("ALTER COMPUTE POOL P1 STOP ALL", exec.last());
    run(delete(POOLS + "/P1", Map.of("ifExists", "true")), exec);
    assertEquals("DROP COMPUTE POOL IF EXISTS P1", exec.last());
    assertThrows(BadRequestException.class, () -> run(post(POOLS + "/P1:explode", null), exec));
  }
}
