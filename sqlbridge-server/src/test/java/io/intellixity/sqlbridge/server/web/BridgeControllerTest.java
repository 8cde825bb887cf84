package io.intellixity.sqlbridge.server.web;

import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.exec.StatementResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
final class BridgeControllerTest {

  /** Records statements; queries answer no rows, everything else the success row. */
  static final class FakeExecutor implements StatementExecutor {
    final List<String> executed = new ArrayList<>();

    @Override
    public List<Map<String, Object>> execute(String sql) {
      executed.add(sql);
      String verb = sql.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
      if (List.of("SHOW", "DESC", "SELECT", "CALL").contains(verb)) return new ArrayList<>();
      List<Map<String, Object>> out = new ArrayList<>();
      out.add(StatementResults.success());
      return out;
    }

    @Override
    public List<List<Map<String, Object>>> executeMany(String sql) {
      List<List<Map<String, Object>>> out = new ArrayList<>();
      for (String s : sql.split(";")) if (!s.isBlank()) out.add(execute(s.trim()));
      return out;
    }
  }

  @TestConfiguration
  static class FakeBackend {
    @Bean
    @Primary
    FakeExecutor fakeExecutor() {
      return new FakeExecutor();
    }
  }

  @Autowired
  private MockMvc mvc;

  @Autowired
  private FakeExecutor executor;

  @BeforeEach
  void reset() {
    executor.executed.clear();
  }

  @Test
  void putCreatesMissingWarehouse() throws Exception {
    mvc.perform(put("/api/v2/warehouses/W1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"W1\",\"warehouse_size\":\"SMALL\"}"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.description").value("successful"));

    assertEquals(List.of("SHOW WAREHOUSES LIKE 'W1'", "CREATE WAREHOUSE W1 WAREHOUSE_SIZE = SMALL "), executor.executed);
  }

  @Test
  void queryStringReachesTranslator() throws Exception {
    mvc.perform(get("/api/v2/databases/DB1/schemas/SCH1/tasks?like=T_&rootOnly=true"))
        .andExpect(status().isOk())
        .andExpect(content().json("[]"));
    assertEquals(List.of("SHOW TASKS LIKE 'T_' IN SCHEMA DB1.SCH1 ROOT ONLY "), executor.executed);
  }

  @Test
  void actionSuffixIsRouted() throws Exception {
    mvc.perform(post("/api/v2/warehouses/W1:suspend"))
        .andExpect(status().isOk());
    assertEquals(List.of("ALTER WAREHOUSE W1 SUSPEND"), executor.executed);
  }

  @Test
  void unknownResourceIsBadRequest() throws Exception {
    mvc.perform(get("/api/v2/users/U1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("400"))
        .andExpect(jsonPath("$.message").value("{error: \"Invalid URL\", details: \"null\"}"));
    assertTrue(executor.executed.isEmpty());
  }

  @Test
  void missingObjectIsNotFound() throws Exception {
    mvc.perform(get("/api/v2/compute-pools/P9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error_code").value("404"));
  }

  @Test
  void nonObjectBodyIsBadRequest() throws Exception {
    mvc.perform(post("/api/v2/warehouses").contentType(MediaType.APPLICATION_JSON).content("[1, 2]"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("400"));
  }

  @Test
  void malformedJsonIsBadRequest() throws Exception {
    mvc.perform(post("/api/v2/warehouses").contentType(MediaType.APPLICATION_JSON).content("{\"name\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("400"));
    assertTrue(executor.executed.isEmpty());
  }
}
