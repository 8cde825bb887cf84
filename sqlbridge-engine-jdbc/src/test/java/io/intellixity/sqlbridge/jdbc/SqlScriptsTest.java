package io.intellixity.sqlbridge.jdbc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlScriptsTest {

  @Test
  void splitsOutsideQuotesOnly() {
    assertEquals(List.of("show tasks", "select ';' as \"a;b\"", "select 1"),
        SqlScripts.split("show tasks; select ';' as \"a;b\" ;;select 1;"));
  }
}
