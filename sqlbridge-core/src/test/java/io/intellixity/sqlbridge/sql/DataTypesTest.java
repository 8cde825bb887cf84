package io.intellixity.sqlbridge.sql;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DataTypesTest {

  @Test
  void aliasesCollapse() {
    assertTrue(DataTypes.equivalent("int", "NUMBER(38,0)"));
    assertTrue(DataTypes.equivalent("string", "VARCHAR(16777216)"));
    assertTrue(DataTypes.equivalent("decimal(10, 2)", "NUMBER(10,2)"));
    assertTrue(DataTypes.equivalent("double precision", "FLOAT"));
    assertEquals("VARCHAR(1)", DataTypes.normalize("char"));
  }

  @Test
  void distinctTypesStayDistinct() {
    assertFalse(DataTypes.equivalent("VARCHAR(10)", "VARCHAR(20)"));
    assertFalse(DataTypes.equivalent("BOOLEAN", "NUMBER"));
  }
}
