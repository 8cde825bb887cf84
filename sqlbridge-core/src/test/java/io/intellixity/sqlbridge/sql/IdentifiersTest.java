package io.intellixity.sqlbridge.sql;

import io.intellixity.sqlbridge.error.BadRequestException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class IdentifiersTest {

  @Test
  void simpleNamesAreUpperCased() {
    assertEquals("WH_1", Identifiers.normalize("wh_1"));
    assertEquals("A$B", Identifiers.normalize("a$b"));
  }

  @Test
  void otherNamesAreQuoted() {
    assertEquals("\"my table\"", Identifiers.normalize("my table"));
    assertEquals("\"1abc\"", Identifiers.normalize("1abc"));
    assertEquals("\"a\"\"b\"", Identifiers.normalize("a\"b"));
  }

  @Test
  void quotedNamesPassThrough() {
    assertEquals("\"MixedCase\"", Identifiers.normalize("\"MixedCase\""));
  }

  @Test
  void normalizeIsIdempotent() {
    for (String raw : List.of("foo", "Foo Bar", "a\"b", "\"Q\"", "x.y", "_under$core")) {
      String once = Identifiers.normalize(raw);
      assertEquals(once, Identifiers.normalize(once), raw);
    }
  }

  @Test
  void storedNamesKeepTheirCase() {
    assertEquals("SVC_1", Identifiers.fromStored("SVC_1"));
    assertEquals("\"svc\"", Identifiers.fromStored("svc"));
    assertEquals("\"My Svc\"", Identifiers.fromStored("My Svc"));
    assertEquals("\"a\"\"b\"", Identifiers.fromStored("a\"b"));
  }

  @Test
  void unescapedQuoteInsideQuotedNameIsRejected() {
    BadRequestException e = assertThrows(BadRequestException.class, () -> Identifiers.normalize("\"a\"b\""));
    assertTrue(e.getMessage().startsWith("Invalid Identifier"));
  }

  @Test
  void dottedNamesSplitOutsideQuotes() {
    assertEquals(List.of("DB", "\"s.c\"", "T"), Identifiers.parts("DB.\"s.c\".T"));
    assertEquals("\"b.c\"", Identifiers.lastPart("A.\"b.c\""));
    assertEquals("T1", Identifiers.lastPart("T1"));
  }

  @Test
  void sameNameComparesNormalizedForms() {
    assertTrue(Identifiers.sameName("abc", "ABC"));
    assertFalse(Identifiers.sameName("\"abc\"", "ABC"));
  }
}
