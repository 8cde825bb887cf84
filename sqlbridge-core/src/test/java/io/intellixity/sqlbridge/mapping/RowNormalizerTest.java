package io.intellixity.sqlbridge.mapping;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RowNormalizerTest {

  @Test
  void appliesWhitelistRenameConversionsAndDrops() {
    RowNormalizer n = RowNormalizer.builder()
        .keep("name", "is_default", "comment", "retention_time", "budget")
        .rename("retention_time", "data_retention_time_in_days")
        .yesNo("is_default")
        .integers("data_retention_time_in_days")
        .emptyToNull("comment")
        .drop("budget")
        .build();

    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("name", "DB1");
    raw.put("is_default", "N");
    raw.put("comment", "");
    raw.put("retention_time", "1");
    raw.put("budget", null);
    raw.put("owner", "SYSADMIN");

    Map<String, Object> out = n.normalize(raw);
    assertEquals("DB1", out.get("name"));
    assertEquals(Boolean.FALSE, out.get("is_default"));
    assertNull(out.get("comment"));
    assertTrue(out.containsKey("comment"));
    assertEquals(1, out.get("data_retention_time_in_days"));
    assertFalse(out.containsKey("budget"));
    assertFalse(out.containsKey("owner"));
    assertFalse(out.containsKey("retention_time"));
  }
}
