package io.intellixity.sqlbridge.resources.support;

import io.intellixity.sqlbridge.error.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Typed reads of request body entries. */
public final class BodyValues {
  private BodyValues() {}

  public static String requireString(Map<String, Object> body, String key, String message) {
    Object v = body.get(key);
    if (v == null || String.valueOf(v).isBlank()) throw new BadRequestException(message);
    return String.valueOf(v);
  }

  /** Null or absent yields an empty list; a scalar is not accepted. */
  public static List<String> stringList(Map<String, Object> body, String key) {
    Object v = body.get(key);
    if (v == null) return List.of();
    if (!(v instanceof List<?> raw)) throw new BadRequestException(key + " must be a list");
    List<String> out = new ArrayList<>(raw.size());
    for (Object o : raw) out.add(String.valueOf(o));
    return out;
  }

  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> objectList(Map<String, Object> body, String key) {
    Object v = body.get(key);
    if (v == null) return List.of();
    if (!(v instanceof List<?> raw)) throw new BadRequestException(key + " must be a list");
    List<Map<String, Object>> out = new ArrayList<>(raw.size());
    for (Object o : raw) {
      if (!(o instanceof Map<?, ?>)) throw new BadRequestException(key + " entries must be objects");
      out.add((Map<String, Object>) o);
    }
    return out;
  }
}
