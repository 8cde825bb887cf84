package io.intellixity.sqlbridge.error;

import java.util.LinkedHashMap;
import java.util.Map;

/** Keys of the backend diagnostic map attached to mapped errors. */
public final class ErrorDetails {
  public static final String ERRNO = "errno";
  public static final String QUERY = "query";
  public static final String SQLSTATE = "sqlstate";
  public static final String QUERY_ID = "sfqid";

  private ErrorDetails() {}

  public static Map<String, Object> of(Integer errno, String query, String sqlState, String queryId) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(ERRNO, errno);
    out.put(QUERY, query);
    out.put(SQLSTATE, sqlState);
    out.put(QUERY_ID, queryId);
    return out;
  }

  /** Native error number carried by an error, or null. */
  public static Integer errno(RestException e) {
    Object v = e.detail(ERRNO);
    if (v instanceof Number n) return n.intValue();
    if (v instanceof String s && !s.isBlank()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException ignored) {
        return null;
      }
    }
    return null;
  }
}
