package io.intellixity.sqlbridge.request;

public enum HttpVerb {
  GET, POST, PUT, DELETE;

  /** Exact, case-sensitive parse of a wire method name. */
  public static HttpVerb parse(String method) {
    if (method != null) {
      for (HttpVerb v : values()) {
        if (v.name().equals(method)) return v;
      }
    }
    throw new IllegalArgumentException(
        "Invalid HTTP method '" + method + "', should be one of 'GET', 'POST', 'PUT', 'DELETE'.");
  }
}
