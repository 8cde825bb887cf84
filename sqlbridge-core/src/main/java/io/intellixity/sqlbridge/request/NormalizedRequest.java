package io.intellixity.sqlbridge.request;

import java.util.*;

/**
 * One inbound call, already split into path segments and an optional custom action.\n
 *
 * The action is whatever follows the last ':' of the raw path ("/api/v2/warehouses/W1:resume").\n
 * Path segments are kept raw (percent-encoded); decoding happens when a translator resolves names.
 */
public record NormalizedRequest(HttpVerb method,
                                String rawPath,
                                List<String> path,
                                String customAction,
                                Map<String, String> queryParams,
                                Map<String, Object> body) {
  public NormalizedRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(rawPath, "rawPath");
    path = path == null ? List.of() : List.copyOf(path);
    customAction = customAction == null ? "" : customAction;
    queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
    // body values may legitimately be null ("comment": null)
    body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
  }

  public static NormalizedRequest of(HttpVerb method, String rawPath, Map<String, String> queryParams,
                                     Map<String, Object> body) {
    Objects.requireNonNull(rawPath, "rawPath");
    String withoutAction = rawPath;
    String action = "";
    int idx = rawPath.lastIndexOf(':');
    if (idx >= 0) {
      withoutAction = rawPath.substring(0, idx);
      action = rawPath.substring(idx + 1);
    }
    return new NormalizedRequest(method, rawPath, splitPath(withoutAction), action, queryParams, body);
  }

  static List<String> splitPath(String path) {
    String p = path;
    while (p.startsWith("/")) p = p.substring(1);
    while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
    if (p.isEmpty()) return List.of();
    return Arrays.asList(p.split("/", -1));
  }

  public boolean hasAction() { return !customAction.isEmpty(); }

  public boolean hasQueryParam(String key) { return queryParams.containsKey(key); }

  public String queryParam(String key) { return queryParams.get(key); }

  public String queryParam(String key, String defaultValue) {
    String v = queryParams.get(key);
    return v == null ? defaultValue : v;
  }

  /** True only for a present parameter whose value reads as "true" (case-insensitive). */
  public boolean flag(String key) {
    String v = queryParams.get(key);
    return v != null && Boolean.parseBoolean(v.trim());
  }

  public boolean hasProperty(String key) { return body.containsKey(key); }

  public Object property(String key) { return body.get(key); }
}
