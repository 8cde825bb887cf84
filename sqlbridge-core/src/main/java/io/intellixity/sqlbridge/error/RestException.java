package io.intellixity.sqlbridge.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base of the bridge error taxonomy.\n
 *
 * Carries the outward status, a message ("Unknown Error" when none is given) and optional
 * backend diagnostics (see {@link ErrorDetails}).
 */
public class RestException extends RuntimeException {
  public static final String DEFAULT_MESSAGE = "Unknown Error";

  private final RestStatus status;
  private final Map<String, Object> details;

  public RestException(RestStatus status, String message, Map<String, Object> details, Throwable cause) {
    super(message == null ? DEFAULT_MESSAGE : message, cause);
    this.status = Objects.requireNonNull(status, "status");
    this.details = details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public RestException(RestStatus status, String message, Map<String, Object> details) {
    this(status, message, details, null);
  }

  public RestException(RestStatus status, String message) {
    this(status, message, null, null);
  }

  public RestStatus status() { return status; }

  public int statusCode() { return status.code(); }

  /** Backend diagnostics, or null when the error was raised before reaching the backend. */
  public Map<String, Object> details() { return details; }

  public Object detail(String key) {
    return details == null ? null : details.get(key);
  }
}
