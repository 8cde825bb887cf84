package io.intellixity.sqlbridge.error;

/** Outward status codes of the bridge error taxonomy. */
public enum RestStatus {
  BAD_REQUEST(400),
  UNAUTHORIZED(401),
  FORBIDDEN(403),
  NOT_FOUND(404),
  CONFLICT(409),
  INTERNAL_SERVER_ERROR(500),
  BAD_GATEWAY(502),
  SERVICE_UNAVAILABLE(503),
  GATEWAY_TIMEOUT(504);

  private final int code;

  RestStatus(int code) {
    this.code = code;
  }

  public int code() { return code; }

  public boolean isClientError() { return code < 500; }

  public static RestStatus of(int code) {
    for (RestStatus s : values()) {
      if (s.code == code) return s;
    }
    throw new IllegalArgumentException("Unknown status code: " + code);
  }
}
