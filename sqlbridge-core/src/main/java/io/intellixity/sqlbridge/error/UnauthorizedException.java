package io.intellixity.sqlbridge.error;

import java.util.Map;

/** Backend authentication failures. */
public class UnauthorizedException extends RestException {
  public UnauthorizedException(String message) {
    super(RestStatus.UNAUTHORIZED, message);
  }

  public UnauthorizedException(String message, Map<String, Object> details) {
    super(RestStatus.UNAUTHORIZED, message, details);
  }

  public UnauthorizedException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.UNAUTHORIZED, message, details, cause);
  }
}
