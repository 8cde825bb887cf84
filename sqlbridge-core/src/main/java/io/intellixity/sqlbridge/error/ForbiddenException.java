package io.intellixity.sqlbridge.error;

import java.util.Map;

public class ForbiddenException extends RestException {
  public ForbiddenException(String message) {
    super(RestStatus.FORBIDDEN, message);
  }

  public ForbiddenException(String message, Map<String, Object> details) {
    super(RestStatus.FORBIDDEN, message, details);
  }

  public ForbiddenException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.FORBIDDEN, message, details, cause);
  }
}
