package io.intellixity.sqlbridge.error;

import java.util.Map;

public class ConflictException extends RestException {
  public ConflictException(String message) {
    super(RestStatus.CONFLICT, message);
  }

  public ConflictException(String message, Map<String, Object> details) {
    super(RestStatus.CONFLICT, message, details);
  }

  public ConflictException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.CONFLICT, message, details, cause);
  }
}
