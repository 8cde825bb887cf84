package io.intellixity.sqlbridge.error;

import java.util.Map;

/** The addressed object does not exist. */
public class NotFoundException extends RestException {
  public NotFoundException(String message) {
    super(RestStatus.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, Object> details) {
    super(RestStatus.NOT_FOUND, message, details);
  }

  public NotFoundException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.NOT_FOUND, message, details, cause);
  }
}
