package io.intellixity.sqlbridge.error;

import java.util.Map;

/** Malformed input, missing or inconsistent properties, unsupported verbs and actions. */
public class BadRequestException extends RestException {
  public BadRequestException(String message) {
    super(RestStatus.BAD_REQUEST, message);
  }

  public BadRequestException(String message, Map<String, Object> details) {
    super(RestStatus.BAD_REQUEST, message, details);
  }

  public BadRequestException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.BAD_REQUEST, message, details, cause);
  }
}
