package io.intellixity.sqlbridge.error;

import java.util.Map;

/** Default for unclassified backend failures. */
public class InternalServerErrorException extends RestException {
  public InternalServerErrorException(String message) {
    super(RestStatus.INTERNAL_SERVER_ERROR, message);
  }

  public InternalServerErrorException(String message, Map<String, Object> details) {
    super(RestStatus.INTERNAL_SERVER_ERROR, message, details);
  }

  public InternalServerErrorException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.INTERNAL_SERVER_ERROR, message, details, cause);
  }
}
