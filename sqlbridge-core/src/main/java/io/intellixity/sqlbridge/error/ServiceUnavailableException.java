package io.intellixity.sqlbridge.error;

import java.util.Map;

public class ServiceUnavailableException extends RestException {
  public ServiceUnavailableException(String message) {
    super(RestStatus.SERVICE_UNAVAILABLE, message);
  }

  public ServiceUnavailableException(String message, Map<String, Object> details) {
    super(RestStatus.SERVICE_UNAVAILABLE, message, details);
  }

  public ServiceUnavailableException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.SERVICE_UNAVAILABLE, message, details, cause);
  }
}
