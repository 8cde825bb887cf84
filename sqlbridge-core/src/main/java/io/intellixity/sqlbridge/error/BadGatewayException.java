package io.intellixity.sqlbridge.error;

import java.util.Map;

/** Backend connectivity or storage transfer failures. */
public class BadGatewayException extends RestException {
  public BadGatewayException(String message) {
    super(RestStatus.BAD_GATEWAY, message);
  }

  public BadGatewayException(String message, Map<String, Object> details) {
    super(RestStatus.BAD_GATEWAY, message, details);
  }

  public BadGatewayException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.BAD_GATEWAY, message, details, cause);
  }
}
