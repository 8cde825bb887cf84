package io.intellixity.sqlbridge.error;

import java.util.Map;

public class GatewayTimeoutException extends RestException {
  public GatewayTimeoutException(String message) {
    super(RestStatus.GATEWAY_TIMEOUT, message);
  }

  public GatewayTimeoutException(String message, Map<String, Object> details) {
    super(RestStatus.GATEWAY_TIMEOUT, message, details);
  }

  public GatewayTimeoutException(String message, Map<String, Object> details, Throwable cause) {
    super(RestStatus.GATEWAY_TIMEOUT, message, details, cause);
  }
}
