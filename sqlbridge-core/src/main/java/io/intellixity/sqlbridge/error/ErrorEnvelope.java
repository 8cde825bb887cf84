package io.intellixity.sqlbridge.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outward error shape.\n
 *
 * Body: {"error_code": "404", "request_id": null, "message": "{error: \"...\", details: \"...\"}"}
 */
public record ErrorEnvelope(int statusCode, String message, Map<String, Object> details) {
  public static final String CONTENT_TYPE = "application/json";

  public ErrorEnvelope {
    message = message == null ? RestException.DEFAULT_MESSAGE : message;
  }

  public static ErrorEnvelope of(RestException e) {
    Objects.requireNonNull(e, "e");
    return new ErrorEnvelope(e.statusCode(), e.getMessage(), e.details());
  }

  public String errorCode() {
    return String.valueOf(statusCode);
  }

  public String renderedMessage() {
    return "{error: \"" + message + "\", details: \"" + details + "\"}";
  }

  public Map<String, Object> body() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("error_code", errorCode());
    out.put("request_id", null);
    out.put("message", renderedMessage());
    return out;
  }
}
