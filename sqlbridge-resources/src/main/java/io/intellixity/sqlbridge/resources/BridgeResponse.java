package io.intellixity.sqlbridge.resources;

import io.intellixity.sqlbridge.error.ErrorEnvelope;

import java.util.List;

/**
 * Outward response of one bridge call: HTTP-like status, JSON body and the statements issued.\n
 * Error responses carry no statements.
 */
public record BridgeResponse(int statusCode, String body, List<String> statements) {
  public static final String CONTENT_TYPE = ErrorEnvelope.CONTENT_TYPE;

  public BridgeResponse {
    statements = statements == null ? List.of() : List.copyOf(statements);
  }

  public boolean successful() { return statusCode == 200; }

  public String contentType() { return CONTENT_TYPE; }
}
