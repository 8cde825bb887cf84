package io.intellixity.sqlbridge.jdbc.auth;

/** Owns the backend session credentials. */
public interface SessionRenewer {
  /** Establishes fresh credentials. Called at most once per failed statement. */
  void renew();

  /** Current session token, or null when the backend authenticates another way. */
  String token();

  default String authorizationHeader() {
    return "Snowflake Token=\"" + token() + "\"";
  }
}
