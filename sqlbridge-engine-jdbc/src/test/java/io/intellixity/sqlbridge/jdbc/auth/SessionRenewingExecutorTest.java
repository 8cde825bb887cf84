package io.intellixity.sqlbridge.jdbc.auth;

import io.intellixity.sqlbridge.error.ErrorDetails;
import io.intellixity.sqlbridge.error.NotFoundException;
import io.intellixity.sqlbridge.error.RestException;
import io.intellixity.sqlbridge.error.UnauthorizedException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.exec.StatementResults;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SessionRenewingExecutorTest {

  private static UnauthorizedException expired() {
    return new UnauthorizedException("Session expired",
        ErrorDetails.of(SessionRenewingExecutor.SESSION_EXPIRED, "SHOW WAREHOUSES", "08001", null));
  }

  /** Throws the queued failures in order, then succeeds. */
  private static final class Scripted implements StatementExecutor {
    final Deque<RestException> failures = new ArrayDeque<>();
    int calls;

    @Override public List<Map<String, Object>> execute(String sql) {
      calls++;
      if (!failures.isEmpty()) throw failures.poll();
      return List.of(StatementResults.success());
    }

    @Override public List<List<Map<String, Object>>> executeMany(String sql) {
      return List.of(execute(sql));
    }
  }

  private static final class CountingRenewer implements SessionRenewer {
    int renewals;

    @Override public void renew() { renewals++; }

    @Override public String token() { return "tok-" + renewals; }
  }

  @Test
  void expiredSessionIsRenewedAndRetriedOnce() {
    Scripted delegate = new Scripted();
    delegate.failures.add(expired());
    CountingRenewer renewer = new CountingRenewer();
    List<Map<String, Object>> rows = new SessionRenewingExecutor(delegate, renewer).execute("SHOW WAREHOUSES");
    assertTrue(StatementResults.isSuccess(rows.get(0)));
    assertEquals(2, delegate.calls);
    assertEquals(1, renewer.renewals);
  }

  @Test
  void secondExpiryIsSurfaced() {
    Scripted delegate = new Scripted();
    delegate.failures.add(expired());
    delegate.failures.add(expired());
    CountingRenewer renewer = new CountingRenewer();
    SessionRenewingExecutor exec = new SessionRenewingExecutor(delegate, renewer);
    assertThrows(UnauthorizedException.class, () -> exec.executeMany("SHOW WAREHOUSES"));
    assertEquals(2, delegate.calls);
    assertEquals(1, renewer.renewals);
  }

  @Test
  void otherFailuresAreNotRetried() {
    Scripted delegate = new Scripted();
    delegate.failures.add(new NotFoundException("nope", ErrorDetails.of(2003, "DESC X", "02000", null)));
    CountingRenewer renewer = new CountingRenewer();
    assertThrows(NotFoundException.class, () -> new SessionRenewingExecutor(delegate, renewer).execute("DESC X"));
    assertEquals(1, delegate.calls);
    assertEquals(0, renewer.renewals);
  }

  @Test
  void authorizationHeaderCarriesToken() {
    assertEquals("Snowflake Token=\"tok-0\"", new CountingRenewer().authorizationHeader());
  }
}
