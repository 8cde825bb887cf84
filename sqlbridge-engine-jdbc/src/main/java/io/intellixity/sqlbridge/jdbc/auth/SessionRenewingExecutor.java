package io.intellixity.sqlbridge.jdbc.auth;

import io.intellixity.sqlbridge.error.ErrorDetails;
import io.intellixity.sqlbridge.error.RestException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Decorator that renews an expired session once and retries the failed call once.\n
 *
 * Any other failure, and a failure of the retry itself, propagates unchanged.
 */
public final class SessionRenewingExecutor implements StatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(SessionRenewingExecutor.class);
  public static final int SESSION_EXPIRED = 390112;

  private final StatementExecutor delegate;
  private final SessionRenewer renewer;

  public SessionRenewingExecutor(StatementExecutor delegate, SessionRenewer renewer) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.renewer = Objects.requireNonNull(renewer, "renewer");
  }

  @Override
  public List<Map<String, Object>> execute(String sql) {
    return withRenewal(() -> delegate.execute(sql));
  }

  @Override
  public List<List<Map<String, Object>>> executeMany(String sql) {
    return withRenewal(() -> delegate.executeMany(sql));
  }

  private <T> T withRenewal(Supplier<T> call) {
    try {
      return call.get();
    } catch (RestException e) {
      if (!isSessionExpired(e)) throw e;
      log.warn("sqlbridge.session_renew errno={} status={}", SESSION_EXPIRED, e.statusCode());
      renewer.renew();
      return call.get();
    }
  }

  static boolean isSessionExpired(RestException e) {
    Integer errno = ErrorDetails.errno(e);
    return errno != null && errno == SESSION_EXPIRED;
  }
}
