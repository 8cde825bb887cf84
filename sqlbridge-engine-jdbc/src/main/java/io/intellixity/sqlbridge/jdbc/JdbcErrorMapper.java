package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.sql.*;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a {@link SQLException} into the bridge error taxonomy.\n
 *
 * Checks run top to bottom, first hit wins:\n
 * - 2002 -> Conflict, 2003 -> NotFound\n
 * - SQLState 28xxx, 390100..390199, 254001..254008 -> Unauthorized\n
 * - SQLState 42501, 3001 -> Forbidden\n
 * - SQLTimeoutException, 604 -> GatewayTimeout\n
 * - SQLState 08xxx, 250001, 250003, 253008 -> BadGateway\n
 * - 253001, 253006 -> BadRequest\n
 * - SQLTransientConnectionException, 390144 -> ServiceUnavailable\n
 * - syntax / unsupported feature, SQLState 42xxx, 22xxx, 0Axxx -> BadRequest\n
 * - anything else -> InternalServerError\n
 */
public final class JdbcErrorMapper {
  private static final Logger log = LoggerFactory.getLogger(JdbcErrorMapper.class);
  private static final int MAX_CAUSE_DEPTH = 8;

  public static final int ALREADY_EXISTS = 2002;
  public static final int DOES_NOT_EXIST = 2003;
  public static final int INSUFFICIENT_PRIVILEGES = 3001;
  public static final int STATEMENT_TIMEOUT = 604;
  public static final int CAPACITY_EXCEEDED = 390144;

  private static final Set<Integer> GATEWAY_CODES = Set.of(250001, 250003, 253008);
  private static final Set<Integer> FILE_CODES = Set.of(253001, 253006);

  public RestException map(SQLException e, String sql) {
    int code = e.getErrorCode();
    String state = e.getSQLState();
    String msg = e.getMessage();
    Map<String, Object> details = ErrorDetails.of(code, sql, state, queryId(e));

    if (code == ALREADY_EXISTS) return new ConflictException(msg, details, e);
    if (code == DOES_NOT_EXIST) return new NotFoundException(msg, details, e);
    if (stateClass(state, "28") || (code >= 390100 && code <= 390199 && code != CAPACITY_EXCEEDED)
        || (code >= 254001 && code <= 254008)) {
      return new UnauthorizedException(msg, details, e);
    }
    if ("42501".equals(state) || code == INSUFFICIENT_PRIVILEGES) return new ForbiddenException(msg, details, e);
    if (e instanceof SQLTimeoutException || code == STATEMENT_TIMEOUT) return new GatewayTimeoutException(msg, details, e);
    if (stateClass(state, "08") || GATEWAY_CODES.contains(code)) return new BadGatewayException(msg, details, e);
    if (FILE_CODES.contains(code)) return new BadRequestException(msg, details, e);
    if (e instanceof SQLTransientConnectionException || code == CAPACITY_EXCEEDED) {
      return new ServiceUnavailableException(msg, details, e);
    }
    if (e instanceof SQLSyntaxErrorException || e instanceof SQLFeatureNotSupportedException
        || stateClass(state, "42") || stateClass(state, "22") || stateClass(state, "0A")) {
      return new BadRequestException(msg, details, e);
    }
    return new InternalServerErrorException(msg, details, e);
  }

  /** Backend query id from the first exception in the cause chain with a public {@code getQueryId()}, or null. */
  static String queryId(Throwable e) {
    Throwable t = e;
    for (int depth = 0; t != null && depth < MAX_CAUSE_DEPTH; depth++, t = t.getCause()) {
      Method accessor = queryIdAccessor(t.getClass());
      if (accessor == null) continue;
      try {
        Object id = accessor.invoke(t);
        if (id != null) return String.valueOf(id);
      } catch (ReflectiveOperationException ex) {
        log.debug("sqlbridge.query_id_unavailable type={} err={}", t.getClass().getName(), ex.toString());
        return null;
      }
    }
    return null;
  }

  private static Method queryIdAccessor(Class<?> type) {
    for (Method m : type.getMethods()) {
      if (m.getName().equals("getQueryId") && m.getParameterCount() == 0) return m;
    }
    return null;
  }

  private static boolean stateClass(String state, String cls) {
    return state != null && state.length() >= 2 && state.regionMatches(true, 0, cls, 0, 2);
  }
}
