package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.error.*;
import org.junit.jupiter.api.Test;

import java.sql.*;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcErrorMapperTest {
  private final JdbcErrorMapper mapper = new JdbcErrorMapper();

  private RestException map(SQLException e) {
    return mapper.map(e, "SQL");
  }

  /** Driver exception exposing the backend query id. */
  public static final class VendorException extends SQLException {
    private final String queryId;

    public VendorException(String reason, String state, int code, String queryId) {
      super(reason, state, code);
      this.queryId = queryId;
    }

    public String getQueryId() { return queryId; }
  }

  @Test
  void queryIdComesFromTheDriverException() {
    RestException e = map(new VendorException("missing", "02000", 2003, "01b2-0001"));
    assertInstanceOf(NotFoundException.class, e);
    assertEquals("01b2-0001", e.detail(ErrorDetails.QUERY_ID));
    assertEquals(2003, e.detail(ErrorDetails.ERRNO));
    assertEquals("SQL", e.detail(ErrorDetails.QUERY));
  }

  @Test
  void queryIdIsFoundOnTheCause() {
    SQLException wrapper = new SQLException("wrapped", "42000", 1003, new VendorException("inner", "42000", 1003, "q-7"));
    assertEquals("q-7", map(wrapper).detail(ErrorDetails.QUERY_ID));
    assertNull(map(new SQLException("plain", "42000", 1003)).detail(ErrorDetails.QUERY_ID));
  }

  @Test
  void existenceCodes() {
    assertInstanceOf(ConflictException.class, map(new SQLException("exists", "42710", 2002)));
    assertInstanceOf(NotFoundException.class, map(new SQLException("missing", "02000", 2003)));
  }

  @Test
  void authenticationAndAuthorization() {
    assertInstanceOf(UnauthorizedException.class, map(new SQLException("bad pw", "28000", 390100)));
    assertInstanceOf(UnauthorizedException.class, map(new SQLException("expired", null, 390112)));
    assertInstanceOf(UnauthorizedException.class, map(new SQLException("ocsp", null, 254003)));
    assertInstanceOf(ForbiddenException.class, map(new SQLException("denied", "42501", 0)));
    assertInstanceOf(ForbiddenException.class, map(new SQLException("denied", null, 3001)));
  }

  @Test
  void infrastructureFailures() {
    assertInstanceOf(GatewayTimeoutException.class, map(new SQLTimeoutException("slow")));
    assertInstanceOf(GatewayTimeoutException.class, map(new SQLException("cancelled", "57014", 604)));
    assertInstanceOf(BadGatewayException.class, map(new SQLException("conn", "08001", 0)));
    assertInstanceOf(BadGatewayException.class, map(new SQLException("upload", null, 253008)));
    assertInstanceOf(ServiceUnavailableException.class, map(new SQLTransientConnectionException("busy")));
    assertInstanceOf(ServiceUnavailableException.class, map(new SQLException("capacity", null, 390144)));
  }

  @Test
  void clientMistakes() {
    assertInstanceOf(BadRequestException.class, map(new SQLSyntaxErrorException("syntax", "42000", 1003)));
    assertInstanceOf(BadRequestException.class, map(new SQLException("no file", null, 253001)));
    assertInstanceOf(BadRequestException.class, map(new SQLException("bad number", "22018", 100038)));
    assertInstanceOf(BadRequestException.class, map(new SQLFeatureNotSupportedException("nope")));
  }

  @Test
  void everythingElseIsInternal() {
    RestException e = map(new SQLException("weird", "XX000", 99));
    assertInstanceOf(InternalServerErrorException.class, e);
    assertEquals("weird", e.getMessage());
    assertEquals(99, ErrorDetails.errno(e));
    assertEquals("SQL", e.detail(ErrorDetails.QUERY));
    assertInstanceOf(InternalServerErrorException.class, map(new SQLIntegrityConstraintViolationException("dup")));
  }
}
