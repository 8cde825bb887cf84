package io.intellixity.sqlbridge.error;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ErrorEnvelopeTest {

  @Test
  void rendersMessageAndNullDetails() {
    ErrorEnvelope env = ErrorEnvelope.of(new BadRequestException("Invalid URL"));
    assertEquals(400, env.statusCode());
    Map<String, Object> body = env.body();
    assertEquals("400", body.get("error_code"));
    assertTrue(body.containsKey("request_id"));
    assertNull(body.get("request_id"));
    assertEquals("{error: \"Invalid URL\", details: \"null\"}", body.get("message"));
  }

  @Test
  void carriesBackendDiagnostics() {
    NotFoundException e = new NotFoundException("Object does not exist",
        ErrorDetails.of(2003, "DESC WAREHOUSE X", "02000", "q-1"));
    assertEquals(2003, ErrorDetails.errno(e));
    String rendered = ErrorEnvelope.of(e).renderedMessage();
    assertTrue(rendered.contains("errno=2003"));
    assertTrue(rendered.contains("query=DESC WAREHOUSE X"));
  }

  @Test
  void missingMessageUsesDefault() {
    RestException e = new RestException(RestStatus.BAD_GATEWAY, null);
    assertEquals("Unknown Error", e.getMessage());
    assertEquals(RestStatus.BAD_GATEWAY, RestStatus.of(502));
    assertFalse(RestStatus.BAD_GATEWAY.isClientError());
  }
}
