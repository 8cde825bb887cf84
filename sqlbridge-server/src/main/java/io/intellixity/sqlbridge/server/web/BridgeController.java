package io.intellixity.sqlbridge.server.web;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.ErrorEnvelope;
import io.intellixity.sqlbridge.resources.BridgeResponse;
import io.intellixity.sqlbridge.resources.SqlBridge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Forwards every resource request under /api/v2 to the bridge as-is: method, full URL with its
 * query string, and the JSON body.
 */
@RestController
@RequestMapping("/api/v2")
public final class BridgeController {
  private static final Logger log = LoggerFactory.getLogger(BridgeController.class);

  private final SqlBridge bridge;
  private final ObjectMapper json;

  public BridgeController(SqlBridge bridge, ObjectMapper json) {
    this.bridge = bridge;
    this.json = json;
  }

  @RequestMapping(value = "/**",
      method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.DELETE})
  public ResponseEntity<String> handle(HttpServletRequest request, @RequestBody(required = false) String body)
      throws JsonProcessingException {
    String url = request.getRequestURL().toString();
    if (request.getQueryString() != null) url = url + "?" + request.getQueryString();

    Object payload;
    try {
      payload = body == null || body.isBlank() ? null : json.readValue(body, Object.class);
    } catch (JsonProcessingException e) {
      ErrorEnvelope envelope = ErrorEnvelope.of(new BadRequestException("Invalid body, " + e.getOriginalMessage()));
      return respond(envelope.statusCode(), json.writeValueAsString(envelope.body()));
    }

    BridgeResponse r = bridge.request(request.getMethod(), url, null, payload);
    log.debug("sqlbridge.http method={} url={} status={} statements={}",
        request.getMethod(), url, r.statusCode(), r.statements().size());
    return respond(r.statusCode(), r.body());
  }

  private static ResponseEntity<String> respond(int status, String body) {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }
}
