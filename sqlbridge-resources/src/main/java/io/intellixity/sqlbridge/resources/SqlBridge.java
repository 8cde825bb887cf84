package io.intellixity.sqlbridge.resources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.ErrorEnvelope;
import io.intellixity.sqlbridge.error.InternalServerErrorException;
import io.intellixity.sqlbridge.error.RestException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.request.HttpVerb;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.resource.HandlerResult;
import io.intellixity.sqlbridge.spi.route.DiscoveredTranslatorRegistry;
import io.intellixity.sqlbridge.spi.route.ResourceRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: validates one REST-shaped call, routes it to a translator and renders the outcome.\n
 *
 * Never throws. A {@link RestException} becomes its envelope; anything else becomes a 500 envelope
 * carrying the exception message.\n
 * Query parameters found in the URL are merged with the explicit ones; explicit values win.
 */
public final class SqlBridge {
  private static final Logger log = LoggerFactory.getLogger(SqlBridge.class);

  private final StatementExecutor executor;
  private final ResourceRouter router;
  private final ObjectMapper json;

  public SqlBridge(StatementExecutor executor) {
    this(executor, new ResourceRouter(new DiscoveredTranslatorRegistry()));
  }

  public SqlBridge(StatementExecutor executor, ResourceRouter router) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.router = Objects.requireNonNull(router, "router");
    this.json = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public BridgeResponse request(String method, String url, Map<String, String> queryParams, Object body) {
    try {
      HandlerResult result = dispatch(method, url, queryParams, body);
      return new BridgeResponse(200, write(result.result()), result.statements());
    } catch (RestException e) {
      return error(e);
    } catch (RuntimeException e) {
      log.warn("sqlbridge.unexpected method={} url={} error={}", method, url, e.toString());
      return error(new InternalServerErrorException(e.getMessage(), null, e));
    }
  }

  public BridgeResponse request(String method, String url) {
    return request(method, url, null, null);
  }

  HandlerResult dispatch(String method, String url, Map<String, String> queryParams, Object body) {
    HttpVerb verb = HttpVerb.parse(method);
    if (url == null || url.isEmpty()) throw new BadRequestException("Invalid URL, should be a non-empty string.");
    int q = url.indexOf('?');
    URI uri = validateUrl(q < 0 ? url : url.substring(0, q));
    Map<String, Object> payload = validateBody(body);

    Map<String, String> params = parseQuery(q < 0 ? null : url.substring(q + 1));
    if (queryParams != null) params.putAll(queryParams);

    NormalizedRequest request = NormalizedRequest.of(verb, uri.getRawPath(), params, payload);
    return router.translatorFor(request, executor).execute();
  }

  static URI validateUrl(String url) {
    if (url == null || url.isEmpty()) throw new BadRequestException("Invalid URL, should be a non-empty string.");
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new BadRequestException("Invalid URL, " + e.getReason() + ".");
    }
    String scheme = uri.getScheme();
    if (scheme == null || !List.of("http", "https").contains(scheme.toLowerCase(Locale.ROOT))) {
      throw new BadRequestException("Invalid URL scheme, should be 'http' or 'https'.");
    }
    if (uri.getRawAuthority() == null || uri.getRawAuthority().isEmpty()) {
      throw new BadRequestException("Invalid URL, missing domain.");
    }
    if (uri.getRawPath() == null || uri.getRawPath().isEmpty()) {
      throw new BadRequestException("Invalid URL, missing path.");
    }
    return uri;
  }

  static Map<String, Object> validateBody(Object body) {
    if (body == null) return null;
    if (!(body instanceof Map<?, ?> m)) throw new BadRequestException("Invalid body, should be a JSON object or null.");
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      if (!(e.getKey() instanceof String k)) throw new BadRequestException("Invalid body, keys should be strings.");
      out.put(k, e.getValue());
    }
    return out;
  }

  /** Lenient: a malformed percent escape is kept as sent ("like=FOO%"). */
  static Map<String, String> parseQuery(String rawQuery) {
    Map<String, String> out = new LinkedHashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) return out;
    int hash = rawQuery.indexOf('#');
    if (hash >= 0) rawQuery = rawQuery.substring(0, hash);
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) continue;
      int eq = pair.indexOf('=');
      String k = eq < 0 ? pair : pair.substring(0, eq);
      String v = eq < 0 ? "" : pair.substring(eq + 1);
      out.put(decode(k), decode(v));
    }
    return out;
  }

  private static String decode(String s) {
    if (s.indexOf('%') < 0 && s.indexOf('+') < 0) return s;
    try {
      return URLDecoder.decode(s, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return s;
    }
  }

  private BridgeResponse error(RestException e) {
    ErrorEnvelope envelope = ErrorEnvelope.of(e);
    return new BridgeResponse(envelope.statusCode(), write(envelope.body()), List.of());
  }

  private String write(Object value) {
    try {
      return json.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new InternalServerErrorException("Result is not JSON serializable: " + e.getOriginalMessage(), null, e);
    }
  }
}
