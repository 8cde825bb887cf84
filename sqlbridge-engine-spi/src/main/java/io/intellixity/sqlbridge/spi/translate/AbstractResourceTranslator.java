package io.intellixity.sqlbridge.spi.translate;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.resource.HandlerResult;
import io.intellixity.sqlbridge.resource.ResourceDescriptor;
import io.intellixity.sqlbridge.sql.CreateMode;
import io.intellixity.sqlbridge.sql.Identifiers;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method translator.\n
 *
 * Responsibilities:\n
 * - Parse the request path once (see {@link ResourcePath})\n
 * - Dispatch by verb + collection/instance + custom action + sub-resource\n
 * - Offer shared helpers for body validation and statement execution\n
 *
 * Every hook defaults to BadRequest, so a resource kind only overrides what it supports.
 */
public abstract class AbstractResourceTranslator implements ResourceTranslator {
  protected final NormalizedRequest request;
  protected final StatementExecutor executor;
  protected final ResourcePath path;

  protected AbstractResourceTranslator(ResourceDescriptor descriptor, NormalizedRequest request, StatementExecutor executor) {
    this.request = Objects.requireNonNull(request, "request");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.path = ResourcePath.parse(descriptor, request.path());
  }

  @Override
  public final HandlerResult execute() {
    return switch (request.method()) {
      case PUT -> createOrAlter();
      case GET -> {
        if (path.collection()) yield list();
        if (path.hasSubResource()) yield subResource(path.subResource());
        yield fetch();
      }
      case POST -> {
        if (request.hasAction()) {
          if (path.collection()) throw unsupported("action '" + request.customAction() + "' on a collection");
          yield action(request.customAction());
        }
        if (path.collection()) yield create();
        throw unsupported("POST without an action on an instance");
      }
      case DELETE -> {
        if (path.collection()) throw unsupported("DELETE on a collection");
        yield drop();
      }
    };
  }

  protected HandlerResult createOrAlter() { throw unsupported("PUT"); }

  protected HandlerResult list() { throw unsupported("GET on a collection"); }

  protected HandlerResult fetch() { throw unsupported("GET on an instance"); }

  protected HandlerResult subResource(String name) { throw unsupported("sub-resource '" + name + "'"); }

  protected HandlerResult create() { throw unsupported("POST"); }

  protected HandlerResult action(String action) {
    throw new BadRequestException("Unsupported action '" + action + "' while POSTing");
  }

  protected HandlerResult drop() { throw unsupported("DELETE"); }

  protected final BadRequestException unsupported(String what) {
    return new BadRequestException("Unsupported operation for " + path.descriptor().kind() + ": " + what);
  }

  protected final Map<String, Object> body() { return request.body(); }

  protected final String kind() { return path.descriptor().kind(); }

  /** Required properties present and (when the path names an instance) body name matches it. */
  protected final String requireDesiredName() {
    path.descriptor().properties().requirePresent(body());
    Object raw = body().get("name");
    if (raw == null) throw new BadRequestException("Required property name is missing");
    String desired = Identifiers.normalize(String.valueOf(raw));
    if (path.name() != null && !path.name().equals(desired)) {
      throw new BadRequestException(capitalize(kind()) + " names are not consistent, "
          + path.name() + " != " + raw + ".");
    }
    return desired;
  }

  protected final CreateMode createMode() {
    return CreateMode.parse(request.queryParam(CreateMode.QUERY_PARAM), CreateMode.ERROR_IF_EXISTS);
  }

  /** Runs one statement and returns its first shaped row. */
  protected final HandlerResult run(String sql) {
    return HandlerResult.single(sql, executor.executeOne(sql));
  }

  protected final HandlerResult runAll(List<String> statements, Object result) {
    for (String sql : statements) executor.execute(sql);
    return HandlerResult.of(statements, result);
  }

  private static String capitalize(String s) {
    return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
