package io.intellixity.sqlbridge.resources.service;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.NotFoundException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.mapping.Coercions;
import io.intellixity.sqlbridge.mapping.RowNormalizer;
import io.intellixity.sqlbridge.reconcile.DiffOutcome;
import io.intellixity.sqlbridge.reconcile.PropertyDiff;
import io.intellixity.sqlbridge.reconcile.PropertyTable;
import io.intellixity.sqlbridge.reconcile.Reconcilable;
import io.intellixity.sqlbridge.reconcile.ReconciliationPlan;
import io.intellixity.sqlbridge.reconcile.Reconciler;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.resource.Creatable;
import io.intellixity.sqlbridge.resource.Describable;
import io.intellixity.sqlbridge.resource.DescribeResult;
import io.intellixity.sqlbridge.resource.HandlerResult;
import io.intellixity.sqlbridge.resource.ResourceDescriptor;
import io.intellixity.sqlbridge.resources.support.Plans;
import io.intellixity.sqlbridge.resources.support.ShowClauses;
import io.intellixity.sqlbridge.resources.support.Statements;
import io.intellixity.sqlbridge.sql.Identifiers;
import io.intellixity.sqlbridge.sql.SqlLiterals;
import io.intellixity.sqlbridge.spi.translate.AbstractResourceTranslator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Container services of a schema: /api/v2/databases/{database}/schemas/{schema}/services[/{name}[/{sub}][:action]]\n
 *
 * Sub-resources: logs, status.
 */
public final class ServiceTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {

  static final String FROM_FILE = "from_file";
  static final String FROM_INLINE = "from_inline";

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name", "compute_pool", "spec")
      .optional("min_instances", "max_instances", "auto_resume", "query_warehouse", "comment")
      .immutable("compute_pool")
      .unsettable("min_instances", "max_instances", "auto_resume", "query_warehouse", "comment")
      .quoted("comment")
      .caseInsensitive("compute_pool", "query_warehouse")
      .special("name", "spec")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "service", "services",
      List.of("api", "v2", "databases", ResourceDescriptor.DATABASE, "schemas", ResourceDescriptor.SCHEMA,
          "services", ResourceDescriptor.NAME, ResourceDescriptor.SUB),
      Pattern.compile("/api/v2/databases/[^/]+/schemas/[^/]+/services(/[^/]+)*"),
      PROPERTIES);

  private static final RowNormalizer ROW = RowNormalizer.builder()
      .trueFalse("auto_resume")
      .integers("min_instances", "max_instances")
      .emptyToNull("comment", "query_warehouse")
      .build();

  public ServiceTranslator(NormalizedRequest request, StatementExecutor executor) {
    super(DESCRIPTOR, request, executor);
  }

  @Override
  protected HandlerResult createOrAlter() {
    requireDesiredName();
    return Reconciler.createOrAlter(kind(), this, executor);
  }

  @Override
  public HandlerResult create() {
    String name = requireDesiredName();
    Map<String, Object> body = body();
    StringBuilder sql = new StringBuilder(Statements.create(createMode(), "SERVICE"));
    sql.append(path.parent().qualify(name)).append(' ');
    sql.append("IN COMPUTE POOL ").append(body.get("compute_pool")).append(' ');
    sql.append(specClause(body.get("spec"))).append(' ');
    for (String key : List.of("min_instances", "max_instances", "auto_resume", "query_warehouse")) {
      if (body.get(key) != null) sql.append(Statements.assignment(key, SqlLiterals.render(body.get(key))));
    }
    if (body.get("comment") != null) sql.append(Statements.assignment("comment", PROPERTIES.render("comment", body.get("comment"))));
    return run(sql.toString());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    try {
      return DescribeResult.found(describeService(path.parent().qualify(name)));
    } catch (NotFoundException e) {
      return DescribeResult.notFound();
    }
  }

  /** Stage-file specifications cannot be read back, so only inline text is compared. */
  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, body(), current);
    PropertyDiff.rejectViolations(outcomes, kind());
    String alter = "ALTER SERVICE " + path.parent().qualify(requireDesiredName());
    ReconciliationPlan.Builder plan = ReconciliationPlan.builder()
        .unset(alter, Plans.unsets(outcomes), ", ")
        .set(alter, Plans.assignments(PROPERTIES, outcomes), " ");

    Map<String, Object> spec = spec(body().get("spec"));
    if (FROM_INLINE.equals(spec.get("spec_type"))) {
      Object currentText = current.get("spec") instanceof Map<?, ?> m ? m.get("spec_text") : null;
      if (!String.valueOf(spec.get("spec_text")).strip().equals(currentText == null ? null : String.valueOf(currentText).strip())) {
        plan.statement(alter + " " + specClause(spec));
      }
    }
    return plan.build();
  }

  @Override
  protected HandlerResult list() {
    StringBuilder show = new StringBuilder("SHOW SERVICES ")
        .append(ShowClauses.like(request))
        .append(ShowClauses.startsWith(request));
    if (request.hasQueryParam(ShowClauses.SHOW_LIMIT)) {
      show.append(ShowClauses.limit(request));
      if (request.hasQueryParam(ShowClauses.FROM_NAME)) show.append(ShowClauses.from(request)).append(' ');
    }
    show.append("IN SCHEMA ").append(path.parent().schemaRef());
    String sql = show.toString();

    List<String> statements = new ArrayList<>();
    statements.add(sql);
    List<Map<String, Object>> services = new ArrayList<>();
    // listing omits the specification, so every service is described
    for (Map<String, Object> row : executor.execute(sql)) {
      String qualified = path.parent().qualify(Identifiers.fromStored(String.valueOf(row.get("name"))));
      statements.add(describeStatement(qualified));
      services.add(describeService(qualified));
    }
    return HandlerResult.of(statements, services);
  }

  @Override
  protected HandlerResult fetch() {
    String qualified = path.qualifiedName();
    return HandlerResult.single(describeStatement(qualified), describeService(qualified));
  }

  @Override
  protected HandlerResult subResource(String name) {
    String qualified = SqlLiterals.singleQuote(path.qualifiedName());
    String sql = switch (name) {
      case "logs" -> "CALL SYSTEM$GET_SERVICE_LOGS(" + qualified + ", "
          + SqlLiterals.singleQuote(requireQueryParam("instanceId")) + ", "
          + SqlLiterals.singleQuote(requireQueryParam("containerName")) + ")";
      case "status" -> "CALL SYSTEM$GET_SERVICE_STATUS(" + qualified + ", " + timeout() + ")";
      default -> throw unsupported("sub-resource '" + name + "'");
    };
    return HandlerResult.single(sql, Coercions.lowerKeys(executor.executeOne(sql)));
  }

  @Override
  protected HandlerResult action(String action) {
    return switch (action) {
      case "resume" -> run("ALTER SERVICE " + Statements.ifExists(request) + path.qualifiedName() + " RESUME");
      case "suspend" -> run("ALTER SERVICE " + Statements.ifExists(request) + path.qualifiedName() + " SUSPEND");
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP SERVICE " + Statements.ifExists(request) + path.qualifiedName());
  }

  private static String describeStatement(String qualified) {
    return "DESC SERVICE " + qualified;
  }

  private Map<String, Object> describeService(String qualified) {
    List<Map<String, Object>> rows = executor.execute(describeStatement(qualified));
    if (rows.isEmpty()) throw new NotFoundException("Service " + qualified + " does not exist or not authorized.");
    Map<String, Object> raw = rows.get(0);
    Map<String, Object> out = ROW.normalize(raw);
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("spec_type", FROM_INLINE);
    spec.put("spec_text", raw.get("spec"));
    out.put("spec", spec);
    return out;
  }

  private String requireQueryParam(String key) {
    String v = request.queryParam(key);
    if (v == null || v.isBlank()) throw new BadRequestException("Query parameter " + key + " is required");
    return v;
  }

  private String timeout() {
    String raw = requireQueryParam("timeout");
    int seconds;
    try {
      seconds = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new BadRequestException("timeout must be a non-negative integer, got " + raw, null, e);
    }
    if (seconds < 0) throw new BadRequestException("timeout must be a non-negative integer, got " + raw);
    return String.valueOf(seconds);
  }

  static String specClause(Object rawSpec) {
    Map<String, Object> spec = spec(rawSpec);
    Object type = spec.get("spec_type");
    if (FROM_FILE.equals(type)) {
      Object stage = spec.get("stage");
      Object file = spec.get("spec_file");
      if (stage == null || file == null) throw new BadRequestException("stage and spec_file are required for a from_file spec");
      String at = String.valueOf(stage).startsWith("@") ? "" : "@";
      return "FROM " + at + stage + " SPECIFICATION_FILE = " + SqlLiterals.singleQuote(file);
    }
    if (FROM_INLINE.equals(type)) {
      if (spec.get("spec_text") == null) throw new BadRequestException("spec_text is required for a from_inline spec");
      return "FROM SPECIFICATION " + SqlLiterals.singleQuote(spec.get("spec_text"));
    }
    throw new BadRequestException("spec_type must be from_file or from_inline, got " + type);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> spec(Object raw) {
    if (raw instanceof Map<?, ?> m) return (Map<String, Object>) m;
    throw new BadRequestException("spec must be an object with a spec_type");
  }
}
