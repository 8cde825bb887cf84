package io.intellixity.sqlbridge.resources.schema;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.NotFoundException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
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
import io.intellixity.sqlbridge.resources.support.ParameterRows;
import io.intellixity.sqlbridge.resources.support.Plans;
import io.intellixity.sqlbridge.resources.support.PointOfTime;
import io.intellixity.sqlbridge.resources.support.ShowClauses;
import io.intellixity.sqlbridge.resources.support.Statements;
import io.intellixity.sqlbridge.sql.Identifiers;
import io.intellixity.sqlbridge.sql.SqlLiterals;
import io.intellixity.sqlbridge.spi.translate.AbstractResourceTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Schemas of a database: /api/v2/databases/{database}/schemas[/{name}[:action]] */
public final class SchemaTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {
  private static final Logger log = LoggerFactory.getLogger(SchemaTranslator.class);

  static final List<String> PARAMETERS = List.of(
      "data_retention_time_in_days", "max_data_extension_time_in_days", "default_ddl_collation", "log_level",
      "pipe_execution_paused", "suspend_task_after_num_failures", "trace_level",
      "user_task_managed_initial_warehouse_size", "user_task_timeout_ms");

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name")
      .optional("comment")
      .optional(PARAMETERS.toArray(new String[0]))
      .readOnly("created_on", "is_default", "is_current", "database_name", "owner", "options", "dropped_on",
          "owner_role_type")
      .unsettable("comment")
      .unsettable(PARAMETERS.toArray(new String[0]))
      .quoted("comment", "default_ddl_collation", "user_task_managed_initial_warehouse_size")
      .caseInsensitive("log_level", "trace_level", "user_task_managed_initial_warehouse_size", "database_name")
      .special("name")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "schema", "schemas",
      List.of("api", "v2", "databases", ResourceDescriptor.DATABASE, "schemas", ResourceDescriptor.NAME,
          ResourceDescriptor.SUB),
      Pattern.compile("/api/v2/databases/[^/]+/schemas(/[^/]+)*"),
      PROPERTIES);

  private static final String LEVEL = "SCHEMA";
  private static final Set<String> KINDS = Set.of("TRANSIENT");

  private static final RowNormalizer SHOW_ROW = RowNormalizer.builder()
      .keep("created_on", "name", "is_default", "is_current", "database_name", "owner", "comment", "options",
          "owner_role_type", "dropped_on", "retention_time")
      .rename("retention_time", "data_retention_time_in_days")
      .yesNo("is_default", "is_current")
      .emptyToNull("comment", "options")
      .convert(v -> v == null ? null : Identifiers.normalize(String.valueOf(v)), "name")
      .build();

  private static final RowNormalizer WITH_PARAMETERS = RowNormalizer.builder()
      .trueFalse("pipe_execution_paused")
      .integers("data_retention_time_in_days", "max_data_extension_time_in_days",
          "suspend_task_after_num_failures", "user_task_timeout_ms")
      .emptyToNull("default_ddl_collation", "log_level", "trace_level", "user_task_managed_initial_warehouse_size")
      .build();

  public SchemaTranslator(NormalizedRequest request, StatementExecutor executor) {
    super(DESCRIPTOR, request, executor);
  }

  @Override
  protected HandlerResult createOrAlter() {
    requireDesiredName();
    return Reconciler.createOrAlter(kind(), this, executor);
  }

  @Override
  public HandlerResult create() {
    if (body().get("name") == null) throw new BadRequestException("Name is a required field for creating a schema");
    String name = requireDesiredName();
    return run(Statements.create(createMode(), modifier(), "SCHEMA") + path.parent().qualify(name) + " "
        + managedAccess() + options());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    Map<String, Object> row = findShowRow(name);
    if (row == null) return DescribeResult.notFound();
    Map<String, Object> current = SHOW_ROW.normalize(row);
    ParameterRows.mergeTyped(current, executor.execute("SHOW PARAMETERS IN SCHEMA " + path.parent().qualify(name)), LEVEL);
    return DescribeResult.found(current);
  }

  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, body(), current);
    PropertyDiff.rejectViolations(outcomes, kind());
    String alter = "ALTER SCHEMA " + path.parent().qualify(requireDesiredName());
    return ReconciliationPlan.builder()
        .unset(alter, Plans.unsets(outcomes), ", ")
        .set(alter, Plans.assignments(PROPERTIES, outcomes), " ")
        .build();
  }

  @Override
  protected HandlerResult list() {
    String show = "SHOW SCHEMAS " + (request.flag("history") ? "HISTORY " : "") + ShowClauses.like(request)
        + "IN DATABASE " + path.parent().database() + " " + ShowClauses.paging(request);
    List<String> statements = new ArrayList<>();
    statements.add(show);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> row : executor.execute(show)) {
      Map<String, Object> shaped = withParameters(SHOW_ROW.normalize(row), statements);
      if (shaped != null) out.add(shaped);
    }
    return HandlerResult.of(statements, out);
  }

  @Override
  protected HandlerResult fetch() {
    Map<String, Object> row = findShowRow(path.name());
    if (row == null) throw new NotFoundException("Schema cannot be found.");
    List<String> statements = new ArrayList<>();
    statements.add(showLike(path.name()));
    Map<String, Object> shaped = withParameters(SHOW_ROW.normalize(row), statements);
    if (shaped == null) throw new NotFoundException("Schema cannot be found.");
    return HandlerResult.of(statements, shaped);
  }

  @Override
  protected HandlerResult action(String action) {
    return switch (action) {
      case "clone" -> cloneSchema();
      case "undrop" -> run("UNDROP SCHEMA " + path.qualifiedName());
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP SCHEMA " + Statements.ifExists(request) + path.qualifiedName());
  }

  private HandlerResult cloneSchema() {
    if (body().get("name") == null) throw new BadRequestException("Name is a required field for cloning a schema");
    String target = path.parent().qualify(Identifiers.normalize(String.valueOf(body().get("name"))));
    return run(Statements.create(createMode(), modifier(), "SCHEMA") + target + " CLONE " + path.qualifiedName() + " "
        + PointOfTime.clause(body().get("point_of_time")) + managedAccess() + options());
  }

  private String managedAccess() {
    return request.flag("with_managed_access") ? "WITH MANAGED ACCESS " : "";
  }

  private String options() {
    StringBuilder sb = new StringBuilder();
    for (String key : PARAMETERS) {
      Object v = body().get(key);
      if (v == null) continue;
      sb.append(Statements.assignment(key, PROPERTIES.render(key, v)));
    }
    if (body().get("comment") != null) sb.append(Statements.assignment("comment", PROPERTIES.render("comment", body().get("comment"))));
    return sb.toString();
  }

  private String modifier() {
    String kind = request.queryParam("kind");
    if (kind == null || kind.isBlank()) return null;
    if (!KINDS.contains(kind.toUpperCase(Locale.ROOT))) throw new BadRequestException("Unsupported schema kind " + kind);
    return kind;
  }

  private Map<String, Object> withParameters(Map<String, Object> shaped, List<String> statements) {
    String params = "SHOW PARAMETERS IN SCHEMA " + path.parent().qualify(String.valueOf(shaped.get("name")));
    statements.add(params);
    try {
      ParameterRows.mergeRaw(shaped, executor.execute(params), PARAMETERS);
    } catch (NotFoundException e) {
      log.debug("sqlbridge.list_skip kind=schema name={} status={}", shaped.get("name"), e.statusCode());
      return null;
    }
    return WITH_PARAMETERS.normalize(shaped);
  }

  private String showLike(String name) {
    return "SHOW SCHEMAS LIKE " + SqlLiterals.pattern(Identifiers.unquote(name)) + " IN DATABASE " + path.parent().database();
  }

  private Map<String, Object> findShowRow(String name) {
    for (Map<String, Object> row : executor.execute(showLike(name))) {
      Object rowName = row.get("name");
      if (rowName != null && Identifiers.sameName(String.valueOf(rowName), name)) return new LinkedHashMap<>(row);
    }
    return null;
  }
}
