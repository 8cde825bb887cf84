package io.intellixity.sqlbridge.resources.database;

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
import io.intellixity.sqlbridge.resources.support.BodyValues;
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

/**
 * Databases: /api/v2/databases[/{name}[/{replication|failover}][:action]]\n
 *
 * Replication and failover toggles address the sub-resource, e.g. POST /databases/DB1/replication:enable.
 */
public final class DatabaseTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {
  private static final Logger log = LoggerFactory.getLogger(DatabaseTranslator.class);

  /** Database-level parameters, in CREATE clause order. */
  static final List<String> PARAMETERS = List.of(
      "data_retention_time_in_days", "default_ddl_collation", "log_level", "max_concurrency_level",
      "max_data_extension_time_in_days", "suspend_task_after_num_failures", "trace_level",
      "user_task_managed_initial_warehouse_size", "user_task_timeout_ms");

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name")
      .optional("comment")
      .optional(PARAMETERS.toArray(new String[0]))
      .readOnly("created_on", "is_default", "is_current", "origin", "owner", "options", "dropped_on",
          "owner_role_type")
      .unsettable("comment")
      .unsettable(PARAMETERS.toArray(new String[0]))
      .quoted("comment", "default_ddl_collation")
      .caseInsensitive("log_level", "trace_level", "user_task_managed_initial_warehouse_size")
      .special("name")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "database", "databases",
      List.of("api", "v2", "databases", ResourceDescriptor.NAME, ResourceDescriptor.SUB),
      Pattern.compile("/api/v2/databases(/[^/]+)*"),
      PROPERTIES);

  private static final String LEVEL = "DATABASE";
  private static final Set<String> KINDS = Set.of("TRANSIENT");

  private static final RowNormalizer SHOW_ROW = RowNormalizer.builder()
      .keep("created_on", "name", "is_default", "is_current", "origin", "owner", "comment", "options",
          "dropped_on", "kind", "retention_time")
      .rename("retention_time", "data_retention_time_in_days")
      .yesNo("is_default", "is_current")
      .emptyToNull("comment", "origin", "options")
      .convert(v -> v == null ? null : Identifiers.normalize(String.valueOf(v)), "name")
      .build();

  private static final RowNormalizer WITH_PARAMETERS = RowNormalizer.builder()
      .integers("data_retention_time_in_days", "max_data_extension_time_in_days",
          "suspend_task_after_num_failures", "user_task_timeout_ms", "max_concurrency_level")
      .emptyToNull("default_ddl_collation", "log_level", "trace_level", "user_task_managed_initial_warehouse_size")
      .build();

  public DatabaseTranslator(NormalizedRequest request, StatementExecutor executor) {
    super(DESCRIPTOR, request, executor);
  }

  @Override
  protected HandlerResult createOrAlter() {
    requireDesiredName();
    return Reconciler.createOrAlter(kind(), this, executor);
  }

  @Override
  public HandlerResult create() {
    if (body().get("name") == null) throw new BadRequestException("Name is a required field for creating a database");
    String name = requireDesiredName();
    return run(Statements.create(createMode(), modifier(), "DATABASE") + name + " " + options());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    Map<String, Object> row = findShowRow(name);
    if (row == null) return DescribeResult.notFound();
    Map<String, Object> current = SHOW_ROW.normalize(row);
    // only values set on the database itself count as current state
    ParameterRows.mergeTyped(current, executor.execute("SHOW PARAMETERS IN DATABASE " + name), LEVEL);
    return DescribeResult.found(current);
  }

  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, body(), current);
    PropertyDiff.rejectViolations(outcomes, kind());
    String alter = "ALTER DATABASE " + requireDesiredName();
    return ReconciliationPlan.builder()
        .unset(alter, Plans.unsets(outcomes), ", ")
        .set(alter, Plans.assignments(PROPERTIES, outcomes), " ")
        .build();
  }

  @Override
  protected HandlerResult list() {
    String show = "SHOW DATABASES " + (request.flag("history") ? "HISTORY " : "")
        + ShowClauses.like(request) + ShowClauses.paging(request);
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
    String show = "SHOW DATABASES LIKE " + SqlLiterals.pattern(Identifiers.unquote(path.name()));
    Map<String, Object> row = findShowRow(path.name());
    if (row == null) throw new NotFoundException("Database cannot be found.");
    List<String> statements = new ArrayList<>();
    statements.add(show);
    Map<String, Object> shaped = withParameters(SHOW_ROW.normalize(row), statements);
    if (shaped == null) throw new NotFoundException("Database cannot be found.");
    return HandlerResult.of(statements, shaped);
  }

  @Override
  protected HandlerResult action(String action) {
    String target = "ALTER DATABASE " + path.name();
    return switch (action) {
      case "clone" -> cloneDatabase();
      case "from_share" -> fromShare();
      case "enable" -> run(target + " ENABLE " + toggled("enable") + " TO ACCOUNTS " + accounts(true));
      case "disable" -> {
        String accounts = accounts(false);
        yield run(target + " DISABLE " + toggled("disable") + (accounts.isEmpty() ? "" : " TO ACCOUNTS " + accounts));
      }
      case "refresh" -> run(target + " REFRESH");
      case "primary" -> run(target + " PRIMARY");
      case "undrop" -> run("UNDROP DATABASE " + path.name());
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP DATABASE " + Statements.ifExists(request) + path.name());
  }

  private HandlerResult cloneDatabase() {
    if (body().get("name") == null) throw new BadRequestException("Name is a required field for cloning a database");
    String target = Identifiers.normalize(String.valueOf(body().get("name")));
    return run(Statements.create(createMode(), modifier(), "DATABASE") + target + " CLONE " + path.name() + " "
        + PointOfTime.clause(body().get("point_of_time")) + options());
  }

  private HandlerResult fromShare() {
    String share = request.queryParam("share");
    if (share == null || share.isBlank()) throw new BadRequestException("share is a required query parameter for creating a database from a share");
    return run(Statements.create(createMode(), "DATABASE") + path.name() + " FROM SHARE " + share + " ");
  }

  private String toggled(String action) {
    String sub = path.subResource();
    if ("replication".equals(sub)) return "REPLICATION";
    if ("failover".equals(sub)) return "FAILOVER";
    throw new BadRequestException("Unsupported property '" + (sub == null ? "" : sub) + "' for action '" + action + "'");
  }

  private String accounts(boolean required) {
    List<String> accounts = BodyValues.stringList(body(), "accounts");
    if (required && accounts.isEmpty()) throw new BadRequestException("accounts is a required field");
    return String.join(", ", accounts);
  }

  /** Parameter and comment clauses of CREATE, in declaration order. */
  private String options() {
    StringBuilder sb = new StringBuilder();
    for (String key : PARAMETERS) {
      Object v = body().get(key);
      if (v == null || (v instanceof String s && s.isEmpty())) continue;
      sb.append(Statements.assignment(key, PROPERTIES.render(key, v)));
    }
    if (body().get("comment") != null) sb.append(Statements.assignment("comment", PROPERTIES.render("comment", body().get("comment"))));
    return sb.toString();
  }

  private String modifier() {
    String kind = request.queryParam("kind");
    if (kind == null || kind.isBlank()) return null;
    if (!KINDS.contains(kind.toUpperCase(Locale.ROOT))) throw new BadRequestException("Unsupported database kind " + kind);
    return kind;
  }

  private Map<String, Object> withParameters(Map<String, Object> shaped, List<String> statements) {
    String params = "SHOW PARAMETERS IN DATABASE " + shaped.get("name");
    statements.add(params);
    try {
      ParameterRows.mergeRaw(shaped, executor.execute(params), PARAMETERS);
    } catch (NotFoundException e) {
      log.debug("sqlbridge.list_skip kind=database name={} status={}", shaped.get("name"), e.statusCode());
      return null;
    }
    return WITH_PARAMETERS.normalize(shaped);
  }

  private Map<String, Object> findShowRow(String name) {
    String sql = "SHOW DATABASES LIKE " + SqlLiterals.pattern(Identifiers.unquote(name));
    for (Map<String, Object> row : executor.execute(sql)) {
      Object rowName = row.get("name");
      if (rowName != null && Identifiers.sameName(String.valueOf(rowName), name)) return new LinkedHashMap<>(row);
    }
    return null;
  }
}
