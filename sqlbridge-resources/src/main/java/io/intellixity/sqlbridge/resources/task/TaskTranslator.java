package io.intellixity.sqlbridge.resources.task;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.NotFoundException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.mapping.Coercions;
import io.intellixity.sqlbridge.reconcile.DependencyListDiff;
import io.intellixity.sqlbridge.reconcile.DiffOutcome;
import io.intellixity.sqlbridge.reconcile.PropertyDiff;
import io.intellixity.sqlbridge.reconcile.PropertyTable;
import io.intellixity.sqlbridge.reconcile.Reconcilable;
import io.intellixity.sqlbridge.reconcile.ReconciliationPlan;
import io.intellixity.sqlbridge.reconcile.Reconciler;
import io.intellixity.sqlbridge.reconcile.Values;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.resource.Creatable;
import io.intellixity.sqlbridge.resource.Describable;
import io.intellixity.sqlbridge.resource.DescribeResult;
import io.intellixity.sqlbridge.resource.HandlerResult;
import io.intellixity.sqlbridge.resource.ResourceDescriptor;
import io.intellixity.sqlbridge.resources.support.BodyValues;
import io.intellixity.sqlbridge.resources.support.Plans;
import io.intellixity.sqlbridge.resources.support.ShowClauses;
import io.intellixity.sqlbridge.resources.support.Statements;
import io.intellixity.sqlbridge.sql.Identifiers;
import io.intellixity.sqlbridge.sql.SqlLiterals;
import io.intellixity.sqlbridge.spi.translate.AbstractResourceTranslator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tasks of a schema: /api/v2/databases/{database}/schemas/{schema}/tasks[/{name}[/{sub}][:action]]\n
 *
 * Sub-resources: dependents, current_graphs, complete_graphs. Actions: resume, suspend, execute.
 */
public final class TaskTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name", "definition")
      .optional("warehouse", "schedule", "comment", "config", "session_parameters", "predecessors",
          "user_task_managed_initial_warehouse_size", "user_task_timeout_ms", "condition",
          "allow_overlapping_execution", "error_integration", "suspend_task_after_num_failures")
      .immutable("user_task_managed_initial_warehouse_size")
      .unsettable("warehouse", "comment", "allow_overlapping_execution", "error_integration",
          "suspend_task_after_num_failures", "user_task_timeout_ms")
      .quoted("comment")
      .caseInsensitive("warehouse", "user_task_managed_initial_warehouse_size", "error_integration")
      .special("name", "definition", "schedule", "config", "session_parameters", "predecessors", "condition")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "task", "tasks",
      List.of("api", "v2", "databases", ResourceDescriptor.DATABASE, "schemas", ResourceDescriptor.SCHEMA,
          "tasks", ResourceDescriptor.NAME, ResourceDescriptor.SUB),
      Pattern.compile("/api/v2/databases/[^/]+/schemas/[^/]+/tasks(/[^/]+)*"),
      PROPERTIES);

  /** TASK-level parameters surfaced as top-level properties rather than session parameters. */
  private static final List<String> TOP_LEVEL_PARAMETERS = List.of(
      "user_task_managed_initial_warehouse_size", "user_task_timeout_ms", "suspend_task_after_num_failures");

  public TaskTranslator(NormalizedRequest request, StatementExecutor executor) {
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
    StringBuilder sql = new StringBuilder(Statements.create(createMode(), "TASK"));
    sql.append(path.parent().qualify(name)).append(' ');
    Map<String, Object> body = body();
    if (body.get("warehouse") != null) {
      sql.append(Statements.assignment("warehouse", String.valueOf(body.get("warehouse"))));
    } else if (body.get("user_task_managed_initial_warehouse_size") != null) {
      sql.append(Statements.assignment("user_task_managed_initial_warehouse_size",
          SqlLiterals.singleQuote(body.get("user_task_managed_initial_warehouse_size"))));
    }
    if (body.get("schedule") != null) sql.append(Statements.assignment("schedule", TaskSchedule.render(body.get("schedule"))));
    Map<String, Object> config = Coercions.parseJsonObject(body.get("config"));
    if (config != null && !config.isEmpty()) {
      sql.append(Statements.assignment("config", SqlLiterals.singleQuote(Coercions.toJson(config))));
    }
    if (Boolean.TRUE.equals(body.get("allow_overlapping_execution"))) {
      sql.append(Statements.assignment("allow_overlapping_execution", "true"));
    }
    for (var e : sessionParameters(body).entrySet()) {
      sql.append(Statements.assignment(e.getKey(), SqlLiterals.singleQuote(e.getValue())));
    }
    for (String key : List.of("user_task_timeout_ms", "suspend_task_after_num_failures", "error_integration")) {
      if (body.get(key) != null) sql.append(Statements.assignment(key, SqlLiterals.render(body.get(key))));
    }
    if (body.get("comment") != null) sql.append(Statements.assignment("comment", PROPERTIES.render("comment", body.get("comment"))));
    List<String> predecessors = BodyValues.stringList(body, "predecessors");
    if (!predecessors.isEmpty()) sql.append("AFTER ").append(qualifyPredecessors(predecessors)).append(' ');
    if (body.get("condition") != null) sql.append("WHEN ").append(body.get("condition")).append(' ');
    sql.append("AS ").append(body.get("definition"));
    return run(sql.toString());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    try {
      return DescribeResult.found(describeTask(path.parent().qualify(name)));
    } catch (NotFoundException e) {
      return DescribeResult.notFound();
    }
  }

  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    Map<String, Object> body = body();
    Map<String, Object> reported = new LinkedHashMap<>(current);
    // false is the default and is always reported
    if (Boolean.FALSE.equals(reported.get("allow_overlapping_execution"))) reported.remove("allow_overlapping_execution");
    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, body, reported);
    PropertyDiff.rejectViolations(outcomes, kind());

    String alter = "ALTER TASK " + path.parent().qualify(requireDesiredName());
    List<String> unsets = new ArrayList<>(Plans.unsets(outcomes));
    List<String> sets = new ArrayList<>(Plans.assignments(PROPERTIES, outcomes));

    Object schedule = body.get("schedule");
    Object currentSchedule = current.get("schedule");
    if (schedule == null) {
      if (currentSchedule != null) unsets.add("schedule");
    } else if (currentSchedule == null || !TaskSchedule.render(schedule).equals(TaskSchedule.render(currentSchedule))) {
      sets.add("SCHEDULE = " + TaskSchedule.render(schedule));
    }

    Map<String, Object> config = Coercions.parseJsonObject(body.get("config"));
    Map<String, Object> currentConfig = Coercions.parseJsonObject(current.get("config"));
    boolean noConfig = config == null || config.isEmpty();
    boolean noCurrentConfig = currentConfig == null || currentConfig.isEmpty();
    if (noConfig) {
      if (!noCurrentConfig) unsets.add("config");
    } else if (noCurrentConfig || !Values.equivalent(config, currentConfig)) {
      sets.add("CONFIG = " + SqlLiterals.singleQuote(Coercions.toJson(config)));
    }

    Map<String, Object> params = sessionParameters(body);
    Map<String, Object> currentParams = sessionParameters(current);
    for (String key : currentParams.keySet()) {
      if (!params.containsKey(key)) unsets.add(key);
    }
    for (var e : params.entrySet()) {
      if (!Values.equivalent(e.getValue(), currentParams.get(e.getKey()), false)) {
        sets.add(e.getKey().toUpperCase(Locale.ROOT) + " = " + SqlLiterals.singleQuote(e.getValue()));
      }
    }

    ReconciliationPlan.Builder plan = ReconciliationPlan.builder()
        .unset(alter, unsets, ", ")
        .set(alter, sets, ", ");

    String definition = String.valueOf(body.get("definition")).trim();
    Object currentDefinition = current.get("definition");
    if (currentDefinition == null || !definition.equals(String.valueOf(currentDefinition).trim())) {
      plan.statement(alter + " MODIFY AS " + definition);
    }

    Object condition = body.get("condition");
    Object currentCondition = current.get("condition");
    if (condition == null) {
      if (currentCondition != null) plan.statement(alter + " REMOVE WHEN");
    } else if (!String.valueOf(condition).trim().equals(currentCondition == null ? null : String.valueOf(currentCondition).trim())) {
      plan.statement(alter + " MODIFY WHEN " + condition);
    }

    @SuppressWarnings("unchecked")
    List<String> currentPredecessors = current.get("predecessors") instanceof List<?> l ? (List<String>) l : List.of();
    DependencyListDiff.Result preds = DependencyListDiff.diff(currentPredecessors,
        BodyValues.stringList(body, "predecessors"), TaskTranslator::predecessorKey);
    if (!preds.removed().isEmpty()) plan.statement(alter + " REMOVE AFTER " + qualifyPredecessors(preds.removed()));
    if (!preds.added().isEmpty()) plan.statement(alter + " ADD AFTER " + qualifyPredecessors(preds.added()));
    return plan.build();
  }

  @Override
  protected HandlerResult list() {
    String show = "SHOW TASKS " + ShowClauses.like(request) + "IN SCHEMA " + path.parent().schemaRef() + " "
        + ShowClauses.startsWith(request) + (request.flag("rootOnly") ? "ROOT ONLY " : "") + ShowClauses.limit(request);
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> row : executor.execute(show)) rows.add(TaskRows.normalize(row));
    return HandlerResult.list(show, rows);
  }

  @Override
  protected HandlerResult fetch() {
    return HandlerResult.single("DESC TASK " + path.qualifiedName(), describeTask(path.qualifiedName()));
  }

  @Override
  protected HandlerResult subResource(String name) {
    return switch (name) {
      case "dependents" -> dependents();
      case "current_graphs" -> graphs("SELECT * FROM TABLE(INFORMATION_SCHEMA.CURRENT_TASK_GRAPHS())");
      case "complete_graphs" -> graphs("SELECT * FROM TABLE(INFORMATION_SCHEMA.COMPLETE_TASK_GRAPHS(ERROR_ONLY => "
          + request.flag("errorOnly") + "))");
      default -> super.subResource(name);
    };
  }

  @Override
  protected HandlerResult action(String action) {
    String task = path.qualifiedName();
    return switch (action) {
      case "resume" -> run("ALTER TASK " + task + " RESUME ");
      case "suspend" -> run("ALTER TASK " + task + " SUSPEND ");
      case "execute" -> run("EXECUTE TASK " + task + (request.flag("retryLast") ? " RETRY LAST" : ""));
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP TASK " + Statements.ifExists(request) + path.qualifiedName());
  }

  /** DESC TASK row plus its TASK-level parameters. */
  private Map<String, Object> describeTask(String qualified) {
    List<Map<String, Object>> rows = executor.execute("DESC TASK " + qualified);
    if (rows.isEmpty()) throw new NotFoundException("Task " + qualified + " does not exist.");
    Map<String, Object> task = TaskRows.normalize(rows.get(0));
    Map<String, Object> sessionParameters = new LinkedHashMap<>();
    for (Map<String, Object> p : executor.execute("SHOW PARAMETERS IN TASK " + qualified)) {
      if (!"TASK".equalsIgnoreCase(String.valueOf(p.get("level")))) continue;
      String key = String.valueOf(p.get("key")).toLowerCase(Locale.ROOT);
      Object value = TaskRows.parameterValue(String.valueOf(p.get("type")), p.get("value"));
      if (TOP_LEVEL_PARAMETERS.contains(key)) {
        task.put(key, value instanceof String s ? s.toUpperCase(Locale.ROOT) : value);
      } else {
        sessionParameters.put(key, value);
      }
    }
    task.put("session_parameters", sessionParameters);
    return task;
  }

  private HandlerResult dependents() {
    String sql = "SELECT * FROM TABLE(INFORMATION_SCHEMA.TASK_DEPENDENTS(TASK_NAME => "
        + SqlLiterals.singleQuote(path.qualifiedName()) + ", RECURSIVE => "
        + !"false".equalsIgnoreCase(request.queryParam("recursive", "true")) + "))";
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> row : executor.execute(sql)) rows.add(TaskRows.normalize(Coercions.lowerKeys(row)));
    return HandlerResult.list(sql, rows);
  }

  private HandlerResult graphs(String source) {
    String sql = source + " WHERE database_name = " + SqlLiterals.singleQuote(Identifiers.unquote(path.parent().database()))
        + " AND schema_name = " + SqlLiterals.singleQuote(Identifiers.unquote(path.parent().schema()))
        + " AND root_task_name = " + SqlLiterals.singleQuote(Identifiers.unquote(path.name()));
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> row : executor.execute(sql)) {
      Map<String, Object> r = Coercions.lowerKeys(row);
      if (r.get("first_error_code") != null) r.put("first_error_code", Coercions.toInteger(r.get("first_error_code")));
      rows.add(r);
    }
    return HandlerResult.list(sql, rows);
  }

  /** Fully qualifies one-, two- or three-part predecessor names against this task's schema. */
  private String qualifyPredecessors(List<String> predecessors) {
    List<String> out = new ArrayList<>(predecessors.size());
    for (String pred : predecessors) {
      List<String> parts = Identifiers.parts(pred);
      List<String> normalized = new ArrayList<>(parts.size());
      for (String p : parts) normalized.add(Identifiers.normalize(p));
      out.add(switch (normalized.size()) {
        case 1 -> path.parent().qualify(normalized.get(0));
        case 2 -> Identifiers.qualify(path.parent().database(), normalized.get(0), normalized.get(1));
        case 3 -> Identifiers.qualify(normalized.toArray(new String[0]));
        default -> throw new BadRequestException("Task predecessor " + pred + " has a wrong format.");
      });
    }
    return String.join(", ", out);
  }

  private static String predecessorKey(String name) {
    return Identifiers.normalize(Identifiers.lastPart(name));
  }

  private static Map<String, Object> sessionParameters(Map<String, Object> source) {
    Object raw = source.get("session_parameters");
    if (raw == null) return Map.of();
    if (!(raw instanceof Map<?, ?> m)) throw new BadRequestException("session_parameters must be an object");
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()).toLowerCase(Locale.ROOT), e.getValue());
    return out;
  }
}
