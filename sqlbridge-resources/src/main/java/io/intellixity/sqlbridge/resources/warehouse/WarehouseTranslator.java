package io.intellixity.sqlbridge.resources.warehouse;

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
import java.util.Map;
import java.util.regex.Pattern;

/** Account-level warehouses: /api/v2/warehouses[/{name}[:action]] */
public final class WarehouseTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {
  private static final Logger log = LoggerFactory.getLogger(WarehouseTranslator.class);

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name")
      .optional("warehouse_type", "warehouse_size", "wait_for_completion", "max_cluster_count",
          "min_cluster_count", "scaling_policy", "auto_suspend", "auto_resume", "initially_suspended",
          "resource_monitor", "comment", "enable_query_acceleration", "query_acceleration_max_scale_factor",
          "max_concurrency_level", "statement_queued_timeout_in_seconds", "statement_timeout_in_seconds")
      .unsettable("max_cluster_count", "min_cluster_count", "auto_suspend", "auto_resume", "comment",
          "enable_query_acceleration", "max_concurrency_level", "statement_queued_timeout_in_seconds",
          "statement_timeout_in_seconds")
      .quoted("comment")
      .caseInsensitive("warehouse_type", "warehouse_size", "scaling_policy")
      .special("name", "wait_for_completion", "initially_suspended")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "warehouse", "warehouses",
      List.of("api", "v2", "warehouses", ResourceDescriptor.NAME),
      Pattern.compile("/api/v2/warehouses(/[^/]+)*"),
      PROPERTIES);

  private static final String LEVEL = "WAREHOUSE";

  private static final RowNormalizer SHOW_ROW = RowNormalizer.builder()
      .yesNo("is_default", "is_current")
      .emptyToNull("comment", "resource_monitor")
      .build();

  public WarehouseTranslator(NormalizedRequest request, StatementExecutor executor) {
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
    StringBuilder sql = new StringBuilder(Statements.create(createMode(), "WAREHOUSE"));
    sql.append(name).append(' ');
    for (String key : PROPERTIES.optional()) {
      Object v = body().get(key);
      if (v == null) continue;
      sql.append(Statements.assignment(key, PROPERTIES.render(key, v)));
    }
    return run(sql.toString());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    Map<String, Object> row = findShowRow(name);
    if (row == null) return DescribeResult.notFound();
    Map<String, Object> current = SHOW_ROW.normalize(row);
    current.putIfAbsent("warehouse_size", row.get("size"));
    current.putIfAbsent("warehouse_type", row.get("type"));
    ParameterRows.mergeTyped(current, executor.execute("SHOW PARAMETERS IN WAREHOUSE " + name), LEVEL);
    return DescribeResult.found(current);
  }

  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, body(), current);
    PropertyDiff.rejectViolations(outcomes, kind());
    String alter = "ALTER WAREHOUSE " + requireDesiredName();
    return ReconciliationPlan.builder()
        .unset(alter, Plans.unsets(outcomes), ", ")
        .set(alter, Plans.assignments(PROPERTIES, outcomes), " ")
        .build();
  }

  @Override
  protected HandlerResult list() {
    String show = "SHOW WAREHOUSES " + ShowClauses.like(request);
    List<String> statements = new ArrayList<>();
    statements.add(show);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> row : executor.execute(show)) {
      Map<String, Object> shaped = SHOW_ROW.normalize(row);
      String params = "SHOW PARAMETERS IN WAREHOUSE " + Identifiers.fromStored(String.valueOf(row.get("name")));
      statements.add(params);
      try {
        ParameterRows.mergeTyped(shaped, executor.execute(params), LEVEL);
      } catch (BadRequestException | NotFoundException e) {
        // dropped between SHOW and SHOW PARAMETERS
        log.debug("sqlbridge.list_skip kind=warehouse name={} status={}", row.get("name"), e.statusCode());
        continue;
      }
      out.add(shaped);
    }
    return HandlerResult.of(statements, out);
  }

  @Override
  protected HandlerResult fetch() {
    Map<String, Object> show = findShowRow(path.name());
    if (show == null) throw notFound();
    String desc = "DESC WAREHOUSE " + path.name();
    List<Map<String, Object>> described = executor.execute(desc);
    // dropped after SHOW
    if (described.isEmpty()) throw notFound();
    Map<String, Object> row = new LinkedHashMap<>(described.get(0));
    row.putAll(SHOW_ROW.normalize(show));
    String params = "SHOW PARAMETERS IN WAREHOUSE " + path.name();
    ParameterRows.mergeTyped(row, executor.execute(params), LEVEL);
    return HandlerResult.of(List.of(showStatement(path.name()), desc, params), row);
  }

  @Override
  protected HandlerResult action(String action) {
    String target = "ALTER WAREHOUSE " + path.name();
    return switch (action) {
      case "resume" -> run(target + " RESUME");
      case "suspend" -> run(target + " SUSPEND");
      case "abort" -> run(target + " ABORT ALL QUERIES");
      case "rename" -> {
        Object newName = body().get("name");
        if (newName == null) throw new BadRequestException("New warehouse name is a required field for renaming a Warehouse");
        yield run(target + " RENAME TO " + Identifiers.normalize(String.valueOf(newName)));
      }
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP WAREHOUSE " + Statements.ifExists(request) + path.name());
  }

  private NotFoundException notFound() {
    return new NotFoundException("Warehouse " + path.name() + " cannot be found.");
  }

  private static String showStatement(String name) {
    return "SHOW WAREHOUSES LIKE " + SqlLiterals.pattern(Identifiers.unquote(name));
  }

  private Map<String, Object> findShowRow(String name) {
    for (Map<String, Object> row : executor.execute(showStatement(name))) {
      Object rowName = row.get("name");
      if (rowName != null && Identifiers.sameName(String.valueOf(rowName), name)) return row;
    }
    return null;
  }
}
