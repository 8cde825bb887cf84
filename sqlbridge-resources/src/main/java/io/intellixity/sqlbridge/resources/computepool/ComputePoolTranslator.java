package io.intellixity.sqlbridge.resources.computepool;

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
import io.intellixity.sqlbridge.resources.support.Plans;
import io.intellixity.sqlbridge.resources.support.ShowClauses;
import io.intellixity.sqlbridge.resources.support.Statements;
import io.intellixity.sqlbridge.sql.CreateMode;
import io.intellixity.sqlbridge.sql.SqlLiterals;
import io.intellixity.sqlbridge.spi.translate.AbstractResourceTranslator;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Account-level compute pools: /api/v2/compute-pools[/{name}[:action]] */
public final class ComputePoolTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name", "min_nodes", "max_nodes", "instance_family")
      .optional("auto_resume", "auto_suspend_secs", "comment")
      .immutable("instance_family")
      .unsettable("auto_resume", "auto_suspend_secs", "comment")
      .quoted("comment")
      .caseInsensitive("instance_family")
      .special("name")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "compute pool", "compute-pools",
      List.of("api", "v2", "compute-pools", ResourceDescriptor.NAME),
      Pattern.compile("/api/v2/compute-pools(/[^/]+)*"),
      PROPERTIES);

  private static final RowNormalizer ROW = RowNormalizer.builder()
      .trueFalse("auto_resume")
      .integers("min_nodes", "max_nodes", "auto_suspend_secs", "num_services", "num_jobs", "active_nodes", "idle_nodes")
      .emptyToNull("comment")
      .build();

  public ComputePoolTranslator(NormalizedRequest request, StatementExecutor executor) {
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
    CreateMode mode = request.flag("ifNotExists") ? CreateMode.IF_NOT_EXISTS : createMode();
    if (mode == CreateMode.OR_REPLACE) throw new BadRequestException("createMode orReplace is not supported for compute pools");
    StringBuilder sql = new StringBuilder(Statements.create(mode, "COMPUTE POOL")).append(name).append(' ');
    append(sql, "min_nodes", body().get("min_nodes"));
    append(sql, "max_nodes", body().get("max_nodes"));
    if (body().get("instance_family") != null) {
      sql.append(Statements.assignment("instance_family", SqlLiterals.singleQuote(body().get("instance_family"))));
    }
    append(sql, "auto_resume", body().get("auto_resume"));
    append(sql, "auto_suspend_secs", body().get("auto_suspend_secs"));
    if (body().get("comment") != null) sql.append(Statements.assignment("comment", PROPERTIES.render("comment", body().get("comment"))));
    return run(sql.toString());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    try {
      return DescribeResult.found(describePool(name));
    } catch (NotFoundException e) {
      return DescribeResult.notFound();
    }
  }

  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, body(), current);
    PropertyDiff.rejectViolations(outcomes, kind());
    String alter = "ALTER COMPUTE POOL " + requireDesiredName();
    return ReconciliationPlan.builder()
        .unset(alter, Plans.unsets(outcomes), ", ")
        .set(alter, Plans.assignments(PROPERTIES, outcomes), " ")
        .build();
  }

  @Override
  protected HandlerResult list() {
    String show = "SHOW COMPUTE POOLS " + ShowClauses.like(request) + ShowClauses.startsWith(request)
        + ShowClauses.limit(request) + (request.hasQueryParam(ShowClauses.SHOW_LIMIT) ? ShowClauses.from(request) : "");
    return HandlerResult.list(show, ROW.normalizeAll(executor.execute(show)));
  }

  @Override
  protected HandlerResult fetch() {
    return HandlerResult.single("DESC COMPUTE POOL " + path.name(), describePool(path.name()));
  }

  @Override
  protected HandlerResult action(String action) {
    String target = "ALTER COMPUTE POOL " + path.name();
    return switch (action) {
      case "resume" -> run(target + " RESUME");
      case "suspend" -> run(target + " SUSPEND");
      case "stopallservices" -> run(target + " STOP ALL");
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP COMPUTE POOL " + Statements.ifExists(request) + path.name());
  }

  private Map<String, Object> describePool(String name) {
    List<Map<String, Object>> rows = executor.execute("DESC COMPUTE POOL " + name);
    if (rows.isEmpty()) throw new NotFoundException("Compute pool " + name + " does not exist.");
    return ROW.normalize(rows.get(0));
  }

  private static void append(StringBuilder sql, String key, Object value) {
    if (value != null) sql.append(Statements.assignment(key, SqlLiterals.render(value)));
  }
}
