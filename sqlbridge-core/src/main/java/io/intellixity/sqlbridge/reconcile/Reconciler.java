package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.error.RestException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.exec.StatementResults;
import io.intellixity.sqlbridge.resource.Creatable;
import io.intellixity.sqlbridge.resource.Describable;
import io.intellixity.sqlbridge.resource.DescribeResult;
import io.intellixity.sqlbridge.resource.HandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Create-or-alter driver.\n
 *
 * describe -> absent: create\n
 * describe -> present: plan, then run the plan statements one by one.\n
 * The first failing statement aborts the rest; earlier statements stay applied.
 */
public final class Reconciler {
  private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

  private Reconciler() {}

  public static <T extends Describable & Creatable & Reconcilable> HandlerResult createOrAlter(
      String resource, T target, StatementExecutor executor) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(executor, "executor");

    DescribeResult current = target.describe();
    if (!current.found()) {
      log.debug("sqlbridge.reconcile resource={} action=create", resource);
      return target.create();
    }

    ReconciliationPlan plan = target.plan(current.row());
    log.debug("sqlbridge.reconcile resource={} action=alter statements={}", resource, plan.size());
    if (plan.isEmpty()) return HandlerResult.of(List.of(), StatementResults.success());

    int executed = 0;
    try {
      for (String sql : plan.statements()) {
        executor.execute(sql);
        executed++;
      }
    } catch (RestException e) {
      log.warn("sqlbridge.reconcile_aborted resource={} executed={} planned={} status={}",
          resource, executed, plan.size(), e.statusCode());
      throw e;
    }
    return HandlerResult.of(plan.statements(), StatementResults.success());
  }
}
