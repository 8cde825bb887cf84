package io.intellixity.sqlbridge.reconcile;

import java.util.Map;

/** Computes the statements needed to reach the desired state from {@code current}. */
public interface Reconcilable {
  ReconciliationPlan plan(Map<String, Object> current);
}
