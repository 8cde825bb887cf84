package io.intellixity.sqlbridge.resources;

import io.intellixity.sqlbridge.error.RestException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.exec.StatementResults;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Test executor: records every statement and answers from canned rows keyed by statement prefix
 * (longest prefix wins).\n
 * Unanswered SHOW / DESC / SELECT / CALL statements return no rows, anything else the success row.
 */
public final class RecordingExecutor implements StatementExecutor {
  private final List<String> executed = new ArrayList<>();
  private final Map<String, List<Map<String, Object>>> answers = new LinkedHashMap<>();
  private final Map<String, RestException> failures = new LinkedHashMap<>();

  public RecordingExecutor answer(String prefix, List<Map<String, Object>> rows) {
    answers.put(prefix, rows);
    return this;
  }

  public RecordingExecutor answer(String prefix, Map<String, Object> row) {
    return answer(prefix, List.of(row));
  }

  public RecordingExecutor fail(String prefix, RestException e) {
    failures.put(prefix, e);
    return this;
  }

  public List<String> executed() { return executed; }

  public String last() { return executed.isEmpty() ? null : executed.get(executed.size() - 1); }

  @Override
  public List<Map<String, Object>> execute(String sql) {
    executed.add(sql);
    String failure = longestPrefix(failures.keySet(), sql);
    if (failure != null) throw failures.get(failure);
    String answer = longestPrefix(answers.keySet(), sql);
    List<Map<String, Object>> out = new ArrayList<>();
    if (answer != null) {
      for (Map<String, Object> r : answers.get(answer)) out.add(new LinkedHashMap<>(r));
      return out;
    }
    if (isQuery(sql)) return out;
    out.add(StatementResults.success());
    return out;
  }

  @Override
  public List<List<Map<String, Object>>> executeMany(String sql) {
    List<List<Map<String, Object>>> out = new ArrayList<>();
    for (String s : sql.split(";")) {
      if (!s.isBlank()) out.add(execute(s.trim()));
    }
    return out;
  }

  /** Ordered key/value pairs; values may be null. */
  public static Map<String, Object> row(Object... kv) {
    if (kv.length % 2 != 0) throw new IllegalArgumentException("odd key/value count " + Arrays.toString(kv));
    Map<String, Object> r = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) r.put((String) kv[i], kv[i + 1]);
    return r;
  }

  private static boolean isQuery(String sql) {
    String s = sql.trim().toUpperCase(Locale.ROOT);
    return s.startsWith("SHOW ") || s.startsWith("DESC ") || s.startsWith("SELECT ") || s.startsWith("CALL ");
  }

  private static String longestPrefix(Iterable<String> prefixes, String sql) {
    String best = null;
    for (String p : prefixes) {
      if (sql.startsWith(p) && (best == null || p.length() > best.length())) best = p;
    }
    return best;
  }
}
