package io.intellixity.sqlbridge.resources.support;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.sql.SqlLiterals;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Time-travel clause of a clone: {@code AT (TIMESTAMP => ...)} or {@code BEFORE (STATEMENT => ...)}.\n
 *
 * Input shape: {"reference": "at", "point_of_time_type": "offset", "offset": -60}
 */
public final class PointOfTime {
  private static final Set<String> REFERENCES = Set.of("AT", "BEFORE");
  private static final Set<String> TYPES = Set.of("TIMESTAMP", "OFFSET", "STATEMENT");

  private PointOfTime() {}

  /** Empty when {@code pot} is null, otherwise the clause followed by a space. */
  public static String clause(Object pot) {
    if (pot == null) return "";
    if (!(pot instanceof Map<?, ?> m)) throw new BadRequestException("point_of_time must be an object");
    String reference = upper(m.get("reference"));
    String type = upper(m.get("point_of_time_type"));
    if (!REFERENCES.contains(reference)) throw new BadRequestException("Unsupported point_of_time reference " + m.get("reference"));
    if (!TYPES.contains(type)) throw new BadRequestException("Unsupported point_of_time_type " + m.get("point_of_time_type"));
    Object value = m.get(type.toLowerCase(Locale.ROOT));
    if (value == null) throw new BadRequestException("point_of_time is missing its " + type.toLowerCase(Locale.ROOT) + " value");
    return reference + " (" + type + " => " + SqlLiterals.render(value) + ") ";
  }

  private static String upper(Object v) {
    return v == null ? "" : String.valueOf(v).toUpperCase(Locale.ROOT);
  }
}
