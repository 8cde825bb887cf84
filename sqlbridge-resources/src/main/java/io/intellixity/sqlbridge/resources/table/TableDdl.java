package io.intellixity.sqlbridge.resources.table;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.resources.support.BodyValues;
import io.intellixity.sqlbridge.sql.Identifiers;
import io.intellixity.sqlbridge.sql.SqlLiterals;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Column, constraint and table-body clauses. */
final class TableDdl {
  static final String PRIMARY_KEY = "PRIMARY KEY";
  static final String UNIQUE = "UNIQUE";
  static final String FOREIGN_KEY = "FOREIGN KEY";

  private static final Pattern SYSTEM_NAME =
      Pattern.compile("\"?SYS_CONSTRAINT_[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\"?");

  private TableDdl() {}

  /** Unnamed, or named by the backend when the user gave no name. */
  static boolean isSystemName(String name) {
    return name == null || name.isEmpty() || SYSTEM_NAME.matcher(name).matches();
  }

  static String column(Map<String, Object> c) {
    Object name = c.get("name");
    Object datatype = c.get("datatype");
    if (name == null || datatype == null) throw new BadRequestException("Column name and datatype are required");
    StringBuilder sb = new StringBuilder(Identifiers.normalize(String.valueOf(name))).append(' ').append(datatype);
    if (Boolean.FALSE.equals(c.get("nullable"))) sb.append(" NOT NULL");
    if (c.get("collate") != null) sb.append(" COLLATE ").append(SqlLiterals.singleQuote(c.get("collate")));
    if (c.get("default") != null) sb.append(" DEFAULT ").append(c.get("default"));
    if (Boolean.TRUE.equals(c.get("autoincrement"))) {
      sb.append(" AUTOINCREMENT");
      if (c.get("autoincrement_start") != null) sb.append(" START ").append(c.get("autoincrement_start"));
      if (c.get("autoincrement_increment") != null) sb.append(" INCREMENT ").append(c.get("autoincrement_increment"));
    }
    Object comment = c.get("comment");
    if (comment != null && !String.valueOf(comment).isEmpty()) sb.append(" COMMENT ").append(SqlLiterals.singleQuote(comment));
    return sb.toString();
  }

  static String constraint(Map<String, Object> c) {
    String type = constraintType(c);
    Object name = c.get("name");
    String prefix = name == null || String.valueOf(name).isEmpty()
        ? "" : "CONSTRAINT " + Identifiers.normalize(String.valueOf(name)) + " ";
    String columns = columnList(BodyValues.stringList(c, "column_names"));
    return switch (type) {
      case PRIMARY_KEY -> prefix + "PRIMARY KEY (" + columns + ")";
      case UNIQUE -> prefix + "UNIQUE (" + columns + ")";
      case FOREIGN_KEY -> {
        Object referenced = c.get("referenced_table_name");
        if (referenced == null) throw new BadRequestException("referenced_table_name is required for a foreign key");
        List<String> refColumns = BodyValues.stringList(c, "referenced_column_names");
        yield prefix + "FOREIGN KEY (" + columns + ") REFERENCES " + referenced
            + (refColumns.isEmpty() ? "" : " (" + columnList(refColumns) + ")");
      }
      default -> throw new BadRequestException("Wrong constraint type '" + c.get("constraint_type") + "'");
    };
  }

  static String constraintType(Map<String, Object> c) {
    Object t = c.get("constraint_type");
    return t == null ? "" : String.valueOf(t).toUpperCase(Locale.ROOT);
  }

  static String columnList(List<String> names) {
    List<String> out = new ArrayList<>(names.size());
    for (String n : names) out.add(Identifiers.normalize(n));
    return String.join(", ", out);
  }

  /** Out-of-line constraints plus each column's inline ones (given their column). */
  static List<Map<String, Object>> allConstraints(Map<String, Object> table) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> column : BodyValues.objectList(table, "columns")) {
      for (Map<String, Object> inline : BodyValues.objectList(column, "constraints")) {
        Map<String, Object> c = new LinkedHashMap<>(inline);
        c.put("column_names", List.of(String.valueOf(column.get("name"))));
        out.add(c);
      }
    }
    out.addAll(BodyValues.objectList(table, "constraints"));
    return out;
  }

  /**
   * Column list and table options of CREATE TABLE, or an empty string when the body has no columns.
   */
  static String body(Map<String, Object> table, Map<String, String> options) {
    List<Map<String, Object>> columns = BodyValues.objectList(table, "columns");
    List<Map<String, Object>> constraints = allConstraints(table);
    if (columns.isEmpty() && constraints.isEmpty()) return "";
    List<String> elements = new ArrayList<>();
    for (Map<String, Object> c : columns) elements.add(column(c));
    for (Map<String, Object> c : constraints) elements.add(constraint(c));
    StringBuilder sb = new StringBuilder("(").append(String.join(", ", elements)).append(") ");
    List<String> clusterBy = BodyValues.stringList(table, "cluster_by");
    if (!clusterBy.isEmpty()) sb.append("CLUSTER BY (").append(String.join(", ", clusterBy)).append(") ");
    for (var e : options.entrySet()) {
      sb.append(e.getKey().toUpperCase(Locale.ROOT)).append(" = ").append(e.getValue()).append(' ');
    }
    return sb.toString();
  }
}
