package io.intellixity.sqlbridge.jdbc;

import java.sql.*;
import java.util.*;

/**
 * Reads a ResultSet into raw rows keyed by lower-cased column label.\n
 *
 * Temporal values become java.time types, LOBs become strings; everything else is passed through.
 */
public final class JdbcRowAdapter {
  private final ResultSet rs;
  private String[] labels;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = Objects.requireNonNull(rs, "rs");
  }

  public List<Map<String, Object>> readAll() throws SQLException {
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) out.add(current());
    return out;
  }

  public Map<String, Object> current() throws SQLException {
    String[] ls = labels();
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < ls.length; i++) row.put(ls[i], convert(rs.getObject(i + 1)));
    return row;
  }

  private String[] labels() throws SQLException {
    if (labels == null) {
      ResultSetMetaData md = rs.getMetaData();
      labels = new String[md.getColumnCount()];
      for (int i = 1; i <= labels.length; i++) labels[i - 1] = md.getColumnLabel(i).toLowerCase(Locale.ROOT);
    }
    return labels;
  }

  static Object convert(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof Time t) return t.toLocalTime();
    if (v instanceof Clob c) return c.getSubString(1, (int) c.length());
    return v;
  }
}
