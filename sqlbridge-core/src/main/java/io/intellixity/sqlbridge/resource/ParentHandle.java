package io.intellixity.sqlbridge.resource;

import io.intellixity.sqlbridge.sql.Identifiers;

import java.util.ArrayList;
import java.util.List;

/** Normalized container of a schema-scoped or database-scoped resource. Either part may be null. */
public record ParentHandle(String database, String schema) {
  public static ParentHandle account() { return new ParentHandle(null, null); }

  public static ParentHandle database(String database) { return new ParentHandle(database, null); }

  public static ParentHandle schema(String database, String schema) { return new ParentHandle(database, schema); }

  /** "DB.SCH"; both parts must be set. */
  public String schemaRef() {
    if (database == null || schema == null) throw new IllegalStateException("not schema-scoped");
    return database + "." + schema;
  }

  public String qualify(String name) {
    List<String> parts = new ArrayList<>(3);
    if (database != null) parts.add(database);
    if (schema != null) parts.add(schema);
    parts.add(name);
    return Identifiers.qualify(parts.toArray(new String[0]));
  }
}
