package io.intellixity.sqlbridge.resources.table;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.error.NotFoundException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.mapping.Coercions;
import io.intellixity.sqlbridge.mapping.RowNormalizer;
import io.intellixity.sqlbridge.reconcile.DiffOutcome;
import io.intellixity.sqlbridge.reconcile.KeyedSetDiff;
import io.intellixity.sqlbridge.reconcile.OrderedListDiff;
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
import io.intellixity.sqlbridge.resources.support.PointOfTime;
import io.intellixity.sqlbridge.resources.support.ShowClauses;
import io.intellixity.sqlbridge.resources.support.Statements;
import io.intellixity.sqlbridge.sql.DataTypes;
import io.intellixity.sqlbridge.sql.Identifiers;
import io.intellixity.sqlbridge.sql.SqlLiterals;
import io.intellixity.sqlbridge.spi.translate.AbstractResourceTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Tables of a schema: /api/v2/databases/{database}/schemas/{schema}/tables[/{name}[:action]]\n
 *
 * create-or-alter covers table options, columns (append or modify, never drop), primary and unique
 * keys, and the clustering key. Foreign keys are created but never reconciled.
 */
public final class TableTranslator extends AbstractResourceTranslator
    implements Describable, Creatable, Reconcilable {
  private static final Logger log = LoggerFactory.getLogger(TableTranslator.class);

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name")
      .optional("kind", "columns", "constraints", "cluster_by", "enable_schema_evolution",
          "data_retention_time_in_days", "max_data_extension_time_in_days", "change_tracking",
          "default_ddl_collation", "comment")
      .immutable("kind")
      .unsettable("enable_schema_evolution", "data_retention_time_in_days", "max_data_extension_time_in_days",
          "change_tracking", "default_ddl_collation", "comment")
      .quoted("default_ddl_collation", "comment")
      .caseInsensitive("kind", "default_ddl_collation")
      .special("name", "columns", "constraints", "cluster_by")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "table", "tables",
      List.of("api", "v2", "databases", ResourceDescriptor.DATABASE, "schemas", ResourceDescriptor.SCHEMA,
          "tables", ResourceDescriptor.NAME),
      Pattern.compile("/api/v2/databases/[^/]+/schemas/[^/]+/tables(/[^/]+)*"),
      PROPERTIES);

  /** Options rendered in CREATE, in clause order. */
  private static final List<String> OPTIONS = List.of("enable_schema_evolution", "data_retention_time_in_days",
      "max_data_extension_time_in_days", "change_tracking", "default_ddl_collation", "comment");

  private static final RowNormalizer SHOW_ROW = RowNormalizer.builder()
      .onOff("search_optimization", "change_tracking", "automatic_clustering")
      .yesNo("enable_schema_evolution")
      .convert(TableTranslator::clusterBy, "cluster_by")
      .emptyToNull("comment")
      .drop("retention_time", "is_external", "is_event", "is_hybrid")
      .build();

  public TableTranslator(NormalizedRequest request, StatementExecutor executor) {
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
    String tableBody = TableDdl.body(body(), createOptions());
    if (tableBody.isEmpty()) throw new BadRequestException("Columns must be provided to create a table");
    return run(prefix(name) + tableBody + copyGrants());
  }

  @Override
  public DescribeResult describe() {
    String name = requireDesiredName();
    Map<String, Object> row = findShowRow(name);
    if (row == null) return DescribeResult.notFound();
    return DescribeResult.found(deep(name, row));
  }

  @Override
  public ReconciliationPlan plan(Map<String, Object> current) {
    Map<String, Object> desired = new LinkedHashMap<>(body());
    desired.put("kind", tableKind(desired.get("kind")));
    if (desired.get("default_ddl_collation") instanceof String s) desired.put("default_ddl_collation", s.toUpperCase(Locale.ROOT));
    Map<String, Object> actual = new LinkedHashMap<>(current);
    actual.put("kind", tableKind(current.get("kind")));
    // reported as false when never set
    for (String flag : List.of("enable_schema_evolution", "change_tracking")) {
      if (Boolean.FALSE.equals(actual.get(flag))) actual.remove(flag);
    }

    List<DiffOutcome> outcomes = PropertyDiff.diff(PROPERTIES, desired, actual);
    for (DiffOutcome o : outcomes) {
      if (o.property().equals("kind") && o.is(DiffOutcome.Kind.IMMUTABLE_VIOLATION)) {
        throw new BadRequestException("Table kind must match. Original kind is " + o.current()
            + " while new kind is " + o.desired());
      }
    }
    PropertyDiff.rejectViolations(outcomes, kind());

    List<Map<String, Object>> desiredColumns = BodyValues.objectList(desired, "columns");
    if (desiredColumns.isEmpty()) throw new BadRequestException("Columns must be provided for create_or_update");

    String alter = "ALTER TABLE " + path.parent().qualify(requireDesiredName());
    ReconciliationPlan.Builder plan = ReconciliationPlan.builder()
        .unset(alter, Plans.unsets(outcomes), ", ")
        .set(alter, Plans.assignments(PROPERTIES, outcomes), " ");

    OrderedListDiff.Result<Map<String, Object>> columns = OrderedListDiff.diff(
        BodyValues.objectList(actual, "columns"), desiredColumns,
        c -> Identifiers.normalize(String.valueOf(c.get("name"))), TableTranslator::columnClauses, "column");
    for (OrderedListDiff.Modification<Map<String, Object>> m : columns.modifications()) {
      plan.statement(alter + " MODIFY " + String.join(", ", m.clauses()));
    }
    for (Map<String, Object> added : columns.appended()) plan.statement(alter + " ADD COLUMN " + TableDdl.column(added));

    planConstraints(plan, alter, actual, desired);

    List<String> clusterBy = BodyValues.stringList(desired, "cluster_by");
    List<String> currentClusterBy = BodyValues.stringList(actual, "cluster_by");
    if (!Values.equivalent(upper(clusterBy), upper(currentClusterBy))) {
      plan.statement(clusterBy.isEmpty()
          ? alter + " DROP CLUSTERING KEY"
          : alter + " CLUSTER BY (" + String.join(", ", clusterBy) + ")");
    }
    return plan.build();
  }

  @Override
  protected HandlerResult list() {
    boolean deep = request.flag("deep");
    String show = "SHOW " + (deep ? "" : "TERSE ") + (request.flag("history") ? "HISTORY " : "") + "TABLES "
        + ShowClauses.like(request) + "IN SCHEMA " + path.parent().schemaRef() + " "
        + ShowClauses.startsWith(request) + ShowClauses.limit(request)
        + (request.hasQueryParam(ShowClauses.SHOW_LIMIT) ? ShowClauses.from(request) : "");
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> row : executor.execute(show)) {
      if (!isPlainTable(row)) continue;
      String name = Identifiers.fromStored(String.valueOf(row.get("name")));
      out.add(deep ? deep(name, row) : withParameters(name, row));
    }
    return HandlerResult.list(show, out);
  }

  @Override
  protected HandlerResult fetch() {
    Map<String, Object> row = findShowRow(path.name());
    if (row == null) throw new NotFoundException("Table " + path.name() + " doesn't exist.");
    return HandlerResult.single(showLike(path.name()), deep(path.name(), row));
  }

  @Override
  protected HandlerResult action(String action) {
    String table = path.qualifiedName();
    return switch (action) {
      case "clone" -> cloneTable();
      case "create_like" -> {
        String newName = request.queryParam("newTableName");
        if (newName == null || newName.isBlank()) throw new BadRequestException("newTableName is required for create_like");
        yield run(prefix(Identifiers.normalize(Identifiers.lastPart(newName))) + "LIKE " + table + copyGrants());
      }
      case "using_template" -> run(prefix(path.name()) + "USING TEMPLATE (" + requireQuery() + ")");
      case "as_select" -> run(prefix(path.name()) + TableDdl.body(body(), Map.of()) + copyGrants() + "AS " + requireQuery());
      case "undrop", "undelete" -> run("UNDROP TABLE " + table);
      case "suspend_recluster" -> run("ALTER TABLE " + table + " SUSPEND RECLUSTER");
      case "resume_recluster" -> run("ALTER TABLE " + table + " RESUME RECLUSTER");
      case "swapwith" -> {
        String target = request.queryParam("targetTableName");
        if (target == null || target.isBlank()) throw new BadRequestException("targetTableName is required for swapwith");
        yield run("ALTER TABLE " + table + " SWAP WITH " + qualify(target));
      }
      default -> super.action(action);
    };
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP TABLE " + Statements.ifExists(request) + path.qualifiedName());
  }

  private HandlerResult cloneTable() {
    if (body().get("name") == null) throw new BadRequestException("Name is a required field for cloning a table");
    String target = Identifiers.normalize(Identifiers.lastPart(String.valueOf(body().get("name"))));
    StringBuilder sql = new StringBuilder(prefix(target))
        .append("CLONE ").append(path.qualifiedName()).append(' ')
        .append(PointOfTime.clause(body().get("point_of_time")));
    for (var e : createOptions().entrySet()) sql.append(Statements.assignment(e.getKey(), e.getValue()));
    return run(sql.toString() + copyGrants());
  }

  /** {@code CREATE [OR REPLACE ][KIND ]TABLE DB.SCH.NAME [IF NOT EXISTS ]} */
  private String prefix(String name) {
    String kind = tableKind(body().get("kind"));
    String modifier = kind.equals("TABLE") ? null : kind;
    return Statements.create(createMode(), modifier, "TABLE") + path.parent().qualify(name) + " ";
  }

  private Map<String, String> createOptions() {
    Map<String, String> out = new LinkedHashMap<>();
    for (String key : OPTIONS) {
      Object v = body().get(key);
      if (v == null || (v instanceof String s && s.isEmpty())) continue;
      out.put(key, PROPERTIES.render(key, v));
    }
    return out;
  }

  private String copyGrants() {
    return request.flag("copy_grants") ? "COPY GRANTS " : "";
  }

  private String requireQuery() {
    String query = request.queryParam("query");
    if (query == null || query.isBlank()) throw new BadRequestException("query is a required query parameter");
    return query;
  }

  private String qualify(String name) {
    List<String> parts = Identifiers.parts(name);
    List<String> normalized = new ArrayList<>(parts.size());
    for (String p : parts) normalized.add(Identifiers.normalize(p));
    return switch (normalized.size()) {
      case 1 -> path.parent().qualify(normalized.get(0));
      case 2 -> Identifiers.qualify(path.parent().database(), normalized.get(0), normalized.get(1));
      case 3 -> Identifiers.qualify(normalized.toArray(new String[0]));
      default -> throw new BadRequestException("Table name " + name + " has a wrong format.");
    };
  }

  private void planConstraints(ReconciliationPlan.Builder plan, String alter,
                               Map<String, Object> current, Map<String, Object> desired) {
    List<Map<String, Object>> wanted = new ArrayList<>();
    int primaryKeys = 0;
    for (Map<String, Object> c : TableDdl.allConstraints(desired)) {
      String type = TableDdl.constraintType(c);
      if (type.equals(TableDdl.PRIMARY_KEY)) primaryKeys++;
      if (type.equals(TableDdl.PRIMARY_KEY) || type.equals(TableDdl.UNIQUE)) wanted.add(c);
    }
    if (primaryKeys > 1) throw new BadRequestException("There should be only one primary key defined.");

    KeyedSetDiff.Result<Map<String, Object>> diff = KeyedSetDiff.diff(
        BodyValues.objectList(current, "constraints"), wanted,
        TableTranslator::constraintKey, TableTranslator::constraintName, TableDdl::isSystemName);
    for (Map<String, Object> dropped : diff.dropped()) {
      plan.statement(alter + " DROP CONSTRAINT " + constraintName(dropped));
    }
    for (KeyedSetDiff.Rename<Map<String, Object>> r : diff.renamed()) {
      plan.statement(alter + " RENAME CONSTRAINT " + r.from() + " TO " + r.to());
    }
    for (Map<String, Object> added : diff.added()) plan.statement(alter + " ADD " + TableDdl.constraint(added));
  }

  /** MODIFY clauses turning {@code current} into {@code desired}; identity columns can't change. */
  static List<String> columnClauses(Map<String, Object> current, Map<String, Object> desired) {
    String column = "COLUMN " + Identifiers.normalize(String.valueOf(desired.get("name")));
    List<String> clauses = new ArrayList<>();
    Object datatype = desired.get("datatype");
    if (datatype != null && !DataTypes.equivalent(String.valueOf(datatype), String.valueOf(current.get("datatype")))) {
      clauses.add(column + " SET DATA TYPE " + DataTypes.normalize(String.valueOf(datatype)));
    }
    Object dflt = desired.get("default");
    if (!Values.equivalent(dflt, current.get("default"))) {
      clauses.add(dflt == null ? column + " DROP DEFAULT" : column + " SET DEFAULT " + dflt);
    }
    boolean nullable = !Boolean.FALSE.equals(desired.get("nullable"));
    boolean currentNullable = !Boolean.FALSE.equals(current.get("nullable"));
    if (nullable != currentNullable) clauses.add(column + (nullable ? " DROP NOT NULL" : " SET NOT NULL"));
    Object comment = Coercions.emptyToNull(desired.get("comment"));
    if (!Objects.equals(comment, Coercions.emptyToNull(current.get("comment")))) {
      clauses.add(comment == null ? column + " UNSET COMMENT" : column + " COMMENT " + SqlLiterals.singleQuote(comment));
    }
    Object collate = desired.get("collate");
    if (collate != null && !String.valueOf(collate).equalsIgnoreCase(String.valueOf(current.get("collate")))) {
      throw new BadRequestException("Can't update a column collate.");
    }
    if (Boolean.TRUE.equals(desired.get("autoincrement")) != Boolean.TRUE.equals(current.get("autoincrement"))) {
      throw new BadRequestException("'autoincrement' of Column " + desired.get("name") + " can't be updated.");
    }
    for (String prop : List.of("autoincrement_start", "autoincrement_increment")) {
      if (!Values.equivalent(desired.get(prop), current.get(prop))) {
        throw new BadRequestException("'" + prop + "' of Column " + desired.get("name") + " can't be updated.");
      }
    }
    return clauses;
  }

  private static List<String> constraintKey(Map<String, Object> c) {
    List<String> key = new ArrayList<>();
    key.add(TableDdl.constraintType(c));
    for (String col : BodyValues.stringList(c, "column_names")) key.add(Identifiers.normalize(col));
    return key;
  }

  private static String constraintName(Map<String, Object> c) {
    Object name = c.get("name");
    return name == null || String.valueOf(name).isEmpty() ? null : Identifiers.normalize(String.valueOf(name));
  }

  private static String tableKind(Object raw) {
    if (raw == null || String.valueOf(raw).isBlank()) return "TABLE";
    String k = String.valueOf(raw).trim().toUpperCase(Locale.ROOT);
    return k.equals("TEMP") ? "TEMPORARY" : k;
  }

  private static List<String> upper(List<String> names) {
    List<String> out = new ArrayList<>(names.size());
    for (String n : names) out.add(n.trim().toUpperCase(Locale.ROOT));
    return out;
  }

  /** "LINEAR(A, B)" -> [A, B] */
  static Object clusterBy(Object raw) {
    if (raw == null) return null;
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return null;
    if (s.toUpperCase(Locale.ROOT).startsWith("LINEAR(") && s.endsWith(")")) s = s.substring(7, s.length() - 1);
    List<String> out = new ArrayList<>();
    for (String part : s.split(",")) if (!part.isBlank()) out.add(part.trim());
    return out;
  }

  private static boolean isPlainTable(Map<String, Object> row) {
    Object dropped = row.get("dropped_on");
    if (dropped != null && !String.valueOf(dropped).isEmpty()) return false;
    for (String marker : List.of("is_event", "is_external", "is_hybrid")) {
      if ("Y".equalsIgnoreCase(String.valueOf(row.get(marker)))) return false;
    }
    return true;
  }

  private Map<String, Object> withParameters(String name, Map<String, Object> row) {
    Map<String, Object> t = SHOW_ROW.normalize(row);
    t.put("data_retention_time_in_days", null);
    t.put("max_data_extension_time_in_days", null);
    t.put("default_ddl_collation", null);
    for (Map<String, Object> p : executor.execute("SHOW PARAMETERS IN TABLE " + path.parent().qualify(name))) {
      if (!"TABLE".equals(p.get("level"))) continue;
      String key = String.valueOf(p.get("key")).toLowerCase(Locale.ROOT);
      if (t.containsKey(key)) t.put(key, Coercions.parameterValue(String.valueOf(p.get("type")), p.get("value")));
    }
    return t;
  }

  private Map<String, Object> deep(String name, Map<String, Object> row) {
    Map<String, Object> t = withParameters(name, row);
    t.put("columns", columns(name));
    t.put("constraints", constraints(name));
    return t;
  }

  private List<Map<String, Object>> columns(String table) {
    String db = path.parent().database();
    String sql = "SELECT COLUMN_NAME, DATA_TYPE, IS_NULLABLE, COLLATION_NAME, COLUMN_DEFAULT, IS_IDENTITY, "
        + "IDENTITY_START, IDENTITY_INCREMENT, COMMENT FROM " + db + ".INFORMATION_SCHEMA.COLUMNS"
        + " WHERE TABLE_CATALOG = " + literal(db) + " AND TABLE_SCHEMA = " + literal(path.parent().schema())
        + " AND TABLE_NAME = " + literal(table) + " ORDER BY ORDINAL_POSITION";
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> raw : executor.execute(sql)) {
      Map<String, Object> r = Coercions.lowerKeys(raw);
      Map<String, Object> c = new LinkedHashMap<>();
      c.put("name", r.get("column_name"));
      c.put("datatype", r.get("data_type"));
      c.put("nullable", "YES".equals(r.get("is_nullable")));
      c.put("collate", r.get("collation_name"));
      c.put("default", r.get("column_default"));
      c.put("autoincrement", "YES".equals(r.get("is_identity")));
      c.put("autoincrement_start", r.get("identity_start"));
      c.put("autoincrement_increment", r.get("identity_increment"));
      c.put("comment", r.get("comment"));
      out.add(c);
    }
    return out;
  }

  private List<Map<String, Object>> constraints(String table) {
    String db = path.parent().database();
    String qualified = path.parent().qualify(table);
    List<Map<String, Object>> declared = executor.execute("SELECT CONSTRAINT_NAME, CONSTRAINT_TYPE FROM " + db
        + ".INFORMATION_SCHEMA.TABLE_CONSTRAINTS WHERE CONSTRAINT_CATALOG = " + literal(db)
        + " AND CONSTRAINT_SCHEMA = " + literal(path.parent().schema()) + " AND TABLE_NAME = " + literal(table)
        + " ORDER BY CONSTRAINT_NAME");
    if (declared.isEmpty()) return new ArrayList<>();
    List<Map<String, Object>> primaryKeys = executor.execute("SHOW PRIMARY KEYS IN TABLE " + qualified);
    List<Map<String, Object>> uniqueKeys = executor.execute("SHOW UNIQUE KEYS IN TABLE " + qualified);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> raw : declared) {
      Map<String, Object> r = Coercions.lowerKeys(raw);
      String type = String.valueOf(r.get("constraint_type"));
      String name = String.valueOf(r.get("constraint_name"));
      List<Map<String, Object>> keyRows = switch (type) {
        case TableDdl.PRIMARY_KEY -> primaryKeys;
        case TableDdl.UNIQUE -> uniqueKeys;
        default -> null;
      };
      if (keyRows == null) {
        log.debug("sqlbridge.table_constraint_skipped table={} constraint={} type={}", qualified, name, type);
        continue;
      }
      Map<String, Object> c = new LinkedHashMap<>();
      c.put("name", name);
      c.put("column_names", keyColumns(keyRows, name));
      c.put("constraint_type", type);
      out.add(c);
    }
    return out;
  }

  private static List<String> keyColumns(List<Map<String, Object>> keyRows, String constraintName) {
    List<Map<String, Object>> mine = new ArrayList<>();
    for (Map<String, Object> k : keyRows) if (constraintName.equals(k.get("constraint_name"))) mine.add(k);
    mine.sort(Comparator.comparingInt(k -> Coercions.toInteger(k.get("key_sequence"))));
    List<String> out = new ArrayList<>(mine.size());
    for (Map<String, Object> k : mine) out.add(String.valueOf(k.get("column_name")));
    return out;
  }

  private static String literal(String identifier) {
    return SqlLiterals.singleQuote(Identifiers.unquote(identifier));
  }

  private String showLike(String name) {
    return "SHOW TABLES LIKE " + SqlLiterals.pattern(Identifiers.unquote(name)) + " IN SCHEMA " + path.parent().schemaRef();
  }

  private Map<String, Object> findShowRow(String name) {
    for (Map<String, Object> row : executor.execute(showLike(name))) {
      Object rowName = row.get("name");
      if (rowName != null && Identifiers.sameName(String.valueOf(rowName), name)) return row;
    }
    return null;
  }
}
