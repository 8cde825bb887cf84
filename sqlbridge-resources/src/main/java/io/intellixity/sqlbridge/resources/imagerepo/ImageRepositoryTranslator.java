package io.intellixity.sqlbridge.resources.imagerepo;

import io.intellixity.sqlbridge.error.NotFoundException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.reconcile.PropertyTable;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.resource.Creatable;
import io.intellixity.sqlbridge.resource.HandlerResult;
import io.intellixity.sqlbridge.resource.ResourceDescriptor;
import io.intellixity.sqlbridge.resources.support.ShowClauses;
import io.intellixity.sqlbridge.resources.support.Statements;
import io.intellixity.sqlbridge.sql.Identifiers;
import io.intellixity.sqlbridge.sql.SqlLiterals;
import io.intellixity.sqlbridge.spi.translate.AbstractResourceTranslator;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Image repositories of a schema: list, fetch, create and drop. PUT is rejected. */
public final class ImageRepositoryTranslator extends AbstractResourceTranslator implements Creatable {

  static final PropertyTable PROPERTIES = PropertyTable.builder()
      .required("name")
      .special("name")
      .build();

  public static final ResourceDescriptor DESCRIPTOR = new ResourceDescriptor(
      "image repository", "image-repositories",
      List.of("api", "v2", "databases", ResourceDescriptor.DATABASE, "schemas", ResourceDescriptor.SCHEMA,
          "image-repositories", ResourceDescriptor.NAME),
      Pattern.compile("/api/v2/databases/[^/]+/schemas/[^/]+/image-repositories(/[^/]+)*"),
      PROPERTIES);

  public ImageRepositoryTranslator(NormalizedRequest request, StatementExecutor executor) {
    super(DESCRIPTOR, request, executor);
  }

  @Override
  public HandlerResult create() {
    String name = requireDesiredName();
    return run(Statements.create(createMode(), "IMAGE REPOSITORY") + path.parent().qualify(name));
  }

  @Override
  protected HandlerResult list() {
    String sql = "SHOW IMAGE REPOSITORIES " + ShowClauses.like(request) + "IN SCHEMA " + path.parent().schemaRef();
    return HandlerResult.list(sql, executor.execute(sql));
  }

  @Override
  protected HandlerResult fetch() {
    String sql = "SHOW IMAGE REPOSITORIES LIKE " + SqlLiterals.pattern(Identifiers.unquote(path.name()))
        + " IN SCHEMA " + path.parent().schemaRef();
    List<Map<String, Object>> rows = executor.execute(sql);
    if (rows.isEmpty()) {
      throw new NotFoundException("Image repository " + path.qualifiedName() + " does not exist or not authorized.");
    }
    return HandlerResult.single(sql, rows.get(0));
  }

  @Override
  protected HandlerResult drop() {
    return run("DROP IMAGE REPOSITORY " + Statements.ifExists(request) + path.qualifiedName());
  }
}
