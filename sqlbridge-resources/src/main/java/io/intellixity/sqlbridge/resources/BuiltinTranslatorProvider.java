package io.intellixity.sqlbridge.resources;

import io.intellixity.sqlbridge.resources.computepool.ComputePoolTranslator;
import io.intellixity.sqlbridge.resources.database.DatabaseTranslator;
import io.intellixity.sqlbridge.resources.imagerepo.ImageRepositoryTranslator;
import io.intellixity.sqlbridge.resources.schema.SchemaTranslator;
import io.intellixity.sqlbridge.resources.service.ServiceTranslator;
import io.intellixity.sqlbridge.resources.table.TableTranslator;
import io.intellixity.sqlbridge.resources.task.TaskTranslator;
import io.intellixity.sqlbridge.resources.warehouse.WarehouseTranslator;
import io.intellixity.sqlbridge.spi.translate.TranslatorProvider;
import io.intellixity.sqlbridge.spi.translate.TranslatorRegistration;

import java.util.List;

/**
 * Built-in resource kinds, discovered via META-INF/sqlbridge.factories.\n
 *
 * Schema-scoped kinds come first: their paths also match the schema and database templates.
 */
public final class BuiltinTranslatorProvider implements TranslatorProvider {
  public static final int ORDER = 1000;

  @Override
  public int order() { return ORDER; }

  @Override
  public List<TranslatorRegistration> translators() {
    return List.of(
        new TranslatorRegistration(TaskTranslator.DESCRIPTOR, TaskTranslator::new),
        new TranslatorRegistration(ServiceTranslator.DESCRIPTOR, ServiceTranslator::new),
        new TranslatorRegistration(ImageRepositoryTranslator.DESCRIPTOR, ImageRepositoryTranslator::new),
        new TranslatorRegistration(TableTranslator.DESCRIPTOR, TableTranslator::new),
        new TranslatorRegistration(ComputePoolTranslator.DESCRIPTOR, ComputePoolTranslator::new),
        new TranslatorRegistration(WarehouseTranslator.DESCRIPTOR, WarehouseTranslator::new),
        new TranslatorRegistration(SchemaTranslator.DESCRIPTOR, SchemaTranslator::new),
        new TranslatorRegistration(DatabaseTranslator.DESCRIPTOR, DatabaseTranslator::new));
  }
}
