package io.intellixity.sqlbridge.spi.translate;

import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.request.NormalizedRequest;

@FunctionalInterface
public interface TranslatorFactory {
  ResourceTranslator create(NormalizedRequest request, StatementExecutor executor);
}
