package io.intellixity.sqlbridge.spi.translate;

import java.util.List;

/** Discovers translators through {@code META-INF/sqlbridge.factories}. */
public interface TranslatorProvider {
  /** Providers with a lower order are matched first. */
  int order();

  /** Registrations in matching order: more specific templates before broader ones. */
  List<TranslatorRegistration> translators();
}
