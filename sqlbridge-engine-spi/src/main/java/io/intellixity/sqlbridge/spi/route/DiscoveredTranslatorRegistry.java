package io.intellixity.sqlbridge.spi.route;

import io.intellixity.sqlbridge.spi.translate.TranslatorProvider;
import io.intellixity.sqlbridge.spi.translate.TranslatorRegistration;
import io.intellixity.sqlbridge.util.BridgeFactoriesLoader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Translator registry built via discovery (META-INF/sqlbridge.factories).\n
 *
 * Resolution order:\n
 * - Providers sorted by {@link TranslatorProvider#order()}, ties keep discovery order.\n
 * - Within a provider, registration order is preserved.\n
 */
public final class DiscoveredTranslatorRegistry {
  private final List<TranslatorRegistration> ordered;

  public DiscoveredTranslatorRegistry() {
    this(BridgeFactoriesLoader.load(TranslatorProvider.class));
  }

  public DiscoveredTranslatorRegistry(List<TranslatorProvider> providers) {
    List<TranslatorProvider> sorted = new ArrayList<>();
    for (TranslatorProvider p : providers) if (p != null) sorted.add(p);
    sorted.sort(Comparator.comparingInt(TranslatorProvider::order));

    List<TranslatorRegistration> out = new ArrayList<>();
    for (TranslatorProvider p : sorted) {
      List<TranslatorRegistration> rs = p.translators();
      if (rs != null) out.addAll(rs);
    }
    this.ordered = List.copyOf(out);
  }

  public List<TranslatorRegistration> registrations() { return ordered; }
}
