package io.intellixity.sqlbridge.spi.route;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.request.NormalizedRequest;
import io.intellixity.sqlbridge.spi.translate.ResourceTranslator;
import io.intellixity.sqlbridge.spi.translate.TranslatorRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** First registration whose URL template matches the request path wins. */
public final class ResourceRouter {
  private static final Logger log = LoggerFactory.getLogger(ResourceRouter.class);

  private final DiscoveredTranslatorRegistry registry;

  public ResourceRouter(DiscoveredTranslatorRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public TranslatorRegistration route(String path) {
    if (path != null && !path.isEmpty()) {
      for (TranslatorRegistration r : registry.registrations()) {
        if (r.descriptor().matches(path)) return r;
      }
    }
    throw new BadRequestException("Invalid URL");
  }

  public ResourceTranslator translatorFor(NormalizedRequest request, StatementExecutor executor) {
    TranslatorRegistration r = route(request.rawPath());
    log.debug("sqlbridge.route kind={} method={} path={}", r.descriptor().kind(), request.method(), request.rawPath());
    return r.factory().create(request, executor);
  }
}
