package io.intellixity.sqlbridge.spi.translate;

import io.intellixity.sqlbridge.resource.HandlerResult;

/** One request against one resource kind. Instances are built per request and never shared. */
public interface ResourceTranslator {
  HandlerResult execute();
}
