package io.intellixity.sqlbridge.spi.translate;

import io.intellixity.sqlbridge.resource.ResourceDescriptor;

import java.util.Objects;

public record TranslatorRegistration(ResourceDescriptor descriptor, TranslatorFactory factory) {
  public TranslatorRegistration {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(factory, "factory");
  }
}
