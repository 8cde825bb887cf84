package io.intellixity.sqlbridge.resource;

public interface Creatable {
  HandlerResult create();
}
