package io.intellixity.sqlbridge.resource;

import io.intellixity.sqlbridge.reconcile.PropertyTable;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Static description of a resource kind.\n
 *
 * {@code segmentRoles} names every path position, e.g. ["api","v2","databases","{database}",
 * "schemas","{schema}","tasks","{name}","{sub}"]. Placeholder roles are wrapped in braces.\n
 * {@code urlTemplate} must match the whole path (custom action suffix included).
 */
public record ResourceDescriptor(String kind,
                                 String collection,
                                 List<String> segmentRoles,
                                 Pattern urlTemplate,
                                 PropertyTable properties) {
  public static final String NAME = "{name}";
  public static final String DATABASE = "{database}";
  public static final String SCHEMA = "{schema}";
  public static final String SUB = "{sub}";

  public ResourceDescriptor {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(collection, "collection");
    segmentRoles = List.copyOf(segmentRoles);
    Objects.requireNonNull(urlTemplate, "urlTemplate");
    Objects.requireNonNull(properties, "properties");
    if (!segmentRoles.contains(collection)) throw new IllegalArgumentException("collection not in roles: " + collection);
  }

  public int indexOf(String role) { return segmentRoles.indexOf(role); }

  public int collectionIndex() { return segmentRoles.indexOf(collection); }

  public boolean matches(String path) { return urlTemplate.matcher(path).matches(); }
}
