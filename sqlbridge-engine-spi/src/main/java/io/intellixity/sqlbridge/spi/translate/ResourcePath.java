package io.intellixity.sqlbridge.spi.translate;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.resource.ParentHandle;
import io.intellixity.sqlbridge.resource.ResourceDescriptor;
import io.intellixity.sqlbridge.sql.Identifiers;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Path metadata of one request, resolved against a {@link ResourceDescriptor}.\n
 *
 * {@code name} is normalized; {@code rawName} is the percent-decoded segment as sent.
 * {@code subResource} is the segment after the instance name ("logs", "replication"), or null.
 */
public record ResourcePath(ResourceDescriptor descriptor,
                           boolean collection,
                           String name,
                           String rawName,
                           ParentHandle parent,
                           String subResource) {

  public ResourcePath {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(parent, "parent");
  }

  public static ResourcePath parse(ResourceDescriptor descriptor, List<String> segments) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(segments, "segments");
    int ci = descriptor.collectionIndex();
    if (segments.size() < ci + 1 || segments.size() > descriptor.segmentRoles().size()) {
      throw new BadRequestException("Malformed Resource URL");
    }

    String database = segmentAt(descriptor, segments, ResourceDescriptor.DATABASE);
    String schema = segmentAt(descriptor, segments, ResourceDescriptor.SCHEMA);
    ParentHandle parent = new ParentHandle(
        database == null ? null : Identifiers.normalize(database),
        schema == null ? null : Identifiers.normalize(schema));

    boolean collection = segments.size() == ci + 1;
    String rawName = collection ? null : decode(segments.get(ci + 1));
    String name = rawName == null ? null : Identifiers.normalize(rawName);
    String sub = segments.size() > ci + 2 ? decode(segments.get(ci + 2)) : null;
    return new ResourcePath(descriptor, collection, name, rawName, parent, sub);
  }

  /** Percent-decoding that keeps a literal '+'. */
  public static String decode(String segment) {
    return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
  }

  public boolean hasSubResource() { return subResource != null && !subResource.isEmpty(); }

  /** Instance name qualified with its parent ("DB.SCH.T1"). */
  public String qualifiedName() {
    if (name == null) throw new BadRequestException("Malformed Resource URL");
    return parent.qualify(name);
  }

  private static String segmentAt(ResourceDescriptor d, List<String> segments, String role) {
    int i = d.indexOf(role);
    if (i < 0 || i >= segments.size()) return null;
    return decode(segments.get(i));
  }
}
