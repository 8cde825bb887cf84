package io.intellixity.sqlbridge.sql;

import io.intellixity.sqlbridge.error.BadRequestException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Values of the createMode query parameter. */
public enum CreateMode {
  ERROR_IF_EXISTS("errorIfExists"),
  OR_REPLACE("orReplace"),
  IF_NOT_EXISTS("ifNotExists"),
  /** Only meaningful on DELETE. */
  IF_EXISTS("ifExists");

  public static final String QUERY_PARAM = "createMode";

  private static final Map<String, CreateMode> ALIASES;

  static {
    Map<String, CreateMode> m = new HashMap<>();
    for (CreateMode c : values()) {
      m.put(c.wireName.toLowerCase(Locale.ROOT), c);
      m.put(c.name().toLowerCase(Locale.ROOT), c);
      m.put(c.name().replace("_", "").toLowerCase(Locale.ROOT), c);
    }
    ALIASES = Collections.unmodifiableMap(m);
  }

  private final String wireName;

  CreateMode(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  public static Optional<CreateMode> lookup(String raw) {
    if (raw == null) return Optional.empty();
    return Optional.ofNullable(ALIASES.get(raw.trim().toLowerCase(Locale.ROOT)));
  }

  /** Blank or absent yields {@code defaultMode}; an unknown value is a client error. */
  public static CreateMode parse(String raw, CreateMode defaultMode) {
    if (raw == null || raw.isBlank()) return defaultMode;
    return lookup(raw).orElseThrow(() -> new BadRequestException("Unsupported createMode mentioned " + raw));
  }
}
