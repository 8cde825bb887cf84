package io.intellixity.sqlbridge.mapping;

import java.util.*;
import java.util.function.Function;

/**
 * Fixed per-resource transform from raw SHOW / DESCRIBE rows to normalized rows.\n
 *
 * Applied in order: whitelist, renames, value conversions, drops.
 */
public final class RowNormalizer {
  private final Set<String> whitelist;
  private final Map<String, String> renames;
  private final Map<String, Function<Object, Object>> conversions;
  private final Set<String> drops;

  private RowNormalizer(Builder b) {
    this.whitelist = b.whitelist == null ? null : Set.copyOf(b.whitelist);
    this.renames = Collections.unmodifiableMap(new LinkedHashMap<>(b.renames));
    this.conversions = Collections.unmodifiableMap(new LinkedHashMap<>(b.conversions));
    this.drops = Set.copyOf(b.drops);
  }

  public static Builder builder() { return new Builder(); }

  public Map<String, Object> normalize(Map<String, Object> raw) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : raw.entrySet()) {
      if (whitelist != null && !whitelist.contains(e.getKey())) continue;
      out.put(e.getKey(), e.getValue());
    }
    for (var r : renames.entrySet()) {
      if (out.containsKey(r.getKey())) out.put(r.getValue(), out.remove(r.getKey()));
    }
    for (var c : conversions.entrySet()) {
      if (out.containsKey(c.getKey())) out.put(c.getKey(), c.getValue().apply(out.get(c.getKey())));
    }
    for (String d : drops) out.remove(d);
    return out;
  }

  public List<Map<String, Object>> normalizeAll(List<Map<String, Object>> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) out.add(normalize(r));
    return out;
  }

  public static final class Builder {
    private Set<String> whitelist;
    private final Map<String, String> renames = new LinkedHashMap<>();
    private final Map<String, Function<Object, Object>> conversions = new LinkedHashMap<>();
    private final Set<String> drops = new LinkedHashSet<>();

    private Builder() {}

    public Builder keep(String... keys) {
      if (whitelist == null) whitelist = new LinkedHashSet<>();
      whitelist.addAll(Arrays.asList(keys));
      return this;
    }

    public Builder rename(String from, String to) {
      renames.put(from, to);
      return this;
    }

    public Builder convert(Function<Object, Object> fn, String... keys) {
      for (String k : keys) conversions.put(k, fn);
      return this;
    }

    public Builder yesNo(String... keys) { return convert(Coercions::yesNo, keys); }

    public Builder trueFalse(String... keys) { return convert(Coercions::trueFalse, keys); }

    public Builder onOff(String... keys) { return convert(Coercions::onOff, keys); }

    public Builder integers(String... keys) { return convert(Coercions::toInteger, keys); }

    public Builder emptyToNull(String... keys) { return convert(Coercions::emptyToNull, keys); }

    public Builder json(String... keys) { return convert(Coercions::parseJsonObject, keys); }

    public Builder delimitedList(String... keys) { return convert(Coercions::delimitedList, keys); }

    public Builder drop(String... keys) {
      drops.addAll(Arrays.asList(keys));
      return this;
    }

    public RowNormalizer build() { return new RowNormalizer(this); }
  }
}
