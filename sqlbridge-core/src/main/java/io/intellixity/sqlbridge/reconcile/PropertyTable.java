package io.intellixity.sqlbridge.reconcile;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.sql.SqlLiterals;

import java.util.*;

/**
 * Property classification of one resource kind.\n
 *
 * - required: must be present in a create or create-or-alter body\n
 * - optional: may be set at creation and altered later\n
 * - immutable: may be set at creation, never changed afterwards\n
 * - readOnly: reported by the backend, never settable\n
 * - unsettable: absent from the desired state means UNSET when currently set\n
 * - special: excluded from the generic diff (identity or composite properties)\n
 */
public final class PropertyTable {
  private final List<String> required;
  private final List<String> optional;
  private final Set<String> immutable;
  private final Set<String> readOnly;
  private final Set<String> unsettable;
  private final Set<String> quoted;
  private final Set<String> caseInsensitive;
  private final Set<String> special;

  private PropertyTable(Builder b) {
    this.required = List.copyOf(b.required);
    this.optional = List.copyOf(b.optional);
    this.immutable = Collections.unmodifiableSet(new LinkedHashSet<>(b.immutable));
    this.readOnly = Collections.unmodifiableSet(new LinkedHashSet<>(b.readOnly));
    this.unsettable = Set.copyOf(b.unsettable);
    this.quoted = Set.copyOf(b.quoted);
    this.caseInsensitive = Set.copyOf(b.caseInsensitive);
    this.special = Set.copyOf(b.special);
  }

  public static Builder builder() { return new Builder(); }

  public List<String> required() { return required; }

  public List<String> optional() { return optional; }

  public boolean isImmutable(String key) { return immutable.contains(key) || readOnly.contains(key); }

  public boolean isReadOnly(String key) { return readOnly.contains(key); }

  public boolean isUnsettable(String key) { return unsettable.contains(key); }

  public boolean isQuoted(String key) { return quoted.contains(key); }

  /** Properties the generic diff walks, in declaration order. */
  public List<String> compared() {
    LinkedHashSet<String> out = new LinkedHashSet<>();
    out.addAll(required);
    out.addAll(optional);
    out.addAll(immutable);
    out.addAll(readOnly);
    out.removeAll(special);
    return List.copyOf(out);
  }

  public void requirePresent(Map<String, Object> body) {
    for (String k : required) {
      if (body == null || !body.containsKey(k)) throw new BadRequestException("Required property " + k + " is missing");
    }
  }

  public boolean equivalent(String key, Object desired, Object current) {
    return Values.equivalent(desired, current, caseInsensitive.contains(key));
  }

  /** Right-hand side of a SET assignment. */
  public String render(String key, Object value) {
    return quoted.contains(key) ? SqlLiterals.singleQuote(value) : SqlLiterals.render(value);
  }

  public static final class Builder {
    private final List<String> required = new ArrayList<>();
    private final List<String> optional = new ArrayList<>();
    private final Set<String> immutable = new LinkedHashSet<>();
    private final Set<String> readOnly = new LinkedHashSet<>();
    private final Set<String> unsettable = new HashSet<>();
    private final Set<String> quoted = new HashSet<>();
    private final Set<String> caseInsensitive = new HashSet<>();
    private final Set<String> special = new HashSet<>();

    private Builder() {}

    public Builder required(String... keys) { required.addAll(Arrays.asList(keys)); return this; }

    public Builder optional(String... keys) { optional.addAll(Arrays.asList(keys)); return this; }

    public Builder immutable(String... keys) { immutable.addAll(Arrays.asList(keys)); return this; }

    public Builder readOnly(String... keys) { readOnly.addAll(Arrays.asList(keys)); return this; }

    public Builder unsettable(String... keys) { unsettable.addAll(Arrays.asList(keys)); return this; }

    public Builder quoted(String... keys) { quoted.addAll(Arrays.asList(keys)); return this; }

    public Builder caseInsensitive(String... keys) { caseInsensitive.addAll(Arrays.asList(keys)); return this; }

    public Builder special(String... keys) { special.addAll(Arrays.asList(keys)); return this; }

    public PropertyTable build() { return new PropertyTable(this); }
  }
}
