package co.schemata.core.model;

import co.schemata.core.types.LogicalType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One field of a schema, as declared. Immutable; created by the parser or the builder.
 *
 * <p>{@code required} implies {@code !nullable}. The parser rejects an explicit
 * {@code nullable: true} on a required field and the canonical constructor enforces
 * the same rule.
 */
public record FieldDefinition(
    String name,
    LogicalType type,
    String description,
    boolean nullable,
    boolean required,
    boolean index,
    boolean unique,
    boolean primaryKey,
    boolean exclude,
    String foreignKey,
    DefaultValue defaultValue,
    String searchCategory,
    List<String> searchKeywords,
    Map<Target, TargetOverride> overrides
) {
  public FieldDefinition {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("field name is required");
    if (type == null) throw new IllegalArgumentException(name + ": type is required");
    if (required && nullable) throw new IllegalArgumentException(name + ": a required field cannot be nullable");
    searchKeywords = searchKeywords == null ? List.of() : List.copyOf(searchKeywords);
    overrides = overrides == null || overrides.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(overrides));
  }

  public static Builder builder(String name, LogicalType type) {
    return new Builder(name, type);
  }

  public Builder toBuilder() {
    return new Builder(name, type)
        .description(description)
        .nullable(nullable)
        .required(required)
        .index(index)
        .unique(unique)
        .primaryKey(primaryKey)
        .exclude(exclude)
        .foreignKey(foreignKey)
        .defaultValue(defaultValue)
        .search(searchCategory, searchKeywords)
        .overrides(overrides);
  }

  public Optional<TargetOverride> override(Target target) {
    return Optional.ofNullable(overrides.get(target));
  }

  public boolean skippedFor(Target target) {
    return override(target).map(TargetOverride::skip).orElse(false);
  }

  /** Name used by {@code target}: the override's rename, else the declared name. */
  public String nameFor(Target target) {
    return override(target).map(TargetOverride::name).orElse(name);
  }

  /** Explicit type expression for {@code target}, if one was declared. */
  public Optional<String> typeFor(Target target) {
    return override(target).map(TargetOverride::type);
  }

  /** Default for {@code target}: the override's default, else the field default. */
  public DefaultValue defaultFor(Target target) {
    return override(target).map(TargetOverride::defaultValue).orElse(defaultValue);
  }

  public boolean hasSearchMetadata() {
    return searchCategory != null || !searchKeywords.isEmpty();
  }

  public static final class Builder {
    private final String name;
    private final LogicalType type;
    private String description;
    private Boolean nullable;
    private boolean required;
    private boolean index;
    private boolean unique;
    private boolean primaryKey;
    private boolean exclude;
    private String foreignKey;
    private DefaultValue defaultValue;
    private String searchCategory;
    private List<String> searchKeywords;
    private final Map<Target, TargetOverride> overrides = new EnumMap<>(Target.class);

    private Builder(String name, LogicalType type) {
      this.name = name;
      this.type = type;
    }

    public Builder description(String description) { this.description = description; return this; }
    public Builder nullable(boolean nullable) { this.nullable = nullable; return this; }
    public Builder required(boolean required) { this.required = required; return this; }
    public Builder index(boolean index) { this.index = index; return this; }
    public Builder unique(boolean unique) { this.unique = unique; return this; }
    public Builder primaryKey(boolean primaryKey) { this.primaryKey = primaryKey; return this; }
    public Builder exclude(boolean exclude) { this.exclude = exclude; return this; }
    public Builder foreignKey(String foreignKey) { this.foreignKey = foreignKey; return this; }
    public Builder defaultValue(DefaultValue defaultValue) { this.defaultValue = defaultValue; return this; }

    public Builder search(String category, List<String> keywords) {
      this.searchCategory = category;
      this.searchKeywords = keywords;
      return this;
    }

    public Builder override(Target target, TargetOverride override) {
      if (override == null) overrides.remove(target);
      else overrides.put(target, override);
      return this;
    }

    public Builder overrides(Map<Target, TargetOverride> overrides) {
      this.overrides.clear();
      this.overrides.putAll(overrides);
      return this;
    }

    /** An omitted {@code nullable} defaults to {@code !required}. */
    public FieldDefinition build() {
      boolean n = nullable != null ? nullable : !required;
      return new FieldDefinition(name, type, description, n, required, index, unique, primaryKey,
          exclude, foreignKey, defaultValue, searchCategory, searchKeywords, overrides);
    }
  }
}
