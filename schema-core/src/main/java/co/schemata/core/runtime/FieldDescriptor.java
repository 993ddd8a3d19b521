package co.schemata.core.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime description of one field of a generated record class. Generated classes expose
 * their fields as {@code public static final List<FieldDescriptor> FIELDS}.
 *
 * @param name         field name as declared in the schema
 * @param type         logical type, e.g. {@code list[string]}
 * @param javaType     Java type of the generated member, e.g. {@code List<String>}
 * @param defaultValue schema-level default, e.g. {@code generate-unique-id}; {@code null} if none
 * @param exclude      internal field, not offered to extraction-facing callers
 */
public record FieldDescriptor(
    String name,
    String type,
    String javaType,
    String description,
    boolean nullable,
    boolean required,
    boolean index,
    boolean unique,
    boolean primaryKey,
    String foreignKey,
    String defaultValue,
    boolean exclude,
    String searchCategory,
    List<String> searchKeywords
) {
  public FieldDescriptor {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("name is required");
    searchKeywords = searchKeywords == null ? List.of() : List.copyOf(searchKeywords);
  }

  public static Builder builder(String name, String type, String javaType) {
    return new Builder(name, type, javaType);
  }

  public boolean hasSearchMetadata() {
    return searchCategory != null || !searchKeywords.isEmpty();
  }

  /**
   * Parent descriptors followed by the child's own, one entry per name. A redefined name
   * keeps the parent's position and takes the child's descriptor.
   */
  public static List<FieldDescriptor> concat(List<FieldDescriptor> parent, List<FieldDescriptor> own) {
    Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
    for (FieldDescriptor f : parent) byName.put(f.name(), f);
    for (FieldDescriptor f : own) byName.put(f.name(), f);
    return List.copyOf(byName.values());
  }

  public static final class Builder {
    private final String name;
    private final String type;
    private final String javaType;
    private String description;
    private boolean nullable;
    private boolean required;
    private boolean index;
    private boolean unique;
    private boolean primaryKey;
    private String foreignKey;
    private String defaultValue;
    private boolean exclude;
    private String searchCategory;
    private List<String> searchKeywords;

    private Builder(String name, String type, String javaType) {
      this.name = name;
      this.type = type;
      this.javaType = javaType;
    }

    public Builder description(String description) { this.description = description; return this; }
    public Builder nullable(boolean nullable) { this.nullable = nullable; return this; }
    public Builder required(boolean required) { this.required = required; return this; }
    public Builder index(boolean index) { this.index = index; return this; }
    public Builder unique(boolean unique) { this.unique = unique; return this; }
    public Builder primaryKey(boolean primaryKey) { this.primaryKey = primaryKey; return this; }
    public Builder foreignKey(String foreignKey) { this.foreignKey = foreignKey; return this; }
    public Builder defaultValue(String defaultValue) { this.defaultValue = defaultValue; return this; }
    public Builder exclude(boolean exclude) { this.exclude = exclude; return this; }
    public Builder searchCategory(String searchCategory) { this.searchCategory = searchCategory; return this; }
    public Builder searchKeywords(List<String> searchKeywords) { this.searchKeywords = searchKeywords; return this; }

    public FieldDescriptor build() {
      return new FieldDescriptor(name, type, javaType, description, nullable, required, index, unique,
          primaryKey, foreignKey, defaultValue, exclude, searchCategory, searchKeywords);
    }
  }
}
