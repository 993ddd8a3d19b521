package co.schemata.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A parsed schema: its own fields only. Inheritance is recorded in {@code extendsName}
 * and resolved separately, so inspecting one schema never requires loading its ancestors.
 */
public record SchemaDefinition(
    String name,
    String description,
    String extendsName,
    List<FieldDefinition> fields,
    List<ExtractionField> extractionFields
) {
  public SchemaDefinition {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("schema name is required");
    fields = fields == null ? List.of() : List.copyOf(fields);
    extractionFields = extractionFields == null ? List.of() : List.copyOf(extractionFields);
  }

  public SchemaDefinition(String name, String description, String extendsName, List<FieldDefinition> fields) {
    this(name, description, extendsName, fields, List.of());
  }

  public boolean hasParent() {
    return extendsName != null && !extendsName.isEmpty();
  }

  public Optional<FieldDefinition> field(String fieldName) {
    return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
  }
}
