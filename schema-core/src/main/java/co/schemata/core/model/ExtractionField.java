package co.schemata.core.model;

import co.schemata.core.types.LogicalType;

import java.util.Map;

/**
 * A field that exists only in the extraction model, declared under
 * {@code extraction_fields}. It never reaches the record, storage or interface targets.
 *
 * @param extraction optional extraction override, {@code null} when absent
 */
public record ExtractionField(
    String name,
    LogicalType type,
    String description,
    boolean nullable,
    boolean required,
    TargetOverride extraction
) {
  public ExtractionField {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("extraction field name is required");
    if (type == null) throw new IllegalArgumentException(name + ": type is required");
  }

  /** View this entry as a field definition so generators treat it like any base field. */
  public FieldDefinition toFieldDefinition() {
    return new FieldDefinition(name, type, description, nullable && !required, required,
        false, false, false, false, null, null, null, null,
        extraction == null ? Map.of() : Map.of(Target.EXTRACTION, extraction));
  }
}
