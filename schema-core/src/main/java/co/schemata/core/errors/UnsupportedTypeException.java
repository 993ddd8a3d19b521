package co.schemata.core.errors;

/**
 * A logical type, or an explicit per-target type expression, has no representation
 * for the target being generated.
 */
public class UnsupportedTypeException extends SchemaException {
  private final String type;

  public UnsupportedTypeException(String schemaName, String fieldName, String target, String type, String message) {
    super(schemaName, fieldName, target, message);
    this.type = type;
  }

  public String getType() { return type; }
}
