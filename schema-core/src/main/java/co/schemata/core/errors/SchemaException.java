package co.schemata.core.errors;

/**
 * Base class for every failure raised while compiling a schema.
 *
 * <p>Carries the offending schema, field and target (each may be {@code null}) so that
 * the message alone is enough to locate the problem, e.g.
 * {@code Venue.categories [storage]: list type 'list[string]' has no storage representation}.
 */
public abstract class SchemaException extends RuntimeException {
  private final String schemaName;
  private final String fieldName;
  private final String target;

  protected SchemaException(String schemaName, String fieldName, String target, String message) {
    this(schemaName, fieldName, target, message, null);
  }

  protected SchemaException(String schemaName, String fieldName, String target, String message, Throwable cause) {
    super(locate(schemaName, fieldName, target) + ": " + message, cause);
    this.schemaName = schemaName;
    this.fieldName = fieldName;
    this.target = target;
  }

  public String getSchemaName() { return schemaName; }

  public String getFieldName() { return fieldName; }

  public String getTarget() { return target; }

  private static String locate(String schemaName, String fieldName, String target) {
    StringBuilder sb = new StringBuilder(schemaName == null ? "<unnamed schema>" : schemaName);
    if (fieldName != null) sb.append('.').append(fieldName);
    if (target != null) sb.append(" [").append(target).append(']');
    return sb.toString();
  }
}
