package co.schemata.core.errors;

/** A schema description is malformed or incomplete. Aborts the affected schema only. */
public class SchemaParseException extends SchemaException {

  public SchemaParseException(String schemaName, String fieldName, String message) {
    super(schemaName, fieldName, null, message);
  }

  public SchemaParseException(String schemaName, String fieldName, String target, String message) {
    super(schemaName, fieldName, target, message);
  }

  public SchemaParseException(String schemaName, String message, Throwable cause) {
    super(schemaName, null, null, message, cause);
  }
}
