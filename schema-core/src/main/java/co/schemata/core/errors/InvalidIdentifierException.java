package co.schemata.core.errors;

/** A field or schema name cannot be spelled as an identifier in the target language. */
public class InvalidIdentifierException extends SchemaException {
  private final String identifier;

  public InvalidIdentifierException(String schemaName, String fieldName, String target, String identifier,
                                    String message) {
    super(schemaName, fieldName, target, message);
    this.identifier = identifier;
  }

  public String getIdentifier() { return identifier; }
}
