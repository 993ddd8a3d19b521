package co.schemata.core.errors;

/**
 * The set of schemas is inconsistent: a parent cannot be found, an {@code extends}
 * chain loops back on itself, or two schemas share a name.
 */
public class SchemaResolutionException extends SchemaException {

  public SchemaResolutionException(String schemaName, String message) {
    super(schemaName, null, null, message);
  }
}
