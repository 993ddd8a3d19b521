package co.schemata.core.errors;

import java.util.List;

/** Two or more fields resolve to the same identifier in a generated artifact. */
public class IdentifierCollisionException extends SchemaException {
  private final List<String> fieldNames;

  public IdentifierCollisionException(String schemaName, String target, String identifier, List<String> fieldNames) {
    super(schemaName, null, target,
        "fields " + fieldNames + " all resolve to identifier '" + identifier
            + "'. Add a " + target + " name override to one of the conflicting fields.");
    this.fieldNames = List.copyOf(fieldNames);
  }

  public List<String> getFieldNames() { return fieldNames; }
}
