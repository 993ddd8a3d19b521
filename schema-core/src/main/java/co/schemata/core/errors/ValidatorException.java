package co.schemata.core.errors;

/** A field declares a validator the extraction model generator cannot emit. */
public class ValidatorException extends SchemaException {
  private final String validator;

  public ValidatorException(String schemaName, String fieldName, String validator, String message) {
    super(schemaName, fieldName, "extraction", message);
    this.validator = validator;
  }

  public String getValidator() { return validator; }
}
