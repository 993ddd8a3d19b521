package co.schemata.core.types;

import co.schemata.core.errors.UnsupportedTypeException;
import co.schemata.core.model.FieldDefinition;

import java.util.Optional;

/**
 * Maps a field to a target type expression: the explicit override when one is declared,
 * otherwise the canonical expression wrapped in the target's nullable convention when the
 * field is nullable.
 */
public final class TypeCatalog {

  private TypeCatalog() {}

  public static <T> T mapType(String schemaName, FieldDefinition field, TargetTypes<T> types) {
    return mapType(schemaName, field, field.nullable(), types);
  }

  /**
   * Same as {@link #mapType(String, FieldDefinition, TargetTypes)} with the nullability
   * supplied by the caller. The extraction model uses this because its optionality differs
   * from the declared one.
   */
  public static <T> T mapType(String schemaName, FieldDefinition field, boolean nullable, TargetTypes<T> types) {
    String target = types.target().key();

    Optional<String> override = field.typeFor(types.target());
    if (override.isPresent()) {
      try {
        return types.explicit(override.get());
      } catch (IllegalArgumentException e) {
        throw new UnsupportedTypeException(schemaName, field.name(), target, override.get(),
            "type override '" + override.get() + "' rejected: " + e.getMessage());
      }
    }

    LogicalType type = field.type();
    T canonical = types.canonical(type).orElseThrow(() -> new UnsupportedTypeException(
        schemaName, field.name(), target, type.toString(),
        "logical type '" + type + "' has no " + target + " representation" + types.unsupportedHint(type)));
    return nullable ? types.nullable(canonical) : canonical;
  }
}
