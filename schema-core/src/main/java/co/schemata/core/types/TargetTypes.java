package co.schemata.core.types;

import co.schemata.core.model.Target;

import java.util.Optional;

/**
 * How one target spells types. Implementations supply the canonical non-nullable
 * expression per logical type and the nullable convention; {@link TypeCatalog} decides
 * when each applies, so every target wraps nullability the same way.
 *
 * @param <T> the target's type expression, e.g. a JavaPoet {@code TypeName} or a plain string
 */
public interface TargetTypes<T> {

  Target target();

  /** Canonical non-nullable expression, or empty when the target cannot represent {@code type}. */
  Optional<T> canonical(LogicalType type);

  /** Wrap a canonical expression in the target's nullable convention. */
  T nullable(T expression);

  /**
   * Interpret an explicit override expression. Overrides are used verbatim and never
   * wrapped.
   *
   * @throws IllegalArgumentException if the target rejects the expression
   */
  T explicit(String expression);

  /** Extra guidance appended to the error raised when {@link #canonical} is empty. */
  default String unsupportedHint(LogicalType type) {
    return "";
  }
}
