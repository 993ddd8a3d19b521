package co.schemata.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * A field default: either a literal value as written in the schema, or a token asking
 * the target to generate the value.
 *
 * <ul>
 *   <li>{@code generate-unique-id} (also {@code cuid()}, {@code uuid()})</li>
 *   <li>{@code current-timestamp} (also {@code now()})</li>
 * </ul>
 */
public record DefaultValue(Kind kind, Object literal) {

  public enum Kind { LITERAL, GENERATE_UNIQUE_ID, CURRENT_TIMESTAMP }

  public static final DefaultValue GENERATE_UNIQUE_ID = new DefaultValue(Kind.GENERATE_UNIQUE_ID, null);
  public static final DefaultValue CURRENT_TIMESTAMP = new DefaultValue(Kind.CURRENT_TIMESTAMP, null);

  private static final Set<String> UNIQUE_ID_TOKENS = Set.of("generate-unique-id", "cuid()", "uuid()");
  private static final Set<String> TIMESTAMP_TOKENS = Set.of("current-timestamp", "now()");
  private static final Set<String> NO_DEFAULT = Set.of("null", "none");

  /**
   * Interpret a raw YAML value. Returns {@code null} when the value means "no default".
   */
  public static DefaultValue parse(Object raw) {
    if (raw == null) return null;
    if (raw instanceof String s) {
      String token = s.trim();
      String lower = token.toLowerCase(Locale.ROOT);
      if (NO_DEFAULT.contains(lower)) return null;
      if (UNIQUE_ID_TOKENS.contains(lower)) return GENERATE_UNIQUE_ID;
      if (TIMESTAMP_TOKENS.contains(lower)) return CURRENT_TIMESTAMP;
      return new DefaultValue(Kind.LITERAL, token);
    }
    return new DefaultValue(Kind.LITERAL, raw);
  }

  public static DefaultValue literal(Object value) {
    return new DefaultValue(Kind.LITERAL, value);
  }

  public boolean isLiteral() { return kind == Kind.LITERAL; }

  /** Schema-level spelling of this default, used in descriptors and diagnostics. */
  public String text() {
    return switch (kind) {
      case GENERATE_UNIQUE_ID -> "generate-unique-id";
      case CURRENT_TIMESTAMP -> "current-timestamp";
      case LITERAL -> String.valueOf(literal);
    };
  }
}
