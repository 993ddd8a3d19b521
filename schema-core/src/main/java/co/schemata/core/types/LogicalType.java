package co.schemata.core.types;

import java.util.Optional;
import java.util.Set;

/**
 * A logical field type from the type catalog.
 *
 * <p>Seven forms are supported:
 * <pre>
 *   string, integer, float, boolean, datetime, json
 *   list[T]   where T is one of string, integer, float, boolean
 * </pre>
 *
 * <p>Logical types say nothing about a target; each target maps them through
 * {@link TypeCatalog}.
 */
public record LogicalType(Kind kind, Kind element) {

  public enum Kind {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    DATETIME("datetime"),
    JSON("json"),
    LIST("list");

    private final String label;

    Kind(String label) {
      this.label = label;
    }

    public String label() { return label; }
  }

  public static final LogicalType STRING = new LogicalType(Kind.STRING, null);
  public static final LogicalType INTEGER = new LogicalType(Kind.INTEGER, null);
  public static final LogicalType FLOAT = new LogicalType(Kind.FLOAT, null);
  public static final LogicalType BOOLEAN = new LogicalType(Kind.BOOLEAN, null);
  public static final LogicalType DATETIME = new LogicalType(Kind.DATETIME, null);
  public static final LogicalType JSON = new LogicalType(Kind.JSON, null);

  private static final Set<Kind> LIST_ELEMENTS = Set.of(Kind.STRING, Kind.INTEGER, Kind.FLOAT, Kind.BOOLEAN);

  public LogicalType {
    if (kind == null) throw new IllegalArgumentException("kind is required");
    if (kind == Kind.LIST) {
      if (element == null || !LIST_ELEMENTS.contains(element)) {
        throw new IllegalArgumentException("list element must be one of string, integer, float, boolean");
      }
    } else if (element != null) {
      throw new IllegalArgumentException("only list types carry an element type");
    }
  }

  public static LogicalType listOf(Kind element) {
    return new LogicalType(Kind.LIST, element);
  }

  /**
   * Parse a catalog type string such as {@code "integer"} or {@code "list[string]"}.
   *
   * @return the type, or empty if {@code s} is not a catalog member
   */
  public static Optional<LogicalType> parse(String s) {
    if (s == null || s.isEmpty()) return Optional.empty();
    String t = s.trim();

    if (t.startsWith("list[") && t.endsWith("]")) {
      String inner = t.substring("list[".length(), t.length() - 1).trim();
      return scalarKind(inner)
          .filter(LIST_ELEMENTS::contains)
          .map(LogicalType::listOf);
    }
    return scalarKind(t).map(k -> new LogicalType(k, null));
  }

  public static boolean isValid(String s) {
    return parse(s).isPresent();
  }

  private static Optional<Kind> scalarKind(String label) {
    for (Kind k : Kind.values()) {
      if (k != Kind.LIST && k.label.equals(label)) return Optional.of(k);
    }
    return Optional.empty();
  }

  public boolean isList() { return kind == Kind.LIST; }

  /** The element type of a list, e.g. {@code string} for {@code list[string]}. */
  public LogicalType elementType() {
    if (!isList()) throw new IllegalStateException(this + " is not a list type");
    return new LogicalType(element, null);
  }

  @Override
  public String toString() {
    return isList() ? "list[" + element.label + "]" : kind.label;
  }
}
