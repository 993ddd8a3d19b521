package co.schemata.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The generated representations a schema compiles into. The {@link #key()} is the name
 * used for per-target override blocks under a field's {@code targets} map.
 */
public enum Target {
  RECORD("record"),
  STORAGE("storage"),
  INTERFACE("interface"),
  EXTRACTION("extraction");

  private final String key;

  Target(String key) {
    this.key = key;
  }

  public String key() { return key; }

  public static Optional<Target> fromKey(String key) {
    return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
  }

  @Override
  public String toString() { return key; }
}
