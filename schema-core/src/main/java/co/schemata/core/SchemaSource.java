package co.schemata.core;

/**
 * One schema description as handed over by the caller: the file name used in diagnostics
 * and generated headers, and the YAML text.
 */
public record SchemaSource(String name, String text) {

  public SchemaSource {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("source name is required");
  }
}
