package co.schemata.core;

import co.schemata.core.model.SchemaDefinition;

import java.util.Optional;

/** Looks up a schema by name, typically a parent named in {@code extends}. */
@FunctionalInterface
public interface SchemaLoader {

  Optional<SchemaDefinition> load(String name);

  /** A loader that knows no schemas; enough for schemas without a parent. */
  static SchemaLoader none() {
    return name -> Optional.empty();
  }
}
