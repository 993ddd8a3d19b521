package co.schemata.core;

import co.schemata.core.errors.SchemaResolutionException;
import co.schemata.core.model.SchemaDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** In-memory {@link SchemaLoader} over a batch of parsed schemas. */
public final class SchemaRegistry implements SchemaLoader {
  private final Map<String, SchemaDefinition> schemas;

  private SchemaRegistry(Map<String, SchemaDefinition> schemas) {
    this.schemas = schemas;
  }

  /** @throws SchemaResolutionException if two schemas share a name */
  public static SchemaRegistry of(Collection<SchemaDefinition> schemas) {
    Map<String, SchemaDefinition> byName = new LinkedHashMap<>();
    for (SchemaDefinition s : schemas) {
      if (byName.putIfAbsent(s.name(), s) != null) {
        throw new SchemaResolutionException(s.name(), "schema name is declared more than once");
      }
    }
    return new SchemaRegistry(byName);
  }

  public static SchemaRegistry of(SchemaDefinition... schemas) {
    return of(List.of(schemas));
  }

  @Override
  public Optional<SchemaDefinition> load(String name) {
    return Optional.ofNullable(schemas.get(name));
  }

  /** Schemas in registration order. */
  public List<SchemaDefinition> all() {
    return List.copyOf(schemas.values());
  }
}
