package co.schemata.core;

import co.schemata.core.errors.SchemaResolutionException;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a schema's {@code extends} chain into its resolved field list: ancestor fields
 * first, then the schema's own, each name once. A redefined name keeps the position of its
 * first declaration and the definition of its last.
 */
public final class InheritanceResolver {
  private static final Logger log = LoggerFactory.getLogger(InheritanceResolver.class);

  private InheritanceResolver() {}

  public static List<FieldDefinition> resolve(SchemaDefinition schema, SchemaLoader loader) {
    if (!schema.hasParent()) return schema.fields();

    Set<String> chain = new LinkedHashSet<>();
    List<FieldDefinition> resolved = resolve(schema, loader, chain);
    log.debug("Resolved {} through {}: {} fields", schema.name(), String.join(" -> ", chain), resolved.size());
    return resolved;
  }

  /** The parent named by {@code extends}. */
  public static SchemaDefinition parent(SchemaDefinition schema, SchemaLoader loader) {
    if (!schema.hasParent()) {
      throw new IllegalArgumentException(schema.name() + " has no parent");
    }
    return loader.load(schema.extendsName()).orElseThrow(() -> new SchemaResolutionException(schema.name(),
        "parent schema '" + schema.extendsName() + "' not found"));
  }

  /** Applies the merge rule to two already ordered field lists. */
  public static List<FieldDefinition> merge(List<FieldDefinition> inherited, List<FieldDefinition> own) {
    Map<String, FieldDefinition> byName = new LinkedHashMap<>();
    for (FieldDefinition f : inherited) byName.put(f.name(), f);
    for (FieldDefinition f : own) byName.put(f.name(), f);
    return List.copyOf(byName.values());
  }

  private static List<FieldDefinition> resolve(SchemaDefinition schema, SchemaLoader loader, Set<String> chain) {
    if (!chain.add(schema.name())) {
      List<String> cycle = new ArrayList<>(chain);
      cycle.add(schema.name());
      throw new SchemaResolutionException(cycle.get(0),
          "cyclic extends chain: " + String.join(" -> ", cycle));
    }
    if (!schema.hasParent()) return schema.fields();

    SchemaDefinition parent = parent(schema, loader);
    return merge(resolve(parent, loader, chain), schema.fields());
  }
}
