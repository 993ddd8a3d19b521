package co.schemata.core;

import co.schemata.core.errors.SchemaResolutionException;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.types.LogicalType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class SchemaRegistryTest {

  private static SchemaDefinition schema(String name) {
    return new SchemaDefinition(name, name, null,
        List.of(FieldDefinition.builder("id", LogicalType.STRING).build()));
  }

  @Test
  void loadsByName() {
    SchemaRegistry registry = SchemaRegistry.of(schema("Listing"), schema("Venue"));

    assertThat(registry.load("Venue")).map(SchemaDefinition::name).contains("Venue");
    assertThat(registry.load("Winery")).isEmpty();
    assertThat(registry.all()).extracting(SchemaDefinition::name).containsExactly("Listing", "Venue");
  }

  @Test
  void rejectsDuplicateNames() {
    assertThatThrownBy(() -> SchemaRegistry.of(schema("Venue"), schema("Venue")))
      .isInstanceOf(SchemaResolutionException.class)
      .hasMessageContaining("Venue: schema name is declared more than once");
  }
}
