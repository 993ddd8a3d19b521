package co.schemata.core.types;

import co.schemata.core.errors.UnsupportedTypeException;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.Target;
import co.schemata.core.model.TargetOverride;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

public class TypeCatalogTest {

  /** Minimal target: upper-cased names, trailing '?' for nullable, no lists. */
  private static final TargetTypes<String> SHOUTY = new TargetTypes<>() {
    @Override
    public Target target() { return Target.STORAGE; }

    @Override
    public Optional<String> canonical(LogicalType type) {
      return type.isList() ? Optional.empty() : Optional.of(type.toString().toUpperCase());
    }

    @Override
    public String nullable(String expression) { return expression + "?"; }

    @Override
    public String explicit(String expression) {
      if (expression.contains("[]")) throw new IllegalArgumentException("arrays are not supported");
      return expression;
    }

    @Override
    public String unsupportedHint(LogicalType type) { return "; declare a storage type override"; }
  };

  @Test
  void nonNullableFieldGetsCanonicalExpression() {
    FieldDefinition f = FieldDefinition.builder("entity_name", LogicalType.STRING).required(true).build();
    assertThat(TypeCatalog.mapType("Venue", f, SHOUTY)).isEqualTo("STRING");
  }

  @Test
  void nullableFieldIsWrapped() {
    FieldDefinition f = FieldDefinition.builder("rating", LogicalType.FLOAT).build();
    assertThat(TypeCatalog.mapType("Venue", f, SHOUTY)).isEqualTo("FLOAT?");
  }

  @Test
  void callerMaySupplyNullability() {
    FieldDefinition f = FieldDefinition.builder("entity_name", LogicalType.STRING).required(true).build();
    assertThat(TypeCatalog.mapType("Venue", f, true, SHOUTY)).isEqualTo("STRING?");
  }

  @Test
  void overrideIsUsedVerbatimAndNeverWrapped() {
    FieldDefinition f = FieldDefinition.builder("notes", LogicalType.STRING)
        .override(Target.STORAGE, TargetOverride.type("Text"))
        .build();
    assertThat(f.nullable()).isTrue();
    assertThat(TypeCatalog.mapType("Venue", f, SHOUTY)).isEqualTo("Text");
  }

  @Test
  void overrideForAnotherTargetIsIgnored() {
    FieldDefinition f = FieldDefinition.builder("notes", LogicalType.STRING)
        .required(true)
        .override(Target.RECORD, TargetOverride.type("CharSequence"))
        .build();
    assertThat(TypeCatalog.mapType("Venue", f, SHOUTY)).isEqualTo("STRING");
  }

  @Test
  void missingCanonicalRaisesUnsupportedType() {
    FieldDefinition f = FieldDefinition.builder("categories", LogicalType.listOf(LogicalType.Kind.STRING)).build();

    assertThatThrownBy(() -> TypeCatalog.mapType("Venue", f, SHOUTY))
      .isInstanceOfSatisfying(UnsupportedTypeException.class, e -> {
        assertThat(e.getSchemaName()).isEqualTo("Venue");
        assertThat(e.getFieldName()).isEqualTo("categories");
        assertThat(e.getTarget()).isEqualTo("storage");
        assertThat(e.getType()).isEqualTo("list[string]");
      })
      .hasMessageContaining("Venue.categories [storage]")
      .hasMessageContaining("declare a storage type override");
  }

  @Test
  void rejectedOverrideRaisesUnsupportedType() {
    FieldDefinition f = FieldDefinition.builder("categories", LogicalType.listOf(LogicalType.Kind.STRING))
        .override(Target.STORAGE, TargetOverride.type("String[]"))
        .build();

    assertThatThrownBy(() -> TypeCatalog.mapType("Venue", f, SHOUTY))
      .isInstanceOf(UnsupportedTypeException.class)
      .hasMessageContaining("type override 'String[]' rejected: arrays are not supported");
  }
}
