package co.schemata.generators.java;

import co.schemata.core.SchemaLoader;
import co.schemata.core.SchemaParser;
import co.schemata.core.SchemaRegistry;
import co.schemata.core.errors.IdentifierCollisionException;
import co.schemata.core.errors.InvalidIdentifierException;
import co.schemata.core.errors.SchemaResolutionException;
import co.schemata.core.errors.UnsupportedTypeException;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.generators.CompilerOptions;
import co.schemata.generators.Fixtures;
import co.schemata.generators.GeneratedHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class RecordGeneratorTest {

  private RecordGenerator generator;
  private SchemaRegistry registry;

  @BeforeEach
  void setUp() {
    generator = new RecordGenerator(CompilerOptions.defaults(), Fixtures.header());
    registry = Fixtures.registry("listing.yaml", "venue.yaml");
  }

  private String listing() {
    return generator.generate(registry.load("Listing").orElseThrow(), "listing.yaml", registry);
  }

  private String venue() {
    return generator.generate(registry.load("Venue").orElseThrow(), "venue.yaml", registry);
  }

  @Test
  void startsWithGeneratedHeader() {
    String content = listing();

    assertThat(content).startsWith("// ====");
    assertThat(content).contains("// GENERATED FILE - DO NOT EDIT");
    assertThat(content).contains("// Generated from: schemas/listing.yaml");
    assertThat(content).contains("// Generated at: 2024-05-01 10:15:30");
    assertThat(content).contains("package co.schemata.generated;");
  }

  @Test
  void generatesImmutableClassWithOneMemberPerField() {
    String content = listing();

    assertThat(content).contains("public final class Listing {");
    assertThat(content).contains("private final String entityId;");
    assertThat(content).contains("private final String entityName;");
    assertThat(content).contains("private final @Nullable String slug;");
    assertThat(content).contains("private final @Nullable List<String> categories;");
    assertThat(content).contains("private final @Nullable Boolean isVerified;");
    assertThat(content).contains("private final @Nullable Map<String, Object> attributes;");
    assertThat(content).contains("private final Instant createdAt;");
    assertThat(content).contains("import org.jspecify.annotations.Nullable;");
  }

  @Test
  void constructorRejectsNullForNonNullableFields() {
    String content = listing();

    assertThat(content).contains("this.entityName = Objects.requireNonNull(entityName, \"entity_name is required\");");
    assertThat(content).contains("this.slug = slug;");
    assertThat(content).doesNotContain("requireNonNull(slug");
  }

  @Test
  void generatesAccessorsBuilderAndValueMethods() {
    String content = listing();

    assertThat(content).contains("public String getEntityName()");
    assertThat(content).contains("public static Builder builder()");
    assertThat(content).contains("public static final class Builder");
    assertThat(content).contains("public Listing build()");
    assertThat(content).contains("public boolean equals(Object o)");
    assertThat(content).contains("public int hashCode()");
    assertThat(content).contains("public String toString()");
  }

  @Test
  void builderStartsFromDeclaredDefaults() {
    String content = listing();

    assertThat(content).contains("private String entityId = UUID.randomUUID().toString();");
    assertThat(content).contains("private Instant createdAt = Instant.now();");
    assertThat(content).contains("private @Nullable Boolean isVerified = false;");
  }

  @Test
  void publishesFieldDescriptors() {
    String content = listing();

    assertThat(content).contains("public static final List<FieldDescriptor> FIELDS = List.of(");
    assertThat(content).contains("FieldDescriptor.builder(\"entity_name\", \"string\", \"String\")");
    assertThat(content).contains("FieldDescriptor.builder(\"categories\", \"list[string]\", \"List<String>\")");
    assertThat(content).contains(".searchCategory(\"identity\")");
    assertThat(content).contains(".searchKeywords(List.of(\"name\", \"title\"))");
    assertThat(content).contains(".defaultValue(\"generate-unique-id\")");
    assertThat(content).contains(".exclude(true)");
    assertThat(content).contains(".primaryKey(true)");
    assertThat(content).doesNotContain("SPECIFIC_FIELDS");
  }

  @Test
  void generatesLookupHelpers() {
    String content = listing();

    assertThat(content).contains("public static Optional<FieldDescriptor> fieldByName(String name)");
    assertThat(content).contains("public static List<FieldDescriptor> fieldsWithSearchMetadata()");
    assertThat(content).contains("public static List<FieldDescriptor> extractionFields()");
    assertThat(content).contains("filter(f -> !f.exclude())");
    assertThat(content).contains("public static List<FieldDescriptor> databaseFields()");
  }

  @Test
  void childListsOwnFieldsAndConcatenatesWithParent() {
    String content = venue();

    assertThat(content).contains("public final class Venue {");
    assertThat(content).contains("public static final List<FieldDescriptor> SPECIFIC_FIELDS = List.of(");
    assertThat(content).contains("FIELDS = FieldDescriptor.concat(Listing.FIELDS, SPECIFIC_FIELDS);");

    String specific = content.substring(
        content.indexOf("SPECIFIC_FIELDS = List.of("),
        content.indexOf("FIELDS = FieldDescriptor.concat"));
    assertThat(specific).contains("FieldDescriptor.builder(\"capacity\", \"integer\", \"Long\")");
    assertThat(specific).doesNotContain("\"entity_name\"");
  }

  @Test
  void childRecordHoldsInheritedFieldsFirst() {
    String content = venue();

    assertThat(content).contains("private final String entityName;");
    assertThat(content).contains("private final @Nullable Long capacity;");
    assertThat(content.indexOf("private final String entityId;"))
        .isLessThan(content.indexOf("private final @Nullable Long capacity;"));
  }

  @Test
  void honorsRecordOverrides() {
    SchemaDefinition schema = SchemaParser.parse("""
        schema:
          name: Event
          description: A scheduled event
        fields:
          - name: price
            type: float
            description: Ticket price
            required: true
            targets:
              record:
                name: ticket_price
                type: java.math.BigDecimal
          - name: internal_notes
            type: string
            description: Staff notes
            targets:
              record:
                skip: true
        """, "event.yaml");

    String content = generator.generate(schema, "event.yaml", SchemaLoader.none());

    assertThat(content).contains("private final BigDecimal ticketPrice;");
    assertThat(content).contains("import java.math.BigDecimal;");
    assertThat(content).doesNotContain("internalNotes");
  }

  @Test
  void regeneratesIdenticallyApartFromTimestamp() {
    RecordGenerator later = new RecordGenerator(CompilerOptions.defaults(),
        new GeneratedHeader("schemas", Fixtures.LATER));
    SchemaDefinition venue = registry.load("Venue").orElseThrow();

    String first = generator.generate(venue, "venue.yaml", registry);
    String second = later.generate(venue, "venue.yaml", registry);

    assertThat(first).isNotEqualTo(second);
    assertThat(GeneratedHeader.withoutTimestamps(first)).isEqualTo(GeneratedHeader.withoutTimestamps(second));
  }

  @Test
  void usesConfiguredPackage() {
    CompilerOptions options = CompilerOptions.fromYaml("javaPackage: com.acme.model");
    RecordGenerator custom = new RecordGenerator(options, Fixtures.header());

    String content = custom.generate(registry.load("Listing").orElseThrow(), "listing.yaml", registry);

    assertThat(content).contains("package com.acme.model;");
  }

  @Test
  void rejectsFieldsThatResolveToTheSameIdentifier() {
    SchemaDefinition schema = SchemaParser.parse("""
        schema:
          name: Clash
          description: Two spellings of one name
        fields:
          - name: entity_name
            type: string
            description: Snake case
          - name: entityName
            type: string
            description: Camel case
        """, "clash.yaml");

    assertThatThrownBy(() -> generator.generate(schema, "clash.yaml", SchemaLoader.none()))
        .isInstanceOf(IdentifierCollisionException.class)
        .hasMessageContaining("entityName")
        .hasMessageContaining("[record]");
  }

  @Test
  void rejectsDefaultCombinedWithTypeOverride() {
    SchemaDefinition schema = SchemaParser.parse("""
        schema:
          name: Counter
          description: A counter
        fields:
          - name: total
            type: integer
            description: Running total
            default: 0
            targets:
              record:
                type: java.math.BigInteger
        """, "counter.yaml");

    assertThatThrownBy(() -> generator.generate(schema, "counter.yaml", SchemaLoader.none()))
        .isInstanceOf(UnsupportedTypeException.class)
        .hasMessageContaining("Counter.total [record]");
  }

  @Test
  void failsWhenParentIsMissing() {
    SchemaDefinition venue = Fixtures.parse("venue.yaml");

    assertThatThrownBy(() -> generator.generate(venue, "venue.yaml", SchemaLoader.none()))
        .isInstanceOf(SchemaResolutionException.class)
        .hasMessageContaining("parent schema 'Listing' not found");
  }

  @Test
  void rejectsFieldNameThatIsNotAJavaIdentifier() {
    SchemaDefinition schema = SchemaParser.parse("""
        schema:
          name: Shop
          description: A shop
        fields:
          - name: price.gbp
            type: float
            description: Price in pounds
        """, "shop.yaml");

    assertThatThrownBy(() -> generator.generate(schema, "shop.yaml", SchemaLoader.none()))
        .isInstanceOf(InvalidIdentifierException.class)
        .hasMessageContaining("Shop.price.gbp [record]")
        .satisfies(e -> assertThat(((InvalidIdentifierException) e).getFieldName()).isEqualTo("price.gbp"));
  }

  @Test
  void recordNameOverrideRepairsInvalidFieldName() {
    SchemaDefinition schema = SchemaParser.parse("""
        schema:
          name: Shop
          description: A shop
        fields:
          - name: price.gbp
            type: float
            description: Price in pounds
            targets:
              record:
                name: price_gbp
        """, "shop.yaml");

    assertThat(generator.generate(schema, "shop.yaml", SchemaLoader.none()))
        .contains("private final @Nullable Double priceGbp;");
  }

  @Test
  void equalsComparesFieldsEvenWhenOneIsNamedLikeTheParameter() {
    SchemaDefinition schema = SchemaParser.parse("""
        schema:
          name: Point
          description: A labelled point
        fields:
          - name: o
            type: string
            description: Origin label
          - name: that
            type: integer
            description: Offset
        """, "point.yaml");

    String content = generator.generate(schema, "point.yaml", SchemaLoader.none());

    assertThat(content).contains("Objects.equals(this.o, that.o)");
    assertThat(content).contains("Objects.equals(this.that, that.that)");
    assertThat(content).doesNotContain("Objects.equals(o, that.o)");
  }
}
