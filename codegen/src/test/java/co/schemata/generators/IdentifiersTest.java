package co.schemata.generators;

import co.schemata.core.errors.IdentifierCollisionException;
import co.schemata.core.errors.InvalidIdentifierException;
import co.schemata.core.model.Target;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

public class IdentifiersTest {

  @Test
  void javaNameConvertsToCamelCase() {
    assertThat(Identifiers.javaName("entity_name")).isEqualTo("entityName");
    assertThat(Identifiers.javaName("opening-hours")).isEqualTo("openingHours");
    assertThat(Identifiers.javaName("TTL")).isEqualTo("ttl");
    assertThat(Identifiers.javaName("alreadyCamel")).isEqualTo("alreadyCamel");
  }

  @Test
  void javaNameEscapesKeywordsAndLeadingDigits() {
    assertThat(Identifiers.javaName("class")).isEqualTo("class_");
    assertThat(Identifiers.javaName("2fa-code")).isEqualTo("_2faCode");
  }

  @Test
  void javaTypeNameCapitalizes() {
    assertThat(Identifiers.javaTypeName("Venue")).isEqualTo("Venue");
    assertThat(Identifiers.javaTypeName("event_series")).isEqualTo("EventSeries");
  }

  @Test
  void javaFieldNameRejectsNamesThatAreNotOneIdentifier() {
    assertThat(Identifiers.javaFieldName("Shop", Target.RECORD, "unit_price", "unit_price")).isEqualTo("unitPrice");

    assertThatThrownBy(() -> Identifiers.javaFieldName("Shop", Target.RECORD, "price.gbp", "price.gbp"))
        .isInstanceOf(InvalidIdentifierException.class)
        .hasMessageContaining("Shop.price.gbp [record]")
        .hasMessageContaining("does not convert to a Java identifier")
        .hasMessageContaining("Add a record name override");
    assertThatThrownBy(() -> Identifiers.javaFieldName("Shop", Target.EXTRACTION, "price", "price/gbp"))
        .isInstanceOf(InvalidIdentifierException.class)
        .hasMessageContaining("[extraction]");
  }

  @Test
  void storageNameMustBeAPrismaIdentifier() {
    assertThat(Identifiers.storageName("Shop", "unit_price", "unit_price")).isEqualTo("unit_price");

    assertThatThrownBy(() -> Identifiers.storageName("Shop", "price.gbp", "price.gbp"))
        .isInstanceOf(InvalidIdentifierException.class)
        .hasMessageContaining("Shop.price.gbp [storage]")
        .hasMessageContaining("not a valid Prisma field name");
    assertThatThrownBy(() -> Identifiers.storageName("Shop", "opening-hours", "opening-hours"))
        .isInstanceOf(InvalidIdentifierException.class);
    assertThatThrownBy(() -> Identifiers.storageName("Shop", "_rank", "_rank"))
        .isInstanceOf(InvalidIdentifierException.class);
  }

  @Test
  void tsPropertyNameQuotesNonIdentifiers() {
    assertThat(Identifiers.tsPropertyName("entity_name")).isEqualTo("entity_name");
    assertThat(Identifiers.tsPropertyName("opening-hours")).isEqualTo("\"opening-hours\"");
  }

  @Test
  void detectCollisionsNamesAllConflictingFields() {
    List<String> fields = List.of("entity_name", "entityName", "slug");

    assertThatThrownBy(() -> Identifiers.detectCollisions("Venue", Target.RECORD, fields,
        Function.identity(), Identifiers::javaName))
        .isInstanceOf(IdentifierCollisionException.class)
        .hasMessageContaining("Venue [record]")
        .hasMessageContaining("[entity_name, entityName]")
        .hasMessageContaining("'entityName'");
  }

  @Test
  void detectCollisionsAcceptsDistinctIdentifiers() {
    assertThatCode(() -> Identifiers.detectCollisions("Venue", Target.RECORD, List.of("a_b", "a_c"),
        Function.identity(), Identifiers::javaName))
        .doesNotThrowAnyException();
  }
}
