package co.schemata.generators;

import co.schemata.generators.prisma.PrismaDialect;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class CompilerOptionsTest {

  @Test
  void defaults() {
    CompilerOptions options = CompilerOptions.defaults();

    assertThat(options.javaPackage()).isEqualTo("co.schemata.generated");
    assertThat(options.dialect()).isEqualTo(PrismaDialect.POSTGRESQL);
    assertThat(options.runtimeValidation()).isTrue();
    assertThat(options.sourceRoot()).isEqualTo("schemas");
    assertThat(options.extractionPackage()).isEqualTo("co.schemata.generated.extraction");
  }

  @Test
  void emptyDocumentsYieldDefaults() {
    assertThat(CompilerOptions.fromJson("{}")).isEqualTo(CompilerOptions.defaults());
    assertThat(CompilerOptions.fromYaml("")).isEqualTo(CompilerOptions.defaults());
    assertThat(CompilerOptions.fromJson(null)).isEqualTo(CompilerOptions.defaults());
  }

  @Test
  void readsYaml() {
    CompilerOptions options = CompilerOptions.fromYaml("""
        javaPackage: com.acme.model
        dialect: SQLite
        runtimeValidation: false
        futureSetting: ignored
        """);

    assertThat(options.javaPackage()).isEqualTo("com.acme.model");
    assertThat(options.dialect()).isEqualTo(PrismaDialect.SQLITE);
    assertThat(options.runtimeValidation()).isFalse();
    assertThat(options.sourceRoot()).isEqualTo("schemas");
  }

  @Test
  void readsJson() {
    CompilerOptions options = CompilerOptions.fromJson(
        "{\"sourceRoot\": \"engine/config/schemas\", \"dialect\": \"postgresql\"}");

    assertThat(options.sourceRoot()).isEqualTo("engine/config/schemas");
    assertThat(options.dialect()).isEqualTo(PrismaDialect.POSTGRESQL);
    assertThat(options.javaPackage()).isEqualTo("co.schemata.generated");
  }

  @Test
  void rejectsUnknownDialect() {
    assertThatThrownBy(() -> CompilerOptions.fromYaml("dialect: mysql"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid compiler options");
  }

  @Test
  void rejectsInvalidPackage() {
    assertThatThrownBy(() -> new CompilerOptions("com.acme.2model", PrismaDialect.POSTGRESQL, true, "schemas"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not a valid Java package name");
  }

  @Test
  void withersKeepOtherSettings() {
    CompilerOptions options = CompilerOptions.defaults()
        .withDialect(PrismaDialect.SQLITE)
        .withRuntimeValidation(false);

    assertThat(options.dialect()).isEqualTo(PrismaDialect.SQLITE);
    assertThat(options.runtimeValidation()).isFalse();
    assertThat(options.javaPackage()).isEqualTo(CompilerOptions.DEFAULT_PACKAGE);
  }
}
