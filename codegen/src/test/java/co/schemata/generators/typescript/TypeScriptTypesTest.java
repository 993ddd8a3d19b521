package co.schemata.generators.typescript;

import co.schemata.core.model.FieldDefinition;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TypeCatalog;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

public class TypeScriptTypesTest {

  private final TypeScriptTypes typescript = new TypeScriptTypes();
  private final ZodTypes zod = new ZodTypes();

  private static LogicalType type(String label) {
    return LogicalType.parse(label).orElseThrow();
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "string        | string              | z.string()",
      "integer       | number              | z.number().int()",
      "float         | number              | z.number()",
      "boolean       | boolean             | z.boolean()",
      "datetime      | Date                | z.date()",
      "json          | Record<string, any> | z.record(z.string(), z.any())",
      "list[string]  | string[]            | z.array(z.string())",
      "list[integer] | number[]            | z.array(z.number().int())",
      "list[float]   | number[]            | z.array(z.number())",
      "list[boolean] | boolean[]           | z.array(z.boolean())",
  })
  void mapsEveryLogicalType(String logical, String tsType, String zodType) {
    FieldDefinition required = FieldDefinition.builder("value", type(logical)).required(true).build();
    FieldDefinition optional = FieldDefinition.builder("value", type(logical)).build();

    assertThat(TypeCatalog.mapType("Sample", required, typescript)).isEqualTo(tsType);
    assertThat(TypeCatalog.mapType("Sample", optional, typescript)).isEqualTo(tsType + " | null");
    assertThat(TypeCatalog.mapType("Sample", required, zod)).isEqualTo(zodType);
    assertThat(TypeCatalog.mapType("Sample", optional, zod)).isEqualTo(zodType + ".nullable()");
  }
}
