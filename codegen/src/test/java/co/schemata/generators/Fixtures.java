package co.schemata.generators;

import co.schemata.core.SchemaParser;
import co.schemata.core.SchemaRegistry;
import co.schemata.core.SchemaSource;
import co.schemata.core.model.SchemaDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Schema fixtures under {@code src/test/resources/schemas} and a fixed clock. */
public final class Fixtures {

  public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
  public static final Clock LATER = Clock.fixed(Instant.parse("2025-01-02T08:00:00Z"), ZoneOffset.UTC);

  private Fixtures() {}

  public static GeneratedHeader header() {
    return new GeneratedHeader("schemas", CLOCK);
  }

  public static String read(String fileName) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/schemas/" + fileName)) {
      if (in == null) throw new IllegalArgumentException("no fixture " + fileName);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static SchemaSource source(String fileName) {
    return new SchemaSource(fileName, read(fileName));
  }

  public static SchemaDefinition parse(String fileName) {
    return SchemaParser.parse(read(fileName), fileName);
  }

  public static SchemaRegistry registry(String... fileNames) {
    return SchemaRegistry.of(Arrays.stream(fileNames).map(Fixtures::parse).collect(Collectors.toList()));
  }
}
