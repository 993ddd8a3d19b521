package co.schemata.sync;

import co.schemata.core.SchemaRegistry;
import co.schemata.core.SchemaSource;
import co.schemata.generators.CompilerOptions;
import co.schemata.generators.Fixtures;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.java.RecordGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class SchemaSyncCheckerTest {

  private SchemaSyncChecker checker;
  private List<SchemaSource> sources;
  private Map<String, String> committed;

  @BeforeEach
  void setUp() {
    checker = new SchemaSyncChecker(new RecordGenerator(CompilerOptions.defaults(), Fixtures.header()));
    sources = List.of(Fixtures.source("listing.yaml"), Fixtures.source("venue.yaml"));

    // committed a year later; only the timestamp line differs
    RecordGenerator earlierRun = new RecordGenerator(CompilerOptions.defaults(),
        new GeneratedHeader("schemas", Fixtures.LATER));
    SchemaRegistry registry = Fixtures.registry("listing.yaml", "venue.yaml");
    committed = new HashMap<>();
    committed.put("listing.yaml", earlierRun.generate(registry.load("Listing").orElseThrow(), "listing.yaml", registry));
    committed.put("venue.yaml", earlierRun.generate(registry.load("Venue").orElseThrow(), "venue.yaml", registry));
  }

  @Test
  void unchangedArtifactsAreInSync() {
    DriftReport report = checker.check(sources, committed);

    assertThat(report.hasDrift()).isFalse();
    assertThat(report.results()).extracting(SyncResult::status)
        .containsExactly(SyncResult.Status.IN_SYNC, SyncResult.Status.IN_SYNC);
    assertThat(report.results()).extracting(SyncResult::schemaName).containsExactly("Listing", "Venue");
    assertThat(report.summary()).isEqualTo("2 of 2 schemas in sync");
  }

  @Test
  void windowsLineEndingsAreNotDrift() {
    committed.put("venue.yaml", committed.get("venue.yaml").replace("\n", "\r\n"));

    assertThat(checker.check(sources, committed).hasDrift()).isFalse();
  }

  @Test
  void editedArtifactIsReportedWithFirstDifferingLine() {
    committed.put("venue.yaml", committed.get("venue.yaml").replace("private final @Nullable Long capacity;",
        "private final @Nullable Integer capacity;"));

    DriftReport report = checker.check(sources, committed);

    assertThat(report.hasDrift()).isTrue();
    assertThat(report.drifted()).hasSize(1);
    SyncResult result = report.drifted().get(0);
    assertThat(result.sourceName()).isEqualTo("venue.yaml");
    assertThat(result.status()).isEqualTo(SyncResult.Status.DRIFTED);
    assertThat(result.message())
        .startsWith("line ")
        .contains("expected 'private final @Nullable Long capacity;'")
        .contains("but found 'private final @Nullable Integer capacity;'");
    assertThat(report.summary()).startsWith("1 of 2 schemas in sync\n  venue.yaml: DRIFTED (line ");
  }

  @Test
  void schemaChangeWithoutRegenerationIsDrift() {
    String venue = Fixtures.read("venue.yaml").replace("extraction_fields:", String.join("\n",
        "  - name: wheelchair_access",
        "    type: boolean",
        "    description: Step-free access",
        "extraction_fields:"));
    List<SchemaSource> changed = List.of(Fixtures.source("listing.yaml"), new SchemaSource("venue.yaml", venue));

    DriftReport report = checker.check(changed, committed);

    assertThat(report.results().get(0).inSync()).isTrue();
    assertThat(report.results().get(1).status()).isEqualTo(SyncResult.Status.DRIFTED);
  }

  @Test
  void missingArtifactIsReported() {
    committed.remove("listing.yaml");

    DriftReport report = checker.check(sources, committed);

    assertThat(report.results().get(0).status()).isEqualTo(SyncResult.Status.MISSING);
    assertThat(report.results().get(0).message()).isEqualTo("no committed record artifact");
    assertThat(report.results().get(1).inSync()).isTrue();
  }

  @Test
  void unparseableSourceFailsWithoutStoppingTheRun() {
    List<SchemaSource> withBroken = List.of(
        new SchemaSource("broken.yaml", "schema: [unclosed"),
        Fixtures.source("listing.yaml"));

    DriftReport report = checker.check(withBroken, committed);

    SyncResult broken = report.results().get(0);
    assertThat(broken.status()).isEqualTo(SyncResult.Status.FAILED);
    assertThat(broken.schemaName()).isNull();
    assertThat(broken.message()).contains("broken.yaml");
    assertThat(report.results().get(1).inSync()).isTrue();
  }

  @Test
  void missingParentFailsTheChildOnly() {
    DriftReport report = checker.check(List.of(Fixtures.source("venue.yaml")), committed);

    SyncResult venue = report.results().get(0);
    assertThat(venue.status()).isEqualTo(SyncResult.Status.FAILED);
    assertThat(venue.message()).contains("parent schema 'Listing' not found");
  }

  @Test
  void duplicateSchemaNameFailsTheSecondSource() {
    List<SchemaSource> duplicated = List.of(
        Fixtures.source("listing.yaml"),
        new SchemaSource("listing-copy.yaml", Fixtures.read("listing.yaml")));

    DriftReport report = checker.check(duplicated, committed);

    assertThat(report.results().get(0).inSync()).isTrue();
    SyncResult copy = report.results().get(1);
    assertThat(copy.status()).isEqualTo(SyncResult.Status.FAILED);
    assertThat(copy.message()).isEqualTo("schema name 'Listing' is already declared by listing.yaml");
  }

  @Test
  void firstDifferenceReportsLineCountMismatch() {
    assertThat(SchemaSyncChecker.firstDifference("a\nb\nc", "a\nb"))
        .isEqualTo("committed artifact has 2 lines, regenerated has 3");
    assertThat(SchemaSyncChecker.firstDifference("a\nb", "a\n  c"))
        .isEqualTo("line 2 differs: expected 'b' but found 'c'");
  }
}
