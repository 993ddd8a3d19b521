package co.schemata.sync;

import co.schemata.core.SchemaParser;
import co.schemata.core.SchemaRegistry;
import co.schemata.core.SchemaSource;
import co.schemata.core.errors.SchemaException;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.java.RecordGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects drift between schema sources and their committed record artifacts.
 *
 * <p>Every source is re-parsed and its record class regenerated; the result is compared
 * with the committed text after dropping {@code Generated at:} lines on both sides. Drift
 * and per-source failures are reported, never thrown, so one run covers every source.
 */
public class SchemaSyncChecker {
    private static final Logger log = LoggerFactory.getLogger(SchemaSyncChecker.class);

    private final RecordGenerator generator;

    public SchemaSyncChecker(RecordGenerator generator) {
        this.generator = generator;
    }

    /**
     * @param sources   schema sources, checked in order
     * @param committed committed record artifacts keyed by schema source name
     */
    public DriftReport check(List<SchemaSource> sources, Map<String, String> committed) {
        Map<String, SyncResult> failures = new HashMap<>();
        Map<String, SchemaDefinition> parsed = new LinkedHashMap<>();
        Map<String, String> declaredIn = new HashMap<>();

        for (SchemaSource source : sources) {
            try {
                SchemaDefinition schema = SchemaParser.parse(source.text(), source.name());
                String previous = declaredIn.putIfAbsent(schema.name(), source.name());
                if (previous != null) {
                    failures.put(source.name(), new SyncResult(source.name(), schema.name(), SyncResult.Status.FAILED,
                        "schema name '" + schema.name() + "' is already declared by " + previous));
                    continue;
                }
                parsed.put(source.name(), schema);
            } catch (SchemaException e) {
                failures.put(source.name(), new SyncResult(source.name(), null, SyncResult.Status.FAILED,
                    e.getMessage()));
            }
        }

        SchemaRegistry registry = SchemaRegistry.of(parsed.values());
        List<SyncResult> results = new ArrayList<>();
        for (SchemaSource source : sources) {
            SyncResult result = failures.get(source.name());
            if (result == null) {
                result = compare(source.name(), parsed.get(source.name()), committed.get(source.name()), registry);
            }
            report(result);
            results.add(result);
        }
        return new DriftReport(results);
    }

    private SyncResult compare(String sourceName, SchemaDefinition schema, String committed, SchemaRegistry registry) {
        if (committed == null) {
            return new SyncResult(sourceName, schema.name(), SyncResult.Status.MISSING,
                "no committed record artifact");
        }

        String generated;
        try {
            generated = generator.generate(schema, sourceName, registry);
        } catch (SchemaException e) {
            return new SyncResult(sourceName, schema.name(), SyncResult.Status.FAILED, e.getMessage());
        }

        String expected = GeneratedHeader.withoutTimestamps(generated);
        String actual = GeneratedHeader.withoutTimestamps(committed);
        if (expected.equals(actual)) {
            return new SyncResult(sourceName, schema.name(), SyncResult.Status.IN_SYNC, null);
        }
        return new SyncResult(sourceName, schema.name(), SyncResult.Status.DRIFTED, firstDifference(expected, actual));
    }

    static String firstDifference(String expected, String actual) {
        String[] e = expected.split("\n", -1);
        String[] a = actual.split("\n", -1);
        int n = Math.min(e.length, a.length);
        for (int i = 0; i < n; i++) {
            if (!e[i].equals(a[i])) {
                return "line " + (i + 1) + " differs: expected '" + e[i].strip() + "' but found '" + a[i].strip() + "'";
            }
        }
        return "committed artifact has " + a.length + " lines, regenerated has " + e.length;
    }

    private static void report(SyncResult result) {
        switch (result.status()) {
            case IN_SYNC -> log.info("{}: in sync", result.sourceName());
            case DRIFTED -> log.warn("{}: drifted, {}", result.sourceName(), result.message());
            case MISSING -> log.warn("{}: no committed record artifact", result.sourceName());
            case FAILED -> log.warn("{}: check failed, {}", result.sourceName(), result.message());
        }
    }
}
