package co.schemata.compiler;

import co.schemata.core.SchemaParser;
import co.schemata.core.SchemaRegistry;
import co.schemata.core.SchemaSource;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.model.Target;
import co.schemata.generators.CompilerOptions;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.Identifiers;
import co.schemata.generators.java.ExtractionModelGenerator;
import co.schemata.generators.java.RecordGenerator;
import co.schemata.generators.prisma.PrismaGenerator;
import co.schemata.generators.typescript.TypeScriptGenerator;
import co.schemata.sync.SchemaSyncChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entry point for callers that compile a batch of schema sources: parse, resolve inheritance
 * within the batch, run the selected generators and return the generated files.
 *
 * <p>Nothing is written to disk and no state survives a call. The first schema error aborts
 * the batch and propagates as a {@link co.schemata.core.errors.SchemaException}.
 */
public class SchemaCompiler {
    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    private final CompilerOptions options;
    private final RecordGenerator records;
    private final ExtractionModelGenerator extractionModels;
    private final PrismaGenerator storage;
    private final TypeScriptGenerator interfaces;

    public SchemaCompiler(CompilerOptions options) {
        this(options, Clock.systemDefaultZone());
    }

    public SchemaCompiler(CompilerOptions options, Clock clock) {
        GeneratedHeader header = new GeneratedHeader(options.sourceRoot(), clock);
        this.options = options;
        this.records = new RecordGenerator(options, header);
        this.extractionModels = new ExtractionModelGenerator(options, header);
        this.storage = new PrismaGenerator(options.dialect(), header);
        this.interfaces = new TypeScriptGenerator(options.runtimeValidation(), header);
    }

    public List<GeneratedArtifact> compileAll(List<SchemaSource> sources) {
        return compile(sources, EnumSet.allOf(Target.class));
    }

    /** Artifacts per source in source order, and per source in {@link Target} order. */
    public List<GeneratedArtifact> compile(List<SchemaSource> sources, Set<Target> targets) {
        List<SchemaDefinition> schemas = new ArrayList<>(sources.size());
        for (SchemaSource source : sources) {
            schemas.add(SchemaParser.parse(source.text(), source.name()));
        }
        SchemaRegistry registry = SchemaRegistry.of(schemas);

        Set<Target> selected = EnumSet.noneOf(Target.class);
        selected.addAll(targets);

        List<GeneratedArtifact> artifacts = new ArrayList<>();
        for (int i = 0; i < sources.size(); i++) {
            String sourceName = sources.get(i).name();
            SchemaDefinition schema = schemas.get(i);
            for (Target target : selected) {
                artifacts.add(new GeneratedArtifact(sourceName, target, path(schema, target),
                    generate(schema, sourceName, target, registry)));
            }
        }
        log.info("Compiled {} schemas into {} artifacts ({})", sources.size(), artifacts.size(), selected);
        return artifacts;
    }

    /** A drift checker that regenerates with this compiler's settings. */
    public SchemaSyncChecker checker() {
        return new SchemaSyncChecker(records);
    }

    private String generate(SchemaDefinition schema, String sourceName, Target target, SchemaRegistry registry) {
        return switch (target) {
            case RECORD -> records.generate(schema, sourceName, registry);
            case STORAGE -> storage.generate(schema, sourceName, registry);
            case INTERFACE -> interfaces.generate(schema, sourceName);
            case EXTRACTION -> extractionModels.generate(schema, sourceName, registry);
        };
    }

    String path(SchemaDefinition schema, Target target) {
        String lower = schema.name().toLowerCase(Locale.ROOT);
        return switch (target) {
            case RECORD -> packagePath(options.javaPackage()) + Identifiers.javaTypeName(schema.name()) + ".java";
            case STORAGE -> lower + ".prisma";
            case INTERFACE -> lower + ".ts";
            case EXTRACTION -> packagePath(options.extractionPackage())
                + ExtractionModelGenerator.className(schema.name()) + ".java";
        };
    }

    private static String packagePath(String pkg) {
        return pkg.replace('.', '/') + "/";
    }
}
