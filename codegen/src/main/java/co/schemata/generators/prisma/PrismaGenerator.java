package co.schemata.generators.prisma;

import co.schemata.core.InheritanceResolver;
import co.schemata.core.SchemaLoader;
import co.schemata.core.errors.UnsupportedTypeException;
import co.schemata.core.model.DefaultValue;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.model.Target;
import co.schemata.core.model.TargetOverride;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TypeCatalog;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Generates Prisma models from schemas.
 *
 * <p>A model holds one column per resolved field that is not skipped for storage, in
 * resolved order, followed by {@code @@index} directives for indexed fields that are
 * neither primary key nor unique:
 * <pre>
 * model Venue {
 *   entity_id   String   &#64;id &#64;default(cuid())
 *   entity_name String
 *   capacity    Int?
 *
 *   &#64;@index([entity_name])
 * }
 * </pre>
 */
public class PrismaGenerator {
    private static final Logger log = LoggerFactory.getLogger(PrismaGenerator.class);

    private static final Set<String> UPDATED_AT = Set.of("updatedAt", "updated_at");

    /** Source named in the header of a combined schema file: every schema under the source root. */
    static final String ALL_SOURCES = "*.yaml";

    private final PrismaDialect dialect;
    private final PrismaTypes types;
    private final GeneratedHeader header;

    public PrismaGenerator(PrismaDialect dialect, GeneratedHeader header) {
        this.dialect = dialect;
        this.types = new PrismaTypes(dialect);
        this.header = header;
    }

    public PrismaDialect dialect() {
        return dialect;
    }

    /** A complete schema file: header, datasource and generator blocks, then the model. */
    public String generate(SchemaDefinition schema, String sourceName, SchemaLoader loader) {
        return header.lineComment(sourceName) + preamble() + "\n" + generateModel(schema, loader) + "\n";
    }

    /**
     * Several models in one schema file, in the given order. The header names
     * {@code <sourceRoot>/*.yaml} rather than each source file.
     */
    public String generateSchema(List<SchemaDefinition> schemas, SchemaLoader loader) {
        StringBuilder sb = new StringBuilder(header.lineComment(ALL_SOURCES)).append(preamble());
        for (SchemaDefinition schema : schemas) {
            sb.append("\n").append(generateModel(schema, loader)).append("\n");
        }
        return sb.toString();
    }

    /** The {@code model} block alone, without a trailing newline. */
    public String generateModel(SchemaDefinition schema, SchemaLoader loader) {
        List<Column> columns = new ArrayList<>();
        List<String> indexes = new ArrayList<>();
        for (FieldDefinition f : InheritanceResolver.resolve(schema, loader)) {
            if (f.skippedFor(Target.STORAGE)) continue;
            String name = Identifiers.storageName(schema.name(), f.name(), f.nameFor(Target.STORAGE));
            columns.add(new Column(f.name(), name, TypeCatalog.mapType(schema.name(), f, types),
                attributes(schema.name(), f)));
            if (f.index() && !f.primaryKey() && !f.unique()) {
                indexes.add("@@index([" + name + "])");
            }
        }
        Identifiers.detectCollisions(schema.name(), Target.STORAGE, columns, Column::fieldName, Column::name);

        int nameWidth = columns.stream().mapToInt(c -> c.name().length()).max().orElse(0);
        int typeWidth = columns.stream().filter(c -> !c.attributes().isEmpty())
            .mapToInt(c -> c.type().length()).max().orElse(0);

        List<String> lines = new ArrayList<>();
        lines.add("model " + schema.name() + " {");
        for (Column c : columns) {
            StringBuilder line = new StringBuilder("  ").append(pad(c.name(), nameWidth)).append(' ');
            if (c.attributes().isEmpty()) {
                line.append(c.type());
            } else {
                line.append(pad(c.type(), typeWidth)).append(' ').append(String.join(" ", c.attributes()));
            }
            lines.add(line.toString());
        }
        if (!indexes.isEmpty()) {
            lines.add("");
            indexes.forEach(i -> lines.add("  " + i));
        }
        lines.add("}");

        log.debug("Generated {} model {} with {} columns and {} indexes",
            dialect.provider(), schema.name(), columns.size(), indexes.size());
        return String.join("\n", lines);
    }

    private String preamble() {
        return String.join("\n",
            "datasource db {",
            "  provider = \"" + dialect.provider() + "\"",
            "  url      = env(\"DATABASE_URL\")",
            "}",
            "",
            "generator client {",
            "  provider = \"prisma-client-js\"",
            "}",
            "");
    }

    // =========================================================================
    // Attributes
    // =========================================================================

    /**
     * {@code @id}, {@code @unique}, {@code @default(...)}, {@code @updatedAt}, in that order.
     * A {@code storage.attributes} override replaces the computed list.
     */
    private List<String> attributes(String schemaName, FieldDefinition f) {
        List<String> declared = f.override(Target.STORAGE).map(TargetOverride::attributes).orElse(null);
        if (declared != null) return declared;

        List<String> attrs = new ArrayList<>();
        if (f.primaryKey()) attrs.add("@id");
        if (f.unique() && !f.primaryKey()) attrs.add("@unique");

        String value = defaultExpression(schemaName, f);
        if (value == null && f.primaryKey()) value = keyDefault(f.type());
        if (value != null) attrs.add("@default(" + value + ")");

        if (UPDATED_AT.contains(f.name())) attrs.add("@updatedAt");
        return attrs;
    }

    private static String keyDefault(LogicalType type) {
        return switch (type.kind()) {
            case STRING -> "cuid()";
            case INTEGER -> "autoincrement()";
            default -> null;
        };
    }

    private static String defaultExpression(String schemaName, FieldDefinition f) {
        DefaultValue d = f.defaultFor(Target.STORAGE);
        if (d == null) return null;

        LogicalType type = f.type();
        String where = "default '" + d.text() + "'";
        switch (d.kind()) {
            case GENERATE_UNIQUE_ID: {
                String key = keyDefault(type);
                if (key == null) {
                    throw new UnsupportedTypeException(schemaName, f.name(), Target.STORAGE.key(), type.toString(),
                        where + " requires a string or integer field");
                }
                return key;
            }
            case CURRENT_TIMESTAMP:
                if (type.kind() != LogicalType.Kind.DATETIME) {
                    throw new UnsupportedTypeException(schemaName, f.name(), Target.STORAGE.key(), type.toString(),
                        where + " requires a datetime field");
                }
                return "now()";
            default:
                break;
        }

        Object literal = d.literal();
        if (literal instanceof Boolean b) return b.toString();
        if (literal instanceof Number n) return n.toString();
        if (literal instanceof String s) {
            if (type.kind() == LogicalType.Kind.STRING || type.kind() == LogicalType.Kind.JSON) return quote(s);
            return s;
        }
        throw new UnsupportedTypeException(schemaName, f.name(), Target.STORAGE.key(), type.toString(),
            where + " has no Prisma literal form");
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }

    private record Column(String fieldName, String name, String type, List<String> attributes) {}
}
