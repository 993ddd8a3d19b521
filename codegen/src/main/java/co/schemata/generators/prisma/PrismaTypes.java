package co.schemata.generators.prisma;

import co.schemata.core.model.Target;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TargetTypes;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prisma scalar types for one dialect. Lists have no canonical column type: a list field
 * must state its storage type or be skipped.
 */
public final class PrismaTypes implements TargetTypes<String> {

    // type token followed by optional native attributes, e.g. "String[]" or "String @db.Text"
    private static final Pattern OVERRIDE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)(\\[\\])?(\\?)?(\\s+@.*)?$");

    private final PrismaDialect dialect;

    public PrismaTypes(PrismaDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public Target target() {
        return Target.STORAGE;
    }

    @Override
    public Optional<String> canonical(LogicalType type) {
        return switch (type.kind()) {
            case STRING -> Optional.of("String");
            case INTEGER -> Optional.of("Int");
            case FLOAT -> Optional.of("Float");
            case BOOLEAN -> Optional.of("Boolean");
            case DATETIME -> Optional.of("DateTime");
            case JSON -> Optional.of(dialect.nativeJson() ? "Json" : "String");
            case LIST -> Optional.empty();
        };
    }

    @Override
    public String nullable(String expression) {
        return expression + "?";
    }

    @Override
    public String explicit(String expression) {
        Matcher m = OVERRIDE.matcher(expression);
        if (!m.matches()) {
            throw new IllegalArgumentException("not a Prisma field type");
        }
        if (!dialect.nativeJson() && m.group(1).equals("Json")) {
            throw new IllegalArgumentException(dialect.provider() + " has no Json columns");
        }
        if (!dialect.scalarLists() && m.group(2) != null) {
            throw new IllegalArgumentException(dialect.provider() + " has no scalar list columns");
        }
        return expression;
    }

    @Override
    public String unsupportedHint(LogicalType type) {
        if (!type.isList()) return "";
        return dialect.scalarLists()
            ? "; declare targets.storage.type (e.g. " + canonical(type.elementType()).orElseThrow()
                + "[]) or targets.storage.skip"
            : "; " + dialect.provider() + " has no list columns, declare a scalar targets.storage.type"
                + " (e.g. String) or targets.storage.skip";
    }
}
