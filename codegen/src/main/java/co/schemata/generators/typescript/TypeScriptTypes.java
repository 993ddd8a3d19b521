package co.schemata.generators.typescript;

import co.schemata.core.model.Target;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TargetTypes;

import java.util.Optional;

/** TypeScript spelling of the logical types; nullable members become {@code T | null}. */
public final class TypeScriptTypes implements TargetTypes<String> {

    @Override
    public Target target() {
        return Target.INTERFACE;
    }

    @Override
    public Optional<String> canonical(LogicalType type) {
        return Optional.of(switch (type.kind()) {
            case STRING -> "string";
            case INTEGER, FLOAT -> "number";
            case BOOLEAN -> "boolean";
            case DATETIME -> "Date";
            case JSON -> "Record<string, any>";
            case LIST -> canonical(type.elementType()).orElseThrow() + "[]";
        });
    }

    @Override
    public String nullable(String expression) {
        return expression + " | null";
    }

    @Override
    public String explicit(String expression) {
        return checkedExpression(expression);
    }

    /** An override must be a single type expression; it is emitted verbatim. */
    static String checkedExpression(String expression) {
        if (expression.indexOf(';') >= 0 || expression.indexOf('\n') >= 0 || expression.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("not a single TypeScript type expression");
        }
        return expression;
    }
}
