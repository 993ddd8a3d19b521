package co.schemata.generators.typescript;

import co.schemata.core.model.Target;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TargetTypes;

import java.util.Optional;

/**
 * Zod validators matching {@link TypeScriptTypes} member for member. An interface type
 * override cannot be translated into a validator, so it becomes {@code z.custom<T>()}.
 */
public final class ZodTypes implements TargetTypes<String> {

    @Override
    public Target target() {
        return Target.INTERFACE;
    }

    @Override
    public Optional<String> canonical(LogicalType type) {
        return Optional.of(switch (type.kind()) {
            case STRING -> "z.string()";
            case INTEGER -> "z.number().int()";
            case FLOAT -> "z.number()";
            case BOOLEAN -> "z.boolean()";
            case DATETIME -> "z.date()";
            case JSON -> "z.record(z.string(), z.any())";
            case LIST -> "z.array(" + canonical(type.elementType()).orElseThrow() + ")";
        });
    }

    @Override
    public String nullable(String expression) {
        return expression + ".nullable()";
    }

    @Override
    public String explicit(String expression) {
        return "z.custom<" + TypeScriptTypes.checkedExpression(expression) + ">()";
    }
}
