package co.schemata.generators.java;

import co.schemata.core.errors.UnsupportedTypeException;
import co.schemata.core.model.DefaultValue;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.Target;
import co.schemata.core.types.LogicalType;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static co.schemata.generators.Identifiers.cap;

/**
 * Plain-Java boilerplate shared by the generated record and extraction classes:
 * constructors, accessors, builder, equals/hashCode/toString.
 */
final class JavaSources {

    static final ClassName OBJECTS = ClassName.get("java.util", "Objects");
    static final ClassName UUID = ClassName.get("java.util", "UUID");

    /**
     * One generated member.
     *
     * @param fieldName   name as declared in the schema
     * @param codeName    Java identifier
     * @param nullable    whether {@code null} is an accepted value
     * @param initializer builder default, {@code null} when there is none
     */
    record PlainField(
        String fieldName,
        String codeName,
        TypeName type,
        boolean nullable,
        CodeBlock initializer
    ) {
        boolean rejectsNull() {
            return !nullable && !type.isPrimitive();
        }
    }

    private JavaSources() {}

    static void addFinalFields(TypeSpec.Builder tb, List<PlainField> fields, List<FieldDefinition> sources) {
        for (int i = 0; i < fields.size(); i++) {
            PlainField f = fields.get(i);
            FieldSpec.Builder fb = FieldSpec.builder(f.type(), f.codeName(), Modifier.PRIVATE, Modifier.FINAL);
            String description = sources.get(i).description();
            if (description != null && !description.isBlank()) {
                fb.addJavadoc("$L\n", description.strip());
            }
            tb.addField(fb.build());
        }
    }

    /** All-args constructor; non-nullable reference members are checked with {@code requireNonNull}. */
    static void addConstructor(TypeSpec.Builder tb, List<PlainField> fields) {
        MethodSpec.Builder allArgs = MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC);
        for (PlainField f : fields) {
            allArgs.addParameter(f.type(), f.codeName());
        }
        for (PlainField f : fields) {
            if (f.rejectsNull()) {
                allArgs.addStatement("this.$L = $T.requireNonNull($L, $S)", f.codeName(), OBJECTS, f.codeName(),
                    f.fieldName() + " is required");
            } else {
                allArgs.addStatement("this.$L = $L", f.codeName(), f.codeName());
            }
        }
        tb.addMethod(allArgs.build());
    }

    static void addGetters(TypeSpec.Builder tb, List<PlainField> fields) {
        for (PlainField f : fields) {
            tb.addMethod(MethodSpec.methodBuilder("get" + cap(f.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .returns(f.type())
                .addStatement("return $L", f.codeName())
                .build());
        }
    }

    /**
     * Emit a static {@code Builder} inner class and a {@code builder()} factory method.
     */
    static void addBuilderClass(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName builderRef = ClassName.bestGuess("Builder");
        ClassName entityRef = ClassName.bestGuess(className);

        tb.addMethod(MethodSpec.methodBuilder("builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(builderRef)
            .addStatement("return new Builder()")
            .build());

        TypeSpec.Builder builderTb = TypeSpec.classBuilder("Builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL);

        for (PlainField f : fields) {
            FieldSpec.Builder fb = FieldSpec.builder(f.type(), f.codeName(), Modifier.PRIVATE);
            if (f.initializer() != null) {
                fb.initializer(f.initializer());
            }
            builderTb.addField(fb.build());
        }

        builderTb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());

        for (PlainField f : fields) {
            builderTb.addMethod(MethodSpec.methodBuilder(f.codeName())
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type(), f.codeName())
                .returns(builderRef)
                .addStatement("this.$L = $L", f.codeName(), f.codeName())
                .addStatement("return this")
                .build());
        }

        String argList = fields.stream().map(PlainField::codeName).collect(Collectors.joining(", "));
        builderTb.addMethod(MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(entityRef)
            .addStatement("return new $T($L)", entityRef, argList)
            .build());

        tb.addType(builderTb.build());
    }

    static void addEqualsHashCodeToString(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName entityRef = ClassName.bestGuess(className);

        MethodSpec.Builder equalsMethod = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(ClassName.OBJECT, "o");
        equalsMethod.addStatement("if (this == o) return true");
        equalsMethod.addStatement("if (!(o instanceof $T)) return false", entityRef);
        if (fields.isEmpty()) {
            equalsMethod.addStatement("return true");
        } else {
            equalsMethod.addStatement("$T that = ($T) o", entityRef, entityRef);
            StringBuilder condExpr = new StringBuilder("return ");
            List<Object> condArgs = new ArrayList<>();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) condExpr.append("\n    && ");
                condExpr.append("$T.equals(this.$L, that.$L)");
                condArgs.add(OBJECTS);
                condArgs.add(fields.get(i).codeName());
                condArgs.add(fields.get(i).codeName());
            }
            equalsMethod.addStatement(condExpr.toString(), condArgs.toArray());
        }
        tb.addMethod(equalsMethod.build());

        MethodSpec.Builder hashCodeMethod = MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class);
        if (fields.isEmpty()) {
            hashCodeMethod.addStatement("return 0");
        } else {
            String hashArgs = fields.stream().map(PlainField::codeName).collect(Collectors.joining(", "));
            hashCodeMethod.addStatement("return $T.hash($L)", OBJECTS, hashArgs);
        }
        tb.addMethod(hashCodeMethod.build());

        MethodSpec.Builder toStringMethod = MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ClassName.get(String.class));
        if (fields.isEmpty()) {
            toStringMethod.addStatement("return $S", className + "{}");
        } else {
            StringBuilder tsExpr = new StringBuilder("return $S + $L");
            List<Object> tsArgs = new ArrayList<>();
            tsArgs.add(className + "{" + fields.get(0).codeName() + "=");
            tsArgs.add(fields.get(0).codeName());
            for (int i = 1; i < fields.size(); i++) {
                tsExpr.append("\n    + $S + $L");
                tsArgs.add(", " + fields.get(i).codeName() + "=");
                tsArgs.add(fields.get(i).codeName());
            }
            tsExpr.append(" + $S");
            tsArgs.add("}");
            toStringMethod.addStatement(tsExpr.toString(), tsArgs.toArray());
        }
        tb.addMethod(toStringMethod.build());
    }

    /**
     * Builder initializer for a field default. Generation tokens become expressions evaluated
     * per builder: {@code generate-unique-id} a random UUID string, {@code current-timestamp}
     * {@code Instant.now()}. Returns {@code null} when there is no default.
     *
     * <p>Literals are formatted by logical type:
     * <ul>
     *   <li>{@code string}   → {@code "text"}</li>
     *   <li>{@code integer}  → long literal, e.g. {@code 0L}</li>
     *   <li>{@code float}    → double literal, e.g. {@code 0.5}</li>
     *   <li>{@code boolean}  → {@code true} / {@code false}</li>
     *   <li>{@code datetime} → {@code Instant.parse("...")}</li>
     * </ul>
     */
    static CodeBlock defaultInitializer(String schemaName, FieldDefinition field, Target target) {
        DefaultValue d = field.defaultFor(target);
        if (d == null) return null;

        LogicalType type = field.type();
        String where = "default '" + d.text() + "'";
        if (field.typeFor(target).isPresent()) {
            throw new UnsupportedTypeException(schemaName, field.name(), target.key(), field.typeFor(target).get(),
                where + " cannot be combined with an explicit type override");
        }

        switch (d.kind()) {
            case GENERATE_UNIQUE_ID:
                if (type.kind() == LogicalType.Kind.STRING) {
                    return CodeBlock.of("$T.randomUUID().toString()", UUID);
                }
                // integer keys are assigned by storage
                if (type.kind() == LogicalType.Kind.INTEGER) return null;
                throw new UnsupportedTypeException(schemaName, field.name(), target.key(), type.toString(),
                    where + " requires a string or integer field");
            case CURRENT_TIMESTAMP:
                if (type.kind() == LogicalType.Kind.DATETIME) {
                    return CodeBlock.of("$T.now()", JavaTypes.INSTANT);
                }
                throw new UnsupportedTypeException(schemaName, field.name(), target.key(), type.toString(),
                    where + " requires a datetime field");
            default:
                break;
        }

        Object literal = d.literal();
        try {
            return switch (type.kind()) {
                case STRING -> CodeBlock.of("$S", literal.toString());
                case INTEGER -> CodeBlock.of("$LL", new java.math.BigDecimal(literal.toString()).longValueExact());
                case FLOAT -> CodeBlock.of("$L", Double.parseDouble(literal.toString()));
                case BOOLEAN -> CodeBlock.of("$L", parseBoolean(literal));
                case DATETIME -> CodeBlock.of("$T.parse($S)", JavaTypes.INSTANT,
                    java.time.Instant.parse(literal.toString()).toString());
                case JSON, LIST -> throw new UnsupportedTypeException(schemaName, field.name(), target.key(),
                    type.toString(), where + " has no Java literal form for " + type);
            };
        } catch (NumberFormatException | ArithmeticException | java.time.format.DateTimeParseException e) {
            throw new UnsupportedTypeException(schemaName, field.name(), target.key(), type.toString(),
                where + " is not a valid " + type + " value");
        }
    }

    private static boolean parseBoolean(Object literal) {
        if (literal instanceof Boolean b) return b;
        String s = literal.toString();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        throw new NumberFormatException(s);
    }
}
