package co.schemata.generators.java;

import co.schemata.core.model.Target;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TargetTypes;
import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Java spelling of the logical types, shared by the record and extraction targets.
 *
 * <pre>
 *   string     String              nullable: @Nullable String
 *   integer    long                nullable: @Nullable Long
 *   float      double              nullable: @Nullable Double
 *   boolean    boolean             nullable: @Nullable Boolean
 *   datetime   Instant
 *   json       Map&lt;String, Object&gt;
 *   list[T]    List&lt;T&gt;             (T boxed)
 * </pre>
 */
public final class JavaTypes implements TargetTypes<TypeName> {

    static final ClassName NULLABLE = ClassName.get("org.jspecify.annotations", "Nullable");
    static final ClassName STRING = ClassName.get(String.class);
    static final ClassName INSTANT = ClassName.get("java.time", "Instant");
    static final ClassName LIST = ClassName.get("java.util", "List");
    static final ClassName MAP = ClassName.get("java.util", "Map");

    private static final Pattern PACKAGE_PREFIX = Pattern.compile("\\b(?:[a-z_][a-z0-9_]*\\.)+(?=[A-Za-z_$])");

    private final Target target;

    public JavaTypes(Target target) {
        this.target = target;
    }

    @Override
    public Target target() {
        return target;
    }

    @Override
    public Optional<TypeName> canonical(LogicalType type) {
        TypeName java = switch (type.kind()) {
            case STRING -> STRING;
            case INTEGER -> TypeName.LONG;
            case FLOAT -> TypeName.DOUBLE;
            case BOOLEAN -> TypeName.BOOLEAN;
            case DATETIME -> INSTANT;
            case JSON -> ParameterizedTypeName.get(MAP, STRING, ClassName.OBJECT);
            case LIST -> ParameterizedTypeName.get(LIST, canonical(type.elementType()).orElseThrow().box());
        };
        return Optional.of(java);
    }

    @Override
    public TypeName nullable(TypeName expression) {
        return expression.box().annotated(AnnotationSpec.builder(NULLABLE).build());
    }

    @Override
    public TypeName explicit(String expression) {
        return JavaTypeExpressions.parse(expression);
    }

    /** {@code java.util.List<java.lang.String>} without annotations and packages: {@code List<String>}. */
    static String simpleName(TypeName type) {
        return PACKAGE_PREFIX.matcher(type.withoutAnnotations().toString()).replaceAll("");
    }
}
