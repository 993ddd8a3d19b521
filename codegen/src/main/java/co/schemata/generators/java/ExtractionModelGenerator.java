package co.schemata.generators.java;

import co.schemata.core.InheritanceResolver;
import co.schemata.core.SchemaLoader;
import co.schemata.core.errors.ValidatorException;
import co.schemata.core.model.ExtractionField;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.model.Target;
import co.schemata.core.model.TargetOverride;
import co.schemata.core.types.LogicalType;
import co.schemata.core.types.TypeCatalog;
import co.schemata.generators.CompilerOptions;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.Identifiers;
import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static co.schemata.generators.Identifiers.cap;

/**
 * Generates the lenient, Jackson-bound extraction model for a schema.
 *
 * <p>The model receives data of unknown completeness, so every member is nullable and
 * absent by default. Only {@code targets.extraction.required: true} makes a member
 * required, whatever the base schema says.
 *
 * <p>Members, in order:
 * <ol>
 *   <li>resolved base fields, minus internal ({@code exclude}) fields, primary keys and
 *       fields with {@code targets.extraction.skip}; renamed by {@code targets.extraction.name}</li>
 *   <li>{@code extraction_fields}; an entry whose name matches a base member replaces it in place</li>
 * </ol>
 */
public class ExtractionModelGenerator {
    private static final Logger log = LoggerFactory.getLogger(ExtractionModelGenerator.class);

    static final ClassName JSON_IGNORE_PROPERTIES =
        ClassName.get("com.fasterxml.jackson.annotation", "JsonIgnoreProperties");
    static final ClassName JSON_PROPERTY = ClassName.get("com.fasterxml.jackson.annotation", "JsonProperty");
    static final ClassName JSON_PROPERTY_DESCRIPTION =
        ClassName.get("com.fasterxml.jackson.annotation", "JsonPropertyDescription");
    static final ClassName JSON_CLASS_DESCRIPTION =
        ClassName.get("com.fasterxml.jackson.annotation", "JsonClassDescription");

    static final String BOOLEAN_NULL_CLAUSE = "Null means unknown, distinct from false.";
    static final String NULL_CLAUSE = "Null if not found.";

    private final String pkg;
    private final GeneratedHeader header;
    private final JavaTypes types = new JavaTypes(Target.EXTRACTION);

    public ExtractionModelGenerator(CompilerOptions options, GeneratedHeader header) {
        this.pkg = options.extractionPackage();
        this.header = header;
    }

    public static String className(String schemaName) {
        return Identifiers.javaTypeName(schemaName) + "Extraction";
    }

    public String generate(SchemaDefinition schema, String sourceName, SchemaLoader loader) {
        return generateFile(schema, sourceName, loader).toString();
    }

    public JavaFile generateFile(SchemaDefinition schema, String sourceName, SchemaLoader loader) {
        String className = className(schema.name());
        List<Member> members = members(schema, loader);

        TypeSpec.Builder tb = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC)
            .addAnnotation(AnnotationSpec.builder(JSON_IGNORE_PROPERTIES)
                .addMember("ignoreUnknown", "true")
                .build())
            .addAnnotation(AnnotationSpec.builder(JSON_CLASS_DESCRIPTION)
                .addMember("value", "$S", classDescription(schema))
                .build())
            .addJavadoc("$L\n", classDescription(schema))
            .addJavadoc("\n<p>Members are optional unless marked required for extraction.\n")
            .addJavadoc("Generated from {@code $L}.\n", sourceName);
        if (schema.hasParent()) {
            tb.addJavadoc("\n@see $T\n", ClassName.get(pkg, className(schema.extendsName())));
        }

        tb.addField(FieldSpec.builder(JavaTypes.STRING, "EXAMPLE_JSON", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Minimal payload this model accepts.\n")
            .initializer("$S", exampleJson(members))
            .build());

        for (Member m : members) {
            AnnotationSpec.Builder property = AnnotationSpec.builder(JSON_PROPERTY);
            if (m.extractionRequired()) {
                property.addMember("value", "$S", m.wireName()).addMember("required", "true");
            } else {
                property.addMember("value", "$S", m.wireName());
            }
            tb.addField(FieldSpec.builder(m.type(), m.codeName(), Modifier.PRIVATE)
                .addAnnotation(property.build())
                .addAnnotation(AnnotationSpec.builder(JSON_PROPERTY_DESCRIPTION)
                    .addMember("value", "$S", m.description())
                    .build())
                .build());
        }

        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC).build());

        for (Member m : members) {
            tb.addMethod(MethodSpec.methodBuilder("get" + cap(m.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .returns(m.type())
                .addStatement("return $L", m.codeName())
                .build());
            tb.addMethod(MethodSpec.methodBuilder("set" + cap(m.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .addParameter(m.type(), m.codeName())
                .addStatement("this.$L = $L", m.codeName(), validatedValue(m))
                .build());
        }

        for (Member m : members) {
            for (ExtractionValidator v : m.validators()) {
                tb.addMethod(v.routine(m.codeName(), m.wireName()));
            }
        }

        List<JavaSources.PlainField> plain = new ArrayList<>();
        for (Member m : members) {
            plain.add(new JavaSources.PlainField(m.wireName(), m.codeName(), m.type(), true, null));
        }
        JavaSources.addEqualsHashCodeToString(tb, className, plain);

        log.debug("Generated extraction model {}.{} with {} members from {}", pkg, className, members.size(), sourceName);
        return JavaFile.builder(pkg, tb.build())
            .addFileComment("$L", header.fileComment(sourceName))
            .skipJavaLangImports(true)
            .build();
    }

    // =========================================================================
    // Members
    // =========================================================================

    /**
     * One generated member.
     *
     * @param wireName JSON property name
     * @param type     Java type; nullable unless required for extraction
     */
    record Member(
        String fieldName,
        String wireName,
        String codeName,
        TypeName type,
        boolean extractionRequired,
        String description,
        List<ExtractionValidator> validators
    ) {}

    List<Member> members(SchemaDefinition schema, SchemaLoader loader) {
        Map<String, FieldDefinition> collected = new LinkedHashMap<>();
        for (FieldDefinition f : InheritanceResolver.resolve(schema, loader)) {
            if (f.exclude() || f.primaryKey() || f.skippedFor(Target.EXTRACTION)) continue;
            collected.putIfAbsent(f.nameFor(Target.EXTRACTION), f);
        }
        for (ExtractionField e : schema.extractionFields()) {
            FieldDefinition f = e.toFieldDefinition();
            if (f.skippedFor(Target.EXTRACTION)) continue;
            collected.put(f.nameFor(Target.EXTRACTION), f);
        }

        List<Member> members = new ArrayList<>();
        for (Map.Entry<String, FieldDefinition> entry : collected.entrySet()) {
            members.add(member(schema.name(), entry.getKey(), entry.getValue()));
        }
        Identifiers.detectCollisions(schema.name(), Target.EXTRACTION, members, Member::fieldName, Member::codeName);
        return members;
    }

    private Member member(String schemaName, String wireName, FieldDefinition f) {
        boolean required = extractionRequired(f);
        TypeName type = TypeCatalog.mapType(schemaName, f, !required, types);
        // absence must stay observable
        if (type.isPrimitive()) type = type.box();

        List<ExtractionValidator> validators = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>(
            f.override(Target.EXTRACTION).map(TargetOverride::validators).orElse(List.of()));
        for (String name : names) {
            ExtractionValidator v = ExtractionValidator.fromKey(name).orElseThrow(() -> new ValidatorException(
                schemaName, f.name(), name,
                "unknown validator '" + name + "'. Supported validators: " + ExtractionValidator.supported()));
            if (!type.withoutAnnotations().equals(JavaTypes.STRING)) {
                throw new ValidatorException(schemaName, f.name(), name,
                    "validator '" + name + "' requires a string field, found " + JavaTypes.simpleName(type));
            }
            validators.add(v);
        }

        String codeName = Identifiers.javaFieldName(schemaName, Target.EXTRACTION, f.name(), wireName);
        return new Member(f.name(), wireName, codeName, type, required,
            describe(f, required), validators);
    }

    static boolean extractionRequired(FieldDefinition f) {
        return f.override(Target.EXTRACTION).map(TargetOverride::isRequired).orElse(false);
    }

    /**
     * Field description with its null semantics spelled out. Optional members get a null
     * clause unless the text already talks about null; members required for extraction get
     * {@code REQUIRED.}; base-required members that stay optional get {@code (required)}.
     */
    static String describe(FieldDefinition f, boolean extractionRequired) {
        String text = f.description() == null ? "" : f.description().strip().replaceAll("\\s*\\R\\s*", " ");
        String lower = text.toLowerCase(Locale.ROOT);
        if (extractionRequired) {
            return lower.contains("required") ? text : append(text, "REQUIRED.");
        }
        if (!lower.contains("null")) {
            text = append(text, f.type().kind() == LogicalType.Kind.BOOLEAN ? BOOLEAN_NULL_CLAUSE : NULL_CLAUSE);
        }
        return f.required() ? append(text, "(required)") : text;
    }

    private static String append(String text, String clause) {
        return text.isEmpty() ? clause : text + " " + clause;
    }

    private static CodeBlock validatedValue(Member m) {
        CodeBlock value = CodeBlock.of("$L", m.codeName());
        for (ExtractionValidator v : m.validators()) {
            value = CodeBlock.of("$L($L)", v.methodName(m.codeName()), value);
        }
        return value;
    }

    private static String classDescription(SchemaDefinition schema) {
        String d = schema.description() == null ? schema.name() : schema.description().strip();
        if (d.endsWith(".")) d = d.substring(0, d.length() - 1);
        return "Extraction model for " + d + ".";
    }

    /** {@code {"entity_name": "Example"}}, using {@code entity_name} when present, else the first member. */
    static String exampleJson(List<Member> members) {
        if (members.isEmpty()) return "{}";
        Member example = members.stream()
            .filter(m -> m.wireName().equals("entity_name"))
            .findFirst()
            .orElse(members.get(0));
        String name = example.wireName().replace("\\", "\\\\").replace("\"", "\\\"");
        return "{\"" + name + "\": " + exampleValue(example.type()) + "}";
    }

    private static String exampleValue(TypeName type) {
        String simple = JavaTypes.simpleName(type);
        if (simple.equals("Long") || simple.equals("Integer")) return "1";
        if (simple.equals("Double") || simple.equals("Float")) return "1.0";
        if (simple.equals("Boolean")) return "true";
        if (simple.equals("Instant")) return "\"2024-01-01T00:00:00Z\"";
        if (simple.startsWith("Map<")) return "{}";
        if (simple.startsWith("List<")) return "[]";
        return "\"Example\"";
    }
}
