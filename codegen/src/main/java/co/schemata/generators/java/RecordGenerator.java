package co.schemata.generators.java;

import co.schemata.core.InheritanceResolver;
import co.schemata.core.SchemaLoader;
import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.model.Target;
import co.schemata.core.runtime.FieldDescriptor;
import co.schemata.core.types.TypeCatalog;
import co.schemata.generators.CompilerOptions;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.Identifiers;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Generates the in-process record type for a schema.
 *
 * <p>The generated class is immutable and holds every field of the resolved field list
 * (fields with {@code targets.record.skip} are left out). It also publishes its fields as
 * {@link FieldDescriptor}s:
 * <ul>
 *   <li>{@code FIELDS}: all fields, including those inherited from the parent</li>
 *   <li>{@code SPECIFIC_FIELDS}: only for child schemas, the fields the schema declares
 *       itself; {@code FIELDS} is then {@code FieldDescriptor.concat(Parent.FIELDS, SPECIFIC_FIELDS)}</li>
 * </ul>
 * plus lookup helpers {@code fieldByName}, {@code fieldsWithSearchMetadata},
 * {@code extractionFields} (internal fields left out) and {@code databaseFields}.
 */
public class RecordGenerator {
    private static final Logger log = LoggerFactory.getLogger(RecordGenerator.class);

    static final ClassName FIELD_DESCRIPTOR = ClassName.get(FieldDescriptor.class);
    private static final TypeName DESCRIPTOR_LIST = ParameterizedTypeName.get(JavaTypes.LIST, FIELD_DESCRIPTOR);

    private final String pkg;
    private final GeneratedHeader header;
    private final JavaTypes types = new JavaTypes(Target.RECORD);

    public RecordGenerator(CompilerOptions options, GeneratedHeader header) {
        this.pkg = options.javaPackage();
        this.header = header;
    }

    /** Generated Java source, starting with the generated-file header. */
    public String generate(SchemaDefinition schema, String sourceName, SchemaLoader loader) {
        return generateFile(schema, sourceName, loader).toString();
    }

    public JavaFile generateFile(SchemaDefinition schema, String sourceName, SchemaLoader loader) {
        String className = Identifiers.javaTypeName(schema.name());

        List<FieldDefinition> fields = InheritanceResolver.resolve(schema, loader).stream()
            .filter(f -> !f.skippedFor(Target.RECORD))
            .collect(Collectors.toList());

        List<JavaSources.PlainField> members = new ArrayList<>();
        for (FieldDefinition f : fields) {
            TypeName type = TypeCatalog.mapType(schema.name(), f, types);
            members.add(new JavaSources.PlainField(
                f.name(),
                Identifiers.javaFieldName(schema.name(), Target.RECORD, f.name(), f.nameFor(Target.RECORD)),
                type,
                f.nullable(),
                JavaSources.defaultInitializer(schema.name(), f, Target.RECORD)));
        }
        Identifiers.detectCollisions(schema.name(), Target.RECORD, members,
            JavaSources.PlainField::fieldName, JavaSources.PlainField::codeName);

        TypeSpec.Builder tb = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("$L\n", schema.description())
            .addJavadoc("\n<p>Generated from {@code $L}.\n", sourceName);

        addDescriptors(tb, schema, fields, members);
        JavaSources.addFinalFields(tb, members, fields);
        JavaSources.addConstructor(tb, members);
        JavaSources.addGetters(tb, members);
        addLookupHelpers(tb);
        JavaSources.addBuilderClass(tb, className, members);
        JavaSources.addEqualsHashCodeToString(tb, className, members);

        log.debug("Generated record {}.{} with {} fields from {}", pkg, className, members.size(), sourceName);
        return JavaFile.builder(pkg, tb.build())
            .addFileComment("$L", header.fileComment(sourceName))
            .skipJavaLangImports(true)
            .build();
    }

    // =========================================================================
    // Field descriptors
    // =========================================================================

    private void addDescriptors(TypeSpec.Builder tb, SchemaDefinition schema, List<FieldDefinition> fields,
                                List<JavaSources.PlainField> members) {
        if (!schema.hasParent()) {
            tb.addField(FieldSpec.builder(DESCRIPTOR_LIST, "FIELDS", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .addJavadoc("All fields in declaration order.\n")
                .initializer(descriptorList(fields, members))
                .build());
            return;
        }

        List<FieldDefinition> ownFields = new ArrayList<>();
        List<JavaSources.PlainField> ownMembers = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldDefinition f = fields.get(i);
            if (schema.fields().contains(f)) {
                ownFields.add(f);
                ownMembers.add(members.get(i));
            }
        }

        ClassName parent = ClassName.get(pkg, Identifiers.javaTypeName(schema.extendsName()));
        tb.addField(FieldSpec.builder(DESCRIPTOR_LIST, "SPECIFIC_FIELDS", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Fields declared by $L itself, without those inherited from {@link $T}.\n",
                schema.name(), parent)
            .initializer(descriptorList(ownFields, ownMembers))
            .build());
        tb.addField(FieldSpec.builder(DESCRIPTOR_LIST, "FIELDS", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Inherited fields followed by {@link #SPECIFIC_FIELDS}.\n")
            .initializer("$T.concat($T.FIELDS, SPECIFIC_FIELDS)", FIELD_DESCRIPTOR, parent)
            .build());
    }

    private static CodeBlock descriptorList(List<FieldDefinition> fields, List<JavaSources.PlainField> members) {
        CodeBlock.Builder cb = CodeBlock.builder().add("$T.of(", JavaTypes.LIST);
        if (!fields.isEmpty()) {
            cb.add("\n$>$>");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) cb.add(",\n");
                cb.add(descriptor(fields.get(i), members.get(i).type()));
            }
            cb.add("$<$<");
        }
        return cb.add(")").build();
    }

    private static CodeBlock descriptor(FieldDefinition f, TypeName type) {
        CodeBlock.Builder cb = CodeBlock.builder()
            .add("$T.builder($S, $S, $S)$>", FIELD_DESCRIPTOR, f.name(), f.type().toString(), JavaTypes.simpleName(type));
        if (f.description() != null) cb.add("\n.description($S)", f.description().strip());
        if (f.nullable()) cb.add("\n.nullable(true)");
        if (f.required()) cb.add("\n.required(true)");
        if (f.index()) cb.add("\n.index(true)");
        if (f.unique()) cb.add("\n.unique(true)");
        if (f.primaryKey()) cb.add("\n.primaryKey(true)");
        if (f.foreignKey() != null) cb.add("\n.foreignKey($S)", f.foreignKey());
        if (f.defaultValue() != null) cb.add("\n.defaultValue($S)", f.defaultValue().text());
        if (f.exclude()) cb.add("\n.exclude(true)");
        if (f.searchCategory() != null) cb.add("\n.searchCategory($S)", f.searchCategory());
        if (!f.searchKeywords().isEmpty()) {
            String placeholders = f.searchKeywords().stream().map(k -> "$S").collect(Collectors.joining(", "));
            cb.add("\n.searchKeywords($T.of(" + placeholders + "))",
                concat(JavaTypes.LIST, f.searchKeywords().toArray()));
        }
        return cb.add("\n.build()$<").build();
    }

    private static Object[] concat(Object first, Object[] rest) {
        Object[] all = new Object[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }

    // =========================================================================
    // Lookup helpers
    // =========================================================================

    private static void addLookupHelpers(TypeSpec.Builder tb) {
        tb.addMethod(MethodSpec.methodBuilder("fieldByName")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(String.class, "name")
            .returns(ParameterizedTypeName.get(ClassName.get(Optional.class), FIELD_DESCRIPTOR))
            .addStatement("return FIELDS.stream().filter(f -> f.name().equals(name)).findFirst()")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("fieldsWithSearchMetadata")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(DESCRIPTOR_LIST)
            .addStatement("return FIELDS.stream().filter($T::hasSearchMetadata).toList()", FIELD_DESCRIPTOR)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("extractionFields")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Fields offered to external extraction; internal fields are left out.\n")
            .returns(DESCRIPTOR_LIST)
            .addStatement("return FIELDS.stream().filter(f -> !f.exclude()).toList()")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("databaseFields")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("All fields, internal ones included.\n")
            .returns(DESCRIPTOR_LIST)
            .addStatement("return FIELDS")
            .build());
    }
}
