package co.schemata.generators.typescript;

import co.schemata.core.model.FieldDefinition;
import co.schemata.core.model.SchemaDefinition;
import co.schemata.core.model.Target;
import co.schemata.core.types.TypeCatalog;
import co.schemata.generators.GeneratedHeader;
import co.schemata.generators.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Generates a TypeScript interface, and optionally a Zod schema of the same shape, for a
 * schema.
 *
 * <p>Inheritance is expressed in TypeScript itself: a child interface {@code extends} the
 * parent's and lists only its own fields; its Zod schema is {@code ParentSchema.extend({...})}.
 */
public class TypeScriptGenerator {
    private static final Logger log = LoggerFactory.getLogger(TypeScriptGenerator.class);

    private final boolean includeRuntimeSchema;
    private final GeneratedHeader header;
    private final TypeScriptTypes tsTypes = new TypeScriptTypes();
    private final ZodTypes zodTypes = new ZodTypes();

    public TypeScriptGenerator(boolean includeRuntimeSchema, GeneratedHeader header) {
        this.includeRuntimeSchema = includeRuntimeSchema;
        this.header = header;
    }

    public String generate(SchemaDefinition schema, String sourceName) {
        List<Member> members = members(schema);

        List<String> parts = new ArrayList<>();
        List<String> imports = imports(schema);
        if (!imports.isEmpty()) {
            parts.add(String.join("\n", imports) + "\n");
        }
        parts.add(generateInterface(schema, members));
        if (includeRuntimeSchema) {
            parts.add(generateRuntimeSchema(schema, members));
        }

        log.debug("Generated TypeScript interface {} with {} members (runtime schema: {})",
            schema.name(), members.size(), includeRuntimeSchema);
        return header.lineComment(sourceName) + String.join("\n\n", parts) + "\n";
    }

    private List<Member> members(SchemaDefinition schema) {
        List<Member> members = new ArrayList<>();
        for (FieldDefinition f : schema.fields()) {
            if (f.skippedFor(Target.INTERFACE)) continue;
            members.add(new Member(
                f.name(),
                Identifiers.tsPropertyName(f.nameFor(Target.INTERFACE)),
                f.description(),
                TypeCatalog.mapType(schema.name(), f, tsTypes),
                TypeCatalog.mapType(schema.name(), f, zodTypes)));
        }
        Identifiers.detectCollisions(schema.name(), Target.INTERFACE, members, Member::fieldName, Member::key);
        return members;
    }

    private List<String> imports(SchemaDefinition schema) {
        List<String> imports = new ArrayList<>();
        if (includeRuntimeSchema) {
            imports.add("import { z } from \"zod\";");
        }
        if (schema.hasParent()) {
            String parent = schema.extendsName();
            String names = includeRuntimeSchema ? parent + ", " + parent + "Schema" : parent;
            imports.add("import { " + names + " } from \"./" + parent.toLowerCase(Locale.ROOT) + "\";");
        }
        return imports;
    }

    private static String generateInterface(SchemaDefinition schema, List<Member> members) {
        List<String> lines = new ArrayList<>();
        lines.add(schema.hasParent()
            ? "export interface " + schema.name() + " extends " + schema.extendsName() + " {"
            : "export interface " + schema.name() + " {");
        for (Member m : members) {
            if (m.description() != null && !m.description().isBlank()) {
                lines.add("  /** " + docText(m.description()) + " */");
            }
            lines.add("  " + m.key() + ": " + m.type() + ";");
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    private static String generateRuntimeSchema(SchemaDefinition schema, List<Member> members) {
        List<String> lines = new ArrayList<>();
        String base = schema.hasParent() ? schema.extendsName() + "Schema.extend" : "z.object";
        lines.add("export const " + schema.name() + "Schema = " + base + "({");
        for (Member m : members) {
            lines.add("  " + m.key() + ": " + m.validator() + ",");
        }
        lines.add("});");
        return String.join("\n", lines);
    }

    private static String docText(String description) {
        return description.strip().replaceAll("\\s*\\R\\s*", " ").replace("*/", "*\\/");
    }

    private record Member(String fieldName, String key, String description, String type, String validator) {}
}
