package co.schemata.generators.java;

import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses a Java type written in a schema override, such as {@code BigDecimal},
 * {@code java.util.Set<String>} or {@code Map<String, List<Long>>}, into a JavaPoet
 * {@link TypeName}. Nothing is loaded or evaluated; unqualified names must be one of a
 * small set of well-known JDK types.
 */
final class JavaTypeExpressions {

    private static final Map<String, TypeName> PRIMITIVES = Map.of(
        "boolean", TypeName.BOOLEAN,
        "byte", TypeName.BYTE,
        "short", TypeName.SHORT,
        "int", TypeName.INT,
        "long", TypeName.LONG,
        "char", TypeName.CHAR,
        "float", TypeName.FLOAT,
        "double", TypeName.DOUBLE);

    private static final Map<String, ClassName> WELL_KNOWN = Map.ofEntries(
        Map.entry("Object", ClassName.get("java.lang", "Object")),
        Map.entry("String", ClassName.get("java.lang", "String")),
        Map.entry("Boolean", ClassName.get("java.lang", "Boolean")),
        Map.entry("Integer", ClassName.get("java.lang", "Integer")),
        Map.entry("Long", ClassName.get("java.lang", "Long")),
        Map.entry("Short", ClassName.get("java.lang", "Short")),
        Map.entry("Double", ClassName.get("java.lang", "Double")),
        Map.entry("Float", ClassName.get("java.lang", "Float")),
        Map.entry("BigDecimal", ClassName.get("java.math", "BigDecimal")),
        Map.entry("BigInteger", ClassName.get("java.math", "BigInteger")),
        Map.entry("Instant", ClassName.get("java.time", "Instant")),
        Map.entry("LocalDate", ClassName.get("java.time", "LocalDate")),
        Map.entry("LocalDateTime", ClassName.get("java.time", "LocalDateTime")),
        Map.entry("OffsetDateTime", ClassName.get("java.time", "OffsetDateTime")),
        Map.entry("Duration", ClassName.get("java.time", "Duration")),
        Map.entry("UUID", ClassName.get("java.util", "UUID")),
        Map.entry("List", ClassName.get("java.util", "List")),
        Map.entry("Set", ClassName.get("java.util", "Set")),
        Map.entry("Map", ClassName.get("java.util", "Map")));

    private final String text;
    private int pos;

    private JavaTypeExpressions(String text) {
        this.text = text;
    }

    /** @throws IllegalArgumentException if {@code text} is not a supported type expression */
    static TypeName parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("empty type expression");
        JavaTypeExpressions p = new JavaTypeExpressions(text);
        TypeName type = p.type();
        p.skipSpaces();
        if (p.pos != text.length()) {
            throw new IllegalArgumentException("unexpected '" + text.substring(p.pos) + "' in '" + text + "'");
        }
        return type;
    }

    private TypeName type() {
        String name = qualifiedName();
        TypeName type;
        if (PRIMITIVES.containsKey(name)) {
            type = PRIMITIVES.get(name);
        } else {
            ClassName raw = className(name);
            skipSpaces();
            if (peek('<')) {
                pos++;
                List<TypeName> args = new ArrayList<>();
                do {
                    TypeName arg = type();
                    if (arg.isPrimitive()) {
                        throw new IllegalArgumentException("primitive type argument in '" + text + "'");
                    }
                    args.add(arg);
                    skipSpaces();
                } while (consume(','));
                expect('>');
                type = ParameterizedTypeName.get(raw, args.toArray(new TypeName[0]));
            } else {
                type = raw;
            }
        }

        skipSpaces();
        while (peek('[')) {
            pos++;
            skipSpaces();
            expect(']');
            type = ArrayTypeName.of(type);
            skipSpaces();
        }
        return type;
    }

    private String qualifiedName() {
        skipSpaces();
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isJavaIdentifierPart(c) || c == '.') pos++;
            else break;
        }
        String name = text.substring(start, pos);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("expected a type name at position " + start + " in '" + text + "'");
        }
        if (!PRIMITIVES.containsKey(name) && !SourceVersion.isName(name)) {
            throw new IllegalArgumentException("'" + name + "' is not a valid Java type name");
        }
        return name;
    }

    private ClassName className(String name) {
        if (!name.contains(".")) {
            ClassName known = WELL_KNOWN.get(name);
            if (known == null) {
                throw new IllegalArgumentException("unknown type '" + name + "'; use a fully qualified name");
            }
            return known;
        }
        return ClassName.bestGuess(name);
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    private boolean peek(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private boolean consume(char c) {
        skipSpaces();
        if (peek(c)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        skipSpaces();
        if (!peek(c)) {
            throw new IllegalArgumentException("expected '" + c + "' at position " + pos + " in '" + text + "'");
        }
        pos++;
    }
}
