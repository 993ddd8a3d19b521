package co.schemata.generators;

import co.schemata.core.errors.IdentifierCollisionException;
import co.schemata.core.errors.InvalidIdentifierException;
import co.schemata.core.model.Target;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/** Naming rules shared by the generators. */
public final class Identifiers {

    private static final Pattern JS_IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");
    private static final Pattern PRISMA_IDENTIFIER = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private Identifiers() {}

    /**
     * Convert a schema field name to a Java camelCase identifier:
     * {@code entity_name -> entityName}, {@code TTL -> ttl}, {@code 2fa-code -> _2faCode}.
     * Java keywords get a trailing underscore.
     */
    public static String javaName(String name) {
        String result = toJavaCamelCase(name);
        return SourceVersion.isKeyword(result) ? result + "_" : result;
    }

    /**
     * {@link #javaName} of a field's target name.
     *
     * @throws InvalidIdentifierException if the converted name is not a single Java identifier,
     *                                    e.g. for {@code price.gbp}
     */
    public static String javaFieldName(String schemaName, Target target, String fieldName, String name) {
        String result = javaName(name);
        if (result == null || !SourceVersion.isIdentifier(result)) {
            throw new InvalidIdentifierException(schemaName, fieldName, target.key(), result,
                "'" + name + "' does not convert to a Java identifier. Add a " + target.key()
                    + " name override.");
        }
        return result;
    }

    /**
     * A Prisma column name: a letter followed by letters, digits or underscores.
     *
     * @throws InvalidIdentifierException otherwise
     */
    public static String storageName(String schemaName, String fieldName, String name) {
        if (!PRISMA_IDENTIFIER.matcher(name).matches()) {
            throw new InvalidIdentifierException(schemaName, fieldName, Target.STORAGE.key(), name,
                "'" + name + "' is not a valid Prisma field name. Add a storage name override.");
        }
        return name;
    }

    /** Class name for a schema: {@code venue -> Venue}, {@code event_series -> EventSeries}. */
    public static String javaTypeName(String schemaName) {
        return cap(toJavaCamelCase(schemaName));
    }

    static String toJavaCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        // all caps: TTL -> ttl
        if (name.equals(name.toUpperCase()) && name.length() > 1 && !name.contains("-") && !name.contains("_")) {
            String result = name.toLowerCase();
            return Character.isDigit(result.charAt(0)) ? "_" + result : result;
        }

        StringBuilder sb = new StringBuilder();
        for (String part : name.split("[-_ ]")) {
            if (part.isEmpty()) continue;
            if (sb.isEmpty()) {
                sb.append(part.substring(0, 1).toLowerCase()).append(part.substring(1));
            } else {
                sb.append(part.substring(0, 1).toUpperCase()).append(part.substring(1));
            }
        }

        String result = sb.toString();
        if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return result;
    }

    /** Property key for a TypeScript or Zod object member, quoted when it is not a bare identifier. */
    public static String tsPropertyName(String name) {
        return JS_IDENTIFIER.matcher(name).matches() ? name : "\"" + name.replace("\"", "\\\"") + "\"";
    }

    public static String cap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase() + s.substring(1);
    }

    /**
     * Fail when two fields map to the same identifier in one artifact.
     *
     * @param fieldName  the field's schema name
     * @param identifier the identifier the generator would emit for it
     */
    public static <F> void detectCollisions(String schemaName, Target target, List<F> fields,
                                            Function<F, String> fieldName, Function<F, String> identifier) {
        Map<String, List<String>> byIdentifier = new LinkedHashMap<>();
        for (F field : fields) {
            byIdentifier.computeIfAbsent(identifier.apply(field), k -> new ArrayList<>()).add(fieldName.apply(field));
        }

        for (Map.Entry<String, List<String>> entry : byIdentifier.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw new IdentifierCollisionException(schemaName, target.key(), entry.getKey(), entry.getValue());
            }
        }
    }
}
