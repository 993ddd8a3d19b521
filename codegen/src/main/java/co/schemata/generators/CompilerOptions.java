package co.schemata.generators;

import co.schemata.generators.prisma.PrismaDialect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import javax.lang.model.SourceVersion;

/**
 * Settings shared by all generators. Every value has a default, so an empty JSON or YAML
 * document yields {@link #defaults()}.
 *
 * @param javaPackage       package of generated record classes; extraction models go to
 *                          {@code <javaPackage>.extraction}
 * @param dialect           storage dialect for the Prisma generator
 * @param runtimeValidation emit the Zod schema next to each TypeScript interface
 * @param sourceRoot        directory named in generated headers, e.g. {@code schemas}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerOptions(
    String javaPackage,
    PrismaDialect dialect,
    boolean runtimeValidation,
    String sourceRoot
) {
    public static final String DEFAULT_PACKAGE = "co.schemata.generated";
    public static final String DEFAULT_SOURCE_ROOT = "schemas";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @JsonCreator
    public CompilerOptions(
        @JsonProperty("javaPackage") String javaPackage,
        @JsonProperty("dialect") PrismaDialect dialect,
        @JsonProperty("runtimeValidation") Boolean runtimeValidation,
        @JsonProperty("sourceRoot") String sourceRoot
    ) {
        this(javaPackage == null ? DEFAULT_PACKAGE : javaPackage,
            dialect == null ? PrismaDialect.POSTGRESQL : dialect,
            runtimeValidation == null || runtimeValidation,
            sourceRoot == null ? DEFAULT_SOURCE_ROOT : sourceRoot);
    }

    public CompilerOptions {
        if (!SourceVersion.isName(javaPackage)) {
            throw new IllegalArgumentException("javaPackage is not a valid Java package name: " + javaPackage);
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_PACKAGE, PrismaDialect.POSTGRESQL, true, DEFAULT_SOURCE_ROOT);
    }

    public static CompilerOptions fromJson(String json) {
        return read(JSON, json);
    }

    public static CompilerOptions fromYaml(String yaml) {
        return read(YAML, yaml);
    }

    public CompilerOptions withDialect(PrismaDialect dialect) {
        return new CompilerOptions(javaPackage, dialect, runtimeValidation, sourceRoot);
    }

    public CompilerOptions withRuntimeValidation(boolean runtimeValidation) {
        return new CompilerOptions(javaPackage, dialect, runtimeValidation, sourceRoot);
    }

    public String extractionPackage() {
        return javaPackage + ".extraction";
    }

    private static CompilerOptions read(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) return defaults();
        try {
            CompilerOptions options = mapper.readValue(text, CompilerOptions.class);
            return options == null ? defaults() : options;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid compiler options: " + e.getOriginalMessage(), e);
        }
    }
}
