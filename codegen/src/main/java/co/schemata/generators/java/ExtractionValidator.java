package co.schemata.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.MethodSpec;

import javax.lang.model.element.Modifier;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import static co.schemata.generators.Identifiers.cap;

/**
 * Named validators an extraction field may declare. Each one becomes a static routine on
 * the extraction model that returns the accepted value or throws
 * {@link IllegalArgumentException}; {@code null} always passes.
 */
enum ExtractionValidator {
    /** Rejects blank text and strips surrounding whitespace. */
    NON_EMPTY("non_empty", "NotEmpty") {
        @Override
        void addChecks(MethodSpec.Builder mb, String fieldName) {
            mb.addJavadoc("Ensure $L is not empty or just whitespace.\n", fieldName);
            mb.beginControlFlow("if (value.strip().isEmpty())")
                .addStatement("throw new $T($S)", IAE, fieldName + " cannot be empty")
                .endControlFlow();
            mb.addStatement("return value.strip()");
        }
    },
    /** International phone number: leading {@code +}, no separators. */
    E164_PHONE("e164_phone", "E164Format") {
        @Override
        void addChecks(MethodSpec.Builder mb, String fieldName) {
            mb.addJavadoc("Ensure $L is in E.164 format if provided.\n", fieldName);
            mb.beginControlFlow("if (!value.startsWith($S))", "+")
                .addStatement("throw new $T($S)", IAE, "Phone number must be in E.164 format (starting with +)")
                .endControlFlow();
            mb.beginControlFlow("if (value.contains($S) || value.contains($S))", " ", "-")
                .addStatement("throw new $T($S)", IAE, "Phone number must not contain spaces or dashes in E.164 format")
                .endControlFlow();
            mb.addStatement("return value");
        }
    },
    /** URL with an explicit http or https scheme. */
    URL_HTTP("url_http", "Url") {
        @Override
        void addChecks(MethodSpec.Builder mb, String fieldName) {
            mb.addJavadoc("Ensure $L is a valid URL if provided.\n", fieldName);
            mb.beginControlFlow("if (!value.startsWith($S) && !value.startsWith($S))", "http://", "https://")
                .addStatement("throw new $T($S)", IAE,
                    label(fieldName) + " must be a valid URL starting with http:// or https://")
                .endControlFlow();
            mb.addStatement("return value");
        }
    },
    /** UK postcode: upper case with the inner space, e.g. {@code EH12 9GR}. */
    POSTCODE_UK("postcode_uk", "Format") {
        @Override
        void addChecks(MethodSpec.Builder mb, String fieldName) {
            mb.addJavadoc("Ensure $L follows the UK postcode format if provided.\n", fieldName);
            mb.beginControlFlow("if (!value.contains($S))", " ")
                .addStatement("throw new $T($S)", IAE, "UK postcode should contain a space (e.g., 'EH12 9GR')")
                .endControlFlow();
            mb.beginControlFlow("if (!value.equals(value.toUpperCase($T.ROOT)))", LOCALE)
                .addStatement("throw new $T($S)", IAE, "Postcode should be uppercase")
                .endControlFlow();
            mb.addStatement("return value");
        }
    };

    private static final ClassName IAE = ClassName.get(IllegalArgumentException.class);
    private static final ClassName LOCALE = ClassName.get(Locale.class);

    private final String key;
    private final String suffix;

    ExtractionValidator(String key, String suffix) {
        this.key = key;
        this.suffix = suffix;
    }

    String key() {
        return key;
    }

    static Optional<ExtractionValidator> fromKey(String key) {
        return Arrays.stream(values()).filter(v -> v.key.equals(key)).findFirst();
    }

    static String supported() {
        return Arrays.stream(values()).map(ExtractionValidator::key).collect(Collectors.joining(", "));
    }

    /** {@code validate<Member><Suffix>}, e.g. {@code validatePhoneE164Format}. */
    String methodName(String codeName) {
        return "validate" + cap(codeName) + suffix;
    }

    MethodSpec routine(String codeName, String fieldName) {
        MethodSpec.Builder mb = MethodSpec.methodBuilder(methodName(codeName))
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(JavaTypes.STRING)
            .addParameter(JavaTypes.STRING, "value");
        mb.beginControlFlow("if (value == null)")
            .addStatement("return null")
            .endControlFlow();
        addChecks(mb, fieldName);
        return mb.build();
    }

    abstract void addChecks(MethodSpec.Builder mb, String fieldName);

    /** {@code website_url -> Website Url} */
    static String label(String fieldName) {
        return Arrays.stream(fieldName.split("_"))
            .filter(p -> !p.isEmpty())
            .map(p -> cap(p.toLowerCase(Locale.ROOT)))
            .collect(Collectors.joining(" "));
    }
}
