package co.schemata.generators;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The banner every generated artifact starts with. It names the source schema file and
 * the generation time; the time line is the only part that differs between two runs over
 * an unchanged schema.
 */
public final class GeneratedHeader {

    /** A generation timestamp line in any of the comment styles the generators emit. */
    public static final Pattern GENERATED_AT = Pattern.compile("^\\s*(//|--|#)\\s*Generated at:.*$");

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String RULE = "============================================================";

    private final String sourceRoot;
    private final Clock clock;

    public GeneratedHeader(String sourceRoot, Clock clock) {
        this.sourceRoot = sourceRoot;
        this.clock = clock;
    }

    /** Header lines without a comment prefix. */
    public List<String> lines(String sourceName) {
        String source = sourcePath(sourceName);
        return List.of(
            RULE,
            "GENERATED FILE - DO NOT EDIT",
            RULE,
            "",
            "Generated from: " + source,
            "Generated at: " + LocalDateTime.now(clock).format(TIMESTAMP),
            "",
            "To make changes, edit " + source + " and regenerate.",
            RULE);
    }

    /** Header as a {@code //} comment block followed by a blank line. */
    public String lineComment(String sourceName) {
        return lines(sourceName).stream()
            .map(l -> l.isEmpty() ? "//" : "// " + l)
            .collect(Collectors.joining("\n", "", "\n\n"));
    }

    /** Header text for JavaPoet's file comment, which adds its own prefix. */
    public String fileComment(String sourceName) {
        return String.join("\n", lines(sourceName));
    }

    String sourcePath(String sourceName) {
        if (sourceRoot == null || sourceRoot.isEmpty()) return sourceName;
        return sourceRoot.endsWith("/") ? sourceRoot + sourceName : sourceRoot + "/" + sourceName;
    }

    /** Drop every timestamp line so two generations of the same schema compare equal. */
    public static String withoutTimestamps(String text) {
        return text.replace("\r\n", "\n").lines()
            .filter(l -> !GENERATED_AT.matcher(l).matches())
            .collect(Collectors.joining("\n"));
    }
}
