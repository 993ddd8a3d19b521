package co.schemata.generators.prisma;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Storage dialects the Prisma generator targets. They differ in how {@code json} and
 * scalar list columns are represented.
 */
public enum PrismaDialect {
    /** Native {@code Json} columns and scalar lists such as {@code String[]}. */
    POSTGRESQL("postgresql", true, true),
    /** No JSON or array columns: {@code json} degrades to {@code String}, list overrides are rejected. */
    SQLITE("sqlite", false, false);

    private final String provider;
    private final boolean nativeJson;
    private final boolean scalarLists;

    PrismaDialect(String provider, boolean nativeJson, boolean scalarLists) {
        this.provider = provider;
        this.nativeJson = nativeJson;
        this.scalarLists = scalarLists;
    }

    /** Datasource provider name, e.g. {@code postgresql}. */
    @JsonValue
    public String provider() {
        return provider;
    }

    public boolean nativeJson() {
        return nativeJson;
    }

    public boolean scalarLists() {
        return scalarLists;
    }

    @JsonCreator
    public static PrismaDialect fromProvider(String value) {
        if (value != null) {
            String key = value.trim().toLowerCase(Locale.ROOT);
            for (PrismaDialect d : values()) {
                if (d.provider.equals(key)) return d;
            }
        }
        throw new IllegalArgumentException("Unknown storage dialect '" + value + "'. Supported dialects: "
            + Arrays.stream(values()).map(PrismaDialect::provider).collect(Collectors.joining(", ")));
    }
}
