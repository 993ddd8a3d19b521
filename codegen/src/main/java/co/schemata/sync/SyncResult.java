package co.schemata.sync;

/**
 * Outcome of checking one schema source against its committed record artifact.
 *
 * @param schemaName {@code null} when the source could not be parsed
 * @param message    human-readable detail; the first differing line for {@code DRIFTED},
 *                   the error for {@code FAILED}
 */
public record SyncResult(String sourceName, String schemaName, Status status, String message) {

    public enum Status {
        IN_SYNC,
        DRIFTED,
        MISSING,
        FAILED
    }

    public boolean inSync() {
        return status == Status.IN_SYNC;
    }

    @Override
    public String toString() {
        return sourceName + ": " + status + (message == null ? "" : " (" + message + ")");
    }
}
