package co.schemata.sync;

import java.util.List;
import java.util.stream.Collectors;

/** Per-source results of one consistency check, in source order. */
public record DriftReport(List<SyncResult> results) {

    public DriftReport {
        results = List.copyOf(results);
    }

    /** {@code true} when any source is not in sync; callers turn this into a failing exit status. */
    public boolean hasDrift() {
        return results.stream().anyMatch(r -> !r.inSync());
    }

    public List<SyncResult> drifted() {
        return results.stream().filter(r -> !r.inSync()).collect(Collectors.toList());
    }

    public String summary() {
        long inSync = results.stream().filter(SyncResult::inSync).count();
        StringBuilder sb = new StringBuilder()
            .append(inSync).append(" of ").append(results.size()).append(" schemas in sync");
        for (SyncResult r : drifted()) {
            sb.append("\n  ").append(r);
        }
        return sb.toString();
    }
}
