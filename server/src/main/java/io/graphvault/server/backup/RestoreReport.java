package io.graphvault.server.backup;

import java.util.List;

/**
 * Counts from a completed restore.
 *
 * @param nodesPreserved nodes skipped by a selective restore because they carry a preserved label
 * @param warnings       one line per recovered record failure or skipped relationship
 */
public record RestoreReport(
        int nodesRestored,
        int nodesPreserved,
        int relationshipsRestored,
        int relationshipsSkipped,
        int nodeFailures,
        int relationshipFailures,
        List<String> warnings
) {
    public RestoreReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
