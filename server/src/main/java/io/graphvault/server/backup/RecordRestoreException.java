package io.graphvault.server.backup;

/**
 * One node or relationship could not be written. Recovered: counted in the
 * {@link RestoreReport}, never propagated out of a restore.
 */
public class RecordRestoreException extends RuntimeException {
    private final String legacyId;

    public RecordRestoreException(String legacyId, String message, Throwable cause) {
        super(message, cause);
        this.legacyId = legacyId;
    }

    public String legacyId() {
        return legacyId;
    }
}
