package io.graphvault.server.backup;

/** A restore aborted. Carries the snapshot and the phase it stopped in. */
public class RestoreFailedException extends RuntimeException {
    private final RestorePhase phase;
    private final String snapshotId;

    public RestoreFailedException(RestorePhase phase, String snapshotId, Throwable cause) {
        super("Restore of snapshot " + snapshotId + " failed during " + phase + ": " + cause.getMessage(), cause);
        this.phase = phase;
        this.snapshotId = snapshotId;
    }

    public RestorePhase phase() {
        return phase;
    }

    public String snapshotId() {
        return snapshotId;
    }
}
