package io.graphvault.storage;

/** The requested snapshot file does not exist. */
public class SnapshotNotFoundException extends RuntimeException {
    private final String snapshotId;

    public SnapshotNotFoundException(String snapshotId, String message) {
        super(message);
        this.snapshotId = snapshotId;
    }

    public String snapshotId() {
        return snapshotId;
    }
}
