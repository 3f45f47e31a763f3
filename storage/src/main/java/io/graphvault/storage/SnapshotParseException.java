package io.graphvault.storage;

/** A snapshot or index document exists but cannot be read as one. */
public class SnapshotParseException extends RuntimeException {
    public SnapshotParseException(String message) {
        super(message);
    }

    public SnapshotParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
