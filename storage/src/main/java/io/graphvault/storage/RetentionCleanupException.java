package io.graphvault.storage;

/**
 * Deleting an evicted snapshot file failed.
 * Only ever logged: eviction problems never fail the backup that caused them.
 */
public class RetentionCleanupException extends RuntimeException {
    public RetentionCleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}
