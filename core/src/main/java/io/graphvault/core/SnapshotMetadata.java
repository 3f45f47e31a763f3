package io.graphvault.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Descriptive header of a snapshot.
 * <p>
 * {@code timestamp} is both the snapshot's identity and the key its filename
 * is derived from. It is fixed-width, so string order equals creation order.
 * {@code fileSizeBytes} is only known once the file is on disk; the copy embedded
 * in the snapshot document carries 0, the index copy carries the real size.
 */
public record SnapshotMetadata(
        String timestamp,
        Instant createdAt,
        String reason,
        long nodeCount,
        long relationshipCount,
        String schemaVersion,
        String backupType,
        long fileSizeBytes
) {
    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String BACKUP_TYPE_FULL = "full";

    public SnapshotMetadata {
        Objects.requireNonNull(timestamp, "timestamp");
        if (timestamp.isBlank()) throw new IllegalArgumentException("timestamp must not be blank");
        reason = reason == null ? "" : reason;
        schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        backupType = backupType == null ? BACKUP_TYPE_FULL : backupType;
    }

    /** Metadata for a new full snapshot of {@code stats}. */
    public static SnapshotMetadata forFullSnapshot(String timestamp, Instant createdAt, String reason, GraphStatistics stats) {
        return new SnapshotMetadata(
                timestamp,
                createdAt,
                reason,
                stats.nodeCount(),
                stats.relationshipCount(),
                SCHEMA_VERSION,
                BACKUP_TYPE_FULL,
                0L
        );
    }

    public SnapshotMetadata withFileSizeBytes(long size) {
        return new SnapshotMetadata(timestamp, createdAt, reason, nodeCount, relationshipCount,
                schemaVersion, backupType, size);
    }

    /** Statistics view used for change detection; per-label counts are not indexed. */
    public GraphStatistics statistics() {
        return GraphStatistics.of(nodeCount, relationshipCount);
    }
}
