// file: server/src/main/java/io/graphvault/server/backup/BackupService.java
package io.graphvault.server.backup;

import io.graphvault.core.ChangeDetector;
import io.graphvault.core.ChangeThresholds;
import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.GraphStatistics;
import io.graphvault.core.SnapshotMetadata;
import io.graphvault.server.graph.GraphStore;
import io.graphvault.server.graph.StoreConnectionException;
import io.graphvault.storage.RetentionManager;
import io.graphvault.storage.SnapshotNaming;
import io.graphvault.storage.SnapshotNotFoundException;
import io.graphvault.storage.SnapshotParseException;
import io.graphvault.storage.SnapshotSerializer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-facing backup operations.
 * <p>
 * Responsibilities:
 *  - create: extract -> write -> record in the index (retention applies).
 *  - autoCreate: compare live counts with the latest snapshot, create only on growth.
 *  - restore / selectiveRestore: resolve the snapshot (latest when no id), run the restorer.
 *  - list / info / status: read-only views.
 * <p>
 * No exception crosses this boundary: every operation returns a result carrying
 * {@code ok}, a human-readable message and a {@link Failure} kind for callers
 * (HTTP, CLI) that need to map it.
 * <p>
 * Single-writer: callers must not run two operations against the same store
 * or snapshot directory at once.
 */
public final class BackupService {
    private static final Logger log = Logger.getLogger(BackupService.class.getName());

    /** Why an operation did not succeed. */
    public enum Failure {
        NONE,
        INVALID_REQUEST,
        NOT_FOUND,
        STORE_UNAVAILABLE,
        FAILED
    }

    /** Outcome of create / autoCreate. {@code snapshot} is null unless one was written. */
    public record BackupResult(boolean ok, boolean created, String message, Failure failure, SnapshotMetadata snapshot) {
        static BackupResult created(String message, SnapshotMetadata snapshot) {
            return new BackupResult(true, true, message, Failure.NONE, snapshot);
        }

        static BackupResult skipped(String message) {
            return new BackupResult(true, false, message, Failure.NONE, null);
        }

        static BackupResult failed(Failure failure, String message) {
            return new BackupResult(false, false, message, failure, null);
        }
    }

    /** Outcome of a restore. {@code report} is null unless the restore reached DONE. */
    public record RestoreOutcome(
            boolean ok,
            String message,
            Failure failure,
            String snapshotId,
            RestorePhase phase,
            RestoreReport report
    ) {
    }

    /**
     * Live vs. last-snapshot comparison.
     *
     * @param last null when no snapshot exists
     */
    public record Status(
            boolean ok,
            String message,
            Failure failure,
            GraphStatistics current,
            GraphStatistics last,
            String lastSnapshotId,
            long deltaNodes,
            long deltaRelationships,
            boolean backupRecommended
    ) {
    }

    private final GraphStore store;
    private final RetentionManager retention;
    private final GraphExtractor extractor;
    private final GraphStatisticsReader statistics;
    private final GraphRestorer restorer;
    private final Clock clock;

    public BackupService(GraphStore store, SnapshotSerializer serializer, RetentionManager retention,
                         String naturalKey, Clock clock) {
        this.store = store;
        this.retention = retention;
        this.extractor = new GraphExtractor();
        this.statistics = new GraphStatisticsReader();
        this.restorer = new GraphRestorer(store, serializer, naturalKey);
        this.clock = clock;
    }

    // ---------- create ----------

    public BackupResult create(String reason) {
        if (!ensureConnected()) {
            return BackupResult.failed(Failure.STORE_UNAVAILABLE, "Graph store is not reachable");
        }
        try {
            GraphSnapshotPayload payload = extractor.extractAll(store);
            Instant now = clock.instant();
            String ts = retention.nextTimestamp(now);
            SnapshotMetadata metadata = SnapshotMetadata.forFullSnapshot(
                    ts, now, reason == null || reason.isBlank() ? "manual" : reason, payload.statistics());
            SnapshotMetadata saved = retention.save(payload, metadata);

            String msg = String.format("Snapshot %s created: %d nodes, %d relationships, %d bytes",
                    saved.timestamp(), saved.nodeCount(), saved.relationshipCount(), saved.fileSizeBytes());
            log.info(msg);
            return BackupResult.created(msg, saved);
        } catch (StoreConnectionException e) {
            log.log(Level.WARNING, "Snapshot creation failed", e);
            return BackupResult.failed(Failure.STORE_UNAVAILABLE, "Snapshot creation failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Snapshot creation failed", e);
            return BackupResult.failed(Failure.FAILED, "Snapshot creation failed: " + e.getMessage());
        }
    }

    public BackupResult autoCreate(ChangeThresholds thresholds) {
        ChangeThresholds t = thresholds == null ? ChangeThresholds.defaults() : thresholds;
        Status status = status(t);
        if (!status.ok()) {
            return BackupResult.failed(status.failure(), status.message());
        }
        if (!status.backupRecommended()) {
            String msg = String.format("No significant changes since snapshot %s (+%d nodes, +%d relationships)",
                    status.lastSnapshotId(), status.deltaNodes(), status.deltaRelationships());
            log.info(msg);
            return BackupResult.skipped(msg);
        }
        String reason = status.last() == null
                ? "auto: initial snapshot"
                : String.format("auto: %+d nodes, %+d relationships", status.deltaNodes(), status.deltaRelationships());
        return create(reason);
    }

    // ---------- restore ----------

    public RestoreOutcome restore(String snapshotId) {
        return runRestore(snapshotId, null);
    }

    public RestoreOutcome selectiveRestore(String snapshotId, Set<String> preserveLabels) {
        return runRestore(snapshotId, preserveLabels == null ? Set.of() : preserveLabels);
    }

    // preserveLabels == null selects a full restore
    private RestoreOutcome runRestore(String requestedId, Set<String> preserveLabels) {
        String kind = preserveLabels == null ? "Restore" : "Selective restore";

        Path file;
        String snapshotId;
        try {
            if (requestedId == null || requestedId.isBlank()) {
                Optional<SnapshotMetadata> latest = retention.latest();
                if (latest.isEmpty()) {
                    return restoreFailure(Failure.NOT_FOUND, "No snapshots found", null, RestorePhase.VALIDATING);
                }
                snapshotId = latest.get().timestamp();
            } else {
                snapshotId = requestedId.strip();
            }
            file = retention.pathFor(snapshotId);
            snapshotId = SnapshotNaming.toTimestamp(snapshotId);
        } catch (IllegalArgumentException e) {
            return restoreFailure(Failure.INVALID_REQUEST, e.getMessage(), requestedId, RestorePhase.VALIDATING);
        }

        if (!Files.exists(file)) {
            return restoreFailure(Failure.NOT_FOUND, "Snapshot " + snapshotId + " not found", snapshotId,
                    RestorePhase.VALIDATING);
        }

        try {
            RestoreReport report = preserveLabels == null
                    ? restorer.restoreFull(file)
                    : restorer.restoreSelective(file, preserveLabels);
            String msg = String.format("%s of snapshot %s done: %d nodes restored, %d preserved, "
                            + "%d relationships restored, %d skipped, %d node failures, %d relationship failures",
                    kind, snapshotId, report.nodesRestored(), report.nodesPreserved(),
                    report.relationshipsRestored(), report.relationshipsSkipped(),
                    report.nodeFailures(), report.relationshipFailures());
            return new RestoreOutcome(true, msg, Failure.NONE, snapshotId, RestorePhase.DONE, report);
        } catch (RestoreFailedException e) {
            log.log(Level.WARNING, e.getMessage(), e.getCause());
            return restoreFailure(classify(e.getCause()), kind + " " + lowerFirst(e.getMessage()), snapshotId, e.phase());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, kind + " of snapshot " + snapshotId + " failed", e);
            return restoreFailure(Failure.FAILED, kind + " of snapshot " + snapshotId + " failed: " + e.getMessage(),
                    snapshotId, RestorePhase.FAILED);
        }
    }

    private static Failure classify(Throwable cause) {
        if (cause instanceof SnapshotNotFoundException) return Failure.NOT_FOUND;
        if (cause instanceof StoreConnectionException) return Failure.STORE_UNAVAILABLE;
        if (cause instanceof SnapshotParseException || cause instanceof IllegalArgumentException) {
            return Failure.INVALID_REQUEST;
        }
        return Failure.FAILED;
    }

    private static RestoreOutcome restoreFailure(Failure failure, String message, String snapshotId, RestorePhase phase) {
        return new RestoreOutcome(false, message, failure, snapshotId, phase, null);
    }

    // "Restore of snapshot X failed during ..." -> "of snapshot X failed during ..."
    private static String lowerFirst(String restoreMessage) {
        return restoreMessage.startsWith("Restore ") ? restoreMessage.substring("Restore ".length()) : restoreMessage;
    }

    // ---------- read-only views ----------

    public List<SnapshotMetadata> list() {
        try {
            return retention.list();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Listing snapshots failed", e);
            return List.of();
        }
    }

    /** Metadata for one snapshot; empty when unknown or when {@code id} is not a valid snapshot id. */
    public Optional<SnapshotMetadata> info(String id) {
        try {
            return retention.info(id);
        } catch (IllegalArgumentException e) {
            log.fine("Rejected snapshot id '" + id + "': " + e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Reading snapshot " + id + " failed", e);
            return Optional.empty();
        }
    }

    public Status status(ChangeThresholds thresholds) {
        ChangeThresholds t = thresholds == null ? ChangeThresholds.defaults() : thresholds;
        if (!ensureConnected()) {
            return new Status(false, "Graph store is not reachable", Failure.STORE_UNAVAILABLE,
                    null, null, null, 0, 0, false);
        }
        try {
            GraphStatistics current = statistics.current(store);
            Optional<SnapshotMetadata> latest = retention.latest();
            GraphStatistics last = latest.map(SnapshotMetadata::statistics).orElse(null);
            long dn = last == null ? current.nodeCount() : current.nodeCount() - last.nodeCount();
            long dr = last == null ? current.relationshipCount() : current.relationshipCount() - last.relationshipCount();
            boolean recommended = ChangeDetector.shouldBackup(current, last, t);

            String msg = last == null
                    ? "No snapshots yet; backup recommended"
                    : String.format("%+d nodes, %+d relationships since snapshot %s; backup %s",
                    dn, dr, latest.get().timestamp(), recommended ? "recommended" : "not needed");
            return new Status(true, msg, Failure.NONE, current, last,
                    latest.map(SnapshotMetadata::timestamp).orElse(null), dn, dr, recommended);
        } catch (StoreConnectionException e) {
            log.log(Level.WARNING, "Reading store statistics failed", e);
            return new Status(false, "Graph store is not reachable: " + e.getMessage(), Failure.STORE_UNAVAILABLE,
                    null, null, null, 0, 0, false);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Reading store statistics failed", e);
            return new Status(false, "Status failed: " + e.getMessage(), Failure.FAILED,
                    null, null, null, 0, 0, false);
        }
    }

    public int maxRetained() {
        return retention.maxRetained();
    }

    private boolean ensureConnected() {
        try {
            return store.isConnected() || store.connect();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Connecting to graph store failed", e);
            return false;
        }
    }
}
