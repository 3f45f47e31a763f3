// file: src/main/java/io/graphvault/storage/RetentionManager.java
package io.graphvault.storage;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.SnapshotMetadata;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owner of the snapshot directory: snapshot files plus their index.
 * <p>
 * Responsibilities:
 *  - save(): write a snapshot through the serializer, then record() it.
 *  - record(): add metadata to the index, keep the newest {@code maxRetained}
 *    entries and delete the files of everything evicted.
 *  - list(): index entries whose files still exist, merged with snapshot files
 *    on disk that the index does not know about (e.g. copied in by hand).
 * <p>
 * Every change to the directory goes through this class so that the index and
 * the files cannot drift apart. There is no locking: callers run one
 * backup/restore job at a time.
 */
public final class RetentionManager {
    private static final Logger log = Logger.getLogger(RetentionManager.class.getName());

    public static final int DEFAULT_MAX_RETAINED = 1;

    private static final Comparator<SnapshotMetadata> NEWEST_FIRST =
            Comparator.comparing(SnapshotMetadata::timestamp).reversed();

    private final Path dir;
    private final int maxRetained;
    private final SnapshotSerializer serializer;
    private final SnapshotIndexFile index;

    public RetentionManager(Path dir, int maxRetained, SnapshotSerializer serializer) {
        if (maxRetained <= 0) throw new IllegalArgumentException("maxRetained must be > 0");
        this.dir = dir;
        this.maxRetained = maxRetained;
        this.serializer = serializer;
        this.index = new SnapshotIndexFile(dir.resolve(SnapshotNaming.INDEX_FILE), SnapshotJson.newMapper());
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    public Path directory() {
        return dir;
    }

    public int maxRetained() {
        return maxRetained;
    }

    /** Location of the snapshot identified by a timestamp or filename. */
    public Path pathFor(String id) {
        return dir.resolve(SnapshotNaming.fileName(SnapshotNaming.toTimestamp(id)));
    }

    /**
     * Timestamp for a snapshot created at {@code now}. Always later than the newest
     * known snapshot and never an existing file, so identities stay unique and
     * ordered even when the clock stalls or steps back.
     */
    public String nextTimestamp(Instant now) {
        Instant candidate = now;
        Optional<Instant> newest = latest().flatMap(m -> SnapshotNaming.instantOf(m.timestamp()));
        if (newest.isPresent() && !candidate.isAfter(newest.get())) {
            candidate = newest.get().plusMillis(1);
        }
        String ts = SnapshotNaming.timestampOf(candidate);
        while (Files.exists(pathFor(ts))) {
            candidate = candidate.plusMillis(1);
            ts = SnapshotNaming.timestampOf(candidate);
        }
        return ts;
    }

    /**
     * Write the snapshot file and record it in the index.
     *
     * @return the recorded metadata, carrying the real file size
     */
    public SnapshotMetadata save(GraphSnapshotPayload payload, SnapshotMetadata metadata) {
        Path path = pathFor(metadata.timestamp());
        long size = serializer.write(payload, metadata, path);
        SnapshotMetadata recorded = metadata.withFileSizeBytes(size);
        record(recorded);
        return recorded;
    }

    /**
     * Add {@code metadata} to the index and enforce the retention cap.
     * Eviction failures are logged, never thrown.
     *
     * @return metadata of the evicted snapshots
     */
    public List<SnapshotMetadata> record(SnapshotMetadata metadata) {
        List<SnapshotMetadata> all = new ArrayList<>(list());
        all.removeIf(m -> m.timestamp().equals(metadata.timestamp()));
        all.add(metadata);
        all.sort(NEWEST_FIRST);

        int keep = Math.min(maxRetained, all.size());
        List<SnapshotMetadata> kept = List.copyOf(all.subList(0, keep));
        List<SnapshotMetadata> evicted = List.copyOf(all.subList(keep, all.size()));

        index.save(kept);

        for (SnapshotMetadata old : evicted) {
            Path file = pathFor(old.timestamp());
            try {
                Files.deleteIfExists(file);
                log.info("Evicted snapshot " + file.getFileName());
            } catch (IOException e) {
                var failure = new RetentionCleanupException("Failed to delete evicted snapshot " + file, e);
                log.log(Level.WARNING, failure.getMessage(), failure);
            }
        }
        return evicted;
    }

    /** All known snapshots, newest first, reconciled against the directory. */
    public List<SnapshotMetadata> list() {
        Map<String, SnapshotMetadata> byTimestamp = new LinkedHashMap<>();

        for (SnapshotMetadata m : index.load()) {
            Path file;
            try {
                file = pathFor(m.timestamp());
            } catch (IllegalArgumentException bad) {
                log.warning("Ignoring index entry with invalid timestamp: " + m.timestamp());
                continue;
            }
            if (Files.exists(file)) {
                byTimestamp.put(m.timestamp(), m);
            } else {
                log.fine("Index entry " + m.timestamp() + " has no file on disk, dropping it");
            }
        }

        for (Path file : snapshotFiles()) {
            String ts = SnapshotNaming.timestampOf(file).orElseThrow();
            if (byTimestamp.containsKey(ts)) continue;
            try {
                SnapshotMetadata fromFile = serializer.readMetadata(file);
                byTimestamp.put(ts, withIdentity(fromFile, ts, Files.size(file)));
            } catch (SnapshotParseException | SnapshotNotFoundException | IOException e) {
                log.log(Level.WARNING, "Skipping unreadable snapshot file " + file.getFileName(), e);
            }
        }

        List<SnapshotMetadata> out = new ArrayList<>(byTimestamp.values());
        out.sort(NEWEST_FIRST);
        return out;
    }

    public Optional<SnapshotMetadata> latest() {
        return list().stream().findFirst();
    }

    /**
     * Metadata for one snapshot with its current on-disk size, or empty if the
     * file does not exist.
     */
    public Optional<SnapshotMetadata> info(String id) {
        String ts = SnapshotNaming.toTimestamp(id);
        Path file = pathFor(ts);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            long size = Files.size(file);
            Optional<SnapshotMetadata> indexed = index.load().stream()
                    .filter(m -> m.timestamp().equals(ts))
                    .findFirst();
            SnapshotMetadata base = indexed.isPresent() ? indexed.get() : serializer.readMetadata(file);
            return Optional.of(withIdentity(base, ts, size));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat snapshot " + file, e);
        }
    }

    private List<Path> snapshotFiles() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> SnapshotNaming.timestampOf(p).isPresent())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan snapshot directory " + dir, e);
        }
    }

    // The filename is the identity; a hand-renamed file keeps the name it has now.
    private static SnapshotMetadata withIdentity(SnapshotMetadata m, String timestamp, long size) {
        return new SnapshotMetadata(timestamp, m.createdAt(), m.reason(), m.nodeCount(),
                m.relationshipCount(), m.schemaVersion(), m.backupType(), size);
    }
}
