package io.graphvault.storage;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Filename and identity conventions for snapshot files.
 * <p>
 * Layout: {@code graph_snapshot_<timestamp>.json}, with a fixed-width UTC
 * timestamp ({@code yyyyMMdd_HHmmss_SSS}), so sorting names sorts by age.
 * Writers use a {@code .tmp} sibling that is never treated as a snapshot.
 */
public final class SnapshotNaming {
    public static final String PREFIX = "graph_snapshot_";
    public static final String SUFFIX = ".json";
    public static final String TMP_SUFFIX = ".tmp";
    public static final String INDEX_FILE = "snapshot_index.json";

    public static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    // ids end up in file paths: no separators, no dots
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

    private SnapshotNaming() {
        // utility
    }

    public static String timestampOf(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    /** Instant encoded by a generated timestamp; empty for hand-made ids that do not parse. */
    public static Optional<Instant> instantOf(String timestamp) {
        try {
            return Optional.of(Instant.from(TIMESTAMP.parse(timestamp)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String fileName(String timestamp) {
        return PREFIX + requireSafe(timestamp) + SUFFIX;
    }

    /**
     * Accepts either a bare timestamp or a full snapshot filename and returns the timestamp.
     *
     * @throws IllegalArgumentException for ids that could escape the snapshot directory
     */
    public static String toTimestamp(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("snapshot id must not be empty");
        }
        String ts = id.strip();
        if (ts.startsWith(PREFIX) && ts.endsWith(SUFFIX)) {
            ts = ts.substring(PREFIX.length(), ts.length() - SUFFIX.length());
        }
        return requireSafe(ts);
    }

    /** Timestamp encoded in a snapshot filename, or empty for any other file. */
    public static Optional<String> timestampOf(Path file) {
        String name = file.getFileName().toString();
        if (!name.startsWith(PREFIX) || !name.endsWith(SUFFIX)) {
            return Optional.empty();
        }
        String ts = name.substring(PREFIX.length(), name.length() - SUFFIX.length());
        return SAFE_ID.matcher(ts).matches() ? Optional.of(ts) : Optional.empty();
    }

    private static String requireSafe(String timestamp) {
        if (!SAFE_ID.matcher(timestamp).matches()) {
            throw new IllegalArgumentException("invalid snapshot id: " + timestamp);
        }
        return timestamp;
    }
}
