package io.graphvault.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphvault.core.SnapshotMetadata;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * The on-disk snapshot index: {@code {"backups": [SnapshotMetadata, ...]}}.
 * <p>
 * Always rewritten wholesale (tmp + atomic move). A missing or unreadable index
 * loads as empty; the directory scan in {@link RetentionManager#list()}
 * rediscovers the snapshot files themselves.
 */
final class SnapshotIndexFile {
    private static final Logger log = Logger.getLogger(SnapshotIndexFile.class.getName());

    /** Jackson binding for the index document. */
    static final class IndexDocument {
        public List<SnapshotMetadata> backups = new ArrayList<>();
    }

    private final Path path;
    private final ObjectMapper json;

    SnapshotIndexFile(Path path, ObjectMapper json) {
        this.path = path;
        this.json = json;
    }

    List<SnapshotMetadata> load() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            IndexDocument doc = json.readValue(path.toFile(), IndexDocument.class);
            return doc.backups == null ? new ArrayList<>() : new ArrayList<>(doc.backups);
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "Snapshot index " + path + " is unreadable, rebuilding from directory scan", e);
            return new ArrayList<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot index " + path, e);
        }
    }

    void save(List<SnapshotMetadata> entries) {
        IndexDocument doc = new IndexDocument();
        doc.backups = new ArrayList<>(entries);
        Path tmp = path.resolveSibling(path.getFileName() + SnapshotNaming.TMP_SUFFIX);
        try {
            json.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), doc);
            Files.move(tmp, path, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot index " + path, e);
        }
    }
}
