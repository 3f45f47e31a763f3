// file: src/main/java/io/graphvault/storage/SnapshotSerializer.java
package io.graphvault.storage;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.SnapshotMetadata;

import java.nio.file.Path;

/**
 * Renders snapshots to disk and reads them back.
 * <p>
 * Document shape:
 * <pre>
 *   { "metadata": {...},
 *     "data": { "nodes": [...], "relationships": [...], "statistics": {...} } }
 * </pre>
 * Writes are crash-safe: a reader either sees the complete file or no file.
 */
public interface SnapshotSerializer {

    /**
     * Persist a snapshot at {@code path}.
     *
     * @return size of the written file in bytes
     */
    long write(GraphSnapshotPayload payload, SnapshotMetadata metadata, Path path);

    /**
     * Load a complete snapshot.
     *
     * @throws SnapshotNotFoundException if {@code path} does not exist
     * @throws SnapshotParseException    if the document is malformed or incomplete
     */
    SnapshotDocument read(Path path);

    /**
     * Load only the metadata header, without materializing nodes and relationships.
     *
     * @throws SnapshotNotFoundException if {@code path} does not exist
     * @throws SnapshotParseException    if no readable metadata object is found
     */
    SnapshotMetadata readMetadata(Path path);
}
