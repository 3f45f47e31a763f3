package io.graphvault.storage;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.SnapshotMetadata;

/** Both halves of a snapshot file as read back from disk. */
public record SnapshotDocument(SnapshotMetadata metadata, GraphSnapshotPayload payload) {}
