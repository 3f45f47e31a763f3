package io.graphvault.server.dto;

import io.graphvault.core.SnapshotMetadata;

import java.util.List;

/** Response of GET /snapshots, newest first. */
public class SnapshotListResponse {
    public int count;
    public int maxRetained;
    public List<SnapshotMetadata> snapshots;
}
