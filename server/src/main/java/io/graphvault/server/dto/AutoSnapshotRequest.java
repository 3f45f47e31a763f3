package io.graphvault.server.dto;

/**
 * Body of POST /snapshots/auto. Every field is optional and falls back to the
 * server's configured thresholds.
 */
public class AutoSnapshotRequest {
    public Long minNewNodes;
    public Long minNewRelationships;
    public Double percentGrowth;
}
