package io.graphvault.server.dto;

/** Body of POST /snapshots: {@code {"reason": "before migration"}}. */
public class CreateSnapshotRequest {
    public String reason;
}
