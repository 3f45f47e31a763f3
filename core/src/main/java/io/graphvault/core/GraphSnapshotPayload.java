package io.graphvault.core;

import java.util.List;
import java.util.Objects;

/**
 * Full in-memory export of a graph: nodes, then relationships, plus statistics.
 * Order is preserved from extraction and drives restore order.
 */
public record GraphSnapshotPayload(
        List<NodeRecord> nodes,
        List<RelationshipRecord> relationships,
        GraphStatistics statistics
) {
    public GraphSnapshotPayload {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
        Objects.requireNonNull(statistics, "statistics");
    }

    /** Build a payload whose statistics are derived from the records themselves. */
    public static GraphSnapshotPayload of(List<NodeRecord> nodes, List<RelationshipRecord> relationships) {
        return new GraphSnapshotPayload(nodes, relationships, GraphStatistics.from(nodes, relationships));
    }
}
