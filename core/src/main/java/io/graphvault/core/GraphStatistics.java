package io.graphvault.core;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary counts for a graph: either a live store or the contents of a snapshot.
 *
 * @param perLabelCounts label -> number of nodes carrying it; empty when unknown
 */
public record GraphStatistics(long nodeCount, long relationshipCount, Map<String, Long> perLabelCounts) {

    public GraphStatistics {
        if (nodeCount < 0 || relationshipCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
        perLabelCounts = perLabelCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(perLabelCounts));
    }

    public static GraphStatistics of(long nodeCount, long relationshipCount) {
        return new GraphStatistics(nodeCount, relationshipCount, Map.of());
    }

    /**
     * Compute statistics from extracted records, so counts always agree with
     * the payload they describe.
     */
    public static GraphStatistics from(Collection<NodeRecord> nodes, Collection<RelationshipRecord> relationships) {
        Map<String, Long> perLabel = new TreeMap<>();
        for (NodeRecord n : nodes) {
            for (String label : n.labels()) {
                perLabel.merge(label, 1L, Long::sum);
            }
        }
        return new GraphStatistics(nodes.size(), relationships.size(), perLabel);
    }
}
