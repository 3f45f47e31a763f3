// file: server/src/main/java/io/graphvault/server/backup/GraphExtractor.java
package io.graphvault.server.backup;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.NodeRecord;
import io.graphvault.core.RelationshipRecord;
import io.graphvault.server.graph.CypherStatements;
import io.graphvault.server.graph.GraphStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads the whole graph into a {@link GraphSnapshotPayload}.
 * <p>
 * One query for nodes, one for relationships; statistics are computed from the
 * returned rows so they always agree with the payload. All-or-nothing: any
 * failure propagates and no partial payload is returned.
 */
public final class GraphExtractor {
    private static final Logger log = Logger.getLogger(GraphExtractor.class.getName());

    /** Label given to nodes that carry none, so every record satisfies the non-empty label rule. */
    public static final String FALLBACK_LABEL = "Node";

    public GraphSnapshotPayload extractAll(GraphStore store) {
        List<NodeRecord> nodes = new ArrayList<>();
        for (Map<String, Object> row : store.executeQuery(CypherStatements.ALL_NODES, Map.of())) {
            nodes.add(toNode(row));
        }

        List<RelationshipRecord> rels = new ArrayList<>();
        for (Map<String, Object> row : store.executeQuery(CypherStatements.ALL_RELATIONSHIPS, Map.of())) {
            rels.add(new RelationshipRecord(
                    String.valueOf(row.get("id")),
                    (String) row.get("type"),
                    String.valueOf(row.get("startId")),
                    String.valueOf(row.get("endId")),
                    props(row)
            ));
        }

        GraphSnapshotPayload payload = GraphSnapshotPayload.of(nodes, rels);
        log.info(String.format("Extracted %d nodes and %d relationships",
                payload.statistics().nodeCount(), payload.statistics().relationshipCount()));
        return payload;
    }

    private static NodeRecord toNode(Map<String, Object> row) {
        String id = String.valueOf(row.get("id"));
        Set<String> labels = new LinkedHashSet<>();
        Object raw = row.get("labels");
        if (raw instanceof Collection<?> c) {
            for (Object l : c) labels.add(String.valueOf(l));
        }
        if (labels.isEmpty()) {
            log.fine("Node " + id + " has no labels, using " + FALLBACK_LABEL);
            labels.add(FALLBACK_LABEL);
        }
        return new NodeRecord(id, labels, props(row));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> props(Map<String, Object> row) {
        Object p = row.get("props");
        return p instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }
}
