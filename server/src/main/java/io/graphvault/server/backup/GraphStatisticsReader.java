package io.graphvault.server.backup;

import io.graphvault.core.GraphStatistics;
import io.graphvault.server.graph.CypherStatements;
import io.graphvault.server.graph.GraphStore;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Live store counts via count queries, without extracting records. */
public final class GraphStatisticsReader {

    public GraphStatistics current(GraphStore store) {
        long nodes = count(store.executeQuery(CypherStatements.COUNT_NODES, Map.of()));
        long rels = count(store.executeQuery(CypherStatements.COUNT_RELATIONSHIPS, Map.of()));

        Map<String, Long> perLabel = new TreeMap<>();
        for (Map<String, Object> row : store.executeQuery(CypherStatements.LABEL_COUNTS, Map.of())) {
            perLabel.put(String.valueOf(row.get("label")), asLong(row.get("count")));
        }
        return new GraphStatistics(nodes, rels, perLabel);
    }

    private static long count(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? 0L : asLong(rows.get(0).get("count"));
    }

    private static long asLong(Object v) {
        return v instanceof Number n ? n.longValue() : 0L;
    }
}
