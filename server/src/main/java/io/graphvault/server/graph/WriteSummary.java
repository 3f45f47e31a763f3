package io.graphvault.server.graph;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one write statement: returned rows plus the store's update counters.
 */
public record WriteSummary(
        List<Map<String, Object>> rows,
        int nodesCreated,
        int nodesDeleted,
        int relationshipsCreated,
        int relationshipsDeleted,
        int propertiesSet
) {
    public WriteSummary {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /** Value of {@code column} in the first returned row. */
    public Object single(String column) {
        if (rows.isEmpty()) {
            throw new GraphQueryException("statement returned no rows, expected column '" + column + "'");
        }
        Object v = rows.get(0).get(column);
        if (v == null) {
            throw new GraphQueryException("statement returned no value for column '" + column + "'");
        }
        return v;
    }
}
