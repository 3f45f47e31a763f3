package io.graphvault.server.graph;

import java.util.List;
import java.util.Map;

/**
 * Narrow port onto the property-graph store.
 * <p>
 * Implementations:
 *  - {@link Neo4jGraphStore}: production adapter over the Neo4j Java driver.
 *  - test doubles that interpret the statements {@link CypherStatements} emits.
 * <p>
 * Both execute methods throw {@link StoreConnectionException} when the store
 * cannot be reached and {@link GraphQueryException} when a single statement is
 * rejected. Callers treat the first as fatal and the second as per-record.
 */
public interface GraphStore {

    /** Open (or re-open) the connection. Returns false instead of throwing when unreachable. */
    boolean connect();

    boolean isConnected();

    /** Run a read statement and return its rows as column -> value maps. */
    List<Map<String, Object>> executeQuery(String query, Map<String, Object> params);

    /** Run a write statement in its own transaction. */
    WriteSummary executeWrite(String query, Map<String, Object> params);
}
