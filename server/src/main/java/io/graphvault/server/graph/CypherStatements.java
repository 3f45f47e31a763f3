package io.graphvault.server.graph;

import java.util.Collection;

/**
 * Every Cypher statement the backup engine sends.
 * <p>
 * Values always travel as parameters ({@code $props}, {@code $key},
 * {@code $startId}, {@code $endId}); identifiers go through {@link CypherLabels}.
 */
public final class CypherStatements {

    public static final String ALL_NODES =
            "MATCH (n) RETURN elementId(n) AS id, labels(n) AS labels, properties(n) AS props";

    public static final String ALL_RELATIONSHIPS =
            "MATCH (a)-[r]->(b) RETURN elementId(r) AS id, type(r) AS type, "
                    + "elementId(a) AS startId, elementId(b) AS endId, properties(r) AS props";

    public static final String COUNT_NODES = "MATCH (n) RETURN count(n) AS count";

    public static final String COUNT_RELATIONSHIPS = "MATCH ()-[r]->() RETURN count(r) AS count";

    public static final String LABEL_COUNTS =
            "MATCH (n) UNWIND labels(n) AS label RETURN label, count(*) AS count";

    public static final String CLEAR_ALL = "MATCH (n) DETACH DELETE n";

    private CypherStatements() {
        // constants
    }

    /** Create a node with exactly {@code labels} and {@code $props}; returns {@code id}. */
    public static String createNode(Collection<String> labels) {
        return "CREATE (n" + CypherLabels.labelExpression(labels) + ") SET n = $props RETURN elementId(n) AS id";
    }

    /**
     * Upsert a node on {@code (labels, naturalKey = $key)}, then replace its
     * properties with {@code $props}; returns {@code id}.
     */
    public static String mergeNodeByKey(Collection<String> labels, String naturalKey) {
        return "MERGE (n" + CypherLabels.labelExpression(labels)
                + " {" + CypherLabels.requireValid(naturalKey, "natural key") + ": $key})"
                + " SET n = $props RETURN elementId(n) AS id";
    }

    public static String createRelationship(String type) {
        return relationship("CREATE", type);
    }

    /** Upsert on {@code (type, start, end)}: re-running never duplicates the edge. */
    public static String mergeRelationship(String type) {
        return relationship("MERGE", type);
    }

    private static String relationship(String verb, String type) {
        return "MATCH (a), (b) WHERE elementId(a) = $startId AND elementId(b) = $endId "
                + verb + " (a)-[r:" + CypherLabels.requireValid(type, "relationship type") + "]->(b)"
                + " SET r = $props RETURN elementId(r) AS id";
    }
}
