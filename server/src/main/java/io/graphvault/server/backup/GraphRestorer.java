// file: server/src/main/java/io/graphvault/server/backup/GraphRestorer.java
package io.graphvault.server.backup;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.IdentityRemapper;
import io.graphvault.core.NodeRecord;
import io.graphvault.core.RelationshipRecord;
import io.graphvault.server.graph.CypherLabels;
import io.graphvault.server.graph.CypherStatements;
import io.graphvault.server.graph.GraphQueryException;
import io.graphvault.server.graph.GraphStore;
import io.graphvault.server.graph.StoreConnectionException;
import io.graphvault.storage.SnapshotDocument;
import io.graphvault.storage.SnapshotNaming;
import io.graphvault.storage.SnapshotSerializer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds a graph from a snapshot file.
 * <p>
 * Full restore:
 *   VALIDATING -> CLEARING -> CREATING_NODES -> CREATING_RELATIONSHIPS -> DONE
 *  - VALIDATING loads the file and checks the connection; any failure here
 *    aborts with the store unchanged.
 *  - CLEARING deletes every node and relationship.
 *  - Node and relationship failures, including an unusable label or type, are
 *    counted and logged; only a lost connection aborts. After CLEARING an abort
 *    leaves a partial graph, and the restore can simply be re-run from the same
 *    snapshot.
 * <p>
 * Selective restore does not clear. Nodes carrying a preserved label are left
 * alone; the rest are upserted on the natural key when they have a non-blank one
 * and created otherwise. Relationships are upserted on (type, start, end).
 * <p>
 * Every restore uses its own {@link IdentityRemapper}; ids from the snapshot are
 * never reused as store ids.
 */
public final class GraphRestorer {
    private static final Logger log = Logger.getLogger(GraphRestorer.class.getName());

    public static final String DEFAULT_NATURAL_KEY = "name";

    private final GraphStore store;
    private final SnapshotSerializer serializer;
    private final String naturalKey;

    public GraphRestorer(GraphStore store, SnapshotSerializer serializer, String naturalKey) {
        this.store = store;
        this.serializer = serializer;
        this.naturalKey = CypherLabels.requireValid(naturalKey, "natural key");
    }

    public RestoreReport restoreFull(Path snapshotFile) {
        String snapshotId = idOf(snapshotFile);
        Pass pass = new Pass(snapshotId);

        GraphSnapshotPayload payload = pass.validate(snapshotFile);

        pass.enter(RestorePhase.CLEARING);
        try {
            var cleared = store.executeWrite(CypherStatements.CLEAR_ALL, Map.of());
            log.info(String.format("Cleared graph before restoring %s (%d nodes, %d relationships deleted)",
                    snapshotId, cleared.nodesDeleted(), cleared.relationshipsDeleted()));
        } catch (RuntimeException e) {
            // nothing has been written yet; any failure here is fatal
            throw pass.fail(e);
        }

        pass.enter(RestorePhase.CREATING_NODES);
        for (NodeRecord node : payload.nodes()) {
            pass.node(node, () -> CypherStatements.createNode(node.labels()), Map.of("props", node.properties()));
        }

        pass.enter(RestorePhase.CREATING_RELATIONSHIPS);
        for (RelationshipRecord rel : payload.relationships()) {
            pass.relationship(rel, () -> CypherStatements.createRelationship(rel.type()));
        }

        return pass.done();
    }

    public RestoreReport restoreSelective(Path snapshotFile, Set<String> preserveLabels) {
        String snapshotId = idOf(snapshotFile);
        Pass pass = new Pass(snapshotId);
        Set<String> preserved = preserveLabels == null ? Set.of() : Set.copyOf(preserveLabels);

        GraphSnapshotPayload payload = pass.validate(snapshotFile);

        pass.enter(RestorePhase.CREATING_NODES);
        for (NodeRecord node : payload.nodes()) {
            if (node.hasAnyLabel(preserved)) {
                pass.preserved++;
                continue;
            }
            Object key = node.properties().get(naturalKey);
            if (hasKey(key)) {
                Map<String, Object> params = new HashMap<>();
                params.put("key", key);
                params.put("props", node.properties());
                pass.node(node, () -> CypherStatements.mergeNodeByKey(node.labels(), naturalKey), params);
            } else {
                pass.node(node, () -> CypherStatements.createNode(node.labels()), Map.of("props", node.properties()));
            }
        }

        pass.enter(RestorePhase.CREATING_RELATIONSHIPS);
        for (RelationshipRecord rel : payload.relationships()) {
            pass.relationship(rel, () -> CypherStatements.mergeRelationship(rel.type()));
        }

        return pass.done();
    }

    // a blank string key would collapse unrelated nodes onto one MERGE match
    private static boolean hasKey(Object key) {
        if (key instanceof String s) {
            return !s.isBlank();
        }
        return key != null;
    }

    private static String idOf(Path file) {
        return SnapshotNaming.timestampOf(file).orElse(file.getFileName().toString());
    }

    /** Mutable state of one restore run. */
    private final class Pass {
        final String snapshotId;
        final IdentityRemapper remapper = new IdentityRemapper();
        final List<String> warnings = new ArrayList<>();
        RestorePhase phase = RestorePhase.IDLE;
        int nodesRestored;
        int preserved;
        int relationshipsRestored;
        int relationshipsSkipped;
        int nodeFailures;
        int relationshipFailures;

        Pass(String snapshotId) {
            this.snapshotId = snapshotId;
        }

        void enter(RestorePhase next) {
            log.fine("Restore " + snapshotId + ": " + phase + " -> " + next);
            phase = next;
        }

        GraphSnapshotPayload validate(Path snapshotFile) {
            enter(RestorePhase.VALIDATING);
            try {
                SnapshotDocument doc = serializer.read(snapshotFile);
                GraphSnapshotPayload payload = doc.payload();
                if (!store.isConnected() && !store.connect()) {
                    throw new StoreConnectionException("Graph store is not reachable");
                }
                log.info(String.format("Restoring snapshot %s: %d nodes, %d relationships",
                        snapshotId, payload.nodes().size(), payload.relationships().size()));
                return payload;
            } catch (RuntimeException e) {
                throw fail(e);
            }
        }

        void node(NodeRecord node, StatementSource statement, Map<String, Object> params) {
            try {
                String newId = String.valueOf(store.executeWrite(statement.get(), params).single("id"));
                remapper.register(node.legacyId(), newId);
                nodesRestored++;
            } catch (StoreConnectionException e) {
                throw fail(e);
            } catch (GraphQueryException | IllegalArgumentException | IllegalStateException e) {
                nodeFailures++;
                recordFailure(new RecordRestoreException(node.legacyId(),
                        "node " + node.legacyId() + " " + node.labels() + ": " + e.getMessage(), e));
            }
        }

        void relationship(RelationshipRecord rel, StatementSource statement) {
            Optional<String> start = remapper.resolve(rel.startLegacyId());
            Optional<String> end = remapper.resolve(rel.endLegacyId());
            if (start.isEmpty() || end.isEmpty()) {
                relationshipsSkipped++;
                String msg = "skipped relationship " + rel.legacyId() + " (" + rel.type()
                        + "): endpoint not restored";
                warnings.add(msg);
                log.warning("Restore " + snapshotId + ": " + msg);
                return;
            }
            Map<String, Object> params = new HashMap<>();
            params.put("startId", start.get());
            params.put("endId", end.get());
            params.put("props", rel.properties());
            try {
                store.executeWrite(statement.get(), params);
                relationshipsRestored++;
            } catch (StoreConnectionException e) {
                throw fail(e);
            } catch (GraphQueryException | IllegalArgumentException e) {
                relationshipFailures++;
                recordFailure(new RecordRestoreException(rel.legacyId(),
                        "relationship " + rel.legacyId() + " (" + rel.type() + "): " + e.getMessage(), e));
            }
        }

        void recordFailure(RecordRestoreException e) {
            warnings.add(e.getMessage());
            log.log(Level.WARNING, "Restore " + snapshotId + ": " + e.getMessage(), e.getCause());
        }

        RestoreFailedException fail(RuntimeException cause) {
            if (cause instanceof RestoreFailedException already) {
                return already;
            }
            RestorePhase failedIn = phase;
            phase = RestorePhase.FAILED;
            return new RestoreFailedException(failedIn, snapshotId, cause);
        }

        RestoreReport done() {
            enter(RestorePhase.DONE);
            RestoreReport report = new RestoreReport(nodesRestored, preserved, relationshipsRestored,
                    relationshipsSkipped, nodeFailures, relationshipFailures, warnings);
            log.info(String.format("Restore %s done: nodes=%d preserved=%d rels=%d skipped=%d nodeFailures=%d relFailures=%d",
                    snapshotId, nodesRestored, preserved, relationshipsRestored, relationshipsSkipped,
                    nodeFailures, relationshipFailures));
            return report;
        }
    }

    /** Statement text is built lazily so an invalid label or type surfaces as a per-record failure. */
    @FunctionalInterface
    private interface StatementSource {
        String get();
    }
}
