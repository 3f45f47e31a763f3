package io.graphvault.server.backup;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.NodeRecord;
import io.graphvault.core.RelationshipRecord;
import io.graphvault.core.SnapshotMetadata;
import io.graphvault.server.graph.InMemoryGraphStore;
import io.graphvault.storage.JsonSnapshotSerializer;
import io.graphvault.storage.SnapshotNaming;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SelectiveRestoreTest {

    private final JsonSnapshotSerializer serializer = new JsonSnapshotSerializer();

    private Path snapshotOf(Path dir, InMemoryGraphStore store) {
        GraphSnapshotPayload payload = new GraphExtractor().extractAll(store);
        String ts = "20250101_120000_000";
        Path file = dir.resolve(SnapshotNaming.fileName(ts));
        serializer.write(payload, SnapshotMetadata.forFullSnapshot(ts, Instant.EPOCH, "test", payload.statistics()), file);
        return file;
    }

    @Test
    void preserved_labels_stay_untouched_and_others_are_restored(@TempDir Path dir) {
        var store = new InMemoryGraphStore();
        String alice = store.addNode(Set.of("User"), Map.of("name", "alice", "plan", "free"));
        String order = store.addNode(Set.of("Order"), Map.of("name", "o-1", "total", 10L));
        store.addRelationship("PLACED", alice, order, Map.of());
        Path file = snapshotOf(dir, store);

        // live changes after the snapshot
        store.nodeNamed("alice").props.put("plan", "pro");
        store.deleteNode(order);

        RestoreReport report = new GraphRestorer(store, serializer, "name").restoreSelective(file, Set.of("User"));

        assertEquals(1, report.nodesPreserved());
        assertEquals(1, report.nodesRestored());
        assertEquals("pro", store.nodeNamed("alice").props.get("plan"));
        assertEquals(1, store.nodesWithLabel("User").size());
        assertEquals(10L, store.nodeNamed("o-1").props.get("total"));
        // the User endpoint was not remapped, so the edge is dropped
        assertEquals(1, report.relationshipsSkipped());
        assertTrue(store.relationships().isEmpty());
    }

    @Test
    void running_twice_is_idempotent_for_named_nodes(@TempDir Path dir) {
        var store = new InMemoryGraphStore();
        String a = store.addNode(Set.of("User"), Map.of("name", "a"));
        String b = store.addNode(Set.of("User"), Map.of("name", "b"));
        String o = store.addNode(Set.of("Order"), Map.of("name", "o"));
        store.addRelationship("KNOWS", a, b, Map.of());
        store.addRelationship("PLACED", a, o, Map.of("n", 1L));
        Path file = snapshotOf(dir, store);

        var restorer = new GraphRestorer(store, serializer, "name");
        restorer.restoreSelective(file, Set.of());
        int nodesAfterFirst = store.nodes().size();
        int relsAfterFirst = store.relationships().size();

        RestoreReport second = restorer.restoreSelective(file, Set.of());

        assertEquals(3, nodesAfterFirst);
        assertEquals(2, relsAfterFirst);
        assertEquals(nodesAfterFirst, store.nodes().size());
        assertEquals(relsAfterFirst, store.relationships().size());
        assertEquals(2, second.relationshipsRestored());
    }

    @Test
    void nodes_without_natural_key_are_created_fresh(@TempDir Path dir) {
        var n = new NodeRecord("1", Set.of("Event"), Map.of("kind", "click"));
        GraphSnapshotPayload payload = GraphSnapshotPayload.of(List.of(n), List.of());
        Path file = dir.resolve(SnapshotNaming.fileName("20250101_000000_000"));
        serializer.write(payload, SnapshotMetadata.forFullSnapshot("20250101_000000_000", Instant.EPOCH, "t",
                payload.statistics()), file);

        var store = new InMemoryGraphStore();
        var restorer = new GraphRestorer(store, serializer, "name");
        restorer.restoreSelective(file, Set.of());
        restorer.restoreSelective(file, Set.of());

        assertEquals(2, store.nodesWithLabel("Event").size());
    }

    @Test
    void configurable_natural_key_drives_upserts(@TempDir Path dir) {
        var u = new NodeRecord("1", Set.of("User"), Map.of("email", "a@x", "score", 1L));
        var v = new NodeRecord("2", Set.of("User"), Map.of("email", "b@x"));
        var rel = new RelationshipRecord("9", "KNOWS", "1", "2", Map.of());
        GraphSnapshotPayload payload = GraphSnapshotPayload.of(List.of(u, v), List.of(rel));
        Path file = dir.resolve(SnapshotNaming.fileName("20250101_000000_000"));
        serializer.write(payload, SnapshotMetadata.forFullSnapshot("20250101_000000_000", Instant.EPOCH, "t",
                payload.statistics()), file);

        var store = new InMemoryGraphStore();
        store.addNode(Set.of("User"), Map.of("email", "a@x", "score", 99L));

        RestoreReport report = new GraphRestorer(store, serializer, "email").restoreSelective(file, Set.of());

        assertEquals(2, store.nodes().size());
        assertEquals(1, store.relationships().size());
        assertEquals(2, report.nodesRestored());
        long score = (Long) store.nodes().get(0).props.get("score");
        assertEquals(1L, score);
    }

    @Test
    void blank_natural_key_creates_fresh_node(@TempDir Path dir) {
        var n = new NodeRecord("1", Set.of("Tag"), Map.of("name", "", "color", "red"));
        GraphSnapshotPayload payload = GraphSnapshotPayload.of(List.of(n), List.of());
        Path file = dir.resolve(SnapshotNaming.fileName("20250101_000000_000"));
        serializer.write(payload, SnapshotMetadata.forFullSnapshot("20250101_000000_000", Instant.EPOCH, "t",
                payload.statistics()), file);

        var store = new InMemoryGraphStore();
        store.addNode(Set.of("Tag"), Map.of("name", "", "color", "blue"));
        var restorer = new GraphRestorer(store, serializer, "name");
        restorer.restoreSelective(file, Set.of());
        restorer.restoreSelective(file, Set.of());

        assertEquals(3, store.nodesWithLabel("Tag").size());
        assertEquals(1, store.nodes().stream().filter(t -> "blue".equals(t.props.get("color"))).count());
    }

    @Test
    void invalid_label_and_type_are_counted_in_selective_restore(@TempDir Path dir) {
        var good = new NodeRecord("1", Set.of("User"), Map.of("name", "good"));
        var bad = new NodeRecord("2", Set.of("No Such"), Map.of("name", "bad"));
        var other = new NodeRecord("3", Set.of("User"), Map.of("name", "other"));
        var badType = new RelationshipRecord("10", "BAD TYPE", "1", "3", Map.of());
        var knows = new RelationshipRecord("11", "KNOWS", "1", "3", Map.of());
        var toBad = new RelationshipRecord("12", "KNOWS", "1", "2", Map.of());
        GraphSnapshotPayload payload = GraphSnapshotPayload.of(List.of(good, bad, other), List.of(badType, knows, toBad));
        Path file = dir.resolve(SnapshotNaming.fileName("20250101_000000_000"));
        serializer.write(payload, SnapshotMetadata.forFullSnapshot("20250101_000000_000", Instant.EPOCH, "t",
                payload.statistics()), file);

        var store = new InMemoryGraphStore();
        RestoreReport report = new GraphRestorer(store, serializer, "name").restoreSelective(file, Set.of());

        assertEquals(2, report.nodesRestored());
        assertEquals(1, report.nodeFailures());
        assertEquals(1, report.relationshipFailures());
        assertEquals(1, report.relationshipsRestored());
        assertEquals(1, report.relationshipsSkipped());
        assertEquals(2, store.nodes().size());
        assertEquals(1, store.relationships().size());
    }
}
