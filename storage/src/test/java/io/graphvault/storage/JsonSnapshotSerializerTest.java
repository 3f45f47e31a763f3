package io.graphvault.storage;

import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.NodeRecord;
import io.graphvault.core.RelationshipRecord;
import io.graphvault.core.SnapshotMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonSnapshotSerializerTest {

    private static GraphSnapshotPayload samplePayload() {
        Map<String, Object> userProps = new LinkedHashMap<>();
        userProps.put("name", "alice");
        userProps.put("age", 42L);
        userProps.put("score", 3.5);
        userProps.put("active", true);
        userProps.put("tags", List.of("a", "b"));
        userProps.put("born", LocalDate.of(1983, 5, 1));
        userProps.put("seen", OffsetDateTime.of(2025, 6, 23, 19, 4, 59, 0, ZoneOffset.UTC));

        var user = new NodeRecord("4:x:1", Set.of("User"), userProps);
        var order = new NodeRecord("4:x:2", Set.of("Order"), Map.of("total", 12L));
        var placed = new RelationshipRecord("5:x:1", "PLACED", "4:x:1", "4:x:2", Map.of("weight", 1.0));
        return GraphSnapshotPayload.of(List.of(user, order), List.of(placed));
    }

    private static SnapshotMetadata metadataFor(GraphSnapshotPayload payload, String ts) {
        return SnapshotMetadata.forFullSnapshot(ts, Instant.parse("2025-06-23T19:04:59Z"), "manual", payload.statistics());
    }

    @Test
    void write_then_read_preserves_records_and_value_types(@TempDir Path dir) {
        var serializer = new JsonSnapshotSerializer();
        var payload = samplePayload();
        Path file = dir.resolve(SnapshotNaming.fileName("20250623_190459_000"));

        long size = serializer.write(payload, metadataFor(payload, "20250623_190459_000"), file);
        SnapshotDocument doc = serializer.read(file);

        assertTrue(size > 0);
        assertEquals(payload.nodes(), doc.payload().nodes());
        assertEquals(payload.relationships(), doc.payload().relationships());
        assertEquals(2, doc.payload().statistics().nodeCount());
        assertEquals(1L, doc.payload().statistics().perLabelCounts().get("User"));
        assertEquals("manual", doc.metadata().reason());

        Object born = doc.payload().nodes().get(0).properties().get("born");
        assertInstanceOf(LocalDate.class, born);
    }

    @Test
    void write_leaves_no_tmp_file_behind(@TempDir Path dir) throws Exception {
        var serializer = new JsonSnapshotSerializer();
        var payload = samplePayload();
        serializer.write(payload, metadataFor(payload, "20250101_000000_000"),
                dir.resolve(SnapshotNaming.fileName("20250101_000000_000")));

        try (var files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(SnapshotNaming.TMP_SUFFIX)));
        }
    }

    @Test
    void read_metadata_does_not_need_the_data_section(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("graph_snapshot_20250101_000000_000.json");
        Files.writeString(file, "{\"metadata\":{\"timestamp\":\"20250101_000000_000\",\"reason\":\"x\","
                + "\"nodeCount\":7,\"relationshipCount\":3},\"data\":\"ignored\"}", StandardCharsets.UTF_8);

        SnapshotMetadata meta = new JsonSnapshotSerializer().readMetadata(file);

        assertEquals("20250101_000000_000", meta.timestamp());
        assertEquals(7, meta.nodeCount());
        assertEquals(3, meta.relationshipCount());
        assertEquals(SnapshotMetadata.SCHEMA_VERSION, meta.schemaVersion());
    }

    @Test
    void missing_required_sections_is_a_parse_error(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("graph_snapshot_20250101_000000_000.json");
        Files.writeString(file, "{\"metadata\":{\"timestamp\":\"20250101_000000_000\"},"
                + "\"data\":{\"nodes\":[]}}", StandardCharsets.UTF_8);

        var ex = assertThrows(SnapshotParseException.class, () -> new JsonSnapshotSerializer().read(file));
        assertTrue(ex.getMessage().contains("relationships"));
    }

    @Test
    void truncated_file_is_a_parse_error(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("graph_snapshot_20250101_000000_000.json");
        Files.writeString(file, "{\"metadata\":{\"timesta", StandardCharsets.UTF_8);

        assertThrows(SnapshotParseException.class, () -> new JsonSnapshotSerializer().read(file));
    }

    @Test
    void nested_map_property_is_rejected_on_read(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("graph_snapshot_20250101_000000_000.json");
        Files.writeString(file, "{\"metadata\":{\"timestamp\":\"20250101_000000_000\"},"
                + "\"data\":{\"nodes\":[{\"legacyId\":\"1\",\"labels\":[\"User\"],\"properties\":{\"addr\":{\"city\":\"x\"}}}],"
                + "\"relationships\":[],\"statistics\":{\"nodeCount\":1,\"relationshipCount\":0}}}", StandardCharsets.UTF_8);

        assertThrows(SnapshotParseException.class, () -> new JsonSnapshotSerializer().read(file));
    }

    @Test
    void missing_file_reports_not_found_with_its_id(@TempDir Path dir) {
        Path file = dir.resolve("graph_snapshot_20990101_000000_000.json");

        var ex = assertThrows(SnapshotNotFoundException.class, () -> new JsonSnapshotSerializer().read(file));
        assertEquals("20990101_000000_000", ex.snapshotId());
    }
}
