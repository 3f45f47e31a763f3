package io.graphvault.server;

import io.graphvault.core.ChangeThresholds;
import io.graphvault.server.backup.BackupService;
import io.graphvault.server.graph.InMemoryGraphStore;
import io.graphvault.storage.JsonSnapshotSerializer;
import io.graphvault.storage.RetentionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks of the admin HTTP surface over an in-memory store.
 *
 * Focus:
 *  - Create / list / info round trip and status codes.
 *  - Restore without snapshots -> 404, invalid JSON -> 400.
 *  - Unknown routes -> 404, wrong method -> 405.
 */
class WebServerTest {

    private static final int PORT = 18090; // test-only port
    private WebServer server;
    private HttpClient client;
    private InMemoryGraphStore store;

    @TempDir
    Path dir;

    @BeforeEach
    void startServer() {
        store = new InMemoryGraphStore();
        String a = store.addNode(Set.of("User"), Map.of("name", "alice"));
        String o = store.addNode(Set.of("Order"), Map.of("name", "o-1"));
        store.addRelationship("PLACED", a, o, Map.of());

        var serializer = new JsonSnapshotSerializer();
        var service = new BackupService(store, serializer, new RetentionManager(dir, 1, serializer), "name",
                Clock.systemUTC());
        server = new WebServer(PORT, service, ChangeThresholds.defaults());
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        var req = HttpRequest.newBuilder(URI.create("http://localhost:" + PORT + path)).GET().build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        var req = HttpRequest.newBuilder(URI.create("http://localhost:" + PORT + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_is_ok() throws Exception {
        var resp = get("/admin/health");
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("\"ok\""));
    }

    @Test
    void create_then_list_and_info() throws Exception {
        var created = post("/snapshots", "{\"reason\":\"before deploy\"}");
        assertEquals(201, created.statusCode(), created.body());
        assertTrue(created.body().contains("before deploy"));

        var list = get("/snapshots");
        assertEquals(200, list.statusCode());
        assertTrue(list.body().contains("\"count\":1"), list.body());

        String ts = list.body().replaceAll("(?s).*\"timestamp\":\"([^\"]+)\".*", "$1");
        var info = get("/snapshots/" + ts);
        assertEquals(200, info.statusCode(), info.body());
        assertTrue(info.body().contains("\"nodeCount\":2"), info.body());
    }

    @Test
    void auto_create_then_no_op() throws Exception {
        assertEquals(201, post("/snapshots/auto", "").statusCode());

        var second = post("/snapshots/auto", "{\"minNewNodes\": 10}");
        assertEquals(200, second.statusCode(), second.body());
        assertTrue(second.body().contains("\"created\":false"), second.body());
    }

    @Test
    void status_reports_recommendation() throws Exception {
        var resp = get("/snapshots/status");
        assertEquals(200, resp.statusCode(), resp.body());
        assertTrue(resp.body().contains("\"backupRecommended\":true"), resp.body());
    }

    @Test
    void restore_round_trip_and_selective() throws Exception {
        assertEquals(201, post("/snapshots", "{}").statusCode());
        store.addNode(Set.of("Junk"), Map.of());

        var full = post("/restore", "{}");
        assertEquals(200, full.statusCode(), full.body());
        assertEquals(2, store.nodes().size());

        var selective = post("/restore/selective", "{\"preserveLabels\":[\"User\"]}");
        assertEquals(200, selective.statusCode(), selective.body());
        assertTrue(selective.body().contains("\"nodesPreserved\":1"), selective.body());
    }

    @Test
    void restore_without_snapshots_is_404() throws Exception {
        var resp = post("/restore", "{}");
        assertEquals(404, resp.statusCode());
        assertTrue(resp.body().contains("No snapshots found"));
    }

    @Test
    void bad_requests_are_rejected() throws Exception {
        assertEquals(400, post("/snapshots", "{not json").statusCode());
        assertEquals(400, post("/snapshots/auto", "{\"percentGrowth\": -2}").statusCode());
        assertEquals(400, post("/restore", "{\"snapshotId\":\"..%2Fetc\"}").statusCode());
        assertEquals(404, get("/snapshots/20990101_000000_000").statusCode());
        assertEquals(404, get("/nope").statusCode());
        assertEquals(405, post("/admin/health", "").statusCode());
    }

    @Test
    void unreachable_store_maps_to_503() throws Exception {
        store.unreachable();
        assertEquals(503, post("/snapshots", "{}").statusCode());
    }
}
