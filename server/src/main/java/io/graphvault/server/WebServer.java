// file: server/src/main/java/io/graphvault/server/WebServer.java
package io.graphvault.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphvault.core.ChangeThresholds;
import io.graphvault.core.SnapshotMetadata;
import io.graphvault.server.backup.BackupService;
import io.graphvault.server.backup.BackupService.BackupResult;
import io.graphvault.server.backup.BackupService.Failure;
import io.graphvault.server.backup.BackupService.RestoreOutcome;
import io.graphvault.server.dto.AutoSnapshotRequest;
import io.graphvault.server.dto.CreateSnapshotRequest;
import io.graphvault.server.dto.RestoreRequest;
import io.graphvault.server.dto.SnapshotListResponse;
import io.graphvault.storage.SnapshotJson;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP adapter over BackupService.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map failure kinds to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET  /admin/health           Basic health check
 *   - GET  /snapshots              List snapshots, newest first
 *   - POST /snapshots              Create a snapshot        {"reason": ...}
 *   - POST /snapshots/auto         Create if grown enough   {"minNewNodes", "minNewRelationships", "percentGrowth"}
 *   - GET  /snapshots/status       Live vs. latest snapshot
 *   - GET  /snapshots/{id}         Metadata of one snapshot
 *   - POST /restore                Full restore             {"snapshotId"}
 *   - POST /restore/selective      Selective restore        {"snapshotId", "preserveLabels"}
 *
 * Backup operations block on the graph store, so every request is dispatched
 * off the IO thread first.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = SnapshotJson.newMapper();
    private final BackupService service;
    private final ChangeThresholds defaultThresholds;

    public WebServer(int port, BackupService service, ChangeThresholds defaultThresholds) {
        this.service = service;
        this.defaultThresholds = defaultThresholds;

        HttpHandler router = this::route;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(router);
                        return;
                    }
                    router.handleRequest(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        long start = System.nanoTime();
        int status;
        long opMillis = -1L;
        Throwable error = null;
        try {
            long opStart = System.nanoTime();
            status = switch (path) {
                case "/admin/health" -> "GET".equals(method) ? send(ex, 200, Map.of("status", "ok")) : notAllowed(ex);
                case "/snapshots" -> switch (method) {
                    case "GET" -> handleList(ex);
                    case "POST" -> handleCreate(ex);
                    default -> notAllowed(ex);
                };
                case "/snapshots/auto" -> "POST".equals(method) ? handleAuto(ex) : notAllowed(ex);
                case "/snapshots/status" -> "GET".equals(method) ? handleStatus(ex) : notAllowed(ex);
                case "/restore" -> "POST".equals(method) ? handleRestore(ex, false) : notAllowed(ex);
                case "/restore/selective" -> "POST".equals(method) ? handleRestore(ex, true) : notAllowed(ex);
                default -> {
                    if (path.startsWith("/snapshots/") && "GET".equals(method)) {
                        yield handleInfo(ex, path.substring("/snapshots/".length()));
                    }
                    yield send(ex, 404, Map.of("error", "not found"));
                }
            };
            opMillis = (System.nanoTime() - opStart) / 1_000_000L;
        } catch (BadRequest bad) {
            status = send(ex, bad.status, Map.of("error", bad.getMessage()));
        } catch (Exception e) {
            error = e;
            status = send(ex, 500, Map.of("error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, status, totalMs, opMillis, error);
    }

    // ---------- handlers ----------

    /** GET /snapshots */
    private int handleList(HttpServerExchange ex) {
        List<SnapshotMetadata> all = service.list();
        var dto = new SnapshotListResponse();
        dto.count = all.size();
        dto.maxRetained = service.maxRetained();
        dto.snapshots = all;
        return send(ex, 200, dto);
    }

    /** GET /snapshots/{id} */
    private int handleInfo(HttpServerExchange ex, String id) {
        if (id.isBlank()) {
            return send(ex, 400, Map.of("error", "snapshot id must not be empty"));
        }
        Optional<SnapshotMetadata> meta = service.info(id);
        if (meta.isEmpty()) {
            return send(ex, 404, Map.of("error", "snapshot " + id + " not found"));
        }
        return send(ex, 200, meta.get());
    }

    /** POST /snapshots */
    private int handleCreate(HttpServerExchange ex) throws IOException {
        var req = readBody(ex, CreateSnapshotRequest.class);
        BackupResult r = service.create(req.reason);
        return send(ex, r.ok() ? 201 : statusOf(r.failure()), r);
    }

    /** POST /snapshots/auto */
    private int handleAuto(HttpServerExchange ex) throws IOException {
        var req = readBody(ex, AutoSnapshotRequest.class);
        ChangeThresholds t;
        try {
            t = new ChangeThresholds(
                    req.minNewNodes != null ? req.minNewNodes : defaultThresholds.minNewNodes(),
                    req.minNewRelationships != null ? req.minNewRelationships : defaultThresholds.minNewRelationships(),
                    req.percentGrowth != null ? req.percentGrowth : defaultThresholds.percentGrowth()
            );
        } catch (IllegalArgumentException bad) {
            throw new BadRequest(400, bad.getMessage());
        }
        BackupResult r = service.autoCreate(t);
        int status = !r.ok() ? statusOf(r.failure()) : r.created() ? 201 : 200;
        return send(ex, status, r);
    }

    /** GET /snapshots/status */
    private int handleStatus(HttpServerExchange ex) {
        BackupService.Status s = service.status(defaultThresholds);
        return send(ex, s.ok() ? 200 : statusOf(s.failure()), s);
    }

    /** POST /restore and POST /restore/selective */
    private int handleRestore(HttpServerExchange ex, boolean selective) throws IOException {
        var req = readBody(ex, RestoreRequest.class);
        RestoreOutcome r;
        if (selective) {
            var preserve = req.preserveLabels == null
                    ? new LinkedHashSet<String>()
                    : new LinkedHashSet<>(req.preserveLabels);
            r = service.selectiveRestore(req.snapshotId, preserve);
        } else {
            r = service.restore(req.snapshotId);
        }
        return send(ex, r.ok() ? 200 : statusOf(r.failure()), r);
    }

    // ---------- helpers ----------

    private static int statusOf(Failure failure) {
        return switch (failure) {
            case NONE -> 200;
            case INVALID_REQUEST -> 400;
            case NOT_FOUND -> 404;
            case STORE_UNAVAILABLE -> 503;
            case FAILED -> 500;
        };
    }

    private int notAllowed(HttpServerExchange ex) {
        return send(ex, 405, Map.of("error", "method not allowed"));
    }

    /** Read and decode the request body; an empty body decodes as a fresh DTO. */
    private <T> T readBody(HttpServerExchange ex, Class<T> type) throws IOException {
        ex.startBlocking();
        byte[] data;
        try (InputStream in = ex.getInputStream()) {
            data = in.readNBytes(MAX_BODY_BYTES + 1);
        }
        if (data.length > MAX_BODY_BYTES) {
            throw new BadRequest(413, "request body too large");
        }
        try {
            if (new String(data, StandardCharsets.UTF_8).isBlank()) {
                return json.readValue("{}", type);
            }
            return json.readValue(data, type);
        } catch (JsonProcessingException e) {
            throw new BadRequest(400, "invalid JSON");
        }
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }

    /** Client error detected while decoding a request. */
    private static final class BadRequest extends RuntimeException {
        final int status;

        BadRequest(int status, String message) {
            super(message);
            this.status = status;
        }
    }
}
