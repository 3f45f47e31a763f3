// file: server/src/main/java/io/graphvault/server/Main.java
package io.graphvault.server;

import io.graphvault.server.backup.BackupService;
import io.graphvault.server.graph.Neo4jGraphStore;
import io.graphvault.storage.JsonSnapshotSerializer;
import io.graphvault.storage.RetentionManager;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the backup server.
 *
 * Responsibilities:
 *  - Load logging setup and parse configuration from CLI.
 *  - Wire the Neo4j adapter, snapshot serializer and retention manager.
 *  - Create BackupService and WebServer, start HTTP.
 *  - Stop the server and close the driver on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = BackupConfig.fromArgs(args);

        // ------ Storage ------
        var serializer = new JsonSnapshotSerializer();
        var retention = new RetentionManager(Path.of(cfg.snapshotDir()), cfg.maxRetained(), serializer);

        // ------ Graph store ------
        var store = new Neo4jGraphStore(cfg.neo4jUri(), cfg.neo4jUser(), cfg.neo4jPassword());
        if (!store.connect()) {
            // not fatal: every operation retries the connection
            log.warning("Graph store unavailable at startup: " + cfg.neo4jUri());
        }

        var service = new BackupService(store, serializer, retention, cfg.naturalKey(), Clock.systemUTC());

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), service, cfg.thresholds());
        web.start();

        log.info(String.format("GraphVault listening on http://localhost:%d, snapshots in %s (keep %d)",
                cfg.httpPort(), retention.directory().toAbsolutePath(), cfg.maxRetained()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            store.close();
        }));
    }

    private static void configureLogging() {
        // an explicit -Djava.util.logging.config.file wins over the bundled setup
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
