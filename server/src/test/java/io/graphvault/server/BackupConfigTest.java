package io.graphvault.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackupConfigTest {

    @Test
    void defaults_apply_without_flags_or_env() {
        BackupConfig cfg = BackupConfig.parse(new String[0], Map.of());

        assertEquals("./data/snapshots", cfg.snapshotDir());
        assertEquals(1, cfg.maxRetained());
        assertEquals(8090, cfg.httpPort());
        assertEquals("bolt://localhost:7687", cfg.neo4jUri());
        assertEquals("neo4j", cfg.neo4jUser());
        assertEquals("name", cfg.naturalKey());
        assertEquals(50, cfg.thresholds().minNewNodes());
        assertEquals(100, cfg.thresholds().minNewRelationships());
        assertEquals(0.10, cfg.thresholds().percentGrowth(), 1e-9);
    }

    @Test
    void environment_supplies_connection_defaults() {
        BackupConfig cfg = BackupConfig.parse(new String[0], Map.of(
                "NEO4J_URI", "neo4j://db:7687",
                "NEO4J_USERNAME", "backup",
                "NEO4J_PASSWORD", "s3cret"));

        assertEquals("neo4j://db:7687", cfg.neo4jUri());
        assertEquals("backup", cfg.neo4jUser());
        assertEquals("s3cret", cfg.neo4jPassword());
        assertFalse(cfg.toString().contains("s3cret"));
    }

    @Test
    void flags_override_config_file_and_env(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("graphvault.json");
        Files.writeString(file, "{\"maxRetained\": 5, \"httpPort\": 9000, \"naturalKey\": \"email\", \"percentGrowth\": 0.25}");

        BackupConfig cfg = BackupConfig.parse(new String[]{
                "--config", file.toString(),
                "--http-port", "9100",
                "-d", "/tmp/snaps",
                "--min-new-nodes", "7"
        }, Map.of("NEO4J_URI", "bolt://env:7687"));

        assertEquals(5, cfg.maxRetained());
        assertEquals(9100, cfg.httpPort());
        assertEquals("/tmp/snaps", cfg.snapshotDir());
        assertEquals("email", cfg.naturalKey());
        assertEquals(7, cfg.minNewNodes());
        assertEquals(0.25, cfg.percentGrowth(), 1e-9);
        assertEquals("bolt://env:7687", cfg.neo4jUri());
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> BackupConfig.parse(new String[]{"--max-retained", "0"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> BackupConfig.parse(new String[]{"--http-port", "abc"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> BackupConfig.parse(new String[]{"--natural-key", "name}) //"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> BackupConfig.parse(new String[]{"--percent-growth", "-1"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> BackupConfig.parse(new String[]{"--snapshot-dir"}, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> BackupConfig.parse(new String[]{"--bogus"}, Map.of()));
    }
}
