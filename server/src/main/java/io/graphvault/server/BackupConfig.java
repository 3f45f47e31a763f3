// file: server/src/main/java/io/graphvault/server/BackupConfig.java
package io.graphvault.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphvault.core.ChangeThresholds;
import io.graphvault.server.dto.JsonConfig;
import io.graphvault.server.graph.CypherLabels;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Backup server configuration.
 * <p>
 * Precedence, lowest first: built-in defaults, environment
 * ({@code NEO4J_URI}, {@code NEO4J_USERNAME}, {@code NEO4J_PASSWORD}),
 * JSON file given by {@code --config}, CLI flags.
 */
public record BackupConfig(
        String snapshotDir,
        int maxRetained,
        int httpPort,
        String neo4jUri,
        String neo4jUser,
        String neo4jPassword,
        String naturalKey,
        long minNewNodes,
        long minNewRelationships,
        double percentGrowth
) {
    public BackupConfig {
        if (maxRetained <= 0) throw new IllegalArgumentException("max-retained must be > 0");
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range");
        CypherLabels.requireValid(naturalKey, "natural-key");
        // validates the threshold values as a side effect
        new ChangeThresholds(minNewNodes, minNewRelationships, percentGrowth);
    }

    @Override
    public String toString() {
        return "BackupConfig[snapshotDir=" + snapshotDir + ", maxRetained=" + maxRetained
                + ", httpPort=" + httpPort + ", neo4jUri=" + neo4jUri + ", neo4jUser=" + neo4jUser
                + ", naturalKey=" + naturalKey + ", thresholds=" + thresholds() + "]";
    }

    public ChangeThresholds thresholds() {
        return new ChangeThresholds(minNewNodes, minNewRelationships, percentGrowth);
    }

    /**
     * Parse CLI args against the process environment. Prints usage and exits
     * on --help or invalid input.
     *
     * Supported flags:
     *   --snapshot-dir,  -d  <path>
     *   --max-retained,  -m  <n>
     *   --http-port,     -p  <port>
     *   --neo4j-uri           <uri>
     *   --neo4j-user          <user>
     *   --neo4j-password      <password>
     *   --natural-key         <property>
     *   --min-new-nodes       <n>
     *   --min-new-rels        <n>
     *   --percent-growth      <fraction>
     *   --config,        -c  <path to JSON>
     *   --help,          -h
     */
    public static BackupConfig fromArgs(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) printHelpAndExit();
        }
        try {
            return parse(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return null; // unreachable
        }
    }

    /** Same as {@link #fromArgs} but with an explicit environment, throwing instead of exiting. */
    static BackupConfig parse(String[] args, Map<String, String> env) {
        // Defaults
        String snapshotDir = "./data/snapshots";
        int maxRetained = 1;
        int httpPort = 8090;
        String uri = env.getOrDefault("NEO4J_URI", "bolt://localhost:7687");
        String user = env.getOrDefault("NEO4J_USERNAME", "neo4j");
        String password = env.getOrDefault("NEO4J_PASSWORD", "");
        String naturalKey = "name";
        long minNewNodes = ChangeThresholds.DEFAULT_MIN_NEW_NODES;
        long minNewRels = ChangeThresholds.DEFAULT_MIN_NEW_RELATIONSHIPS;
        double percentGrowth = ChangeThresholds.DEFAULT_PERCENT_GROWTH;

        // Config file first, so flags can override it
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                JsonConfig file = loadJson(Path.of(value(args, i)));
                if (file.snapshotDir != null) snapshotDir = file.snapshotDir;
                if (file.maxRetained != null) maxRetained = file.maxRetained;
                if (file.httpPort != null) httpPort = file.httpPort;
                if (file.neo4jUri != null) uri = file.neo4jUri;
                if (file.neo4jUser != null) user = file.neo4jUser;
                if (file.neo4jPassword != null) password = file.neo4jPassword;
                if (file.naturalKey != null) naturalKey = file.naturalKey;
                if (file.minNewNodes != null) minNewNodes = file.minNewNodes;
                if (file.minNewRelationships != null) minNewRels = file.minNewRelationships;
                if (file.percentGrowth != null) percentGrowth = file.percentGrowth;
            }
        }

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> i++;
                case "--snapshot-dir", "-d" -> snapshotDir = value(args, i++);
                case "--max-retained", "-m" -> maxRetained = parseInt(args, i++);
                case "--http-port", "-p" -> httpPort = parseInt(args, i++);
                case "--neo4j-uri" -> uri = value(args, i++);
                case "--neo4j-user" -> user = value(args, i++);
                case "--neo4j-password" -> password = value(args, i++);
                case "--natural-key" -> naturalKey = value(args, i++);
                case "--min-new-nodes" -> minNewNodes = parseLong(args, i++);
                case "--min-new-rels" -> minNewRels = parseLong(args, i++);
                case "--percent-growth" -> percentGrowth = parseDouble(args, i++);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return new BackupConfig(snapshotDir, maxRetained, httpPort, uri, user, password, naturalKey,
                minNewNodes, minNewRels, percentGrowth);
    }

    private static JsonConfig loadJson(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String[] args, int i) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i].substring(2) + ": " + v);
        }
    }

    private static long parseLong(String[] args, int i) {
        String v = value(args, i);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i].substring(2) + ": " + v);
        }
    }

    private static double parseDouble(String[] args, int i) {
        String v = value(args, i);
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i].substring(2) + ": " + v);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: graphvault-server [options]

            Options:
              --snapshot-dir,   -d   Snapshot directory (default: ./data/snapshots)
              --max-retained,   -m   Snapshots to keep (default: 1)
              --http-port,      -p   HTTP admin port (default: 8090)
              --neo4j-uri            Bolt URI (default: $NEO4J_URI or bolt://localhost:7687)
              --neo4j-user           User (default: $NEO4J_USERNAME or neo4j)
              --neo4j-password       Password (default: $NEO4J_PASSWORD)
              --natural-key          Property used to upsert nodes in selective restore (default: name)
              --min-new-nodes        Auto-backup absolute node threshold (default: 50)
              --min-new-rels         Auto-backup absolute relationship threshold (default: 100)
              --percent-growth       Auto-backup relative threshold (default: 0.10)
              --config,         -c   JSON config file (optional)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
