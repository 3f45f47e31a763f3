// file: client/src/main/java/io/graphvault/client/Cli.java
package io.graphvault.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for a running GraphVault backup server.
 *
 * Usage:
 *   graphvault-cli [--base-url http://host:port] create [reason]
 *   graphvault-cli [--base-url http://host:port] auto
 *   graphvault-cli [--base-url http://host:port] list
 *   graphvault-cli [--base-url http://host:port] info <id>
 *   graphvault-cli [--base-url http://host:port] status
 *   graphvault-cli [--base-url http://host:port] restore [id] --yes
 *   graphvault-cli [--base-url http://host:port] selective-restore [id] --preserve User,Account
 *
 * A full restore deletes the whole graph first, so it refuses to run without --yes.
 * Responses are printed as returned by the server.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8090";

    /** One HTTP call derived from the command line. {@code body} is null for GET. */
    record Call(String method, String path, String body) {
    }

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }
            Call call = toCall(rest);
            new Cli(parsed.getKey()).send(call);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Translate a command (without --base-url) into the HTTP call to make.
     *
     * @throws CliException on unknown commands or missing arguments
     */
    static Call toCall(String[] rest) {
        String cmd = rest[0];
        List<String> args = new ArrayList<>(Arrays.asList(rest).subList(1, rest.length));

        return switch (cmd) {
            case "create" -> new Call("POST", "/snapshots",
                    args.isEmpty() ? "{}" : "{\"reason\":" + quote(String.join(" ", args)) + "}");
            case "auto" -> {
                requireNoArgs(cmd, args);
                yield new Call("POST", "/snapshots/auto", "{}");
            }
            case "list" -> {
                requireNoArgs(cmd, args);
                yield new Call("GET", "/snapshots", null);
            }
            case "status" -> {
                requireNoArgs(cmd, args);
                yield new Call("GET", "/snapshots/status", null);
            }
            case "info" -> {
                if (args.size() != 1) {
                    throw new CliException("info requires <id>");
                }
                yield new Call("GET", "/snapshots/" + args.get(0), null);
            }
            case "restore" -> {
                if (!args.remove("--yes")) {
                    throw new CliException("restore deletes the current graph; re-run with --yes to confirm");
                }
                yield new Call("POST", "/restore", "{\"snapshotId\":" + optionalId(cmd, args) + "}");
            }
            case "selective-restore" -> {
                int i = args.indexOf("--preserve");
                if (i < 0 || i + 1 >= args.size()) {
                    throw new CliException("selective-restore requires --preserve <Label[,Label...]>");
                }
                String labels = args.get(i + 1);
                args.remove(i + 1);
                args.remove(i);
                StringBuilder preserve = new StringBuilder("[");
                for (String l : labels.split(",")) {
                    if (l.isBlank()) continue;
                    if (preserve.length() > 1) preserve.append(',');
                    preserve.append(quote(l.strip()));
                }
                preserve.append(']');
                yield new Call("POST", "/restore/selective",
                        "{\"snapshotId\":" + optionalId(cmd, args) + ",\"preserveLabels\":" + preserve + "}");
            }
            default -> throw new CliException("unknown command: " + cmd);
        };
    }

    private void send(Call call) throws Exception {
        var builder = HttpRequest.newBuilder().uri(URI.create(baseUrl + call.path()));
        if (call.body() == null) {
            builder.GET();
        } else {
            builder.header("Content-Type", "application/json")
                    .method(call.method(), HttpRequest.BodyPublishers.ofString(call.body()));
        }

        HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 300) {
            throw new CliException(call.method() + " " + call.path() + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void requireNoArgs(String cmd, List<String> args) {
        if (!args.isEmpty()) {
            throw new CliException(cmd + " takes no arguments");
        }
    }

    // absent id -> JSON null, the server then picks the latest snapshot
    private static String optionalId(String cmd, List<String> args) {
        if (args.size() > 1) {
            throw new CliException(cmd + " takes at most one snapshot id");
        }
        return args.isEmpty() ? "null" : quote(args.get(0));
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  graphvault-cli [--base-url http://host:port] create [reason]
                  graphvault-cli [--base-url http://host:port] auto
                  graphvault-cli [--base-url http://host:port] list
                  graphvault-cli [--base-url http://host:port] info <id>
                  graphvault-cli [--base-url http://host:port] status
                  graphvault-cli [--base-url http://host:port] restore [id] --yes
                  graphvault-cli [--base-url http://host:port] selective-restore [id] --preserve A,B
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
