// file: src/main/java/io/graphvault/storage/JsonSnapshotSerializer.java
package io.graphvault.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphvault.core.GraphSnapshotPayload;
import io.graphvault.core.GraphStatistics;
import io.graphvault.core.NodeRecord;
import io.graphvault.core.RelationshipRecord;
import io.graphvault.core.SnapshotMetadata;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * JSON snapshot implementation, one file per snapshot.
 * <p>
 * Node entry:
 * <pre>
 *   {"legacyId": "4:ab:12", "labels": ["User"], "properties": {...}}
 * </pre>
 * Relationship entry:
 * <pre>
 *   {"legacyId": "5:ab:3", "type": "PLACED", "startLegacyId": "...",
 *    "endLegacyId": "...", "properties": {...}}
 * </pre>
 * <p>
 * Atomicity:
 *   - We stream to "&lt;name&gt;.tmp" in the target directory and fsync it,
 *   - then move it onto "&lt;name&gt;" using ATOMIC_MOVE.
 * A crash mid-write leaves only the .tmp file, which listing ignores.
 */
public final class JsonSnapshotSerializer implements SnapshotSerializer {
    private final ObjectMapper json;

    public JsonSnapshotSerializer() {
        this(SnapshotJson.newMapper());
    }

    public JsonSnapshotSerializer(ObjectMapper json) {
        this.json = json;
    }

    @Override
    public long write(GraphSnapshotPayload payload, SnapshotMetadata metadata, Path path) {
        Path tmp = path.resolveSibling(path.getFileName() + SnapshotNaming.TMP_SUFFIX);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
                OutputStream out = Channels.newOutputStream(ch);
                try (JsonGenerator gen = json.getFactory().createGenerator(out)) {
                    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
                    gen.useDefaultPrettyPrinter();
                    writeDocument(gen, payload, metadata);
                }
                ch.force(true);
            }

            Files.move(tmp, path, ATOMIC_MOVE, REPLACE_EXISTING);
            return Files.size(path);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new UncheckedIOException("Failed to write snapshot " + path, e);
        } catch (RuntimeException e) {
            deleteQuietly(tmp, e);
            throw e;
        }
    }

    @Override
    public SnapshotDocument read(Path path) {
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = json.readTree(in);
        } catch (NoSuchFileException e) {
            throw notFound(path);
        } catch (JsonProcessingException e) {
            throw new SnapshotParseException("Snapshot " + path.getFileName() + " is not valid JSON", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + path, e);
        }

        String name = path.getFileName().toString();
        if (root == null || !root.isObject()) {
            throw new SnapshotParseException("Snapshot " + name + " is not a JSON object");
        }
        JsonNode meta = requireObject(root, "metadata", name);
        JsonNode data = requireObject(root, "data", name);
        JsonNode nodes = requireArray(data, "nodes", name);
        JsonNode rels = requireArray(data, "relationships", name);
        JsonNode stats = requireObject(data, "statistics", name);

        try {
            SnapshotMetadata metadata = json.treeToValue(meta, SnapshotMetadata.class);
            GraphStatistics statistics = json.treeToValue(stats, GraphStatistics.class);

            List<NodeRecord> nodeRecords = new ArrayList<>(nodes.size());
            for (JsonNode n : nodes) {
                nodeRecords.add(readNode(n, name));
            }
            List<RelationshipRecord> relRecords = new ArrayList<>(rels.size());
            for (JsonNode r : rels) {
                relRecords.add(readRelationship(r, name));
            }
            return new SnapshotDocument(metadata, new GraphSnapshotPayload(nodeRecords, relRecords, statistics));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SnapshotParseException("Snapshot " + name + " is malformed: " + e.getMessage(), e);
        }
    }

    @Override
    public SnapshotMetadata readMetadata(Path path) {
        String name = path.getFileName().toString();
        try (InputStream in = Files.newInputStream(path);
             JsonParser p = json.getFactory().createParser(in)) {
            if (p.nextToken() != JsonToken.START_OBJECT) {
                throw new SnapshotParseException("Snapshot " + name + " is not a JSON object");
            }
            while (p.nextToken() == JsonToken.FIELD_NAME) {
                String field = p.currentName();
                JsonToken value = p.nextToken();
                if ("metadata".equals(field) && value == JsonToken.START_OBJECT) {
                    return json.readValue(p, SnapshotMetadata.class);
                }
                p.skipChildren();
            }
            throw new SnapshotParseException("Snapshot " + name + " has no metadata object");
        } catch (NoSuchFileException e) {
            throw notFound(path);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SnapshotParseException("Snapshot " + name + " has unreadable metadata", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + path, e);
        }
    }

    // ---------- writing ----------

    private void writeDocument(JsonGenerator gen, GraphSnapshotPayload payload, SnapshotMetadata metadata)
            throws IOException {
        gen.writeStartObject();

        gen.writeFieldName("metadata");
        json.writeValue(gen, metadata);

        gen.writeObjectFieldStart("data");

        gen.writeArrayFieldStart("nodes");
        for (NodeRecord n : payload.nodes()) {
            gen.writeStartObject();
            gen.writeStringField("legacyId", n.legacyId());
            gen.writeArrayFieldStart("labels");
            for (String label : n.labels()) gen.writeString(label);
            gen.writeEndArray();
            gen.writeFieldName("properties");
            PropertyCodec.write(gen, n.properties());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("relationships");
        for (RelationshipRecord r : payload.relationships()) {
            gen.writeStartObject();
            gen.writeStringField("legacyId", r.legacyId());
            gen.writeStringField("type", r.type());
            gen.writeStringField("startLegacyId", r.startLegacyId());
            gen.writeStringField("endLegacyId", r.endLegacyId());
            gen.writeFieldName("properties");
            PropertyCodec.write(gen, r.properties());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeFieldName("statistics");
        json.writeValue(gen, payload.statistics());

        gen.writeEndObject(); // data
        gen.writeEndObject();
    }

    // ---------- reading ----------

    private static NodeRecord readNode(JsonNode n, String file) {
        String id = requireText(n, "legacyId", file + " node");
        String owner = file + " node " + id;
        JsonNode labelsNode = n.get("labels");
        if (labelsNode == null || !labelsNode.isArray()) {
            throw new SnapshotParseException(owner + ": labels must be an array");
        }
        Set<String> labels = new LinkedHashSet<>();
        for (JsonNode l : labelsNode) {
            if (!l.isTextual()) throw new SnapshotParseException(owner + ": labels must be strings");
            labels.add(l.textValue());
        }
        return new NodeRecord(id, labels, PropertyCodec.read(n.get("properties"), owner));
    }

    private static RelationshipRecord readRelationship(JsonNode r, String file) {
        String id = requireText(r, "legacyId", file + " relationship");
        String owner = file + " relationship " + id;
        return new RelationshipRecord(
                id,
                requireText(r, "type", owner),
                requireText(r, "startLegacyId", owner),
                requireText(r, "endLegacyId", owner),
                PropertyCodec.read(r.get("properties"), owner)
        );
    }

    // Legacy ids may have been written as numbers by older exporters.
    private static String requireText(JsonNode parent, String field, String owner) {
        JsonNode v = parent.get(field);
        if (v == null || !(v.isTextual() || v.isIntegralNumber())) {
            throw new SnapshotParseException(owner + ": missing '" + field + "'");
        }
        return v.asText();
    }

    private static JsonNode requireObject(JsonNode parent, String field, String file) {
        JsonNode v = parent.get(field);
        if (v == null || !v.isObject()) {
            throw new SnapshotParseException("Snapshot " + file + " is missing required object '" + field + "'");
        }
        return v;
    }

    private static JsonNode requireArray(JsonNode parent, String field, String file) {
        JsonNode v = parent.get(field);
        if (v == null || !v.isArray()) {
            throw new SnapshotParseException("Snapshot " + file + " is missing required array 'data." + field + "'");
        }
        return v;
    }

    private static SnapshotNotFoundException notFound(Path path) {
        String name = path.getFileName().toString();
        String id = SnapshotNaming.timestampOf(path).orElse(name);
        return new SnapshotNotFoundException(id, "Snapshot file not found: " + name);
    }

    private static void deleteQuietly(Path tmp, Exception primary) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
