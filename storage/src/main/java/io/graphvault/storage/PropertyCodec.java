// file: src/main/java/io/graphvault/storage/PropertyCodec.java
package io.graphvault.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.graphvault.core.PropertyValues;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of property maps.
 * <p>
 * Scalars map to native JSON (string, integral, floating, boolean).
 * Temporal values are tagged so they come back as the same java.time type:
 * <pre>
 *   {"@temporal": "datetime", "value": "2025-06-23T19:04:59Z[UTC]"}
 * </pre>
 * Any other JSON object, and any array nested in an array, is rejected.
 */
final class PropertyCodec {
    static final String TEMPORAL_TAG = "@temporal";
    static final String TEMPORAL_VALUE = "value";

    private PropertyCodec() {
        // utility
    }

    static void write(JsonGenerator gen, Map<String, Object> properties) throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> e : properties.entrySet()) {
            gen.writeFieldName(e.getKey());
            Object value = e.getValue();
            if (value instanceof List<?> list) {
                gen.writeStartArray();
                for (Object item : list) {
                    writeScalar(gen, item);
                }
                gen.writeEndArray();
            } else {
                writeScalar(gen, value);
            }
        }
        gen.writeEndObject();
    }

    static Map<String, Object> read(JsonNode node, String owner) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new SnapshotParseException(owner + ": properties must be an object");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            String key = f.getKey();
            JsonNode v = f.getValue();
            if (v.isNull()) {
                continue;
            }
            if (v.isArray()) {
                List<Object> items = new ArrayList<>(v.size());
                for (JsonNode item : v) {
                    items.add(readScalar(item, owner, key));
                }
                out.put(key, items);
            } else {
                out.put(key, readScalar(v, owner, key));
            }
        }
        return out;
    }

    private static void writeScalar(JsonGenerator gen, Object value) throws IOException {
        if (value instanceof String s) {
            gen.writeString(s);
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Double d) {
            gen.writeNumber(d);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (PropertyValues.isTemporal(value)) {
            gen.writeStartObject();
            gen.writeStringField(TEMPORAL_TAG, temporalKind(value));
            gen.writeStringField(TEMPORAL_VALUE, value.toString());
            gen.writeEndObject();
        } else {
            // PropertyValues.checked() has already narrowed the domain
            throw new IllegalStateException("unexpected property value: " + value.getClass().getName());
        }
    }

    private static Object readScalar(JsonNode v, String owner, String key) {
        if (v.isTextual()) return v.textValue();
        if (v.isBoolean()) return v.booleanValue();
        if (v.isIntegralNumber()) {
            if (!v.canConvertToLong()) {
                throw new SnapshotParseException(owner + ": property '" + key + "' does not fit in a long");
            }
            return v.longValue();
        }
        if (v.isNumber()) return v.doubleValue();
        if (v.isObject() && v.has(TEMPORAL_TAG)) {
            return readTemporal(v, owner, key);
        }
        String kind = v.isArray() ? "nested list" : v.isObject() ? "nested map" : v.getNodeType().toString();
        throw new SnapshotParseException(owner + ": property '" + key + "' has unsupported value: " + kind);
    }

    private static String temporalKind(Object value) {
        if (value instanceof ZonedDateTime) return "datetime";
        if (value instanceof OffsetDateTime) return "offsetdatetime";
        if (value instanceof LocalDateTime) return "localdatetime";
        if (value instanceof LocalDate) return "date";
        if (value instanceof OffsetTime) return "time";
        if (value instanceof LocalTime) return "localtime";
        return "instant";
    }

    private static Object readTemporal(JsonNode v, String owner, String key) {
        String kind = v.path(TEMPORAL_TAG).asText();
        String text = v.path(TEMPORAL_VALUE).asText(null);
        if (text == null) {
            throw new SnapshotParseException(owner + ": temporal property '" + key + "' has no value");
        }
        try {
            return switch (kind) {
                case "datetime" -> ZonedDateTime.parse(text);
                case "offsetdatetime" -> OffsetDateTime.parse(text);
                case "localdatetime" -> LocalDateTime.parse(text);
                case "date" -> LocalDate.parse(text);
                case "time" -> OffsetTime.parse(text);
                case "localtime" -> LocalTime.parse(text);
                case "instant" -> Instant.parse(text);
                default -> throw new SnapshotParseException(
                        owner + ": property '" + key + "' has unknown temporal kind '" + kind + "'");
            };
        } catch (DateTimeParseException e) {
            throw new SnapshotParseException(owner + ": property '" + key + "' is not a valid " + kind, e);
        }
    }
}
