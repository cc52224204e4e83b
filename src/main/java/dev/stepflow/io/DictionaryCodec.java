package dev.stepflow.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes one dictionary as a flat JSON object,
 * {@code {"qualified name": "LABEL", ...}}, keeping entry order.
 */
public final class DictionaryCodec {

    private DictionaryCodec() {}

    public static Map<String, String> read(Path path) throws IOException {
        return parse(DiagramJson.MAPPER.readTree(path.toFile()));
    }

    public static Map<String, String> readString(String json) throws IOException {
        return parse(DiagramJson.MAPPER.readTree(json));
    }

    public static void write(Map<String, String> entries, Path path) throws IOException {
        DiagramJson.MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toNode(entries));
    }

    public static String writeString(Map<String, String> entries) throws IOException {
        return DiagramJson.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(entries));
    }

    static Map<String, String> parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FlowFormatException("Invalid dictionary: expected a flat JSON object");
        }
        var entries = new LinkedHashMap<String, String>();
        for (var entry : root.properties()) {
            JsonNode value = entry.getValue();
            if (!value.isValueNode() || value.isNull()) {
                throw new FlowFormatException("Dictionary entry '%s' is not a plain value".formatted(entry.getKey()));
            }
            entries.put(entry.getKey(), value.asText());
        }
        return entries;
    }

    static ObjectNode toNode(Map<String, String> entries) {
        ObjectNode node = DiagramJson.MAPPER.createObjectNode();
        entries.forEach(node::put);
        return node;
    }
}
