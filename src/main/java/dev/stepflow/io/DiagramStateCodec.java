package dev.stepflow.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.stepflow.model.DiagramState;
import dev.stepflow.model.StepType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of a saved {@link DiagramState}: the diagram fields plus
 * {@code classifications} (step id to type) and the two dictionaries.
 */
public final class DiagramStateCodec {

    public static final String VERSION = "1.0";

    private DiagramStateCodec() {}

    public static DiagramState read(Path path) throws IOException {
        return parse(DiagramJson.MAPPER.readTree(path.toFile()));
    }

    public static DiagramState readString(String json) throws IOException {
        return parse(DiagramJson.MAPPER.readTree(json));
    }

    public static void write(DiagramState state, Path path) throws IOException {
        DiagramJson.MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toNode(state));
    }

    public static String writeString(DiagramState state) throws IOException {
        return DiagramJson.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(state));
    }

    private static DiagramState parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FlowFormatException("Invalid saved diagram: expected a JSON object");
        }
        var classifications = new LinkedHashMap<String, StepType>();
        JsonNode classificationNode = root.get("classifications");
        if (classificationNode != null && classificationNode.isObject()) {
            for (var entry : classificationNode.properties()) {
                StepType type = StepType.parse(entry.getValue().asText())
                    .orElseThrow(() -> new FlowFormatException(
                        "Unknown classification '%s' for step %s".formatted(entry.getValue().asText(), entry.getKey())));
                classifications.put(entry.getKey(), type);
            }
        }
        return new DiagramState(
            DiagramJson.parseSteps(root.get("steps")),
            DiagramJson.parseConnections(root.get("connections")),
            classifications,
            dictionary(root.get("stateDictionary")),
            dictionary(root.get("ruleDictionary"))
        );
    }

    private static Map<String, String> dictionary(JsonNode node) {
        return node == null || node.isNull() ? Map.of() : DictionaryCodec.parse(node);
    }

    private static ObjectNode toNode(DiagramState state) {
        ObjectNode root = DiagramJson.MAPPER.createObjectNode();
        root.put("version", VERSION);
        root.set("steps", DiagramJson.writeSteps(state.steps()));
        root.set("connections", DiagramJson.writeConnections(state.connections()));
        ObjectNode classifications = root.putObject("classifications");
        state.classifications().forEach((id, type) -> classifications.put(id, type.label()));
        root.set("stateDictionary", DictionaryCodec.toNode(state.stateDictionary()));
        root.set("ruleDictionary", DictionaryCodec.toNode(state.ruleDictionary()));
        return root;
    }
}
