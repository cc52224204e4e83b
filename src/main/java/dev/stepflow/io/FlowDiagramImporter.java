package dev.stepflow.io;

import com.fasterxml.jackson.databind.JsonNode;
import dev.stepflow.model.FlowDiagram;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads diagrams exported by the editor as JSON:
 * {@code {"steps": [...], "connections": [...], "classificationRules": [...]}}.
 * Unknown fields such as {@code exportDate} or editor positions are ignored.
 */
public final class FlowDiagramImporter {

    private FlowDiagramImporter() {}

    public static FlowDiagram loadFromFile(Path path) throws IOException {
        JsonNode root = DiagramJson.MAPPER.readTree(path.toFile());
        return parseDiagram(root);
    }

    public static FlowDiagram loadFromString(String json) throws IOException {
        JsonNode root = DiagramJson.MAPPER.readTree(json);
        return parseDiagram(root);
    }

    private static FlowDiagram parseDiagram(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FlowFormatException("Invalid diagram: expected a JSON object");
        }
        return new FlowDiagram(
            DiagramJson.parseSteps(root.get("steps")),
            DiagramJson.parseConnections(root.get("connections")),
            DiagramJson.parseRules(root.get("classificationRules"))
        );
    }
}
