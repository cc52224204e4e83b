package dev.stepflow.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.stepflow.model.ClassificationRule;
import dev.stepflow.model.Connection;
import dev.stepflow.model.ConnectionType;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shapes shared by the importer and the persistence codec.
 */
final class DiagramJson {

    static final ObjectMapper MAPPER = new ObjectMapper();

    /** Connection type written by the legacy CSV import when none was given. */
    static final String LEGACY_DEFAULT_TYPE = "default";

    private DiagramJson() {}

    static List<Step> parseSteps(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new FlowFormatException("Invalid diagram: missing steps array");
        }
        var steps = new ArrayList<Step>();
        node.forEach(stepNode -> steps.add(parseStep(stepNode)));
        return steps;
    }

    static Step parseStep(JsonNode node) {
        String id = text(node, "id");
        if (id == null || id.isBlank()) {
            throw new FlowFormatException("Step without id: " + node);
        }
        String typeLabel = text(node, "type");
        StepType type = StepType.parse(typeLabel).orElse(null);
        if (typeLabel != null && !typeLabel.isBlank() && type == null) {
            throw new FlowFormatException("Step '%s' has unknown type '%s'".formatted(id, typeLabel));
        }

        List<String> imageUrls = strings(node.get("imageUrls"));
        String legacyImage = text(node, "imageUrl");
        if (imageUrls.isEmpty() && legacyImage != null && !legacyImage.isBlank()) {
            imageUrls = List.of(legacyImage);
        }

        return new Step(
            id,
            text(node, "name"),
            text(node, "alias"),
            text(node, "description"),
            type,
            text(node, "parentId"),
            strings(node.get("assumptions")),
            strings(node.get("questions")),
            imageUrls
        );
    }

    static List<Connection> parseConnections(JsonNode node) {
        var connections = new ArrayList<Connection>();
        if (node == null || node.isNull()) {
            return connections;
        }
        if (!node.isArray()) {
            throw new FlowFormatException("Invalid diagram: connections is not an array");
        }
        node.forEach(c -> connections.add(parseConnection(c)));
        return connections;
    }

    static Connection parseConnection(JsonNode node) {
        String from = text(node, "fromStepId");
        String to = text(node, "toStepId");
        if (from == null || to == null) {
            throw new FlowFormatException("Connection without fromStepId/toStepId: " + node);
        }
        String typeLabel = text(node, "type");
        ConnectionType type;
        if (typeLabel == null || LEGACY_DEFAULT_TYPE.equalsIgnoreCase(typeLabel)) {
            type = ConnectionType.SUCCESS;
        } else {
            type = ConnectionType.parse(typeLabel)
                .orElseThrow(() -> new FlowFormatException("Unknown connection type: " + typeLabel));
        }
        return new Connection(from, to, type);
    }

    static List<ClassificationRule> parseRules(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new FlowFormatException("classificationRules is not an array");
        }
        var rules = new ArrayList<ClassificationRule>();
        for (JsonNode ruleNode : node) {
            String keyword = text(ruleNode, "keyword");
            String matchLabel = text(ruleNode, "matchType");
            ClassificationRule.MatchType matchType = ClassificationRule.MatchType.parse(matchLabel)
                .orElseThrow(() -> new FlowFormatException("Unknown matchType: " + matchLabel));
            StepType type = StepType.parse(text(ruleNode, "type")).orElse(StepType.STATE);
            boolean caseSensitive = ruleNode.has("caseSensitive") && ruleNode.get("caseSensitive").asBoolean();
            rules.add(new ClassificationRule(keyword, matchType, caseSensitive, type, text(ruleNode, "aliasTemplate")));
        }
        return rules;
    }

    static ArrayNode writeSteps(List<Step> steps) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Step step : steps) {
            ObjectNode node = array.addObject();
            node.put("id", step.id());
            node.put("name", step.name());
            if (step.alias() != null) {
                node.put("alias", step.alias());
            }
            node.put("description", step.description());
            if (step.type() != null) {
                node.put("type", step.type().label());
            }
            if (step.parentId() != null) {
                node.put("parentId", step.parentId());
            }
            step.assumptions().forEach(node.putArray("assumptions")::add);
            step.questions().forEach(node.putArray("questions")::add);
            step.imageUrls().forEach(node.putArray("imageUrls")::add);
        }
        return array;
    }

    static ArrayNode writeConnections(List<Connection> connections) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Connection connection : connections) {
            ObjectNode node = array.addObject();
            node.put("fromStepId", connection.fromStepId());
            node.put("toStepId", connection.toStepId());
            node.put("type", connection.type().label());
        }
        return array;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        if (node == null || !node.isArray()) {
            return values;
        }
        node.forEach(v -> values.add(v.isTextual() ? v.asText() : v.toString()));
        return values;
    }
}
