package dev.stepflow.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.stepflow.model.ClassificationKeywords;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads classifier keyword lists:
 * {@code {"ruleKeywords": [...], "behaviorKeywords": [...]}}.
 * A list missing from a file falls back to the shipped default list.
 */
public final class ClassificationConfigLoader {

    static final String DEFAULTS_RESOURCE = "/stepflow/classification-defaults.json";

    private static volatile ClassificationKeywords defaults;

    private ClassificationConfigLoader() {}

    /** The keyword lists shipped with the library. */
    public static ClassificationKeywords defaults() {
        ClassificationKeywords loaded = defaults;
        if (loaded == null) {
            try (InputStream in = ClassificationConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
                }
                loaded = parse(DiagramJson.MAPPER.readTree(in), ClassificationKeywords.none());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
            }
            defaults = loaded;
        }
        return loaded;
    }

    public static ClassificationKeywords loadFromFile(Path path) throws IOException {
        return parse(DiagramJson.MAPPER.readTree(path.toFile()), defaults());
    }

    public static ClassificationKeywords loadFromString(String json) throws IOException {
        return parse(DiagramJson.MAPPER.readTree(json), defaults());
    }

    public static void write(ClassificationKeywords keywords, Path path) throws IOException {
        DiagramJson.MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toNode(keywords));
    }

    public static String writeString(ClassificationKeywords keywords) throws IOException {
        return DiagramJson.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(keywords));
    }

    private static ClassificationKeywords parse(JsonNode root, ClassificationKeywords fallback) {
        if (root == null || !root.isObject()) {
            throw new FlowFormatException("Invalid keyword configuration: expected a JSON object");
        }
        List<String> rule = root.has("ruleKeywords")
            ? keywords(root.get("ruleKeywords"), "ruleKeywords") : fallback.ruleKeywords();
        List<String> behavior = root.has("behaviorKeywords")
            ? keywords(root.get("behaviorKeywords"), "behaviorKeywords") : fallback.behaviorKeywords();
        return new ClassificationKeywords(rule, behavior);
    }

    private static List<String> keywords(JsonNode node, String field) {
        if (!node.isArray()) {
            throw new FlowFormatException("'%s' must be an array of strings".formatted(field));
        }
        var values = new ArrayList<String>();
        node.forEach(v -> {
            String keyword = v.asText().trim();
            if (!keyword.isEmpty()) {
                values.add(keyword);
            }
        });
        return values;
    }

    private static ObjectNode toNode(ClassificationKeywords keywords) {
        ObjectNode node = DiagramJson.MAPPER.createObjectNode();
        keywords.ruleKeywords().forEach(node.putArray("ruleKeywords")::add);
        keywords.behaviorKeywords().forEach(node.putArray("behaviorKeywords")::add);
        return node;
    }
}
