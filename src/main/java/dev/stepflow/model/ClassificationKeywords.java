package dev.stepflow.model;

import java.util.List;

/**
 * Keyword prefixes used by the heuristic classifier. Defaults are shipped as
 * a classpath resource and loaded by {@code ClassificationConfigLoader}.
 */
public record ClassificationKeywords(
    List<String> ruleKeywords,
    List<String> behaviorKeywords
) {
    public ClassificationKeywords {
        ruleKeywords = ruleKeywords == null ? List.of() : List.copyOf(ruleKeywords);
        behaviorKeywords = behaviorKeywords == null ? List.of() : List.copyOf(behaviorKeywords);
    }

    public static ClassificationKeywords none() {
        return new ClassificationKeywords(List.of(), List.of());
    }
}
