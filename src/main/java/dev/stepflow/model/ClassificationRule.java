package dev.stepflow.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A user-defined classification rule imported with a diagram. The first
 * matching rule decides the step type and may propose an alias through
 * {@code aliasTemplate}, where {@code {name}} stands for the step name.
 */
public record ClassificationRule(
    String keyword,
    MatchType matchType,
    boolean caseSensitive,
    StepType type,
    String aliasTemplate   // nullable
) {
    public static final String NAME_PLACEHOLDER = "{name}";

    public enum MatchType {
        CONTAINS("contains"),
        STARTS_WITH("startsWith"),
        ENDS_WITH("endsWith"),
        EXACT("exact");

        private final String label;

        MatchType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Optional<MatchType> parse(String value) {
            for (MatchType type : values()) {
                if (type.label.equalsIgnoreCase(value)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }
    }

    public boolean matches(String stepName) {
        if (stepName == null || keyword == null || keyword.isEmpty()) {
            return false;
        }
        String name = caseSensitive ? stepName : stepName.toLowerCase(Locale.ROOT);
        String key = caseSensitive ? keyword : keyword.toLowerCase(Locale.ROOT);
        switch (matchType) {
            case CONTAINS:
                return name.contains(key);
            case STARTS_WITH:
                return name.startsWith(key);
            case ENDS_WITH:
                return name.endsWith(key);
            case EXACT:
                return name.equals(key);
            default:
                return false;
        }
    }

    /**
     * Alias proposed for a matching step, or the name itself without a
     * template. Only the first {@code {name}} is substituted.
     */
    public String aliasFor(String stepName) {
        if (aliasTemplate == null || aliasTemplate.isEmpty()) {
            return stepName;
        }
        return aliasTemplate.replaceFirst(Pattern.quote(NAME_PLACEHOLDER), Matcher.quoteReplacement(stepName));
    }
}
