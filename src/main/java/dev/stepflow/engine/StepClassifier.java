package dev.stepflow.engine;

import dev.stepflow.io.ClassificationConfigLoader;
import dev.stepflow.model.ClassificationKeywords;
import dev.stepflow.model.ClassificationRule;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides whether a step is a state, a rule or a behavior.
 *
 * <p>An explicit step type always wins. Otherwise user-defined
 * {@link ClassificationRule}s are tried in order, then the built-in
 * heuristics below, and the first match decides:
 * <ol>
 *   <li>name ends with {@code ?} &rarr; rule</li>
 *   <li>name starts with a rule keyword &rarr; rule</li>
 *   <li>name starts with {@code ask} &rarr; state</li>
 *   <li>name is all capitals &rarr; state</li>
 *   <li>name starts with a behavior keyword &rarr; behavior</li>
 *   <li>anything else &rarr; state</li>
 * </ol>
 * Keywords match whole leading words, ignoring case.
 */
public final class StepClassifier {

    static final String ASK_KEYWORD = "ask";

    /** One ordered heuristic: a test on the trimmed step name and the type it implies. */
    public record Heuristic(String description, Predicate<String> test, StepType type) {}

    private final ClassificationKeywords keywords;
    private final List<ClassificationRule> customRules;
    private final List<Heuristic> heuristics;

    public StepClassifier(ClassificationKeywords keywords) {
        this(keywords, List.of());
    }

    public StepClassifier(ClassificationKeywords keywords, List<ClassificationRule> customRules) {
        this.keywords = keywords;
        this.customRules = customRules == null ? List.of() : List.copyOf(customRules);
        this.heuristics = List.of(
            new Heuristic("ends with '?'", name -> name.endsWith("?"), StepType.RULE),
            new Heuristic("starts with a rule keyword",
                name -> startsWithAny(name, keywords.ruleKeywords()), StepType.RULE),
            new Heuristic("starts with '" + ASK_KEYWORD + "'",
                name -> startsWithWord(name, ASK_KEYWORD), StepType.STATE),
            new Heuristic("is all capitals", StepClassifier::isAllCaps, StepType.STATE),
            new Heuristic("starts with a behavior keyword",
                name -> startsWithAny(name, keywords.behaviorKeywords()), StepType.BEHAVIOR)
        );
    }

    /** Classifier using the shipped default keywords and no custom rules. */
    public static StepClassifier withDefaults() {
        return new StepClassifier(ClassificationConfigLoader.defaults());
    }

    public ClassificationKeywords keywords() {
        return keywords;
    }

    public List<ClassificationRule> customRules() {
        return customRules;
    }

    public List<Heuristic> heuristics() {
        return heuristics;
    }

    public StepType classify(Step step) {
        if (step.type() != null) {
            return step.type();
        }
        return classifyName(step.name());
    }

    /** Classification of a bare name, ignoring any explicit type. */
    public StepType classifyName(String name) {
        String trimmed = name == null ? "" : name.trim();
        for (ClassificationRule rule : customRules) {
            if (rule.matches(trimmed)) {
                return rule.type() == null ? StepType.STATE : rule.type();
            }
        }
        for (Heuristic heuristic : heuristics) {
            if (heuristic.test().test(trimmed)) {
                return heuristic.type();
            }
        }
        return StepType.STATE;
    }

    /** Classification of every step, keyed by id in the given order. */
    public Map<String, StepType> classifyAll(Collection<Step> steps) {
        var result = new LinkedHashMap<String, StepType>();
        for (Step step : steps) {
            result.put(step.id(), classify(step));
        }
        return result;
    }

    /**
     * Alias for a step without one, taken from the first matching custom
     * rule that carries an alias template.
     */
    public Optional<String> suggestAlias(Step step) {
        if (step.alias() != null && !step.alias().isBlank()) {
            return Optional.of(step.alias());
        }
        for (ClassificationRule rule : customRules) {
            if (rule.matches(step.name().trim())) {
                return Optional.ofNullable(rule.aliasTemplate()).map(t -> rule.aliasFor(step.name()));
            }
        }
        return Optional.empty();
    }

    static boolean startsWithAny(String name, List<String> words) {
        for (String word : words) {
            if (startsWithWord(name, word)) {
                return true;
            }
        }
        return false;
    }

    static boolean startsWithWord(String name, String word) {
        if (word == null || word.isBlank()) {
            return false;
        }
        String key = word.trim();
        if (!name.regionMatches(true, 0, key, 0, key.length())) {
            return false;
        }
        return name.length() == key.length() || !Character.isLetterOrDigit(name.charAt(key.length()));
    }

    static boolean isAllCaps(String name) {
        return name.chars().anyMatch(Character::isLetter)
            && name.equals(name.toUpperCase(Locale.ROOT));
    }
}
