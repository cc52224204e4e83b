package dev.stepflow.engine;

import dev.stepflow.model.DictionaryKind;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The state and rule dictionaries: qualified step name to export label.
 *
 * <p>Keys are qualified-name snapshots, so renaming or moving a step leaves
 * its entry behind until {@link #renameKey} migrates it. Lookups never fail;
 * a miss yields the dictionary's sentinel.
 */
public final class StepDictionary {

    private static final Logger log = LoggerFactory.getLogger(StepDictionary.class);

    private final Map<DictionaryKind, Map<String, String>> entries = new EnumMap<>(DictionaryKind.class);

    public StepDictionary() {
        for (DictionaryKind kind : DictionaryKind.values()) {
            entries.put(kind, new LinkedHashMap<>());
        }
    }

    public StepDictionary(Map<String, String> stateEntries, Map<String, String> ruleEntries) {
        this();
        entries.get(DictionaryKind.STATE).putAll(stateEntries);
        entries.get(DictionaryKind.RULE).putAll(ruleEntries);
    }

    /**
     * Identity dictionaries for the given steps: every state step maps its
     * qualified name to itself in the state dictionary, every rule step in
     * the rule dictionary. Behavior steps are left out.
     */
    public static StepDictionary generateDefaults(Collection<Step> steps, Map<String, StepType> classifications) {
        var dictionary = new StepDictionary();
        dictionary.syncFromSteps(steps, classifications);
        return dictionary;
    }

    public String lookupStateName(String qualifiedName) {
        return lookup(DictionaryKind.STATE, qualifiedName);
    }

    public String lookupRuleName(String qualifiedName) {
        return lookup(DictionaryKind.RULE, qualifiedName);
    }

    public String lookup(DictionaryKind kind, String qualifiedName) {
        String label = entries.get(kind).get(qualifiedName);
        if (label == null) {
            log.debug("No {} dictionary entry for '{}'", kind, qualifiedName);
            return kind.sentinel(qualifiedName);
        }
        return label;
    }

    public boolean contains(DictionaryKind kind, String qualifiedName) {
        return entries.get(kind).containsKey(qualifiedName);
    }

    /** Read-only view in insertion order. */
    public Map<String, String> entries(DictionaryKind kind) {
        return Collections.unmodifiableMap(entries.get(kind));
    }

    public Map<String, String> stateEntries() {
        return entries(DictionaryKind.STATE);
    }

    public Map<String, String> ruleEntries() {
        return entries(DictionaryKind.RULE);
    }

    /** Add an entry or relabel an existing one. */
    public void put(DictionaryKind kind, String qualifiedName, String label) {
        entries.get(kind).put(qualifiedName, label == null ? "" : label);
    }

    public boolean remove(DictionaryKind kind, String qualifiedName) {
        return entries.get(kind).remove(qualifiedName) != null;
    }

    /**
     * Move an entry to a new key, keeping its label and position. Fails if
     * the old key is missing or the new key is already taken.
     */
    public boolean renameKey(DictionaryKind kind, String oldName, String newName) {
        Map<String, String> map = entries.get(kind);
        if (!map.containsKey(oldName)) {
            log.warn("Cannot rename {} dictionary key '{}': no such entry", kind, oldName);
            return false;
        }
        if (oldName.equals(newName)) {
            return true;
        }
        if (map.containsKey(newName)) {
            log.warn("Cannot rename {} dictionary key '{}' to '{}': target exists", kind, oldName, newName);
            return false;
        }
        var rebuilt = new LinkedHashMap<String, String>();
        map.forEach((key, label) -> rebuilt.put(key.equals(oldName) ? newName : key, label));
        map.clear();
        map.putAll(rebuilt);
        return true;
    }

    /** Replace one dictionary wholesale, e.g. after an import. */
    public void replace(DictionaryKind kind, Map<String, String> newEntries) {
        Map<String, String> map = entries.get(kind);
        map.clear();
        map.putAll(newEntries);
    }

    public void clear(DictionaryKind kind) {
        entries.get(kind).clear();
    }

    /**
     * Add identity entries for steps missing from their dictionary, leaving
     * curated labels alone.
     *
     * @return number of entries added
     */
    public int syncFromSteps(Collection<Step> steps, Map<String, StepType> classifications) {
        StepGraph graph = StepGraph.of(steps, List.of());
        int added = 0;
        for (Step step : graph.steps()) {
            StepType type = classifications.getOrDefault(step.id(), StepType.STATE);
            for (DictionaryKind kind : DictionaryKind.values()) {
                if (kind.stepType() == type) {
                    String name = graph.qualifiedName(step.id());
                    if (entries.get(kind).putIfAbsent(name, name) == null) {
                        added++;
                    }
                }
            }
        }
        if (added > 0) {
            log.debug("Added {} identity dictionary entr{}", added, added == 1 ? "y" : "ies");
        }
        return added;
    }

    public StepDictionary copy() {
        return new StepDictionary(stateEntries(), ruleEntries());
    }
}
