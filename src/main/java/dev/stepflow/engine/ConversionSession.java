package dev.stepflow.engine;

import dev.stepflow.model.DiagramState;
import dev.stepflow.model.DictionaryKind;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepPatch;
import dev.stepflow.model.StepType;
import dev.stepflow.model.TransitionRow;
import dev.stepflow.storage.DiagramRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * State behind the "convert to state machine" preview: the live store, the
 * classifier, per-step classification overrides, the two dictionaries and
 * the user's cell edits. The table is regenerated from scratch on every call
 * to {@link #rows()}; edits are re-applied by row identity so they survive
 * regeneration.
 */
public final class ConversionSession {

    private static final Logger log = LoggerFactory.getLogger(ConversionSession.class);

    private final StepStore store;
    private StepClassifier classifier;
    private final Map<String, StepType> overrides = new LinkedHashMap<>();
    private final StepDictionary dictionary = new StepDictionary();
    private final Map<RowKey, RowEdit> rowEdits = new HashMap<>();

    /** Identifies a row across regenerations: its content plus which repeat of that content it is. */
    record RowKey(String source, String destination, String ruleList, int occurrence) {}

    record RowEdit(Integer priority, String operation) {
        TransitionRow applyTo(TransitionRow row) {
            TransitionRow edited = row;
            if (priority != null) {
                edited = edited.withPriority(priority);
            }
            if (operation != null) {
                edited = edited.withOperation(operation);
            }
            return edited;
        }

        RowEdit merge(RowEdit newer) {
            return new RowEdit(
                newer.priority != null ? newer.priority : priority,
                newer.operation != null ? newer.operation : operation);
        }
    }

    public ConversionSession(StepStore store, StepClassifier classifier) {
        this.store = store;
        this.classifier = classifier;
    }

    public StepStore store() {
        return store;
    }

    public StepClassifier classifier() {
        return classifier;
    }

    /** Swap keyword configuration or custom rules; overrides are kept. */
    public void useClassifier(StepClassifier newClassifier) {
        this.classifier = newClassifier;
    }

    public StepDictionary dictionary() {
        return dictionary;
    }

    // --- classification ---

    /** Effective classification of every step in store order. */
    public Map<String, StepType> classifications() {
        var result = new LinkedHashMap<String, StepType>();
        for (Step step : store.steps()) {
            StepType override = overrides.get(step.id());
            result.put(step.id(), override != null ? override : classifier.classify(step));
        }
        return result;
    }

    public boolean reclassify(String stepId, StepType type) {
        if (store.findStep(stepId).isEmpty()) {
            log.warn("Ignoring classification of unknown step {}", stepId);
            return false;
        }
        overrides.put(stepId, type);
        return true;
    }

    public void clearOverride(String stepId) {
        overrides.remove(stepId);
    }

    /** Drop every override so all steps follow the classifier again. */
    public void resetClassifications() {
        overrides.clear();
    }

    // --- dictionaries ---

    /** Discard both dictionaries and seed them with identity entries. */
    public void regenerateDictionaries() {
        StepDictionary defaults = StepDictionary.generateDefaults(store.steps(), classifications());
        for (DictionaryKind kind : DictionaryKind.values()) {
            dictionary.replace(kind, defaults.entries(kind));
        }
    }

    /** Add identity entries for steps not yet in their dictionary. */
    public int syncDictionaries() {
        return dictionary.syncFromSteps(store.steps(), classifications());
    }

    /**
     * Rename a step and move the dictionary entries of the step and its
     * descendants to their new qualified names. A stale entry already under
     * a new name is overwritten. If a live step of the same kind owns that
     * name, nothing changes and false is returned.
     */
    public boolean renameStep(String stepId, String newName) {
        Optional<Step> step = store.findStep(stepId);
        if (step.isEmpty()) {
            log.warn("Ignoring rename of unknown step {}", stepId);
            return false;
        }
        String oldName = step.get().name();
        Map<String, StepType> types = classifications();
        Map<String, String> before = qualifiedNamesUnder(stepId);
        store.updateStep(stepId, StepPatch.rename(newName));
        Map<String, String> after = qualifiedNamesUnder(stepId);

        for (var entry : before.entrySet()) {
            String newQualified = after.get(entry.getKey());
            for (DictionaryKind kind : DictionaryKind.values()) {
                if (types.get(entry.getKey()) == kind.stepType()
                    && dictionary.contains(kind, entry.getValue())
                    && !entry.getValue().equals(newQualified)
                    && dictionary.contains(kind, newQualified)
                    && liveNames(kind, types, after.keySet()).contains(newQualified)) {
                    log.warn("Cannot rename step {} to '{}': {} dictionary entry '{}' belongs to another step",
                        stepId, newName, kind, newQualified);
                    store.updateStep(stepId, StepPatch.rename(oldName));
                    return false;
                }
            }
        }

        for (var entry : before.entrySet()) {
            String oldQualified = entry.getValue();
            String newQualified = after.get(entry.getKey());
            for (DictionaryKind kind : DictionaryKind.values()) {
                if (types.get(entry.getKey()) != kind.stepType()
                    || !dictionary.contains(kind, oldQualified)
                    || oldQualified.equals(newQualified)) {
                    continue;
                }
                if (dictionary.contains(kind, newQualified)) {
                    log.info("Replacing stale {} dictionary entry '{}'", kind, newQualified);
                    dictionary.remove(kind, newQualified);
                }
                dictionary.renameKey(kind, oldQualified, newQualified);
            }
        }
        return true;
    }

    /** Qualified names of the steps of one kind, leaving out the given ids. */
    private Set<String> liveNames(DictionaryKind kind, Map<String, StepType> types, Set<String> excluded) {
        var names = new HashSet<String>();
        for (Step step : store.steps()) {
            if (!excluded.contains(step.id()) && types.get(step.id()) == kind.stepType()) {
                names.add(store.qualifiedName(step));
            }
        }
        return names;
    }

    private Map<String, String> qualifiedNamesUnder(String rootId) {
        var names = new LinkedHashMap<String, String>();
        for (Step step : store.steps()) {
            if (isSelfOrDescendant(step, rootId)) {
                names.put(step.id(), store.qualifiedName(step));
            }
        }
        return names;
    }

    private boolean isSelfOrDescendant(Step step, String rootId) {
        var seen = new HashSet<String>();
        Step cursor = step;
        while (cursor != null && seen.add(cursor.id())) {
            if (cursor.id().equals(rootId)) {
                return true;
            }
            cursor = cursor.hasParent() ? store.findStep(cursor.parentId()).orElse(null) : null;
        }
        return false;
    }

    // --- table ---

    /** Generated rows with the user's cell edits applied. */
    public List<TransitionRow> rows() {
        List<TransitionRow> generated = TransitionTableGenerator.generateRows(
            store.graph(), classifications(), dictionary);
        if (rowEdits.isEmpty()) {
            return generated;
        }
        List<RowKey> keys = keysOf(generated);
        var edited = new ArrayList<TransitionRow>(generated.size());
        for (int i = 0; i < generated.size(); i++) {
            RowEdit edit = rowEdits.get(keys.get(i));
            edited.add(edit == null ? generated.get(i) : edit.applyTo(generated.get(i)));
        }
        return List.copyOf(edited);
    }

    /**
     * Edit the priority and/or operation of the row at {@code index} in the
     * current table. Null arguments leave that cell as it is.
     */
    public boolean editRow(int index, Integer priority, String operation) {
        List<TransitionRow> generated = TransitionTableGenerator.generateRows(
            store.graph(), classifications(), dictionary);
        if (index < 0 || index >= generated.size()) {
            log.warn("Ignoring edit of row {}: table has {} row(s)", index, generated.size());
            return false;
        }
        RowKey key = keysOf(generated).get(index);
        rowEdits.merge(key, new RowEdit(priority, operation), RowEdit::merge);
        return true;
    }

    public void clearRowEdits() {
        rowEdits.clear();
    }

    private static List<RowKey> keysOf(List<TransitionRow> rows) {
        var seen = new HashMap<List<String>, Integer>();
        var keys = new ArrayList<RowKey>(rows.size());
        for (TransitionRow row : rows) {
            List<String> content = List.of(row.sourceNode(), row.destinationNode(), row.ruleList());
            int occurrence = seen.merge(content, 1, Integer::sum) - 1;
            keys.add(new RowKey(row.sourceNode(), row.destinationNode(), row.ruleList(), occurrence));
        }
        return keys;
    }

    public List<String> warnings() {
        return GraphValidator.validate(store.graph(), classifications(), dictionary);
    }

    // --- persistence ---

    public DiagramState toState() {
        return new DiagramState(store.steps(), store.connections(), classifications(),
            dictionary.stateEntries(), dictionary.ruleEntries());
    }

    /**
     * Replace everything with a saved state. Saved classifications become
     * overrides, since they may have been edited by hand.
     */
    public void restore(DiagramState state) {
        store.replaceAll(state.steps(), state.connections());
        overrides.clear();
        state.classifications().forEach((id, type) -> {
            if (store.findStep(id).isPresent()) {
                overrides.put(id, type);
            }
        });
        dictionary.replace(DictionaryKind.STATE, state.stateDictionary());
        dictionary.replace(DictionaryKind.RULE, state.ruleDictionary());
        rowEdits.clear();
    }

    /**
     * Fetch the saved state without touching the session. The future may
     * complete on any thread, so the caller applies the result with
     * {@link #restore} from the thread that owns the session.
     */
    public CompletableFuture<Optional<DiagramState>> loadFrom(DiagramRepository repository) {
        return repository.load().thenApply(saved -> {
            if (saved.isEmpty()) {
                log.info("Nothing saved in {}", repository.getName());
            }
            return saved;
        });
    }

    /**
     * Load from the repository and restore on {@code sessionExecutor}, the
     * executor that runs every other call on this session. A failed load
     * leaves the session untouched.
     *
     * @return true if a saved state was found and applied
     */
    public CompletableFuture<Boolean> loadFrom(DiagramRepository repository, Executor sessionExecutor) {
        return loadFrom(repository).thenApplyAsync(saved -> {
            if (saved.isEmpty()) {
                return false;
            }
            restore(saved.get());
            log.info("Restored {} step(s) from {}", saved.get().steps().size(), repository.getName());
            return true;
        }, sessionExecutor);
    }

    public CompletableFuture<Void> saveTo(DiagramRepository repository) {
        return repository.save(toState());
    }
}
