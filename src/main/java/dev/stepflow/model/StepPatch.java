package dev.stepflow.model;

import java.util.List;

/**
 * Partial update for a step. Null fields are left untouched; the parent is
 * only changed when {@code changesParent} is set, so a patch can also detach
 * a step from its parent.
 */
public record StepPatch(
    String name,
    String alias,
    String description,
    StepType type,
    boolean changesParent,
    String parentId,
    List<String> assumptions,
    List<String> questions,
    List<String> imageUrls
) {
    private static final StepPatch EMPTY = new StepPatch(null, null, null, null, false, null, null, null, null);

    public static StepPatch empty() {
        return EMPTY;
    }

    public static StepPatch rename(String name) {
        return EMPTY.withName(name);
    }

    public static StepPatch retype(StepType type) {
        return EMPTY.withType(type);
    }

    public static StepPatch reparent(String parentId) {
        return EMPTY.withParent(parentId);
    }

    public StepPatch withName(String newName) {
        return new StepPatch(newName, alias, description, type, changesParent, parentId, assumptions, questions, imageUrls);
    }

    public StepPatch withAlias(String newAlias) {
        return new StepPatch(name, newAlias, description, type, changesParent, parentId, assumptions, questions, imageUrls);
    }

    public StepPatch withDescription(String newDescription) {
        return new StepPatch(name, alias, newDescription, type, changesParent, parentId, assumptions, questions, imageUrls);
    }

    public StepPatch withType(StepType newType) {
        return new StepPatch(name, alias, description, newType, changesParent, parentId, assumptions, questions, imageUrls);
    }

    public StepPatch withParent(String newParentId) {
        return new StepPatch(name, alias, description, type, true, newParentId, assumptions, questions, imageUrls);
    }
}
