package dev.stepflow.model;

import java.util.List;
import java.util.Objects;

/**
 * A node of the flow diagram.
 *
 * <p>{@code type} is the explicitly chosen role and is {@code null} when the
 * role is left to the classifier. {@code parentId} is {@code null} for a root
 * step. Assumptions, questions and image references are carried for the
 * editor and ignored by the compiler.
 */
public record Step(
    String id,
    String name,
    String alias,          // nullable
    String description,
    StepType type,         // nullable, classifier decides
    String parentId,       // nullable
    List<String> assumptions,
    List<String> questions,
    List<String> imageUrls
) {
    public Step {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        questions = questions == null ? List.of() : List.copyOf(questions);
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    /** A root step with only an id and a name. */
    public static Step of(String id, String name) {
        return new Step(id, name, null, "", null, null, List.of(), List.of(), List.of());
    }

    public boolean hasParent() {
        return parentId != null;
    }

    public Step withType(StepType newType) {
        return new Step(id, name, alias, description, newType, parentId, assumptions, questions, imageUrls);
    }

    public Step withParent(String newParentId) {
        return new Step(id, name, alias, description, type, newParentId, assumptions, questions, imageUrls);
    }

    public Step withAlias(String newAlias) {
        return new Step(id, name, newAlias, description, type, parentId, assumptions, questions, imageUrls);
    }

    /**
     * Apply the non-null fields of a patch. The parent is replaced only when
     * the patch says so, since {@code null} is a meaningful parent.
     */
    public Step merge(StepPatch patch) {
        return new Step(
            id,
            patch.name() != null ? patch.name() : name,
            patch.alias() != null ? patch.alias() : alias,
            patch.description() != null ? patch.description() : description,
            patch.type() != null ? patch.type() : type,
            patch.changesParent() ? patch.parentId() : parentId,
            patch.assumptions() != null ? patch.assumptions() : assumptions,
            patch.questions() != null ? patch.questions() : questions,
            patch.imageUrls() != null ? patch.imageUrls() : imageUrls
        );
    }
}
