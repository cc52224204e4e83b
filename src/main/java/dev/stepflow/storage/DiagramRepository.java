package dev.stepflow.storage;

import dev.stepflow.model.DiagramState;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over where a diagram is kept between editing sessions.
 * Both operations may fail asynchronously; callers must not touch their
 * in-memory state until a load has completed successfully.
 */
public interface DiagramRepository {

    /**
     * Load the saved diagram.
     *
     * @return the saved state, or empty if nothing has been saved yet
     */
    CompletableFuture<Optional<DiagramState>> load();

    /** Replace the saved diagram with the given state. */
    CompletableFuture<Void> save(DiagramState state);

    /** Display name of the storage location. */
    String getName();
}
