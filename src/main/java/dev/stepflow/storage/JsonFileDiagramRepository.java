package dev.stepflow.storage;

import dev.stepflow.io.DiagramStateCodec;
import dev.stepflow.model.DiagramState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Keeps a diagram in a single JSON file. Saves go through a temporary file
 * in the same directory so a failed write leaves the previous file intact.
 */
public final class JsonFileDiagramRepository implements DiagramRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileDiagramRepository.class);

    private final Path file;
    private final Executor executor;

    public JsonFileDiagramRepository(Path file) {
        this(file, ForkJoinPool.commonPool());
    }

    public JsonFileDiagramRepository(Path file, Executor executor) {
        this.file = file;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Optional<DiagramState>> load() {
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.exists(file)) {
                log.debug("No saved diagram at {}", file);
                return Optional.empty();
            }
            try {
                return Optional.of(DiagramStateCodec.read(file));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read diagram from " + file, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> save(DiagramState state) {
        return CompletableFuture.runAsync(() -> {
            try {
                Path dir = file.toAbsolutePath().getParent();
                Files.createDirectories(dir);
                Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
                try {
                    DiagramStateCodec.write(state, temp);
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                } finally {
                    Files.deleteIfExists(temp);
                }
                log.debug("Saved {} step(s) to {}", state.steps().size(), file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to save diagram to " + file, e);
            }
        }, executor);
    }

    @Override
    public String getName() {
        return file.toString();
    }
}
