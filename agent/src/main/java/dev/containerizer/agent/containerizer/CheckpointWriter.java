package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.checkpoint.CheckpointStore;
import dev.containerizer.agent.checkpoint.RunRecord;
import dev.containerizer.agent.model.ContainerId;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link CheckpointStore} calls off the containerizer thread.
 */
final class CheckpointWriter {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointWriter.class);

    private final CheckpointStore store;
    private final Executor executor;

    CheckpointWriter(CheckpointStore store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    CompletableFuture<Void> write(RunRecord run) {
        return CompletableFuture.runAsync(() -> store.checkpoint(run), executor);
    }

    /**
     * Drops the container's checkpoint. Never fails; errors are logged.
     */
    CompletableFuture<Void> discard(ContainerId containerId) {
        return CompletableFuture.runAsync(() -> store.remove(containerId), executor)
                .exceptionally(error -> {
                    logger.warn("Failed to remove checkpoint of container {}", containerId, Futures.unwrap(error));
                    return null;
                });
    }
}
