package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.docker.DockerContainer;
import dev.containerizer.agent.docker.DockerRuntime;
import dev.containerizer.agent.model.Termination;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for a running container to exit, collects its logs, removes it and resolves its termination.
 */
final class ContainerMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ContainerMonitor.class);

    private final ContainerizerConfig config;
    private final ContainerRegistry registry;
    private final DockerRuntime runtime;
    private final CheckpointWriter checkpoints;
    private final Executor process;

    ContainerMonitor(
            ContainerizerConfig config,
            ContainerRegistry registry,
            DockerRuntime runtime,
            CheckpointWriter checkpoints,
            Executor process) {
        this.config = config;
        this.registry = registry;
        this.runtime = runtime;
        this.checkpoints = checkpoints;
        this.process = process;
    }

    void watch(ContainerState state) {
        logger.debug("Monitoring container {}", state.name());
        runtime.await(state.name()).handleAsync((status, error) -> {
            if (!registry.isCurrent(state)) {
                logger.debug("Container {} exited after it was already retired", state.id());
                return null;
            }
            if (error != null) {
                var cause = Futures.unwrap(error);
                logger.warn("Lost track of container {}", state.name(), cause);
                discardCheckpoint(state).thenRunAsync(() -> registry.retire(state, cause), process);
                return null;
            }
            exited(state, status);
            return null;
        }, process);
    }

    private void exited(ContainerState state, int status) {
        logger.info("Container {} exited with status {}", state.name(), status);
        bestEffort(runtime.inspect(state.name()), "inspect", state)
                .thenCompose(container -> captureLogs(state)
                        .thenCompose(ignored -> remove(state))
                        .thenApply(ignored -> termination(state, status, container)))
                .thenCompose(termination -> discardCheckpoint(state)
                        .thenApplyAsync(ignored -> termination, process))
                .thenAccept(termination -> registry.retire(state, termination))
                .exceptionally(error -> {
                    logger.error("Failed to finish container {}", state.id(), error);
                    registry.retire(state, Futures.unwrap(error));
                    return null;
                });
    }

    private CompletableFuture<Void> captureLogs(ContainerState state) {
        return state.directory()
                .map(directory -> bestEffort(runtime.logs(state.name(), directory), "capture logs of", state))
                .orElseGet(() -> CompletableFuture.completedFuture(null));
    }

    private CompletableFuture<Void> remove(ContainerState state) {
        if (config.keepContainers() && !state.destroyed()) {
            logger.debug("Keeping container {}", state.name());
            return CompletableFuture.completedFuture(null);
        }
        return bestEffort(runtime.rm(state.name(), state.destroyed()), "remove", state);
    }

    private CompletableFuture<Void> discardCheckpoint(ContainerState state) {
        return state.checkpoint() ? checkpoints.discard(state.id()) : CompletableFuture.completedFuture(null);
    }

    private Termination termination(ContainerState state, int status, DockerContainer container) {
        if (state.destroyed()) {
            return Termination.destroyed("Container destroyed", status);
        }
        if (container != null && container.oomKilled()) {
            return Termination.oom(status);
        }
        return Termination.exited(status);
    }

    private <T> CompletableFuture<T> bestEffort(CompletableFuture<T> call, String operation, ContainerState state) {
        return call.handleAsync((result, error) -> {
            if (error != null) {
                logger.warn("Failed to {} container {}", operation, state.name(), Futures.unwrap(error));
                return null;
            }
            return result;
        }, process);
    }
}
