package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.checkpoint.AgentState;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ExecutorSpec;
import dev.containerizer.agent.model.ResourceStatistics;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.TaskSpec;
import dev.containerizer.agent.model.Termination;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle management of the containers the agent runs its tasks and executors in. Every operation completes
 * asynchronously; failures surface as {@link ContainerizerException} subclasses, possibly wrapped in a
 * {@link java.util.concurrent.CompletionException}.
 */
public interface Containerizer {

    /**
     * Reconciles checkpointed runs with the runtime. Called once, before any launch is served.
     */
    CompletableFuture<Void> recover(AgentState state);

    /**
     * Launches {@code task} under {@code executor}. Completes with false when the task carries no container spec.
     */
    CompletableFuture<Boolean> launch(
            ContainerId containerId,
            TaskSpec task,
            ExecutorSpec executor,
            Path directory,
            Optional<String> user,
            String agentId,
            String agentAddress,
            boolean checkpoint);

    /**
     * Launches {@code executor} itself. Completes with false when the executor carries no container spec.
     */
    CompletableFuture<Boolean> launch(
            ContainerId containerId,
            ExecutorSpec executor,
            Path directory,
            Optional<String> user,
            String agentId,
            String agentAddress,
            boolean checkpoint);

    CompletableFuture<Termination> wait(ContainerId containerId);

    CompletableFuture<Void> destroy(ContainerId containerId);

    CompletableFuture<Void> update(ContainerId containerId, Resources resources);

    CompletableFuture<ResourceStatistics> usage(ContainerId containerId);

    CompletableFuture<Set<ContainerId>> containers();
}
