package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.checkpoint.AgentState;
import dev.containerizer.agent.checkpoint.RunRecord;
import dev.containerizer.agent.docker.DockerContainer;
import dev.containerizer.agent.docker.DockerRuntime;
import dev.containerizer.agent.docker.DockerRuntimeException;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.Resources;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-attaches to the containers an earlier agent run left behind, reconciling the checkpointed runs with what the
 * runtime still lists.
 */
final class RecoveryCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final ContainerizerConfig config;
    private final ContainerNames names;
    private final ContainerRegistry registry;
    private final DockerRuntime runtime;
    private final CheckpointWriter checkpoints;
    private final ContainerMonitor monitor;
    private final Executor process;

    RecoveryCoordinator(
            ContainerizerConfig config,
            ContainerNames names,
            ContainerRegistry registry,
            DockerRuntime runtime,
            CheckpointWriter checkpoints,
            ContainerMonitor monitor,
            Executor process) {
        this.config = config;
        this.names = names;
        this.registry = registry;
        this.runtime = runtime;
        this.checkpoints = checkpoints;
        this.monitor = monitor;
        this.process = process;
    }

    /**
     * Must run on the containerizer thread. Fails with {@link RecoveryException} on any inconsistency or runtime
     * error.
     */
    CompletableFuture<Void> recover(AgentState agentState) {
        var runs = validate(agentState);
        logger.info("Recovering {} checkpointed container(s) of agent {}", runs.size(), agentState.agentId());

        return runtime.ps(true, names.prefix())
                .handleAsync((containers, error) -> {
                    if (error != null) {
                        throw new RecoveryException("Failed to list containers", Futures.unwrap(error));
                    }
                    return listed(containers);
                }, process)
                .thenCompose(listed -> {
                    var reattached = new ArrayList<CompletableFuture<Void>>();
                    for (var run : runs.values()) {
                        var container = listed.get(run.containerId());
                        if (container == null) {
                            logger.info("Container {} is gone, treating it as terminated", run.containerId());
                            reattached.add(checkpoints.discard(run.containerId()));
                        } else {
                            reattached.add(reattach(run, container));
                        }
                    }
                    var orphans = new LinkedHashMap<>(listed);
                    orphans.keySet().removeAll(runs.keySet());
                    reattached.add(orphans(orphans.values()));
                    return CompletableFuture.allOf(reattached.toArray(CompletableFuture[]::new));
                })
                .thenRunAsync(() -> logger.info("Recovery complete, {} container(s) running", registry.ids().size()),
                        process);
    }

    /**
     * Checkpointed runs keyed by container id. A container recorded twice, or an executor with more than one run,
     * cannot be reconciled.
     */
    static Map<ContainerId, RunRecord> validate(AgentState agentState) {
        var runs = new LinkedHashMap<ContainerId, RunRecord>();
        for (var run : agentState.runs()) {
            if (runs.putIfAbsent(run.containerId(), run) != null) {
                throw new RecoveryException("Container " + run.containerId() + " is checkpointed more than once");
            }
        }
        agentState.frameworks().forEach((frameworkId, executors) -> executors.forEach((executorId, executorRuns) -> {
            if (executorRuns.size() > 1) {
                throw new RecoveryException("Executor " + executorId + " of framework " + frameworkId
                        + " has " + executorRuns.size() + " checkpointed runs");
            }
        }));
        return runs;
    }

    private Map<ContainerId, DockerContainer> listed(List<DockerContainer> containers) {
        var listed = new LinkedHashMap<ContainerId, DockerContainer>();
        for (var container : containers) {
            names.containerId(container.name()).ifPresent(id -> listed.put(id, container));
        }
        return listed;
    }

    private CompletableFuture<Void> reattach(RunRecord run, DockerContainer listed) {
        return runtime.inspect(listed.name()).handleAsync((container, error) -> {
            if (error != null) {
                var cause = Futures.unwrap(error);
                if (cause instanceof DockerRuntimeException runtimeError && runtimeError.isNotFound()) {
                    logger.info("Container {} disappeared before it could be inspected, treating it as terminated",
                            run.containerId());
                    return checkpoints.discard(run.containerId());
                }
                throw new RecoveryException("Failed to inspect container " + listed.name(), cause);
            }
            var state = new ContainerState(
                    run.containerId(),
                    names.name(run.containerId()),
                    run.optionalDirectory().map(Path::of).orElse(null),
                    Optional.empty(),
                    run.agentId(),
                    run.frameworkId(),
                    run.executorId(),
                    true,
                    Resources.EMPTY,
                    ContainerStatus.RUNNING);

            var checkpointed = run.optionalPid();
            var live = container.optionalPid();
            if (live.isPresent()) {
                if (checkpointed.isPresent() && !checkpointed.equals(live)) {
                    logger.warn("Container {} was checkpointed with pid {} but runs as pid {}",
                            run.containerId(), checkpointed.get(), live.get());
                }
                state.pid(live.get());
            } else {
                logger.info("Container {} exited while the agent was down", run.containerId());
            }

            registry.register(state);
            state.markRunStarted();
            state.markStarted();
            state.markMonitored();
            monitor.watch(state);
            logger.info("Recovered container {}", run.containerId());
            return CompletableFuture.<Void>completedFuture(null);
        }, process).thenCompose(Function.identity());
    }

    private CompletableFuture<Void> orphans(Iterable<DockerContainer> orphans) {
        var destroyed = new ArrayList<CompletableFuture<Void>>();
        for (var orphan : orphans) {
            if (config.orphanPolicy() == OrphanPolicy.LEAVE) {
                logger.warn("Leaving orphan container {} with no checkpointed run", orphan.name());
                continue;
            }
            logger.info("Destroying orphan container {}", orphan.name());
            destroyed.add(runtime.stop(orphan.name(), config.stopTimeout(), true).handle((ignored, error) -> {
                if (error != null) {
                    throw new RecoveryException("Failed to destroy orphan container " + orphan.name(),
                            Futures.unwrap(error));
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(destroyed.toArray(CompletableFuture[]::new));
    }
}
