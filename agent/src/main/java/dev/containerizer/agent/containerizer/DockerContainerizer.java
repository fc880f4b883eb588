package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.cgroups.Cgroups;
import dev.containerizer.agent.checkpoint.AgentState;
import dev.containerizer.agent.checkpoint.CheckpointStore;
import dev.containerizer.agent.docker.DockerRuntime;
import dev.containerizer.agent.fetcher.Fetcher;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ExecutorSpec;
import dev.containerizer.agent.model.ResourceStatistics;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.TaskSpec;
import dev.containerizer.agent.model.Termination;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Containerizer} that runs every workload in its own Docker container.
 *
 * <p>All container state lives on one thread, the containerizer thread. Public operations hop onto it, and every
 * runtime, fetch or checkpoint call resumes on it before touching state again, so no state is ever shared between
 * threads.
 */
public class DockerContainerizer implements Containerizer, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DockerContainerizer.class);

    private final ContainerizerConfig config;
    private final ExecutorService process;
    private final ExecutorService blocking;
    private final ContainerEvents events = new ContainerEvents();
    private final ContainerRegistry registry = new ContainerRegistry(events);
    private final LaunchPipeline pipeline;
    private final RecoveryCoordinator recovery;
    private final ResourceIsolator isolator;
    private final CompletableFuture<Void> recovered = new CompletableFuture<>();
    private final AtomicBoolean recoveryStarted = new AtomicBoolean();
    private final DockerRuntime runtime;

    public DockerContainerizer(
            ContainerizerConfig config,
            DockerRuntime runtime,
            Cgroups cgroups,
            Fetcher fetcher,
            CheckpointStore checkpointStore) {
        this(config, runtime, cgroups, fetcher, checkpointStore, Clock.systemUTC());
    }

    DockerContainerizer(
            ContainerizerConfig config,
            DockerRuntime runtime,
            Cgroups cgroups,
            Fetcher fetcher,
            CheckpointStore checkpointStore,
            Clock clock) {
        this.config = config;
        this.runtime = runtime;
        this.process = Executors.newSingleThreadExecutor(threads("containerizer"));
        this.blocking = Executors.newCachedThreadPool(threads("containerizer-io"));

        var names = new ContainerNames(config.namePrefix());
        var checkpoints = new CheckpointWriter(checkpointStore, blocking);
        var monitor = new ContainerMonitor(config, registry, runtime, checkpoints, process);
        this.pipeline = new LaunchPipeline(config, names, registry, runtime, fetcher, checkpoints, monitor, process);
        this.recovery = new RecoveryCoordinator(config, names, registry, runtime, checkpoints, monitor, process);
        this.isolator = new ResourceIsolator(cgroups, runtime, clock, process, blocking);
    }

    public ContainerizerConfig config() {
        return config;
    }

    public void addListener(ContainerEventListener listener) {
        events.add(listener);
    }

    @Override
    public CompletableFuture<Void> recover(AgentState state) {
        if (!recoveryStarted.compareAndSet(false, true)) {
            throw new IllegalStateException("Recovery already ran");
        }
        onProcess(() -> recovery.recover(state)).whenComplete((ignored, error) -> {
            if (error != null) {
                var cause = Futures.unwrap(error);
                logger.error("Recovery failed", cause);
                recovered.completeExceptionally(cause instanceof RecoveryException
                        ? cause
                        : new RecoveryException("Recovery failed: " + cause.getMessage(), cause));
            } else {
                recovered.complete(null);
            }
        });
        return recovered.copy();
    }

    @Override
    public CompletableFuture<Boolean> launch(
            ContainerId containerId,
            TaskSpec task,
            ExecutorSpec executor,
            Path directory,
            Optional<String> user,
            String agentId,
            String agentAddress,
            boolean checkpoint) {
        Objects.requireNonNull(task, "task");
        return launch(new LaunchContext(
                containerId, task, executor, directory, user, agentId, agentAddress, checkpoint));
    }

    @Override
    public CompletableFuture<Boolean> launch(
            ContainerId containerId,
            ExecutorSpec executor,
            Path directory,
            Optional<String> user,
            String agentId,
            String agentAddress,
            boolean checkpoint) {
        return launch(new LaunchContext(
                containerId, null, executor, directory, user, agentId, agentAddress, checkpoint));
    }

    private CompletableFuture<Boolean> launch(LaunchContext context) {
        if (context.container().isEmpty()) {
            logger.debug("Container {} has no container spec, leaving it to another containerizer",
                    context.containerId());
            return CompletableFuture.completedFuture(false);
        }
        return recovered.thenComposeAsync(ignored -> pipeline.launch(context), process);
    }

    @Override
    public CompletableFuture<Termination> wait(ContainerId containerId) {
        return onProcess(() -> find(containerId).termination().copy());
    }

    @Override
    public CompletableFuture<Void> destroy(ContainerId containerId) {
        return onProcess(() -> {
            var state = find(containerId);
            if (!registry.markDestroyed(state)) {
                logger.debug("Container {} is already being destroyed", containerId);
                return CompletableFuture.completedFuture(null);
            }
            if (!state.monitored()) {
                logger.info("Destroying container {} while {}", containerId, state.stage().describe());
                return CompletableFuture.completedFuture(null);
            }
            logger.info("Destroying container {}", containerId);
            return runtime.stop(state.name(), config.stopTimeout(), false).handleAsync((ignored, error) -> {
                if (error == null) {
                    return null;
                }
                var cause = Futures.unwrap(error);
                logger.warn("Failed to stop container {}", state.name(), cause);
                runtime.rm(state.name(), true).whenComplete((removed, rmError) -> {
                    if (rmError != null) {
                        logger.warn("Failed to remove container {}", state.name(), Futures.unwrap(rmError));
                    }
                });
                var failure = new ContainerizerException("Failed to destroy container " + containerId, cause);
                if (registry.isCurrent(state)) {
                    registry.retire(state, failure);
                }
                throw failure;
            }, process);
        });
    }

    @Override
    public CompletableFuture<Void> update(ContainerId containerId, Resources resources) {
        return onProcess(() -> isolator.update(find(containerId), resources));
    }

    @Override
    public CompletableFuture<ResourceStatistics> usage(ContainerId containerId) {
        return onProcess(() -> isolator.usage(find(containerId)))
                .thenApply(statistics -> {
                    events.usage(containerId, statistics);
                    return statistics;
                });
    }

    @Override
    public CompletableFuture<Set<ContainerId>> containers() {
        return CompletableFuture.supplyAsync(registry::ids, process);
    }

    @Override
    public void close() {
        logger.info("Shutting down containerizer");
        process.shutdownNow();
        blocking.shutdownNow();
    }

    private ContainerState find(ContainerId containerId) {
        return registry.get(containerId).orElseThrow(() -> new ContainerNotFoundException(containerId));
    }

    private <T> CompletableFuture<T> onProcess(Supplier<CompletableFuture<T>> operation) {
        return CompletableFuture.supplyAsync(operation, process).thenCompose(Function.identity());
    }

    private static ThreadFactory threads(String name) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
