package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.checkpoint.RunRecord;
import dev.containerizer.agent.docker.DockerRuntime;
import dev.containerizer.agent.docker.RunRequest;
import dev.containerizer.agent.fetcher.Fetcher;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.NetworkMode;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.Termination;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a container through fetch, pull, run and checkpoint, then hands it to the {@link ContainerMonitor}.
 * Every stage checks for a destroy before it starts and again when its call returns; a destroy or a failure sends
 * the container down the abort path, which stops whatever was started and resolves the termination.
 */
final class LaunchPipeline {

    private static final Logger logger = LoggerFactory.getLogger(LaunchPipeline.class);

    private final ContainerizerConfig config;
    private final ContainerNames names;
    private final ContainerRegistry registry;
    private final DockerRuntime runtime;
    private final Fetcher fetcher;
    private final CheckpointWriter checkpoints;
    private final ContainerMonitor monitor;
    private final Executor process;

    LaunchPipeline(
            ContainerizerConfig config,
            ContainerNames names,
            ContainerRegistry registry,
            DockerRuntime runtime,
            Fetcher fetcher,
            CheckpointWriter checkpoints,
            ContainerMonitor monitor,
            Executor process) {
        this.config = config;
        this.names = names;
        this.registry = registry;
        this.runtime = runtime;
        this.fetcher = fetcher;
        this.checkpoints = checkpoints;
        this.monitor = monitor;
        this.process = process;
    }

    /**
     * Registers the container and starts its pipeline. Must run on the containerizer thread.
     */
    CompletableFuture<Boolean> launch(LaunchContext context) {
        var spec = context.container().orElseThrow();
        boolean pullImage = true;
        if (!spec.hasImage()) {
            if (!context.bareExecutor()) {
                throw new RunException("Container spec of task " + context.task().taskId() + " names no image");
            }
            logger.info("Executor {} names no image, running default executor image {}",
                    context.executor().executorId(), config.defaultExecutorImage());
            spec = spec.withImage(config.defaultExecutorImage());
            pullImage = false;
        }

        var state = new ContainerState(
                context.containerId(),
                names.name(context.containerId()),
                context.directory(),
                context.user(),
                context.agentId(),
                context.executor().frameworkId(),
                context.executor().executorId(),
                context.checkpoint(),
                context.resources(),
                ContainerStatus.FETCHING);
        registry.register(state);
        logger.info("Starting container {} for {} from image {}", state.id(), describe(context), spec.image());

        var image = spec;
        var shouldPull = pullImage;
        return stage(state, ContainerStatus.FETCHING,
                () -> fetcher.fetch(state.id(), context.command(), context.directory(), context.user()),
                (message, cause) -> new FetchException("Failed to fetch artifacts for container " + message, cause))
                .thenCompose(ignored -> shouldPull ? pull(state, image) : CompletableFuture.<Void>completedFuture(null))
                .thenCompose(ignored -> run(state, image, context))
                .thenCompose(ignored -> checkpoint(state))
                .thenApply(ignored -> attach(state))
                .handle((launched, error) -> error == null
                        ? CompletableFuture.completedFuture(launched)
                        : abort(state, Futures.unwrap(error)))
                .thenCompose(Function.identity());
    }

    private CompletableFuture<Void> pull(ContainerState state, ContainerSpec spec) {
        return stage(state, ContainerStatus.PULLING,
                () -> runtime.pull(state.directory().orElseThrow(), spec.image(), spec.forcePullImage()),
                (message, cause) -> new PullException(
                        "Failed to pull image " + spec.image() + " for container " + message, cause));
    }

    private CompletableFuture<Void> run(ContainerState state, ContainerSpec spec, LaunchContext context) {
        return stage(state, ContainerStatus.RUNNING,
                () -> {
                    // Resources may have been updated while the container was fetching or pulling.
                    var resources = state.resources();
                    checkPortMappings(spec, resources);
                    var request = new RunRequest(
                            state.name(),
                            spec,
                            context.command(),
                            context.directory(),
                            config.sandboxDirectory(),
                            resources,
                            environment(context));
                    state.markRunStarted();
                    return runtime.run(request);
                },
                (message, cause) -> new RunException("Failed to run container " + message, cause))
                .thenAccept(pid -> {
                    pid.ifPresent(state::pid);
                    state.markStarted();
                });
    }

    private CompletableFuture<Void> checkpoint(ContainerState state) {
        if (!state.checkpoint()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Integer> pid = state.pid().isPresent()
                ? CompletableFuture.completedFuture(state.pid().get())
                : stage(state, ContainerStatus.RUNNING,
                        () -> runtime.inspect(state.name()),
                        (message, cause) -> new CheckpointException(
                                "Failed to inspect container " + message, cause))
                        .thenApply(container -> {
                            var discovered = container.optionalPid().orElseThrow(() -> new CheckpointException(
                                    "Container " + state.id() + " has no pid to checkpoint", null));
                            state.pid(discovered);
                            return discovered;
                        });

        return pid.thenCompose(known -> stage(state, ContainerStatus.RUNNING,
                () -> checkpoints.write(new RunRecord(
                        state.id(),
                        state.agentId(),
                        state.frameworkId(),
                        state.executorId(),
                        known,
                        state.directory().map(Object::toString).orElse(null))),
                (message, cause) -> new CheckpointException("Failed to checkpoint container " + message, cause)));
    }

    private boolean attach(ContainerState state) {
        if (state.destroyed()) {
            throw new DestroyedDuringLaunchException(state.id(), state.stage());
        }
        state.markMonitored();
        monitor.watch(state);
        logger.info("Container {} is running", state.id());
        return true;
    }

    /**
     * Runs one asynchronous stage call and resumes on the containerizer thread. Errors that are not already
     * containerizer errors are wrapped by {@code failure}, which receives the container id and cause message.
     */
    private <T> CompletableFuture<T> stage(
            ContainerState state,
            ContainerStatus status,
            Supplier<CompletableFuture<T>> call,
            BiFunction<String, Throwable, ? extends ContainerizerException> failure) {
        if (state.destroyed()) {
            return CompletableFuture.failedFuture(new DestroyedDuringLaunchException(state.id(), state.stage()));
        }
        registry.transition(state, status);

        CompletableFuture<T> pending;
        try {
            pending = call.get();
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        return pending.handleAsync((result, error) -> {
            if (state.destroyed()) {
                throw new DestroyedDuringLaunchException(state.id(), state.stage());
            }
            if (error != null) {
                var cause = Futures.unwrap(error);
                if (cause instanceof ContainerizerException containerizerError) {
                    throw containerizerError;
                }
                throw failure.apply(state.id() + ": " + cause.getMessage(), cause);
            }
            return result;
        }, process);
    }

    private CompletableFuture<Boolean> abort(ContainerState state, Throwable error) {
        if (error instanceof DestroyedDuringLaunchException) {
            logger.info("Aborting launch: {}", error.getMessage());
        } else {
            logger.warn("Launch of container {} failed while {}", state.id(), state.stage().describe(), error);
        }
        // Updates waiting for the container to start fail with the launch.
        state.started().completeExceptionally(error);

        CompletableFuture<Void> cleanup = state.runStarted()
                ? runtime.stop(state.name(), config.stopTimeout(), true)
                        .handleAsync((ignored, stopError) -> {
                            if (stopError != null) {
                                logger.warn("Failed to remove partially launched container {}",
                                        state.name(), Futures.unwrap(stopError));
                            }
                            return null;
                        }, process)
                : CompletableFuture.completedFuture(null);

        if (state.checkpoint() && state.runStarted()) {
            cleanup = cleanup.thenCompose(ignored -> checkpoints.discard(state.id()))
                    .thenApplyAsync(Function.identity(), process);
        }

        return cleanup.thenCompose(ignored -> {
            if (error instanceof DestroyedDuringLaunchException destroyed) {
                registry.retire(state, Termination.destroyed(
                        "Container destroyed while " + destroyed.stage().describe(), null));
            } else {
                registry.retire(state, error);
            }
            return CompletableFuture.failedFuture(error);
        });
    }

    static void checkPortMappings(ContainerSpec spec, Resources resources) {
        if (spec.portMappings().isEmpty()) {
            return;
        }
        if (spec.network() != NetworkMode.BRIDGE) {
            throw new RunException("Port mappings require BRIDGE networking, not " + spec.network());
        }
        for (var mapping : spec.portMappings()) {
            if (!resources.containsPort(mapping.hostPort())) {
                throw new RunException("Host port " + mapping.hostPort()
                        + " is outside the allocated port ranges " + resources.ports());
            }
        }
    }

    Map<String, String> environment(LaunchContext context) {
        var environment = new LinkedHashMap<String, String>();
        environment.put("MESOS_SANDBOX", config.sandboxDirectory());
        if (context.bareExecutor()) {
            var executor = context.executor();
            environment.put("MESOS_FRAMEWORK_ID", Objects.toString(executor.frameworkId(), ""));
            environment.put("MESOS_EXECUTOR_ID", Objects.toString(executor.executorId(), ""));
            environment.put("MESOS_DIRECTORY", context.directory().toString());
            environment.put("MESOS_SLAVE_ID", Objects.toString(context.agentId(), ""));
            environment.put("MESOS_SLAVE_PID", Objects.toString(context.agentAddress(), ""));
            environment.put("MESOS_CHECKPOINT", context.checkpoint() ? "1" : "0");
        }
        return environment;
    }

    private static String describe(LaunchContext context) {
        return context.bareExecutor()
                ? "executor " + context.executor().executorId()
                : "task " + context.task().taskId();
    }
}
