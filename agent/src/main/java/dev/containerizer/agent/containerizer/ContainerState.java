package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.Termination;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable record of one live container. Only touched from the containerizer thread; status changes go through
 * {@link ContainerRegistry} so listeners see them.
 */
final class ContainerState {

    private final ContainerId id;
    private final String name;
    private final Path directory;
    private final Optional<String> user;
    private final String agentId;
    private final String frameworkId;
    private final String executorId;
    private final boolean checkpoint;
    private final CompletableFuture<Termination> termination = new CompletableFuture<>();
    private final CompletableFuture<Void> started = new CompletableFuture<>();

    private ContainerStatus status;
    // Last pipeline stage entered; survives the switch to DESTROYING.
    private ContainerStatus stage;
    private Resources resources;
    private Integer pid;
    private CompletableFuture<Integer> pidLookup;
    // Tail of the cgroup updates applied so far, in arrival order.
    private CompletableFuture<Void> updates = CompletableFuture.completedFuture(null);
    private boolean destroyed;
    private boolean monitored;
    private boolean runStarted;

    ContainerState(
            ContainerId id,
            String name,
            Path directory,
            Optional<String> user,
            String agentId,
            String frameworkId,
            String executorId,
            boolean checkpoint,
            Resources resources,
            ContainerStatus status) {
        this.id = id;
        this.name = name;
        this.directory = directory;
        this.user = user;
        this.agentId = agentId;
        this.frameworkId = frameworkId;
        this.executorId = executorId;
        this.checkpoint = checkpoint;
        this.resources = resources;
        this.status = status;
        this.stage = status;
    }

    ContainerId id() {
        return id;
    }

    String name() {
        return name;
    }

    Optional<Path> directory() {
        return Optional.ofNullable(directory);
    }

    Optional<String> user() {
        return user;
    }

    String agentId() {
        return agentId;
    }

    String frameworkId() {
        return frameworkId;
    }

    String executorId() {
        return executorId;
    }

    boolean checkpoint() {
        return checkpoint;
    }

    CompletableFuture<Termination> termination() {
        return termination;
    }

    ContainerStatus status() {
        return status;
    }

    ContainerStatus stage() {
        return stage;
    }

    void status(ContainerStatus status) {
        this.status = status;
        if (status != ContainerStatus.DESTROYING) {
            this.stage = status;
        }
    }

    Resources resources() {
        return resources;
    }

    void resources(Resources resources) {
        this.resources = resources;
    }

    Optional<Integer> pid() {
        return Optional.ofNullable(pid);
    }

    void pid(int pid) {
        this.pid = pid;
    }

    Optional<CompletableFuture<Integer>> pidLookup() {
        return Optional.ofNullable(pidLookup);
    }

    void pidLookup(CompletableFuture<Integer> pidLookup) {
        this.pidLookup = pidLookup;
    }

    CompletableFuture<Void> updates() {
        return updates;
    }

    void updates(CompletableFuture<Void> updates) {
        this.updates = updates;
    }

    /**
     * Completes once the runtime has created the container, or fails if the launch is aborted before that.
     */
    CompletableFuture<Void> started() {
        return started;
    }

    void markStarted() {
        started.complete(null);
    }

    boolean destroyed() {
        return destroyed;
    }

    void markDestroyed() {
        this.destroyed = true;
    }

    boolean monitored() {
        return monitored;
    }

    void markMonitored() {
        this.monitored = true;
    }

    boolean runStarted() {
        return runStarted;
    }

    void markRunStarted() {
        this.runStarted = true;
    }
}
