package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.cgroups.CgroupLimits;
import dev.containerizer.agent.cgroups.Cgroups;
import dev.containerizer.agent.docker.DockerRuntime;
import dev.containerizer.agent.model.ResourceStatistics;
import dev.containerizer.agent.model.Resources;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies resource updates to, and reads usage from, the cgroups of running containers. The container's pid is
 * looked up once through the runtime and cached on its state. Updates of one container are applied one after
 * another in the order they arrived, and never before the runtime has created the container.
 */
final class ResourceIsolator {

    private static final Logger logger = LoggerFactory.getLogger(ResourceIsolator.class);

    private final Cgroups cgroups;
    private final DockerRuntime runtime;
    private final Clock clock;
    private final Executor process;
    private final Executor blocking;

    ResourceIsolator(Cgroups cgroups, DockerRuntime runtime, Clock clock, Executor process, Executor blocking) {
        this.cgroups = cgroups;
        this.runtime = runtime;
        this.clock = clock;
        this.process = process;
        this.blocking = blocking;
    }

    /**
     * Must run on the containerizer thread.
     */
    CompletableFuture<Void> update(ContainerState state, Resources resources) {
        if (state.destroyed()) {
            logger.info("Ignoring update of container {}: it is being destroyed", state.id());
            return CompletableFuture.completedFuture(null);
        }
        state.resources(resources);
        if (!state.runStarted()) {
            logger.info("Container {} is still {}, resources {} apply once it runs",
                    state.id(), state.status().describe(), resources);
            return CompletableFuture.completedFuture(null);
        }
        // A failed earlier update must not hold back later ones.
        var applied = state.updates()
                .exceptionally(ignored -> null)
                .thenCompose(ignored -> state.started())
                .thenComposeAsync(ignored -> pid(state), process)
                .thenAcceptAsync(pid -> apply(state, pid, resources), blocking);
        state.updates(applied);
        return applied;
    }

    /**
     * Must run on the containerizer thread.
     */
    CompletableFuture<ResourceStatistics> usage(ContainerState state) {
        if (state.destroyed()) {
            return CompletableFuture.failedFuture(
                    new ContainerizerException("Container " + state.id() + " is being destroyed"));
        }
        var resources = state.resources();
        return pid(state).thenApplyAsync(pid -> statistics(pid, resources), blocking);
    }

    /**
     * Must run on the containerizer thread. Callers arriving while a lookup is in flight share it; a failed lookup
     * is retried by the next caller.
     */
    private CompletableFuture<Integer> pid(ContainerState state) {
        if (state.pid().isPresent()) {
            return CompletableFuture.completedFuture(state.pid().get());
        }
        var pending = state.pidLookup();
        if (pending.isPresent() && !pending.get().isCompletedExceptionally()) {
            return pending.get();
        }
        var lookup = runtime.inspect(state.name()).thenApplyAsync(container -> {
            var pid = container.optionalPid().orElseThrow(() -> new ContainerizerException(
                    "Container " + state.id() + " has no running process"));
            state.pid(pid);
            logger.debug("Discovered pid {} of container {}", pid, state.id());
            return pid;
        }, process);
        state.pidLookup(lookup);
        return lookup;
    }

    private void apply(ContainerState state, int pid, Resources resources) {
        if (resources.hasCpus()) {
            var hierarchy = cgroups.hierarchy(Cgroups.CPU);
            var cgroup = cgroups.cgroup(pid, Cgroups.CPU);
            var shares = CgroupLimits.cpuShares(resources.cpus());
            cgroups.cpuShares(hierarchy, cgroup, shares);
            logger.info("Updated cpu.shares of container {} to {}", state.id(), shares);
        }

        if (resources.hasMem()) {
            var hierarchy = cgroups.hierarchy(Cgroups.MEMORY);
            var cgroup = cgroups.cgroup(pid, Cgroups.MEMORY);
            var limit = CgroupLimits.memoryLimit(resources.memBytes());
            cgroups.memorySoftLimit(hierarchy, cgroup, limit);
            logger.info("Updated memory soft limit of container {} to {} bytes", state.id(), limit);

            // Only ever raised here.
            if (cgroups.memoryLimit(hierarchy, cgroup) < limit) {
                cgroups.memoryLimit(hierarchy, cgroup, limit);
                logger.info("Raised memory limit of container {} to {} bytes", state.id(), limit);
            }
        }
    }

    private ResourceStatistics statistics(int pid, Resources resources) {
        var cpuacct = cgroups.hierarchy(Cgroups.CPUACCT);
        var times = cgroups.cpuTimes(cpuacct, cgroups.cgroup(pid, Cgroups.CPUACCT));

        var memory = cgroups.hierarchy(Cgroups.MEMORY);
        var rss = cgroups.memoryRss(memory, cgroups.cgroup(pid, Cgroups.MEMORY));

        return new ResourceStatistics(
                clock.millis() / 1000.0,
                times.userSeconds(),
                times.systemSeconds(),
                resources.cpus(),
                rss,
                resources.memBytes());
    }
}
