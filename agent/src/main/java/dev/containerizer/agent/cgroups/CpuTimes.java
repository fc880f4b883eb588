package dev.containerizer.agent.cgroups;

/**
 * Accumulated CPU time of a cgroup, in clock ticks as reported by {@code cpuacct.stat}.
 */
public record CpuTimes(long userTicks, long systemTicks) {

    // USER_HZ on every Linux architecture the agent runs on.
    static final double TICKS_PER_SECOND = 100.0;

    public double userSeconds() {
        return userTicks / TICKS_PER_SECOND;
    }

    public double systemSeconds() {
        return systemTicks / TICKS_PER_SECOND;
    }
}
