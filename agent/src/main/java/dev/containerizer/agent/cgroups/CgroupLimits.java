package dev.containerizer.agent.cgroups;

/**
 * Conversions from allocated resources to cgroup control values.
 */
public final class CgroupLimits {

    public static final long CPU_SHARES_PER_CPU = 1024;
    public static final long MIN_CPU_SHARES = 10;
    public static final long MIN_MEMORY_BYTES = 32L * 1024 * 1024;

    private CgroupLimits() {
    }

    public static long cpuShares(double cpus) {
        return Math.max((long) (cpus * CPU_SHARES_PER_CPU), MIN_CPU_SHARES);
    }

    public static long memoryLimit(long bytes) {
        return Math.max(bytes, MIN_MEMORY_BYTES);
    }
}
