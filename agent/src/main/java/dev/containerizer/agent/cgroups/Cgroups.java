package dev.containerizer.agent.cgroups;

import java.nio.file.Path;

/**
 * Synchronous access to cgroup v1 control files. A cgroup is addressed by its hierarchy mount point plus the path
 * of the cgroup inside it. Every method throws {@link CgroupException} when the hierarchy or file is missing or a
 * write is rejected.
 */
public interface Cgroups {

    String CPU = "cpu";
    String CPUACCT = "cpuacct";
    String MEMORY = "memory";

    /** Mount point of the hierarchy the subsystem is attached to. */
    Path hierarchy(String subsystem);

    /** Path of the cgroup that {@code pid} belongs to for the subsystem, relative to its hierarchy. */
    String cgroup(int pid, String subsystem);

    long cpuShares(Path hierarchy, String cgroup);

    void cpuShares(Path hierarchy, String cgroup, long shares);

    long memorySoftLimit(Path hierarchy, String cgroup);

    void memorySoftLimit(Path hierarchy, String cgroup, long bytes);

    long memoryLimit(Path hierarchy, String cgroup);

    void memoryLimit(Path hierarchy, String cgroup, long bytes);

    CpuTimes cpuTimes(Path hierarchy, String cgroup);

    long memoryRss(Path hierarchy, String cgroup);
}
