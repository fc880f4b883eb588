package dev.containerizer.agent.cgroups;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Cgroups} backed by the cgroup v1 filesystem, discovered through {@code <proc>/mounts} and
 * {@code <proc>/<pid>/cgroup}.
 */
public class LinuxCgroups implements Cgroups {

    private static final Logger logger = LoggerFactory.getLogger(LinuxCgroups.class);

    private final Path procRoot;

    public LinuxCgroups() {
        this(Path.of("/proc"));
    }

    public LinuxCgroups(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public Path hierarchy(String subsystem) {
        for (String line : readLines(procRoot.resolve("mounts"))) {
            var fields = line.split("\\s+");
            if (fields.length < 4 || !fields[2].equals("cgroup")) {
                continue;
            }
            if (Arrays.asList(fields[3].split(",")).contains(subsystem)) {
                return Path.of(fields[1]);
            }
        }
        throw new CgroupException("Hierarchy for subsystem '" + subsystem + "' is not mounted");
    }

    @Override
    public String cgroup(int pid, String subsystem) {
        var file = procRoot.resolve(String.valueOf(pid)).resolve("cgroup");
        for (String line : readLines(file)) {
            // hierarchy-id:controller-list:cgroup-path
            var fields = line.split(":", 3);
            if (fields.length == 3 && Arrays.asList(fields[1].split(",")).contains(subsystem)) {
                return fields[2];
            }
        }
        throw new CgroupException("Process " + pid + " is not in a '" + subsystem + "' cgroup");
    }

    @Override
    public long cpuShares(Path hierarchy, String cgroup) {
        return readLong(control(hierarchy, cgroup, "cpu.shares"));
    }

    @Override
    public void cpuShares(Path hierarchy, String cgroup, long shares) {
        write(control(hierarchy, cgroup, "cpu.shares"), shares);
    }

    @Override
    public long memorySoftLimit(Path hierarchy, String cgroup) {
        return readLong(control(hierarchy, cgroup, "memory.soft_limit_in_bytes"));
    }

    @Override
    public void memorySoftLimit(Path hierarchy, String cgroup, long bytes) {
        write(control(hierarchy, cgroup, "memory.soft_limit_in_bytes"), bytes);
    }

    @Override
    public long memoryLimit(Path hierarchy, String cgroup) {
        return readLong(control(hierarchy, cgroup, "memory.limit_in_bytes"));
    }

    @Override
    public void memoryLimit(Path hierarchy, String cgroup, long bytes) {
        write(control(hierarchy, cgroup, "memory.limit_in_bytes"), bytes);
    }

    @Override
    public CpuTimes cpuTimes(Path hierarchy, String cgroup) {
        var file = control(hierarchy, cgroup, "cpuacct.stat");
        long user = -1;
        long system = -1;
        for (String line : readLines(file)) {
            var fields = line.trim().split("\\s+");
            if (fields.length != 2) {
                continue;
            }
            switch (fields[0]) {
                case "user" -> user = parse(file, fields[1]);
                case "system" -> system = parse(file, fields[1]);
                default -> { }
            }
        }
        if (user < 0 || system < 0) {
            throw new CgroupException("Malformed " + file + ": missing user or system time");
        }
        return new CpuTimes(user, system);
    }

    @Override
    public long memoryRss(Path hierarchy, String cgroup) {
        var file = control(hierarchy, cgroup, "memory.stat");
        for (String line : readLines(file)) {
            var fields = line.trim().split("\\s+");
            if (fields.length == 2 && fields[0].equals("total_rss")) {
                return parse(file, fields[1]);
            }
        }
        for (String line : readLines(file)) {
            var fields = line.trim().split("\\s+");
            if (fields.length == 2 && fields[0].equals("rss")) {
                return parse(file, fields[1]);
            }
        }
        throw new CgroupException("Malformed " + file + ": no rss entry");
    }

    private Path control(Path hierarchy, String cgroup, String name) {
        var relative = cgroup.startsWith("/") ? cgroup.substring(1) : cgroup;
        return hierarchy.resolve(relative).resolve(name);
    }

    private List<String> readLines(Path file) {
        try {
            return Files.readAllLines(file);
        } catch (IOException e) {
            throw new CgroupException("Failed to read " + file, e);
        }
    }

    private long readLong(Path file) {
        try {
            return parse(file, Files.readString(file).trim());
        } catch (IOException e) {
            throw new CgroupException("Failed to read " + file, e);
        }
    }

    private void write(Path file, long value) {
        if (!Files.exists(file)) {
            throw new CgroupException("Control file " + file + " does not exist");
        }
        try {
            Files.writeString(file, Long.toString(value));
            logger.debug("Wrote {} to {}", value, file);
        } catch (IOException e) {
            throw new CgroupException("Failed to write " + value + " to " + file, e);
        }
    }

    private static long parse(Path file, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new CgroupException("Unexpected value '" + value + "' in " + file, e);
        }
    }
}
