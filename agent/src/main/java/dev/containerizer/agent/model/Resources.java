package dev.containerizer.agent.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource allocation of a container. A zero {@code cpus} or {@code memMb} means the value was not specified.
 */
public record Resources(double cpus, long memMb, List<PortRange> ports) {

    public static final Resources EMPTY = new Resources(0, 0, List.of());

    private static final long BYTES_PER_MB = 1024L * 1024L;

    public Resources {
        if (cpus < 0 || memMb < 0) {
            throw new IllegalArgumentException("Resources must not be negative: cpus=" + cpus + ", mem=" + memMb);
        }
        ports = ports == null ? List.of() : List.copyOf(ports);
    }

    public static Resources of(double cpus, long memMb) {
        return new Resources(cpus, memMb, List.of());
    }

    /**
     * Parses the text form used on the command line and in tests, e.g. {@code cpus:1;mem:128;ports:[31000-31005]}.
     */
    public static Resources parse(String text) {
        double cpus = 0;
        long memMb = 0;
        var ports = new ArrayList<PortRange>();

        for (String entry : text.split(";")) {
            var trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("Malformed resource '" + trimmed + "' in: " + text);
            }
            var name = trimmed.substring(0, colon).trim();
            var value = trimmed.substring(colon + 1).trim();
            switch (name) {
                case "cpus" -> cpus = Double.parseDouble(value);
                case "mem" -> memMb = Long.parseLong(value);
                case "ports" -> ports.addAll(parseRanges(value));
                default -> throw new IllegalArgumentException("Unknown resource '" + name + "' in: " + text);
            }
        }
        return new Resources(cpus, memMb, ports);
    }

    private static List<PortRange> parseRanges(String value) {
        if (!value.startsWith("[") || !value.endsWith("]")) {
            throw new IllegalArgumentException("Port ranges must be enclosed in brackets: " + value);
        }
        var ranges = new ArrayList<PortRange>();
        for (String range : value.substring(1, value.length() - 1).split(",")) {
            var bounds = range.trim().split("-");
            if (bounds.length != 2) {
                throw new IllegalArgumentException("Malformed port range: " + range);
            }
            ranges.add(new PortRange(Integer.parseInt(bounds[0].trim()), Integer.parseInt(bounds[1].trim())));
        }
        return ranges;
    }

    public boolean hasCpus() {
        return cpus > 0;
    }

    public boolean hasMem() {
        return memMb > 0;
    }

    public long memBytes() {
        return memMb * BYTES_PER_MB;
    }

    public boolean containsPort(int port) {
        return ports.stream().anyMatch(range -> range.contains(port));
    }

    @Override
    public String toString() {
        var text = new StringBuilder();
        text.append("cpus:").append(cpus).append(";mem:").append(memMb);
        if (!ports.isEmpty()) {
            text.append(";ports:").append(ports);
        }
        return text.toString();
    }
}
