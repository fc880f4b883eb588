package dev.containerizer.agent.model;

public record PortRange(int begin, int end) {

    public PortRange {
        if (begin > end) {
            throw new IllegalArgumentException("Invalid port range " + begin + "-" + end);
        }
    }

    public boolean contains(int port) {
        return port >= begin && port <= end;
    }

    @Override
    public String toString() {
        return begin + "-" + end;
    }
}
