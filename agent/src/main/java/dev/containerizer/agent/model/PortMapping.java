package dev.containerizer.agent.model;

public record PortMapping(int hostPort, int containerPort, String protocol) {

    public PortMapping {
        protocol = protocol == null || protocol.isBlank() ? "tcp" : protocol.toLowerCase();
        if (!protocol.equals("tcp") && !protocol.equals("udp")) {
            throw new IllegalArgumentException("Unsupported protocol: " + protocol);
        }
    }

    public static PortMapping tcp(int hostPort, int containerPort) {
        return new PortMapping(hostPort, containerPort, "tcp");
    }
}
