package dev.containerizer.agent.model;

public enum NetworkMode {
    HOST("host"),
    BRIDGE("bridge"),
    NONE("none");

    private final String dockerName;

    NetworkMode(String dockerName) {
        this.dockerName = dockerName;
    }

    public String dockerName() {
        return dockerName;
    }
}
