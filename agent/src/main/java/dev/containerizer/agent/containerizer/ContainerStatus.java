package dev.containerizer.agent.containerizer;

public enum ContainerStatus {
    FETCHING("fetching"),
    PULLING("pulling"),
    RUNNING("running"),
    DESTROYING("destroying");

    private final String description;

    ContainerStatus(String description) {
        this.description = description;
    }

    String describe() {
        return description;
    }
}
