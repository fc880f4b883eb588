package dev.containerizer.agent.model;

import java.util.Optional;

public record ExecutorSpec(
    String frameworkId,
    String executorId,
    CommandSpec command,
    ContainerSpec container,
    Resources resources
) {

    public ExecutorSpec {
        resources = resources == null ? Resources.EMPTY : resources;
    }

    public Optional<ContainerSpec> optionalContainer() {
        return Optional.ofNullable(container);
    }
}
