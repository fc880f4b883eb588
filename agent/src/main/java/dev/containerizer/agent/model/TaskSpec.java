package dev.containerizer.agent.model;

import java.util.Optional;

public record TaskSpec(
    String taskId,
    String name,
    CommandSpec command,
    ContainerSpec container,
    Resources resources
) {

    public TaskSpec {
        resources = resources == null ? Resources.EMPTY : resources;
    }

    public Optional<ContainerSpec> optionalContainer() {
        return Optional.ofNullable(container);
    }
}
