package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;

public class ContainerNotFoundException extends ContainerizerException {

    public ContainerNotFoundException(ContainerId containerId) {
        super("Unknown container: " + containerId);
    }
}
