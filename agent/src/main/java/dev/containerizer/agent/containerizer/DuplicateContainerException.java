package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;

public class DuplicateContainerException extends ContainerizerException {

    public DuplicateContainerException(ContainerId containerId) {
        super("Container already started: " + containerId);
    }
}
