package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;

/**
 * The launch was abandoned because the container was destroyed before it was handed to its monitor.
 */
public class DestroyedDuringLaunchException extends ContainerizerException {

    private final ContainerStatus stage;

    public DestroyedDuringLaunchException(ContainerId containerId, ContainerStatus stage) {
        super("Container " + containerId + " destroyed while " + stage.describe());
        this.stage = stage;
    }

    public ContainerStatus stage() {
        return stage;
    }
}
