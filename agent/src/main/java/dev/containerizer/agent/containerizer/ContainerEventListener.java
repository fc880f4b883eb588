package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ResourceStatistics;

public interface ContainerEventListener {

    void onStatusChanged(ContainerStatusChanged event);

    default void onTerminated(ContainerTerminated event) {
    }

    default void onUsage(ContainerId containerId, ResourceStatistics statistics) {
    }
}
