package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ResourceStatistics;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ContainerEvents {

    private static final Logger logger = LoggerFactory.getLogger(ContainerEvents.class);

    private final List<ContainerEventListener> listeners = new CopyOnWriteArrayList<>();

    void add(ContainerEventListener listener) {
        listeners.add(listener);
    }

    void statusChanged(ContainerStatusChanged event) {
        emit(event.containerId(), listener -> listener.onStatusChanged(event));
    }

    void terminated(ContainerTerminated event) {
        emit(event.containerId(), listener -> listener.onTerminated(event));
    }

    void usage(ContainerId containerId, ResourceStatistics statistics) {
        emit(containerId, listener -> listener.onUsage(containerId, statistics));
    }

    private void emit(ContainerId containerId, Consumer<ContainerEventListener> delivery) {
        for (var listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (Exception e) {
                logger.error("Listener failed for container {}", containerId, e);
            }
        }
    }
}
