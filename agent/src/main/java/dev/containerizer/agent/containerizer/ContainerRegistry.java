package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.Termination;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The live containers, keyed by id, and the only place their status changes. Confined to the containerizer
 * thread.
 */
final class ContainerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ContainerRegistry.class);

    private final Map<ContainerId, ContainerState> states = new LinkedHashMap<>();
    private final ContainerEvents events;

    ContainerRegistry(ContainerEvents events) {
        this.events = events;
    }

    void register(ContainerState state) {
        if (states.containsKey(state.id())) {
            throw new DuplicateContainerException(state.id());
        }
        states.put(state.id(), state);
        logger.debug("Registered container {} in state {}", state.id(), state.status());
        events.statusChanged(new ContainerStatusChanged(state.id(), null, state.status()));
    }

    Optional<ContainerState> get(ContainerId containerId) {
        return Optional.ofNullable(states.get(containerId));
    }

    /** Whether {@code state} is still the registered state of its id. */
    boolean isCurrent(ContainerState state) {
        return states.get(state.id()) == state;
    }

    Set<ContainerId> ids() {
        return new LinkedHashSet<>(states.keySet());
    }

    Collection<ContainerState> states() {
        return List.copyOf(states.values());
    }

    /**
     * Moves the container to a pipeline status. Ignored once it is being destroyed.
     */
    void transition(ContainerState state, ContainerStatus status) {
        var previous = state.status();
        if (state.destroyed() || previous == status) {
            return;
        }
        state.status(status);
        events.statusChanged(new ContainerStatusChanged(state.id(), previous, status));
    }

    /**
     * Marks the container destroyed. Returns false when a destroy was already accepted.
     */
    boolean markDestroyed(ContainerState state) {
        if (state.destroyed()) {
            return false;
        }
        var previous = state.status();
        state.status(ContainerStatus.DESTROYING);
        state.markDestroyed();
        events.statusChanged(new ContainerStatusChanged(state.id(), previous, ContainerStatus.DESTROYING));
        return true;
    }

    /**
     * Resolves the termination, then forgets the container.
     */
    void retire(ContainerState state, Termination termination) {
        if (!state.termination().complete(termination)) {
            logger.warn("Container {} was already terminated", state.id());
        }
        remove(state);
        events.terminated(new ContainerTerminated(state.id(), termination, null));
    }

    /**
     * Fails the termination, then forgets the container.
     */
    void retire(ContainerState state, Throwable failure) {
        if (!state.termination().completeExceptionally(failure)) {
            logger.warn("Container {} was already terminated", state.id());
        }
        remove(state);
        events.terminated(new ContainerTerminated(state.id(), null, failure));
    }

    private void remove(ContainerState state) {
        if (isCurrent(state)) {
            states.remove(state.id());
            logger.debug("Removed container {}", state.id());
        }
    }
}
