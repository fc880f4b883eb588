package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.Termination;

/**
 * A container left the registry, either with a termination or with the failure that ended its lifecycle.
 */
public record ContainerTerminated(ContainerId containerId, Termination termination, Throwable failure) {}
