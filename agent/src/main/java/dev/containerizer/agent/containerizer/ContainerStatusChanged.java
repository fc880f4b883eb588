package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;

/**
 * A container moved between lifecycle states. {@code previous} is null for a newly registered container.
 */
public record ContainerStatusChanged(ContainerId containerId, ContainerStatus previous, ContainerStatus current) {}
