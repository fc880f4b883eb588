package dev.containerizer.agent.checkpoint;

import dev.containerizer.agent.model.ContainerId;

/**
 * Durable storage of run records. Implementations throw unchecked exceptions on I/O failure.
 */
public interface CheckpointStore {

    void checkpoint(RunRecord run);

    void remove(ContainerId containerId);

    AgentState load(String agentId);
}
