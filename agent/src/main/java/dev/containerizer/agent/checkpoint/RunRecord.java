package dev.containerizer.agent.checkpoint;

import dev.containerizer.agent.model.ContainerId;
import java.util.Optional;

/**
 * Durable identity of one container run, enough to re-attach to it after an agent restart.
 */
public record RunRecord(
    ContainerId containerId,
    String agentId,
    String frameworkId,
    String executorId,
    Integer pid,
    String directory
) {

    public Optional<Integer> optionalPid() {
        return Optional.ofNullable(pid);
    }

    public Optional<String> optionalDirectory() {
        return directory == null || directory.isEmpty() ? Optional.empty() : Optional.of(directory);
    }
}
