package dev.containerizer.agent.docker;

import java.util.Optional;

/**
 * A container as the runtime reports it from {@code ps} or {@code inspect}. Listings carry no pid.
 */
public record DockerContainer(
    String id,
    String name,
    Integer pid,
    boolean isRunning,
    Integer exitCode,
    boolean oomKilled,
    String systemError
) {

    public Optional<Integer> optionalPid() {
        return Optional.ofNullable(pid);
    }
}
