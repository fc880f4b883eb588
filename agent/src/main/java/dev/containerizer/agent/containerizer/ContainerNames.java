package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.ContainerId;
import java.util.Optional;

/**
 * Maps container ids to runtime container names and back.
 */
public final class ContainerNames {

    private final String prefix;

    public ContainerNames(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String name(ContainerId containerId) {
        return prefix + containerId.value();
    }

    /**
     * The id behind a runtime name, or empty when the name does not carry our prefix.
     */
    public Optional<ContainerId> containerId(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var stripped = name.startsWith("/") ? name.substring(1) : name;
        if (!stripped.startsWith(prefix) || stripped.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(ContainerId.of(stripped.substring(prefix.length())));
    }
}
