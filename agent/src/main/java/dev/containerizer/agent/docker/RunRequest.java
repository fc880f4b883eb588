package dev.containerizer.agent.docker;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.Resources;
import java.nio.file.Path;
import java.util.Map;

/**
 * Everything needed to create and start one container.
 *
 * @param name         runtime-visible name, prefix included
 * @param directory    host sandbox directory, bind-mounted at {@code sandboxMount}
 * @param sandboxMount path of the sandbox inside the container, also the working directory
 * @param environment  variables added on top of the command's own environment
 */
public record RunRequest(
    String name,
    ContainerSpec container,
    CommandSpec command,
    Path directory,
    String sandboxMount,
    Resources resources,
    Map<String, String> environment
) {

    public RunRequest {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
