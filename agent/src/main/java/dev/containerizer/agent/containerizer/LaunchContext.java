package dev.containerizer.agent.containerizer;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.ExecutorSpec;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.TaskSpec;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Arguments of one launch. {@code task} is null when the executor itself is launched.
 */
record LaunchContext(
    ContainerId containerId,
    TaskSpec task,
    ExecutorSpec executor,
    Path directory,
    Optional<String> user,
    String agentId,
    String agentAddress,
    boolean checkpoint
) {

    LaunchContext {
        Objects.requireNonNull(containerId, "containerId");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(directory, "directory");
        user = user == null ? Optional.empty() : user;
    }

    boolean bareExecutor() {
        return task == null;
    }

    Optional<ContainerSpec> container() {
        return bareExecutor() ? executor.optionalContainer() : task.optionalContainer();
    }

    CommandSpec command() {
        var command = bareExecutor() ? executor.command() : task.command();
        return command != null ? command : CommandSpec.imageDefault();
    }

    Resources resources() {
        return bareExecutor() ? executor.resources() : task.resources();
    }
}
