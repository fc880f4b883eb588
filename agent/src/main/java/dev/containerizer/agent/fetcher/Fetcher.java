package dev.containerizer.agent.fetcher;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerId;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieves a command's artifacts into the container's sandbox before the container starts.
 */
public interface Fetcher {

    CompletableFuture<Void> fetch(ContainerId containerId, CommandSpec command, Path directory, Optional<String> user);
}
