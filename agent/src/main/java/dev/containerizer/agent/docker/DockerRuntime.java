package dev.containerizer.agent.docker;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the container runtime. Every call completes independently and may be issued concurrently
 * for different containers. Failures surface as {@link DockerRuntimeException}.
 */
public interface DockerRuntime {

    /**
     * Creates and starts a container. Completes with the container's pid when the runtime reports it right away.
     */
    CompletableFuture<Optional<Integer>> run(RunRequest request);

    /**
     * Makes {@code image} available locally. A no-op when the image is present and {@code force} is false.
     */
    CompletableFuture<Void> pull(Path directory, String image, boolean force);

    /**
     * Stops a container, killing it once {@code timeout} has passed, and removes it if asked to.
     */
    CompletableFuture<Void> stop(String name, Duration timeout, boolean remove);

    CompletableFuture<Void> rm(String name, boolean force);

    CompletableFuture<DockerContainer> inspect(String name);

    /**
     * Lists containers whose name starts with {@code namePrefix}; names come back without the leading slash.
     */
    CompletableFuture<List<DockerContainer>> ps(boolean all, String namePrefix);

    /**
     * Writes the container's stdout and stderr into {@code stdout} and {@code stderr} files under {@code directory}.
     */
    CompletableFuture<Void> logs(String name, Path directory);

    /**
     * Completes with the exit status once the container has stopped.
     */
    CompletableFuture<Integer> await(String name);
}
