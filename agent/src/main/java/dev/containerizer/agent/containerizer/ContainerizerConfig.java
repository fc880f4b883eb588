package dev.containerizer.agent.containerizer;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of a {@link DockerContainerizer}, fixed for its lifetime.
 *
 * @param namePrefix           prefix of every runtime container name this agent owns
 * @param sandboxDirectory     mount point of the sandbox inside the container
 * @param stopTimeout          grace period a stopped container gets before it is killed
 * @param keepContainers       keep exited containers around instead of removing them
 * @param orphanPolicy         what recovery does with unknown containers carrying the prefix
 * @param defaultExecutorImage image run for bare executors whose container spec names none
 */
public record ContainerizerConfig(
    String namePrefix,
    String sandboxDirectory,
    Duration stopTimeout,
    boolean keepContainers,
    OrphanPolicy orphanPolicy,
    String defaultExecutorImage
) {

    public static final String DEFAULT_NAME_PREFIX = "mesos-";
    public static final String DEFAULT_SANDBOX_DIRECTORY = "/mnt/mesos/sandbox";
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_EXECUTOR_IMAGE = "alpine:latest";

    public ContainerizerConfig {
        Objects.requireNonNull(namePrefix, "namePrefix");
        Objects.requireNonNull(sandboxDirectory, "sandboxDirectory");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(orphanPolicy, "orphanPolicy");
        Objects.requireNonNull(defaultExecutorImage, "defaultExecutorImage");
        if (namePrefix.isBlank()) {
            throw new IllegalArgumentException("Name prefix must not be blank");
        }
        if (stopTimeout.isNegative()) {
            throw new IllegalArgumentException("Stop timeout must not be negative: " + stopTimeout);
        }
    }

    public static ContainerizerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String namePrefix = DEFAULT_NAME_PREFIX;
        private String sandboxDirectory = DEFAULT_SANDBOX_DIRECTORY;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private boolean keepContainers;
        private OrphanPolicy orphanPolicy = OrphanPolicy.LEAVE;
        private String defaultExecutorImage = DEFAULT_EXECUTOR_IMAGE;

        private Builder() {
        }

        public Builder namePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
            return this;
        }

        public Builder sandboxDirectory(String sandboxDirectory) {
            this.sandboxDirectory = sandboxDirectory;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder keepContainers(boolean keepContainers) {
            this.keepContainers = keepContainers;
            return this;
        }

        public Builder orphanPolicy(OrphanPolicy orphanPolicy) {
            this.orphanPolicy = orphanPolicy;
            return this;
        }

        public Builder defaultExecutorImage(String defaultExecutorImage) {
            this.defaultExecutorImage = defaultExecutorImage;
            return this;
        }

        public ContainerizerConfig build() {
            return new ContainerizerConfig(namePrefix, sandboxDirectory, stopTimeout, keepContainers, orphanPolicy,
                    defaultExecutorImage);
        }
    }
}
