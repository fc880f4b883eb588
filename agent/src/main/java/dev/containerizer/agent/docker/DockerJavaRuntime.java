package dev.containerizer.agent.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientBuilder;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import dev.containerizer.agent.cgroups.CgroupLimits;
import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.PortMapping;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DockerRuntime} over the Docker Engine API. docker-java calls block, so each one runs on a worker pool and
 * is handed back as a future.
 */
public class DockerJavaRuntime implements DockerRuntime, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DockerJavaRuntime.class);

    private static final String DEFAULT_TAG = "latest";

    private final DockerClient docker;
    private final ExecutorService executor;

    public DockerJavaRuntime(DockerClient docker) {
        this(docker, Executors.newCachedThreadPool(workerThreads()));
    }

    DockerJavaRuntime(DockerClient docker, ExecutorService executor) {
        this.docker = docker;
        this.executor = executor;
    }

    public static DockerJavaRuntime connect(String dockerHost) {
        var builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (dockerHost != null && !dockerHost.isBlank()) {
            builder.withDockerHost(dockerHost);
        }
        var config = builder.build();
        var httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return new DockerJavaRuntime(DockerClientBuilder.getInstance(config)
                .withDockerHttpClient(httpClient)
                .build());
    }

    @Override
    public CompletableFuture<Optional<Integer>> run(RunRequest request) {
        return async("run", request.name(), () -> {
            var spec = request.container();
            var create = docker.createContainerCmd(spec.image())
                    .withName(request.name())
                    .withEnv(environment(request))
                    .withWorkingDir(request.sandboxMount())
                    .withHostConfig(hostConfig(request));

            var command = commandLine(request.command());
            if (!command.isEmpty()) {
                create.withCmd(command);
            }
            if (!spec.portMappings().isEmpty()) {
                create.withExposedPorts(spec.portMappings().stream()
                        .map(DockerJavaRuntime::exposedPort)
                        .toList());
            }

            var response = create.exec();
            docker.startContainerCmd(response.getId()).exec();
            logger.info("Started container {} ({}) from image {}", request.name(), response.getId(), spec.image());
            // The Engine API does not return the pid on start; the first inspect discovers it.
            return Optional.<Integer>empty();
        });
    }

    @Override
    public CompletableFuture<Void> pull(Path directory, String image, boolean force) {
        return async("pull", image, () -> {
            if (!force && imageExists(image)) {
                logger.debug("Image {} already present, skipping pull", image);
                return null;
            }
            var reference = ImageReference.parse(image);
            var pull = docker.pullImageCmd(reference.repository());
            if (reference.tag() != null) {
                pull.withTag(reference.tag());
            }
            logger.info("Pulling image {} for sandbox {}", image, directory);
            pull.start().awaitCompletion();
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> stop(String name, Duration timeout, boolean remove) {
        return async("stop", name, () -> {
            try {
                docker.stopContainerCmd(name)
                        .withTimeout((int) timeout.toSeconds())
                        .exec();
            } catch (NotModifiedException e) {
                logger.debug("Container {} was already stopped", name);
            }
            if (remove) {
                docker.removeContainerCmd(name)
                        .withForce(true)
                        .withRemoveVolumes(true)
                        .exec();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> rm(String name, boolean force) {
        return async("remove", name, () -> {
            docker.removeContainerCmd(name)
                    .withForce(force)
                    .withRemoveVolumes(true)
                    .exec();
            return null;
        });
    }

    @Override
    public CompletableFuture<DockerContainer> inspect(String name) {
        return async("inspect", name, () -> {
            var response = docker.inspectContainerCmd(name).exec();
            var state = response.getState();
            var pid = state.getPidLong();
            var exitCode = state.getExitCodeLong();
            var error = state.getError();

            return new DockerContainer(
                    response.getId(),
                    stripSlash(response.getName()),
                    pid != null && pid > 0 ? pid.intValue() : null,
                    Boolean.TRUE.equals(state.getRunning()),
                    exitCode != null ? exitCode.intValue() : null,
                    Boolean.TRUE.equals(state.getOOMKilled()),
                    error != null && !error.isBlank() ? error : null
            );
        });
    }

    @Override
    public CompletableFuture<List<DockerContainer>> ps(boolean all, String namePrefix) {
        return async("list", namePrefix, () -> {
            var containers = new ArrayList<DockerContainer>();
            for (var container : docker.listContainersCmd()
                    .withShowAll(all)
                    .withNameFilter(List.of(namePrefix))
                    .exec()) {
                // The name filter matches substrings, so check the prefix ourselves.
                Arrays.stream(container.getNames())
                        .map(DockerJavaRuntime::stripSlash)
                        .filter(name -> name.startsWith(namePrefix))
                        .findFirst()
                        .ifPresent(name -> containers.add(new DockerContainer(
                                container.getId(),
                                name,
                                null,
                                "running".equalsIgnoreCase(container.getState()),
                                null,
                                false,
                                null)));
            }
            return containers;
        });
    }

    @Override
    public CompletableFuture<Void> logs(String name, Path directory) {
        return async("capture logs of", name, () -> {
            try (var stdout = Files.newOutputStream(directory.resolve("stdout"),
                         StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 var stderr = Files.newOutputStream(directory.resolve("stderr"),
                         StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                docker.logContainerCmd(name)
                        .withStdOut(true)
                        .withStdErr(true)
                        .withFollowStream(false)
                        .exec(new ResultCallback.Adapter<Frame>() {
                            @Override
                            public void onNext(Frame frame) {
                                write(frame.getStreamType() == StreamType.STDERR ? stderr : stdout,
                                        frame.getPayload());
                            }
                        })
                        .awaitCompletion();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Integer> await(String name) {
        return async("wait for", name, () -> docker.waitContainerCmd(name)
                .exec(new WaitContainerResultCallback())
                .awaitStatusCode());
    }

    @Override
    public void close() throws IOException {
        executor.shutdownNow();
        docker.close();
    }

    private boolean imageExists(String image) {
        try {
            docker.inspectImageCmd(image).exec();
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    private <T> CompletableFuture<T> async(String operation, String name, Callable<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (NotFoundException e) {
                throw DockerRuntimeException.notFound(name, e);
            } catch (DockerRuntimeException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DockerRuntimeException("Interrupted while trying to " + operation + " " + name, e);
            } catch (Exception e) {
                throw new DockerRuntimeException("Failed to " + operation + " " + name + ": " + e.getMessage(), e);
            }
        }, executor);
    }

    static List<String> commandLine(CommandSpec command) {
        if (command.shell()) {
            var value = command.optionalValue()
                    .orElseThrow(() -> new DockerRuntimeException("Shell command requires a value"));
            return List.of("sh", "-c", value);
        }
        var line = new ArrayList<String>();
        command.optionalValue().ifPresent(line::add);
        line.addAll(command.arguments());
        return line;
    }

    static List<String> environment(RunRequest request) {
        var variables = new LinkedHashMap<>(request.command().environment());
        variables.putAll(request.environment());
        return variables.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .toList();
    }

    static HostConfig hostConfig(RunRequest request) {
        var spec = request.container();
        var binds = new ArrayList<Bind>();
        // Structured binds keep host paths containing ':' intact.
        binds.add(new Bind(request.directory().toString(), new Volume(request.sandboxMount()), AccessMode.rw));
        for (var volume : spec.volumes()) {
            binds.add(new Bind(volume.hostPath(), new Volume(volume.containerPath()),
                    volume.readOnly() ? AccessMode.ro : AccessMode.rw));
        }

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds)
                .withNetworkMode(spec.network().dockerName());

        if (!spec.portMappings().isEmpty()) {
            var ports = new Ports();
            for (var mapping : spec.portMappings()) {
                ports.bind(exposedPort(mapping), Ports.Binding.bindPort(mapping.hostPort()));
            }
            hostConfig.withPortBindings(ports);
        }

        var resources = request.resources();
        if (resources.hasMem()) {
            hostConfig.withMemory(CgroupLimits.memoryLimit(resources.memBytes()));
        }
        if (resources.hasCpus()) {
            hostConfig.withCpuShares((int) CgroupLimits.cpuShares(resources.cpus()));
        }
        return hostConfig;
    }

    private static ExposedPort exposedPort(PortMapping mapping) {
        return mapping.protocol().equals("udp")
                ? ExposedPort.udp(mapping.containerPort())
                : ExposedPort.tcp(mapping.containerPort());
    }

    private static void write(OutputStream out, byte[] payload) {
        try {
            out.write(payload);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String stripSlash(String name) {
        return name != null && name.startsWith("/") ? name.substring(1) : name;
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "docker-runtime-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    record ImageReference(String repository, String tag) {

        static ImageReference parse(String image) {
            if (image.contains("@")) {
                return new ImageReference(image, null);
            }
            int slash = image.lastIndexOf('/');
            int colon = image.lastIndexOf(':');
            if (colon > slash) {
                return new ImageReference(image.substring(0, colon), image.substring(colon + 1));
            }
            return new ImageReference(image, DEFAULT_TAG);
        }
    }
}
