package dev.containerizer.agent;

import dev.containerizer.agent.cgroups.LinuxCgroups;
import dev.containerizer.agent.checkpoint.CheckpointStore;
import dev.containerizer.agent.checkpoint.DynamoDbCheckpointStore;
import dev.containerizer.agent.checkpoint.FileCheckpointStore;
import dev.containerizer.agent.containerizer.ContainerizerConfig;
import dev.containerizer.agent.containerizer.DockerContainerizer;
import dev.containerizer.agent.containerizer.Futures;
import dev.containerizer.agent.containerizer.OrphanPolicy;
import dev.containerizer.agent.docker.DockerJavaRuntime;
import dev.containerizer.agent.fetcher.UriFetcher;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.protobuf.services.ProtoReflectionServiceV1;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Command(name = "containerizer-agent", mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final String API_KEY_ENV = "API_KEY";

    enum CheckpointBackend { FILE, DYNAMODB }

    @Option(names = "--port", defaultValue = "9090", description = "gRPC port (default: ${DEFAULT-VALUE})")
    private int port;

    @Option(names = "--docker-host", description = "Docker daemon address, e.g. unix:///var/run/docker.sock")
    private String dockerHost;

    @Option(names = "--agent-id", required = true, description = "Id of the agent this containerizer serves")
    private String agentId;

    @Option(names = "--work-dir", defaultValue = "/var/lib/containerizer",
            description = "Agent work directory holding checkpoints (default: ${DEFAULT-VALUE})")
    private Path workDir;

    @Option(names = "--checkpoint-backend", defaultValue = "FILE",
            description = "Where run records are checkpointed: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private CheckpointBackend checkpointBackend;

    @Option(names = "--checkpoint-table", defaultValue = DynamoDbCheckpointStore.DEFAULT_TABLE_NAME,
            description = "DynamoDB table for the DYNAMODB backend (default: ${DEFAULT-VALUE})")
    private String checkpointTable;

    @Option(names = "--name-prefix", defaultValue = ContainerizerConfig.DEFAULT_NAME_PREFIX,
            description = "Prefix of the Docker container names this agent owns (default: ${DEFAULT-VALUE})")
    private String namePrefix;

    @Option(names = "--sandbox-directory", defaultValue = ContainerizerConfig.DEFAULT_SANDBOX_DIRECTORY,
            description = "Sandbox mount point inside containers (default: ${DEFAULT-VALUE})")
    private String sandboxDirectory;

    @Option(names = "--stop-timeout", defaultValue = "10",
            description = "Seconds a container gets to stop before it is killed (default: ${DEFAULT-VALUE})")
    private long stopTimeoutSeconds;

    @Option(names = "--keep-containers", description = "Keep exited containers instead of removing them")
    private boolean keepContainers;

    @Option(names = "--orphan-policy", defaultValue = "LEAVE",
            description = "Recovery action for unknown containers: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OrphanPolicy orphanPolicy;

    @Option(names = "--default-executor-image", defaultValue = ContainerizerConfig.DEFAULT_EXECUTOR_IMAGE,
            description = "Image for executors that name none (default: ${DEFAULT-VALUE})")
    private String defaultExecutorImage;

    @Option(names = "--proc-root", defaultValue = "/proc", description = "procfs mount (default: ${DEFAULT-VALUE})")
    private Path procRoot;

    @Option(names = "--usage-interval", defaultValue = "0",
            description = "Seconds between usage samples, 0 disables polling (default: ${DEFAULT-VALUE})")
    private long usageIntervalSeconds;

    @Override
    public Integer call() throws IOException, InterruptedException {
        var config = ContainerizerConfig.builder()
                .namePrefix(namePrefix)
                .sandboxDirectory(sandboxDirectory)
                .stopTimeout(Duration.ofSeconds(stopTimeoutSeconds))
                .keepContainers(keepContainers)
                .orphanPolicy(orphanPolicy)
                .defaultExecutorImage(defaultExecutorImage)
                .build();
        logger.info("Containerizer agent {} starting with {} checkpoints", agentId, checkpointBackend);

        var store = checkpointStore();
        var runtime = DockerJavaRuntime.connect(dockerHost);
        var fetchPool = Executors.newCachedThreadPool();
        var containerizer = new DockerContainerizer(
                config, runtime, new LinuxCgroups(procRoot), new UriFetcher(fetchPool), store);
        containerizer.addListener(new LoggingSubscriber());

        try {
            containerizer.recover(store.load(agentId)).join();
        } catch (RuntimeException e) {
            logger.error("Recovery failed, refusing to serve launches", Futures.unwrap(e));
            containerizer.close();
            fetchPool.shutdownNow();
            runtime.close();
            return 1;
        }

        var poller = new UsagePoller(containerizer, Duration.ofSeconds(usageIntervalSeconds));
        poller.start();

        ServerServiceDefinition service = new ContainerizerServiceImpl(containerizer).bindService();
        var apiKey = System.getenv(API_KEY_ENV);
        if (apiKey != null && !apiKey.isBlank()) {
            service = ServerInterceptors.intercept(service, new AuthInterceptor(apiKey));
            logger.info("Authorization enabled ({} is set)", API_KEY_ENV);
        } else {
            logger.info("Authorization disabled ({} is not set)", API_KEY_ENV);
        }

        Server server = ServerBuilder.forPort(port)
                .addService(service)
                .addService(ProtoReflectionServiceV1.newInstance())
                .build()
                .start();
        logger.info("Containerizer listening on port {}", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down containerizer agent");
            server.shutdown();
            poller.close();
            containerizer.close();
            fetchPool.shutdownNow();
            try {
                runtime.close();
            } catch (IOException e) {
                logger.warn("Failed to close Docker client", e);
            }
        }));

        server.awaitTermination();
        return 0;
    }

    private CheckpointStore checkpointStore() {
        return switch (checkpointBackend) {
            case FILE -> new FileCheckpointStore(workDir.resolve("meta").resolve("containers"));
            case DYNAMODB -> new DynamoDbCheckpointStore(DynamoDbClient.create(), checkpointTable);
        };
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
