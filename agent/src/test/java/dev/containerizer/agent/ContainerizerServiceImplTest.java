package dev.containerizer.agent;

import static org.junit.jupiter.api.Assertions.*;

import dev.containerizer.agent.cgroups.CgroupException;
import dev.containerizer.agent.cgroups.CgroupFixture;
import dev.containerizer.agent.checkpoint.AgentState;
import dev.containerizer.agent.checkpoint.FileCheckpointStore;
import dev.containerizer.agent.containerizer.ContainerNotFoundException;
import dev.containerizer.agent.containerizer.ContainerizerConfig;
import dev.containerizer.agent.containerizer.DockerContainerizer;
import dev.containerizer.agent.docker.FakeDockerRuntime;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.common.CommandInfo;
import dev.containerizer.common.ContainerIdRequest;
import dev.containerizer.common.ContainerizerServiceGrpc;
import dev.containerizer.common.DockerInfo;
import dev.containerizer.common.ExecutorInfo;
import dev.containerizer.common.LaunchRequest;
import dev.containerizer.common.ListContainersRequest;
import dev.containerizer.common.Resources;
import dev.containerizer.common.TaskInfo;
import dev.containerizer.common.TerminationInfo;
import dev.containerizer.common.UpdateRequest;
import io.grpc.ClientInterceptor;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.MetadataUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContainerizerServiceImplTest {

    @TempDir
    Path temp;

    private FakeDockerRuntime docker;
    private CgroupFixture cgroups;
    private DockerContainerizer containerizer;
    private Server server;
    private ManagedChannel channel;
    private ContainerizerServiceGrpc.ContainerizerServiceBlockingStub stub;
    private Path sandbox;

    @BeforeEach
    void setUp() throws Exception {
        docker = new FakeDockerRuntime();
        cgroups = new CgroupFixture(temp.resolve("host"));
        sandbox = Files.createDirectories(temp.resolve("sandbox"));
        containerizer = new DockerContainerizer(ContainerizerConfig.defaults(), docker, cgroups.cgroups(),
                (id, command, directory, user) -> CompletableFuture.completedFuture(null),
                new FileCheckpointStore(temp.resolve("meta")));
        containerizer.recover(AgentState.empty("agent-1")).get(5, TimeUnit.SECONDS);

        var name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.intercept(
                        new ContainerizerServiceImpl(containerizer), new AuthInterceptor("agent-secret")))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = ContainerizerServiceGrpc.newBlockingStub(channel)
                .withInterceptors(bearer("agent-secret"))
                .withDeadlineAfter(5, TimeUnit.SECONDS);
    }

    private static ClientInterceptor bearer(String token) {
        var headers = new Metadata();
        headers.put(AuthInterceptor.AUTHORIZATION_KEY, "Bearer " + token);
        return MetadataUtils.newAttachHeadersInterceptor(headers);
    }

    @AfterEach
    void tearDown() throws Exception {
        channel.shutdownNow();
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        containerizer.close();
    }

    private LaunchRequest launchRequest(String containerId, TaskInfo task) {
        return LaunchRequest.newBuilder()
                .setContainerId(containerId)
                .setExecutor(ExecutorInfo.newBuilder()
                        .setFrameworkId("framework-1")
                        .setExecutorId("executor-1")
                        .setCommand(CommandInfo.newBuilder().setShell(true).setValue("exec ./executor")))
                .setTask(task)
                .setDirectory(sandbox.toString())
                .setAgentId("agent-1")
                .setAgentAddress("agent@10.0.0.1:5051")
                .build();
    }

    private static TaskInfo task(String image) {
        return TaskInfo.newBuilder()
                .setTaskId("task-1")
                .setName("sleeper")
                .setCommand(CommandInfo.newBuilder().setShell(true).setValue("sleep 1000"))
                .setContainer(DockerInfo.newBuilder().setImage(image))
                .setResources(Resources.newBuilder().setCpus(1).setMemMb(128))
                .build();
    }

    private static ContainerIdRequest id(String containerId) {
        return ContainerIdRequest.newBuilder().setContainerId(containerId).build();
    }

    @Test
    void launchesAndReportsTermination() throws Exception {
        assertTrue(stub.launch(launchRequest("c1", task("busybox"))).getLaunched());
        var termination = ContainerizerServiceGrpc.newFutureStub(channel)
                .withInterceptors(bearer("agent-secret"))
                .await(id("c1"));

        docker.exit("mesos-c1", 3);

        var info = termination.get(5, TimeUnit.SECONDS);
        assertEquals("c1", info.getContainerId());
        assertEquals(TerminationInfo.Reason.EXITED, info.getReason());
        assertTrue(info.hasStatus());
        assertEquals(3, info.getStatus());
        assertFalse(info.getKilled());
    }

    @Test
    void reportsTaskWithoutContainerAsNotLaunched() {
        var task = task("busybox").toBuilder().clearContainer().build();

        assertFalse(stub.launch(launchRequest("c1", task)).getLaunched());
        assertEquals(0, stub.listContainers(ListContainersRequest.getDefaultInstance()).getContainerIdsCount());
    }

    @Test
    void destroyRemovesContainer() throws Exception {
        stub.launch(launchRequest("c1", task("busybox")));
        assertEquals(List.of("c1"), stub.listContainers(ListContainersRequest.getDefaultInstance()).getContainerIdsList());
        var termination = ContainerizerServiceGrpc.newFutureStub(channel)
                .withInterceptors(bearer("agent-secret"))
                .await(id("c1"));

        stub.destroy(id("c1"));

        assertEquals(TerminationInfo.Reason.DESTROYED, termination.get(5, TimeUnit.SECONDS).getReason());
        assertFalse(docker.contains("mesos-c1"));
        assertEquals(0, stub.listContainers(ListContainersRequest.getDefaultInstance()).getContainerIdsCount());
    }

    @Test
    void updatesAndReportsUsage() throws Exception {
        stub.launch(launchRequest("c1", task("busybox")));
        cgroups.addProcess(docker.pid("mesos-c1"), "/docker/c1");

        stub.update(UpdateRequest.newBuilder()
                .setContainerId("c1")
                .setResources(Resources.newBuilder().setCpus(2).setMemMb(256))
                .build());
        var usage = stub.usage(id("c1"));

        assertEquals(2048, cgroups.cpuShares("/docker/c1"));
        assertEquals("c1", usage.getContainerId());
        assertEquals(2.0, usage.getCpusLimit());
        assertEquals(256L * 1024 * 1024, usage.getMemLimitBytes());
        assertEquals(8192, usage.getMemRssBytes());
    }

    @Test
    void unknownContainerIsNotFound() {
        var error = assertThrows(StatusRuntimeException.class, () -> stub.await(id("nope")));

        assertEquals(Status.Code.NOT_FOUND, error.getStatus().getCode());
    }

    @Test
    void duplicateLaunchIsAlreadyExists() {
        stub.launch(launchRequest("c1", task("busybox")));

        var error = assertThrows(StatusRuntimeException.class,
                () -> stub.launch(launchRequest("c1", task("busybox"))));

        assertEquals(Status.Code.ALREADY_EXISTS, error.getStatus().getCode());
    }

    @Test
    void blankIdIsInvalidArgument() {
        var error = assertThrows(StatusRuntimeException.class, () -> stub.destroy(id(" ")));

        assertEquals(Status.Code.INVALID_ARGUMENT, error.getStatus().getCode());
    }

    @Test
    void rejectsCallsWithoutToken() {
        var anonymous = ContainerizerServiceGrpc.newBlockingStub(channel);

        var error = assertThrows(StatusRuntimeException.class,
                () -> anonymous.listContainers(ListContainersRequest.getDefaultInstance()));

        assertEquals(Status.Code.UNAUTHENTICATED, error.getStatus().getCode());
    }

    @Test
    void mapsFailuresToStatusCodes() {
        assertEquals(Status.Code.NOT_FOUND, ContainerizerServiceImpl.toStatus("wait for",
                new ContainerNotFoundException(ContainerId.of("c1"))).getStatus().getCode());
        assertEquals(Status.Code.FAILED_PRECONDITION, ContainerizerServiceImpl.toStatus("update",
                new CgroupException("memory hierarchy is not mounted")).getStatus().getCode());
        assertEquals(Status.Code.INTERNAL, ContainerizerServiceImpl.toStatus("launch",
                new IllegalStateException("boom")).getStatus().getCode());
    }
}
