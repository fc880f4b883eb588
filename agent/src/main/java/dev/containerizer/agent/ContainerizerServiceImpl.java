package dev.containerizer.agent;

import dev.containerizer.agent.cgroups.CgroupException;
import dev.containerizer.agent.containerizer.Containerizer;
import dev.containerizer.agent.containerizer.ContainerNotFoundException;
import dev.containerizer.agent.containerizer.DestroyedDuringLaunchException;
import dev.containerizer.agent.containerizer.DuplicateContainerException;
import dev.containerizer.agent.containerizer.Futures;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.common.ContainerIdRequest;
import dev.containerizer.common.ContainerizerServiceGrpc;
import dev.containerizer.common.DestroyResponse;
import dev.containerizer.common.LaunchRequest;
import dev.containerizer.common.LaunchResponse;
import dev.containerizer.common.ListContainersRequest;
import dev.containerizer.common.ListContainersResponse;
import dev.containerizer.common.ResourceUsage;
import dev.containerizer.common.TerminationInfo;
import dev.containerizer.common.UpdateRequest;
import dev.containerizer.common.UpdateResponse;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.StreamObserver;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ContainerizerServiceImpl extends ContainerizerServiceGrpc.ContainerizerServiceImplBase {

    private static final Logger logger = LoggerFactory.getLogger(ContainerizerServiceImpl.class);

    private final Containerizer containerizer;

    public ContainerizerServiceImpl(Containerizer containerizer) {
        this.containerizer = containerizer;
    }

    @Override
    public void launch(LaunchRequest request, StreamObserver<LaunchResponse> responseObserver) {
        reply("launch", responseObserver, () -> {
            var containerId = ContainerId.of(request.getContainerId());
            var executor = ProtoConverters.toExecutor(request.getExecutor());
            var directory = Path.of(request.getDirectory());
            var user = request.getUser().isEmpty() ? Optional.<String>empty() : Optional.of(request.getUser());
            if (request.hasTask()) {
                return containerizer.launch(containerId, ProtoConverters.toTask(request.getTask()), executor,
                        directory, user, request.getAgentId(), request.getAgentAddress(), request.getCheckpoint());
            }
            return containerizer.launch(containerId, executor, directory, user, request.getAgentId(),
                    request.getAgentAddress(), request.getCheckpoint());
        }, launched -> LaunchResponse.newBuilder().setLaunched(launched).build());
    }

    @Override
    public void await(ContainerIdRequest request, StreamObserver<TerminationInfo> responseObserver) {
        reply("wait for", responseObserver, () -> containerizer.wait(containerId(request)),
                termination -> ProtoConverters.toProto(containerId(request), termination));
    }

    @Override
    public void destroy(ContainerIdRequest request, StreamObserver<DestroyResponse> responseObserver) {
        reply("destroy", responseObserver, () -> containerizer.destroy(containerId(request)),
                ignored -> DestroyResponse.getDefaultInstance());
    }

    @Override
    public void update(UpdateRequest request, StreamObserver<UpdateResponse> responseObserver) {
        reply("update", responseObserver,
                () -> containerizer.update(ContainerId.of(request.getContainerId()),
                        ProtoConverters.toResources(request.getResources())),
                ignored -> UpdateResponse.getDefaultInstance());
    }

    @Override
    public void usage(ContainerIdRequest request, StreamObserver<ResourceUsage> responseObserver) {
        reply("read usage of", responseObserver, () -> containerizer.usage(containerId(request)),
                statistics -> ProtoConverters.toProto(containerId(request), statistics));
    }

    @Override
    public void listContainers(ListContainersRequest request,
                               StreamObserver<ListContainersResponse> responseObserver) {
        reply("list", responseObserver, containerizer::containers,
                ids -> ListContainersResponse.newBuilder()
                        .addAllContainerIds(ids.stream().map(ContainerId::value).toList())
                        .build());
    }

    private static ContainerId containerId(ContainerIdRequest request) {
        return ContainerId.of(request.getContainerId());
    }

    private <T, R> void reply(
            String operation,
            StreamObserver<R> responseObserver,
            Supplier<CompletableFuture<T>> call,
            Function<T, R> response) {
        CompletableFuture<T> pending;
        try {
            pending = call.get();
        } catch (RuntimeException e) {
            responseObserver.onError(toStatus(operation, e));
            return;
        }
        pending.whenComplete((result, error) -> {
            if (error != null) {
                responseObserver.onError(toStatus(operation, Futures.unwrap(error)));
                return;
            }
            responseObserver.onNext(response.apply(result));
            responseObserver.onCompleted();
        });
    }

    static StatusException toStatus(String operation, Throwable error) {
        Status status;
        if (error instanceof ContainerNotFoundException) {
            status = Status.NOT_FOUND;
        } else if (error instanceof DuplicateContainerException) {
            status = Status.ALREADY_EXISTS;
        } else if (error instanceof DestroyedDuringLaunchException) {
            status = Status.ABORTED;
        } else if (error instanceof CgroupException) {
            status = Status.FAILED_PRECONDITION;
        } else if (error instanceof IllegalArgumentException || error instanceof NullPointerException) {
            status = Status.INVALID_ARGUMENT;
        } else {
            logger.warn("Failed to {} container", operation, error);
            status = Status.INTERNAL;
        }
        return status.withDescription("Failed to " + operation + " container: " + error.getMessage())
                .withCause(error)
                .asException();
    }
}
