package dev.containerizer.agent;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.ExecutorSpec;
import dev.containerizer.agent.model.FetchUri;
import dev.containerizer.agent.model.NetworkMode;
import dev.containerizer.agent.model.PortMapping;
import dev.containerizer.agent.model.PortRange;
import dev.containerizer.agent.model.ResourceStatistics;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.TaskSpec;
import dev.containerizer.agent.model.Termination;
import dev.containerizer.agent.model.VolumeMount;
import dev.containerizer.common.CommandInfo;
import dev.containerizer.common.DockerInfo;
import dev.containerizer.common.ExecutorInfo;
import dev.containerizer.common.ResourceUsage;
import dev.containerizer.common.TaskInfo;
import dev.containerizer.common.TerminationInfo;

/**
 * Conversions between the wire messages and the containerizer's model.
 */
final class ProtoConverters {

    private ProtoConverters() {
    }

    static TaskSpec toTask(TaskInfo task) {
        return new TaskSpec(
                task.getTaskId(),
                task.getName(),
                task.hasCommand() ? toCommand(task.getCommand()) : null,
                task.hasContainer() ? toContainer(task.getContainer()) : null,
                toResources(task.getResources()));
    }

    static ExecutorSpec toExecutor(ExecutorInfo executor) {
        return new ExecutorSpec(
                executor.getFrameworkId(),
                executor.getExecutorId(),
                executor.hasCommand() ? toCommand(executor.getCommand()) : null,
                executor.hasContainer() ? toContainer(executor.getContainer()) : null,
                toResources(executor.getResources()));
    }

    static CommandSpec toCommand(CommandInfo command) {
        return new CommandSpec(
                command.getShell(),
                command.getValue(),
                command.getArgumentsList(),
                command.getEnvironmentMap(),
                command.getUrisList().stream()
                        .map(uri -> new FetchUri(uri.getValue(), uri.getExecutable()))
                        .toList());
    }

    static ContainerSpec toContainer(DockerInfo docker) {
        var network = switch (docker.getNetwork()) {
            case HOST -> NetworkMode.HOST;
            case BRIDGE -> NetworkMode.BRIDGE;
            case NONE -> NetworkMode.NONE;
            default -> throw new IllegalArgumentException("Unknown network mode: " + docker.getNetworkValue());
        };
        return new ContainerSpec(
                docker.getImage(),
                network,
                docker.getPortMappingsList().stream()
                        .map(mapping -> new PortMapping(
                                mapping.getHostPort(), mapping.getContainerPort(), mapping.getProtocol()))
                        .toList(),
                docker.getVolumesList().stream()
                        .map(volume -> new VolumeMount(
                                volume.getHostPath(), volume.getContainerPath(), volume.getReadOnly()))
                        .toList(),
                docker.getForcePullImage());
    }

    static Resources toResources(dev.containerizer.common.Resources resources) {
        return new Resources(
                resources.getCpus(),
                resources.getMemMb(),
                resources.getPortsList().stream()
                        .map(range -> new PortRange(range.getBegin(), range.getEnd()))
                        .toList());
    }

    static TerminationInfo toProto(ContainerId containerId, Termination termination) {
        var builder = TerminationInfo.newBuilder()
                .setContainerId(containerId.value())
                .setReason(switch (termination.reason()) {
                    case EXITED -> TerminationInfo.Reason.EXITED;
                    case KILLED -> TerminationInfo.Reason.KILLED;
                    case OOM -> TerminationInfo.Reason.OOM;
                    case DESTROYED -> TerminationInfo.Reason.DESTROYED;
                })
                .setKilled(termination.killed())
                .setMessage(termination.message() != null ? termination.message() : "");
        termination.optionalStatus().ifPresent(builder::setStatus);
        return builder.build();
    }

    static ResourceUsage toProto(ContainerId containerId, ResourceStatistics statistics) {
        return ResourceUsage.newBuilder()
                .setContainerId(containerId.value())
                .setTimestamp(statistics.timestamp())
                .setCpusUserTimeSecs(statistics.cpusUserTimeSecs())
                .setCpusSystemTimeSecs(statistics.cpusSystemTimeSecs())
                .setCpusLimit(statistics.cpusLimit())
                .setMemRssBytes(statistics.memRssBytes())
                .setMemLimitBytes(statistics.memLimitBytes())
                .build();
    }
}
