package dev.containerizer.agent.model;

import java.util.List;

public record ContainerSpec(
    String image,
    NetworkMode network,
    List<PortMapping> portMappings,
    List<VolumeMount> volumes,
    boolean forcePullImage
) {

    public ContainerSpec {
        network = network == null ? NetworkMode.HOST : network;
        portMappings = portMappings == null ? List.of() : List.copyOf(portMappings);
        volumes = volumes == null ? List.of() : List.copyOf(volumes);
    }

    public static ContainerSpec image(String image) {
        return new ContainerSpec(image, NetworkMode.HOST, List.of(), List.of(), false);
    }

    public boolean hasImage() {
        return image != null && !image.isBlank();
    }

    public ContainerSpec withImage(String image) {
        return new ContainerSpec(image, network, portMappings, volumes, forcePullImage);
    }

    public ContainerSpec withForcePullImage(boolean forcePullImage) {
        return new ContainerSpec(image, network, portMappings, volumes, forcePullImage);
    }

    public ContainerSpec withBridgedPorts(List<PortMapping> portMappings) {
        return new ContainerSpec(image, NetworkMode.BRIDGE, portMappings, volumes, forcePullImage);
    }
}
