package dev.containerizer.agent.docker;

import static org.junit.jupiter.api.Assertions.*;

import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.ExposedPort;
import dev.containerizer.agent.cgroups.CgroupLimits;
import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.NetworkMode;
import dev.containerizer.agent.model.PortMapping;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.VolumeMount;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DockerJavaRuntimeTest {

    private static RunRequest request(ContainerSpec container, CommandSpec command, Resources resources) {
        return new RunRequest("mesos-c1", container, command, Path.of("/var/sandboxes/c1"), "/mnt/mesos/sandbox",
                resources, Map.of("MESOS_SANDBOX", "/mnt/mesos/sandbox"));
    }

    @Test
    void wrapsShellCommand() {
        assertEquals(List.of("sh", "-c", "echo hi && sleep 1"),
                DockerJavaRuntime.commandLine(CommandSpec.shell("echo hi && sleep 1")));
    }

    @Test
    void passesExecCommandAsIs() {
        assertEquals(List.of("/bin/server", "--port", "80"),
                DockerJavaRuntime.commandLine(CommandSpec.exec("/bin/server", List.of("--port", "80"))));
    }

    @Test
    void leavesImageDefaultEmpty() {
        assertTrue(DockerJavaRuntime.commandLine(CommandSpec.imageDefault()).isEmpty());
    }

    @Test
    void rejectsEmptyShellCommand() {
        assertThrows(DockerRuntimeException.class,
                () -> DockerJavaRuntime.commandLine(new CommandSpec(true, "", List.of(), Map.of(), List.of())));
    }

    @Test
    void agentVariablesOverrideCommandEnvironment() {
        var command = CommandSpec.shell("env").withEnvironment(Map.of("MESOS_SANDBOX", "/elsewhere", "FOO", "bar"));

        var environment = DockerJavaRuntime.environment(
                request(ContainerSpec.image("busybox"), command, Resources.EMPTY));

        assertTrue(environment.contains("FOO=bar"));
        assertTrue(environment.contains("MESOS_SANDBOX=/mnt/mesos/sandbox"));
        assertFalse(environment.contains("MESOS_SANDBOX=/elsewhere"));
    }

    @Test
    void mountsSandboxAndVolumes() {
        var container = new ContainerSpec("busybox", NetworkMode.HOST, List.of(),
                List.of(new VolumeMount("/etc/config", "/config", true)), false);

        var hostConfig = DockerJavaRuntime.hostConfig(request(container, CommandSpec.imageDefault(), Resources.EMPTY));

        var binds = hostConfig.getBinds();
        assertEquals(2, binds.length);
        assertEquals("/var/sandboxes/c1", binds[0].getPath());
        assertEquals("/mnt/mesos/sandbox", binds[0].getVolume().getPath());
        assertEquals(AccessMode.rw, binds[0].getAccessMode());
        assertEquals("/config", binds[1].getVolume().getPath());
        assertEquals(AccessMode.ro, binds[1].getAccessMode());
        assertEquals("host", hostConfig.getNetworkMode());
    }

    @Test
    void bindsBridgedPorts() {
        var container = ContainerSpec.image("nginx")
                .withBridgedPorts(List.of(PortMapping.tcp(31000, 80), new PortMapping(31001, 53, "udp")));

        var hostConfig = DockerJavaRuntime.hostConfig(
                request(container, CommandSpec.imageDefault(), Resources.parse("ports:[31000-31001]")));

        assertEquals("bridge", hostConfig.getNetworkMode());
        var bindings = hostConfig.getPortBindings().getBindings();
        assertEquals("31000", bindings.get(ExposedPort.tcp(80))[0].getHostPortSpec());
        assertEquals("31001", bindings.get(ExposedPort.udp(53))[0].getHostPortSpec());
    }

    @Test
    void appliesResourceLimits() {
        var hostConfig = DockerJavaRuntime.hostConfig(
                request(ContainerSpec.image("busybox"), CommandSpec.imageDefault(), Resources.parse("cpus:0.5;mem:64")));

        assertEquals(64L * 1024 * 1024, hostConfig.getMemory());
        assertEquals(512, hostConfig.getCpuShares());
    }

    @Test
    void raisesTinyLimitsToMinimums() {
        var hostConfig = DockerJavaRuntime.hostConfig(
                request(ContainerSpec.image("busybox"), CommandSpec.imageDefault(), Resources.parse("cpus:0.001;mem:4")));

        assertEquals(CgroupLimits.MIN_MEMORY_BYTES, hostConfig.getMemory());
        assertEquals(10, hostConfig.getCpuShares());
    }

    @Test
    void omitsUnspecifiedLimits() {
        var hostConfig = DockerJavaRuntime.hostConfig(
                request(ContainerSpec.image("busybox"), CommandSpec.imageDefault(), Resources.EMPTY));

        assertNull(hostConfig.getMemory());
        assertNull(hostConfig.getCpuShares());
    }

    @Test
    void parsesImageReferences() {
        assertEquals(new DockerJavaRuntime.ImageReference("busybox", "latest"),
                DockerJavaRuntime.ImageReference.parse("busybox"));
        assertEquals(new DockerJavaRuntime.ImageReference("library/redis", "7"),
                DockerJavaRuntime.ImageReference.parse("library/redis:7"));
        assertEquals(new DockerJavaRuntime.ImageReference("registry:5000/app", "latest"),
                DockerJavaRuntime.ImageReference.parse("registry:5000/app"));
        assertEquals(new DockerJavaRuntime.ImageReference("alpine@sha256:abc", null),
                DockerJavaRuntime.ImageReference.parse("alpine@sha256:abc"));
    }
}
