package dev.containerizer.agent.docker;

import static org.junit.jupiter.api.Assertions.*;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.Resources;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs against a real Docker daemon. Enabled with {@code DOCKER_TESTS=true}.
 */
@EnabledIfEnvironmentVariable(named = "DOCKER_TESTS", matches = "true")
class DockerJavaRuntimeIntegrationTest {

    private static final String IMAGE = "alpine:latest";

    static DockerJavaRuntime runtime;

    @TempDir
    Path sandbox;

    @BeforeAll
    static void setup() throws Exception {
        runtime = DockerJavaRuntime.connect(null);
        runtime.pull(Path.of("."), IMAGE, false).get(2, TimeUnit.MINUTES);
    }

    @AfterAll
    static void teardown() throws Exception {
        runtime.close();
    }

    private static String name() {
        return "containerizer-it-" + UUID.randomUUID();
    }

    private RunRequest request(String name, String command) {
        return new RunRequest(name, ContainerSpec.image(IMAGE), CommandSpec.shell(command), sandbox,
                "/mnt/mesos/sandbox", Resources.EMPTY, Map.of("GREETING", "hello"));
    }

    @Test
    void runsContainerAndReportsExitStatus() throws Exception {
        var name = name();
        runtime.run(request(name, "exit 42")).get(30, TimeUnit.SECONDS);

        assertEquals(42, runtime.await(name).get(30, TimeUnit.SECONDS));

        var container = runtime.inspect(name).get(30, TimeUnit.SECONDS);
        assertFalse(container.isRunning());
        assertEquals(42, container.exitCode());
        runtime.rm(name, false).get(30, TimeUnit.SECONDS);
    }

    @Test
    void capturesLogsIntoSandbox() throws Exception {
        var name = name();
        runtime.run(request(name, "echo $GREETING; echo oops >&2")).get(30, TimeUnit.SECONDS);
        runtime.await(name).get(30, TimeUnit.SECONDS);

        runtime.logs(name, sandbox).get(30, TimeUnit.SECONDS);

        assertEquals("hello\n", Files.readString(sandbox.resolve("stdout")));
        assertEquals("oops\n", Files.readString(sandbox.resolve("stderr")));
        runtime.rm(name, false).get(30, TimeUnit.SECONDS);
    }

    @Test
    void stopsAndRemovesRunningContainer() throws Exception {
        var name = name();
        runtime.run(request(name, "sleep 300")).get(30, TimeUnit.SECONDS);
        assertTrue(runtime.inspect(name).get(30, TimeUnit.SECONDS).isRunning());

        runtime.stop(name, Duration.ofSeconds(1), true).get(30, TimeUnit.SECONDS);

        assertTrue(runtime.ps(true, name).get(30, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void inspectOfUnknownContainerIsNotFound() {
        var error = assertThrows(Exception.class, () -> runtime.inspect(name()).get(30, TimeUnit.SECONDS));

        assertInstanceOf(DockerRuntimeException.class, error.getCause());
        assertTrue(((DockerRuntimeException) error.getCause()).isNotFound());
    }
}
