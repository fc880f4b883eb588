package dev.containerizer.agent.docker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory {@link DockerRuntime}. Containers "run" until a test calls {@link #exit} or the containerizer stops
 * them. Pull and run calls can be held open to race destroys against them.
 */
public class FakeDockerRuntime implements DockerRuntime {

    public static final int KILLED_STATUS = 137;

    private final Map<String, FakeContainer> containers = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final List<RunRequest> runs = new ArrayList<>();
    private int nextPid = 1000;
    private boolean reportPidOnRun = true;
    private Gate pullGate;
    private Gate runGate;
    private RuntimeException stopFailure;
    private RuntimeException psFailure;
    private RuntimeException inspectFailure;

    /**
     * A call that stays pending until released.
     */
    public static final class Gate {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CompletableFuture<Void> released = new CompletableFuture<>();

        public CompletableFuture<Void> enter() {
            entered.countDown();
            return released;
        }

        public boolean awaitEntered() throws InterruptedException {
            return entered.await(5, TimeUnit.SECONDS);
        }

        public void release() {
            released.complete(null);
        }

        public void fail(RuntimeException error) {
            released.completeExceptionally(error);
        }
    }

    private static final class FakeContainer {
        final String id;
        final String name;
        final int pid;
        final CompletableFuture<Integer> exit = new CompletableFuture<>();
        boolean running = true;
        Integer exitCode;
        boolean oomKilled;

        FakeContainer(String id, String name, int pid) {
            this.id = id;
            this.name = name;
            this.pid = pid;
        }
    }

    public synchronized Gate holdNextPull() {
        pullGate = new Gate();
        return pullGate;
    }

    public synchronized Gate holdNextRun() {
        runGate = new Gate();
        return runGate;
    }

    public synchronized void reportPidOnRun(boolean reportPidOnRun) {
        this.reportPidOnRun = reportPidOnRun;
    }

    public synchronized void failNextStop(RuntimeException error) {
        this.stopFailure = error;
    }

    public synchronized void failNextPs(RuntimeException error) {
        this.psFailure = error;
    }

    public synchronized void failNextInspect(RuntimeException error) {
        this.inspectFailure = error;
    }

    /** Adds a running container that was not started through {@link #run}. */
    public synchronized void createRunning(String name, int pid) {
        containers.put(name, new FakeContainer("id-" + name, name, pid));
    }

    public synchronized void exit(String name, int status) {
        terminate(require(name), status, false);
    }

    public synchronized void oomKill(String name) {
        terminate(require(name), KILLED_STATUS, true);
    }

    public synchronized boolean contains(String name) {
        return containers.containsKey(name);
    }

    public synchronized boolean isRunning(String name) {
        return containers.containsKey(name) && containers.get(name).running;
    }

    public synchronized int pid(String name) {
        return require(name).pid;
    }

    public synchronized int count(String operation, String target) {
        return (int) calls.stream().filter(call -> call.equals(operation + " " + target)).count();
    }

    public synchronized int count(String operation) {
        return (int) calls.stream().filter(call -> call.startsWith(operation + " ")).count();
    }

    public synchronized List<RunRequest> runs() {
        return List.copyOf(runs);
    }

    @Override
    public synchronized CompletableFuture<Optional<Integer>> run(RunRequest request) {
        calls.add("run " + request.name());
        runs.add(request);
        if (containers.containsKey(request.name())) {
            return CompletableFuture.failedFuture(
                    new DockerRuntimeException("Conflict: name " + request.name() + " is in use"));
        }
        var container = new FakeContainer("id-" + request.name(), request.name(), nextPid++);
        containers.put(request.name(), container);
        var result = reportPidOnRun ? Optional.of(container.pid) : Optional.<Integer>empty();

        if (runGate != null) {
            var gate = runGate;
            runGate = null;
            return gate.enter().thenApply(ignored -> result);
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public synchronized CompletableFuture<Void> pull(Path directory, String image, boolean force) {
        calls.add("pull " + image);
        if (pullGate != null) {
            var gate = pullGate;
            pullGate = null;
            return gate.enter();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> stop(String name, Duration timeout, boolean remove) {
        calls.add("stop " + name);
        if (stopFailure != null) {
            var error = stopFailure;
            stopFailure = null;
            return CompletableFuture.failedFuture(error);
        }
        var container = containers.get(name);
        if (container == null) {
            return CompletableFuture.failedFuture(DockerRuntimeException.notFound(name, null));
        }
        if (container.running) {
            terminate(container, KILLED_STATUS, false);
        }
        if (remove) {
            containers.remove(name);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> rm(String name, boolean force) {
        calls.add("rm " + name);
        var container = containers.get(name);
        if (container == null) {
            return CompletableFuture.failedFuture(DockerRuntimeException.notFound(name, null));
        }
        if (container.running) {
            if (!force) {
                return CompletableFuture.failedFuture(
                        new DockerRuntimeException("Container " + name + " is running"));
            }
            terminate(container, KILLED_STATUS, false);
        }
        containers.remove(name);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<DockerContainer> inspect(String name) {
        calls.add("inspect " + name);
        if (inspectFailure != null) {
            var error = inspectFailure;
            inspectFailure = null;
            return CompletableFuture.failedFuture(error);
        }
        var container = containers.get(name);
        if (container == null) {
            return CompletableFuture.failedFuture(DockerRuntimeException.notFound(name, null));
        }
        return CompletableFuture.completedFuture(describe(container));
    }

    @Override
    public synchronized CompletableFuture<List<DockerContainer>> ps(boolean all, String namePrefix) {
        calls.add("ps " + namePrefix);
        if (psFailure != null) {
            var error = psFailure;
            psFailure = null;
            return CompletableFuture.failedFuture(error);
        }
        return CompletableFuture.completedFuture(containers.values().stream()
                .filter(container -> container.name.startsWith(namePrefix))
                .filter(container -> all || container.running)
                .map(container -> new DockerContainer(
                        container.id, container.name, null, container.running, null, false, null))
                .toList());
    }

    @Override
    public synchronized CompletableFuture<Void> logs(String name, Path directory) {
        calls.add("logs " + name);
        if (!containers.containsKey(name)) {
            return CompletableFuture.failedFuture(DockerRuntimeException.notFound(name, null));
        }
        try {
            Files.writeString(directory.resolve("stdout"), "output of " + name + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            Files.writeString(directory.resolve("stderr"), "",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException(e));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Integer> await(String name) {
        calls.add("await " + name);
        var container = containers.get(name);
        if (container == null) {
            return CompletableFuture.failedFuture(DockerRuntimeException.notFound(name, null));
        }
        return container.exit.copy();
    }

    private FakeContainer require(String name) {
        var container = containers.get(name);
        if (container == null) {
            throw new IllegalStateException("No container " + name);
        }
        return container;
    }

    private static void terminate(FakeContainer container, int status, boolean oomKilled) {
        container.running = false;
        container.exitCode = status;
        container.oomKilled = oomKilled;
        container.exit.complete(status);
    }

    private static DockerContainer describe(FakeContainer container) {
        return new DockerContainer(
                container.id,
                container.name,
                container.running ? container.pid : null,
                container.running,
                container.exitCode,
                container.oomKilled,
                null);
    }
}
