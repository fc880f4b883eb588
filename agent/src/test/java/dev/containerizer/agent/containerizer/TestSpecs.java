package dev.containerizer.agent.containerizer;

import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.containerizer.agent.model.CommandSpec;
import dev.containerizer.agent.model.ContainerSpec;
import dev.containerizer.agent.model.ExecutorSpec;
import dev.containerizer.agent.model.Resources;
import dev.containerizer.agent.model.TaskSpec;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class TestSpecs {

    static final String AGENT_ID = "agent-1";
    static final String AGENT_ADDRESS = "agent@10.0.0.1:5051";

    private TestSpecs() {
    }

    static ExecutorSpec executor() {
        return new ExecutorSpec("framework-1", "executor-1", CommandSpec.shell("exec ./executor"), null,
                Resources.EMPTY);
    }

    static TaskSpec task(String image, String resources) {
        return task(ContainerSpec.image(image), resources);
    }

    static TaskSpec task(ContainerSpec container, String resources) {
        return new TaskSpec("task-1", "sleeper", CommandSpec.shell("sleep 1000"), container,
                Resources.parse(resources));
    }

    static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (Futures.unwrap(e) instanceof Exception cause) {
                throw cause;
            }
            throw e;
        } catch (TimeoutException e) {
            throw new AssertionError("Future did not complete in time", e);
        }
    }

    static <E extends Throwable> E awaitFailure(Class<E> type, CompletableFuture<?> future) {
        return assertThrows(type, () -> await(future));
    }
}
