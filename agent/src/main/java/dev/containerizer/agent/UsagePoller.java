package dev.containerizer.agent;

import dev.containerizer.agent.containerizer.ContainerNotFoundException;
import dev.containerizer.agent.containerizer.Containerizer;
import dev.containerizer.agent.containerizer.Futures;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the usage of every live container at a fixed rate. Samples reach the containerizer's listeners.
 */
public class UsagePoller implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(UsagePoller.class);

    private final Containerizer containerizer;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        var thread = new Thread(runnable, "usage-poller");
        thread.setDaemon(true);
        return thread;
    });

    public UsagePoller(Containerizer containerizer, Duration interval) {
        this.containerizer = containerizer;
        this.interval = interval;
    }

    public void start() {
        if (interval.isZero() || interval.isNegative()) {
            logger.info("Usage polling disabled");
            return;
        }
        logger.info("Usage polling started, interval={}", interval);
        scheduler.scheduleAtFixedRate(this::poll, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    void poll() {
        try {
            var ids = containerizer.containers().join();
            logger.debug("Sampling usage of {} container(s)", ids.size());
            for (var id : ids) {
                containerizer.usage(id).whenComplete((statistics, error) -> {
                    if (error == null) {
                        return;
                    }
                    var cause = Futures.unwrap(error);
                    if (cause instanceof ContainerNotFoundException) {
                        logger.debug("Container {} is already gone", id);
                    } else {
                        logger.warn("Failed to sample usage of container {}: {}", id, cause.getMessage());
                    }
                });
            }
        } catch (Exception e) {
            logger.error("Usage polling cycle failed", e);
        }
    }
}
