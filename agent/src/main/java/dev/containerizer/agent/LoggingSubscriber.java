package dev.containerizer.agent;

import dev.containerizer.agent.containerizer.ContainerEventListener;
import dev.containerizer.agent.containerizer.ContainerStatusChanged;
import dev.containerizer.agent.containerizer.ContainerTerminated;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.agent.model.ResourceStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSubscriber implements ContainerEventListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSubscriber.class);

    @Override
    public void onStatusChanged(ContainerStatusChanged event) {
        if (event.previous() == null) {
            logger.info("Container {} registered as {}", event.containerId(), event.current());
        } else {
            logger.info("Container {} is now {} (was {})", event.containerId(), event.current(), event.previous());
        }
    }

    @Override
    public void onTerminated(ContainerTerminated event) {
        var termination = event.termination();
        if (termination == null) {
            logger.warn("Container {} FAILED: {}", event.containerId(),
                    event.failure() != null ? event.failure().getMessage() : "unknown error");
            return;
        }
        switch (termination.reason()) {
            case EXITED -> logger.info("Container {} EXITED (status: {})",
                    event.containerId(), termination.status());
            case KILLED -> logger.info("Container {} KILLED ({})", event.containerId(), termination.message());
            case OOM -> logger.warn("Container {} OOM (status: {})", event.containerId(), termination.status());
            case DESTROYED -> logger.info("Container {} DESTROYED ({})", event.containerId(), termination.message());
        }
    }

    @Override
    public void onUsage(ContainerId containerId, ResourceStatistics statistics) {
        logger.debug("Container {} usage: user={}s system={}s rss={} bytes (limits: cpus={}, mem={} bytes)",
                containerId, statistics.cpusUserTimeSecs(), statistics.cpusSystemTimeSecs(),
                statistics.memRssBytes(), statistics.cpusLimit(), statistics.memLimitBytes());
    }
}
