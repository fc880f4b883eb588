package dev.containerizer.agent.checkpoint;

import com.google.protobuf.InvalidProtocolBufferException;
import dev.containerizer.agent.model.ContainerId;
import dev.containerizer.common.CheckpointedRun;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one {@link CheckpointedRun} file per container under the agent's meta directory. Writes go through a
 * temporary file and an atomic rename so a crash never leaves a torn record.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final String SUFFIX = ".run";

    private final Path root;

    public FileCheckpointStore(Path root) {
        this.root = root;
    }

    @Override
    public void checkpoint(RunRecord run) {
        var builder = CheckpointedRun.newBuilder()
                .setContainerId(run.containerId().value())
                .setAgentId(run.agentId())
                .setFrameworkId(run.frameworkId())
                .setExecutorId(run.executorId())
                .setDirectory(run.optionalDirectory().orElse(""));
        run.optionalPid().ifPresent(builder::setPid);

        try {
            Files.createDirectories(root);
            var target = file(run.containerId());
            var temp = Files.createTempFile(root, "checkpoint", ".tmp");
            Files.write(temp, builder.build().toByteArray());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Checkpointed run of container {} to {}", run.containerId(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to checkpoint container " + run.containerId(), e);
        }
    }

    @Override
    public void remove(ContainerId containerId) {
        try {
            Files.deleteIfExists(file(containerId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove checkpoint of container " + containerId, e);
        }
    }

    @Override
    public AgentState load(String agentId) {
        if (!Files.isDirectory(root)) {
            return AgentState.empty(agentId);
        }
        var runs = new ArrayList<RunRecord>();
        try (var files = Files.list(root)) {
            for (var file : files.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).sorted().toList()) {
                var run = parse(file);
                if (!run.getAgentId().equals(agentId)) {
                    logger.warn("Ignoring checkpoint {} of agent {}", file, run.getAgentId());
                    continue;
                }
                runs.add(new RunRecord(
                        ContainerId.of(run.getContainerId()),
                        run.getAgentId(),
                        run.getFrameworkId(),
                        run.getExecutorId(),
                        run.hasPid() ? run.getPid() : null,
                        run.getDirectory()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoints from " + root, e);
        }
        logger.info("Loaded {} checkpointed run(s) from {}", runs.size(), root);
        return new AgentState(agentId, runs);
    }

    private Path file(ContainerId containerId) {
        return root.resolve(URLEncoder.encode(containerId.value(), StandardCharsets.UTF_8) + SUFFIX);
    }

    private static CheckpointedRun parse(Path file) throws IOException {
        try {
            return CheckpointedRun.parseFrom(Files.readAllBytes(file));
        } catch (InvalidProtocolBufferException e) {
            throw new IOException("Corrupt checkpoint " + file, e);
        }
    }
}
