package dev.containerizer.agent.checkpoint;

import dev.containerizer.agent.model.ContainerId;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

public class DynamoDbCheckpointStore implements CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbCheckpointStore.class);
    public static final String DEFAULT_TABLE_NAME = "Containerizer-Checkpoints";

    private final DynamoDbClient client;
    private final String tableName;

    public DynamoDbCheckpointStore(DynamoDbClient client, String tableName) {
        this.client = client;
        this.tableName = tableName;
    }

    @Override
    public void checkpoint(RunRecord run) {
        client.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(toItem(run))
                .build());
        logger.debug("Checkpointed run of container {}", run.containerId());
    }

    @Override
    public void remove(ContainerId containerId) {
        client.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(Map.of("ContainerId", AttributeValue.fromS(containerId.value())))
                .build());
        logger.debug("Removed checkpoint of container {}", containerId);
    }

    @Override
    public AgentState load(String agentId) {
        var request = ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("AgentId = :agent")
                .expressionAttributeValues(Map.of(":agent", AttributeValue.fromS(agentId)))
                .build();
        var runs = client.scanPaginator(request).items().stream()
                .map(DynamoDbCheckpointStore::fromItem)
                .toList();
        logger.info("Loaded {} checkpointed run(s) of agent {} from {}", runs.size(), agentId, tableName);
        return new AgentState(agentId, runs);
    }

    static Map<String, AttributeValue> toItem(RunRecord run) {
        var item = new HashMap<String, AttributeValue>();
        item.put("ContainerId", AttributeValue.fromS(run.containerId().value()));
        item.put("AgentId", AttributeValue.fromS(run.agentId()));
        item.put("FrameworkId", AttributeValue.fromS(run.frameworkId()));
        item.put("ExecutorId", AttributeValue.fromS(run.executorId()));
        item.put("UpdatedAt", AttributeValue.fromN(String.valueOf(Instant.now().getEpochSecond())));
        run.optionalPid().ifPresent(pid -> item.put("Pid", AttributeValue.fromN(String.valueOf(pid))));
        run.optionalDirectory().ifPresent(directory -> item.put("Directory", AttributeValue.fromS(directory)));
        return item;
    }

    static RunRecord fromItem(Map<String, AttributeValue> item) {
        var pid = item.get("Pid");
        var directory = item.get("Directory");
        return new RunRecord(
                ContainerId.of(item.get("ContainerId").s()),
                item.get("AgentId").s(),
                item.get("FrameworkId").s(),
                item.get("ExecutorId").s(),
                pid != null ? Integer.valueOf(pid.n()) : null,
                directory != null ? directory.s() : null);
    }
}
