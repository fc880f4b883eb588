package dev.containerizer.agent.checkpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The runs an agent had checkpointed when it last stopped.
 */
public record AgentState(String agentId, List<RunRecord> runs) {

    public AgentState {
        runs = List.copyOf(runs);
    }

    public static AgentState empty(String agentId) {
        return new AgentState(agentId, List.of());
    }

    /**
     * Runs grouped by framework, then executor, in checkpoint order.
     */
    public Map<String, Map<String, List<RunRecord>>> frameworks() {
        var frameworks = new LinkedHashMap<String, Map<String, List<RunRecord>>>();
        for (var run : runs) {
            frameworks.computeIfAbsent(run.frameworkId(), id -> new LinkedHashMap<>())
                    .computeIfAbsent(run.executorId(), id -> new ArrayList<>())
                    .add(run);
        }
        return frameworks;
    }
}
