package com.flowys.flowys_backend.model.execution;

import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single executor run. Never shared between runs.
 *
 * globalContext accumulates every completed node's output keys in execution order;
 * on a key collision the later node wins.
 */
@Getter
public class ExecutionContext {

    private final Map<String, Map<String, Object>> nodeOutputs = new HashMap<>();
    private final Map<String, Object> globalContext;
    private final List<ExecutionLog> logs = new ArrayList<>();

    public ExecutionContext(Map<String, Object> input) {
        this.globalContext = input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>();
    }

    public void recordOutput(String nodeId, Map<String, Object> output) {
        Map<String, Object> stored = output != null ? output : new LinkedHashMap<>();
        nodeOutputs.put(nodeId, stored);
        globalContext.putAll(stored);
    }

    public Map<String, Object> outputOf(String nodeId) {
        return nodeOutputs.get(nodeId);
    }

    public List<ExecutionLog> snapshotLogs() {
        return List.copyOf(logs);
    }
}
