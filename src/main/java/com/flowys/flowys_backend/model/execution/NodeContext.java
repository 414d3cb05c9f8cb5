package com.flowys.flowys_backend.model.execution;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a handler sees for one invocation. The executor builds a fresh instance per node;
 * globalContext is the run-wide map shared by reference, handlers must treat it as read-only.
 */
@Data
@Builder
public class NodeContext {
    private String nodeId;

    @Builder.Default
    private Map<String, Object> inputs = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> globalContext = new LinkedHashMap<>();

    /** inputs overlaid by globalContext; the scope templates resolve against. */
    public Map<String, Object> templateScope() {
        Map<String, Object> scope = new LinkedHashMap<>(inputs);
        scope.putAll(globalContext);
        return scope;
    }
}
