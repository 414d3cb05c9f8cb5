package com.flowys.flowys_backend.model.dto;

import com.flowys.flowys_backend.model.domain.WorkflowEdge;
import com.flowys.flowys_backend.model.domain.WorkflowNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/workflows/execute[/async] and /api/workflows/estimate.
 * Null-safe: null lists and input are treated as empty.
 */
public record ExecuteWorkflowRequest(
    String workflowId,
    List<WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    Map<String, Object> input
) {
    public List<WorkflowNode> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<WorkflowEdge> edges() {
        return edges != null ? edges : Collections.emptyList();
    }

    public Map<String, Object> input() {
        return input != null ? input : Collections.emptyMap();
    }
}
