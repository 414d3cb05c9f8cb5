package com.flowys.flowys_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowExecutionResult {
    private boolean success;
    private Map<String, Object> output;
    private String error;
    private ErrorAnalysis errorAnalysis;
    private List<ExecutionLog> logs;
    private long duration;
    // Topological order the run used; empty when the graph was rejected
    private List<String> executionOrder;
}
