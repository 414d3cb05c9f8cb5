package com.flowys.flowys_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flowys.flowys_backend.model.execution.ErrorAnalysis;
import com.flowys.flowys_backend.model.execution.ExecutionLog;
import com.flowys.flowys_backend.model.execution.WorkflowExecutionResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Execution record returned by the run endpoints and carried by the workflow.completed event. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowRunResponse(
    String id,
    String workflowId,
    String status,
    Map<String, Object> input,
    Map<String, Object> output,
    List<ExecutionLog> logs,
    String error,
    ErrorAnalysis errorAnalysis,
    List<String> executionOrder,
    Instant startedAt,
    Instant completedAt,
    long duration,
    CreditUsage credits
) {
    public static WorkflowRunResponse of(String executionId,
                                         String workflowId,
                                         Map<String, Object> input,
                                         WorkflowExecutionResult result,
                                         Instant startedAt,
                                         CreditUsage credits) {
        return new WorkflowRunResponse(
                executionId,
                workflowId,
                result.isSuccess() ? "completed" : "failed",
                input,
                result.getOutput(),
                result.getLogs(),
                result.getError(),
                result.getErrorAnalysis(),
                result.getExecutionOrder(),
                startedAt,
                Instant.now(),
                result.getDuration(),
                credits);
    }
}
