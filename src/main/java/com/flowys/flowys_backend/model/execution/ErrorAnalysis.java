package com.flowys.flowys_backend.model.execution;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/** Human-readable diagnosis attached to a failed run. Advisory only. */
@Data
@Builder
public class ErrorAnalysis {
    private String summary;
    private String failedNode;
    private String failedNodeType;
    private List<String> possibleCauses;
    private List<String> suggestedFixes;
    // Labels of nodes downstream of the failure that never ran
    private List<String> affectedNodes;
}
