package com.flowys.flowys_backend.engine;

/**
 * The graph itself cannot be executed. Raised before any node runs and never retried.
 */
public class WorkflowStructureException extends RuntimeException {

    public WorkflowStructureException(String message) {
        super(message);
    }
}
