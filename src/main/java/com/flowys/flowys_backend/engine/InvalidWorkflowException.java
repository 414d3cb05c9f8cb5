package com.flowys.flowys_backend.engine;

/** Duplicate node ids, edges pointing at nodes that do not exist, nodes without a type. */
public class InvalidWorkflowException extends WorkflowStructureException {

    public InvalidWorkflowException(String message) {
        super(message);
    }
}
