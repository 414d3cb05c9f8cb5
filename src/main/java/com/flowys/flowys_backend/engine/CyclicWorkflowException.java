package com.flowys.flowys_backend.engine;

public class CyclicWorkflowException extends WorkflowStructureException {

    public CyclicWorkflowException() {
        super("Workflow contains a cycle - cannot execute");
    }
}
