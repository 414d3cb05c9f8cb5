package com.flowys.flowys_backend.engine;

import com.flowys.flowys_backend.model.domain.NodeType;

public class UnknownNodeTypeException extends WorkflowStructureException {

    public UnknownNodeTypeException(NodeType type) {
        super("Unknown node type: " + (type != null ? type.value() : "null"));
    }
}
