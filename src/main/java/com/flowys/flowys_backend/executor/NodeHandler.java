package com.flowys.flowys_backend.executor;

import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;

import java.util.Map;

/**
 * Execution logic for one node type. Implementations are Spring beans picked up by
 * {@link NodeHandlerRegistry}; adding a node type means adding one of these.
 *
 * execute reports expected failures through {@link NodeResult#failure(String)} rather than throwing.
 * It may block on network I/O and should give up promptly when the calling thread is interrupted.
 */
public interface NodeHandler {

    NodeType supportedType();

    NodeResult execute(NodeContext context);

    ConfigValidation validateConfig(Map<String, Object> config);
}
