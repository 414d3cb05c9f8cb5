package com.flowys.flowys_backend.service;

import com.flowys.flowys_backend.executor.NodeHandler;
import com.flowys.flowys_backend.executor.NodeHandlerRegistry;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-node operations used by the editor: the type catalogue, config validation,
 * and running one node outside of a workflow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeService {

    static final String TEST_NODE_ID = "test";

    public record NodeTypeInfo(String type, int creditCost) {}

    private final NodeHandlerRegistry registry;

    public List<NodeTypeInfo> catalogue() {
        return Arrays.stream(NodeType.values())
                .filter(registry::isSupported)
                .map(t -> new NodeTypeInfo(t.value(), t.getCreditCost()))
                .toList();
    }

    public ConfigValidation validate(NodeType type, Map<String, Object> config) {
        return registry.get(type).validateConfig(config != null ? config : Map.of());
    }

    public NodeResult test(NodeType type, Map<String, Object> config, Map<String, Object> input) {
        NodeHandler handler = registry.get(type);
        NodeContext context = NodeContext.builder()
                .nodeId(TEST_NODE_ID)
                .inputs(input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>())
                .config(config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>())
                .globalContext(new LinkedHashMap<>())
                .build();

        log.info("[NodeTest] Running {} node in isolation", type.value());
        try {
            NodeResult result = handler.execute(context);
            return result != null ? result : NodeResult.failure("Handler returned no result");
        } catch (RuntimeException ex) {
            log.error("[NodeTest] {} node threw: {}", type.value(), ex.getMessage(), ex);
            return NodeResult.failure(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }
}
