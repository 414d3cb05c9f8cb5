package com.flowys.flowys_backend.executor;

import com.flowys.flowys_backend.engine.UnknownNodeTypeException;
import com.flowys.flowys_backend.model.domain.NodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class NodeHandlerRegistry {

    private final List<NodeHandler> handlers;
    private final Map<NodeType, NodeHandler> registry = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        handlers.forEach(handler -> {
            NodeHandler previous = registry.put(handler.supportedType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for node type " + handler.supportedType()
                        + ": " + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        });
    }

    public NodeHandler get(NodeType type) {
        NodeHandler handler = registry.get(type);
        if (handler == null) {
            throw new UnknownNodeTypeException(type);
        }
        return handler;
    }

    public boolean isSupported(NodeType type) {
        return type != null && registry.containsKey(type);
    }

    public Set<NodeType> supportedTypes() {
        return registry.keySet();
    }
}
