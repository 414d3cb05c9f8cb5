package com.flowys.flowys_backend.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of a workflow. Shapes the run input into declared, typed fields.
 *
 * Config shape:
 * {
 *   "fields": [
 *     { "name": "count", "type": "number", "required": true, "default": 10 },
 *     { "name": "query", "type": "string" }
 *   ]
 * }
 *
 * With no fields the inputs pass through untouched. A value that cannot be coerced is kept as-is
 * and logged; the node never fails on bad input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputNodeHandler implements NodeHandler {

    private final ObjectMapper objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.INPUT;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        List<?> fields = ConfigValues.list(context.getConfig(), "fields");
        if (fields == null || fields.isEmpty()) {
            return NodeResult.ok(new LinkedHashMap<>(context.getInputs()));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        for (Object raw : fields) {
            if (!(raw instanceof Map<?, ?> field) || !(field.get("name") instanceof String name)) {
                continue;
            }
            String type = field.get("type") instanceof String t ? t : "string";
            Object value = context.getInputs().get(name);

            if (value == null || "".equals(value)) {
                if (Boolean.TRUE.equals(field.get("required")) && !field.containsKey("default")) {
                    log.warn("[InputNode] {}: required field '{}' missing, using empty {}", context.getNodeId(), name, type);
                }
                output.put(name, field.containsKey("default") ? field.get("default") : zeroValue(type));
                continue;
            }

            try {
                output.put(name, coerce(value, type));
            } catch (IllegalArgumentException e) {
                log.warn("[InputNode] {}: could not coerce field '{}' to {}: {}", context.getNodeId(), name, type, e.getMessage());
                output.put(name, value);
            }
        }
        return NodeResult.ok(output);
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (config.containsKey("fields") && !(config.get("fields") instanceof List)) {
            errors.add("fields must be an array");
        }
        return ConfigValidation.of(errors);
    }

    private Object zeroValue(String type) {
        return switch (type) {
            case "number"  -> 0L;
            case "boolean" -> false;
            case "json"    -> new LinkedHashMap<String, Object>();
            default        -> "";
        };
    }

    private Object coerce(Object value, String type) {
        return switch (type) {
            case "number"  -> toNumber(value);
            case "boolean" -> toBoolean(value);
            case "json"    -> toJson(value);
            case "string"  -> value instanceof String ? value : renderString(value);
            default        -> value;
        };
    }

    private Object toNumber(Object value) {
        if (value instanceof Number) return value;
        if (value instanceof Boolean b) return b ? 1L : 0L;
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + value);
        }
        if (parsed.stripTrailingZeros().scale() <= 0 && parsed.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
            return parsed.longValue();
        }
        return parsed.doubleValue();
    }

    private Object toBoolean(Object value) {
        if (value instanceof Boolean) return value;
        if ("true".equals(value)) return true;
        if ("false".equals(value)) return false;
        throw new IllegalArgumentException("Invalid boolean: " + value);
    }

    private Object toJson(Object value) {
        if (value instanceof Map || value instanceof List) return value;
        try {
            return objectMapper.readValue(value.toString(), Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    private String renderString(Object value) {
        if (value instanceof Map || value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }
}
