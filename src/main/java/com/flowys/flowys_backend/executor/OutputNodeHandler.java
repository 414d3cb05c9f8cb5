package com.flowys.flowys_backend.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Final formatting step. Its output becomes the workflow result.
 *
 * Config shape:
 * {
 *   "format":   "json" | "text" | "markdown",
 *   "fields":   ["summary", "stats.total"],   // json only
 *   "template": "Found {{count}} items"       // text and markdown
 * }
 */
@Component
@RequiredArgsConstructor
public class OutputNodeHandler implements NodeHandler {

    private static final List<String> FORMATS = List.of("json", "text", "markdown");

    private final PathResolver resolver;
    private final ObjectMapper objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.OUTPUT;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        Map<String, Object> config = context.getConfig();
        Map<String, Object> inputs = context.getInputs();
        String format = ConfigValues.string(config, "format", "json");

        if (inputs.isEmpty()) {
            Map<String, Object> empty = new LinkedHashMap<>();
            empty.put("result", null);
            empty.put("message", "No data to output");
            empty.put("format", format);
            return NodeResult.ok(empty);
        }

        try {
            return switch (format) {
                case "text"     -> formatted(text(config, inputs), "text");
                case "markdown" -> formatted(markdown(config, inputs), "markdown");
                default         -> formatted(json(config, inputs), "json");
            };
        } catch (JsonProcessingException | RuntimeException e) {
            return NodeResult.failure("Output error: " + e.getMessage());
        }
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        Object format = config.get("format");
        if (format != null && !FORMATS.contains(format)) {
            errors.add("format must be json, text, or markdown");
        }
        return ConfigValidation.of(errors);
    }

    private Object json(Map<String, Object> config, Map<String, Object> inputs) {
        List<?> fields = ConfigValues.list(config, "fields");
        if (fields == null || fields.isEmpty()) {
            return inputs;
        }
        Map<String, Object> filtered = new LinkedHashMap<>();
        for (Object field : fields) {
            String path = String.valueOf(field);
            Object value = resolver.getNestedValue(inputs, path);
            if (value != null) {
                filtered.put(path, value);
            }
        }
        return filtered;
    }

    private String text(Map<String, Object> config, Map<String, Object> inputs) {
        String template = ConfigValues.string(config, "template");
        if (template != null && !template.isEmpty()) {
            return resolver.interpolate(template, inputs);
        }
        return inputs.values().stream()
                .map(resolver::render)
                .collect(Collectors.joining("\n"));
    }

    private String markdown(Map<String, Object> config, Map<String, Object> inputs) throws JsonProcessingException {
        String template = ConfigValues.string(config, "template");
        if (template != null && !template.isEmpty()) {
            return resolver.interpolate(template, inputs);
        }
        StringBuilder md = new StringBuilder();
        for (Map.Entry<String, Object> entry : inputs.entrySet()) {
            md.append("## ").append(entry.getKey()).append("\n\n");
            Object value = entry.getValue();
            if (value == null || value instanceof Map || value instanceof List) {
                md.append("```json\n")
                  .append(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value))
                  .append("\n```\n\n");
            } else {
                md.append(LooseValues.asString(value)).append("\n\n");
            }
        }
        return md.toString().trim();
    }

    private static NodeResult formatted(Object result, String format) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", result);
        output.put("format", format);
        return NodeResult.ok(output);
    }
}
