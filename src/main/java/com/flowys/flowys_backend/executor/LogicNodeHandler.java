package com.flowys.flowys_backend.executor;

import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Data shaping without code: filter, map, reduce, condition, transform, passthrough, sort, slice.
 *
 * Config shape:
 * {
 *   "operation":  "filter",
 *   "condition":  "item.score > 80",          // filter, condition
 *   "expression": "sum:amount",               // reduce, sort ("desc:score"), slice ("0:10")
 *   "mappings":   { "name": "item.fullName" } // map, transform
 * }
 *
 * Array operations read the first list found under a well-known key (data, items, results, ...),
 * else the first list-valued input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogicNodeHandler implements NodeHandler {

    static final List<String> OPERATIONS =
            List.of("filter", "map", "reduce", "condition", "transform", "passthrough", "sort", "slice");

    private static final List<String> COMMON_ARRAY_KEYS =
            List.of("data", "items", "results", "list", "records", "rows", "caregivers", "users", "entries");

    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");

    private final PathResolver resolver;
    private final ConditionEvaluator conditions;

    @Override
    public NodeType supportedType() {
        return NodeType.LOGIC;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        Map<String, Object> config = context.getConfig();
        String operation = ConfigValues.string(config, "operation", "passthrough");
        try {
            return switch (operation) {
                case "filter"    -> filter(context);
                case "map"       -> map(context);
                case "reduce"    -> reduce(context);
                case "condition" -> condition(context);
                case "transform" -> transform(context);
                case "sort"      -> sort(context);
                case "slice"     -> slice(context);
                default          -> passthrough(context);
            };
        } catch (RuntimeException e) {
            log.warn("[LogicNode] {} {} threw: {}", context.getNodeId(), operation, e.toString());
            return NodeResult.failure("Logic error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        Object operation = config.get("operation");
        if (operation != null && !OPERATIONS.contains(operation)) {
            errors.add("operation must be one of: " + String.join(", ", OPERATIONS));
        }
        return ConfigValidation.of(errors);
    }

    // ── Operations ───────────────────────────────────────────────────────────

    private NodeResult filter(NodeContext context) {
        List<Object> data = findArrayData(context.getInputs());
        if (data == null) {
            return NodeResult.failure("Filter needs a list of items to work with. The previous node didn't output any array data. "
                    + "Check that your API or data source is returning a list.");
        }
        String condition = ConfigValues.string(context.getConfig(), "condition");
        if (condition == null || condition.isBlank()) {
            return NodeResult.failure("Filter needs a condition to know what to keep. "
                    + "Click this node and add a condition like 'item.score > 80' in the settings.");
        }

        List<Object> kept = new ArrayList<>();
        for (Object item : data) {
            Map<String, Object> scope = new LinkedHashMap<>(context.getInputs());
            scope.put("item", item);
            if (conditions.evaluate(condition, scope)) {
                kept.add(item);
            }
        }
        return NodeResult.ok(list(kept));
    }

    private NodeResult map(NodeContext context) {
        List<Object> data = findArrayData(context.getInputs());
        if (data == null) {
            return NodeResult.failure("Map needs a list of items to transform. The previous node didn't output any array data. "
                    + "Check that your API or data source is returning a list.");
        }
        if (!(context.getConfig().get("mappings") instanceof Map<?, ?> mappings)) {
            return NodeResult.ok(list(data));
        }

        List<Object> mapped = new ArrayList<>(data.size());
        for (int index = 0; index < data.size(); index++) {
            Object item = data.get(index);
            Map<String, Object> itemScope = new LinkedHashMap<>();
            itemScope.put("item", item);
            itemScope.put("index", index);
            if (item instanceof Map<?, ?> fields) {
                fields.forEach((k, v) -> itemScope.put(String.valueOf(k), v));
            }

            Map<String, Object> row = new LinkedHashMap<>();
            mappings.forEach((key, rawPath) -> {
                String path = String.valueOf(rawPath);
                Object value = resolver.getNestedValue(itemScope, path);
                if (value == null && path.startsWith("item.")) {
                    value = resolver.getNestedValue(item, path.substring(5));
                }
                if (value == null && item instanceof Map<?, ?> fields) {
                    value = fields.get(path);
                }
                row.put(String.valueOf(key), value);
            });
            mapped.add(row);
        }
        return NodeResult.ok(list(mapped));
    }

    private NodeResult reduce(NodeContext context) {
        List<Object> data = findArrayData(context.getInputs());
        if (data == null) {
            return NodeResult.failure("Reduce needs a list of items to combine. The previous node didn't output any array data. "
                    + "Check that your API or data source is returning a list.");
        }
        String expression = ConfigValues.string(context.getConfig(), "expression");
        if (expression == null || expression.isBlank()) {
            return NodeResult.failure("Reduce needs an expression to know how to combine items. "
                    + "Click this node and add an expression like 'sum:score' or 'count' in the settings.");
        }

        String[] parts = expression.split(":");
        String op = parts[0];
        String field = parts.length > 1 && !parts[1].isEmpty() ? parts[1] : null;

        List<Object> values = new ArrayList<>(data.size());
        for (Object item : data) {
            values.add(field != null ? resolver.getNestedValue(item, field) : item);
        }
        List<Double> numbers = values.stream()
                .filter(v -> v instanceof Number)
                .map(v -> ((Number) v).doubleValue())
                .toList();

        Object result;
        switch (op) {
            case "sum" -> {
                double sum = 0;
                for (Object v : values) {
                    double n = LooseValues.toNumber(v);
                    sum += Double.isNaN(n) ? 0 : n;
                }
                result = LooseValues.normalize(sum);
            }
            case "count" -> result = values.size();
            case "avg" -> result = numbers.isEmpty()
                    ? 0L
                    : LooseValues.normalize(numbers.stream().mapToDouble(Double::doubleValue).average().orElse(0));
            case "min" -> result = numbers.isEmpty() ? null
                    : LooseValues.normalize(numbers.stream().mapToDouble(Double::doubleValue).min().orElse(0));
            case "max" -> result = numbers.isEmpty() ? null
                    : LooseValues.normalize(numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0));
            case "concat" -> {
                StringBuilder sb = new StringBuilder();
                values.forEach(v -> sb.append(LooseValues.asString(v)));
                result = sb.toString();
            }
            case "first" -> result = values.isEmpty() ? null : values.get(0);
            case "last" -> result = values.isEmpty() ? null : values.get(values.size() - 1);
            default -> {
                return NodeResult.failure("Unknown reduce operation: " + op);
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", result);
        return NodeResult.ok(output);
    }

    private NodeResult condition(NodeContext context) {
        String condition = ConfigValues.string(context.getConfig(), "condition");
        if (condition == null || condition.isBlank()) {
            return NodeResult.failure("Condition needs a rule to check. "
                    + "Click this node and add a condition like 'data.status == \"active\"' in the settings.");
        }
        boolean result = conditions.evaluate(condition, context.getInputs());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", result);
        output.put("branch", result ? "true" : "false");
        output.put("data", context.getInputs());
        return NodeResult.ok(output);
    }

    private NodeResult transform(NodeContext context) {
        if (!(context.getConfig().get("mappings") instanceof Map<?, ?> mappings)) {
            return NodeResult.ok(new LinkedHashMap<>(context.getInputs()));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        mappings.forEach((key, path) ->
                output.put(String.valueOf(key), resolver.getNestedValue(context.getInputs(), String.valueOf(path))));
        return NodeResult.ok(output);
    }

    private NodeResult passthrough(NodeContext context) {
        List<Object> data = findArrayData(context.getInputs());
        if (data == null) {
            return NodeResult.ok(new LinkedHashMap<>(context.getInputs()));
        }
        Map<String, Object> output = list(data);
        output.putAll(context.getInputs());
        return NodeResult.ok(output);
    }

    private NodeResult sort(NodeContext context) {
        List<Object> data = findArrayData(context.getInputs());
        if (data == null) {
            return NodeResult.failure("Sort needs a list of items to sort. The previous node didn't output any array data.");
        }
        String expression = ConfigValues.string(context.getConfig(), "expression", "asc");
        String[] parts = expression.split(":", -1);
        boolean descending = "desc".equals(parts[0]);
        String field = parts.length > 1 && !parts[1].isEmpty() ? parts[1] : null;

        Function<Object, Object> sortKey = item ->
                field != null && item instanceof Map ? resolver.getNestedValue(item, field) : item;
        // numeric order only when every key is a number; mixed lists sort as text throughout
        boolean numeric = data.stream().map(sortKey).allMatch(Number.class::isInstance);
        Comparator<Object> ascending = numeric
                ? Comparator.comparingDouble(item -> ((Number) sortKey.apply(item)).doubleValue())
                : Comparator.comparing(item -> sortText(sortKey.apply(item)), Collator.getInstance());

        List<Object> sorted = new ArrayList<>(data);
        sorted.sort(descending ? ascending.reversed() : ascending);
        return NodeResult.ok(list(sorted));
    }

    private static String sortText(Object value) {
        return LooseValues.isTruthy(value) ? LooseValues.asString(value) : "";
    }

    private NodeResult slice(NodeContext context) {
        List<Object> data = findArrayData(context.getInputs());
        if (data == null) {
            return NodeResult.failure("Slice needs a list of items. The previous node didn't output any array data.");
        }
        String expression = ConfigValues.string(context.getConfig(), "expression", "0:10");
        String[] parts = expression.split(":", -1);
        Integer parsedStart = parseLeadingInt(parts[0]);
        int size = data.size();
        int start = clampIndex(parsedStart != null ? parsedStart : 0, size);
        int end = size;
        if (parts.length > 1 && !parts[1].isEmpty()) {
            Integer parsedEnd = parseLeadingInt(parts[1]);
            end = clampIndex(parsedEnd != null ? parsedEnd : 0, size);
        }

        List<Object> sliced = start < end ? new ArrayList<>(data.subList(start, end)) : new ArrayList<>();
        return NodeResult.ok(list(sliced));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    List<Object> findArrayData(Map<String, Object> inputs) {
        for (String key : COMMON_ARRAY_KEYS) {
            if (inputs.get(key) instanceof List<?> list) {
                return (List<Object>) list;
            }
        }
        for (Object value : inputs.values()) {
            if (value instanceof List<?> list) {
                return (List<Object>) list;
            }
        }
        return null;
    }

    private static Map<String, Object> list(List<Object> data) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("data", data);
        output.put("count", data.size());
        return output;
    }

    // Negative indexes count from the end
    private static int clampIndex(int index, int size) {
        if (index < 0) return Math.max(size + index, 0);
        return Math.min(index, size);
    }

    private static Integer parseLeadingInt(String text) {
        Matcher m = LEADING_INT.matcher(text);
        if (!m.find()) return null;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
