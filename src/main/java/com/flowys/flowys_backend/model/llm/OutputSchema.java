package com.flowys.flowys_backend.model.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-schema subset an AI node can demand from the model:
 *
 * { "type": "object",
 *   "properties": { "title": { "type": "string" }, "tags": { "type": "array" } },
 *   "required": ["title"] }
 *
 * Kept as the raw map so it can be forwarded to providers unchanged.
 */
public class OutputSchema {

    private final Map<String, Object> definition;

    private OutputSchema(Map<String, Object> definition) {
        this.definition = definition;
    }

    public static OutputSchema of(Map<String, Object> definition) {
        return new OutputSchema(new LinkedHashMap<>(definition));
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(definition);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Map<String, Object>> properties() {
        Object props = definition.get("properties");
        if (!(props instanceof Map<?, ?> map)) return Map.of();
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v instanceof Map<?, ?> prop) {
                result.put(String.valueOf(k), (Map<String, Object>) prop);
            }
        });
        return result;
    }

    public List<String> required() {
        Object req = definition.get("required");
        if (!(req instanceof List<?> list)) return List.of();
        return list.stream().map(String::valueOf).toList();
    }
}
