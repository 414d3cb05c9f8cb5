package com.flowys.flowys_backend.executor.llm;

import com.flowys.flowys_backend.model.llm.OutputSchema;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Checks parsed model output against an OutputSchema: the value must be an object, every required
 * field present, and declared string/number/boolean/array properties of the right kind.
 */
@Component
public class SchemaValidator {

    public Map<String, Object> validate(Object data, OutputSchema schema) throws SchemaValidationException {
        if (!(data instanceof Map<?, ?> map)) {
            throw new SchemaValidationException("Response must be an object", false);
        }
        for (String field : schema.required()) {
            if (!map.containsKey(field)) {
                throw new SchemaValidationException("Missing required field: " + field, true);
            }
        }
        for (Map.Entry<String, Map<String, Object>> prop : schema.properties().entrySet()) {
            String name = prop.getKey();
            if (!map.containsKey(name)) continue;
            Object value = map.get(name);
            Object type = prop.getValue().get("type");
            if (type instanceof String expected && !matches(value, expected)) {
                throw new SchemaValidationException("Field " + name + " must be a " + expected, false);
            }
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) map;
        return result;
    }

    private boolean matches(Object value, String type) {
        return switch (type) {
            case "string"  -> value instanceof String;
            case "number"  -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "array"   -> value instanceof List;
            default        -> true;
        };
    }
}
