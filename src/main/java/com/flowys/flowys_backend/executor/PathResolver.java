package com.flowys.flowys_backend.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dotted-path lookup and {{path}} interpolation over nested maps and lists.
 *
 * Path syntax is identifier(.identifier)*; list elements are reachable by numeric segment
 * ("items.0.name"). Missing keys and non-container values resolve to null, never throw.
 */
@Component
@RequiredArgsConstructor
public class PathResolver {

    // Matches {{user.profile.name}}
    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{(\\w+(?:\\.\\w+)*)}}");

    private final ObjectMapper objectMapper;

    /**
     * Replaces every {{path}} with the value found in scope. Maps and lists are rendered as JSON.
     * Unresolved paths stay in the text as the literal placeholder.
     */
    public String interpolate(String template, Map<String, Object> scope) {
        return replace(template, scope, true);
    }

    /** Like interpolate, but an unresolved path renders as an empty string. Used for request URLs. */
    public String interpolateOrBlank(String template, Map<String, Object> scope) {
        return replace(template, scope, false);
    }

    /**
     * Resolves a template structure (maps, lists, strings) leaf by leaf. A string that is exactly one
     * placeholder keeps the referenced value's type; other strings are interpolated.
     */
    @SuppressWarnings("unchecked")
    public Object resolveStructure(Object template, Map<String, Object> scope) {
        if (template instanceof String s) {
            String trimmed = s.trim();
            Matcher whole = REF_PATTERN.matcher(trimmed);
            if (whole.matches()) {
                Object value = getNestedValue(scope, whole.group(1));
                return value != null ? value : s;
            }
            return interpolate(s, scope);
        }
        if (template instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((k, v) -> resolved.put(k, resolveStructure(v, scope)));
            return resolved;
        }
        if (template instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(v -> resolved.add(resolveStructure(v, scope)));
            return resolved;
        }
        return template;
    }

    /** Walk a map/list tree by dot path. Returns null as soon as a step is missing. */
    public Object getNestedValue(Object root, String path) {
        if (root == null || path == null || path.isBlank()) return null;
        Object current = root;
        for (String seg : path.split("\\.")) {
            if (current == null || seg.isEmpty()) return null;
            if (current instanceof Map<?, ?> map) {
                current = map.get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return null;
                current = list.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }

    /** True when every step of the path exists, even if the value at the end is null. */
    public boolean hasPath(Object root, String path) {
        if (root == null || path == null || path.isBlank()) return false;
        Object current = root;
        for (String seg : path.split("\\.")) {
            if (seg.isEmpty()) return false;
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(seg)) return false;
                current = map.get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return false;
                current = list.get(idx);
            } else {
                return false;
            }
        }
        return true;
    }

    /** String form used inside templates: JSON for maps and lists, toString otherwise. */
    public String render(Object value) {
        if (value == null) return "";
        if (value instanceof Map || value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        if (value instanceof Double d && d == Math.floor(d) && !Double.isInfinite(d)) {
            return String.valueOf(d.longValue());
        }
        return value.toString();
    }

    private String replace(String template, Map<String, Object> scope, boolean keepUnresolved) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = getNestedValue(scope, matcher.group(1));
            String replacement;
            if (value == null) {
                replacement = keepUnresolved ? matcher.group(0) : "";
            } else {
                replacement = render(value);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
