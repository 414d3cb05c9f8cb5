package com.flowys.flowys_backend.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort cleanup of model output before parsing: strips markdown fences, cuts the text down to
 * the outermost JSON value and closes structures left open by a truncated response.
 */
@Component
@RequiredArgsConstructor
public class JsonRepair {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern OPENING_FENCE = Pattern.compile("^```(?:json)?\\s*");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*$");

    private final ObjectMapper objectMapper;

    /** Repaired text, and whether closers had to be appended to make it parse. */
    public record Result(String json, boolean completed) {}

    public String stripCodeFences(String content) {
        Matcher fenced = FENCED.matcher(content);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        // An unterminated fence is what a cut-off response looks like
        return OPENING_FENCE.matcher(content.trim()).replaceFirst("");
    }

    public Result repair(String content) {
        String json = content.trim();

        int firstBrace = json.indexOf('{');
        int firstBracket = json.indexOf('[');
        int start = firstBrace == -1 ? firstBracket
                : firstBracket == -1 ? firstBrace
                : Math.min(firstBrace, firstBracket);
        if (start > 0) {
            json = json.substring(start);
        }

        if (json.startsWith("{")) {
            int lastBrace = json.lastIndexOf('}');
            if (lastBrace > 0) json = json.substring(0, lastBrace + 1);
        } else if (json.startsWith("[")) {
            int lastBracket = json.lastIndexOf(']');
            if (lastBracket > 0) json = json.substring(0, lastBracket + 1);
        }

        if (isValid(json)) {
            return new Result(json, false);
        }
        String completed = complete(json);
        return new Result(completed, !completed.equals(json));
    }

    /**
     * Scans for unclosed strings, objects and arrays (respecting escapes), then closes them
     * innermost first.
     */
    String complete(String json) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) continue;
            switch (c) {
                case '{' -> open.push('}');
                case '[' -> open.push(']');
                case '}', ']' -> {
                    if (!open.isEmpty() && open.peek() == c) open.pop();
                }
                default -> { }
            }
        }

        StringBuilder result = new StringBuilder(json);
        if (inString) {
            result.append('"');
        }
        String trimmed = TRAILING_COMMA.matcher(result).replaceFirst("");
        result = new StringBuilder(trimmed);
        while (!open.isEmpty()) {
            result.append(open.pop());
        }
        return result.toString();
    }

    private boolean isValid(String json) {
        try {
            objectMapper.readTree(json);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
