package com.flowys.flowys_backend.executor;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the condition grammar used by filter and condition operations:
 *
 *   leftPath op right
 *
 * op is one of ===, !==, ==, !=, >=, <=, >, <, contains, startsWith, endsWith, exists, empty.
 * A right side quoted with ' or " is a literal; otherwise it is looked up as a path and falls back
 * to the literal text. An expression that does not match the grammar is the truthiness of the path.
 */
@Component
@RequiredArgsConstructor
public class ConditionEvaluator {

    private static final Pattern CONDITION = Pattern.compile(
            "^(\\S+)\\s+(===|!==|==|!=|>=|<=|>|<|contains|startsWith|endsWith|exists|empty)\\s*(.*)$");

    private final PathResolver resolver;

    public boolean evaluate(String condition, Map<String, Object> scope) {
        String trimmed = condition.trim();
        Matcher m = CONDITION.matcher(trimmed);
        if (!m.matches()) {
            return LooseValues.isTruthy(resolver.getNestedValue(scope, trimmed));
        }

        String leftPath = m.group(1);
        Object left = resolver.getNestedValue(scope, leftPath);
        String op = m.group(2);
        Object right = resolveRight(m.group(3).trim(), scope);
        // a missing field has no numeric value, so every ordering comparison on it is false
        double leftNumber = resolver.hasPath(scope, leftPath) ? LooseValues.toNumber(left) : Double.NaN;

        return switch (op) {
            case "=="          -> LooseValues.looseEquals(left, right);
            case "==="         -> LooseValues.strictEquals(left, right);
            case "!="          -> !LooseValues.looseEquals(left, right);
            case "!=="         -> !LooseValues.strictEquals(left, right);
            case ">"           -> leftNumber > LooseValues.toNumber(right);
            case ">="          -> leftNumber >= LooseValues.toNumber(right);
            case "<"           -> leftNumber < LooseValues.toNumber(right);
            case "<="          -> leftNumber <= LooseValues.toNumber(right);
            case "contains"    -> LooseValues.asString(left).contains(LooseValues.asString(right));
            case "startsWith"  -> LooseValues.asString(left).startsWith(LooseValues.asString(right));
            case "endsWith"    -> LooseValues.asString(left).endsWith(LooseValues.asString(right));
            case "exists"      -> left != null;
            case "empty"       -> LooseValues.isEmpty(left);
            default            -> false;
        };
    }

    private Object resolveRight(String raw, Map<String, Object> scope) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        Object resolved = resolver.getNestedValue(scope, raw);
        return resolved != null ? resolved : raw;
    }
}
