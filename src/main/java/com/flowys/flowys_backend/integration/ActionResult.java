package com.flowys.flowys_backend.integration;

import java.util.Map;

public record ActionResult(boolean success, Map<String, Object> output, String error) {

    public static ActionResult ok(Map<String, Object> output) {
        return new ActionResult(true, output, null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, null, error);
    }
}
