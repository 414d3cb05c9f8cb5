package com.flowys.flowys_backend.model.execution;

import java.util.List;

/** Outcome of NodeHandler.validateConfig. */
public record ConfigValidation(boolean valid, List<String> errors) {

    public static ConfigValidation of(List<String> errors) {
        return errors.isEmpty()
                ? new ConfigValidation(true, List.of())
                : new ConfigValidation(false, List.copyOf(errors));
    }
}
