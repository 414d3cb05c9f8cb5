package com.flowys.flowys_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeResult {
    private boolean success;
    private Map<String, Object> output;
    private String error;

    public static NodeResult ok(Map<String, Object> output) {
        return new NodeResult(true, output, null);
    }

    public static NodeResult failure(String error) {
        return new NodeResult(false, null, error);
    }

    /** Failure that still reports what happened, e.g. the status of a rejected webhook call. */
    public static NodeResult failure(String error, Map<String, Object> output) {
        return new NodeResult(false, output, error);
    }
}
