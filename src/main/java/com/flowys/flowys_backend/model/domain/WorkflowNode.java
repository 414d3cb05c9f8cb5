package com.flowys.flowys_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a workflow graph.
 *
 * Accepts both the flat shape { id, type, label, config } and the editor shape
 * { id, type, position, data: { label, config } }. Position is UI-only and dropped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowNode {

    private String id;
    private NodeType type;
    private String label;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    public Map<String, Object> getConfig() {
        return config != null ? config : Map.of();
    }

    /** Label for logs and diagnostics; falls back to the id when the editor left it blank. */
    public String displayName() {
        return label != null && !label.isBlank() ? label : id;
    }

    @JsonProperty("data")
    @SuppressWarnings("unchecked")
    public void setData(Map<String, Object> data) {
        if (data == null) return;
        if (data.get("label") instanceof String l) {
            this.label = l;
        }
        if (data.get("config") instanceof Map<?, ?> c) {
            this.config = new LinkedHashMap<>((Map<String, Object>) c);
        }
    }
}
