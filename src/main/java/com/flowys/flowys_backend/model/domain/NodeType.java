package com.flowys.flowys_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Step types a workflow graph may contain. Serialized in lowercase ("input", "api", ...)
 * to match what the editor stores.
 */
public enum NodeType {
    INPUT(0),
    API(1),
    AI(10),
    LOGIC(1),
    OUTPUT(0),
    WEBHOOK(1),
    INTEGRATION(1);

    // Credits charged per node of this type
    private final int creditCost;

    NodeType(int creditCost) {
        this.creditCost = creditCost;
    }

    public int getCreditCost() { return creditCost; }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node type is required");
        }
        try {
            return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node type: " + value);
        }
    }
}
