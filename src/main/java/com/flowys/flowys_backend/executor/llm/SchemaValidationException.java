package com.flowys.flowys_backend.executor.llm;

public class SchemaValidationException extends Exception {

    private final boolean missingField;

    public SchemaValidationException(String message, boolean missingField) {
        super(message);
        this.missingField = missingField;
    }

    public boolean isMissingField() {
        return missingField;
    }
}
