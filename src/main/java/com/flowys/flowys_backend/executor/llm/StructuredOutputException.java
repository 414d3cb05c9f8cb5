package com.flowys.flowys_backend.executor.llm;

/** The model never produced JSON satisfying the schema within the attempt budget. */
public class StructuredOutputException extends RuntimeException {

    private final boolean truncated;

    public StructuredOutputException(String message, boolean truncated) {
        super(message);
        this.truncated = truncated;
    }

    public boolean isTruncated() {
        return truncated;
    }
}
